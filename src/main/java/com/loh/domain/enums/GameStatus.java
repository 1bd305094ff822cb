package com.loh.domain.enums;

/**
 * Lifecycle status of a game. Only RUNNING games have turns resolved by the idle monitor.
 */
public enum GameStatus {
    LOBBY,
    RUNNING,
    PAUSED,
    FROZEN,
    FINISHED
}
