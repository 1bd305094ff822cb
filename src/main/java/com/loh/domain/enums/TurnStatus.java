package com.loh.domain.enums;

/**
 * Status of a game turn. Transitions: OPEN → RESOLVING → CLOSED, never backwards.
 * A game has at most one OPEN turn at a time.
 */
public enum TurnStatus {
    OPEN,
    RESOLVING,
    CLOSED
}
