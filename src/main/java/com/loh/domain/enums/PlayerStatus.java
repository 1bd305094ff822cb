package com.loh.domain.enums;

/**
 * Turn-readiness status of a player within a game.
 * ACTIVE = still composing orders for the open turn. WAITING = has ended the turn.
 * SUSPENDED and EJECTED players do not take part in readiness checks.
 */
public enum PlayerStatus {
    ACTIVE,
    WAITING,
    SUSPENDED,
    EJECTED;

    /** True for the statuses counted when deciding whether every player has ended the turn. */
    public boolean isParticipating() {
        return this == ACTIVE || this == WAITING;
    }
}
