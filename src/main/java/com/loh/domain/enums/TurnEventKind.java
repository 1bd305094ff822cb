package com.loh.domain.enums;

import lombok.Getter;

/**
 * Kinds of entries written to the per-turn event log.
 */
@Getter
public enum TurnEventKind {
    GAME_STARTED("game_started"),
    SHIPS_BUILT("ships_built"),
    INDUSTRY_EXPANDED("industry_expanded"),
    SHIPS_MOVED("ships_moved"),
    ORDER_FAILED("order_failed"),
    TURN_RESOLVED("turn_resolved");

    private final String code;

    TurnEventKind(String code) {
        this.code = code;
    }
}
