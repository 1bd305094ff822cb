package com.loh.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Mutable per-game state of a star: ownership, economy and a free-form details bag.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StarState {

    public static final String DETAILS_STANDING_ORDERS = "standingOrders";

    private String id;
    private String gameId;
    private String starId;
    private String ownerPlayerId;
    private Economy economy;
    private Map<String, Object> damage;
    private Map<String, Object> details;
    private LocalDateTime updatedAt;
}
