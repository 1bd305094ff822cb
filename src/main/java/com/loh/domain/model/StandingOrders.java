package com.loh.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-star template that is turned into concrete orders at the start of every turn.
 * Stored under the {@code standingOrders} key of star_state.details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandingOrders {

    private Industry industry;
    private Move move;

    /**
     * Percent split of the star's available points (JSON keys {@code expand},
     * {@code research}, {@code build}). Each value is 0..100 and the three together
     * may not exceed 100.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Industry {
        @JsonProperty("expand")
        private Double expandPercent;

        @JsonProperty("research")
        private Double researchPercent;

        @JsonProperty("build")
        private Double buildPercent;

        public double total() {
            return valueOf(expandPercent) + valueOf(researchPercent) + valueOf(buildPercent);
        }

        static double valueOf(Double percent) {
            return percent != null ? percent : 0;
        }
    }

    /**
     * Sends every ship at the star to {@code destinationStarId} each turn. The template names no
     * ships: the move is materialized with an empty selection, which resolution reads as all
     * of the owner's ships at the source at that time.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Move {
        private String destinationStarId;
    }
}
