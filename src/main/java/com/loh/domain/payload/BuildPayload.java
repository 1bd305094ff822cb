package com.loh.domain.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for BUILD and AUTO_BUILD orders.
 *
 * <p>{@code ships} is an explicit ship count. The build, expand and research values are
 * point allocations out of the star's available economy (JSON keys {@code build},
 * {@code expand}, {@code research}). Research points are recorded but not applied
 * during resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class BuildPayload implements OrderPayload {

    private String sourceStarId;
    private Integer ships;

    @JsonProperty("expand")
    private Double expandPoints;

    @JsonProperty("research")
    private Double researchPoints;

    @JsonProperty("build")
    private Double buildPoints;

    private boolean fromStandingOrder;

    /**
     * Number of ships this order asks for at the given unit cost: the explicit
     * {@code ships} count if present, else {@code floor(build / shipCost)} if build
     * points were allocated, else one ship unless the order only allocates expand or
     * research points.
     */
    public int requestedShips(double shipCost) {
        if (ships != null) {
            return Math.max(0, ships);
        }
        if (buildPoints != null) {
            return Math.max(0, (int) Math.floor(buildPoints / shipCost));
        }
        return expandPoints == null && researchPoints == null ? 1 : 0;
    }

    /** True when the order carries an expansion allocation that the expansion phase should apply. */
    public boolean hasExpansion() {
        return expandPoints != null && expandPoints > 0;
    }
}
