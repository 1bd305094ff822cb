package com.loh.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Economic state of a star, stored as JSON in star_state.economy.
 * {@code available} is the pool that build, expansion and research draw from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Economy {

    private double available;
    private double industry;
    private double technology;
    private double resource;

    /** Cost of one ship, which equals technology. Technology at or below zero counts as 1. */
    public double shipCost() {
        return technology > 0 ? technology : 1;
    }
}
