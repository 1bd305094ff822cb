package com.loh.resolution;

import com.loh.domain.enums.ResolutionPhase;
import lombok.Getter;

/**
 * Counters for one resolution phase.
 */
@Getter
public class PhaseSummary {

    private final ResolutionPhase phase;
    private int ordersConsidered;
    private int ordersApplied;
    private int ordersSkipped;
    private int ordersFailed;
    private int unitsAffected;
    private double pointsSpent;

    public PhaseSummary(ResolutionPhase phase) {
        this.phase = phase;
    }

    void record(OrderOutcome outcome) {
        ordersConsidered++;
        if (outcome.applied()) {
            ordersApplied++;
            unitsAffected += outcome.units();
            pointsSpent += outcome.pointsSpent();
        } else {
            ordersSkipped++;
        }
    }

    void recordFailure() {
        ordersConsidered++;
        ordersFailed++;
    }
}
