package com.loh.resolution;

import com.loh.domain.enums.ResolutionPhase;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of resolving one turn: per-phase counters and the orders that failed.
 */
@Getter
@Builder
public class ResolutionResult {

    private final String gameId;
    private final String turnId;
    private final int turnNumber;
    private final List<PhaseSummary> phases;
    private final List<OrderFailure> failures;
    private final Duration duration;

    public PhaseSummary getPhase(ResolutionPhase phase) {
        return phases.stream()
                .filter(summary -> summary.getPhase() == phase)
                .findFirst()
                .orElseGet(() -> new PhaseSummary(phase));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
