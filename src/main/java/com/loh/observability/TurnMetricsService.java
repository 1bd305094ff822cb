package com.loh.observability;

import com.loh.domain.enums.ResolutionPhase;
import com.loh.event.TurnAdvancedEvent;
import com.loh.event.TurnResolvedEvent;
import com.loh.resolution.ResolutionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the turn engine's Micrometer metrics:
 * <ul>
 *   <li><b>turns.resolved.count</b> (counter): turns whose final orders were applied</li>
 *   <li><b>turns.advanced.count</b> (counter): turns closed with a successor opened</li>
 *   <li><b>orders.failed.count</b> (counter): final orders that failed during resolution</li>
 *   <li><b>ships.built.count</b> (counter): ships created by the build phase</li>
 *   <li><b>turn.resolution.latency</b> (timer): wall time of one resolution run</li>
 * </ul>
 */
@Service
public class TurnMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TurnMetricsService.class);

    private final Counter turnsResolvedCounter;
    private final Counter turnsAdvancedCounter;
    private final Counter ordersFailedCounter;
    private final Counter shipsBuiltCounter;
    private final Timer resolutionLatencyTimer;

    public TurnMetricsService(MeterRegistry meterRegistry) {
        this.turnsResolvedCounter = Counter.builder("turns.resolved.count")
                .description("Turns whose final orders were resolved")
                .register(meterRegistry);

        this.turnsAdvancedCounter = Counter.builder("turns.advanced.count")
                .description("Turns closed and replaced by a new open turn")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("orders.failed.count")
                .description("Final orders that failed during resolution")
                .register(meterRegistry);

        this.shipsBuiltCounter = Counter.builder("ships.built.count")
                .description("Ships created by build orders")
                .register(meterRegistry);

        this.resolutionLatencyTimer = Timer.builder("turn.resolution.latency")
                .description("Time spent resolving one turn")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    /**
     * Runs at @Order(20), after the listeners that act on the resolved turn.
     */
    @EventListener
    @Order(20)
    public void onTurnResolved(TurnResolvedEvent event) {
        ResolutionResult result = event.getResult();
        turnsResolvedCounter.increment();
        if (result.getDuration() != null) {
            resolutionLatencyTimer.record(result.getDuration());
        }
        int built = result.getPhase(ResolutionPhase.BUILD).getUnitsAffected();
        if (built > 0) {
            shipsBuiltCounter.increment(built);
        }
        if (result.hasFailures()) {
            ordersFailedCounter.increment(result.getFailures().size());
            log.warn(
                    "Turn {} of game {} resolved with {} failed orders",
                    result.getTurnNumber(),
                    event.getGameId(),
                    result.getFailures().size());
        }
    }

    @EventListener
    @Order(20)
    public void onTurnAdvanced(TurnAdvancedEvent event) {
        turnsAdvancedCounter.increment();
    }
}
