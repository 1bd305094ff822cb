package com.loh.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.loh.domain.enums.OrderType;
import com.loh.domain.enums.ResolutionPhase;
import com.loh.domain.model.Turn;
import com.loh.event.TurnAdvancedEvent;
import com.loh.event.TurnResolvedEvent;
import com.loh.observability.TurnMetricsService;
import com.loh.resolution.OrderFailure;
import com.loh.resolution.PhaseSummary;
import com.loh.resolution.ResolutionResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TurnMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private TurnMetricsService turnMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        turnMetricsService = new TurnMetricsService(meterRegistry);
    }

    @Test
    void registersAllMeters() {
        assertThat(meterRegistry.find("turns.resolved.count").counter()).isNotNull();
        assertThat(meterRegistry.find("turns.advanced.count").counter()).isNotNull();
        assertThat(meterRegistry.find("orders.failed.count").counter()).isNotNull();
        assertThat(meterRegistry.find("ships.built.count").counter()).isNotNull();
        assertThat(meterRegistry.find("turn.resolution.latency").timer()).isNotNull();
    }

    @Test
    void resolvedTurnRecordsCountLatencyAndShips() {
        PhaseSummary build = mock(PhaseSummary.class);
        when(build.getPhase()).thenReturn(ResolutionPhase.BUILD);
        when(build.getUnitsAffected()).thenReturn(7);
        ResolutionResult result = result(List.of(build), List.of());

        turnMetricsService.onTurnResolved(new TurnResolvedEvent(this, "game-1", result));

        assertThat(meterRegistry.get("turns.resolved.count").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("ships.built.count").counter().count()).isEqualTo(7.0);
        assertThat(meterRegistry.get("orders.failed.count").counter().count()).isZero();
        assertThat(meterRegistry.get("turn.resolution.latency").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.get("turn.resolution.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(40.0);
    }

    @Test
    void failuresAreCounted() {
        OrderFailure failure = OrderFailure.builder()
                .orderId("o1")
                .playerId("p1")
                .orderType(OrderType.MOVE)
                .phase(ResolutionPhase.MOVEMENT)
                .message("not adjacent")
                .build();

        turnMetricsService.onTurnResolved(
                new TurnResolvedEvent(this, "game-1", result(List.of(), List.of(failure, failure))));

        assertThat(meterRegistry.get("orders.failed.count").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("ships.built.count").counter().count()).isZero();
    }

    @Test
    void advancedTurnsAreCounted() {
        Turn previous = Turn.builder().id("turn-1").number(1).build();
        Turn next = Turn.builder().id("turn-2").number(2).build();

        turnMetricsService.onTurnAdvanced(new TurnAdvancedEvent(this, "game-1", previous, next));
        turnMetricsService.onTurnAdvanced(new TurnAdvancedEvent(this, "game-1", next, next));

        assertThat(meterRegistry.get("turns.advanced.count").counter().count()).isEqualTo(2.0);
    }

    private static ResolutionResult result(List<PhaseSummary> phases, List<OrderFailure> failures) {
        return ResolutionResult.builder()
                .gameId("game-1")
                .turnId("turn-1")
                .turnNumber(1)
                .phases(phases)
                .failures(failures)
                .duration(Duration.ofMillis(40))
                .build();
    }
}
