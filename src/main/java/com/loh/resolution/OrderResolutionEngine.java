package com.loh.resolution;

import com.loh.domain.enums.ResolutionPhase;
import com.loh.domain.enums.ShipStatus;
import com.loh.domain.enums.TurnEventKind;
import com.loh.domain.model.Economy;
import com.loh.domain.model.GalaxyTopology;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.model.Turn;
import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import com.loh.entity.ShipEntity;
import com.loh.entity.StarStateEntity;
import com.loh.eventlog.TurnEventService;
import com.loh.exception.InvalidStateException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.galaxy.GalaxyTopologyProvider;
import com.loh.mapper.JsonHelper;
import com.loh.order.OrderService;
import com.loh.repository.jpa.ShipJpaRepository;
import com.loh.repository.jpa.StarStateJpaRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Applies a turn's final orders to the world.
 *
 * <p>Phases run in a fixed order: build, then expansion, then movement. Within a phase orders
 * are applied in the order the store returns them (by player, then clientOrderId). Every order
 * runs in its own transaction and re-reads its source star, so a later order sees the economy
 * left by earlier ones and a failing order rolls back alone.
 *
 * <p>Build: a ship costs the star's technology (at least 1). The number built is
 * {@code min(requested, floor(available / cost))}; each new ship gets hp and power equal to
 * its cost. Expansion: spends {@code min(expand, available)} and raises industry by
 * {@code sqrt(1 + spend) - 1}, rounded to two decimals. Movement: relocates the player's
 * active ships at the source to an adjacent star; the topology is read per order, so an
 * unavailable topology fails the move orders alone.
 */
@Service
public class OrderResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(OrderResolutionEngine.class);

    private final OrderService orderService;
    private final StarStateJpaRepository starStateJpaRepository;
    private final ShipJpaRepository shipJpaRepository;
    private final GalaxyTopologyProvider galaxyTopologyProvider;
    private final TurnEventService turnEventService;
    private final TransactionOperations transactionOperations;

    public OrderResolutionEngine(
            OrderService orderService,
            StarStateJpaRepository starStateJpaRepository,
            ShipJpaRepository shipJpaRepository,
            GalaxyTopologyProvider galaxyTopologyProvider,
            TurnEventService turnEventService,
            TransactionOperations transactionOperations) {
        this.orderService = orderService;
        this.starStateJpaRepository = starStateJpaRepository;
        this.shipJpaRepository = shipJpaRepository;
        this.galaxyTopologyProvider = galaxyTopologyProvider;
        this.turnEventService = turnEventService;
        this.transactionOperations = transactionOperations;
    }

    /**
     * Resolves every final order of the turn. Per-order errors are collected in the result
     * rather than thrown.
     */
    public ResolutionResult resolve(String gameId, Turn turn) {
        long startNanos = System.nanoTime();
        List<OrderSubmission> finals = orderService.listFinalOrders(gameId, turn.getId(), null);
        log.info("Resolving turn {} of game {}: {} final orders", turn.getNumber(), gameId, finals.size());

        List<PhaseSummary> phases = new ArrayList<>();
        List<OrderFailure> failures = new ArrayList<>();
        for (ResolutionPhase phase : ResolutionPhase.values()) {
            phases.add(runPhase(gameId, turn, phase, finals, failures));
        }

        ResolutionResult result = ResolutionResult.builder()
                .gameId(gameId)
                .turnId(turn.getId())
                .turnNumber(turn.getNumber())
                .phases(phases)
                .failures(failures)
                .duration(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();
        appendSummary(gameId, turn, result);

        log.info(
                "Turn {} of game {} resolved in {} ms: built={}, expanded={}, moved={}, failed={}",
                turn.getNumber(),
                gameId,
                result.getDuration().toMillis(),
                result.getPhase(ResolutionPhase.BUILD).getUnitsAffected(),
                result.getPhase(ResolutionPhase.EXPANSION).getUnitsAffected(),
                result.getPhase(ResolutionPhase.MOVEMENT).getUnitsAffected(),
                failures.size());
        return result;
    }

    private PhaseSummary runPhase(
            String gameId,
            Turn turn,
            ResolutionPhase phase,
            List<OrderSubmission> finals,
            List<OrderFailure> failures) {
        PhaseSummary summary = new PhaseSummary(phase);
        for (OrderSubmission order : finals) {
            if (!participates(phase, order)) {
                continue;
            }
            try {
                OrderOutcome outcome = transactionOperations.execute(status -> apply(phase, gameId, turn, order));
                summary.record(outcome != null ? outcome : OrderOutcome.skipped());
            } catch (RuntimeException e) {
                summary.recordFailure();
                OrderFailure failure = OrderFailure.builder()
                        .orderId(order.getId())
                        .clientOrderId(order.getClientOrderId())
                        .playerId(order.getPlayerId())
                        .sourceStarId(order.getSourceStarId())
                        .orderType(order.getOrderType())
                        .phase(phase)
                        .message(e.getMessage())
                        .build();
                failures.add(failure);
                log.error(
                        "{} phase: order {} of player {} failed in game {} turn {}: {}",
                        phase,
                        order.getClientOrderId(),
                        order.getPlayerId(),
                        gameId,
                        turn.getNumber(),
                        e.getMessage(),
                        e);
                recordFailureEvent(gameId, turn, failure);
            }
        }
        return summary;
    }

    /**
     * Whether an order takes part in a phase. Build-type orders feed the build phase, and the
     * expansion phase when they carry expand points; move-type orders feed movement.
     */
    public static boolean participates(ResolutionPhase phase, OrderSubmission order) {
        return switch (order.getOrderType()) {
            case BUILD, AUTO_BUILD -> phase == ResolutionPhase.BUILD
                    || (phase == ResolutionPhase.EXPANSION && ((BuildPayload) order.getPayload()).hasExpansion());
            case MOVE, AUTO_MOVE -> phase == ResolutionPhase.MOVEMENT;
        };
    }

    private OrderOutcome apply(ResolutionPhase phase, String gameId, Turn turn, OrderSubmission order) {
        return switch (phase) {
            case BUILD -> applyBuild(gameId, turn, order, (BuildPayload) order.getPayload());
            case EXPANSION -> applyExpansion(gameId, turn, order, (BuildPayload) order.getPayload());
            case MOVEMENT -> applyMovement(
                    gameId, turn, order, (MovePayload) order.getPayload(), galaxyTopologyProvider.getTopology(gameId));
        };
    }

    OrderOutcome applyBuild(String gameId, Turn turn, OrderSubmission order, BuildPayload payload) {
        StarStateEntity star = requireOwnedStar(gameId, order);
        Economy economy = readEconomy(star);

        double shipCost = economy.shipCost();
        int requested = payload.requestedShips(shipCost);
        int affordable = (int) Math.floor(economy.getAvailable() / shipCost);
        int toBuild = Math.min(requested, affordable);
        if (toBuild <= 0) {
            log.debug(
                    "Star {} cannot build: requested={}, available={}, cost={}",
                    star.getStarId(),
                    requested,
                    economy.getAvailable(),
                    shipCost);
            return OrderOutcome.skipped();
        }

        LocalDateTime now = LocalDateTime.now();
        List<ShipEntity> ships = new ArrayList<>();
        for (int i = 0; i < toBuild; i++) {
            ships.add(ShipEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gameId(gameId)
                    .ownerPlayerId(star.getOwnerPlayerId())
                    .locationStarId(star.getStarId())
                    .hp(shipCost)
                    .power(shipCost)
                    .status(ShipStatus.ACTIVE)
                    .details(JsonHelper.toJson(Map.of("builtTurn", turn.getNumber())))
                    .createdAt(now)
                    .build());
        }
        shipJpaRepository.saveAll(ships);

        double spent = toBuild * shipCost;
        economy.setAvailable(Math.max(0, economy.getAvailable() - spent));
        saveEconomy(star, economy, now);

        Map<String, Object> details = orderDetails(order);
        details.put("shipsRequested", requested);
        details.put("shipsBuilt", toBuild);
        details.put("shipCost", shipCost);
        details.put("pointsSpent", spent);
        details.put("availableAfter", economy.getAvailable());
        details.put("shipIds", ships.stream().map(ShipEntity::getId).toList());
        turnEventService.append(gameId, turn, order.getPlayerId(), TurnEventKind.SHIPS_BUILT, details);
        return OrderOutcome.applied(toBuild, spent);
    }

    OrderOutcome applyExpansion(String gameId, Turn turn, OrderSubmission order, BuildPayload payload) {
        StarStateEntity star = requireOwnedStar(gameId, order);
        Economy economy = readEconomy(star);

        double spend = Math.min(payload.getExpandPoints(), economy.getAvailable());
        if (spend <= 0) {
            return OrderOutcome.skipped();
        }
        double industryBefore = economy.getIndustry();
        double industryAfter = roundToCents(industryBefore + Math.sqrt(1 + spend) - 1);
        economy.setIndustry(industryAfter);
        economy.setAvailable(Math.max(0, economy.getAvailable() - spend));
        saveEconomy(star, economy, LocalDateTime.now());

        Map<String, Object> details = orderDetails(order);
        details.put("pointsSpent", spend);
        details.put("industryBefore", industryBefore);
        details.put("industryAfter", industryAfter);
        details.put("availableAfter", economy.getAvailable());
        turnEventService.append(gameId, turn, order.getPlayerId(), TurnEventKind.INDUSTRY_EXPANDED, details);
        return OrderOutcome.applied(1, spend);
    }

    OrderOutcome applyMovement(
            String gameId, Turn turn, OrderSubmission order, MovePayload payload, GalaxyTopology topology) {
        String from = payload.getSourceStarId();
        String to = payload.getDestinationStarId();
        if (topology == null || !topology.areAdjacent(from, to)) {
            throw new InvalidStateException("Star " + to + " is not adjacent to " + from);
        }

        List<ShipEntity> candidates = shipJpaRepository.findByGameIdAndLocationStarIdAndOwnerPlayerIdAndStatus(
                gameId, from, order.getPlayerId(), ShipStatus.ACTIVE);
        List<ShipEntity> moving;
        if (payload.selectsAllShips()) {
            moving = candidates;
        } else {
            Set<String> selected = new HashSet<>(payload.getSelectedShipIds());
            moving = candidates.stream().filter(ship -> selected.contains(ship.getId())).toList();
        }
        if (moving.isEmpty()) {
            log.debug("No ships of player {} to move from {} to {}", order.getPlayerId(), from, to);
            return OrderOutcome.skipped();
        }

        moving.forEach(ship -> ship.setLocationStarId(to));
        shipJpaRepository.saveAll(moving);

        Map<String, Object> details = orderDetails(order);
        details.put("destinationStarId", to);
        details.put("shipsMoved", moving.size());
        details.put("shipIds", moving.stream().map(ShipEntity::getId).toList());
        turnEventService.append(gameId, turn, order.getPlayerId(), TurnEventKind.SHIPS_MOVED, details);
        return OrderOutcome.applied(moving.size(), 0);
    }

    static double roundToCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private StarStateEntity requireOwnedStar(String gameId, OrderSubmission order) {
        StarStateEntity star = starStateJpaRepository
                .findByGameIdAndStarId(gameId, order.getSourceStarId())
                .orElseThrow(() -> new ResourceNotFoundException("Star state", order.getSourceStarId()));
        if (!order.getPlayerId().equals(star.getOwnerPlayerId())) {
            throw new InvalidStateException(
                    "Star " + star.getStarId() + " is not owned by player " + order.getPlayerId());
        }
        return star;
    }

    private Economy readEconomy(StarStateEntity star) {
        Economy economy = JsonHelper.fromJson(star.getEconomy(), Economy.class);
        return economy != null ? economy : new Economy();
    }

    private void saveEconomy(StarStateEntity star, Economy economy, LocalDateTime now) {
        star.setEconomy(JsonHelper.toJson(economy));
        star.setUpdatedAt(now);
        starStateJpaRepository.save(star);
    }

    private Map<String, Object> orderDetails(OrderSubmission order) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("clientOrderId", order.getClientOrderId());
        details.put("orderType", order.getOrderType().getCode());
        details.put("sourceStarId", order.getSourceStarId());
        details.put("fromStandingOrder", order.getPayload().isFromStandingOrder());
        return details;
    }

    private void recordFailureEvent(String gameId, Turn turn, OrderFailure failure) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", failure.getOrderId());
        details.put("clientOrderId", failure.getClientOrderId());
        details.put("orderType", failure.getOrderType().getCode());
        details.put("phase", failure.getPhase().name().toLowerCase(Locale.ROOT));
        details.put("sourceStarId", failure.getSourceStarId());
        details.put("message", failure.getMessage());
        try {
            turnEventService.append(gameId, turn, failure.getPlayerId(), TurnEventKind.ORDER_FAILED, details);
        } catch (RuntimeException e) {
            log.error("Could not record failure of order {}: {}", failure.getClientOrderId(), e.getMessage(), e);
        }
    }

    private void appendSummary(String gameId, Turn turn, ResolutionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (PhaseSummary phase : result.getPhases()) {
            Map<String, Object> counters = new LinkedHashMap<>();
            counters.put("considered", phase.getOrdersConsidered());
            counters.put("applied", phase.getOrdersApplied());
            counters.put("skipped", phase.getOrdersSkipped());
            counters.put("failed", phase.getOrdersFailed());
            counters.put("units", phase.getUnitsAffected());
            counters.put("pointsSpent", phase.getPointsSpent());
            details.put(phase.getPhase().name().toLowerCase(Locale.ROOT), counters);
        }
        details.put("failures", result.getFailures().size());
        details.put("durationMs", result.getDuration().toMillis());
        try {
            turnEventService.append(gameId, turn, null, TurnEventKind.TURN_RESOLVED, details);
        } catch (RuntimeException e) {
            log.error("Could not record resolution summary for game {} turn {}", gameId, turn.getNumber(), e);
        }
    }
}
