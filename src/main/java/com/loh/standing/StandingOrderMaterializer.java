package com.loh.standing;

import com.loh.domain.enums.OrderType;
import com.loh.domain.model.Economy;
import com.loh.domain.model.StandingOrders;
import com.loh.domain.model.Turn;
import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import com.loh.entity.StarStateEntity;
import com.loh.mapper.JsonHelper;
import com.loh.order.OrderService;
import com.loh.repository.jpa.StarStateJpaRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns every star's standing-order template into draft orders for a newly opened turn.
 *
 * <p>Runs after the turn has been opened and the previous turn's economy has settled, so
 * percentages apply to the star's current available points. Generated orders are ordinary
 * drafts owned by the star's owner; the player can still edit or delete them before ending
 * the turn. A failure on one star is logged and does not stop the others.
 *
 * <p>Industry split: each allocation is {@code floor(available * percent / 100)}. If rounding
 * ever leaves the sum above available, all three are scaled by {@code available / total} and
 * floored again, so the order never asks for more than the star has.
 */
@Service
public class StandingOrderMaterializer {

    private static final Logger log = LoggerFactory.getLogger(StandingOrderMaterializer.class);

    private final StarStateJpaRepository starStateJpaRepository;
    private final OrderService orderService;

    public StandingOrderMaterializer(StarStateJpaRepository starStateJpaRepository, OrderService orderService) {
        this.starStateJpaRepository = starStateJpaRepository;
        this.orderService = orderService;
    }

    public MaterializationResult materialize(String gameId, Turn turn) {
        List<StarStateEntity> stars = starStateJpaRepository.findByGameIdAndHasStandingOrdersTrue(gameId);
        int ordersCreated = 0;
        int starsFailed = 0;

        for (StarStateEntity star : stars) {
            try {
                ordersCreated += materializeStar(gameId, turn, star);
            } catch (RuntimeException e) {
                starsFailed++;
                log.error(
                        "Failed to materialize standing orders for star {} in game {} turn {}: {}",
                        star.getStarId(),
                        gameId,
                        turn.getNumber(),
                        e.getMessage(),
                        e);
            }
        }

        if (!stars.isEmpty()) {
            log.info(
                    "Materialized {} standing orders from {} stars for game {} turn {} ({} failed)",
                    ordersCreated,
                    stars.size(),
                    gameId,
                    turn.getNumber(),
                    starsFailed);
        }
        return MaterializationResult.builder()
                .starsProcessed(stars.size())
                .ordersCreated(ordersCreated)
                .starsFailed(starsFailed)
                .build();
    }

    private int materializeStar(String gameId, Turn turn, StarStateEntity star) {
        if (star.getOwnerPlayerId() == null) {
            log.warn("Star {} in game {} has standing orders but no owner, skipping", star.getStarId(), gameId);
            return 0;
        }
        Optional<StandingOrders> template = StandingOrderService.read(star);
        if (template.isEmpty()) {
            return 0;
        }

        int created = 0;
        StandingOrders standingOrders = template.get();
        if (standingOrders.getIndustry() != null) {
            Economy economy = JsonHelper.fromJson(star.getEconomy(), Economy.class);
            double available = economy != null ? economy.getAvailable() : 0;
            BuildPayload payload = allocateIndustry(star.getStarId(), available, standingOrders.getIndustry());
            if (payload != null) {
                orderService.createDraft(gameId, turn.getId(), star.getOwnerPlayerId(), OrderType.AUTO_BUILD, payload);
                created++;
            }
        }

        StandingOrders.Move move = standingOrders.getMove();
        if (move != null && move.getDestinationStarId() != null) {
            MovePayload payload = MovePayload.builder()
                    .sourceStarId(star.getStarId())
                    .destinationStarId(move.getDestinationStarId())
                    .selectedShipIds(new ArrayList<>())
                    .fromStandingOrder(true)
                    .build();
            orderService.createDraft(gameId, turn.getId(), star.getOwnerPlayerId(), OrderType.AUTO_MOVE, payload);
            created++;
        }
        return created;
    }

    /**
     * Splits {@code available} points by the template's percentages.
     *
     * @return the build payload, or null when nothing would be allocated
     */
    public static BuildPayload allocateIndustry(String starId, double available, StandingOrders.Industry industry) {
        if (available <= 0) {
            return null;
        }
        double expand = Math.floor(available * percent(industry.getExpandPercent()) / 100);
        double research = Math.floor(available * percent(industry.getResearchPercent()) / 100);
        double build = Math.floor(available * percent(industry.getBuildPercent()) / 100);

        double total = expand + research + build;
        if (total > available) {
            double scale = available / total;
            expand = Math.floor(expand * scale);
            research = Math.floor(research * scale);
            build = Math.floor(build * scale);
        }
        if (expand + research + build <= 0) {
            return null;
        }
        return BuildPayload.builder()
                .sourceStarId(starId)
                .expandPoints(expand)
                .researchPoints(research)
                .buildPoints(build)
                .fromStandingOrder(true)
                .build();
    }

    private static double percent(Double value) {
        return value != null ? value : 0;
    }
}
