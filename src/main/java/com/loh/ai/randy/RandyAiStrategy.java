package com.loh.ai.randy;

import com.loh.ai.AiTurnContext;
import com.loh.ai.BaseAiStrategy;
import com.loh.ai.MapAnalysis;
import com.loh.domain.enums.OrderType;
import com.loh.domain.model.GameState;
import com.loh.domain.model.Ship;
import com.loh.domain.model.StarState;
import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * "Randy": a seeded, weighted-random computer player.
 *
 * <p>The seed is derived from the game and player ids, so the same seat always gets the same
 * build/expand/research weights. Each weight starts in [0.1, 0.5) and the three are normalized
 * to sum to 1. Every owned star with available points splits them by those weights in a single
 * build order.
 *
 * <p>Movement: from each owned star holding its ships, Randy looks at the adjacent stars and
 * sends all of them to the first one with no enemy ships. Failing that it picks the adjacent
 * star with the best friendly-to-enemy ratio, provided the ratio reaches the aggression
 * threshold (config key {@code aggression}, default 1.0).
 */
public class RandyAiStrategy extends BaseAiStrategy {

    public static final String NAME = "Randy";

    private final double buildWeight;
    private final double expandWeight;
    private final double researchWeight;
    private final double aggression;

    public RandyAiStrategy(String gameId, String playerId, Map<String, Object> config) {
        super(gameId, playerId, config);
        Random random = new Random(seedFor(gameId, playerId));
        double build = nextWeight(random);
        double expand = nextWeight(random);
        double research = nextWeight(random);
        double sum = build + expand + research;
        this.buildWeight = build / sum;
        this.expandWeight = expand / sum;
        this.researchWeight = research / sum;
        this.aggression = configDouble("aggression", 1.0);
        log.debug(
                "Randy for player {} weights: build={}, expand={}, research={}",
                playerId,
                String.format("%.2f", buildWeight),
                String.format("%.2f", expandWeight),
                String.format("%.2f", researchWeight));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void takeTurn(AiTurnContext context) {
        GameState state = context.getState();
        List<StarState> ownedStars = MapAnalysis.ownedStars(state, playerId);
        if (ownedStars.isEmpty()) {
            log.debug("Player {} owns no stars, nothing to do", playerId);
            return;
        }
        for (StarState star : ownedStars) {
            issueIndustryOrder(context, star);
        }
        for (StarState star : ownedStars) {
            issueMoveOrder(context, state, star);
        }
    }

    private void issueIndustryOrder(AiTurnContext context, StarState star) {
        double available = star.getEconomy() != null ? star.getEconomy().getAvailable() : 0;
        if (available <= 0) {
            return;
        }
        BuildPayload payload = BuildPayload.builder()
                .sourceStarId(star.getStarId())
                .buildPoints(available * buildWeight)
                .expandPoints(available * expandWeight)
                .researchPoints(available * researchWeight)
                .build();
        context.submit(OrderType.BUILD, payload);
    }

    private void issueMoveOrder(AiTurnContext context, GameState state, StarState star) {
        List<Ship> ships = MapAnalysis.ownActiveShipsAt(state, star.getStarId(), playerId);
        if (ships.isEmpty()) {
            return;
        }
        String target = chooseTarget(state, star.getStarId());
        if (target == null) {
            return;
        }
        MovePayload payload = MovePayload.builder()
                .sourceStarId(star.getStarId())
                .destinationStarId(target)
                .selectedShipIds(ships.stream().map(Ship::getId).toList())
                .build();
        context.submit(OrderType.MOVE, payload);
    }

    /** Adjacent star to move to, or null if none is uncontested or favourable enough. */
    public String chooseTarget(GameState state, String starId) {
        String bestTarget = null;
        double bestRatio = 0;
        for (String adjacent : MapAnalysis.adjacentStars(state, starId)) {
            if (MapAnalysis.enemyShipCount(state, adjacent, playerId) == 0) {
                return adjacent;
            }
            double ratio = MapAnalysis.shipRatio(state, adjacent, playerId);
            if (ratio >= aggression && ratio > bestRatio) {
                bestTarget = adjacent;
                bestRatio = ratio;
            }
        }
        return bestTarget;
    }

    public double getBuildWeight() {
        return buildWeight;
    }

    public double getExpandWeight() {
        return expandWeight;
    }

    public double getResearchWeight() {
        return researchWeight;
    }

    static long seedFor(String gameId, String playerId) {
        return Math.abs((long) (gameId + playerId).hashCode());
    }

    private static double nextWeight(Random random) {
        return 0.1 + random.nextDouble() * 0.4;
    }
}
