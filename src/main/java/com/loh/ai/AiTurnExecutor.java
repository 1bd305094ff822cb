package com.loh.ai;

import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.model.GameState;
import com.loh.domain.model.Player;
import com.loh.domain.model.Turn;
import com.loh.order.OrderService;
import com.loh.turn.TurnCoordinator;
import com.loh.turn.TurnLedger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Runs computer players for a game's open turn.
 *
 * <p>Each AI seat is handled in isolation: its strategy plans against a filtered view of the
 * game and submits drafts, and only if that completes does the seat end its turn. A strategy
 * that throws is logged and leaves its seat ACTIVE; the other seats still play. Ending the turn
 * goes through {@link TurnCoordinator}, so the last AI to finish may trigger resolution.
 */
@Service
@EnableConfigurationProperties(AiProperties.class)
public class AiTurnExecutor {

    private static final Logger log = LoggerFactory.getLogger(AiTurnExecutor.class);

    private final AiStrategyRegistry aiStrategyRegistry;
    private final GameStateService gameStateService;
    private final OrderService orderService;
    private final TurnLedger turnLedger;
    private final TurnCoordinator turnCoordinator;
    private final AiProperties aiProperties;

    public AiTurnExecutor(
            AiStrategyRegistry aiStrategyRegistry,
            GameStateService gameStateService,
            OrderService orderService,
            TurnLedger turnLedger,
            TurnCoordinator turnCoordinator,
            AiProperties aiProperties) {
        this.aiStrategyRegistry = aiStrategyRegistry;
        this.gameStateService = gameStateService;
        this.orderService = orderService;
        this.turnLedger = turnLedger;
        this.turnCoordinator = turnCoordinator;
        this.aiProperties = aiProperties;
    }

    /**
     * Plays every ACTIVE seat whose {@code main_ai} names a registered strategy, one after the
     * other with the configured delay in between.
     */
    public List<AiTurnResult> executeAllAiTurns(String gameId) {
        List<Player> aiPlayers = turnLedger.getPlayersTurnStatus(gameId).stream()
                .filter(player -> player.getStatus() == PlayerStatus.ACTIVE)
                .filter(player -> aiStrategyRegistry.has(player.getAiName()))
                .toList();
        if (aiPlayers.isEmpty()) {
            return List.of();
        }
        log.info("Running {} AI players for game {}", aiPlayers.size(), gameId);

        List<AiTurnResult> results = new ArrayList<>();
        for (int i = 0; i < aiPlayers.size(); i++) {
            Player player = aiPlayers.get(i);
            AiTurnResult result = executeAiTurn(gameId, player);
            if (result.isSuccess()) {
                endTurn(gameId, player, result);
            }
            results.add(result);

            if (i < aiPlayers.size() - 1 && !pause()) {
                log.warn("AI run for game {} interrupted after {} players", gameId, results.size());
                break;
            }
        }

        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        log.info("AI turns for game {} done: {} ok, {} failed", gameId, results.size() - failed, failed);
        return results;
    }

    /** Plans and submits orders for one AI seat without ending its turn. */
    public AiTurnResult executeAiTurn(String gameId, Player player) {
        String aiName = player.getAiName();
        AiTurnResult.AiTurnResultBuilder result =
                AiTurnResult.builder().playerId(player.getId()).playerName(player.getName()).aiName(aiName);
        try {
            Optional<Turn> openTurn = turnLedger.getOpenTurn(gameId);
            if (openTurn.isEmpty()) {
                return result.success(false).error("No open turn").build();
            }
            GameState fullState = gameStateService.loadGameState(gameId, openTurn.get());
            GameState view = GameStateFilter.forPlayer(fullState, player.getId());

            AiStrategy strategy = aiStrategyRegistry.create(aiName, gameId, player.getId(), player.getAiConfig());
            AiTurnContext context = new AiTurnContext(gameId, player.getId(), openTurn.get(), view, orderService);
            strategy.takeTurn(context);

            log.info(
                    "AI {} ({}) submitted {} orders in game {} turn {}",
                    player.getName(),
                    aiName,
                    context.getSubmitted().size(),
                    gameId,
                    openTurn.get().getNumber());
            return result.success(true).ordersSubmitted(context.getSubmitted().size()).build();
        } catch (RuntimeException e) {
            log.error("AI {} ({}) failed in game {}: {}", player.getName(), aiName, gameId, e.getMessage(), e);
            return result.success(false).error(e.getMessage()).build();
        }
    }

    private void endTurn(String gameId, Player player, AiTurnResult result) {
        try {
            turnCoordinator.endPlayerTurn(gameId, player.getId());
        } catch (RuntimeException e) {
            log.error("AI {} could not end its turn in game {}: {}", player.getName(), gameId, e.getMessage(), e);
            result.setSuccess(false);
            result.setError(e.getMessage());
        }
    }

    private boolean pause() {
        long delay = aiProperties.getInterPlayerDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
