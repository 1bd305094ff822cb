package com.loh.turn;

import com.loh.domain.enums.TurnEventKind;
import com.loh.domain.enums.TurnStatus;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.model.Player;
import com.loh.domain.model.Turn;
import com.loh.event.EventPublisherHelper;
import com.loh.eventlog.TurnEventService;
import com.loh.exception.InvalidStateException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.order.OrderService;
import com.loh.resolution.OrderResolutionEngine;
import com.loh.resolution.ResolutionResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for "player ends turn".
 *
 * <p>Finalizes the player's drafts, records readiness and, when the player was the last one
 * the game was waiting for, resolves the turn and advances the game. Calls for the same game
 * are serialized on a per-game monitor, and the turn is claimed with a conditional
 * OPEN → RESOLVING update, so resolution runs exactly once per turn even if several players
 * finish at the same moment. Calls for different games run in parallel. A monitor exists only
 * while some call for its game is in progress.
 *
 * <p>If resolution fails before it has applied anything, the claim is released and the turn
 * is OPEN again. A turn left in RESOLVING after that is finished by
 * {@link #completeStalledTurn(String, int)}.
 */
@Service
public class TurnCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TurnCoordinator.class);

    private final Map<String, GameLock> gameLocks = new ConcurrentHashMap<>();

    private final TurnLedger turnLedger;
    private final OrderService orderService;
    private final OrderResolutionEngine orderResolutionEngine;
    private final TurnAdvancer turnAdvancer;
    private final TurnEventService turnEventService;
    private final EventPublisherHelper eventPublisherHelper;

    public TurnCoordinator(
            TurnLedger turnLedger,
            OrderService orderService,
            OrderResolutionEngine orderResolutionEngine,
            TurnAdvancer turnAdvancer,
            TurnEventService turnEventService,
            EventPublisherHelper eventPublisherHelper) {
        this.turnLedger = turnLedger;
        this.orderService = orderService;
        this.orderResolutionEngine = orderResolutionEngine;
        this.turnAdvancer = turnAdvancer;
        this.turnEventService = turnEventService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Ends the open turn for one player.
     *
     * @throws ResourceNotFoundException if the game has no open turn or the player is not in it
     * @throws InvalidStateException if the player is suspended or ejected
     */
    public EndTurnResult endPlayerTurn(String gameId, String playerId) {
        return withGameLock(gameId, () -> {
            Turn openTurn = turnLedger
                    .getOpenTurn(gameId)
                    .orElseThrow(() -> new ResourceNotFoundException("Open turn", gameId));
            Player player = turnLedger.getPlayer(gameId, playerId);
            if (!player.getStatus().isParticipating()) {
                throw new InvalidStateException(
                        "Player " + playerId + " is " + player.getStatus() + " and cannot end the turn");
            }

            List<OrderSubmission> finals = orderService.finalizePlayerTurn(gameId, openTurn.getId(), playerId);
            ReadinessResult readiness = turnLedger.markPlayerWaiting(gameId, playerId, openTurn.getNumber());

            EndTurnResult.EndTurnResultBuilder result = EndTurnResult.builder()
                    .gameId(gameId)
                    .playerId(playerId)
                    .turnNumber(openTurn.getNumber())
                    .ordersFinalized(finals.size())
                    .allPlayersWaiting(readiness.allPlayersWaiting())
                    .remainingPlayers(readiness.remainingPlayers());
            if (!readiness.resolutionClaimed()) {
                return result.build();
            }

            log.info("All players ready in game {}, resolving turn {}", gameId, openTurn.getNumber());
            ResolutionResult resolution = resolveOrRelease(gameId, openTurn);
            Turn nextTurn = turnAdvancer.advance(gameId, openTurn);
            return result.resolution(resolution).nextTurn(nextTurn).build();
        });
    }

    /**
     * Finishes a turn that was claimed for resolution but never advanced: resolves it unless
     * its resolution summary was already recorded, then opens the next turn.
     *
     * @return the newly opened turn, or empty if the turn is no longer RESOLVING
     */
    public Optional<Turn> completeStalledTurn(String gameId, int turnNumber) {
        return withGameLock(gameId, () -> {
            Turn turn = turnLedger.getTurn(gameId, turnNumber);
            if (turn.getStatus() != TurnStatus.RESOLVING) {
                return Optional.empty();
            }
            boolean resolved = !turnEventService
                    .getAllEvents(gameId, turn.getId(), TurnEventKind.TURN_RESOLVED)
                    .isEmpty();
            log.warn(
                    "Turn {} of game {} stalled in RESOLVING, {}",
                    turnNumber,
                    gameId,
                    resolved ? "advancing it" : "resolving and advancing it");
            if (!resolved) {
                resolveOrRelease(gameId, turn);
            }
            return Optional.of(turnAdvancer.advance(gameId, turn));
        });
    }

    /** Number of games with an end-turn or recovery call in progress. */
    public int lockedGameCount() {
        return gameLocks.size();
    }

    private ResolutionResult resolveOrRelease(String gameId, Turn turn) {
        ResolutionResult resolution;
        try {
            resolution = orderResolutionEngine.resolve(gameId, turn);
        } catch (RuntimeException e) {
            log.error(
                    "Resolution of turn {} in game {} failed, reopening the turn: {}",
                    turn.getNumber(),
                    gameId,
                    e.getMessage(),
                    e);
            try {
                turnLedger.releaseResolutionClaim(gameId, turn.getNumber());
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        eventPublisherHelper.publishTurnResolved(this, gameId, resolution);
        return resolution;
    }

    private <T> T withGameLock(String gameId, Supplier<T> action) {
        GameLock lock = gameLocks.compute(gameId, (id, held) -> {
            GameLock acquired = held != null ? held : new GameLock();
            acquired.users++;
            return acquired;
        });
        try {
            synchronized (lock) {
                return action.get();
            }
        } finally {
            gameLocks.computeIfPresent(gameId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    // users is only read and written inside ConcurrentHashMap.compute for the game's key
    private static final class GameLock {
        private int users;
    }
}
