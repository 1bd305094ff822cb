package com.loh.turn;

import com.loh.domain.model.Turn;
import com.loh.event.EventPublisherHelper;
import com.loh.notification.TurnAdvanceNotification;
import com.loh.notification.TurnNotificationSink;
import com.loh.standing.StandingOrderMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Moves a game from a resolved turn to the next one.
 *
 * <p>Closing the old turn, opening {@code number + 1} and resetting player readiness commit
 * together. Standing-order materialization, the client notification and the application
 * event follow; a failure in any of those is logged and does not undo the advance.
 */
@Service
public class TurnAdvancer {

    private static final Logger log = LoggerFactory.getLogger(TurnAdvancer.class);

    private final TurnLedger turnLedger;
    private final StandingOrderMaterializer standingOrderMaterializer;
    private final TurnNotificationSink turnNotificationSink;
    private final EventPublisherHelper eventPublisherHelper;
    private final TransactionOperations transactionOperations;

    public TurnAdvancer(
            TurnLedger turnLedger,
            StandingOrderMaterializer standingOrderMaterializer,
            TurnNotificationSink turnNotificationSink,
            EventPublisherHelper eventPublisherHelper,
            TransactionOperations transactionOperations) {
        this.turnLedger = turnLedger;
        this.standingOrderMaterializer = standingOrderMaterializer;
        this.turnNotificationSink = turnNotificationSink;
        this.eventPublisherHelper = eventPublisherHelper;
        this.transactionOperations = transactionOperations;
    }

    /**
     * Closes {@code resolvedTurn} and opens its successor.
     *
     * @return the newly opened turn
     */
    public Turn advance(String gameId, Turn resolvedTurn) {
        Turn nextTurn = transactionOperations.execute(status -> {
            if (!turnLedger.closeTurn(gameId, resolvedTurn.getNumber())) {
                log.warn("Turn {} of game {} was already closed", resolvedTurn.getNumber(), gameId);
            }
            Turn opened = turnLedger.openTurn(gameId, resolvedTurn.getNumber() + 1);
            turnLedger.resetPlayersForNewTurn(gameId);
            return opened;
        });
        log.info("Game {} advanced from turn {} to turn {}", gameId, resolvedTurn.getNumber(), nextTurn.getNumber());

        try {
            standingOrderMaterializer.materialize(gameId, nextTurn);
        } catch (RuntimeException e) {
            log.error(
                    "Standing orders were not materialized for game {} turn {}: {}",
                    gameId,
                    nextTurn.getNumber(),
                    e.getMessage(),
                    e);
        }

        notifyClients(gameId, resolvedTurn, nextTurn);
        eventPublisherHelper.publishTurnAdvanced(this, gameId, resolvedTurn, nextTurn);
        return nextTurn;
    }

    private void notifyClients(String gameId, Turn previousTurn, Turn nextTurn) {
        TurnAdvanceNotification notification = TurnAdvanceNotification.builder()
                .gameId(gameId)
                .previousTurnId(previousTurn.getId())
                .previousTurnNumber(previousTurn.getNumber())
                .newTurnId(nextTurn.getId())
                .newTurnNumber(nextTurn.getNumber())
                .build();
        try {
            turnNotificationSink.turnAdvanced(notification);
        } catch (RuntimeException e) {
            log.error("Turn advance notification failed for game {}: {}", gameId, e.getMessage());
        }
    }
}
