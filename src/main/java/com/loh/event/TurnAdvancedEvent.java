package com.loh.event;

import com.loh.domain.model.Turn;
import org.springframework.context.ApplicationEvent;

/**
 * Published once a turn has been closed and its successor opened.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AiTurnListener: runs AI players for the new turn</li>
 *   <li>TurnMetricsService: counts advanced turns</li>
 * </ul>
 */
public class TurnAdvancedEvent extends ApplicationEvent {

    private final String gameId;
    private final Turn previousTurn;
    private final Turn newTurn;

    public TurnAdvancedEvent(Object source, String gameId, Turn previousTurn, Turn newTurn) {
        super(source);
        this.gameId = gameId;
        this.previousTurn = previousTurn;
        this.newTurn = newTurn;
    }

    public String getGameId() {
        return gameId;
    }

    public Turn getPreviousTurn() {
        return previousTurn;
    }

    public Turn getNewTurn() {
        return newTurn;
    }
}
