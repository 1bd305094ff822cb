package com.loh.event;

import com.loh.domain.model.Turn;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a game has been set up and its first turn opened.
 */
public class GameStartedEvent extends ApplicationEvent {

    private final String gameId;
    private final Turn firstTurn;

    public GameStartedEvent(Object source, String gameId, Turn firstTurn) {
        super(source);
        this.gameId = gameId;
        this.firstTurn = firstTurn;
    }

    public String getGameId() {
        return gameId;
    }

    public Turn getFirstTurn() {
        return firstTurn;
    }
}
