package com.loh.event;

import com.loh.resolution.ResolutionResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a turn's final orders have been applied, before the next turn opens.
 * TurnMetricsService listens to record resolution latency and failure counts.
 */
public class TurnResolvedEvent extends ApplicationEvent {

    private final String gameId;
    private final ResolutionResult result;

    public TurnResolvedEvent(Object source, String gameId, ResolutionResult result) {
        super(source);
        this.gameId = gameId;
        this.result = result;
    }

    public String getGameId() {
        return gameId;
    }

    public ResolutionResult getResult() {
        return result;
    }
}
