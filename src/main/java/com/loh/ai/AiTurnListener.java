package com.loh.ai;

import com.loh.event.GameStartedEvent;
import com.loh.event.TurnAdvancedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts AI play when a game starts or a turn advances. Runs on the async executor after
 * the publishing transaction (if any) has committed, so AI seats read the new turn.
 */
@Component
public class AiTurnListener {

    private static final Logger log = LoggerFactory.getLogger(AiTurnListener.class);

    private final AiTurnExecutor aiTurnExecutor;
    private final AiProperties aiProperties;

    public AiTurnListener(AiTurnExecutor aiTurnExecutor, AiProperties aiProperties) {
        this.aiTurnExecutor = aiTurnExecutor;
        this.aiProperties = aiProperties;
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void onGameStarted(GameStartedEvent event) {
        run(event.getGameId(), event.getFirstTurn().getNumber());
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void onTurnAdvanced(TurnAdvancedEvent event) {
        run(event.getGameId(), event.getNewTurn().getNumber());
    }

    private void run(String gameId, int turnNumber) {
        if (!aiProperties.isEnabled()) {
            return;
        }
        log.debug("Triggering AI players for game {} turn {}", gameId, turnNumber);
        aiTurnExecutor.executeAllAiTurns(gameId);
    }
}
