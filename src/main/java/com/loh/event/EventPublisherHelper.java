package com.loh.event;

import com.loh.domain.model.Turn;
import com.loh.resolution.ResolutionResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for the
 * turn engine's application events.
 *
 * <p>Delivery depends on the listener: plain {@code @EventListener} runs on the publishing
 * thread, {@code @Async} listeners run on the turn event executor.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishTurnResolved(Object source, String gameId, ResolutionResult result) {
        applicationEventPublisher.publishEvent(new TurnResolvedEvent(source, gameId, result));
    }

    public void publishTurnAdvanced(Object source, String gameId, Turn previousTurn, Turn newTurn) {
        applicationEventPublisher.publishEvent(new TurnAdvancedEvent(source, gameId, previousTurn, newTurn));
    }

    public void publishGameStarted(Object source, String gameId, Turn firstTurn) {
        applicationEventPublisher.publishEvent(new GameStartedEvent(source, gameId, firstTurn));
    }
}
