package com.loh.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes turn-advance notifications over STOMP to {@code /topic/games/{gameId}/turns}.
 */
@Component
public class StompTurnNotifier implements TurnNotificationSink {

    private static final Logger log = LoggerFactory.getLogger(StompTurnNotifier.class);

    static final String TOPIC_TEMPLATE = "/topic/games/%s/turns";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public StompTurnNotifier(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Override
    public void turnAdvanced(TurnAdvanceNotification notification) {
        String destination = String.format(TOPIC_TEMPLATE, notification.getGameId());
        try {
            simpMessagingTemplate.convertAndSend(destination, notification);
            log.debug("Turn advance pushed to {}: turn {}", destination, notification.getNewTurnNumber());
        } catch (Exception e) {
            log.error("Failed to push turn advance for game {}: {}", notification.getGameId(), e.getMessage());
        }
    }
}
