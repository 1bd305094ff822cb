package com.loh.unit.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.loh.notification.StompTurnNotifier;
import com.loh.notification.TurnAdvanceNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

class StompTurnNotifierTest {

    private SimpMessagingTemplate simpMessagingTemplate;
    private StompTurnNotifier notifier;
    private TurnAdvanceNotification notification;

    @BeforeEach
    void setUp() {
        simpMessagingTemplate = mock(SimpMessagingTemplate.class);
        notifier = new StompTurnNotifier(simpMessagingTemplate);
        notification = TurnAdvanceNotification.builder()
                .gameId("game-1")
                .previousTurnId("turn-1")
                .previousTurnNumber(1)
                .newTurnId("turn-2")
                .newTurnNumber(2)
                .build();
    }

    @Test
    void sendsToTheGameTopic() {
        notifier.turnAdvanced(notification);

        verify(simpMessagingTemplate).convertAndSend("/topic/games/game-1/turns", notification);
    }

    @Test
    void deliveryFailureDoesNotEscape() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(simpMessagingTemplate)
                .convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> notifier.turnAdvanced(notification)).doesNotThrowAnyException();
    }
}
