package com.loh.unit.turn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.loh.domain.enums.TurnStatus;
import com.loh.domain.model.Turn;
import com.loh.event.EventPublisherHelper;
import com.loh.notification.TurnAdvanceNotification;
import com.loh.notification.TurnNotificationSink;
import com.loh.standing.StandingOrderMaterializer;
import com.loh.turn.TurnAdvancer;
import com.loh.turn.TurnLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.transaction.support.TransactionOperations;

class TurnAdvancerTest {

    private static final String GAME = "game-1";

    private TurnLedger turnLedger;
    private StandingOrderMaterializer standingOrderMaterializer;
    private TurnNotificationSink turnNotificationSink;
    private EventPublisherHelper eventPublisherHelper;
    private TurnAdvancer turnAdvancer;

    private Turn resolved;
    private Turn next;

    @BeforeEach
    void setUp() {
        turnLedger = mock(TurnLedger.class);
        standingOrderMaterializer = mock(StandingOrderMaterializer.class);
        turnNotificationSink = mock(TurnNotificationSink.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        turnAdvancer = new TurnAdvancer(
                turnLedger,
                standingOrderMaterializer,
                turnNotificationSink,
                eventPublisherHelper,
                TransactionOperations.withoutTransaction());

        resolved = Turn.builder().id("turn-3").gameId(GAME).number(3).status(TurnStatus.RESOLVING).build();
        next = Turn.builder().id("turn-4").gameId(GAME).number(4).status(TurnStatus.OPEN).build();
        when(turnLedger.closeTurn(GAME, 3)).thenReturn(true);
        when(turnLedger.openTurn(GAME, 4)).thenReturn(next);
    }

    @Test
    @DisplayName("closes the turn, opens the next, resets players, then materializes standing orders")
    void advances() {
        Turn opened = turnAdvancer.advance(GAME, resolved);

        assertThat(opened).isSameAs(next);
        InOrder order = inOrder(turnLedger, standingOrderMaterializer, turnNotificationSink, eventPublisherHelper);
        order.verify(turnLedger).closeTurn(GAME, 3);
        order.verify(turnLedger).openTurn(GAME, 4);
        order.verify(turnLedger).resetPlayersForNewTurn(GAME);
        order.verify(standingOrderMaterializer).materialize(GAME, next);
        order.verify(turnNotificationSink).turnAdvanced(any());
        order.verify(eventPublisherHelper).publishTurnAdvanced(turnAdvancer, GAME, resolved, next);
    }

    @Test
    @DisplayName("the notification names both turns")
    void notificationContent() {
        turnAdvancer.advance(GAME, resolved);

        ArgumentCaptor<TurnAdvanceNotification> captor = ArgumentCaptor.forClass(TurnAdvanceNotification.class);
        verify(turnNotificationSink).turnAdvanced(captor.capture());
        assertThat(captor.getValue().getGameId()).isEqualTo(GAME);
        assertThat(captor.getValue().getPreviousTurnId()).isEqualTo("turn-3");
        assertThat(captor.getValue().getPreviousTurnNumber()).isEqualTo(3);
        assertThat(captor.getValue().getNewTurnId()).isEqualTo("turn-4");
        assertThat(captor.getValue().getNewTurnNumber()).isEqualTo(4);
    }

    @Test
    @DisplayName("materialization and notification failures do not stop the advance")
    void failuresAfterCommitAreLogged() {
        when(standingOrderMaterializer.materialize(GAME, next)).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("broker down")).when(turnNotificationSink).turnAdvanced(any());

        Turn opened = turnAdvancer.advance(GAME, resolved);

        assertThat(opened).isSameAs(next);
        verify(eventPublisherHelper).publishTurnAdvanced(turnAdvancer, GAME, resolved, next);
    }
}
