package com.loh.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.loh.domain.enums.GameStatus;
import com.loh.domain.enums.OrderType;
import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.PlayerType;
import com.loh.domain.enums.TurnEventKind;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.model.Turn;
import com.loh.domain.payload.BuildPayload;
import com.loh.entity.GameEntity;
import com.loh.entity.PlayerEntity;
import com.loh.eventlog.TurnEventService;
import com.loh.mapper.OrderSubmissionMapper;
import com.loh.mapper.PlayerMapper;
import com.loh.mapper.TurnEventMapper;
import com.loh.mapper.TurnMapper;
import com.loh.order.OrderService;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.OrderSubmissionJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.TurnEventJpaRepository;
import com.loh.repository.jpa.TurnJpaRepository;
import com.loh.turn.ReadinessResult;
import com.loh.turn.TurnLedger;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

/**
 * Runs the ledger, order store and event log against H2 to check the queries behind
 * revisions, re-finalization, readiness claims and per-turn sequence numbers.
 */
@DataJpaTest
class TurnLedgerPersistenceIntegrationTest {

    private static final String GAME = "game-it";

    @Autowired
    private GameJpaRepository gameJpaRepository;

    @Autowired
    private PlayerJpaRepository playerJpaRepository;

    @Autowired
    private TurnJpaRepository turnJpaRepository;

    @Autowired
    private OrderSubmissionJpaRepository orderSubmissionJpaRepository;

    @Autowired
    private TurnEventJpaRepository turnEventJpaRepository;

    private TurnLedger turnLedger;
    private OrderService orderService;
    private TurnEventService turnEventService;

    @BeforeEach
    void setUp() {
        turnLedger = new TurnLedger(
                turnJpaRepository,
                playerJpaRepository,
                gameJpaRepository,
                Mappers.getMapper(TurnMapper.class),
                Mappers.getMapper(PlayerMapper.class));
        orderService = new OrderService(
                orderSubmissionJpaRepository, turnJpaRepository, Mappers.getMapper(OrderSubmissionMapper.class));
        turnEventService = new TurnEventService(turnEventJpaRepository, Mappers.getMapper(TurnEventMapper.class));

        gameJpaRepository.save(GameEntity.builder()
                .id(GAME)
                .title("ledger")
                .status(GameStatus.RUNNING)
                .createdAt(LocalDateTime.now())
                .build());
        playerJpaRepository.save(player("p1", "alice"));
        playerJpaRepository.save(player("p2", "bob"));
    }

    @Nested
    @DisplayName("Turns")
    class Turns {

        @Test
        @DisplayName("opening the same turn twice returns the existing row")
        void openTurnIsIdempotent() {
            Turn first = turnLedger.openTurn(GAME, 1);
            Turn second = turnLedger.openTurn(GAME, 1);

            assertThat(second.getId()).isEqualTo(first.getId());
            assertThat(turnLedger.listTurns(GAME)).hasSize(1);
        }

        @Test
        @DisplayName("only the last player to end the turn claims it, and only once")
        void readinessClaim() {
            turnLedger.openTurn(GAME, 1);

            ReadinessResult alice = turnLedger.markPlayerWaiting(GAME, "p1", 1);
            ReadinessResult bob = turnLedger.markPlayerWaiting(GAME, "p2", 1);
            ReadinessResult bobAgain = turnLedger.markPlayerWaiting(GAME, "p2", 1);

            assertThat(alice.resolutionClaimed()).isFalse();
            assertThat(alice.remainingPlayers()).isEqualTo(1);
            assertThat(bob.resolutionClaimed()).isTrue();
            assertThat(bobAgain.allPlayersWaiting()).isTrue();
            assertThat(bobAgain.resolutionClaimed()).isFalse();
        }

        @Test
        @DisplayName("suspended players do not hold up the turn")
        void suspendedPlayersAreIgnored() {
            turnLedger.openTurn(GAME, 1);
            playerJpaRepository.updateStatus(GAME, "p2", PlayerStatus.SUSPENDED);

            assertThat(turnLedger.markPlayerWaiting(GAME, "p1", 1).resolutionClaimed()).isTrue();
            assertThat(turnLedger.resetPlayersForNewTurn(GAME)).isEqualTo(1);
            assertThat(turnLedger.getPlayer(GAME, "p2").getStatus()).isEqualTo(PlayerStatus.SUSPENDED);
        }

        @Test
        @DisplayName("closing is conditional on the current status")
        void closeOnce() {
            turnLedger.openTurn(GAME, 1);

            assertThat(turnLedger.closeTurn(GAME, 1)).isTrue();
            assertThat(turnLedger.closeTurn(GAME, 1)).isFalse();
            assertThat(turnLedger.markTurnResolving(GAME, 1)).isFalse();
            assertThat(turnLedger.getOpenTurn(GAME)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("re-finalizing leaves exactly one final row per order")
        void refinalize() {
            Turn turn = turnLedger.openTurn(GAME, 1);
            OrderSubmission draft = orderService.createDraft(GAME, turn.getId(), "p1", OrderType.BUILD, build(1));
            orderService.editDraft(GAME, turn.getId(), "p1", draft.getClientOrderId(), OrderType.BUILD, build(2));
            OrderSubmission dropped = orderService.createDraft(GAME, turn.getId(), "p1", OrderType.BUILD, build(5));
            orderService.deleteDraft(GAME, turn.getId(), "p1", dropped.getClientOrderId());

            assertThat(orderService.finalizePlayerTurn(GAME, turn.getId(), "p1"))
                    .singleElement()
                    .satisfies(order -> assertThat(order.getRevision()).isEqualTo(3));

            orderService.editDraft(GAME, turn.getId(), "p1", draft.getClientOrderId(), OrderType.BUILD, build(4));
            orderService.finalizePlayerTurn(GAME, turn.getId(), "p1");

            List<OrderSubmission> finals = orderService.listFinalOrders(GAME, turn.getId(), null);
            assertThat(finals).singleElement().satisfies(order -> {
                assertThat(order.getClientOrderId()).isEqualTo(draft.getClientOrderId());
                assertThat(order.getRevision()).isEqualTo(5);
                assertThat(((BuildPayload) order.getPayload()).getShips()).isEqualTo(4);
            });
            assertThat(orderService.listLatestDrafts(GAME, turn.getId(), "p1")).isEmpty();
        }

        @Test
        @DisplayName("drafts can be listed by source star")
        void draftsByStar() {
            Turn turn = turnLedger.openTurn(GAME, 1);
            orderService.createDraft(GAME, turn.getId(), "p1", OrderType.BUILD, build(1));
            orderService.createDraft(GAME, turn.getId(), "p2", OrderType.BUILD, build(1));

            assertThat(orderService.listDraftsForStar(GAME, turn.getId(), "s1", null, null)).hasSize(2);
            assertThat(orderService.listDraftsForStar(GAME, turn.getId(), "s1", "p2", OrderType.BUILD))
                    .hasSize(1);
            assertThat(orderService.listDraftsForStar(GAME, turn.getId(), "s9", null, null)).isEmpty();
        }
    }

    @Test
    @DisplayName("event sequence numbers restart for each turn")
    void eventSeqPerTurn() {
        Turn turn1 = turnLedger.openTurn(GAME, 1);
        Turn turn2 = turnLedger.openTurn(GAME, 2);

        turnEventService.append(GAME, turn1, null, TurnEventKind.GAME_STARTED, Map.of());
        turnEventService.append(GAME, turn1, "p1", TurnEventKind.SHIPS_BUILT, Map.of("shipsBuilt", 2));
        turnEventService.append(GAME, turn2, "p1", TurnEventKind.SHIPS_MOVED, null);

        assertThat(turnEventService.getAllEvents(GAME, turn1.getId(), null))
                .extracting(event -> event.getSeq())
                .containsExactly(1, 2);
        assertThat(turnEventService.getAllEvents(GAME, turn2.getId(), null))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getSeq()).isEqualTo(1);
                    assertThat(event.getDetails()).isEmpty();
                });
        assertThat(turnEventService.getEventsByKind(GAME, "p2", TurnEventKind.SHIPS_BUILT, 10)).isEmpty();
        assertThat(turnEventService.getEventsByKind(GAME, null, TurnEventKind.SHIPS_BUILT, 10))
                .singleElement()
                .satisfies(event -> assertThat(event.getDetails()).containsEntry("shipsBuilt", 2));
    }

    private static PlayerEntity player(String id, String name) {
        return PlayerEntity.builder()
                .id(id)
                .gameId(GAME)
                .name(name)
                .status(PlayerStatus.ACTIVE)
                .type(PlayerType.PLAYER)
                .meta("{}")
                .build();
    }

    private static BuildPayload build(int ships) {
        return BuildPayload.builder().sourceStarId("s1").ships(ships).build();
    }
}
