package com.loh.unit.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.loh.ai.AiTurnContext;
import com.loh.ai.randy.RandyAiStrategy;
import com.loh.domain.enums.OrderType;
import com.loh.domain.enums.ShipStatus;
import com.loh.domain.model.Economy;
import com.loh.domain.model.GalaxyTopology;
import com.loh.domain.model.GameState;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.model.Ship;
import com.loh.domain.model.Star;
import com.loh.domain.model.StarState;
import com.loh.domain.model.Turn;
import com.loh.domain.model.Wormhole;
import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import com.loh.order.OrderService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RandyAiStrategyTest {

    private static final String GAME = "game-1";
    private static final String ME = "p-randy";
    private static final String ENEMY = "p-enemy";

    private OrderService orderService;
    private Turn turn;

    @BeforeEach
    void setUp() {
        orderService = mock(OrderService.class);
        when(orderService.createDraft(anyString(), anyString(), anyString(), any(), any()))
                .thenReturn(OrderSubmission.builder().id("o").build());
        turn = Turn.builder().id("turn-1").gameId(GAME).number(1).build();
    }

    @Nested
    @DisplayName("Weights")
    class Weights {

        @Test
        @DisplayName("same seat always gets the same weights")
        void deterministic() {
            RandyAiStrategy first = new RandyAiStrategy(GAME, ME, Map.of());
            RandyAiStrategy second = new RandyAiStrategy(GAME, ME, Map.of());

            assertThat(second.getBuildWeight()).isEqualTo(first.getBuildWeight());
            assertThat(second.getExpandWeight()).isEqualTo(first.getExpandWeight());
            assertThat(second.getResearchWeight()).isEqualTo(first.getResearchWeight());
        }

        @Test
        @DisplayName("weights are normalized and none dominates completely")
        void normalized() {
            RandyAiStrategy randy = new RandyAiStrategy(GAME, ME, null);

            double sum = randy.getBuildWeight() + randy.getExpandWeight() + randy.getResearchWeight();
            assertThat(sum).isCloseTo(1.0, within(1e-9));
            // each raw weight is in [0.1, 0.5), so a normalized one is between 0.1/1.1 and 0.5/0.7
            assertThat(List.of(randy.getBuildWeight(), randy.getExpandWeight(), randy.getResearchWeight()))
                    .allSatisfy(weight -> assertThat(weight).isBetween(0.09, 0.72));
        }
    }

    @Nested
    @DisplayName("Taking a turn")
    class TakeTurn {

        @Test
        @DisplayName("splits each owned star's available points into one build order")
        void buildOrderPerStar() {
            GameState state = state(List.of(), 30);
            RandyAiStrategy randy = new RandyAiStrategy(GAME, ME, Map.of());

            randy.takeTurn(new AiTurnContext(GAME, ME, turn, state, orderService));

            ArgumentCaptor<BuildPayload> captor = ArgumentCaptor.forClass(BuildPayload.class);
            verify(orderService).createDraft(eq(GAME), eq("turn-1"), eq(ME), eq(OrderType.BUILD), captor.capture());
            BuildPayload payload = captor.getValue();
            assertThat(payload.getSourceStarId()).isEqualTo("home");
            assertThat(payload.getBuildPoints() + payload.getExpandPoints() + payload.getResearchPoints())
                    .isCloseTo(30.0, within(1e-9));
        }

        @Test
        @DisplayName("stars without available points get no build order")
        void nothingAvailable() {
            GameState state = state(List.of(), 0);

            new RandyAiStrategy(GAME, ME, Map.of())
                    .takeTurn(new AiTurnContext(GAME, ME, turn, state, orderService));

            verify(orderService, never()).createDraft(any(), any(), any(), eq(OrderType.BUILD), any());
        }

        @Test
        @DisplayName("moves its ships to an uncontested neighbour, not to one held by the enemy")
        void movesToUncontested() {
            List<Ship> ships = List.of(
                    ship("mine-1", ME, "home"),
                    ship("mine-2", ME, "home"),
                    ship("theirs-1", ENEMY, "north"));
            GameState state = state(ships, 0);
            AiTurnContext context = new AiTurnContext(GAME, ME, turn, state, orderService);

            new RandyAiStrategy(GAME, ME, Map.of()).takeTurn(context);

            ArgumentCaptor<MovePayload> captor = ArgumentCaptor.forClass(MovePayload.class);
            verify(orderService).createDraft(eq(GAME), eq("turn-1"), eq(ME), eq(OrderType.MOVE), captor.capture());
            assertThat(captor.getValue().getDestinationStarId()).isEqualTo("south");
            assertThat(captor.getValue().getSelectedShipIds()).containsExactlyInAnyOrder("mine-1", "mine-2");
            assertThat(context.getSubmitted()).hasSize(1);
        }

        @Test
        @DisplayName("attacks only when the friendly ratio reaches the aggression threshold")
        void aggressionThreshold() {
            List<Ship> enemyEverywhere = new ArrayList<>(List.of(
                    ship("theirs-1", ENEMY, "north"),
                    ship("theirs-2", ENEMY, "south"),
                    ship("theirs-3", ENEMY, "south"),
                    ship("mine-1", ME, "north"),
                    ship("mine-2", ME, "home")));
            GameState state = state(enemyEverywhere, 0);

            RandyAiStrategy cautious = new RandyAiStrategy(GAME, ME, Map.of("aggression", 2.0));
            RandyAiStrategy bold = new RandyAiStrategy(GAME, ME, Map.of("aggression", 0.5));

            assertThat(cautious.chooseTarget(state, "home")).isNull();
            assertThat(bold.chooseTarget(state, "home")).isEqualTo("north");
        }
    }

    private static GameState state(List<Ship> ships, double available) {
        GalaxyTopology topology = GalaxyTopology.builder()
                .stars(List.of(star("home"), star("north"), star("south")))
                .wormholes(List.of(
                        Wormhole.builder().starAId("home").starBId("north").build(),
                        Wormhole.builder().starAId("home").starBId("south").build()))
                .build();
        StarState home = StarState.builder()
                .gameId(GAME)
                .starId("home")
                .ownerPlayerId(ME)
                .economy(Economy.builder().available(available).industry(1).technology(1).build())
                .build();
        StarState north = StarState.builder().gameId(GAME).starId("north").economy(new Economy()).build();
        return GameState.builder()
                .turn(Turn.builder().id("turn-1").number(1).build())
                .topology(topology)
                .starStates(List.of(home, north))
                .ships(ships)
                .build();
    }

    private static Star star(String id) {
        return Star.builder().id(id).name(id).build();
    }

    private static Ship ship(String id, String owner, String starId) {
        return Ship.builder()
                .id(id)
                .gameId(GAME)
                .ownerPlayerId(owner)
                .locationStarId(starId)
                .hp(1)
                .power(1)
                .status(ShipStatus.ACTIVE)
                .build();
    }
}
