package com.loh.unit.turn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.loh.domain.enums.GameStatus;
import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.PlayerType;
import com.loh.domain.enums.TurnStatus;
import com.loh.domain.model.Turn;
import com.loh.entity.GameEntity;
import com.loh.entity.PlayerEntity;
import com.loh.entity.TurnEntity;
import com.loh.exception.InvalidStateException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.mapper.PlayerMapper;
import com.loh.mapper.TurnMapper;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.TurnJpaRepository;
import com.loh.turn.ReadinessResult;
import com.loh.turn.TurnLedger;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class TurnLedgerTest {

    private static final String GAME = "game-1";

    private TurnJpaRepository turnJpaRepository;
    private PlayerJpaRepository playerJpaRepository;
    private GameJpaRepository gameJpaRepository;
    private TurnLedger turnLedger;

    @BeforeEach
    void setUp() {
        turnJpaRepository = mock(TurnJpaRepository.class);
        playerJpaRepository = mock(PlayerJpaRepository.class);
        gameJpaRepository = mock(GameJpaRepository.class);
        turnLedger = new TurnLedger(
                turnJpaRepository,
                playerJpaRepository,
                gameJpaRepository,
                Mappers.getMapper(TurnMapper.class),
                Mappers.getMapper(PlayerMapper.class));

        when(turnJpaRepository.save(any(TurnEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(gameJpaRepository.findByIdForUpdate(GAME))
                .thenReturn(Optional.of(GameEntity.builder().id(GAME).status(GameStatus.RUNNING).build()));
    }

    @Nested
    @DisplayName("Opening turns")
    class OpenTurn {

        @Test
        @DisplayName("creates an OPEN turn with the requested number")
        void createsOpenTurn() {
            when(turnJpaRepository.findByGameIdAndNumber(GAME, 1)).thenReturn(Optional.empty());

            Turn turn = turnLedger.openTurn(GAME, 1);

            assertThat(turn.getNumber()).isEqualTo(1);
            assertThat(turn.getStatus()).isEqualTo(TurnStatus.OPEN);
            assertThat(turn.getOpenedAt()).isNotNull();
            assertThat(turn.getId()).isNotBlank();
        }

        @Test
        @DisplayName("opening an existing turn returns it without inserting")
        void idempotent() {
            TurnEntity existing = TurnEntity.builder()
                    .id("turn-1")
                    .gameId(GAME)
                    .number(1)
                    .status(TurnStatus.OPEN)
                    .openedAt(LocalDateTime.now())
                    .build();
            when(turnJpaRepository.findByGameIdAndNumber(GAME, 1)).thenReturn(Optional.of(existing));

            Turn turn = turnLedger.openTurn(GAME, 1);

            assertThat(turn.getId()).isEqualTo("turn-1");
            verify(turnJpaRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Marking players waiting")
    class MarkWaiting {

        @Test
        @DisplayName("the last active player claims the turn")
        void lastPlayerClaims() {
            when(playerJpaRepository.findByGameIdAndId(GAME, "p-2")).thenReturn(Optional.of(player("p-2", PlayerStatus.ACTIVE)));
            when(playerJpaRepository.countByGameIdAndStatus(GAME, PlayerStatus.ACTIVE)).thenReturn(0L);
            when(turnJpaRepository.transition(GAME, 1, TurnStatus.OPEN, TurnStatus.RESOLVING)).thenReturn(1);

            ReadinessResult result = turnLedger.markPlayerWaiting(GAME, "p-2", 1);

            verify(playerJpaRepository).updateStatus(GAME, "p-2", PlayerStatus.WAITING);
            assertThat(result.allPlayersWaiting()).isTrue();
            assertThat(result.resolutionClaimed()).isTrue();
            assertThat(result.remainingPlayers()).isZero();
        }

        @Test
        @DisplayName("a turn already claimed by someone else is not claimed again")
        void alreadyClaimed() {
            when(playerJpaRepository.findByGameIdAndId(GAME, "p-2")).thenReturn(Optional.of(player("p-2", PlayerStatus.WAITING)));
            when(playerJpaRepository.countByGameIdAndStatus(GAME, PlayerStatus.ACTIVE)).thenReturn(0L);
            when(turnJpaRepository.transition(GAME, 1, TurnStatus.OPEN, TurnStatus.RESOLVING)).thenReturn(0);

            ReadinessResult result = turnLedger.markPlayerWaiting(GAME, "p-2", 1);

            assertThat(result.allPlayersWaiting()).isTrue();
            assertThat(result.resolutionClaimed()).isFalse();
        }

        @Test
        @DisplayName("players still active leave the turn open")
        void othersStillActive() {
            when(playerJpaRepository.findByGameIdAndId(GAME, "p-1")).thenReturn(Optional.of(player("p-1", PlayerStatus.ACTIVE)));
            when(playerJpaRepository.countByGameIdAndStatus(GAME, PlayerStatus.ACTIVE)).thenReturn(2L);

            ReadinessResult result = turnLedger.markPlayerWaiting(GAME, "p-1", 1);

            assertThat(result.allPlayersWaiting()).isFalse();
            assertThat(result.remainingPlayers()).isEqualTo(2);
            verify(turnJpaRepository, never()).transition(anyString(), anyInt(), any(), any());
        }

        @Test
        @DisplayName("unknown player is not found")
        void unknownPlayer() {
            when(playerJpaRepository.findByGameIdAndId(GAME, "ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> turnLedger.markPlayerWaiting(GAME, "ghost", 1))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("unknown game is not found")
        void unknownGame() {
            when(gameJpaRepository.findByIdForUpdate("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> turnLedger.markPlayerWaiting("nope", "p-1", 1))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("ejected players cannot end the turn")
        void ejectedRejected() {
            when(playerJpaRepository.findByGameIdAndId(GAME, "p-1")).thenReturn(Optional.of(player("p-1", PlayerStatus.EJECTED)));

            assertThatThrownBy(() -> turnLedger.markPlayerWaiting(GAME, "p-1", 1))
                    .isInstanceOf(InvalidStateException.class);
            verify(playerJpaRepository, never()).updateStatus(any(), any(), any());
        }
    }

    @Test
    @DisplayName("closing reports whether the turn changed")
    void closeTurn() {
        when(turnJpaRepository.close(any(), anyInt(), any(), any(), any())).thenReturn(1, 0);

        assertThat(turnLedger.closeTurn(GAME, 1)).isTrue();
        assertThat(turnLedger.closeTurn(GAME, 1)).isFalse();
    }

    @Test
    @DisplayName("reset moves waiting players back to active")
    void resetPlayers() {
        when(playerJpaRepository.updateStatusForGame(GAME, PlayerStatus.WAITING, PlayerStatus.ACTIVE)).thenReturn(3);

        assertThat(turnLedger.resetPlayersForNewTurn(GAME)).isEqualTo(3);
    }

    @Nested
    @DisplayName("Releasing a resolution claim")
    class ReleaseClaim {

        @Test
        @DisplayName("reopens the turn and makes waiting players active again")
        void releases() {
            when(turnJpaRepository.transition(GAME, 1, TurnStatus.RESOLVING, TurnStatus.OPEN))
                    .thenReturn(1);

            assertThat(turnLedger.releaseResolutionClaim(GAME, 1)).isTrue();
            verify(playerJpaRepository).updateStatusForGame(GAME, PlayerStatus.WAITING, PlayerStatus.ACTIVE);
        }

        @Test
        @DisplayName("a turn that is no longer resolving keeps its players as they are")
        void notResolving() {
            when(turnJpaRepository.transition(GAME, 1, TurnStatus.RESOLVING, TurnStatus.OPEN))
                    .thenReturn(0);

            assertThat(turnLedger.releaseResolutionClaim(GAME, 1)).isFalse();
            verify(playerJpaRepository, never()).updateStatusForGame(any(), any(), any());
        }
    }

    private static PlayerEntity player(String id, PlayerStatus status) {
        return PlayerEntity.builder()
                .id(id)
                .gameId(GAME)
                .name(id)
                .status(status)
                .type(PlayerType.PLAYER)
                .build();
    }
}
