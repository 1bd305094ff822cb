package com.loh.turn;

import com.loh.domain.enums.GameStatus;
import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.TurnStatus;
import com.loh.entity.GameEntity;
import com.loh.entity.PlayerEntity;
import com.loh.entity.TurnEntity;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.TurnJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps games moving when nobody ends the turn.
 *
 * <p>Turns left in RESOLVING are handed to {@link TurnCoordinator#completeStalledTurn} on
 * every check. Turns open longer than {@code loh.turn.idle-timeout-minutes} have every
 * player still ACTIVE ended with whatever drafts they have; the last of those calls triggers
 * resolution through the usual path. Idle ending is disabled when the timeout is 0.
 */
@Component
@EnableConfigurationProperties(TurnEngineConfig.class)
public class IdleTurnMonitor {

    private static final Logger log = LoggerFactory.getLogger(IdleTurnMonitor.class);

    private final TurnJpaRepository turnJpaRepository;
    private final GameJpaRepository gameJpaRepository;
    private final PlayerJpaRepository playerJpaRepository;
    private final TurnCoordinator turnCoordinator;
    private final TurnEngineConfig turnEngineConfig;

    public IdleTurnMonitor(
            TurnJpaRepository turnJpaRepository,
            GameJpaRepository gameJpaRepository,
            PlayerJpaRepository playerJpaRepository,
            TurnCoordinator turnCoordinator,
            TurnEngineConfig turnEngineConfig) {
        this.turnJpaRepository = turnJpaRepository;
        this.gameJpaRepository = gameJpaRepository;
        this.playerJpaRepository = playerJpaRepository;
        this.turnCoordinator = turnCoordinator;
        this.turnEngineConfig = turnEngineConfig;
    }

    @Scheduled(fixedDelayString = "${loh.turn.idle-check-interval-ms:60000}")
    public void checkIdleTurns() {
        completeStalledTurns();

        int timeoutMinutes = turnEngineConfig.getIdleTimeoutMinutes();
        if (timeoutMinutes <= 0) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(timeoutMinutes);
        List<TurnEntity> staleTurns = turnJpaRepository.findByStatusAndOpenedAtBefore(TurnStatus.OPEN, cutoff);
        for (TurnEntity turn : staleTurns) {
            boolean running = gameJpaRepository
                    .findById(turn.getGameId())
                    .map(GameEntity::getStatus)
                    .filter(status -> status == GameStatus.RUNNING)
                    .isPresent();
            if (running) {
                endTurnForIdlePlayers(turn);
            }
        }
    }

    private void completeStalledTurns() {
        List<TurnEntity> resolving =
                turnJpaRepository.findByStatusAndOpenedAtBefore(TurnStatus.RESOLVING, LocalDateTime.now());
        for (TurnEntity turn : resolving) {
            try {
                turnCoordinator
                        .completeStalledTurn(turn.getGameId(), turn.getNumber())
                        .ifPresent(next -> log.info(
                                "Recovered game {}: turn {} is now open", turn.getGameId(), next.getNumber()));
            } catch (RuntimeException e) {
                log.error(
                        "Failed to complete stalled turn {} of game {}: {}",
                        turn.getNumber(),
                        turn.getGameId(),
                        e.getMessage(),
                        e);
            }
        }
    }

    private void endTurnForIdlePlayers(TurnEntity turn) {
        List<PlayerEntity> idlePlayers =
                playerJpaRepository.findByGameIdAndStatus(turn.getGameId(), PlayerStatus.ACTIVE);
        log.info(
                "Turn {} of game {} idle since {}, ending it for {} players",
                turn.getNumber(),
                turn.getGameId(),
                turn.getOpenedAt(),
                idlePlayers.size());
        for (PlayerEntity player : idlePlayers) {
            try {
                turnCoordinator.endPlayerTurn(turn.getGameId(), player.getId());
            } catch (RuntimeException e) {
                log.error(
                        "Failed to end idle turn for player {} in game {}: {}",
                        player.getId(),
                        turn.getGameId(),
                        e.getMessage(),
                        e);
            }
        }
    }
}
