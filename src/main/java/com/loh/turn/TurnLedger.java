package com.loh.turn;

import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.TurnStatus;
import com.loh.domain.model.Player;
import com.loh.domain.model.Turn;
import com.loh.entity.PlayerEntity;
import com.loh.entity.TurnEntity;
import com.loh.exception.InvalidStateException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.mapper.PlayerMapper;
import com.loh.mapper.TurnMapper;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.TurnJpaRepository;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turn lifecycle and player readiness for a game.
 *
 * <p>Turn transitions are conditional updates (OPEN → RESOLVING, OPEN/RESOLVING → CLOSED)
 * and report whether a row changed, so exactly one caller wins a race. Readiness is recorded
 * while holding a row lock on the game, which makes "mark waiting, count the rest, claim the
 * turn" a single atomic step per game.
 */
@Service
public class TurnLedger {

    private static final Logger log = LoggerFactory.getLogger(TurnLedger.class);

    private final TurnJpaRepository turnJpaRepository;
    private final PlayerJpaRepository playerJpaRepository;
    private final GameJpaRepository gameJpaRepository;
    private final TurnMapper turnMapper;
    private final PlayerMapper playerMapper;

    public TurnLedger(
            TurnJpaRepository turnJpaRepository,
            PlayerJpaRepository playerJpaRepository,
            GameJpaRepository gameJpaRepository,
            TurnMapper turnMapper,
            PlayerMapper playerMapper) {
        this.turnJpaRepository = turnJpaRepository;
        this.playerJpaRepository = playerJpaRepository;
        this.gameJpaRepository = gameJpaRepository;
        this.turnMapper = turnMapper;
        this.playerMapper = playerMapper;
    }

    /**
     * Opens turn {@code number} for the game, or returns it unchanged if it already exists.
     */
    @Transactional
    public Turn openTurn(String gameId, int number) {
        Optional<TurnEntity> existing = turnJpaRepository.findByGameIdAndNumber(gameId, number);
        if (existing.isPresent()) {
            log.debug("Turn {} of game {} already exists with status {}", number, gameId, existing.get().getStatus());
            return turnMapper.toDomain(existing.get());
        }

        TurnEntity turn = TurnEntity.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .number(number)
                .status(TurnStatus.OPEN)
                .openedAt(LocalDateTime.now())
                .build();
        TurnEntity saved = turnJpaRepository.save(turn);
        log.info("Opened turn {} for game {}", number, gameId);
        return turnMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<Turn> getOpenTurn(String gameId) {
        return turnJpaRepository
                .findFirstByGameIdAndStatusOrderByNumberDesc(gameId, TurnStatus.OPEN)
                .map(turnMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public Turn getTurn(String gameId, int number) {
        return turnJpaRepository
                .findByGameIdAndNumber(gameId, number)
                .map(turnMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Turn", gameId + "#" + number));
    }

    @Transactional(readOnly = true)
    public List<Turn> listTurns(String gameId) {
        return turnMapper.toDomainList(turnJpaRepository.findByGameIdOrderByNumberAsc(gameId));
    }

    /** OPEN → RESOLVING. Returns false if the turn was not open. */
    @Transactional
    public boolean markTurnResolving(String gameId, int number) {
        return turnJpaRepository.transition(gameId, number, TurnStatus.OPEN, TurnStatus.RESOLVING) == 1;
    }

    /** OPEN or RESOLVING → CLOSED, stamping closedAt. Returns false if the turn was already closed. */
    @Transactional
    public boolean closeTurn(String gameId, int number) {
        int updated = turnJpaRepository.close(
                gameId,
                number,
                EnumSet.of(TurnStatus.OPEN, TurnStatus.RESOLVING),
                TurnStatus.CLOSED,
                LocalDateTime.now());
        return updated == 1;
    }

    /**
     * Marks the player as waiting and, if that makes every participating player ready,
     * claims turn {@code turnNumber} for resolution.
     *
     * @throws ResourceNotFoundException if the game or the player does not exist
     * @throws InvalidStateException if the player is suspended or ejected
     */
    @Transactional
    public ReadinessResult markPlayerWaiting(String gameId, String playerId, int turnNumber) {
        gameJpaRepository.findByIdForUpdate(gameId).orElseThrow(() -> new ResourceNotFoundException("Game", gameId));
        PlayerEntity player = playerJpaRepository
                .findByGameIdAndId(gameId, playerId)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));
        if (!player.getStatus().isParticipating()) {
            throw new InvalidStateException(
                    "Player " + playerId + " is " + player.getStatus() + " and cannot end the turn");
        }

        playerJpaRepository.updateStatus(gameId, playerId, PlayerStatus.WAITING);
        long remaining = playerJpaRepository.countByGameIdAndStatus(gameId, PlayerStatus.ACTIVE);
        boolean allWaiting = remaining == 0;
        boolean claimed = allWaiting && markTurnResolving(gameId, turnNumber);

        log.info(
                "Player {} ended turn {} in game {}: {} still active{}",
                playerId,
                turnNumber,
                gameId,
                remaining,
                claimed ? ", turn claimed for resolution" : "");
        return new ReadinessResult(playerId, allWaiting, remaining, claimed);
    }

    /**
     * Hands a claimed turn back: RESOLVING → OPEN, and every waiting player back to ACTIVE so
     * the turn can be ended again. Does nothing if the turn is no longer RESOLVING.
     *
     * @return true if the claim was released
     */
    @Transactional
    public boolean releaseResolutionClaim(String gameId, int turnNumber) {
        if (turnJpaRepository.transition(gameId, turnNumber, TurnStatus.RESOLVING, TurnStatus.OPEN) != 1) {
            return false;
        }
        int reset = playerJpaRepository.updateStatusForGame(gameId, PlayerStatus.WAITING, PlayerStatus.ACTIVE);
        log.warn("Released resolution claim on turn {} of game {}, {} players active again", turnNumber, gameId, reset);
        return true;
    }

    @Transactional(readOnly = true)
    public Player getPlayer(String gameId, String playerId) {
        return playerJpaRepository
                .findByGameIdAndId(gameId, playerId)
                .map(playerMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));
    }

    /** Every player of the game with their current turn status, by name. */
    @Transactional(readOnly = true)
    public List<Player> getPlayersTurnStatus(String gameId) {
        return playerMapper.toDomainList(playerJpaRepository.findByGameIdOrderByNameAsc(gameId));
    }

    /** WAITING → ACTIVE for every player of the game. Suspended and ejected players are untouched. */
    @Transactional
    public int resetPlayersForNewTurn(String gameId) {
        int reset = playerJpaRepository.updateStatusForGame(gameId, PlayerStatus.WAITING, PlayerStatus.ACTIVE);
        log.debug("Reset {} players to ACTIVE in game {}", reset, gameId);
        return reset;
    }
}
