package com.loh.eventlog;

import com.loh.domain.enums.TurnEventKind;
import com.loh.domain.model.Turn;
import com.loh.domain.model.TurnEvent;
import com.loh.entity.TurnEventEntity;
import com.loh.mapper.JsonHelper;
import com.loh.mapper.TurnEventMapper;
import com.loh.repository.jpa.TurnEventJpaRepository;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-turn event log written during resolution and game setup.
 *
 * <p>Within a turn events are numbered 1, 2, 3... in append order. The next number is
 * {@code max(seq) + 1}; the unique (turn_id, seq) constraint rejects a concurrent writer
 * that picked the same number. Resolution is single-writer per game, so that only fires
 * when something else is wrong.
 */
@Service
public class TurnEventService {

    private static final Logger log = LoggerFactory.getLogger(TurnEventService.class);

    private final TurnEventJpaRepository turnEventJpaRepository;
    private final TurnEventMapper turnEventMapper;

    public TurnEventService(TurnEventJpaRepository turnEventJpaRepository, TurnEventMapper turnEventMapper) {
        this.turnEventJpaRepository = turnEventJpaRepository;
        this.turnEventMapper = turnEventMapper;
    }

    /**
     * Appends an event to the turn's log.
     *
     * @param playerId owning player, or null for a global event
     */
    @Transactional
    public TurnEvent append(
            String gameId, Turn turn, String playerId, TurnEventKind kind, Map<String, Object> details) {
        int seq = turnEventJpaRepository.findMaxSeq(turn.getId()) + 1;
        TurnEventEntity entity = TurnEventEntity.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .turnId(turn.getId())
                .turnNumber(turn.getNumber())
                .playerId(playerId)
                .seq(seq)
                .kind(kind)
                .details(JsonHelper.toJson(details != null ? details : new LinkedHashMap<>()))
                .createdAt(LocalDateTime.now())
                .build();
        TurnEventEntity saved = turnEventJpaRepository.save(entity);
        log.debug("Event {} #{} appended to game {} turn {}", kind.getCode(), seq, gameId, turn.getNumber());
        return turnEventMapper.toDomain(saved);
    }

    /** Events the player may see in one turn (own plus global), by seq, optionally of one kind. */
    @Transactional(readOnly = true)
    public List<TurnEvent> getEventsForPlayer(String gameId, String turnId, String playerId, TurnEventKind kind) {
        List<TurnEventEntity> events = turnEventJpaRepository.findVisibleToPlayer(gameId, turnId, playerId);
        return turnEventMapper.toDomainList(filterKind(events, kind));
    }

    /** Every event of one turn, by seq, optionally of one kind. */
    @Transactional(readOnly = true)
    public List<TurnEvent> getAllEvents(String gameId, String turnId, TurnEventKind kind) {
        List<TurnEventEntity> events = turnEventJpaRepository.findByGameIdAndTurnIdOrderBySeqAsc(gameId, turnId);
        return turnEventMapper.toDomainList(filterKind(events, kind));
    }

    /**
     * Events of one kind across turns, newest turn first and by seq within a turn.
     *
     * @param playerId when set, only that player's and global events
     */
    @Transactional(readOnly = true)
    public List<TurnEvent> getEventsByKind(String gameId, String playerId, TurnEventKind kind, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<TurnEventEntity> events = playerId == null
                ? turnEventJpaRepository.findHistoryByKind(gameId, kind, page)
                : turnEventJpaRepository.findHistoryByKindVisibleToPlayer(gameId, playerId, kind, page);
        return turnEventMapper.toDomainList(events);
    }

    private List<TurnEventEntity> filterKind(List<TurnEventEntity> events, TurnEventKind kind) {
        if (kind == null) {
            return events;
        }
        return events.stream().filter(event -> event.getKind() == kind).toList();
    }
}
