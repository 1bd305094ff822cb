package com.loh.repository.jpa;

import com.loh.domain.enums.TurnEventKind;
import com.loh.entity.TurnEventEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the turn_event table.
 *
 * <p>Player-scoped queries return the player's own events plus global ones
 * ({@code player_id IS NULL}).
 */
@Repository
public interface TurnEventJpaRepository extends JpaRepository<TurnEventEntity, String> {

    @Query("SELECT COALESCE(MAX(e.seq), 0) FROM TurnEventEntity e WHERE e.turnId = :turnId")
    int findMaxSeq(@Param("turnId") String turnId);

    List<TurnEventEntity> findByGameIdAndTurnIdOrderBySeqAsc(String gameId, String turnId);

    @Query("SELECT e FROM TurnEventEntity e WHERE e.gameId = :gameId AND e.turnId = :turnId"
            + " AND (e.playerId = :playerId OR e.playerId IS NULL) ORDER BY e.seq ASC")
    List<TurnEventEntity> findVisibleToPlayer(
            @Param("gameId") String gameId, @Param("turnId") String turnId, @Param("playerId") String playerId);

    @Query("SELECT e FROM TurnEventEntity e WHERE e.gameId = :gameId AND e.kind = :kind"
            + " ORDER BY e.turnNumber DESC, e.seq ASC")
    List<TurnEventEntity> findHistoryByKind(
            @Param("gameId") String gameId, @Param("kind") TurnEventKind kind, Pageable pageable);

    @Query("SELECT e FROM TurnEventEntity e WHERE e.gameId = :gameId AND e.kind = :kind"
            + " AND (e.playerId = :playerId OR e.playerId IS NULL) ORDER BY e.turnNumber DESC, e.seq ASC")
    List<TurnEventEntity> findHistoryByKindVisibleToPlayer(
            @Param("gameId") String gameId,
            @Param("playerId") String playerId,
            @Param("kind") TurnEventKind kind,
            Pageable pageable);
}
