package com.loh.repository.jpa;

import com.loh.domain.enums.PlayerStatus;
import com.loh.entity.PlayerEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the game_player table, including the bulk status updates
 * used by turn readiness tracking.
 */
@Repository
public interface PlayerJpaRepository extends JpaRepository<PlayerEntity, String> {

    List<PlayerEntity> findByGameIdOrderByNameAsc(String gameId);

    Optional<PlayerEntity> findByGameIdAndId(String gameId, String id);

    List<PlayerEntity> findByGameIdAndStatus(String gameId, PlayerStatus status);

    long countByGameIdAndStatus(String gameId, PlayerStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE PlayerEntity p SET p.status = :status WHERE p.gameId = :gameId AND p.id = :playerId")
    int updateStatus(
            @Param("gameId") String gameId, @Param("playerId") String playerId, @Param("status") PlayerStatus status);

    /** Moves every player in {@code from} status to {@code to}; returns the number of rows changed. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE PlayerEntity p SET p.status = :to WHERE p.gameId = :gameId AND p.status = :from")
    int updateStatusForGame(
            @Param("gameId") String gameId, @Param("from") PlayerStatus from, @Param("to") PlayerStatus to);
}
