package com.loh.repository.jpa;

import com.loh.domain.enums.TurnStatus;
import com.loh.entity.TurnEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the game_turn table.
 *
 * <p>Status transitions are conditional updates: the WHERE clause names the statuses the
 * turn may move from, and the returned row count tells the caller whether it won.
 */
@Repository
public interface TurnJpaRepository extends JpaRepository<TurnEntity, String> {

    Optional<TurnEntity> findByGameIdAndNumber(String gameId, int number);

    Optional<TurnEntity> findFirstByGameIdAndStatusOrderByNumberDesc(String gameId, TurnStatus status);

    List<TurnEntity> findByGameIdOrderByNumberAsc(String gameId);

    List<TurnEntity> findByStatusAndOpenedAtBefore(TurnStatus status, LocalDateTime openedBefore);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(
            "UPDATE TurnEntity t SET t.status = :to WHERE t.gameId = :gameId AND t.number = :number AND t.status = :from")
    int transition(
            @Param("gameId") String gameId,
            @Param("number") int number,
            @Param("from") TurnStatus from,
            @Param("to") TurnStatus to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE TurnEntity t SET t.status = :to, t.closedAt = :closedAt"
            + " WHERE t.gameId = :gameId AND t.number = :number AND t.status IN :from")
    int close(
            @Param("gameId") String gameId,
            @Param("number") int number,
            @Param("from") Collection<TurnStatus> from,
            @Param("to") TurnStatus to,
            @Param("closedAt") LocalDateTime closedAt);
}
