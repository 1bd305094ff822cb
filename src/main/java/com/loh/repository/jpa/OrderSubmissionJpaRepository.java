package com.loh.repository.jpa;

import com.loh.entity.OrderSubmissionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the order_submission table.
 *
 * <p>"Latest revision per client order" is computed in the service from the full set of
 * rows for a player's turn; these queries only narrow the rows loaded.
 */
@Repository
public interface OrderSubmissionJpaRepository extends JpaRepository<OrderSubmissionEntity, String> {

    List<OrderSubmissionEntity> findByGameIdAndTurnIdAndPlayerId(String gameId, String turnId, String playerId);

    List<OrderSubmissionEntity> findByGameIdAndTurnIdAndSourceStarId(String gameId, String turnId, String sourceStarId);

    Optional<OrderSubmissionEntity> findFirstByGameIdAndTurnIdAndPlayerIdAndClientOrderIdOrderByRevisionDesc(
            String gameId, String turnId, String playerId, String clientOrderId);

    @Query("SELECT o FROM OrderSubmissionEntity o WHERE o.gameId = :gameId AND o.turnId = :turnId"
            + " AND o.finalized = true ORDER BY o.playerId ASC, o.clientOrderId ASC")
    List<OrderSubmissionEntity> findFinalOrders(@Param("gameId") String gameId, @Param("turnId") String turnId);

    /** Clears the final flag on every row of a player's turn; used before re-finalizing. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE OrderSubmissionEntity o SET o.finalized = false WHERE o.gameId = :gameId"
            + " AND o.turnId = :turnId AND o.playerId = :playerId AND o.finalized = true")
    int clearFinalFlags(
            @Param("gameId") String gameId, @Param("turnId") String turnId, @Param("playerId") String playerId);
}
