package com.loh.entity;

import com.loh.domain.enums.OrderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_submission table (append-only order revisions).
 *
 * <p>Every create, edit, delete and finalize inserts a new row; existing rows are only
 * ever touched to clear a stale {@code is_final} flag. {@code source_star_id} duplicates
 * the payload's source star so per-star lookups do not have to parse JSON.
 */
@Entity
@Table(
        name = "order_submission",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_order_submission_revision",
                        columnNames = {"game_id", "turn_id", "player_id", "client_order_id", "revision"}),
        indexes = @Index(name = "idx_order_submission_star", columnList = "game_id, turn_id, source_star_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderSubmissionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "turn_id", length = 36, nullable = false)
    private String turnId;

    @Column(name = "player_id", length = 36, nullable = false)
    private String playerId;

    @Column(name = "client_order_id", length = 36, nullable = false)
    private String clientOrderId;

    @Column(name = "revision", nullable = false)
    private int revision;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, columnDefinition = "varchar(20)")
    private OrderType orderType;

    @Column(name = "source_star_id", length = 36)
    private String sourceStarId;

    /** JSON form of the typed payload for {@link #orderType}. */
    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "is_final", nullable = false)
    private boolean finalized;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
