package com.loh.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the star_state table. One row per star per game.
 *
 * <p>{@code has_standing_orders} mirrors whether the details bag holds a standing-order
 * template, so the per-turn materialization pass can select those stars directly.
 */
@Entity
@Table(
        name = "star_state",
        uniqueConstraints = @UniqueConstraint(name = "uk_star_state_star", columnNames = {"game_id", "star_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StarStateEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "star_id", length = 36, nullable = false)
    private String starId;

    @Column(name = "owner_player_id", length = 36)
    private String ownerPlayerId;

    /** JSON {@link com.loh.domain.model.Economy}. */
    @Column(name = "economy", columnDefinition = "TEXT")
    private String economy;

    @Column(name = "damage", columnDefinition = "TEXT")
    private String damage;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "has_standing_orders", nullable = false)
    private boolean hasStandingOrders;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
