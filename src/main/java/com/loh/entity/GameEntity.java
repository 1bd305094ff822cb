package com.loh.entity;

import com.loh.domain.enums.GameStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the game table. Also serves as the row that is locked while a
 * player's readiness is recorded, so concurrent end-turn calls for one game serialize.
 */
@Entity
@Table(name = "game")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "owner_id", length = 64)
    private String ownerId;

    private Long seed;

    @Column(name = "map_size", length = 20)
    private String mapSize;

    @Column(name = "density_min")
    private Double densityMin;

    @Column(name = "density_max")
    private Double densityMax;

    @Column(length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private GameStatus status;

    /** JSON object of game parameters. */
    @Column(name = "params", columnDefinition = "TEXT")
    private String params;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
