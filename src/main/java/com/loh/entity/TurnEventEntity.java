package com.loh.entity;

import com.loh.domain.enums.TurnEventKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the turn_event table. {@code seq} is dense and unique within a turn;
 * {@code turn_number} is denormalized so history queries can sort without a join.
 */
@Entity
@Table(
        name = "turn_event",
        uniqueConstraints = @UniqueConstraint(name = "uk_turn_event_seq", columnNames = {"turn_id", "seq"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnEventEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "turn_id", length = 36, nullable = false)
    private String turnId;

    @Column(name = "turn_number", nullable = false)
    private int turnNumber;

    /** Null for events visible to every player. */
    @Column(name = "player_id", length = 36)
    private String playerId;

    @Column(name = "seq", nullable = false)
    private int seq;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, columnDefinition = "varchar(40)")
    private TurnEventKind kind;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
