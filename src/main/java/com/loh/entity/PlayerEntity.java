package com.loh.entity;

import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.PlayerType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the game_player table. Player names are unique within a game.
 */
@Entity
@Table(
        name = "game_player",
        uniqueConstraints = @UniqueConstraint(name = "uk_game_player_name", columnNames = {"game_id", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(length = 100, nullable = false)
    private String name;

    @Column(name = "color_hex", length = 9)
    private String colorHex;

    @Column(name = "country_name", length = 100)
    private String countryName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private PlayerStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, columnDefinition = "varchar(20)")
    private PlayerType type;

    /** JSON object; holds main_ai and ai_config for AI seats. */
    @Column(name = "meta", columnDefinition = "TEXT")
    private String meta;
}
