package com.loh.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the wormhole table. Endpoints are stored with star_a_id &lt; star_b_id.
 */
@Entity
@Table(name = "wormhole")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WormholeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "star_a_id", length = 36, nullable = false)
    private String starAId;

    @Column(name = "star_b_id", length = 36, nullable = false)
    private String starBId;
}
