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
 * JPA entity for the star table (static galaxy topology). The primary key is a
 * surrogate; {@code star_id} is the id the rest of the game refers to.
 */
@Entity
@Table(name = "star")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StarEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "game_id", length = 36, nullable = false)
    private String gameId;

    @Column(name = "star_id", length = 36, nullable = false)
    private String starId;

    @Column(length = 100)
    private String name;

    @Column(name = "pos_x")
    private double posX;

    @Column(name = "pos_y")
    private double posY;

    @Column(name = "pos_z")
    private double posZ;

    private double resource;
}
