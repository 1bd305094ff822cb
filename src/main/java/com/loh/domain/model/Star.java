package com.loh.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static star in a game's galaxy. Position and resource never change after setup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Star {

    private String id;
    private String name;
    private double posX;
    private double posY;
    private double posZ;
    private double resource;
}
