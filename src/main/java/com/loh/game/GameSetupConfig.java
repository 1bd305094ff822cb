package com.loh.game;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Starting conditions for new games under the {@code loh.setup} prefix: the economy of each
 * home star and the stats of each player's first ship.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "loh.setup")
public class GameSetupConfig {

    private double startingAvailable = 10;
    private double startingIndustry = 1;
    private double startingTechnology = 1;
    private double startingShipHp = 100;
    private double startingShipPower = 10;
}
