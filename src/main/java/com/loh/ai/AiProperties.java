package com.loh.ai;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for computer players under the {@code loh.ai} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- run AI players automatically when a game starts or a turn advances</li>
 *   <li>{@code interPlayerDelayMs} -- pause between consecutive AI players of one game</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "loh.ai")
public class AiProperties {

    private boolean enabled = true;
    private long interPlayerDelayMs = 100;
}
