package com.loh.turn;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for turn handling under the {@code loh.turn} prefix.
 *
 * <ul>
 *   <li>{@code idleTimeoutMinutes} -- an open turn older than this is ended on behalf of every
 *       player still active; 0 disables idle ending</li>
 *   <li>{@code idleCheckIntervalMs} -- how often the monitor looks for stale and stalled turns</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "loh.turn")
public class TurnEngineConfig {

    private int idleTimeoutMinutes = 0;
    private long idleCheckIntervalMs = 60000;
}
