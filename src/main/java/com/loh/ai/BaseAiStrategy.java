package com.loh.ai;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common state for AI strategies: the seat they play and their tuning map.
 */
public abstract class BaseAiStrategy implements AiStrategy {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final String gameId;
    protected final String playerId;
    protected final Map<String, Object> config;

    protected BaseAiStrategy(String gameId, String playerId, Map<String, Object> config) {
        this.gameId = gameId;
        this.playerId = playerId;
        this.config = config != null ? config : Map.of();
    }

    public String getGameId() {
        return gameId;
    }

    public String getPlayerId() {
        return playerId;
    }

    /** Numeric tuning value from the config map, or {@code defaultValue} if absent or not a number. */
    protected double configDouble(String key, double defaultValue) {
        Object value = config.get(key);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }
}
