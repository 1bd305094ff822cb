package com.loh.ai;

import java.util.Map;

@FunctionalInterface
public interface AiStrategyFactory {

    AiStrategy create(String gameId, String playerId, Map<String, Object> config);
}
