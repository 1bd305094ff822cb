package com.loh.ai;

import com.loh.ai.randy.RandyAiStrategy;
import com.loh.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps AI names (as stored in a player's {@code main_ai} meta key) to strategy factories.
 *
 * <p>Built-in strategies are registered at construction. Names are case-sensitive.
 */
@Component
public class AiStrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(AiStrategyRegistry.class);

    private final Map<String, AiStrategyFactory> factories = new ConcurrentHashMap<>();

    public AiStrategyRegistry() {
        register(RandyAiStrategy.NAME, RandyAiStrategy::new);
    }

    public void register(String name, AiStrategyFactory factory) {
        AiStrategyFactory previous = factories.put(name, factory);
        if (previous != null) {
            log.warn("AI strategy {} re-registered", name);
        }
    }

    public boolean has(String name) {
        return name != null && factories.containsKey(name);
    }

    public List<String> list() {
        List<String> names = new ArrayList<>(factories.keySet());
        names.sort(String::compareTo);
        return names;
    }

    /**
     * @throws ResourceNotFoundException if no strategy is registered under {@code name}
     */
    public AiStrategy create(String name, String gameId, String playerId, Map<String, Object> config) {
        AiStrategyFactory factory = name != null ? factories.get(name) : null;
        if (factory == null) {
            throw new ResourceNotFoundException("AI strategy", name);
        }
        return factory.create(gameId, playerId, config);
    }
}
