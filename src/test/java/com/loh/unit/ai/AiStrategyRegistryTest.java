package com.loh.unit.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.loh.ai.AiStrategy;
import com.loh.ai.AiStrategyRegistry;
import com.loh.ai.AiTurnContext;
import com.loh.ai.randy.RandyAiStrategy;
import com.loh.exception.ResourceNotFoundException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AiStrategyRegistryTest {

    private AiStrategyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AiStrategyRegistry();
    }

    @Test
    @DisplayName("Randy is available out of the box")
    void randyRegistered() {
        assertThat(registry.has("Randy")).isTrue();
        assertThat(registry.list()).containsExactly("Randy");

        AiStrategy strategy = registry.create("Randy", "game-1", "p1", Map.of());

        assertThat(strategy).isInstanceOf(RandyAiStrategy.class);
        assertThat(strategy.getName()).isEqualTo(RandyAiStrategy.NAME);
    }

    @Test
    @DisplayName("names are case-sensitive and null is never registered")
    void lookupRules() {
        assertThat(registry.has("randy")).isFalse();
        assertThat(registry.has(null)).isFalse();
    }

    @Test
    @DisplayName("creating an unknown strategy fails with NOT_FOUND")
    void unknownStrategy() {
        assertThatThrownBy(() -> registry.create("Skynet", "game-1", "p1", Map.of()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Skynet");
    }

    @Test
    @DisplayName("custom strategies can be registered and are listed alphabetically")
    void registerCustom() {
        registry.register("Idle", (gameId, playerId, config) -> new AiStrategy() {
            @Override
            public String getName() {
                return "Idle";
            }

            @Override
            public void takeTurn(AiTurnContext context) {}
        });

        assertThat(registry.list()).containsExactly("Idle", "Randy");
        assertThat(registry.create("Idle", "game-1", "p1", null).getName()).isEqualTo("Idle");
    }
}
