package com.loh.domain.model;

import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.PlayerType;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A seat in a game, human or AI.
 *
 * <p>{@code meta} carries the AI assignment: {@code main_ai} names a registered strategy
 * and {@code ai_config} holds its tuning map.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Player {

    public static final String META_MAIN_AI = "main_ai";
    public static final String META_AI_CONFIG = "ai_config";

    private String id;
    private String gameId;
    private String userId;
    private String name;
    private String colorHex;
    private String countryName;
    private PlayerStatus status;
    private PlayerType type;
    private Map<String, Object> meta;

    /** Name of the AI strategy driving this player, or null for a human-controlled seat. */
    public String getAiName() {
        if (meta == null) {
            return null;
        }
        Object value = meta.get(META_MAIN_AI);
        return value instanceof String name && !name.isBlank() ? name : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getAiConfig() {
        if (meta == null) {
            return Map.of();
        }
        Object value = meta.get(META_AI_CONFIG);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
