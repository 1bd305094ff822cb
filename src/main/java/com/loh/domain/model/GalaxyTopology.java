package com.loh.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stars and wormholes of one game. Immutable once the game has started.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GalaxyTopology {

    @Builder.Default
    private List<Star> stars = new ArrayList<>();

    @Builder.Default
    private List<Wormhole> wormholes = new ArrayList<>();

    /** Stars directly reachable from {@code starId}, in wormhole order. */
    public List<String> adjacentStarIds(String starId) {
        List<String> adjacent = new ArrayList<>();
        for (Wormhole wormhole : wormholes) {
            String other = wormhole.otherEnd(starId);
            if (other != null && !adjacent.contains(other)) {
                adjacent.add(other);
            }
        }
        return adjacent;
    }

    public boolean areAdjacent(String fromStarId, String toStarId) {
        return toStarId != null && adjacentStarIds(fromStarId).contains(toStarId);
    }
}
