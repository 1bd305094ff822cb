package com.loh.ai;

import com.loh.domain.model.GameState;
import java.util.ArrayList;

/**
 * Produces the view of a game one player is allowed to see.
 *
 * <p>The galaxy currently has no fog of war, so the view is a copy of the full state.
 * Strategies only ever receive the filtered copy, never the shared snapshot.
 */
public final class GameStateFilter {

    private GameStateFilter() {}

    public static GameState forPlayer(GameState state, String playerId) {
        return state.toBuilder()
                .starStates(new ArrayList<>(state.getStarStates()))
                .ships(new ArrayList<>(state.getShips()))
                .players(new ArrayList<>(state.getPlayers()))
                .build();
    }
}
