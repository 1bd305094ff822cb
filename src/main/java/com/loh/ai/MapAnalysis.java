package com.loh.ai;

import com.loh.domain.enums.ShipStatus;
import com.loh.domain.model.GameState;
import com.loh.domain.model.Ship;
import com.loh.domain.model.StarState;
import java.util.List;

/**
 * Read-only helpers AI strategies use to reason about a {@link GameState}.
 */
public final class MapAnalysis {

    private MapAnalysis() {}

    public static List<StarState> ownedStars(GameState state, String playerId) {
        return state.getStarStates().stream()
                .filter(star -> playerId.equals(star.getOwnerPlayerId()))
                .toList();
    }

    /** Active ships at a star, any owner. */
    public static List<Ship> activeShipsAt(GameState state, String starId) {
        return state.getShips().stream()
                .filter(ship -> ship.getStatus() == ShipStatus.ACTIVE && starId.equals(ship.getLocationStarId()))
                .toList();
    }

    public static List<Ship> ownActiveShipsAt(GameState state, String starId, String playerId) {
        return activeShipsAt(state, starId).stream()
                .filter(ship -> playerId.equals(ship.getOwnerPlayerId()))
                .toList();
    }

    public static List<String> adjacentStars(GameState state, String starId) {
        return state.getTopology().adjacentStarIds(starId);
    }

    /** Active ships at a star that belong to anyone but {@code playerId}. */
    public static long enemyShipCount(GameState state, String starId, String playerId) {
        return activeShipsAt(state, starId).stream()
                .filter(ship -> !playerId.equals(ship.getOwnerPlayerId()))
                .count();
    }

    /**
     * Friendly-to-enemy ship ratio at a star from {@code playerId}'s point of view.
     * Returns 0 when there are no enemy ships; use {@link #enemyShipCount} to tell an
     * uncontested star from one where the player has no ships yet.
     */
    public static double shipRatio(GameState state, String starId, String playerId) {
        int friendly = 0;
        int enemy = 0;
        for (Ship ship : activeShipsAt(state, starId)) {
            if (playerId.equals(ship.getOwnerPlayerId())) {
                friendly++;
            } else {
                enemy++;
            }
        }
        return enemy == 0 ? 0 : (double) friendly / enemy;
    }
}
