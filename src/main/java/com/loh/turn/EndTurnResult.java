package com.loh.turn;

import com.loh.domain.model.Turn;
import com.loh.resolution.ResolutionResult;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of a player ending their turn. {@code resolution} and {@code nextTurn} are only
 * set for the call that completed the set of ready players and triggered resolution.
 */
@Getter
@Builder
public class EndTurnResult {

    private final String gameId;
    private final String playerId;
    private final int turnNumber;
    private final int ordersFinalized;
    private final boolean allPlayersWaiting;
    private final long remainingPlayers;
    private final ResolutionResult resolution;
    private final Turn nextTurn;

    public boolean isResolutionTriggered() {
        return resolution != null;
    }
}
