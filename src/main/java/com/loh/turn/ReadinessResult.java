package com.loh.turn;

/**
 * Result of marking a player as done with the open turn.
 *
 * @param remainingPlayers participating players still composing orders
 * @param resolutionClaimed true only for the single caller that moved the turn to RESOLVING
 */
public record ReadinessResult(
        String playerId, boolean allPlayersWaiting, long remainingPlayers, boolean resolutionClaimed) {}
