package com.loh.ai;

/**
 * A computer player. Instances are plain objects created per turn by the
 * {@link AiStrategyRegistry}; they receive everything they need through the context.
 */
public interface AiStrategy {

    String getName();

    /**
     * Plans the turn and submits draft orders through the context. Must not end the turn;
     * the executor does that once this returns normally.
     */
    void takeTurn(AiTurnContext context);
}
