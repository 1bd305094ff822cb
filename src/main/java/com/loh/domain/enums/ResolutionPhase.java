package com.loh.domain.enums;

/**
 * Phases of turn resolution, in the order they run.
 */
public enum ResolutionPhase {
    BUILD,
    EXPANSION,
    MOVEMENT
}
