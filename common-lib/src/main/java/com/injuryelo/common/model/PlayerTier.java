package com.injuryelo.common.model;

/**
 * Expected marginal impact of a player on team strength when absent.
 * Unregistered players resolve to {@link #STARTER}.
 */
public enum PlayerTier {
    ALL_STAR,
    STARTER,
    BENCH
}
