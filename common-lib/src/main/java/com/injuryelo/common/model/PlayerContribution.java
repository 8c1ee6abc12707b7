package com.injuryelo.common.model;

/**
 * The Elo cost attributed to one (deduplicated) injury listing.
 *
 * @param record       the listing that survived deduplication
 * @param canonicalKey normalized player key used for deduplication
 * @param tier         resolved tier
 * @param multiplier   tier multiplier applied
 * @param registered   {@code false} when the player was not in the registry and defaulted
 * @param contribution {@code statusWeight × multiplier × baseMagnitude}, always {@code >= 0}
 */
public record PlayerContribution(
    InjuryRecord record,
    String canonicalKey,
    PlayerTier tier,
    double multiplier,
    boolean registered,
    double contribution
) {}
