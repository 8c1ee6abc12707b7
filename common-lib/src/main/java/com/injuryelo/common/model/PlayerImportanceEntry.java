package com.injuryelo.common.model;

/**
 * One seeded row of the player importance registry.
 *
 * @param canonicalKey normalized player key (see {@code PlayerNameNormalizer})
 * @param displayName  name as seeded, kept for logs and summaries
 * @param tier         impact tier
 * @param multiplier   tier multiplier resolved from configuration when the registry was built
 */
public record PlayerImportanceEntry(
    String canonicalKey,
    String displayName,
    PlayerTier tier,
    double multiplier
) {}
