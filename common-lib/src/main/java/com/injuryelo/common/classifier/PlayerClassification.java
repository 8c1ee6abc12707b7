package com.injuryelo.common.classifier;

import com.injuryelo.common.model.PlayerTier;

/**
 * Result of classifying one reported player name.
 *
 * @param canonicalKey key after normalization and alias resolution
 * @param tier         resolved tier
 * @param multiplier   tier multiplier
 * @param registered   {@code false} when the name missed the registry and defaulted to STARTER
 */
public record PlayerClassification(
    String canonicalKey,
    PlayerTier tier,
    double multiplier,
    boolean registered
) {}
