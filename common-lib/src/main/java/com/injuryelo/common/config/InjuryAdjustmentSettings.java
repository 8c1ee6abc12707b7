package com.injuryelo.common.config;

import com.injuryelo.common.exception.ConfigurationException;
import com.injuryelo.common.model.InjuryStatus;
import com.injuryelo.common.model.PlayerTier;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of every tunable used by the injury adjustment subsystem.
 *
 * <p>Built once at process start. The compact constructor validates every value and
 * throws {@link ConfigurationException} on the first violation, so an invalid
 * configuration can never reach the prediction path.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>every {@link PlayerTier} has a multiplier {@code > 0}</li>
 *   <li>every {@link InjuryStatus} except {@code AVAILABLE} has a weight in {@code [0, 1]};
 *       {@code AVAILABLE} is pinned to {@code 0.0}</li>
 *   <li>{@code baseMagnitude >= 0}, {@code maxAdjustmentCap >= 0},
 *       {@code minimumAdjustment >= 0}</li>
 *   <li>{@code cacheTtl > 0} and {@code hardCeiling >= cacheTtl}</li>
 * </ul>
 */
public record InjuryAdjustmentSettings(
    Map<PlayerTier, Double> tierMultipliers,
    Map<InjuryStatus, Double> statusWeights,
    double baseMagnitude,
    double maxAdjustmentCap,
    double minimumAdjustment,
    Duration cacheTtl,
    Duration hardCeiling,
    boolean enabled
) {

    public static final double DEFAULT_BASE_MAGNITUDE = 20.0;
    public static final double DEFAULT_MAX_ADJUSTMENT_CAP = 100.0;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(4);
    public static final Duration DEFAULT_HARD_CEILING = Duration.ofHours(24);

    public InjuryAdjustmentSettings {
        tierMultipliers = validateTiers(tierMultipliers);
        statusWeights = validateWeights(statusWeights);
        requireFiniteNonNegative("base-magnitude", baseMagnitude);
        requireFiniteNonNegative("max-adjustment-cap", maxAdjustmentCap);
        requireFiniteNonNegative("min-adjustment", minimumAdjustment);
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new ConfigurationException("cache.ttl-seconds", "must be positive but was " + cacheTtl);
        }
        if (hardCeiling == null || hardCeiling.compareTo(cacheTtl) < 0) {
            throw new ConfigurationException("cache.hard-ceiling-seconds",
                "must be >= cache TTL (" + cacheTtl.toSeconds() + "s) but was " + hardCeiling);
        }
    }

    /** Stock tuning: 20 Elo per severity point, cap 100, TTL 4h, ceiling 24h. */
    public static InjuryAdjustmentSettings defaults() {
        return new InjuryAdjustmentSettings(defaultTierMultipliers(), defaultStatusWeights(),
            DEFAULT_BASE_MAGNITUDE, DEFAULT_MAX_ADJUSTMENT_CAP, 0.0,
            DEFAULT_CACHE_TTL, DEFAULT_HARD_CEILING, true);
    }

    public static Map<PlayerTier, Double> defaultTierMultipliers() {
        Map<PlayerTier, Double> tiers = new EnumMap<>(PlayerTier.class);
        tiers.put(PlayerTier.ALL_STAR, 2.5);
        tiers.put(PlayerTier.STARTER, 1.5);
        tiers.put(PlayerTier.BENCH, 1.0);
        return tiers;
    }

    public static Map<InjuryStatus, Double> defaultStatusWeights() {
        Map<InjuryStatus, Double> weights = new EnumMap<>(InjuryStatus.class);
        weights.put(InjuryStatus.OUT, 1.0);
        weights.put(InjuryStatus.DOUBTFUL, 0.75);
        weights.put(InjuryStatus.QUESTIONABLE, 0.5);
        weights.put(InjuryStatus.PROBABLE, 0.25);
        weights.put(InjuryStatus.AVAILABLE, 0.0);
        return weights;
    }

    public double tierMultiplier(PlayerTier tier) {
        return tierMultipliers.get(tier);
    }

    public double statusWeight(InjuryStatus status) {
        return statusWeights.get(status);
    }

    public InjuryAdjustmentSettings withEnabled(boolean flag) {
        return new InjuryAdjustmentSettings(tierMultipliers, statusWeights, baseMagnitude,
            maxAdjustmentCap, minimumAdjustment, cacheTtl, hardCeiling, flag);
    }

    // ── validation ───────────────────────────────────────────────────────────

    private static Map<PlayerTier, Double> validateTiers(Map<PlayerTier, Double> input) {
        if (input == null) {
            throw new ConfigurationException("tier-multipliers", "must be provided");
        }
        Map<PlayerTier, Double> copy = new EnumMap<>(PlayerTier.class);
        for (PlayerTier tier : PlayerTier.values()) {
            Double value = input.get(tier);
            String property = "tier-multipliers." + kebab(tier.name());
            if (value == null) {
                throw new ConfigurationException(property, "is missing");
            }
            if (value.isNaN() || value.isInfinite() || value <= 0.0) {
                throw new ConfigurationException(property, "must be a positive number but was " + value);
            }
            copy.put(tier, value);
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<InjuryStatus, Double> validateWeights(Map<InjuryStatus, Double> input) {
        if (input == null) {
            throw new ConfigurationException("status-weights", "must be provided");
        }
        Map<InjuryStatus, Double> copy = new EnumMap<>(InjuryStatus.class);
        for (InjuryStatus status : InjuryStatus.values()) {
            if (status == InjuryStatus.AVAILABLE) {
                copy.put(status, 0.0);
                continue;
            }
            Double value = input.get(status);
            String property = "status-weights." + kebab(status.name());
            if (value == null) {
                throw new ConfigurationException(property, "is missing");
            }
            if (value.isNaN() || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(property, "must be within [0,1] but was " + value);
            }
            copy.put(status, value);
        }
        return Collections.unmodifiableMap(copy);
    }

    private static void requireFiniteNonNegative(String property, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
            throw new ConfigurationException(property, "must be a finite number >= 0 but was " + value);
        }
    }

    private static String kebab(String enumName) {
        return enumName.toLowerCase().replace('_', '-');
    }
}
