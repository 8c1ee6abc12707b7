package com.injuryelo.common.classifier;

import com.injuryelo.common.model.PlayerImportanceEntry;
import com.injuryelo.common.model.PlayerTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of seeded player importance entries plus the alias table.
 *
 * <p>Both maps are keyed by normalized name. A registry is built once from seeds and
 * injected into {@link PlayerImportanceClassifier}; replacing it means building a new
 * instance, never mutating this one.
 */
public final class PlayerRegistry {

    private final Map<String, PlayerImportanceEntry> entries;
    private final Map<String, String> aliases;
    private final Map<PlayerTier, Double> tierMultipliers;

    private PlayerRegistry(Map<String, PlayerImportanceEntry> entries,
                           Map<String, String> aliases,
                           Map<PlayerTier, Double> tierMultipliers) {
        this.entries = Collections.unmodifiableMap(entries);
        this.aliases = Collections.unmodifiableMap(aliases);
        this.tierMultipliers = Collections.unmodifiableMap(tierMultipliers);
    }

    /**
     * @param seeds           display name → tier
     * @param aliases         alias spelling → canonical display name (both normalized here)
     * @param tierMultipliers multiplier per tier; must cover every {@link PlayerTier}
     */
    public static PlayerRegistry of(Map<String, PlayerTier> seeds,
                                    Map<String, String> aliases,
                                    Map<PlayerTier, Double> tierMultipliers) {
        Map<PlayerTier, Double> multipliers = new EnumMap<>(PlayerTier.class);
        for (PlayerTier tier : PlayerTier.values()) {
            multipliers.put(tier, Objects.requireNonNull(tierMultipliers.get(tier),
                "missing multiplier for tier " + tier));
        }

        Map<String, PlayerImportanceEntry> entries = new LinkedHashMap<>();
        seeds.forEach((name, tier) -> {
            String key = PlayerNameNormalizer.normalize(name);
            if (!key.isEmpty()) {
                entries.put(key, new PlayerImportanceEntry(key, name.trim(), tier, multipliers.get(tier)));
            }
        });

        Map<String, String> aliasKeys = new LinkedHashMap<>();
        aliases.forEach((alias, canonical) -> {
            String from = PlayerNameNormalizer.normalize(alias);
            String to = PlayerNameNormalizer.normalize(canonical);
            if (!from.isEmpty() && !to.isEmpty() && !from.equals(to)) {
                aliasKeys.put(from, to);
            }
        });
        return new PlayerRegistry(entries, aliasKeys, multipliers);
    }

    public static PlayerRegistry empty(Map<PlayerTier, Double> tierMultipliers) {
        return of(Map.of(), Map.of(), tierMultipliers);
    }

    /** Normalizes {@code name} and follows one alias hop. */
    public String canonicalKey(String name) {
        String key = PlayerNameNormalizer.normalize(name);
        return aliases.getOrDefault(key, key);
    }

    public PlayerImportanceEntry find(String canonicalKey) {
        return entries.get(canonicalKey);
    }

    public double multiplier(PlayerTier tier) {
        return tierMultipliers.get(tier);
    }

    public int size() {
        return entries.size();
    }

    public int aliasCount() {
        return aliases.size();
    }

    public long count(PlayerTier tier) {
        return entries.values().stream().filter(e -> e.tier() == tier).count();
    }
}
