package com.injuryelo.common.classifier;

import com.injuryelo.common.model.PlayerImportanceEntry;
import com.injuryelo.common.model.PlayerTier;

import java.util.Objects;

/**
 * Maps a reported player name to an impact tier and its multiplier.
 *
 * <p>Lookup is exact on the canonical key produced by {@link PlayerRegistry#canonicalKey}.
 * A miss resolves to {@link PlayerTier#STARTER}, not {@link PlayerTier#BENCH}, so an
 * unlisted rotation player who is injured is never under-weighted. Callers that want to
 * surface the miss read {@link PlayerClassification#registered()}.
 *
 * <p>Deterministic, no I/O, never throws for any input including {@code null}.
 */
public final class PlayerImportanceClassifier {

    static final PlayerTier DEFAULT_TIER = PlayerTier.STARTER;

    private final PlayerRegistry registry;

    public PlayerImportanceClassifier(PlayerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public String normalize(String name) {
        return registry.canonicalKey(name);
    }

    public PlayerClassification classify(String name) {
        String key = registry.canonicalKey(name);
        PlayerImportanceEntry entry = registry.find(key);
        if (entry == null) {
            return new PlayerClassification(key, DEFAULT_TIER, registry.multiplier(DEFAULT_TIER), false);
        }
        return new PlayerClassification(key, entry.tier(), entry.multiplier(), true);
    }

    public boolean isAllStar(String name) {
        return classify(name).tier() == PlayerTier.ALL_STAR;
    }

    public PlayerRegistry registry() {
        return registry;
    }
}
