package com.injuryelo.injury.registry;

import com.injuryelo.common.classifier.PlayerImportanceClassifier;
import com.injuryelo.common.classifier.PlayerRegistry;
import com.injuryelo.common.model.PlayerTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the classifier currently in use. {@link #reload()} builds a complete new registry
 * and swaps it in atomically; a computation already running keeps the classifier it
 * started with.
 */
public class PlayerRegistryProvider {

    private static final Logger log = LoggerFactory.getLogger(PlayerRegistryProvider.class);

    private final Supplier<PlayerRegistry> source;
    private final AtomicReference<PlayerImportanceClassifier> current = new AtomicReference<>();

    /** Loads eagerly so a bad seed file fails startup. */
    public PlayerRegistryProvider(Supplier<PlayerRegistry> source) {
        this.source = source;
        install(source.get());
    }

    public PlayerImportanceClassifier classifier() {
        return current.get();
    }

    /**
     * Re-reads the seed files. On failure the previous registry stays active and the
     * error propagates to the caller.
     */
    public PlayerRegistry reload() {
        PlayerRegistry registry = source.get();
        install(registry);
        return registry;
    }

    private void install(PlayerRegistry registry) {
        current.set(new PlayerImportanceClassifier(registry));
        log.info("Player registry installed. players={} allStars={} starters={} bench={} aliases={}",
                 registry.size(), registry.count(PlayerTier.ALL_STAR), registry.count(PlayerTier.STARTER),
                 registry.count(PlayerTier.BENCH), registry.aliasCount());
    }
}
