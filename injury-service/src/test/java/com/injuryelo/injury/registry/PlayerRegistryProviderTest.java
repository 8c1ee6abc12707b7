package com.injuryelo.injury.registry;

import com.injuryelo.common.classifier.PlayerImportanceClassifier;
import com.injuryelo.common.classifier.PlayerRegistry;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.exception.ConfigurationException;
import com.injuryelo.common.model.PlayerTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PlayerRegistryProviderTest {

    @TempDir
    Path dir;

    private PlayerRegistryLoader loader(Path players, Path aliases) {
        return new PlayerRegistryLoader(new DefaultResourceLoader(), players.toUri().toString(),
            aliases.toUri().toString(), InjuryAdjustmentSettings.defaultTierMultipliers());
    }

    @Test
    @DisplayName("bundled seed files load the All-Star list and aliases")
    void bundledSeeds() {
        PlayerRegistry registry = new PlayerRegistryLoader(new DefaultResourceLoader(),
            "classpath:registry/players.csv", "classpath:registry/aliases.csv",
            InjuryAdjustmentSettings.defaultTierMultipliers()).load();
        PlayerImportanceClassifier classifier = new PlayerImportanceClassifier(registry);

        assertEquals(47, registry.count(PlayerTier.ALL_STAR));
        assertTrue(classifier.isAllStar("LeBron James"));
        assertTrue(classifier.isAllStar("Nikola Jokić"));
        assertTrue(classifier.isAllStar("Jaren Jackson Jr."));
        assertTrue(classifier.isAllStar("SGA"));
        assertFalse(classifier.isAllStar("Max Christie"));
    }

    @Test
    @DisplayName("reload swaps in the edited registry")
    void reloadSwaps() throws IOException {
        Path players = Files.writeString(dir.resolve("players.csv"), "LeBron James,ALL_STAR\n", StandardCharsets.UTF_8);
        Path aliases = Files.writeString(dir.resolve("aliases.csv"), "# none\n", StandardCharsets.UTF_8);
        PlayerRegistryProvider provider = new PlayerRegistryProvider(loader(players, aliases)::load);
        PlayerImportanceClassifier before = provider.classifier();
        assertFalse(before.isAllStar("Austin Reaves"));

        Files.writeString(players, "LeBron James,ALL_STAR\nAustin Reaves,all-star\n", StandardCharsets.UTF_8);
        PlayerRegistry reloaded = provider.reload();

        assertEquals(2, reloaded.size());
        assertTrue(provider.classifier().isAllStar("Austin Reaves"));
        assertFalse(before.isAllStar("Austin Reaves"), "previous snapshot is unchanged");
    }

    @Test
    @DisplayName("bad reload keeps the previous registry")
    void badReloadKeepsPrevious() throws IOException {
        Path players = Files.writeString(dir.resolve("players.csv"), "LeBron James,ALL_STAR\n", StandardCharsets.UTF_8);
        Path aliases = Files.writeString(dir.resolve("aliases.csv"), "", StandardCharsets.UTF_8);
        PlayerRegistryProvider provider = new PlayerRegistryProvider(loader(players, aliases)::load);
        PlayerImportanceClassifier before = provider.classifier();

        Files.writeString(players, "LeBron James,SUPERSTAR\n", StandardCharsets.UTF_8);

        ConfigurationException ex = assertThrows(ConfigurationException.class, provider::reload);
        assertEquals("registry.players", ex.getProperty());
        assertSame(before, provider.classifier());
    }

    @Test
    @DisplayName("missing seed file fails the load")
    void missingFile() {
        PlayerRegistryLoader loader = loader(dir.resolve("absent.csv"), dir.resolve("absent-aliases.csv"));
        ConfigurationException ex = assertThrows(ConfigurationException.class, loader::load);
        assertEquals("registry.players", ex.getProperty());
    }
}
