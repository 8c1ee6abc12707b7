package com.injuryelo.injury.registry;

import com.injuryelo.common.classifier.PlayerRegistry;
import com.injuryelo.common.exception.ConfigurationException;
import com.injuryelo.common.model.PlayerTier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the player seed and alias CSV files into a {@link PlayerRegistry}.
 *
 * <p>Seeds are {@code name,tier} rows; aliases are {@code alias,canonical} rows. Lines
 * that are blank or start with {@code #} are ignored. Any other malformed row fails the
 * whole load.
 */
public class PlayerRegistryLoader {

    private final ResourceLoader resourceLoader;
    private final String playersLocation;
    private final String aliasesLocation;
    private final Map<PlayerTier, Double> tierMultipliers;

    public PlayerRegistryLoader(ResourceLoader resourceLoader, String playersLocation, String aliasesLocation,
                                Map<PlayerTier, Double> tierMultipliers) {
        this.resourceLoader  = resourceLoader;
        this.playersLocation = playersLocation;
        this.aliasesLocation = aliasesLocation;
        this.tierMultipliers = tierMultipliers;
    }

    public PlayerRegistry load() {
        Map<String, PlayerTier> seeds = new LinkedHashMap<>();
        readRows(playersLocation, "registry.players", (cols, where) -> {
            try {
                seeds.put(cols[0], PlayerTier.valueOf(cols[1].toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("registry.players", where + ": unknown tier '" + cols[1] + "'", e);
            }
        });

        Map<String, String> aliases = new LinkedHashMap<>();
        readRows(aliasesLocation, "registry.aliases", (cols, where) -> aliases.put(cols[0], cols[1]));

        return PlayerRegistry.of(seeds, aliases, tierMultipliers);
    }

    @FunctionalInterface
    private interface RowHandler {
        void accept(String[] cols, String where);
    }

    private void readRows(String location, String property, RowHandler handler) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException(property, "resource not found: " + location);
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] cols = trimmed.split(",", -1);
                String where = location + " line " + lineNo;
                if (cols.length != 2 || cols[0].isBlank() || cols[1].isBlank()) {
                    throw new ConfigurationException(property, where + ": expected 2 non-blank columns");
                }
                cols[0] = cols[0].trim();
                cols[1] = cols[1].trim();
                handler.accept(cols, where);
            }
        } catch (IOException e) {
            throw new ConfigurationException(property, "cannot read " + location, e);
        }
    }
}
