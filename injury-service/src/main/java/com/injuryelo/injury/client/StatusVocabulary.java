package com.injuryelo.injury.client;

import com.injuryelo.common.model.InjuryStatus;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps feed status strings to {@link InjuryStatus}. Lookups are case-insensitive and
 * whitespace-trimmed; anything unmapped (or absent) resolves to {@code AVAILABLE}.
 */
public final class StatusVocabulary {

    private final Map<String, InjuryStatus> mapping;

    public StatusVocabulary(Map<String, InjuryStatus> mapping) {
        Map<String, InjuryStatus> copy = new HashMap<>();
        mapping.forEach((raw, status) -> copy.put(key(raw), status));
        this.mapping = Collections.unmodifiableMap(copy);
    }

    public InjuryStatus resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return InjuryStatus.AVAILABLE;
        }
        return mapping.getOrDefault(key(raw), InjuryStatus.AVAILABLE);
    }

    public boolean isKnown(String raw) {
        return raw != null && mapping.containsKey(key(raw));
    }

    private static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
