package com.injuryelo.injury.cache;

import com.injuryelo.common.model.TeamInjuryReport;

/**
 * Result of {@link InjuryCache#get(int)}. {@code entry} is {@code null} exactly when
 * {@code state} is {@code MISS}.
 */
public record CacheLookup(int teamId, CacheState state, CacheEntry entry) {

    public static CacheLookup miss(int teamId) {
        return new CacheLookup(teamId, CacheState.MISS, null);
    }

    public TeamInjuryReport report() {
        return entry == null ? null : entry.report();
    }

    public boolean isUsable() {
        return state == CacheState.FRESH || state == CacheState.STALE;
    }
}
