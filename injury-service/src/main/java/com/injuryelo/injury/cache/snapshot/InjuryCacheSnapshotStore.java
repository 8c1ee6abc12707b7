package com.injuryelo.injury.cache.snapshot;

import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.cache.CacheEntry;

import java.util.Collection;
import java.util.List;

/**
 * Persists cache contents across restarts. Implementations must not throw from
 * {@link #save}: a failed write is logged and the in-memory cache stays authoritative.
 */
public interface InjuryCacheSnapshotStore {

    /** Reports from the last snapshot, or an empty list when none is readable. */
    List<TeamInjuryReport> load();

    void save(Collection<CacheEntry> entries);

    static InjuryCacheSnapshotStore disabled() {
        return new InjuryCacheSnapshotStore() {
            @Override
            public List<TeamInjuryReport> load() {
                return List.of();
            }

            @Override
            public void save(Collection<CacheEntry> entries) {
                // snapshots turned off
            }
        };
    }
}
