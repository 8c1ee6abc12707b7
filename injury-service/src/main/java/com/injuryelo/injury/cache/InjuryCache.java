package com.injuryelo.injury.cache;

import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.cache.snapshot.InjuryCacheSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * In-memory cache of team injury reports, one entry per team id.
 *
 * <p>Entries move FRESH → STALE → EXPIRED as the clock passes {@code fetchedAt + ttl} and
 * {@code fetchedAt + hardCeiling}. An expired entry is evicted when read and reported as a
 * miss. A write never replaces an entry with an older report, so concurrent refreshes
 * finishing out of order cannot regress a team.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. No blocking calls except the optional
 * snapshot write in {@link #put}, which callers run off the event loop. Snapshot writes are
 * serialized with the copy they write, so a later write always carries the later map.
 */
public class InjuryCache {

    private static final Logger log = LoggerFactory.getLogger(InjuryCache.class);

    private final ConcurrentHashMap<Integer, CacheEntry> store = new ConcurrentHashMap<>();

    private final Clock clock;
    private final Duration ttl;
    private final Duration hardCeiling;
    private final InjuryCacheSnapshotStore snapshotStore;

    public InjuryCache(InjuryAdjustmentSettings settings, Clock clock, InjuryCacheSnapshotStore snapshotStore) {
        this.clock         = clock;
        this.ttl           = settings.cacheTtl();
        this.hardCeiling   = settings.hardCeiling();
        this.snapshotStore = snapshotStore;
    }

    /**
     * Loads the last snapshot, keeping only entries still within the hard ceiling.
     *
     * @return number of entries restored
     */
    public int restore() {
        Instant now = clock.instant();
        int restored = 0;
        for (TeamInjuryReport report : snapshotStore.load()) {
            CacheEntry entry = CacheEntry.of(report, ttl, hardCeiling);
            if (entry.state(now) == CacheState.EXPIRED) {
                continue;
            }
            if (storeIfNewer(entry)) {
                restored++;
            }
        }
        log.info("CACHE_RESTORE entries={}", restored);
        return restored;
    }

    public CacheLookup get(int teamId) {
        CacheEntry entry = store.get(teamId);
        if (entry == null) {
            log.debug("CACHE_MISS teamId={}", teamId);
            return CacheLookup.miss(teamId);
        }
        CacheState state = entry.state(clock.instant());
        if (state == CacheState.EXPIRED) {
            store.remove(teamId, entry);
            log.debug("CACHE_MISS teamId={} evicted=expired", teamId);
            return CacheLookup.miss(teamId);
        }
        log.debug("CACHE_HIT teamId={} state={}", teamId, state);
        return new CacheLookup(teamId, state, entry);
    }

    /**
     * Stores {@code report} for its team unless the cached report is newer.
     *
     * @return {@code true} if the report was stored
     */
    public boolean put(TeamInjuryReport report) {
        CacheEntry candidate = CacheEntry.of(report, ttl, hardCeiling);
        boolean stored = storeIfNewer(candidate);
        if (stored) {
            log.info("CACHE_REFRESH teamId={} injuries={} ttlSeconds={}",
                     report.teamId(), report.records().size(), ttl.toSeconds());
            persistSnapshot();
        } else {
            log.debug("CACHE_REFRESH_IGNORED teamId={} reason=older_than_cached fetchedAt={}",
                      report.teamId(), report.fetchedAt());
        }
        return stored;
    }

    /** Stores several reports with a single snapshot write. */
    public int putAll(List<TeamInjuryReport> reports) {
        int stored = 0;
        for (TeamInjuryReport report : reports) {
            if (storeIfNewer(CacheEntry.of(report, ttl, hardCeiling))) {
                stored++;
            }
        }
        if (stored > 0) {
            log.info("CACHE_REFRESH teams={} ttlSeconds={}", stored, ttl.toSeconds());
            persistSnapshot();
        }
        return stored;
    }

    public boolean clear(int teamId) {
        boolean removed = store.remove(teamId) != null;
        if (removed) {
            log.info("CACHE_CLEAR teamId={}", teamId);
            persistSnapshot();
        }
        return removed;
    }

    public int clearAll() {
        int size = store.size();
        store.clear();
        log.info("CACHE_CLEAR_ALL entries={}", size);
        persistSnapshot();
        return size;
    }

    /** Drops every entry past the hard ceiling. */
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicBoolean changed = new AtomicBoolean();
        int[] evicted = {0};
        store.forEach((teamId, entry) -> {
            if (entry.state(now) == CacheState.EXPIRED && store.remove(teamId, entry)) {
                evicted[0]++;
                changed.set(true);
            }
        });
        if (changed.get()) {
            log.info("CACHE_EVICT expired={}", evicted[0]);
            persistSnapshot();
        }
        return evicted[0];
    }

    public CacheStats stats(IntSupplier refreshesInFlight) {
        Instant now = clock.instant();
        int fresh = 0;
        int stale = 0;
        int expired = 0;
        long totalAgeSeconds = 0;
        List<CacheEntry> entries = List.copyOf(store.values());
        for (CacheEntry entry : entries) {
            switch (entry.state(now)) {
                case FRESH -> fresh++;
                case STALE -> stale++;
                default -> expired++;
            }
            totalAgeSeconds += entry.age(now).toSeconds();
        }
        double averageAge = entries.isEmpty() ? 0.0 : (double) totalAgeSeconds / entries.size();
        return new CacheStats(entries.size(), fresh, stale, expired, averageAge,
            ttl.toSeconds(), hardCeiling.toSeconds(), refreshesInFlight.getAsInt());
    }

    public int size() {
        return store.size();
    }

    private synchronized void persistSnapshot() {
        snapshotStore.save(List.copyOf(store.values()));
    }

    private boolean storeIfNewer(CacheEntry candidate) {
        CacheEntry result = store.merge(candidate.teamId(), candidate, (existing, incoming) ->
            existing.report().fetchedAt().isAfter(incoming.report().fetchedAt()) ? existing : incoming);
        return result == candidate;
    }
}
