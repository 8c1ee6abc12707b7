package com.injuryelo.injury.cache;

import com.injuryelo.common.model.TeamInjuryReport;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One cached report. Both deadlines derive from {@code report.fetchedAt()}; neither can be
 * set independently.
 */
public final class CacheEntry {

    private final TeamInjuryReport report;
    private final Instant expiresAt;
    private final Instant hardExpiresAt;

    private CacheEntry(TeamInjuryReport report, Instant expiresAt, Instant hardExpiresAt) {
        this.report        = report;
        this.expiresAt     = expiresAt;
        this.hardExpiresAt = hardExpiresAt;
    }

    public static CacheEntry of(TeamInjuryReport report, Duration ttl, Duration hardCeiling) {
        Objects.requireNonNull(report, "report");
        return new CacheEntry(report, report.fetchedAt().plus(ttl), report.fetchedAt().plus(hardCeiling));
    }

    public CacheState state(Instant now) {
        if (now.isBefore(expiresAt)) {
            return CacheState.FRESH;
        }
        if (now.isBefore(hardExpiresAt)) {
            return CacheState.STALE;
        }
        return CacheState.EXPIRED;
    }

    public Duration age(Instant now) {
        Duration age = Duration.between(report.fetchedAt(), now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public int teamId() {
        return report.teamId();
    }

    public TeamInjuryReport report() {
        return report;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant hardExpiresAt() {
        return hardExpiresAt;
    }
}
