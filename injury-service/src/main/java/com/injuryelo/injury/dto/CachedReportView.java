package com.injuryelo.injury.dto;

import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.cache.CacheLookup;
import com.injuryelo.injury.cache.CacheState;

import java.time.Instant;

public record CachedReportView(
    int teamId,
    CacheState state,
    Instant expiresAt,
    TeamInjuryReport report
) {

    public static CachedReportView from(CacheLookup lookup) {
        return new CachedReportView(lookup.teamId(), lookup.state(),
            lookup.entry() == null ? null : lookup.entry().expiresAt(), lookup.report());
    }
}
