package com.injuryelo.injury.cache.snapshot;

import com.injuryelo.common.model.TeamInjuryReport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** On-disk layout of the cache snapshot file. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheSnapshotDocument {

    private int version = 1;
    private Instant savedAt;
    private List<Entry> entries = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private int teamId;
        /** Informational; recomputed from {@code report.fetchedAt} on load. */
        private Instant expiresAt;
        private TeamInjuryReport report;
    }
}
