package com.injuryelo.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of every injury listing for one team at fetch time.
 *
 * <p>An empty {@code records} list means the feed listed no injuries for the team,
 * which is a valid healthy-roster report and not a cache miss.
 */
public record TeamInjuryReport(
    int teamId,
    String teamName,
    List<InjuryRecord> records,
    Instant fetchedAt,
    String source
) {

    public TeamInjuryReport {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static TeamInjuryReport empty(int teamId, String teamName, Instant fetchedAt, String source) {
        return new TeamInjuryReport(teamId, teamName, List.of(), fetchedAt, source);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Sum of status weights across all listings. */
    public double totalSeverity() {
        return records.stream().mapToDouble(InjuryRecord::statusWeight).sum();
    }

    public List<InjuryRecord> withStatus(InjuryStatus status) {
        return records.stream().filter(r -> r.status() == status).toList();
    }
}
