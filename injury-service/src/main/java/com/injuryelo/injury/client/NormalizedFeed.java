package com.injuryelo.injury.client;

import com.injuryelo.common.model.TeamInjuryReport;

import java.util.Map;
import java.util.Optional;

/**
 * Reports built from one payload, keyed by team id, plus counts of what was dropped.
 */
public record NormalizedFeed(
    Map<Integer, TeamInjuryReport> reports,
    int skippedEntries,
    int unknownTeams
) {

    public NormalizedFeed {
        reports = Map.copyOf(reports);
    }

    public Optional<TeamInjuryReport> report(int teamId) {
        return Optional.ofNullable(reports.get(teamId));
    }
}
