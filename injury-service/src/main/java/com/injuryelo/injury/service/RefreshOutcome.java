package com.injuryelo.injury.service;

import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.client.FetchError;

/**
 * What a single-team refresh produced. Exactly one of {@code report} and {@code error}
 * is non-null.
 */
public record RefreshOutcome(int teamId, TeamInjuryReport report, FetchError error) {

    public static RefreshOutcome success(TeamInjuryReport report) {
        return new RefreshOutcome(report.teamId(), report, null);
    }

    public static RefreshOutcome failed(int teamId, FetchError error) {
        return new RefreshOutcome(teamId, null, error);
    }

    public boolean succeeded() {
        return report != null;
    }
}
