package com.injuryelo.injury.service;

import com.injuryelo.injury.client.FetchError;

public record LeagueRefreshResult(
    int teamsUpdated,
    int teamsWithInjuries,
    int skippedEntries,
    FetchError error
) {

    public static LeagueRefreshResult failed(FetchError error) {
        return new LeagueRefreshResult(0, 0, 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
