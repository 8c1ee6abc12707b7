package com.injuryelo.injury.client;

/**
 * What a fetch is meant to cover: the whole league, or a single team.
 *
 * <p>The ESPN endpoint only serves league-wide listings, so a team scope narrows what
 * the normalizer keeps rather than what goes over the wire.
 */
public record FeedScope(Integer teamId) {

    private static final FeedScope LEAGUE = new FeedScope(null);

    public static FeedScope league() {
        return LEAGUE;
    }

    public static FeedScope team(int teamId) {
        return new FeedScope(teamId);
    }

    public boolean isLeague() {
        return teamId == null;
    }

    public boolean covers(int candidateTeamId) {
        return teamId == null || teamId == candidateTeamId;
    }

    @Override
    public String toString() {
        return isLeague() ? "league" : "team:" + teamId;
    }
}
