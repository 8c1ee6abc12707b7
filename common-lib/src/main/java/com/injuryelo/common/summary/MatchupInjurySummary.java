package com.injuryelo.common.summary;

import java.util.List;

/**
 * Human-readable injury context for a single game.
 *
 * @param homeInjuries  {@code "Player (Status)"} labels for the home side
 * @param awayInjuries  labels for the away side
 * @param homeSeverity  sum of home status weights
 * @param awaySeverity  sum of away status weights
 * @param advantage     healthier side, {@link HealthAdvantage#EVEN} when severities are close
 */
public record MatchupInjurySummary(
    int homeTeamId,
    int awayTeamId,
    List<String> homeInjuries,
    List<String> awayInjuries,
    double homeSeverity,
    double awaySeverity,
    HealthAdvantage advantage
) {

    public MatchupInjurySummary {
        homeInjuries = List.copyOf(homeInjuries);
        awayInjuries = List.copyOf(awayInjuries);
    }
}
