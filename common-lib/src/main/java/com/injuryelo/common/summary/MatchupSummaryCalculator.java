package com.injuryelo.common.summary;

import com.injuryelo.common.model.InjuryRecord;
import com.injuryelo.common.model.TeamInjuryReport;

import java.util.List;

/**
 * Builds a {@link MatchupInjurySummary} from the two teams' reports.
 *
 * <p>Severity is the plain sum of status weights (player importance is deliberately
 * ignored here; the Elo adjustment already carries it). A difference below
 * {@value #EVEN_THRESHOLD} is {@link HealthAdvantage#EVEN}; otherwise the side with the
 * lower severity holds the advantage. A {@code null} report counts as no injuries.
 */
public final class MatchupSummaryCalculator {

    static final double EVEN_THRESHOLD = 0.5;

    private MatchupSummaryCalculator() {}

    public static MatchupInjurySummary summarize(int homeTeamId, TeamInjuryReport home,
                                                 int awayTeamId, TeamInjuryReport away) {
        double homeSeverity = home == null ? 0.0 : home.totalSeverity();
        double awaySeverity = away == null ? 0.0 : away.totalSeverity();
        return new MatchupInjurySummary(homeTeamId, awayTeamId, labels(home), labels(away),
            homeSeverity, awaySeverity, resolveAdvantage(homeSeverity, awaySeverity));
    }

    public static HealthAdvantage resolveAdvantage(double homeSeverity, double awaySeverity) {
        double diff = awaySeverity - homeSeverity;
        if (Math.abs(diff) < EVEN_THRESHOLD) {
            return HealthAdvantage.EVEN;
        }
        return diff > 0 ? HealthAdvantage.HOME : HealthAdvantage.AWAY;
    }

    private static List<String> labels(TeamInjuryReport report) {
        if (report == null) {
            return List.of();
        }
        return report.records().stream().map(InjuryRecord::describe).toList();
    }
}
