package com.injuryelo.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Value handed to the feature pipeline for one team.
 *
 * <p>{@code adjustedElo} always lies within {@code [baselineElo - maxCap, baselineElo]}.
 */
public record AdjustedElo(
    @JsonProperty("teamId") int teamId,
    @JsonProperty("baselineElo") double baselineElo,
    @JsonProperty("adjustedElo") double adjustedElo,
    @JsonProperty("adjustment") double adjustment,
    @JsonProperty("fallbackReason") FallbackReason fallbackReason,
    @JsonProperty("injuriesConsidered") int injuriesConsidered
) {

    public static AdjustedElo applied(int teamId, double baselineElo, AdjustmentResult result,
                                      FallbackReason reason) {
        return new AdjustedElo(teamId, baselineElo, baselineElo + result.cappedAdjustment(),
            result.cappedAdjustment(), reason, result.contributions().size());
    }

    public static AdjustedElo unchanged(int teamId, double baselineElo, FallbackReason reason) {
        return new AdjustedElo(teamId, baselineElo, baselineElo, 0.0, reason, 0);
    }

    @JsonProperty("degraded")
    public boolean degraded() {
        return fallbackReason.isDegraded();
    }
}
