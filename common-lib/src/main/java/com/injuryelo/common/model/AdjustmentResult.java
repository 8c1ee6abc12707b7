package com.injuryelo.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Output of the adjustment calculator for one team. Computed on demand, never persisted.
 *
 * @param teamId            team the adjustment applies to
 * @param rawAdjustment     negated sum of contributions, unclamped
 * @param cappedAdjustment  {@code rawAdjustment} clamped to {@code [-maxCap, 0]}
 * @param contributions     per-player contributions in canonical key order
 * @param computedAt        evaluation timestamp (metadata only)
 */
public record AdjustmentResult(
    int teamId,
    double rawAdjustment,
    double cappedAdjustment,
    List<PlayerContribution> contributions,
    Instant computedAt
) {

    public AdjustmentResult {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public static AdjustmentResult none(int teamId, Instant computedAt) {
        return new AdjustmentResult(teamId, 0.0, 0.0, List.of(), computedAt);
    }

    public boolean wasCapped() {
        return rawAdjustment < cappedAdjustment;
    }

    public long unregisteredPlayers() {
        return contributions.stream().filter(c -> !c.registered()).count();
    }
}
