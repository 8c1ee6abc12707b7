package com.injuryelo.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Both sides of a game after injury adjustment, plus the adjusted Elo difference
 * (home minus away) used as the model's {@code elo_diff} feature.
 */
public record GameEloAdjustment(
    @JsonProperty("home") AdjustedElo home,
    @JsonProperty("away") AdjustedElo away
) {

    @JsonProperty("eloDiff")
    public double eloDiff() {
        return home.adjustedElo() - away.adjustedElo();
    }
}
