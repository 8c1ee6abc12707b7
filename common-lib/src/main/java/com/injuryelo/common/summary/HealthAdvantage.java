package com.injuryelo.common.summary;

/** Which side of a matchup is healthier. */
public enum HealthAdvantage {
    HOME,
    AWAY,
    EVEN
}
