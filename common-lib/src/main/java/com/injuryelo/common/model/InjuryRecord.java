package com.injuryelo.common.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single normalized injury listing. Created fresh on every fetch and never mutated.
 *
 * @param playerName  player name as reported by the feed
 * @param teamId      team the feed attributes the player to
 * @param status      internal status
 * @param statusWeight severity weight in {@code [0, 1]}
 * @param bodyPart    injured body part, {@code null} when the feed omits it
 * @param observedAt  when the feed reported the listing
 * @param reportedStatus status text exactly as the feed printed it; defaults to the internal label
 */
public record InjuryRecord(
    String playerName,
    int teamId,
    InjuryStatus status,
    double statusWeight,
    String bodyPart,
    Instant observedAt,
    String reportedStatus
) {

    public InjuryRecord {
        if (playerName == null || playerName.isBlank()) {
            throw new IllegalArgumentException("playerName must not be blank");
        }
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(observedAt, "observedAt");
        if (Double.isNaN(statusWeight) || statusWeight < 0.0 || statusWeight > 1.0) {
            throw new IllegalArgumentException("statusWeight must be within [0,1] but was " + statusWeight);
        }
        if (reportedStatus == null || reportedStatus.isBlank()) {
            reportedStatus = status.label();
        }
    }

    public InjuryRecord(String playerName, int teamId, InjuryStatus status, double statusWeight,
                        String bodyPart, Instant observedAt) {
        this(playerName, teamId, status, statusWeight, bodyPart, observedAt, null);
    }

    /** {@code "LeBron James (Day-To-Day)"} style label used by summaries, in the feed's wording. */
    public String describe() {
        return playerName + " (" + reportedStatus + ")";
    }
}
