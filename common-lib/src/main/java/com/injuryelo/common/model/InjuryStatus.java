package com.injuryelo.common.model;

/**
 * Internal availability status of a listed player, ordered from most to least severe.
 *
 * <p>The numeric weight of each status is not fixed here; it is read from
 * {@link com.injuryelo.common.config.InjuryAdjustmentSettings#statusWeight(InjuryStatus)}.
 * {@link #AVAILABLE} always weighs {@code 0.0}.
 */
public enum InjuryStatus {
    OUT("Out"),
    DOUBTFUL("Doubtful"),
    QUESTIONABLE("Questionable"),
    PROBABLE("Probable"),
    AVAILABLE("Available");

    private final String label;

    InjuryStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
