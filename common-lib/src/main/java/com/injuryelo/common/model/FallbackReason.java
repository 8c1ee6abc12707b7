package com.injuryelo.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an adjusted Elo equals (or partly relies on) data other than a fresh report.
 * Consumed downstream as a confidence/metadata flag.
 */
public enum FallbackReason {
    NONE("none"),
    NO_DATA("no_data"),
    STALE_REFRESH_FAILED("stale_refresh_failed"),
    DISABLED("disabled"),
    CALCULATION_FAILED("calculation_failed");

    private final String code;

    FallbackReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isDegraded() {
        return this != NONE;
    }
}
