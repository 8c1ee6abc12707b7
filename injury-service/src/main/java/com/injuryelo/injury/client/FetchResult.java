package com.injuryelo.injury.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one feed call: either a raw payload or a {@link FetchError}, never both.
 */
public record FetchResult(FeedScope scope, JsonNode payload, FetchError error, Instant fetchedAt) {

    public FetchResult {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if ((payload == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of payload or error must be set");
        }
    }

    public static FetchResult success(FeedScope scope, JsonNode payload, Instant fetchedAt) {
        return new FetchResult(scope, payload, null, fetchedAt);
    }

    public static FetchResult failure(FeedScope scope, FetchError error, Instant fetchedAt) {
        return new FetchResult(scope, null, error, fetchedAt);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
