package com.injuryelo.injury.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * A failed fetch or refresh, carried as a value so callers can fall back without
 * unwinding a reactive chain.
 */
public record FetchError(FetchErrorKind kind, String message) {

    public static FetchError timeout(String message) {
        return new FetchError(FetchErrorKind.TIMEOUT, message);
    }

    public static FetchError unknownTeam(int teamId) {
        return new FetchError(FetchErrorKind.UNKNOWN_TEAM, "team " + teamId + " is not in the team directory");
    }

    public static FetchError parse(String message) {
        return new FetchError(FetchErrorKind.PARSE, message);
    }

    /** Classifies a transport or decoding failure. */
    public static FetchError from(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException || cause instanceof ReadTimeoutException) {
            return new FetchError(FetchErrorKind.TIMEOUT, describe(cause));
        }
        if (cause instanceof WebClientResponseException wcre) {
            return new FetchError(FetchErrorKind.HTTP_STATUS, "HTTP " + wcre.getStatusCode().value());
        }
        if (cause instanceof CodecException || cause instanceof JsonProcessingException
            || cause instanceof IllegalArgumentException) {
            return new FetchError(FetchErrorKind.PARSE, describe(cause));
        }
        if (cause instanceof WebClientRequestException) {
            Throwable root = cause.getCause();
            if (root instanceof TimeoutException || root instanceof ReadTimeoutException) {
                return new FetchError(FetchErrorKind.TIMEOUT, describe(root));
            }
        }
        return new FetchError(FetchErrorKind.NETWORK, describe(cause));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    @Override
    public String toString() {
        return kind + " " + message;
    }
}
