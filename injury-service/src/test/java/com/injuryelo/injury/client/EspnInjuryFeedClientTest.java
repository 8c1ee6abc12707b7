package com.injuryelo.injury.client;

import com.injuryelo.injury.support.FeedPayloads;
import com.injuryelo.injury.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static com.injuryelo.injury.support.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class EspnInjuryFeedClientTest {

    private final MutableClock clock = new MutableClock(T0);

    private EspnInjuryFeedClient client(ExchangeFunction exchange, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://feed.test/nba")
            .exchangeFunction(exchange)
            .build();
        return new EspnInjuryFeedClient(webClient, timeout, clock);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    @DisplayName("200 with JSON body → success carrying the payload")
    void successfulFetch() {
        String json = FeedPayloads.payload().team("Los Angeles Lakers").injury("LeBron James", "Out").json();
        AtomicReference<URI> requested = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            requested.set(request.url());
            return respond(HttpStatus.OK, json).exchange(request);
        };

        FetchResult result = client(exchange, Duration.ofSeconds(1)).fetch(FeedScope.league()).block();

        assertNotNull(result);
        assertTrue(result.isSuccess());
        assertEquals(1, result.payload().path("injuries").size());
        assertEquals(T0, result.fetchedAt());
        assertEquals("/nba/injuries", requested.get().getPath());
    }

    @Test
    @DisplayName("5xx → HTTP_STATUS failure, no exception")
    void serverError() {
        FetchResult result = client(respond(HttpStatus.SERVICE_UNAVAILABLE, "{}"), Duration.ofSeconds(1))
            .fetch(FeedScope.league()).block();

        assertNotNull(result);
        assertFalse(result.isSuccess());
        assertEquals(FetchErrorKind.HTTP_STATUS, result.error().kind());
        assertEquals("HTTP 503", result.error().message());
    }

    @Test
    @DisplayName("no response within the fetch timeout → TIMEOUT failure")
    void timeout() {
        FetchResult result = client(request -> Mono.never(), Duration.ofMillis(100))
            .fetch(FeedScope.team(1610612747)).block(Duration.ofSeconds(5));

        assertNotNull(result);
        assertEquals(FetchErrorKind.TIMEOUT, result.error().kind());
        assertEquals(FeedScope.team(1610612747), result.scope());
    }

    @Test
    @DisplayName("undecodable body → PARSE failure")
    void malformedBody() {
        FetchResult result = client(respond(HttpStatus.OK, "{not json"), Duration.ofSeconds(1))
            .fetch(FeedScope.league()).block();

        assertNotNull(result);
        assertEquals(FetchErrorKind.PARSE, result.error().kind());
    }

    @Test
    @DisplayName("connection failure → NETWORK failure")
    void connectionRefused() {
        ExchangeFunction exchange = request -> Mono.error(new WebClientRequestException(
            new ConnectException("Connection refused"), HttpMethod.GET, request.url(), new HttpHeaders()));

        FetchResult result = client(exchange, Duration.ofSeconds(1)).fetch(FeedScope.league()).block();

        assertNotNull(result);
        assertEquals(FetchErrorKind.NETWORK, result.error().kind());
    }
}
