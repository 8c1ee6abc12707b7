package com.injuryelo.injury.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Reads the ESPN NBA injuries endpoint ({@code GET {base-url}/injuries}).
 *
 * <p>The body is decoded to a {@link JsonNode} and handed back untouched; mapping to
 * {@code TeamInjuryReport} happens in {@link InjuryFeedNormalizer}.
 */
public class EspnInjuryFeedClient implements InjuryFeedClient {

    private static final Logger log = LoggerFactory.getLogger(EspnInjuryFeedClient.class);

    static final String INJURIES_PATH = "/injuries";

    private final WebClient webClient;
    private final Duration fetchTimeout;
    private final Clock clock;

    public EspnInjuryFeedClient(WebClient injuryFeedWebClient, Duration fetchTimeout, Clock clock) {
        this.webClient    = injuryFeedWebClient;
        this.fetchTimeout = fetchTimeout;
        this.clock        = clock;
    }

    @Override
    public Mono<FetchResult> fetch(FeedScope scope) {
        log.info("Fetching injury feed. provider=ESPN scope={}", scope);
        return webClient.get()
            .uri(INJURIES_PATH)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(fetchTimeout)
            .map(json -> FetchResult.success(scope, json, clock.instant()))
            .switchIfEmpty(Mono.fromSupplier(() ->
                FetchResult.failure(scope, FetchError.parse("empty response body"), clock.instant())))
            .doOnNext(result -> {
                if (result.isSuccess()) {
                    log.info("Injury feed fetched. provider=ESPN scope={} teams={}",
                             scope, result.payload().path("injuries").size());
                }
            })
            .onErrorResume(e -> {
                FetchError error = FetchError.from(e);
                log.warn("Injury feed fetch failed. provider=ESPN scope={} kind={} reason={}",
                         scope, error.kind(), error.message());
                return Mono.just(FetchResult.failure(scope, error, clock.instant()));
            });
    }
}
