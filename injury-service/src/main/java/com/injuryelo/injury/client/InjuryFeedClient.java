package com.injuryelo.injury.client;

import reactor.core.publisher.Mono;

/**
 * Strategy interface for the upstream injury feed.
 *
 * <p>Implementations must emit exactly one {@link FetchResult} and never signal an error:
 * timeouts, network failures, bad statuses and undecodable bodies all become
 * {@link FetchResult#failure}.
 */
public interface InjuryFeedClient {

    Mono<FetchResult> fetch(FeedScope scope);
}
