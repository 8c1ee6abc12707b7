package com.injuryelo.injury.service;

import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.cache.CacheLookup;
import com.injuryelo.injury.cache.CacheStats;
import com.injuryelo.injury.cache.InjuryCache;
import com.injuryelo.injury.client.FeedScope;
import com.injuryelo.injury.client.FetchError;
import com.injuryelo.injury.client.FetchResult;
import com.injuryelo.injury.client.InjuryFeedClient;
import com.injuryelo.injury.client.InjuryFeedNormalizer;
import com.injuryelo.injury.client.NormalizedFeed;
import com.injuryelo.injury.team.TeamDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Owns the path from the upstream feed into {@link InjuryCache}.
 *
 * <p><strong>Single flight:</strong> at most one refresh per team runs at a time. A caller
 * arriving while one is in flight joins it and sees the same {@link RefreshOutcome}. A
 * caller that gives up (cancels, or times out on its own deadline) detaches from the
 * shared refresh without cancelling it, so the cache still receives the result.
 *
 * <p>Refresh failures are returned as {@link RefreshOutcome#failed} values; the cache is
 * left untouched and any previous entry stays in place.
 */
public class InjuryReportService {

    private static final Logger log = LoggerFactory.getLogger(InjuryReportService.class);

    private static final int LEAGUE_KEY = 0;

    /** In-flight refresh per team id. */
    private final ConcurrentHashMap<Integer, CompletableFuture<RefreshOutcome>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, CompletableFuture<LeagueRefreshResult>> leagueInFlight = new ConcurrentHashMap<>();

    private final InjuryFeedClient feedClient;
    private final InjuryFeedNormalizer normalizer;
    private final InjuryCache cache;
    private final TeamDirectory teams;
    private final Duration refreshTimeout;

    public InjuryReportService(InjuryFeedClient feedClient, InjuryFeedNormalizer normalizer, InjuryCache cache,
                               TeamDirectory teams, Duration refreshTimeout) {
        this.feedClient     = feedClient;
        this.normalizer     = normalizer;
        this.cache          = cache;
        this.teams          = teams;
        this.refreshTimeout = refreshTimeout;
    }

    public CacheLookup lookup(int teamId) {
        return cache.get(teamId);
    }

    /**
     * Refreshes one team, joining an in-flight refresh when there is one. Never signals an
     * error; emits exactly one outcome once the fetch finishes or hits the refresh timeout.
     */
    public Mono<RefreshOutcome> refresh(int teamId) {
        return Mono.defer(() -> {
            CompletableFuture<RefreshOutcome> candidate = new CompletableFuture<>();
            CompletableFuture<RefreshOutcome> running = inFlight.putIfAbsent(teamId, candidate);
            if (running != null) {
                log.debug("REFRESH_JOINED teamId={}", teamId);
                return Mono.fromFuture(running.copy());
            }
            log.debug("REFRESH_STARTED teamId={}", teamId);
            // Leave the in-flight map before completing, so a caller woken by the result starts a new fetch.
            fetchTeam(teamId).subscribe(
                outcome -> {
                    inFlight.remove(teamId, candidate);
                    candidate.complete(outcome);
                },
                error -> {
                    inFlight.remove(teamId, candidate);
                    candidate.completeExceptionally(error);
                },
                () -> {
                    inFlight.remove(teamId, candidate);
                    candidate.complete(RefreshOutcome.failed(teamId, FetchError.parse("refresh produced no result")));
                });
            return Mono.fromFuture(candidate.copy());
        });
    }

    /**
     * One league-wide fetch that replaces every team's entry. Teams the feed does not list
     * are stored as empty (healthy) reports.
     */
    public Mono<LeagueRefreshResult> refreshAll() {
        return Mono.defer(() -> {
            CompletableFuture<LeagueRefreshResult> candidate = new CompletableFuture<>();
            CompletableFuture<LeagueRefreshResult> running = leagueInFlight.putIfAbsent(LEAGUE_KEY, candidate);
            if (running != null) {
                log.debug("REFRESH_JOINED scope=league");
                return Mono.fromFuture(running.copy());
            }
            fetchLeague().subscribe(
                result -> {
                    leagueInFlight.remove(LEAGUE_KEY, candidate);
                    candidate.complete(result);
                },
                error -> {
                    leagueInFlight.remove(LEAGUE_KEY, candidate);
                    candidate.completeExceptionally(error);
                },
                () -> {
                    leagueInFlight.remove(LEAGUE_KEY, candidate);
                    candidate.complete(LeagueRefreshResult.failed(FetchError.parse("refresh produced no result")));
                });
            return Mono.fromFuture(candidate.copy());
        });
    }

    public int refreshesInFlight() {
        return inFlight.size() + leagueInFlight.size();
    }

    public CacheStats cacheStats() {
        return cache.stats(this::refreshesInFlight);
    }

    // ── fetch pipelines ─────────────────────────────────────────────────────

    private Mono<RefreshOutcome> fetchTeam(int teamId) {
        if (!teams.contains(teamId)) {
            log.warn("Refresh rejected. teamId={} reason=unknown_team", teamId);
            return Mono.just(RefreshOutcome.failed(teamId, FetchError.unknownTeam(teamId)));
        }
        FeedScope scope = FeedScope.team(teamId);
        return feedClient.fetch(scope)
            .timeout(refreshTimeout)
            .publishOn(Schedulers.boundedElastic())
            .map(result -> applyTeam(teamId, result))
            .onErrorResume(e -> {
                FetchError error = e instanceof TimeoutException
                    ? FetchError.timeout("refresh exceeded " + refreshTimeout.toMillis() + "ms")
                    : FetchError.from(e);
                return Mono.just(RefreshOutcome.failed(teamId, error));
            })
            .doOnNext(outcome -> {
                if (!outcome.succeeded()) {
                    log.warn("Refresh failed. teamId={} kind={} reason={}",
                             teamId, outcome.error().kind(), outcome.error().message());
                }
            });
    }

    private RefreshOutcome applyTeam(int teamId, FetchResult result) {
        if (!result.isSuccess()) {
            return RefreshOutcome.failed(teamId, result.error());
        }
        NormalizedFeed feed = normalizer.normalize(result.payload(), result.scope(), result.fetchedAt());
        TeamInjuryReport report = feed.report(teamId).orElseGet(() ->
            TeamInjuryReport.empty(teamId, teams.displayName(teamId), result.fetchedAt(), InjuryFeedNormalizer.SOURCE));
        cache.put(report);
        // A newer report may already be cached; callers see whatever the cache now holds.
        CacheLookup current = cache.get(teamId);
        return RefreshOutcome.success(current.isUsable() ? current.report() : report);
    }

    private Mono<LeagueRefreshResult> fetchLeague() {
        FeedScope scope = FeedScope.league();
        return feedClient.fetch(scope)
            .timeout(refreshTimeout)
            .publishOn(Schedulers.boundedElastic())
            .map(this::applyLeague)
            .onErrorResume(e -> Mono.just(LeagueRefreshResult.failed(e instanceof TimeoutException
                ? FetchError.timeout("refresh exceeded " + refreshTimeout.toMillis() + "ms")
                : FetchError.from(e))))
            .doOnNext(result -> {
                if (result.succeeded()) {
                    log.info("League refresh complete. teamsUpdated={} teamsWithInjuries={} skippedEntries={}",
                             result.teamsUpdated(), result.teamsWithInjuries(), result.skippedEntries());
                } else {
                    log.warn("League refresh failed. kind={} reason={}",
                             result.error().kind(), result.error().message());
                }
            });
    }

    private LeagueRefreshResult applyLeague(FetchResult result) {
        if (!result.isSuccess()) {
            return LeagueRefreshResult.failed(result.error());
        }
        NormalizedFeed feed = normalizer.normalize(result.payload(), result.scope(), result.fetchedAt());
        List<TeamInjuryReport> reports = new ArrayList<>();
        for (int teamId : teams.teamIds()) {
            reports.add(feed.report(teamId).orElseGet(() ->
                TeamInjuryReport.empty(teamId, teams.displayName(teamId), result.fetchedAt(), InjuryFeedNormalizer.SOURCE)));
        }
        int updated = cache.putAll(reports);
        int withInjuries = (int) reports.stream().filter(r -> !r.isEmpty()).count();
        return new LeagueRefreshResult(updated, withInjuries, feed.skippedEntries(), null);
    }
}
