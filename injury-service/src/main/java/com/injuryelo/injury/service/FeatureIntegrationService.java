package com.injuryelo.injury.service;

import com.injuryelo.common.adjustment.InjuryAdjustmentCalculator;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.model.AdjustedElo;
import com.injuryelo.common.model.AdjustmentResult;
import com.injuryelo.common.model.FallbackReason;
import com.injuryelo.common.model.GameEloAdjustment;
import com.injuryelo.common.model.PlayerContribution;
import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.common.summary.MatchupInjurySummary;
import com.injuryelo.common.summary.MatchupSummaryCalculator;
import com.injuryelo.injury.cache.CacheLookup;
import com.injuryelo.injury.client.FetchError;
import com.injuryelo.injury.dto.EloRequest;
import com.injuryelo.injury.registry.PlayerRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point used by the prediction pipeline: baseline Elo in, injury-adjusted Elo out.
 *
 * <p>Never fails. Every path that cannot produce a fresh adjustment returns a value tagged
 * with a {@link FallbackReason}:
 * <ul>
 *   <li>FRESH cache hit: adjustment applied, {@code NONE}</li>
 *   <li>STALE hit: refresh attempted within the request timeout. Success gives {@code NONE};
 *       failure applies the stale report with {@code STALE_REFRESH_FAILED}</li>
 *   <li>MISS (or expired): refresh attempted. Failure returns the baseline with {@code NO_DATA}</li>
 *   <li>feature disabled: baseline with {@code DISABLED}, no cache or network access</li>
 *   <li>classifier or calculator error: baseline with {@code CALCULATION_FAILED}</li>
 * </ul>
 */
public class FeatureIntegrationService {

    private static final Logger log = LoggerFactory.getLogger(FeatureIntegrationService.class);

    private final InjuryReportService reports;
    private final PlayerRegistryProvider registryProvider;
    private final InjuryAdjustmentSettings settings;
    private final Duration requestTimeout;
    private final Clock clock;

    /** Unregistered players already warned about, so batch runs do not repeat the warning. */
    private final Set<String> reportedUnregistered = ConcurrentHashMap.newKeySet();

    public FeatureIntegrationService(InjuryReportService reports, PlayerRegistryProvider registryProvider,
                                     InjuryAdjustmentSettings settings, Duration requestTimeout, Clock clock) {
        this.reports          = reports;
        this.registryProvider = registryProvider;
        this.settings         = settings;
        this.requestTimeout   = requestTimeout;
        this.clock            = clock;
    }

    public Mono<AdjustedElo> adjustedElo(int teamId, double baselineElo) {
        if (!settings.enabled()) {
            log.debug("INJURY_FALLBACK teamId={} reason={}", teamId, FallbackReason.DISABLED.code());
            return Mono.just(AdjustedElo.unchanged(teamId, baselineElo, FallbackReason.DISABLED));
        }
        return Mono.defer(() -> {
                CacheLookup lookup = reports.lookup(teamId);
                return switch (lookup.state()) {
                    case FRESH -> Mono.just(apply(teamId, baselineElo, lookup.report(), FallbackReason.NONE));
                    case STALE -> awaitRefresh(teamId).map(outcome -> outcome.succeeded()
                        ? apply(teamId, baselineElo, outcome.report(), FallbackReason.NONE)
                        : apply(teamId, baselineElo, lookup.report(), FallbackReason.STALE_REFRESH_FAILED));
                    default -> awaitRefresh(teamId).map(outcome -> outcome.succeeded()
                        ? apply(teamId, baselineElo, outcome.report(), FallbackReason.NONE)
                        : fallback(teamId, baselineElo, FallbackReason.NO_DATA, outcome.error()));
                };
            })
            .onErrorResume(e -> {
                log.warn("INJURY_FALLBACK teamId={} reason={} error={}",
                         teamId, FallbackReason.CALCULATION_FAILED.code(), e.toString());
                return Mono.just(AdjustedElo.unchanged(teamId, baselineElo, FallbackReason.CALCULATION_FAILED));
            });
    }

    /** Blocking variant for callers outside a reactive pipeline. */
    public AdjustedElo adjustedEloBlocking(int teamId, double baselineElo) {
        return adjustedElo(teamId, baselineElo).block(requestTimeout.plusSeconds(1));
    }

    public Mono<GameEloAdjustment> adjustedEloForGame(int homeTeamId, double homeBaselineElo,
                                                      int awayTeamId, double awayBaselineElo) {
        return Mono.zip(adjustedElo(homeTeamId, homeBaselineElo), adjustedElo(awayTeamId, awayBaselineElo))
            .map(pair -> new GameEloAdjustment(pair.getT1(), pair.getT2()));
    }

    /** Results come back in request order; one team's fallback never affects another's. */
    public Mono<List<AdjustedElo>> adjustedEloBatch(List<EloRequest> requests) {
        return Flux.fromIterable(requests)
            .flatMapSequential(r -> adjustedElo(r.teamId(), r.baselineElo()))
            .collectList();
    }

    /**
     * Matchup injury comparison from cached reports. A team with nothing cached gets one
     * bounded refresh attempt and counts as healthy if that fails.
     */
    public Mono<MatchupInjurySummary> matchupSummary(int homeTeamId, int awayTeamId) {
        return Mono.zip(currentReport(homeTeamId), currentReport(awayTeamId))
            .map(pair -> MatchupSummaryCalculator.summarize(
                homeTeamId, pair.getT1().orElse(null), awayTeamId, pair.getT2().orElse(null)));
    }

    // ── internals ───────────────────────────────────────────────────────────

    private Mono<RefreshOutcome> awaitRefresh(int teamId) {
        return reports.refresh(teamId)
            .timeout(requestTimeout, Mono.fromSupplier(() -> RefreshOutcome.failed(teamId,
                FetchError.timeout("no refresh result within " + requestTimeout.toMillis() + "ms"))));
    }

    private Mono<Optional<TeamInjuryReport>> currentReport(int teamId) {
        CacheLookup lookup = reports.lookup(teamId);
        if (lookup.isUsable()) {
            return Mono.just(Optional.of(lookup.report()));
        }
        return awaitRefresh(teamId)
            .map(outcome -> Optional.ofNullable(outcome.report()));
    }

    private AdjustedElo apply(int teamId, double baselineElo, TeamInjuryReport report, FallbackReason reason) {
        AdjustmentResult result = InjuryAdjustmentCalculator.compute(
            teamId, report, registryProvider.classifier(), settings, clock.instant());
        warnUnregistered(teamId, result);
        AdjustedElo adjusted = AdjustedElo.applied(teamId, baselineElo, result, reason);
        if (reason == FallbackReason.NONE) {
            log.info("INJURY_ADJUSTMENT_APPLIED teamId={} baseline={} adjusted={} adjustment={} injuries={} capped={}",
                     teamId, baselineElo, adjusted.adjustedElo(), adjusted.adjustment(),
                     result.contributions().size(), result.wasCapped());
        } else {
            log.warn("INJURY_FALLBACK teamId={} reason={} adjustment={} reportFetchedAt={}",
                     teamId, reason.code(), adjusted.adjustment(), report.fetchedAt());
        }
        return adjusted;
    }

    private AdjustedElo fallback(int teamId, double baselineElo, FallbackReason reason, FetchError error) {
        log.warn("INJURY_FALLBACK teamId={} reason={} fetchError={}", teamId, reason.code(), error);
        return AdjustedElo.unchanged(teamId, baselineElo, reason);
    }

    private void warnUnregistered(int teamId, AdjustmentResult result) {
        for (PlayerContribution contribution : result.contributions()) {
            if (!contribution.registered() && reportedUnregistered.add(contribution.canonicalKey())) {
                log.warn("PLAYER_UNREGISTERED teamId={} player='{}' assumedTier={}",
                         teamId, contribution.record().playerName(), contribution.tier());
            }
        }
    }
}
