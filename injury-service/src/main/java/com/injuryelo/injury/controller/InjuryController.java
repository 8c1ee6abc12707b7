package com.injuryelo.injury.controller;

import com.injuryelo.common.model.AdjustedElo;
import com.injuryelo.common.model.GameEloAdjustment;
import com.injuryelo.common.model.PlayerTier;
import com.injuryelo.common.summary.MatchupInjurySummary;
import com.injuryelo.injury.cache.CacheLookup;
import com.injuryelo.injury.cache.CacheStats;
import com.injuryelo.injury.dto.CachedReportView;
import com.injuryelo.injury.dto.EloRequest;
import com.injuryelo.injury.dto.RegistryReloadResponse;
import com.injuryelo.injury.registry.PlayerRegistryProvider;
import com.injuryelo.injury.service.FeatureIntegrationService;
import com.injuryelo.injury.service.InjuryReportService;
import com.injuryelo.injury.service.LeagueRefreshResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/injuries")
public class InjuryController {

    private static final Logger log = LoggerFactory.getLogger(InjuryController.class);

    private final InjuryReportService reports;
    private final FeatureIntegrationService features;
    private final PlayerRegistryProvider registryProvider;

    public InjuryController(InjuryReportService reports, FeatureIntegrationService features,
                            PlayerRegistryProvider registryProvider) {
        this.reports          = reports;
        this.features         = features;
        this.registryProvider = registryProvider;
    }

    /** Cached report for a team; 404 when nothing usable is cached. Does not trigger a fetch. */
    @GetMapping("/teams/{teamId}")
    public ResponseEntity<CachedReportView> teamReport(@PathVariable int teamId) {
        CacheLookup lookup = reports.lookup(teamId);
        if (!lookup.isUsable()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(CachedReportView.from(lookup));
    }

    @GetMapping("/adjusted-elo")
    public Mono<AdjustedElo> adjustedElo(@RequestParam int teamId, @RequestParam double baselineElo) {
        return features.adjustedElo(teamId, baselineElo);
    }

    @PostMapping("/adjusted-elo/batch")
    public Mono<List<AdjustedElo>> adjustedEloBatch(@RequestBody List<EloRequest> requests) {
        return features.adjustedEloBatch(requests);
    }

    @GetMapping("/adjusted-elo/game")
    public Mono<GameEloAdjustment> adjustedEloForGame(@RequestParam int homeTeamId, @RequestParam double homeElo,
                                                      @RequestParam int awayTeamId, @RequestParam double awayElo) {
        return features.adjustedEloForGame(homeTeamId, homeElo, awayTeamId, awayElo);
    }

    @GetMapping("/matchup")
    public Mono<MatchupInjurySummary> matchup(@RequestParam int homeTeamId, @RequestParam int awayTeamId) {
        return features.matchupSummary(homeTeamId, awayTeamId);
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return reports.cacheStats();
    }

    /** League-wide refresh; 502 when the feed could not be read. */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<LeagueRefreshResult>> refresh() {
        return reports.refreshAll()
            .map(result -> result.succeeded()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result));
    }

    @PostMapping("/registry/reload")
    public Mono<ResponseEntity<RegistryReloadResponse>> reloadRegistry() {
        return Mono.fromCallable(registryProvider::reload)
            .subscribeOn(Schedulers.boundedElastic())
            .map(registry -> ResponseEntity.ok(new RegistryReloadResponse(
                registry.size(), registry.count(PlayerTier.ALL_STAR), registry.aliasCount())))
            .onErrorResume(e -> {
                log.error("Player registry reload failed, previous registry kept. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
