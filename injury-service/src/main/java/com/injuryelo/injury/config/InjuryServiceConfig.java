package com.injuryelo.injury.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.injury.cache.InjuryCache;
import com.injuryelo.injury.cache.snapshot.InjuryCacheSnapshotStore;
import com.injuryelo.injury.cache.snapshot.JsonFileSnapshotStore;
import com.injuryelo.injury.client.InjuryFeedClient;
import com.injuryelo.injury.client.InjuryFeedNormalizer;
import com.injuryelo.injury.client.StatusVocabulary;
import com.injuryelo.injury.job.InjuryRefreshScheduler;
import com.injuryelo.injury.registry.PlayerRegistryLoader;
import com.injuryelo.injury.registry.PlayerRegistryProvider;
import com.injuryelo.injury.service.FeatureIntegrationService;
import com.injuryelo.injury.service.InjuryReportService;
import com.injuryelo.injury.team.TeamDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the injury adjustment subsystem. Every configuration value is validated while
 * these beans are built, so a bad value stops the application from starting.
 */
@Configuration
public class InjuryServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(InjuryServiceConfig.class);

    @Bean
    public InjuryAdjustmentSettings injuryAdjustmentSettings(InjuryProperties properties) {
        InjuryAdjustmentSettings settings = properties.toSettings();
        log.info("Injury adjustment configured. enabled={} baseMagnitude={} maxCap={} minAdjustment={} ttlSeconds={} hardCeilingSeconds={}",
                 settings.enabled(), settings.baseMagnitude(), settings.maxAdjustmentCap(),
                 settings.minimumAdjustment(), settings.cacheTtl().toSeconds(), settings.hardCeiling().toSeconds());
        return settings;
    }

    @Bean
    public Clock injuryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TeamDirectory teamDirectory(InjuryProperties properties, ResourceLoader resourceLoader) {
        return TeamDirectory.load(resourceLoader.getResource(properties.getTeams()));
    }

    @Bean
    public PlayerRegistryProvider playerRegistryProvider(InjuryProperties properties, ResourceLoader resourceLoader,
                                                         InjuryAdjustmentSettings settings) {
        PlayerRegistryLoader loader = new PlayerRegistryLoader(resourceLoader,
            properties.getRegistry().getPlayers(), properties.getRegistry().getAliases(), settings.tierMultipliers());
        return new PlayerRegistryProvider(loader::load);
    }

    @Bean
    public InjuryFeedNormalizer injuryFeedNormalizer(TeamDirectory teamDirectory, InjuryProperties properties,
                                                     InjuryAdjustmentSettings settings) {
        return new InjuryFeedNormalizer(teamDirectory, new StatusVocabulary(properties.getStatusVocabulary()), settings);
    }

    @Bean
    public InjuryCacheSnapshotStore injuryCacheSnapshotStore(InjuryProperties properties, ObjectMapper objectMapper,
                                                             Clock clock) {
        InjuryProperties.Snapshot snapshot = properties.getCache().getSnapshot();
        if (!snapshot.isEnabled()) {
            return InjuryCacheSnapshotStore.disabled();
        }
        return new JsonFileSnapshotStore(Path.of(snapshot.getPath()), objectMapper, clock);
    }

    @Bean
    public InjuryCache injuryCache(InjuryAdjustmentSettings settings, Clock clock, InjuryCacheSnapshotStore snapshotStore) {
        InjuryCache cache = new InjuryCache(settings, clock, snapshotStore);
        cache.restore();
        return cache;
    }

    @Bean
    public InjuryReportService injuryReportService(InjuryFeedClient injuryFeedClient, InjuryFeedNormalizer normalizer,
                                                   InjuryCache cache, TeamDirectory teamDirectory,
                                                   InjuryProperties properties) {
        return new InjuryReportService(injuryFeedClient, normalizer, cache, teamDirectory, properties.fetchTimeout());
    }

    @Bean
    public FeatureIntegrationService featureIntegrationService(InjuryReportService reports,
                                                               PlayerRegistryProvider registryProvider,
                                                               InjuryAdjustmentSettings settings,
                                                               InjuryProperties properties, Clock clock) {
        return new FeatureIntegrationService(reports, registryProvider, settings, properties.requestTimeout(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "injury.refresh.proactive", name = "enabled", havingValue = "true")
    public InjuryRefreshScheduler injuryRefreshScheduler(InjuryReportService reports, InjuryCache cache,
                                                         InjuryProperties properties) {
        return new InjuryRefreshScheduler(reports, cache, properties.proactiveInterval());
    }
}
