package com.injuryelo.injury.config;

import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.exception.ConfigurationException;
import com.injuryelo.common.model.InjuryStatus;
import com.injuryelo.common.model.PlayerTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound view of the {@code injury.*} configuration surface.
 *
 * <p>This bean is mutable only while Spring binds it. Everything downstream reads the
 * immutable {@link InjuryAdjustmentSettings} produced once by {@link #toSettings()}.
 */
@Data
@ConfigurationProperties(prefix = "injury")
public class InjuryProperties {

    private boolean enabled = true;
    private double baseMagnitude = InjuryAdjustmentSettings.DEFAULT_BASE_MAGNITUDE;
    private double maxAdjustmentCap = InjuryAdjustmentSettings.DEFAULT_MAX_ADJUSTMENT_CAP;
    private double minAdjustment = 0.0;

    private TierMultipliers tierMultipliers = new TierMultipliers();
    private StatusWeights statusWeights = new StatusWeights();

    /** External feed status string (case-insensitive) → internal status. */
    private Map<String, InjuryStatus> statusVocabulary = defaultVocabulary();

    private Cache cache = new Cache();
    private Feed feed = new Feed();
    private Refresh refresh = new Refresh();
    private Registry registry = new Registry();

    /** Team directory CSV: team_id,full_name,abbreviation,nickname,city. */
    private String teams = "classpath:teams/nba-teams.csv";

    @Data
    public static class TierMultipliers {
        private double allStar = 2.5;
        private double starter = 1.5;
        private double bench = 1.0;
    }

    @Data
    public static class StatusWeights {
        private double out = 1.0;
        private double doubtful = 0.75;
        private double questionable = 0.5;
        private double probable = 0.25;
    }

    @Data
    public static class Cache {
        private long ttlSeconds = InjuryAdjustmentSettings.DEFAULT_CACHE_TTL.toSeconds();
        private long hardCeilingSeconds = InjuryAdjustmentSettings.DEFAULT_HARD_CEILING.toSeconds();
        private Snapshot snapshot = new Snapshot();
    }

    @Data
    public static class Snapshot {
        private boolean enabled = false;
        private String path = ".cache/injury-cache.json";
    }

    @Data
    public static class Feed {
        private String baseUrl = "https://site.api.espn.com/apis/site/v2/sports/basketball/nba";
        private String userAgent = "injury-elo/1.0";
        private int connectTimeoutMs = 5_000;
        private long fetchTimeoutMs = 10_000;
    }

    @Data
    public static class Refresh {
        /** Longest a prediction request waits on an in-flight refresh before using what is cached. */
        private long requestTimeoutMs = 2_000;
        private Proactive proactive = new Proactive();
    }

    @Data
    public static class Proactive {
        private boolean enabled = false;
        private long intervalSeconds = 1_800;
    }

    @Data
    public static class Registry {
        /** name,tier rows; tier is ALL_STAR, STARTER or BENCH. */
        private String players = "classpath:registry/players.csv";
        /** alias,canonical rows. */
        private String aliases = "classpath:registry/aliases.csv";
    }

    // ── conversion ───────────────────────────────────────────────────────────

    /**
     * Builds the validated settings snapshot.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public InjuryAdjustmentSettings toSettings() {
        if (cache.getTtlSeconds() <= 0) {
            throw new ConfigurationException("cache.ttl-seconds", "must be positive but was " + cache.getTtlSeconds());
        }
        Map<PlayerTier, Double> tiers = new EnumMap<>(PlayerTier.class);
        tiers.put(PlayerTier.ALL_STAR, tierMultipliers.getAllStar());
        tiers.put(PlayerTier.STARTER, tierMultipliers.getStarter());
        tiers.put(PlayerTier.BENCH, tierMultipliers.getBench());

        Map<InjuryStatus, Double> weights = new EnumMap<>(InjuryStatus.class);
        weights.put(InjuryStatus.OUT, statusWeights.getOut());
        weights.put(InjuryStatus.DOUBTFUL, statusWeights.getDoubtful());
        weights.put(InjuryStatus.QUESTIONABLE, statusWeights.getQuestionable());
        weights.put(InjuryStatus.PROBABLE, statusWeights.getProbable());

        return new InjuryAdjustmentSettings(tiers, weights, baseMagnitude, maxAdjustmentCap, minAdjustment,
            Duration.ofSeconds(cache.getTtlSeconds()), Duration.ofSeconds(cache.getHardCeilingSeconds()), enabled);
    }

    public Duration requestTimeout() {
        return positiveMillis("refresh.request-timeout-ms", refresh.getRequestTimeoutMs());
    }

    public Duration fetchTimeout() {
        return positiveMillis("feed.fetch-timeout-ms", feed.getFetchTimeoutMs());
    }

    public Duration proactiveInterval() {
        if (refresh.getProactive().getIntervalSeconds() <= 0) {
            throw new ConfigurationException("refresh.proactive.interval-seconds",
                "must be positive but was " + refresh.getProactive().getIntervalSeconds());
        }
        return Duration.ofSeconds(refresh.getProactive().getIntervalSeconds());
    }

    private static Duration positiveMillis(String property, long millis) {
        if (millis <= 0) {
            throw new ConfigurationException(property, "must be positive but was " + millis);
        }
        return Duration.ofMillis(millis);
    }

    private static Map<String, InjuryStatus> defaultVocabulary() {
        Map<String, InjuryStatus> vocabulary = new LinkedHashMap<>();
        vocabulary.put("out", InjuryStatus.OUT);
        vocabulary.put("o", InjuryStatus.OUT);
        vocabulary.put("doubtful", InjuryStatus.DOUBTFUL);
        vocabulary.put("d", InjuryStatus.DOUBTFUL);
        vocabulary.put("questionable", InjuryStatus.QUESTIONABLE);
        vocabulary.put("q", InjuryStatus.QUESTIONABLE);
        vocabulary.put("probable", InjuryStatus.PROBABLE);
        vocabulary.put("p", InjuryStatus.PROBABLE);
        vocabulary.put("day-to-day", InjuryStatus.PROBABLE);
        vocabulary.put("dtd", InjuryStatus.PROBABLE);
        vocabulary.put("available", InjuryStatus.AVAILABLE);
        vocabulary.put("active", InjuryStatus.AVAILABLE);
        return vocabulary;
    }
}
