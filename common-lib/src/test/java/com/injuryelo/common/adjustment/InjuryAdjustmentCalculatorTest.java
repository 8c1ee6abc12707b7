package com.injuryelo.common.adjustment;

import com.injuryelo.common.classifier.PlayerImportanceClassifier;
import com.injuryelo.common.classifier.PlayerRegistry;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.model.AdjustmentResult;
import com.injuryelo.common.model.InjuryRecord;
import com.injuryelo.common.model.InjuryStatus;
import com.injuryelo.common.model.PlayerContribution;
import com.injuryelo.common.model.PlayerTier;
import com.injuryelo.common.model.TeamInjuryReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link InjuryAdjustmentCalculator}.
 * Covers the reference scenarios, clamping, deduplication and order independence.
 */
class InjuryAdjustmentCalculatorTest {

    private static final int LAKERS = 1610612747;
    private static final Instant NOW = Instant.parse("2025-01-15T18:00:00Z");
    private static final InjuryAdjustmentSettings SETTINGS = InjuryAdjustmentSettings.defaults();

    private static final PlayerImportanceClassifier CLASSIFIER = new PlayerImportanceClassifier(
        PlayerRegistry.of(
            Map.of(
                "LeBron James", PlayerTier.ALL_STAR,
                "Anthony Davis", PlayerTier.ALL_STAR,
                "Stephen Curry", PlayerTier.ALL_STAR,
                "Kevin Durant", PlayerTier.ALL_STAR,
                "Jaxson Hayes", PlayerTier.BENCH),
            Map.of("LeBron", "LeBron James", "AD", "Anthony Davis"),
            SETTINGS.tierMultipliers()));

    private static InjuryRecord record(String name, InjuryStatus status) {
        return new InjuryRecord(name, LAKERS, status, SETTINGS.statusWeight(status), null, NOW);
    }

    private static TeamInjuryReport report(InjuryRecord... records) {
        return new TeamInjuryReport(LAKERS, "Los Angeles Lakers", List.of(records), NOW, "test");
    }

    private static AdjustmentResult compute(TeamInjuryReport report) {
        return InjuryAdjustmentCalculator.compute(LAKERS, report, CLASSIFIER, SETTINGS, NOW);
    }

    // ── reference scenarios ──────────────────────────────────────────────

    @Nested
    @DisplayName("reference scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("All-Star out → 1.0 × 2.5 × 20 = -50")
        void allStarOut() {
            AdjustmentResult result = compute(report(record("LeBron James", InjuryStatus.OUT)));
            assertEquals(-50.0, result.rawAdjustment());
            assertEquals(-50.0, result.cappedAdjustment());
            assertEquals(1, result.contributions().size());
            assertEquals(50.0, result.contributions().get(0).contribution());
        }

        @Test
        @DisplayName("All-Star out + All-Star questionable (via aliases) → -50 + -25 = -75")
        void twoAllStars() {
            AdjustmentResult result = compute(report(
                record("LeBron", InjuryStatus.OUT),
                record("AD", InjuryStatus.QUESTIONABLE)));
            assertEquals(-75.0, result.cappedAdjustment());
            assertFalse(result.wasCapped());
        }

        @Test
        @DisplayName("unregistered player questionable → 0.5 × 1.5 × 20 = -15")
        void unregisteredQuestionable() {
            AdjustmentResult result = compute(report(record("Random Role Player", InjuryStatus.QUESTIONABLE)));
            assertEquals(-15.0, result.cappedAdjustment());
            assertEquals(1, result.unregisteredPlayers());
            assertEquals(PlayerTier.STARTER, result.contributions().get(0).tier());
        }

        @Test
        @DisplayName("bench player doubtful → 0.75 × 1.0 × 20 = -15")
        void benchDoubtful() {
            AdjustmentResult result = compute(report(record("Jaxson Hayes", InjuryStatus.DOUBTFUL)));
            assertEquals(-15.0, result.cappedAdjustment());
        }

        @Test
        @DisplayName("available players contribute nothing")
        void availableIsFree() {
            AdjustmentResult result = compute(report(record("LeBron James", InjuryStatus.AVAILABLE)));
            assertEquals(0.0, result.cappedAdjustment());
            assertEquals(0.0, result.rawAdjustment());
        }
    }

    // ── edge cases ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("empty report → 0")
        void emptyReport() {
            AdjustmentResult result = compute(report());
            assertEquals(0.0, result.cappedAdjustment());
            assertTrue(result.contributions().isEmpty());
        }

        @Test
        @DisplayName("null report → 0")
        void nullReport() {
            assertEquals(0.0, compute(null).cappedAdjustment());
        }

        @Test
        @DisplayName("saturation clamps exactly to -maxCap")
        void saturation() {
            AdjustmentResult result = compute(report(
                record("LeBron James", InjuryStatus.OUT),
                record("Anthony Davis", InjuryStatus.OUT),
                record("Stephen Curry", InjuryStatus.OUT)));
            assertEquals(-150.0, result.rawAdjustment());
            assertEquals(-SETTINGS.maxAdjustmentCap(), result.cappedAdjustment());
            assertTrue(result.wasCapped());
        }

        @Test
        @DisplayName("duplicate listings keep the highest status weight")
        void duplicatesDeduplicated() {
            AdjustmentResult result = compute(report(
                record("LeBron James", InjuryStatus.QUESTIONABLE),
                record("lebron james", InjuryStatus.OUT),
                record("LeBron", InjuryStatus.PROBABLE)));
            assertEquals(-50.0, result.cappedAdjustment());
            assertEquals(1, result.contributions().size());
            assertEquals(InjuryStatus.OUT, result.contributions().get(0).record().status());
        }

        @Test
        @DisplayName("equal-weight duplicates resolve to the same record in either order")
        void equalWeightDuplicatesAreOrderIndependent() {
            Map<InjuryStatus, Double> weights = InjuryAdjustmentSettings.defaultStatusWeights();
            weights.put(InjuryStatus.DOUBTFUL, 0.5);
            InjuryAdjustmentSettings tied = new InjuryAdjustmentSettings(SETTINGS.tierMultipliers(), weights,
                20.0, 100.0, 0.0, Duration.ofHours(4), Duration.ofHours(24), true);
            InjuryRecord doubtful = new InjuryRecord("LeBron James", LAKERS, InjuryStatus.DOUBTFUL, 0.5, null, NOW);
            InjuryRecord questionable = new InjuryRecord("LeBron James", LAKERS, InjuryStatus.QUESTIONABLE, 0.5, null, NOW);

            AdjustmentResult forward = InjuryAdjustmentCalculator.compute(LAKERS,
                report(doubtful, questionable), CLASSIFIER, tied, NOW);
            AdjustmentResult reversed = InjuryAdjustmentCalculator.compute(LAKERS,
                report(questionable, doubtful), CLASSIFIER, tied, NOW);

            assertEquals(forward, reversed);
            assertEquals(1, forward.contributions().size());
            assertEquals(InjuryStatus.DOUBTFUL, forward.contributions().get(0).record().status());
        }

        @Test
        @DisplayName("records attributed to another team are trusted as-is")
        void noRosterValidation() {
            InjuryRecord foreign = new InjuryRecord("Kevin Durant", 1610612756, InjuryStatus.OUT, 1.0, "Calf", NOW);
            assertEquals(-50.0, compute(report(foreign)).cappedAdjustment());
        }

        @Test
        @DisplayName("noise floor zeroes adjustments smaller than the minimum")
        void noiseFloor() {
            InjuryAdjustmentSettings floored = new InjuryAdjustmentSettings(SETTINGS.tierMultipliers(),
                SETTINGS.statusWeights(), 20.0, 100.0, 10.0,
                Duration.ofHours(4), Duration.ofHours(24), true);
            TeamInjuryReport small = report(record("Jaxson Hayes", InjuryStatus.PROBABLE));
            AdjustmentResult result = InjuryAdjustmentCalculator.compute(LAKERS, small, CLASSIFIER, floored, NOW);
            assertEquals(-5.0, result.rawAdjustment());
            assertEquals(0.0, result.cappedAdjustment());
        }

        @Test
        @DisplayName("zero cap always yields 0")
        void zeroCap() {
            InjuryAdjustmentSettings zeroCap = new InjuryAdjustmentSettings(SETTINGS.tierMultipliers(),
                SETTINGS.statusWeights(), 20.0, 0.0, 0.0,
                Duration.ofHours(4), Duration.ofHours(24), true);
            TeamInjuryReport report = report(record("LeBron James", InjuryStatus.OUT));
            assertEquals(0.0,
                InjuryAdjustmentCalculator.compute(LAKERS, report, CLASSIFIER, zeroCap, NOW).cappedAdjustment());
        }

        @Test
        @DisplayName("contributions are listed in canonical key order")
        void contributionOrder() {
            AdjustmentResult result = compute(report(
                record("Stephen Curry", InjuryStatus.OUT),
                record("Anthony Davis", InjuryStatus.OUT)));
            List<String> keys = result.contributions().stream().map(PlayerContribution::canonicalKey).toList();
            assertEquals(List.of("anthony davis", "stephen curry"), keys);
        }
    }

    // ── properties ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("properties over generated reports")
    class PropertyTests {

        private final List<String> names = List.of("LeBron James", "Anthony Davis", "Stephen Curry",
            "Kevin Durant", "Jaxson Hayes", "Bench Guy", "Two Way Player", "Rookie Wing");

        private List<InjuryRecord> randomRecords(Random random) {
            int count = random.nextInt(9);
            List<InjuryRecord> records = new ArrayList<>();
            InjuryStatus[] statuses = InjuryStatus.values();
            for (int i = 0; i < count; i++) {
                String name = names.get(random.nextInt(names.size()));
                InjuryStatus status = statuses[random.nextInt(statuses.length)];
                records.add(new InjuryRecord(name, LAKERS, status, SETTINGS.statusWeight(status), null,
                    NOW.minusSeconds(random.nextInt(3600))));
            }
            return records;
        }

        @Test
        @DisplayName("capped adjustment always within [-maxCap, 0]")
        void alwaysBounded() {
            Random random = new Random(42);
            for (int i = 0; i < 500; i++) {
                double capped = compute(new TeamInjuryReport(LAKERS, "LAL", randomRecords(random), NOW, "gen"))
                    .cappedAdjustment();
                assertTrue(capped <= 0.0 && capped >= -SETTINGS.maxAdjustmentCap(),
                    "out of bounds on iteration " + i + ": " + capped);
            }
        }

        @Test
        @DisplayName("permuting the input never changes the result")
        void orderIndependent() {
            Random random = new Random(7);
            for (int i = 0; i < 200; i++) {
                List<InjuryRecord> records = randomRecords(random);
                AdjustmentResult first = compute(new TeamInjuryReport(LAKERS, "LAL", records, NOW, "gen"));

                List<InjuryRecord> shuffled = new ArrayList<>(records);
                Collections.shuffle(shuffled, random);
                AdjustmentResult second = compute(new TeamInjuryReport(LAKERS, "LAL", shuffled, NOW, "gen"));

                assertEquals(first, second, "permutation changed result on iteration " + i);
            }
        }

        @Test
        @DisplayName("deterministic: same input always produces same output")
        void deterministic() {
            TeamInjuryReport report = report(
                record("LeBron James", InjuryStatus.OUT),
                record("Bench Guy", InjuryStatus.DOUBTFUL));
            AdjustmentResult first = compute(report);
            for (int i = 0; i < 100; i++) {
                assertEquals(first, compute(report), "iteration " + i);
            }
        }
    }
}
