package com.injuryelo.common.adjustment;

import com.injuryelo.common.classifier.PlayerClassification;
import com.injuryelo.common.classifier.PlayerImportanceClassifier;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.model.AdjustmentResult;
import com.injuryelo.common.model.InjuryRecord;
import com.injuryelo.common.model.PlayerContribution;
import com.injuryelo.common.model.TeamInjuryReport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure stateless calculator that turns a team injury report into a bounded Elo delta.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li><strong>Deduplicate:</strong> records are grouped by canonical player key; the
 *       record with the highest status weight wins.</li>
 *   <li><strong>Contribution:</strong> {@code statusWeight × tierMultiplier × baseMagnitude}
 *       for every surviving record.</li>
 *   <li><strong>Sum:</strong> contributions are added in canonical key order, so the
 *       result is bit-identical under any permutation of the input.</li>
 *   <li><strong>Negate and clamp:</strong> the raw adjustment is {@code -sum}; the capped
 *       adjustment is clamped to {@code [-maxAdjustmentCap, 0]}. A capped magnitude below
 *       {@code minimumAdjustment} is treated as noise and becomes {@code 0}.</li>
 * </ol>
 *
 * <p>Team attribution is taken from the report as-is; no roster cross-validation.
 * No Spring dependencies. No I/O. No logging.
 */
public final class InjuryAdjustmentCalculator {

    /**
     * Stronger weight first, then the most recent observation, then every remaining field with
     * the more severe status first. The surviving duplicate never depends on input order.
     */
    private static final Comparator<InjuryRecord> PREFERENCE =
        Comparator.comparingDouble(InjuryRecord::statusWeight).reversed()
            .thenComparing(InjuryRecord::observedAt, Comparator.reverseOrder())
            .thenComparing(InjuryRecord::playerName)
            .thenComparing(InjuryRecord::status)
            .thenComparingInt(InjuryRecord::teamId)
            .thenComparing(r -> r.bodyPart() == null ? "" : r.bodyPart())
            .thenComparing(InjuryRecord::reportedStatus);

    private InjuryAdjustmentCalculator() {}

    /**
     * Computes the adjustment for {@code teamId}.
     *
     * @param teamId     team the adjustment applies to
     * @param report     injury report; {@code null} or empty yields a zero adjustment
     * @param classifier importance classifier built from the current registry snapshot
     * @param settings   validated configuration snapshot
     * @param computedAt evaluation timestamp copied into the result
     * @return the adjustment; {@code cappedAdjustment} is always within {@code [-cap, 0]}
     */
    public static AdjustmentResult compute(int teamId,
                                           TeamInjuryReport report,
                                           PlayerImportanceClassifier classifier,
                                           InjuryAdjustmentSettings settings,
                                           Instant computedAt) {
        if (report == null || report.isEmpty()) {
            return AdjustmentResult.none(teamId, computedAt);
        }

        Map<String, Candidate> byPlayer = deduplicate(report.records(), classifier);

        List<PlayerContribution> contributions = new ArrayList<>(byPlayer.size());
        double sum = 0.0;
        for (Candidate candidate : byPlayer.values()) {
            InjuryRecord record = candidate.record();
            PlayerClassification classification = candidate.classification();
            double contribution = record.statusWeight() * classification.multiplier() * settings.baseMagnitude();
            sum += contribution;
            contributions.add(new PlayerContribution(record, classification.canonicalKey(),
                classification.tier(), classification.multiplier(), classification.registered(), contribution));
        }

        double raw = sum == 0.0 ? 0.0 : -sum;
        return new AdjustmentResult(teamId, raw, clamp(raw, settings), contributions, computedAt);
    }

    /** Clamps a raw (non-positive) adjustment into {@code [-cap, 0]} and applies the noise floor. */
    public static double clamp(double rawAdjustment, InjuryAdjustmentSettings settings) {
        double capped = Math.max(-settings.maxAdjustmentCap(), Math.min(0.0, rawAdjustment));
        if (Math.abs(capped) < settings.minimumAdjustment() || capped == 0.0) {
            return 0.0;
        }
        return capped;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Map<String, Candidate> deduplicate(List<InjuryRecord> records,
                                                      PlayerImportanceClassifier classifier) {
        Map<String, Candidate> byPlayer = new TreeMap<>();
        for (InjuryRecord record : records) {
            PlayerClassification classification = classifier.classify(record.playerName());
            byPlayer.merge(classification.canonicalKey(), new Candidate(record, classification),
                (current, challenger) ->
                    PREFERENCE.compare(challenger.record(), current.record()) < 0 ? challenger : current);
        }
        return byPlayer;
    }

    private record Candidate(InjuryRecord record, PlayerClassification classification) {}
}
