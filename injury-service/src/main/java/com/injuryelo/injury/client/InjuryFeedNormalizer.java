package com.injuryelo.injury.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.common.model.InjuryRecord;
import com.injuryelo.common.model.InjuryStatus;
import com.injuryelo.common.model.TeamInjuryReport;
import com.injuryelo.injury.team.TeamDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the ESPN injuries payload into {@link TeamInjuryReport}s.
 *
 * <p>Expected shape:
 * <pre>
 * {"injuries": [
 *   {"displayName": "Los Angeles Lakers",
 *    "injuries": [
 *      {"athlete": {"displayName": "LeBron James"},
 *       "status": "Out",
 *       "details": {"type": "Ankle"},
 *       "date": "2025-01-14T21:36Z"}]}]}
 * </pre>
 *
 * <p>A malformed listing is logged and skipped; the rest of the payload still produces
 * reports. A team the directory cannot resolve is skipped the same way. A payload with
 * no {@code injuries} array is rejected outright.
 */
public class InjuryFeedNormalizer {

    private static final Logger log = LoggerFactory.getLogger(InjuryFeedNormalizer.class);

    public static final String SOURCE = "espn";

    private final TeamDirectory teams;
    private final StatusVocabulary vocabulary;
    private final InjuryAdjustmentSettings settings;

    public InjuryFeedNormalizer(TeamDirectory teams, StatusVocabulary vocabulary, InjuryAdjustmentSettings settings) {
        this.teams      = teams;
        this.vocabulary = vocabulary;
        this.settings   = settings;
    }

    /**
     * @throws IllegalArgumentException if the payload has no {@code injuries} array
     */
    public NormalizedFeed normalize(JsonNode payload, FeedScope scope, Instant fetchedAt) {
        JsonNode teamNodes = payload == null ? null : payload.get("injuries");
        if (teamNodes == null || !teamNodes.isArray()) {
            throw new IllegalArgumentException("payload has no 'injuries' array");
        }

        Map<Integer, List<InjuryRecord>> recordsByTeam = new LinkedHashMap<>();
        Map<Integer, String> namesByTeam = new LinkedHashMap<>();
        int skipped = 0;
        int unknownTeams = 0;

        for (JsonNode teamNode : teamNodes) {
            String teamName = teamNode.path("displayName").asText("");
            Optional<Integer> resolved = teams.resolve(teamName);
            if (resolved.isEmpty()) {
                unknownTeams++;
                log.warn("Skipping injury listings for unknown team. team='{}'", teamName);
                continue;
            }
            int teamId = resolved.get();
            if (!scope.covers(teamId)) {
                continue;
            }
            namesByTeam.putIfAbsent(teamId, teams.displayName(teamId));
            List<InjuryRecord> records = recordsByTeam.computeIfAbsent(teamId, id -> new ArrayList<>());

            for (JsonNode entry : teamNode.path("injuries")) {
                try {
                    records.add(toRecord(entry, teamId, fetchedAt));
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Skipping malformed injury listing. teamId={} reason={}", teamId, e.getMessage());
                }
            }
        }

        Map<Integer, TeamInjuryReport> reports = new LinkedHashMap<>();
        recordsByTeam.forEach((teamId, records) -> reports.put(teamId,
            new TeamInjuryReport(teamId, namesByTeam.get(teamId), records, fetchedAt, SOURCE)));

        log.debug("Injury feed normalized. scope={} teams={} skippedEntries={} unknownTeams={}",
                  scope, reports.size(), skipped, unknownTeams);
        return new NormalizedFeed(reports, skipped, unknownTeams);
    }

    private InjuryRecord toRecord(JsonNode entry, int teamId, Instant fetchedAt) {
        String playerName = entry.path("athlete").path("displayName").asText("");
        if (playerName.isBlank()) {
            throw new IllegalArgumentException("listing has no athlete.displayName");
        }
        String rawStatus = entry.path("status").asText(null);
        InjuryStatus status = vocabulary.resolve(rawStatus);
        if (rawStatus != null && !vocabulary.isKnown(rawStatus)) {
            log.debug("Unmapped injury status treated as available. player='{}' status='{}'", playerName, rawStatus);
        }
        String bodyPart = entry.path("details").path("type").asText(null);
        if (bodyPart != null && bodyPart.isBlank()) {
            bodyPart = null;
        }
        return new InjuryRecord(playerName.trim(), teamId, status, settings.statusWeight(status),
            bodyPart, parseDate(entry.path("date").asText(null), fetchedAt),
            rawStatus == null ? null : rawStatus.trim());
    }

    private static Instant parseDate(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
