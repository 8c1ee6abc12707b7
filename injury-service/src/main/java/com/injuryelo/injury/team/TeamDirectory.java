package com.injuryelo.injury.team;

import com.injuryelo.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the team names used by the injury feed to numeric team ids.
 *
 * <p>A name matches on full name, abbreviation, nickname or city, case-insensitively.
 * A key shared by two teams (both Los Angeles teams have the same city) is dropped so
 * that it never resolves to the wrong roster.
 */
public final class TeamDirectory {

    private static final Logger log = LoggerFactory.getLogger(TeamDirectory.class);

    /** Feed spellings that match no directory field. */
    private static final Map<String, String> FEED_ALIASES = Map.of(
        "la clippers", "los angeles clippers",
        "la lakers",   "los angeles lakers"
    );

    private final Map<Integer, TeamInfo> byId;
    private final Map<String, Integer> byKey;

    private TeamDirectory(Map<Integer, TeamInfo> byId, Map<String, Integer> byKey) {
        this.byId  = Collections.unmodifiableMap(byId);
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    public static TeamDirectory of(List<TeamInfo> teams) {
        Map<Integer, TeamInfo> byId = new LinkedHashMap<>();
        Map<String, Integer> byKey = new HashMap<>();
        Set<String> ambiguous = new HashSet<>();

        for (TeamInfo team : teams) {
            if (byId.putIfAbsent(team.teamId(), team) != null) {
                throw new IllegalArgumentException("duplicate team id " + team.teamId());
            }
            for (String field : List.of(team.fullName(), team.abbreviation(), team.nickname(), team.city())) {
                String key = key(field);
                if (key.isEmpty()) {
                    continue;
                }
                Integer previous = byKey.putIfAbsent(key, team.teamId());
                if (previous != null && previous != team.teamId()) {
                    ambiguous.add(key);
                }
            }
        }
        ambiguous.forEach(byKey::remove);
        FEED_ALIASES.forEach((alias, target) -> {
            Integer id = byKey.get(target);
            if (id != null) {
                byKey.putIfAbsent(alias, id);
            }
        });
        return new TeamDirectory(byId, byKey);
    }

    /**
     * Reads {@code team_id,full_name,abbreviation,nickname,city} rows. Blank lines,
     * {@code #} comments and a header row starting with {@code team_id} are skipped.
     */
    public static TeamDirectory load(Resource resource) {
        List<TeamInfo> teams = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("team_id")) {
                    continue;
                }
                String[] cols = trimmed.split(",", -1);
                if (cols.length != 5) {
                    throw new ConfigurationException("teams",
                        resource.getDescription() + " line " + lineNo + ": expected 5 columns but got " + cols.length);
                }
                try {
                    teams.add(new TeamInfo(Integer.parseInt(cols[0].trim()), cols[1].trim(),
                        cols[2].trim(), cols[3].trim(), cols[4].trim()));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("teams",
                        resource.getDescription() + " line " + lineNo + ": bad team id '" + cols[0] + "'", e);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("teams", "cannot read " + resource.getDescription(), e);
        }
        TeamDirectory directory = of(teams);
        log.info("Team directory loaded. teams={} source={}", directory.size(), resource.getDescription());
        return directory;
    }

    public Optional<Integer> resolve(String name) {
        return Optional.ofNullable(byKey.get(key(name)));
    }

    public Optional<TeamInfo> find(int teamId) {
        return Optional.ofNullable(byId.get(teamId));
    }

    public boolean contains(int teamId) {
        return byId.containsKey(teamId);
    }

    public String displayName(int teamId) {
        TeamInfo team = byId.get(teamId);
        return team == null ? "Team " + teamId : team.fullName();
    }

    public List<Integer> teamIds() {
        return List.copyOf(byId.keySet());
    }

    public int size() {
        return byId.size();
    }

    private static String key(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
