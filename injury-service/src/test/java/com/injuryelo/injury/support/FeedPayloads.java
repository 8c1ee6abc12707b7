package com.injuryelo.injury.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Builds ESPN-shaped injury payloads for tests. */
public final class FeedPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode root = MAPPER.createObjectNode();
    private final ArrayNode teams = root.putArray("injuries");
    private ArrayNode currentTeam;

    private FeedPayloads() {}

    public static FeedPayloads payload() {
        return new FeedPayloads();
    }

    public static JsonNode empty() {
        return payload().build();
    }

    public FeedPayloads team(String displayName) {
        ObjectNode team = teams.addObject();
        team.put("displayName", displayName);
        currentTeam = team.putArray("injuries");
        return this;
    }

    public FeedPayloads injury(String player, String status) {
        return injury(player, status, "Knee", "2025-01-14T21:36Z");
    }

    public FeedPayloads injury(String player, String status, String bodyPart, String date) {
        ObjectNode entry = currentTeam.addObject();
        entry.putObject("athlete").put("displayName", player);
        if (status != null) {
            entry.put("status", status);
        }
        if (bodyPart != null) {
            entry.putObject("details").put("type", bodyPart);
        }
        if (date != null) {
            entry.put("date", date);
        }
        return this;
    }

    /** Adds a listing with no athlete block. */
    public FeedPayloads malformedInjury(String status) {
        currentTeam.addObject().put("status", status);
        return this;
    }

    public JsonNode build() {
        return root.deepCopy();
    }

    public String json() {
        return root.toString();
    }
}
