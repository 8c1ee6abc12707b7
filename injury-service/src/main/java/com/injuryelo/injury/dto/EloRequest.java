package com.injuryelo.injury.dto;

/** One team's baseline Elo, as submitted to the batch endpoint. */
public record EloRequest(int teamId, double baselineElo) {}
