package com.injuryelo.injury.team;

public record TeamInfo(
    int teamId,
    String fullName,
    String abbreviation,
    String nickname,
    String city
) {}
