package com.injuryelo.injury.dto;

public record RegistryReloadResponse(int players, long allStars, int aliases) {}
