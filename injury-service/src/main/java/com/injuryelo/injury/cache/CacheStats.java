package com.injuryelo.injury.cache;

public record CacheStats(
    int totalEntries,
    int freshEntries,
    int staleEntries,
    int expiredEntries,
    double averageAgeSeconds,
    long ttlSeconds,
    long hardCeilingSeconds,
    int refreshesInFlight
) {}
