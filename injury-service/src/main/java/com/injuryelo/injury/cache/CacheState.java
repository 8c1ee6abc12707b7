package com.injuryelo.injury.cache;

/**
 * Freshness of a team's cached report.
 *
 * <ul>
 *   <li>{@code FRESH}: younger than the TTL, served as-is</li>
 *   <li>{@code STALE}: past the TTL but within the hard ceiling, servable while a refresh is attempted</li>
 *   <li>{@code EXPIRED}: past the hard ceiling, never served</li>
 *   <li>{@code MISS}: nothing cached</li>
 * </ul>
 *
 * {@link InjuryCache#get(int)} reports an expired entry as {@code MISS}.
 */
public enum CacheState {
    FRESH,
    STALE,
    EXPIRED,
    MISS
}
