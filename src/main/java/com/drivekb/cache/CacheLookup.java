package com.drivekb.cache;

/**
 * Outcome of {@link ResponseCache#lookupOrCompute}. {@code similarity} is the best similarity
 * seen during the scan, or 0 when nothing was compared.
 */
public record CacheLookup<V>(V value, boolean hit, double similarity) {

    static <V> CacheLookup<V> hit(V value, double similarity) {
        return new CacheLookup<>(value, true, similarity);
    }

    static <V> CacheLookup<V> miss(V value, double similarity) {
        return new CacheLookup<>(value, false, similarity);
    }
}
