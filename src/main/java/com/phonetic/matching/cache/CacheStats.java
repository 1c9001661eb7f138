package com.phonetic.matching.cache;

/**
 * Snapshot of the encoding cache counters.
 *
 * @param hits        lookups answered from the cache
 * @param misses      lookups that had to run the encoder
 * @param cachedCodes codes currently held
 */
public record CacheStats(long hits, long misses, long cachedCodes) {

    /**
     * Share of encodings served without running the encoder, 0.0 before the first lookup.
     */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0);
    }
}
