package com.phonetic.matching.cache;

import java.util.Optional;

/**
 * Cache of phonetic codes, keyed by algorithm name and raw input.
 */
public interface EncodingCache {

    /**
     * Gets a cached code.
     *
     * @param algorithm the encoder name
     * @param input     the raw input
     * @return the cached code, or empty if not cached
     */
    Optional<String> get(String algorithm, String input);

    /**
     * Caches a code.
     */
    void put(String algorithm, String input, String code);

    /**
     * Invalidates all cache entries, e.g. after rules were reloaded.
     */
    void invalidateAll();

    CacheStats getStats();
}
