package com.phonetic.matching.cache;

import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpEncodingCache implements EncodingCache {

    @Override
    public Optional<String> get(String algorithm, String input) {
        return Optional.empty();
    }

    @Override
    public void put(String algorithm, String input, String code) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
