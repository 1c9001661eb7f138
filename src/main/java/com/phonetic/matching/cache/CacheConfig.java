package com.phonetic.matching.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings of the encoding cache.
 *
 * <p>A code depends only on its input and the rules loaded at build time, so entries need no
 * expiry; {@code expireAfterWrite} is only set to bound how long rarely seen names stay resident.</p>
 *
 * @param maxCodes         maximum number of cached codes
 * @param expireAfterWrite lifetime of an entry, or {@code null} to keep entries until evicted by size
 * @param enabled          whether codes are cached at all
 */
public record CacheConfig(int maxCodes, Duration expireAfterWrite, boolean enabled) {

    public CacheConfig {
        if (maxCodes <= 0) {
            throw new IllegalArgumentException("maxCodes must be > 0");
        }
        if (expireAfterWrite != null && (expireAfterWrite.isZero() || expireAfterWrite.isNegative())) {
            throw new IllegalArgumentException("expireAfterWrite must be positive");
        }
    }

    /**
     * Up to 10,000 codes, never expiring.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, null, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, null, false);
    }

    public Optional<Duration> expiry() {
        return Optional.ofNullable(expireAfterWrite);
    }
}
