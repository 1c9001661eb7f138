package com.phonetic.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed encoding cache, bounded by size and optionally by age.
 */
public class CaffeineEncodingCache implements EncodingCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEncodingCache.class);

    private final Cache<CacheKey, String> cache;

    public CaffeineEncodingCache(CacheConfig config) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxCodes())
                .recordStats();
        config.expiry().ifPresent(builder::expireAfterWrite);
        this.cache = builder.build();
        log.info("CaffeineEncodingCache initialized: maxCodes={}, expireAfterWrite={}",
                config.maxCodes(), config.expiry().map(Duration::toString).orElse("never"));
    }

    @Override
    public Optional<String> get(String algorithm, String input) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(algorithm, input)));
    }

    @Override
    public void put(String algorithm, String input, String code) {
        cache.put(new CacheKey(algorithm, input), code);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Cache key combining encoder name and raw input.
     */
    record CacheKey(String algorithm, String input) {}
}
