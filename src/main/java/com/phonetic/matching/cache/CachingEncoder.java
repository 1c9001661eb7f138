package com.phonetic.matching.cache;

import com.phonetic.matching.encoder.Encoder;
import com.phonetic.matching.metrics.MetricsService;
import com.phonetic.matching.metrics.NoOpMetricsService;

import java.util.Objects;
import java.util.Optional;

/**
 * Memoizes the codes of another encoder. Equality checks are delegated unchanged, since some
 * encoders compare more than the codes.
 */
public class CachingEncoder implements Encoder {

    private final Encoder delegate;
    private final EncodingCache cache;
    private final MetricsService metricsService;

    public CachingEncoder(Encoder delegate, EncodingCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingEncoder(Encoder delegate, EncodingCache cache, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        Optional<String> cached = cache.get(delegate.getName(), value);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        String code = delegate.encode(value);
        cache.put(delegate.getName(), value, code);
        return code;
    }

    @Override
    public boolean isEncodedEquals(String first, String second) {
        return delegate.isEncodedEquals(first, second);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    public Encoder getDelegate() {
        return delegate;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }
}
