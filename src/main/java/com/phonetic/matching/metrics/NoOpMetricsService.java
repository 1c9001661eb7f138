package com.phonetic.matching.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordEncodeDuration(String algorithm, Duration duration) {
    }

    @Override
    public void recordAlternatives(String algorithm, int count) {
    }

    @Override
    public void recordConfigLoadDuration(String source, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
