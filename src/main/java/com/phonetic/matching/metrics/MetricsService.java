package com.phonetic.matching.metrics;

import java.time.Duration;

/**
 * Interface for recording phonetic encoding metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without any
 * metrics backend.
 */
public interface MetricsService {

    void recordEncodeDuration(String algorithm, Duration duration);

    /**
     * Records how many {@code |}-separated alternatives a code holds.
     */
    void recordAlternatives(String algorithm, int count);

    void recordConfigLoadDuration(String source, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
