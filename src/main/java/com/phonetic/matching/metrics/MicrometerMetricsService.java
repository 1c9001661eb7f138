package com.phonetic.matching.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code phonetic.encode.duration}: Timer (tag: algorithm)</li>
 *   <li>{@code phonetic.encode.count}: Counter (tag: algorithm)</li>
 *   <li>{@code phonetic.encode.alternatives}: DistributionSummary (tag: algorithm)</li>
 *   <li>{@code phonetic.config.load.duration}: Timer (tag: source)</li>
 *   <li>{@code phonetic.cache.hits}: Counter</li>
 *   <li>{@code phonetic.cache.misses}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("phonetic.cache.hits")
                .description("Number of encoding cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("phonetic.cache.misses")
                .description("Number of encoding cache misses")
                .register(registry);
    }

    @Override
    public void recordEncodeDuration(String algorithm, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("encode:" + algorithm, k ->
                Timer.builder("phonetic.encode.duration")
                        .description("Duration of encode calls")
                        .tag("algorithm", algorithm)
                        .register(registry));
        timer.record(duration);

        Counter counter = counterCache.computeIfAbsent(algorithm, k ->
                Counter.builder("phonetic.encode.count")
                        .description("Number of encode calls")
                        .tag("algorithm", algorithm)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordAlternatives(String algorithm, int count) {
        DistributionSummary summary = summaryCache.computeIfAbsent(algorithm, k ->
                DistributionSummary.builder("phonetic.encode.alternatives")
                        .description("Number of alternatives per code")
                        .tag("algorithm", algorithm)
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordConfigLoadDuration(String source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("config:" + source, k ->
                Timer.builder("phonetic.config.load.duration")
                        .description("Duration of rule configuration loads")
                        .tag("source", source)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
