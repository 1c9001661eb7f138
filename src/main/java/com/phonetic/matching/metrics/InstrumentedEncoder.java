package com.phonetic.matching.metrics;

import com.phonetic.matching.blocking.PhoneticBlockingKeyStrategy;
import com.phonetic.matching.encoder.Encoder;
import com.phonetic.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Records duration and alternative count of every encode call of another encoder.
 */
public class InstrumentedEncoder implements Encoder {
    private static final Logger log = LoggerFactory.getLogger(InstrumentedEncoder.class);

    private final Encoder delegate;
    private final MetricsService metricsService;

    public InstrumentedEncoder(Encoder delegate, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    @Override
    public String encode(String value) {
        try (LogContext ctx = LogContext.forEncoding(delegate.getName())) {
            long start = System.nanoTime();
            String code = delegate.encode(value);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            metricsService.recordEncodeDuration(delegate.getName(), elapsed);
            metricsService.recordAlternatives(delegate.getName(), countAlternatives(code));
            log.debug("encoded input='{}' code='{}' in {}us", value, code, elapsed.toNanos() / 1_000);
            return code;
        }
    }

    @Override
    public boolean isEncodedEquals(String first, String second) {
        return delegate.isEncodedEquals(first, second);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    /**
     * Distinct alternatives in a code, counting each word of a grouped multi-word code separately.
     */
    static int countAlternatives(String code) {
        return PhoneticBlockingKeyStrategy.alternatives(code).size();
    }
}
