package com.phonetic.matching.metrics;

import com.phonetic.matching.encoder.Encoder;
import com.phonetic.matching.encoder.Soundex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordEncodeDuration("soundex", Duration.ofMillis(1));
                noOp.recordAlternatives("beider-morse", 4);
                noOp.recordConfigLoadDuration("classpath:bm", Duration.ofMillis(100));
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record encode duration as timer and count")
        void recordEncodeDuration() {
            metrics.recordEncodeDuration("soundex", Duration.ofNanos(1500));
            metrics.recordEncodeDuration("soundex", Duration.ofNanos(2500));
            metrics.recordEncodeDuration("cologne", Duration.ofNanos(2500));

            Timer timer = registry.find("phonetic.encode.duration").tag("algorithm", "soundex").timer();
            Counter counter = registry.find("phonetic.encode.count").tag("algorithm", "soundex").counter();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("Should record alternatives as distribution summary")
        void recordAlternatives() {
            metrics.recordAlternatives("beider-morse", 8);
            metrics.recordAlternatives("beider-morse", 2);

            DistributionSummary summary = registry.find("phonetic.encode.alternatives")
                    .tag("algorithm", "beider-morse")
                    .summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(10.0, summary.totalAmount());
            assertEquals(8.0, summary.max());
        }

        @Test
        @DisplayName("Should record config load duration per source")
        void recordConfigLoadDuration() {
            metrics.recordConfigLoadDuration("classpath:com/phonetic/matching/bm/", Duration.ofMillis(120));

            Timer timer = registry.find("phonetic.config.load.duration")
                    .tag("source", "classpath:com/phonetic/matching/bm/")
                    .timer();

            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void recordCacheHitsAndMisses() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("phonetic.cache.hits").counter().count());
            assertEquals(1.0, registry.find("phonetic.cache.misses").counter().count());
        }
    }

    @Nested
    @DisplayName("InstrumentedEncoder")
    class InstrumentedEncoderTests {

        @Test
        @DisplayName("Should record duration and alternatives of each call")
        void recordsEveryCall() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            InstrumentedEncoder encoder = new InstrumentedEncoder(new Soundex(), new MicrometerMetricsService(registry));

            assertEquals("R163", encoder.encode("Robert"));
            assertEquals("R163", encoder.encode("Rupert"));

            Timer timer = registry.find("phonetic.encode.duration").tag("algorithm", "soundex").timer();
            DistributionSummary summary = registry.find("phonetic.encode.alternatives")
                    .tag("algorithm", "soundex")
                    .summary();
            assertEquals(2, timer.count());
            assertEquals(2.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should pass name and equality checks through")
        void delegatesNameAndEquality() {
            Encoder delegate = mock(Encoder.class);
            when(delegate.getName()).thenReturn("fake");
            when(delegate.isEncodedEquals("a", "b")).thenReturn(true);

            InstrumentedEncoder encoder = new InstrumentedEncoder(delegate, new NoOpMetricsService());

            assertEquals("fake", encoder.getName());
            assertTrue(encoder.isEncodedEquals("a", "b"));
        }

        @ParameterizedTest(name = "''{0}'' has {1} alternatives")
        @CsvSource({
                "'', 0",
                "R163, 1",
                "rinD|rinDlt|rina, 3",
                "154600|454600, 2",
                "(ortlaj|ortlej)-(dortlaj|dortlej), 4"
        })
        void countsAlternatives(String code, int expected) {
            assertEquals(expected, InstrumentedEncoder.countAlternatives(code));
        }
    }
}
