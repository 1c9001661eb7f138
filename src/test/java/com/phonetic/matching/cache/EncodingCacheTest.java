package com.phonetic.matching.cache;

import com.phonetic.matching.encoder.Encoder;
import com.phonetic.matching.encoder.Soundex;
import com.phonetic.matching.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EncodingCacheTest {

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Defaults should hold 10,000 codes without expiry")
        void testDefaults() {
            CacheConfig config = CacheConfig.defaults();
            assertEquals(10_000, config.maxCodes());
            assertTrue(config.expiry().isEmpty());
            assertTrue(config.enabled());
        }

        @Test
        @DisplayName("Disabled config should not be enabled")
        void testDisabled() {
            assertFalse(CacheConfig.disabled().enabled());
        }

        @Test
        @DisplayName("Should reject non-positive sizes and lifetimes")
        void testRejectsInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, null, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ofSeconds(-1), true));
        }
    }

    @Nested
    @DisplayName("NoOpEncodingCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpEncodingCache cache = new NoOpEncodingCache();
            cache.put("soundex", "Robert", "R163");
            assertTrue(cache.get("soundex", "Robert").isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpEncodingCache().getStats();
            assertEquals(CacheStats.empty(), stats);
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineEncodingCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve codes")
        void testPutAndGet() {
            CaffeineEncodingCache cache = new CaffeineEncodingCache(CacheConfig.defaults());
            cache.put("soundex", "Robert", "R163");

            Optional<String> cached = cache.get("soundex", "Robert");

            assertTrue(cached.isPresent());
            assertEquals("R163", cached.get());
        }

        @Test
        @DisplayName("Should key entries by algorithm and input")
        void testKeyedByAlgorithm() {
            CaffeineEncodingCache cache = new CaffeineEncodingCache(CacheConfig.defaults());
            cache.put("soundex", "Robert", "R163");

            assertTrue(cache.get("metaphone", "Robert").isEmpty());
            assertTrue(cache.get("soundex", "robert").isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineEncodingCache cache = new CaffeineEncodingCache(CacheConfig.defaults());
            cache.put("soundex", "Robert", "R163");

            cache.get("soundex", "Robert");
            cache.get("soundex", "Robert");
            cache.get("soundex", "Rupert");

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(1, stats.cachedCodes());
            assertEquals(2.0 / 3.0, stats.hitRate(), 0.0001);
        }

        @Test
        @DisplayName("Should expire codes when a lifetime is set")
        void testExpiry() throws InterruptedException {
            CaffeineEncodingCache cache = new CaffeineEncodingCache(
                    new CacheConfig(100, Duration.ofMillis(20), true));
            cache.put("soundex", "Robert", "R163");

            Thread.sleep(100);

            assertTrue(cache.get("soundex", "Robert").isEmpty());
        }

        @Test
        @DisplayName("Should invalidate all entries")
        void testInvalidateAll() {
            CaffeineEncodingCache cache = new CaffeineEncodingCache(CacheConfig.defaults());
            cache.put("soundex", "Robert", "R163");
            cache.put("soundex", "Rupert", "R163");

            cache.invalidateAll();

            assertTrue(cache.get("soundex", "Robert").isEmpty());
            assertTrue(cache.get("soundex", "Rupert").isEmpty());
        }
    }

    @Nested
    @DisplayName("CachingEncoder")
    class CachingEncoderTests {

        @Test
        @DisplayName("Should call the delegate once per distinct input")
        void testMemoizes() {
            Encoder delegate = mock(Encoder.class);
            when(delegate.getName()).thenReturn("fake");
            when(delegate.encode("Robert")).thenReturn("R163");

            CachingEncoder encoder = new CachingEncoder(delegate, new CaffeineEncodingCache(CacheConfig.defaults()));

            assertEquals("R163", encoder.encode("Robert"));
            assertEquals("R163", encoder.encode("Robert"));
            verify(delegate, times(1)).encode("Robert");
            assertEquals(1, encoder.getStats().hits());
        }

        @Test
        @DisplayName("Should report hits and misses to the metrics service")
        void testRecordsMetrics() {
            MetricsService metrics = mock(MetricsService.class);
            CachingEncoder encoder = new CachingEncoder(new Soundex(),
                    new CaffeineEncodingCache(CacheConfig.defaults()), metrics);

            encoder.encode("Robert");
            encoder.encode("Robert");
            encoder.encode("Rupert");

            verify(metrics, times(1)).recordCacheHit();
            verify(metrics, times(2)).recordCacheMiss();
        }

        @Test
        @DisplayName("Should return the same codes as the delegate")
        void testTransparent() {
            Soundex soundex = new Soundex();
            CachingEncoder encoder = new CachingEncoder(soundex, new CaffeineEncodingCache(CacheConfig.defaults()));

            assertEquals(soundex.encode("Washington"), encoder.encode("Washington"));
            assertEquals(soundex.encode("Washington"), encoder.encode("Washington"));
            assertEquals("soundex", encoder.getName());
            assertSame(soundex, encoder.getDelegate());
        }

        @Test
        @DisplayName("Should delegate equality checks")
        void testDelegatesEquality() {
            Encoder delegate = mock(Encoder.class);
            when(delegate.isEncodedEquals(anyString(), anyString())).thenReturn(true);

            CachingEncoder encoder = new CachingEncoder(delegate, new NoOpEncodingCache());

            assertTrue(encoder.isEncodedEquals("a", "b"));
            verify(delegate).isEncodedEquals("a", "b");
            verify(delegate, never()).encode(anyString());
        }
    }
}
