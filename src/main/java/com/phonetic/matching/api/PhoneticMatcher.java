package com.phonetic.matching.api;

import com.phonetic.matching.blocking.BlockingKeyStrategy;
import com.phonetic.matching.blocking.PhoneticBlockingKeyStrategy;
import com.phonetic.matching.bm.BeiderMorseConfig;
import com.phonetic.matching.bm.BeiderMorseEncoder;
import com.phonetic.matching.bm.EngineOptions;
import com.phonetic.matching.cache.CacheConfig;
import com.phonetic.matching.cache.CacheStats;
import com.phonetic.matching.cache.CachingEncoder;
import com.phonetic.matching.cache.CaffeineEncodingCache;
import com.phonetic.matching.cache.EncodingCache;
import com.phonetic.matching.cache.NoOpEncodingCache;
import com.phonetic.matching.dm.DaitchMokotoffRules;
import com.phonetic.matching.dm.DaitchMokotoffSoundex;
import com.phonetic.matching.encoder.Caverphone1;
import com.phonetic.matching.encoder.Caverphone2;
import com.phonetic.matching.encoder.ColognePhonetic;
import com.phonetic.matching.encoder.DoubleMetaphone;
import com.phonetic.matching.encoder.DoubleMetaphoneResult;
import com.phonetic.matching.encoder.Encoder;
import com.phonetic.matching.encoder.MatchRatingApproachEncoder;
import com.phonetic.matching.encoder.Metaphone;
import com.phonetic.matching.encoder.Nysiis;
import com.phonetic.matching.encoder.Phonex;
import com.phonetic.matching.encoder.RefinedSoundex;
import com.phonetic.matching.encoder.Soundex;
import com.phonetic.matching.metrics.InstrumentedEncoder;
import com.phonetic.matching.metrics.MetricsService;
import com.phonetic.matching.metrics.NoOpMetricsService;
import com.phonetic.matching.rules.ClasspathRuleSource;
import com.phonetic.matching.rules.RuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Main entry point: one phonetic algorithm, optionally cached and instrumented.
 *
 * <pre>
 * PhoneticMatcher matcher = PhoneticMatcher.builder()
 *     .algorithm(PhoneticAlgorithm.BEIDER_MORSE)
 *     .engineOptions(EngineOptions.builder().nameType(NameType.ASHKENAZI).build())
 *     .cacheConfig(CacheConfig.defaults())
 *     .build();
 *
 * String code = matcher.encode("Schwarzenegger");
 * boolean same = matcher.isMatch("Moskowitz", "Moskovitz");
 * </pre>
 *
 * <p>Rule-based algorithms load and validate their rules in {@link Builder#build()}; once built,
 * a matcher never fails on input and is safe for concurrent use.</p>
 */
public class PhoneticMatcher {
    private static final Logger log = LoggerFactory.getLogger(PhoneticMatcher.class);

    private final PhoneticAlgorithm algorithm;
    private final Encoder baseEncoder;
    private final Encoder encoder;
    private final EncodingCache cache;
    private final BlockingKeyStrategy blockingKeyStrategy;

    private PhoneticMatcher(Builder builder) {
        this.algorithm = builder.algorithm;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        this.baseEncoder = createEncoder(builder, metricsService);

        Encoder decorated = builder.metricsService != null
                ? new InstrumentedEncoder(baseEncoder, metricsService) : baseEncoder;
        if (builder.cacheConfig.enabled()) {
            this.cache = new CaffeineEncodingCache(builder.cacheConfig);
            decorated = new CachingEncoder(decorated, cache, metricsService);
        } else {
            this.cache = new NoOpEncodingCache();
        }
        this.encoder = decorated;
        String prefix = builder.blockingKeyPrefix != null ? builder.blockingKeyPrefix : encoder.getName();
        this.blockingKeyStrategy = new PhoneticBlockingKeyStrategy(encoder, prefix);

        log.info("PhoneticMatcher initialized: algorithm={}, cache={}, metrics={}",
                algorithm, builder.cacheConfig.enabled(), builder.metricsService != null);
    }

    public PhoneticAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * The (possibly cached and instrumented) encoder.
     */
    public Encoder getEncoder() {
        return encoder;
    }

    public String encode(String name) {
        return encoder.encode(name);
    }

    /**
     * Whether two names sound alike.
     *
     * <p>Beider-Morse and Daitch-Mokotoff codes hold several alternatives; names match when they
     * share at least one. Double Metaphone names match when any of their primary and alternate
     * codes agree. Other algorithms use their encoder's own comparison.</p>
     */
    public boolean isMatch(String name1, String name2) {
        Objects.requireNonNull(name1, "name1");
        Objects.requireNonNull(name2, "name2");
        return switch (algorithm) {
            case BEIDER_MORSE -> sharesAlternative(encoder.encode(name1), encoder.encode(name2));
            case DAITCH_MOKOTOFF -> {
                DaitchMokotoffSoundex dm = (DaitchMokotoffSoundex) baseEncoder;
                yield sharesAlternative(dm.soundex(name1), dm.soundex(name2));
            }
            case DOUBLE_METAPHONE -> {
                DoubleMetaphone doubleMetaphone = (DoubleMetaphone) baseEncoder;
                yield sharesCode(doubleMetaphone.doubleMetaphone(name1), doubleMetaphone.doubleMetaphone(name2));
            }
            default -> encoder.isEncodedEquals(name1, name2);
        };
    }

    /**
     * Blocking keys of a name, one per code alternative.
     */
    public Set<String> blockingKeys(String name) {
        return blockingKeyStrategy.generateKeys(name);
    }

    public BlockingKeyStrategy getBlockingKeyStrategy() {
        return blockingKeyStrategy;
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    private static boolean sharesAlternative(String code1, String code2) {
        Set<String> alternatives1 = PhoneticBlockingKeyStrategy.alternatives(code1);
        Set<String> alternatives2 = PhoneticBlockingKeyStrategy.alternatives(code2);
        return !Collections.disjoint(alternatives1, alternatives2);
    }

    private static boolean sharesCode(DoubleMetaphoneResult first, DoubleMetaphoneResult second) {
        return first.primary().equals(second.primary())
                || first.primary().equals(second.alternate())
                || first.alternate().equals(second.primary())
                || first.alternate().equals(second.alternate());
    }

    private static Encoder createEncoder(Builder builder, MetricsService metricsService) {
        return switch (builder.algorithm) {
            case BEIDER_MORSE -> {
                BeiderMorseConfig config = builder.beiderMorseConfig;
                if (config == null) {
                    RuleSource source = builder.ruleSource != null
                            ? builder.ruleSource : ClasspathRuleSource.beiderMorse();
                    long start = System.nanoTime();
                    config = BeiderMorseConfig.load(source);
                    metricsService.recordConfigLoadDuration(source.describe(),
                            Duration.ofNanos(System.nanoTime() - start));
                }
                yield new BeiderMorseEncoder(config, builder.engineOptions);
            }
            case DAITCH_MOKOTOFF -> {
                RuleSource source = builder.ruleSource != null
                        ? builder.ruleSource : ClasspathRuleSource.daitchMokotoff();
                long start = System.nanoTime();
                DaitchMokotoffRules rules = DaitchMokotoffRules.load(source);
                metricsService.recordConfigLoadDuration(source.describe(),
                        Duration.ofNanos(System.nanoTime() - start));
                yield new DaitchMokotoffSoundex(rules, builder.asciiFolding);
            }
            case SOUNDEX -> new Soundex();
            case SOUNDEX_GENEALOGY -> Soundex.genealogy();
            case REFINED_SOUNDEX -> new RefinedSoundex();
            case CAVERPHONE1 -> new Caverphone1();
            case CAVERPHONE2 -> new Caverphone2();
            case COLOGNE -> new ColognePhonetic();
            case NYSIIS -> new Nysiis(builder.strictNysiis);
            case METAPHONE -> new Metaphone(builder.maxCodeLength);
            case DOUBLE_METAPHONE -> new DoubleMetaphone(builder.maxCodeLength);
            case MATCH_RATING_APPROACH -> new MatchRatingApproachEncoder();
            case PHONEX -> new Phonex(builder.maxCodeLength);
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private static final int DEFAULT_MAX_CODE_LENGTH = 4;

        private PhoneticAlgorithm algorithm;
        private EngineOptions engineOptions = EngineOptions.defaults();
        private BeiderMorseConfig beiderMorseConfig;
        private RuleSource ruleSource;
        private boolean asciiFolding = true;
        private boolean strictNysiis = true;
        private int maxCodeLength = DEFAULT_MAX_CODE_LENGTH;
        private CacheConfig cacheConfig = CacheConfig.disabled();
        private MetricsService metricsService;
        private String blockingKeyPrefix;

        /**
         * Sets the algorithm. Required.
         */
        public Builder algorithm(PhoneticAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        /**
         * Sets Beider-Morse engine options. Ignored by other algorithms.
         */
        public Builder engineOptions(EngineOptions engineOptions) {
            if (engineOptions == null) {
                throw new IllegalArgumentException("engineOptions cannot be null");
            }
            this.engineOptions = engineOptions;
            return this;
        }

        /**
         * Reuses an already loaded Beider-Morse configuration instead of loading one.
         */
        public Builder beiderMorseConfig(BeiderMorseConfig config) {
            this.beiderMorseConfig = config;
            return this;
        }

        /**
         * Where rule-based algorithms read their rules. Defaults to the bundled rules.
         */
        public Builder ruleSource(RuleSource ruleSource) {
            this.ruleSource = ruleSource;
            return this;
        }

        /**
         * Daitch-Mokotoff ASCII folding, on by default.
         */
        public Builder asciiFolding(boolean asciiFolding) {
            this.asciiFolding = asciiFolding;
            return this;
        }

        /**
         * NYSIIS strict mode (six-character codes), on by default.
         */
        public Builder strictNysiis(boolean strictNysiis) {
            this.strictNysiis = strictNysiis;
            return this;
        }

        /**
         * Code length for Metaphone, Double Metaphone and Phonex, 4 by default.
         */
        public Builder maxCodeLength(int maxCodeLength) {
            if (maxCodeLength <= 0) {
                throw new IllegalArgumentException("maxCodeLength must be positive");
            }
            this.maxCodeLength = maxCodeLength;
            return this;
        }

        /**
         * Enables caching of codes. Disabled by default.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig cannot be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a metrics service. Encode calls are only instrumented when one is set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Prefix of blocking keys. Defaults to the encoder name.
         */
        public Builder blockingKeyPrefix(String blockingKeyPrefix) {
            this.blockingKeyPrefix = blockingKeyPrefix;
            return this;
        }

        public PhoneticMatcher build() {
            if (algorithm == null) {
                throw new IllegalStateException("PhoneticAlgorithm is required");
            }
            return new PhoneticMatcher(this);
        }
    }
}
