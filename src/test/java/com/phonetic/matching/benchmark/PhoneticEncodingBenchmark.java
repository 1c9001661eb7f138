package com.phonetic.matching.benchmark;

import com.phonetic.matching.bm.BeiderMorseConfig;
import com.phonetic.matching.bm.EngineOptions;
import com.phonetic.matching.bm.NameType;
import com.phonetic.matching.bm.PhoneticEngine;
import com.phonetic.matching.bm.RuleType;
import com.phonetic.matching.dm.DaitchMokotoffSoundex;
import com.phonetic.matching.encoder.ColognePhonetic;
import com.phonetic.matching.encoder.Metaphone;
import com.phonetic.matching.encoder.Soundex;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks of single-name encoding: Beider-Morse per name type against the
 * cheaper sibling encoders.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class PhoneticEncodingBenchmark {

    private static final String[] NAMES = {
            "Renault", "Schwarzenegger", "Moskowitz", "van Helsing", "d'Ortley", "Judenburg",
            "Washington", "Müller-Lüdenscheidt", "Rosochowaciec", "Thompson"
    };

    @Param({"ASHKENAZI", "GENERIC", "SEPHARDIC"})
    private NameType nameType;

    private PhoneticEngine approxEngine;
    private PhoneticEngine exactEngine;
    private DaitchMokotoffSoundex daitchMokotoff;
    private Soundex soundex;
    private Metaphone metaphone;
    private ColognePhonetic cologne;
    private int counter;

    @Setup(Level.Trial)
    public void setUp() {
        BeiderMorseConfig config = BeiderMorseConfig.bundled();
        approxEngine = new PhoneticEngine(config, EngineOptions.builder()
                .nameType(nameType)
                .ruleType(RuleType.APPROX)
                .build());
        exactEngine = new PhoneticEngine(config, EngineOptions.builder()
                .nameType(nameType)
                .ruleType(RuleType.EXACT)
                .build());
        daitchMokotoff = new DaitchMokotoffSoundex();
        soundex = new Soundex();
        metaphone = new Metaphone();
        cologne = new ColognePhonetic();
        counter = 0;
    }

    private String nextName() {
        return NAMES[counter++ % NAMES.length];
    }

    @Benchmark
    public void beiderMorseApprox(Blackhole bh) {
        bh.consume(approxEngine.encode(nextName()));
    }

    @Benchmark
    public void beiderMorseExact(Blackhole bh) {
        bh.consume(exactEngine.encode(nextName()));
    }

    /**
     * Baseline for the rule-driven engines; independent of the name type parameter.
     */
    @Benchmark
    public void daitchMokotoffAllBranches(Blackhole bh) {
        bh.consume(daitchMokotoff.soundex(nextName()));
    }

    @Benchmark
    public void simpleEncoders(Blackhole bh) {
        String name = nextName();
        bh.consume(soundex.encode(name));
        bh.consume(metaphone.encode(name));
        bh.consume(cologne.encode(name));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(PhoneticEncodingBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
