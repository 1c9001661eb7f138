package com.phonetic.matching.bm;

import com.phonetic.matching.encoder.Encoder;

import java.util.Objects;

/**
 * {@link Encoder} view of a {@link PhoneticEngine}.
 */
public class BeiderMorseEncoder implements Encoder {

    private final PhoneticEngine engine;

    public BeiderMorseEncoder(BeiderMorseConfig config) {
        this(config, EngineOptions.defaults());
    }

    public BeiderMorseEncoder(BeiderMorseConfig config, EngineOptions options) {
        this(new PhoneticEngine(config, options));
    }

    public BeiderMorseEncoder(PhoneticEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        return engine.encode(value);
    }

    @Override
    public String getName() {
        return "beider-morse";
    }
}
