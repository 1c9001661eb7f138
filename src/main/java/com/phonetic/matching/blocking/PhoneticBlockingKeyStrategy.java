package com.phonetic.matching.blocking;

import com.phonetic.matching.encoder.Encoder;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blocking keys from phonetic codes. Multi-alternative codes such as Beider-Morse
 * {@code (ortlaj|ortlej)-(dortlaj|dortlej)} yield one key per alternative, e.g. {@code bm:ortlaj}.
 */
public class PhoneticBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final Pattern ALTERNATIVE = Pattern.compile("([^()|-]+)");

    private final Encoder encoder;
    private final String prefix;

    public PhoneticBlockingKeyStrategy(Encoder encoder, String prefix) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Set<String> generateKeys(String name) {
        Set<String> keys = new LinkedHashSet<>();
        if (name == null || name.isBlank()) {
            return keys;
        }
        Matcher matcher = ALTERNATIVE.matcher(encoder.encode(name));
        while (matcher.find()) {
            keys.add(prefix + ":" + matcher.group(1));
        }
        return keys;
    }

    /**
     * Individual alternatives of a code, in order of appearance.
     */
    public static Set<String> alternatives(String code) {
        Set<String> alternatives = new LinkedHashSet<>();
        Matcher matcher = ALTERNATIVE.matcher(code);
        while (matcher.find()) {
            alternatives.add(matcher.group(1));
        }
        return alternatives;
    }
}
