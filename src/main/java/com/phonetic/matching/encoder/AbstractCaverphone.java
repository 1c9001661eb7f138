package com.phonetic.matching.encoder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Caverphone encoders: an ordered chain of regex rewrites over the lower-cased letters, padded
 * with {@code 1} to a fixed length.
 */
public abstract class AbstractCaverphone implements Encoder {

    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]");

    /**
     * One step of the rewrite chain.
     */
    protected record Rewrite(Pattern pattern, String replacement) {

        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }

    private final List<Rewrite> rewrites;
    private final int codeLength;
    private final String padding;

    protected AbstractCaverphone(List<Rewrite> rewrites, int codeLength) {
        this.rewrites = List.copyOf(rewrites);
        this.codeLength = codeLength;
        this.padding = "1".repeat(codeLength);
    }

    protected static Rewrite rewrite(String regex, String replacement) {
        return new Rewrite(Pattern.compile(regex), replacement);
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            return padding;
        }
        String text = NON_LETTERS.matcher(value.toLowerCase(Locale.ENGLISH)).replaceAll("");
        for (Rewrite step : rewrites) {
            text = step.apply(text);
        }
        return (text + padding).substring(0, codeLength);
    }

    public int getCodeLength() {
        return codeLength;
    }
}
