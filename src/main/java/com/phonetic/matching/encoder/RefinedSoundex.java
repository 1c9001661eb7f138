package com.phonetic.matching.encoder;

import java.util.Objects;

/**
 * Refined Soundex: variable-length code keeping the first letter followed by the code of every
 * letter, consecutive duplicates collapsed.
 */
public class RefinedSoundex implements SoundexEncoder {

    public static final String US_ENGLISH_MAPPING = "01360240043788015936020505";

    private final String mapping;

    public RefinedSoundex() {
        this(US_ENGLISH_MAPPING);
    }

    public RefinedSoundex(String mapping) {
        if (mapping == null || mapping.length() != 26) {
            throw new IllegalArgumentException("mapping must contain exactly 26 codes, one per letter A-Z");
        }
        this.mapping = mapping;
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        String text = SoundexUtils.cleanAsciiLetters(value);
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder code = new StringBuilder();
        code.append(text.charAt(0));
        char last = '*';
        for (int i = 0; i < text.length(); i++) {
            char current = mapping.charAt(text.charAt(i) - 'A');
            if (current != last) {
                code.append(current);
            }
            last = current;
        }
        return code.toString();
    }

    @Override
    public String getName() {
        return "refined-soundex";
    }
}
