package com.phonetic.matching.encoder;

import java.util.Objects;

/**
 * American Soundex: first letter followed by three digits.
 *
 * <p>The mapping assigns a digit to each letter A-Z. {@code '0'} marks letters that separate
 * equal codes (vowels), {@code '-'} marks silent letters that never separate them. With the
 * special H/W handling, H and W are skipped entirely, so consonants with the same code on either
 * side of them collapse.</p>
 */
public class Soundex implements SoundexEncoder {

    /** Letters A-Z: {@code 01230120022455012623010202}. */
    public static final String US_ENGLISH_MAPPING = "01230120022455012623010202";

    /** Genealogy variant: vowels, H, W and Y are silent. */
    public static final String GENEALOGY_MAPPING = "-123-12--22455-12623-1-2-2";

    private static final char SILENT_MARKER = '-';
    private static final int CODE_LENGTH = 4;

    private final String mapping;
    private final boolean specialCaseHW;

    public Soundex() {
        this(US_ENGLISH_MAPPING);
    }

    /**
     * Special H/W handling is on unless the mapping declares silent letters.
     */
    public Soundex(String mapping) {
        this(mapping, mapping.indexOf(SILENT_MARKER) < 0);
    }

    public Soundex(String mapping, boolean specialCaseHW) {
        if (mapping == null || mapping.length() != 26) {
            throw new IllegalArgumentException("mapping must contain exactly 26 codes, one per letter A-Z");
        }
        this.mapping = mapping;
        this.specialCaseHW = specialCaseHW;
    }

    public static Soundex genealogy() {
        return new Soundex(GENEALOGY_MAPPING);
    }

    /**
     * US mapping where H and W separate equal codes like vowels do.
     */
    public static Soundex simplified() {
        return new Soundex(US_ENGLISH_MAPPING, false);
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        String text = SoundexUtils.cleanAsciiLetters(value);
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        code.append(text.charAt(0));
        char previous = map(text.charAt(0));
        for (int i = 1; i < text.length() && code.length() < CODE_LENGTH; i++) {
            char c = text.charAt(i);
            if (specialCaseHW && (c == 'H' || c == 'W')) {
                continue;
            }
            char digit = map(c);
            if (digit == SILENT_MARKER) {
                continue;
            }
            if (digit != '0' && digit != previous) {
                code.append(digit);
            }
            previous = digit;
        }
        while (code.length() < CODE_LENGTH) {
            code.append('0');
        }
        return code.toString();
    }

    @Override
    public String getName() {
        return "soundex";
    }

    public boolean isSpecialCaseHW() {
        return specialCaseHW;
    }

    private char map(char letter) {
        return mapping.charAt(letter - 'A');
    }
}
