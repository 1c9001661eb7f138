package com.phonetic.matching.encoder;

import java.util.Locale;

/**
 * Helpers shared by the Soundex family.
 */
public final class SoundexUtils {

    private SoundexUtils() {
    }

    /**
     * Keeps letters only, upper-cased.
     */
    public static String clean(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(c);
            }
        }
        return sb.toString().toUpperCase(Locale.ENGLISH);
    }

    /**
     * Like {@link #clean(String)} but also drops letters outside A-Z, such as accented ones.
     */
    public static String cleanAsciiLetters(String value) {
        String cleaned = clean(value);
        if (cleaned == null || cleaned.isEmpty()) {
            return cleaned;
        }
        StringBuilder sb = new StringBuilder(cleaned.length());
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Encodes both values and counts the positions holding the same character.
     */
    public static int difference(Encoder encoder, String first, String second) {
        return differenceEncoded(encoder.encode(first), encoder.encode(second));
    }

    /**
     * Counts the positions at which two codes hold the same character; 0 when either is empty.
     */
    public static int differenceEncoded(String first, String second) {
        if (first == null || second == null) {
            return 0;
        }
        int length = Math.min(first.length(), second.length());
        int diff = 0;
        for (int i = 0; i < length; i++) {
            if (first.charAt(i) == second.charAt(i)) {
                diff++;
            }
        }
        return diff;
    }
}
