package com.phonetic.matching.encoder;

import java.util.Objects;

/**
 * Phonex, a Soundex refinement combining Soundex and Phonix preprocessing.
 * Codes are the first letter followed by digits, zero-padded to the maximum length.
 */
public class Phonex implements Encoder {

    private static final int DEFAULT_MAX_CODE_LENGTH = 4;

    private final int maxCodeLength;

    public Phonex() {
        this(DEFAULT_MAX_CODE_LENGTH);
    }

    public Phonex(int maxCodeLength) {
        if (maxCodeLength <= 0) {
            throw new IllegalArgumentException("maxCodeLength must be positive");
        }
        this.maxCodeLength = maxCodeLength;
    }

    @Override
    public String getName() {
        return "phonex";
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        String text = preprocess(value);
        StringBuilder code = new StringBuilder(maxCodeLength);
        char last = '0';
        int i = 0;

        while (i < text.length() && code.length() < maxCodeLength) {
            char current = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            boolean isLast = i == text.length() - 1;
            boolean skipNext = false;
            char digit;

            switch (current) {
                case 'B', 'P', 'F', 'V' -> digit = '1';
                case 'C', 'S', 'K', 'G', 'J', 'Q', 'X', 'Z' -> digit = '2';
                case 'D', 'T' -> digit = next == 'C' ? '0' : '3';
                case 'L' -> digit = isVowel(next) || isLast ? '4' : '0';
                case 'M', 'N' -> {
                    skipNext = next == 'D' || next == 'G';
                    digit = '5';
                }
                case 'R' -> digit = isVowel(next) || isLast ? '6' : '0';
                default -> digit = '0';
            }
            if (skipNext) {
                i++;
            }

            if (last != digit && digit != '0' && i != 0) {
                code.append(digit);
            }
            if (i == 0) {
                code.append(current);
                last = digit;
            } else {
                last = code.charAt(code.length() - 1);
            }
            i++;
        }

        while (code.length() < maxCodeLength) {
            code.append('0');
        }
        return code.toString();
    }

    /**
     * Drops trailing S, simplifies some leading letter pairs and folds the first letter.
     */
    String preprocess(String value) {
        String text = SoundexUtils.cleanAsciiLetters(value);
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == 'S') {
            end--;
        }
        text = text.substring(0, end);

        if (text.startsWith("KN")) {
            text = "N" + text.substring(2);
        } else if (text.startsWith("PH")) {
            text = "F" + text.substring(2);
        } else if (text.startsWith("WR")) {
            text = "R" + text.substring(2);
        }
        if (text.startsWith("H")) {
            text = text.substring(1);
        }
        if (text.isEmpty()) {
            return text;
        }

        char first = switch (text.charAt(0)) {
            case 'E', 'I', 'O', 'U', 'Y' -> 'A';
            case 'P' -> 'B';
            case 'V' -> 'F';
            case 'K', 'Q' -> 'C';
            case 'J' -> 'G';
            case 'Z' -> 'S';
            default -> text.charAt(0);
        };
        return first + text.substring(1);
    }

    private static boolean isVowel(char c) {
        return c == 'A' || c == 'E' || c == 'I' || c == 'O' || c == 'U' || c == 'Y';
    }
}
