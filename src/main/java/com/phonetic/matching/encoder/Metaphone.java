package com.phonetic.matching.encoder;

import java.util.Locale;
import java.util.Objects;

/**
 * Lawrence Philips' original Metaphone.
 */
public class Metaphone implements Encoder {

    private static final int DEFAULT_MAX_CODE_LENGTH = 4;

    private static final String VOWELS = "AEIOU";
    private static final String FRONTV = "EIY";
    private static final String VARSON = "CSPTG";

    private final int maxCodeLength;

    public Metaphone() {
        this(DEFAULT_MAX_CODE_LENGTH);
    }

    public Metaphone(int maxCodeLength) {
        if (maxCodeLength <= 0) {
            throw new IllegalArgumentException("maxCodeLength must be positive");
        }
        this.maxCodeLength = maxCodeLength;
    }

    public int getMaxCodeLength() {
        return maxCodeLength;
    }

    @Override
    public String getName() {
        return "metaphone";
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            return "";
        }
        if (value.length() == 1) {
            return value.toUpperCase(Locale.ENGLISH);
        }

        String local = initialTransform(value.toUpperCase(Locale.ENGLISH));
        int wdsz = local.length();
        StringBuilder code = new StringBuilder(maxCodeLength + 1);
        int n = 0;

        while (code.length() < maxCodeLength && n < wdsz) {
            char symb = local.charAt(n);
            if (symb != 'C' && isPreviousChar(local, n, symb)) {
                n++;
                continue;
            }
            switch (symb) {
                case 'A', 'E', 'I', 'O', 'U' -> {
                    if (n == 0) {
                        code.append(symb);
                    }
                }
                case 'B' -> {
                    if (!(isPreviousChar(local, n, 'M') && isLastChar(wdsz, n))) {
                        code.append(symb);
                    }
                }
                case 'C' -> encodeC(local, n, wdsz, code);
                case 'D' -> {
                    if (!isLastChar(wdsz, n + 1) && isNextChar(local, n, 'G')
                            && FRONTV.indexOf(local.charAt(n + 2)) >= 0) {
                        code.append('J');
                        n += 2;
                    } else {
                        code.append('T');
                    }
                }
                case 'G' -> encodeG(local, n, wdsz, code);
                case 'H' -> {
                    if (!isLastChar(wdsz, n)
                            && !(n > 0 && VARSON.indexOf(local.charAt(n - 1)) >= 0)
                            && isVowel(local, n + 1)) {
                        code.append('H');
                    }
                }
                case 'F', 'J', 'L', 'M', 'N', 'R' -> code.append(symb);
                case 'K' -> {
                    if (n == 0 || !isPreviousChar(local, n, 'C')) {
                        code.append(symb);
                    }
                }
                case 'P' -> code.append(isNextChar(local, n, 'H') ? 'F' : symb);
                case 'Q' -> code.append('K');
                case 'S' -> {
                    if (regionMatch(local, n, "SH") || regionMatch(local, n, "SIO") || regionMatch(local, n, "SIA")) {
                        code.append('X');
                    } else {
                        code.append('S');
                    }
                }
                case 'T' -> {
                    if (regionMatch(local, n, "TIA") || regionMatch(local, n, "TIO")) {
                        code.append('X');
                    } else if (regionMatch(local, n, "TCH")) {
                        // silent, CH carries the sound
                    } else if (regionMatch(local, n, "TH")) {
                        code.append('0');
                    } else {
                        code.append('T');
                    }
                }
                case 'V' -> code.append('F');
                case 'W', 'Y' -> {
                    if (!isLastChar(wdsz, n) && isVowel(local, n + 1)) {
                        code.append(symb);
                    }
                }
                case 'X' -> code.append('K').append('S');
                case 'Z' -> code.append('S');
                default -> {
                    // other characters are dropped
                }
            }
            n++;
            if (code.length() > maxCodeLength) {
                code.setLength(maxCodeLength);
            }
        }
        return code.toString();
    }

    private static String initialTransform(String word) {
        char first = word.charAt(0);
        char second = word.charAt(1);
        switch (first) {
            case 'K', 'G', 'P':
                return second == 'N' ? word.substring(1) : word;
            case 'A':
                return second == 'E' ? word.substring(1) : word;
            case 'W':
                if (second == 'R') {
                    return word.substring(1);
                }
                if (second == 'H') {
                    return "W" + word.substring(2);
                }
                return word;
            case 'X':
                return "S" + word.substring(1);
            default:
                return word;
        }
    }

    private static void encodeC(String local, int n, int wdsz, StringBuilder code) {
        if (isPreviousChar(local, n, 'S') && !isLastChar(wdsz, n) && FRONTV.indexOf(local.charAt(n + 1)) >= 0) {
            return;
        }
        if (regionMatch(local, n, "CIA")) {
            code.append('X');
        } else if (!isLastChar(wdsz, n) && FRONTV.indexOf(local.charAt(n + 1)) >= 0) {
            code.append('S');
        } else if (isPreviousChar(local, n, 'S') && isNextChar(local, n, 'H')) {
            code.append('K');
        } else if (isNextChar(local, n, 'H')) {
            code.append(n == 0 && wdsz >= 3 && isVowel(local, 2) ? 'K' : 'X');
        } else {
            code.append('K');
        }
    }

    private static void encodeG(String local, int n, int wdsz, StringBuilder code) {
        if (isLastChar(wdsz, n + 1) && isNextChar(local, n, 'H')) {
            return;
        }
        if (!isLastChar(wdsz, n + 1) && isNextChar(local, n, 'H') && !isVowel(local, n + 2)) {
            return;
        }
        if (n > 0 && (regionMatch(local, n, "GN") || regionMatch(local, n, "GNED"))) {
            return;
        }
        boolean hard = isPreviousChar(local, n, 'G');
        if (!isLastChar(wdsz, n) && FRONTV.indexOf(local.charAt(n + 1)) >= 0 && !hard) {
            code.append('J');
        } else {
            code.append('K');
        }
    }

    private static boolean isVowel(String s, int index) {
        return index < s.length() && VOWELS.indexOf(s.charAt(index)) >= 0;
    }

    private static boolean isPreviousChar(String s, int index, char c) {
        return index > 0 && index < s.length() && s.charAt(index - 1) == c;
    }

    private static boolean isNextChar(String s, int index, char c) {
        return index < s.length() - 1 && s.charAt(index + 1) == c;
    }

    private static boolean regionMatch(String s, int index, String test) {
        return index + test.length() - 1 < s.length() && s.startsWith(test, index);
    }

    private static boolean isLastChar(int wdsz, int n) {
        return n + 1 == wdsz;
    }
}
