package com.phonetic.matching.encoder;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * New York State Identification and Intelligence System phonetic code.
 * In strict mode codes are truncated to six characters.
 */
public class Nysiis implements Encoder {

    private static final char SPACE = ' ';
    private static final int TRUE_LENGTH = 6;

    private static final Pattern PAT_MAC = Pattern.compile("^MAC");
    private static final Pattern PAT_KN = Pattern.compile("^KN");
    private static final Pattern PAT_K = Pattern.compile("^K");
    private static final Pattern PAT_PH_PF = Pattern.compile("^(PH|PF)");
    private static final Pattern PAT_SCH = Pattern.compile("^SCH");
    private static final Pattern PAT_EE_IE = Pattern.compile("(EE|IE)$");
    private static final Pattern PAT_DT_ETC = Pattern.compile("(DT|RT|RD|NT|ND)$");

    private final boolean strict;

    public Nysiis() {
        this(true);
    }

    public Nysiis(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        String text = SoundexUtils.cleanAsciiLetters(value);
        if (text.isEmpty()) {
            return text;
        }

        text = PAT_MAC.matcher(text).replaceFirst("MCC");
        text = PAT_KN.matcher(text).replaceFirst("NN");
        text = PAT_K.matcher(text).replaceFirst("C");
        text = PAT_PH_PF.matcher(text).replaceFirst("FF");
        text = PAT_SCH.matcher(text).replaceFirst("SSS");
        text = PAT_EE_IE.matcher(text).replaceFirst("Y");
        text = PAT_DT_ETC.matcher(text).replaceFirst("D");

        StringBuilder key = new StringBuilder(text.length());
        key.append(text.charAt(0));

        char[] chars = text.toCharArray();
        int len = chars.length;
        for (int i = 1; i < len; i++) {
            char next = i < len - 1 ? chars[i + 1] : SPACE;
            char aNext = i < len - 2 ? chars[i + 2] : SPACE;
            char[] transcoded = transcodeRemaining(chars[i - 1], chars[i], next, aNext);
            System.arraycopy(transcoded, 0, chars, i, transcoded.length);
            if (chars[i] != chars[i - 1]) {
                key.append(chars[i]);
            }
        }

        if (key.length() > 1) {
            char lastChar = key.charAt(key.length() - 1);
            if (lastChar == 'S') {
                key.deleteCharAt(key.length() - 1);
                lastChar = key.charAt(key.length() - 1);
            }
            if (key.length() > 2 && key.charAt(key.length() - 2) == 'A' && lastChar == 'Y') {
                key.deleteCharAt(key.length() - 2);
            }
            if (lastChar == 'A') {
                key.deleteCharAt(key.length() - 1);
            }
        }

        String result = key.toString();
        return strict ? result.substring(0, Math.min(TRUE_LENGTH, result.length())) : result;
    }

    @Override
    public String getName() {
        return strict ? "nysiis" : "nysiis-loose";
    }

    private static boolean isVowel(char c) {
        return c == 'A' || c == 'E' || c == 'I' || c == 'O' || c == 'U';
    }

    private static char[] transcodeRemaining(char prev, char curr, char next, char aNext) {
        if (curr == 'E' && next == 'V') {
            return new char[]{'A', 'F'};
        }
        if (isVowel(curr)) {
            return new char[]{'A'};
        }
        switch (curr) {
            case 'Q':
                return new char[]{'G'};
            case 'Z':
                return new char[]{'S'};
            case 'M':
                return new char[]{'N'};
            case 'K':
                return next == 'N' ? new char[]{'N', 'N'} : new char[]{'C'};
            default:
                break;
        }
        if (curr == 'S' && next == 'C' && aNext == 'H') {
            return new char[]{'S', 'S', 'S'};
        }
        if (curr == 'P' && next == 'H') {
            return new char[]{'F', 'F'};
        }
        if (curr == 'H' && (!isVowel(prev) || !isVowel(next))) {
            return new char[]{prev};
        }
        if (curr == 'W' && isVowel(prev)) {
            return new char[]{prev};
        }
        return new char[]{curr};
    }
}
