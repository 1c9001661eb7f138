package com.phonetic.matching.encoder;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Match Rating Approach (Western Airlines, 1977).
 *
 * <p>Codes drop non-leading vowels and doubled consonants and keep at most the first and last three
 * characters. Equality is not plain code equality: the codes are compared from both ends and
 * the number of unmatched characters is rated against a threshold depending on the combined
 * code length.</p>
 */
public class MatchRatingApproachEncoder implements Encoder {

    private static final String SPACE = " ";
    private static final String EMPTY = "";
    private static final String IGNORED_PUNCTUATION = "-&'.,";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String PLAIN_ASCII = "AaEeIiOoUuAaEeIiOoUuYyAaEeIiOoUuYyAaOoNnAaEeIiOoUuYyAaCcOoUu";
    private static final String UNICODE = "ÀàÈèÌìÒòÙùÁáÉéÍíÓóÚúÝýÂâÊêÎîÔôÛûŶŷÃãÕõÑñÄäËëÏïÖöÜüŸÿÅåÇçŐőŰű";

    private static final String[] DOUBLE_CONSONANTS = {"BB", "CC", "DD", "FF", "GG", "HH", "JJ", "KK", "LL", "MM",
            "NN", "PP", "QQ", "RR", "SS", "TT", "VV", "WW", "XX", "YY", "ZZ"};

    @Override
    public String encode(String name) {
        Objects.requireNonNull(name, "name");
        if (name.strip().length() <= 1) {
            return EMPTY;
        }
        String cleaned = cleanName(name);
        if (cleaned.isEmpty()) {
            return EMPTY;
        }
        String withoutVowels = removeVowels(cleaned);
        if (withoutVowels.isEmpty()) {
            return EMPTY;
        }
        return getFirst3Last3(removeDoubleConsonants(withoutVowels));
    }

    @Override
    public boolean isEncodedEquals(String name1, String name2) {
        Objects.requireNonNull(name1, "name1");
        Objects.requireNonNull(name2, "name2");
        if (name1.strip().length() <= 1 || name2.strip().length() <= 1) {
            return false;
        }
        if (name1.equalsIgnoreCase(name2)) {
            return true;
        }

        String code1 = encode(name1);
        String code2 = encode(name2);
        if (code1.isEmpty() || code2.isEmpty()) {
            return false;
        }
        if (Math.abs(code1.length() - code2.length()) >= 3) {
            return false;
        }

        int minRating = getMinRating(code1.length() + code2.length());
        return leftToRightThenRightToLeftProcessing(code1, code2) >= minRating;
    }

    @Override
    public String getName() {
        return "match-rating-approach";
    }

    String cleanName(String name) {
        String upper = name.toUpperCase(Locale.ENGLISH);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (IGNORED_PUNCTUATION.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        upper = removeAccents(sb.toString());
        return WHITESPACE.matcher(upper).replaceAll(EMPTY);
    }

    String removeVowels(String name) {
        String firstLetter = name.substring(0, 1);
        String result = name.replace("A", EMPTY)
                .replace("E", EMPTY)
                .replace("I", EMPTY)
                .replace("O", EMPTY)
                .replace("U", EMPTY);
        result = WHITESPACE.matcher(result).replaceAll(SPACE);
        return isVowel(firstLetter) ? firstLetter + result : result;
    }

    String removeDoubleConsonants(String name) {
        String result = name.toUpperCase(Locale.ENGLISH);
        for (String dc : DOUBLE_CONSONANTS) {
            if (result.contains(dc)) {
                result = result.replace(dc, dc.substring(0, 1));
            }
        }
        return result;
    }

    String getFirst3Last3(String name) {
        int length = name.length();
        if (length > 6) {
            return name.substring(0, 3) + name.substring(length - 3, length);
        }
        return name;
    }

    int getMinRating(int sumLength) {
        if (sumLength <= 4) {
            return 5;
        }
        if (sumLength <= 7) {
            return 4;
        }
        if (sumLength <= 11) {
            return 3;
        }
        if (sumLength == 12) {
            return 2;
        }
        return 1;
    }

    /**
     * Blanks out the characters both codes share at the same distance from the start and from the
     * end, then rates the longer remainder: {@code |6 - remaining|}.
     */
    int leftToRightThenRightToLeftProcessing(String name1, String name2) {
        char[] name1Char = name1.toCharArray();
        char[] name2Char = name2.toCharArray();
        int name1Size = name1.length() - 1;
        int name2Size = name2.length() - 1;

        for (int i = 0; i < name1Char.length; i++) {
            if (i > name2Size) {
                break;
            }
            if (name1.charAt(i) == name2.charAt(i)) {
                name1Char[i] = ' ';
                name2Char[i] = ' ';
            }
            if (name1.charAt(name1Size - i) == name2.charAt(name2Size - i)) {
                name1Char[name1Size - i] = ' ';
                name2Char[name2Size - i] = ' ';
            }
        }

        String remaining1 = new String(name1Char).replace(" ", EMPTY);
        String remaining2 = new String(name2Char).replace(" ", EMPTY);
        if (remaining1.length() > remaining2.length()) {
            return Math.abs(6 - remaining1.length());
        }
        return Math.abs(6 - remaining2.length());
    }

    private static boolean isVowel(String letter) {
        return "AEIOU".contains(letter) && letter.length() == 1;
    }

    private static String removeAccents(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int pos = UNICODE.indexOf(c);
            sb.append(pos > -1 ? PLAIN_ASCII.charAt(pos) : c);
        }
        return sb.toString();
    }
}
