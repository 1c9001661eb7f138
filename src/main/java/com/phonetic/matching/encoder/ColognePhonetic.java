package com.phonetic.matching.encoder;

import java.util.Locale;
import java.util.Objects;

/**
 * Cologne phonetics (Kölner Phonetik), a Soundex-like code tuned for German names.
 * Letters are mapped to digits by their neighbours; repeated digits collapse and {@code 0} is only
 * kept in first position.
 */
public class ColognePhonetic implements Encoder {

    private static final char NONE = '-';

    private static final String AEIJOUY = "AEIJOUY";
    private static final String CSZ = "CSZ";
    private static final String FPVW = "FPVW";
    private static final String GKQ = "GKQ";
    private static final String CKQ = "CKQ";
    private static final String AHKLOQRUX = "AHKLOQRUX";
    private static final String SZ = "SZ";
    private static final String AHKOQUX = "AHKOQUX";
    private static final String DTX = "DTX";

    /**
     * Code buffer that drops repeats, silent markers and non-leading zeros.
     */
    private static final class Output {
        private final StringBuilder code = new StringBuilder();
        private char lastCode = '/';

        void put(char c) {
            if (c != NONE && lastCode != c && (c != '0' || code.length() == 0)) {
                code.append(c);
            }
            lastCode = c;
        }

        boolean isEmpty() {
            return code.length() == 0;
        }

        @Override
        public String toString() {
            return code.toString();
        }
    }

    @Override
    public String encode(String value) {
        Objects.requireNonNull(value, "value");
        char[] chars = preprocess(value);
        Output output = new Output();
        char lastChar = NONE;

        for (int i = 0; i < chars.length; i++) {
            char chr = chars[i];
            if (chr < 'A' || chr > 'Z') {
                continue;
            }
            char nextChar = i + 1 < chars.length ? chars[i + 1] : NONE;

            if (isIn(chr, AEIJOUY)) {
                output.put('0');
            } else if (chr == 'B' || (chr == 'P' && nextChar != 'H')) {
                output.put('1');
            } else if ((chr == 'D' || chr == 'T') && !isIn(nextChar, CSZ)) {
                output.put('2');
            } else if (isIn(chr, FPVW)) {
                output.put('3');
            } else if (isIn(chr, GKQ)) {
                output.put('4');
            } else if (chr == 'X' && !isIn(lastChar, CKQ)) {
                output.put('4');
                output.put('8');
            } else if (chr == 'S' || chr == 'Z') {
                output.put('8');
            } else if (chr == 'C') {
                if (output.isEmpty()) {
                    output.put(isIn(nextChar, AHKLOQRUX) ? '4' : '8');
                } else if (isIn(lastChar, SZ) || !isIn(nextChar, AHKOQUX)) {
                    output.put('8');
                } else {
                    output.put('4');
                }
            } else if (isIn(chr, DTX)) {
                output.put('8');
            } else if (chr == 'R') {
                output.put('7');
            } else if (chr == 'L') {
                output.put('5');
            } else if (chr == 'M' || chr == 'N') {
                output.put('6');
            } else if (chr == 'H') {
                output.put(NONE);
            }
            lastChar = chr;
        }
        return output.toString();
    }

    @Override
    public String getName() {
        return "cologne";
    }

    private static char[] preprocess(String text) {
        return text.toUpperCase(Locale.GERMAN)
                .replace('Ä', 'A')
                .replace('Ü', 'U')
                .replace('Ö', 'O')
                .toCharArray();
    }

    private static boolean isIn(char c, String chars) {
        return chars.indexOf(c) >= 0;
    }
}
