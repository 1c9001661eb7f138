package com.phonetic.matching.encoder;

import java.util.Locale;
import java.util.Objects;

/**
 * Lawrence Philips' Double Metaphone. Every value gets a primary code and an alternate code for
 * a second plausible pronunciation; {@link #encode(String)} returns the primary one.
 */
public class DoubleMetaphone implements Encoder {

    private static final int DEFAULT_MAX_CODE_LENGTH = 4;

    private static final String VOWELS = "AEIOUY";

    private static final String[] SILENT_START = {"GN", "KN", "PN", "WR", "PS"};
    private static final String[] L_R_N_M_B_H_F_V_W_SPACE = {"L", "R", "N", "M", "B", "H", "F", "V", "W", " "};
    private static final String[] ES_EP_EB_EL_EY_IB_IL_IN_IE_EI_ER =
            {"ES", "EP", "EB", "EL", "EY", "IB", "IL", "IN", "IE", "EI", "ER"};
    private static final String[] L_T_K_S_N_M_B_Z = {"L", "T", "K", "S", "N", "M", "B", "Z"};

    private final int maxCodeLength;

    public DoubleMetaphone() {
        this(DEFAULT_MAX_CODE_LENGTH);
    }

    public DoubleMetaphone(int maxCodeLength) {
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
        return "double-metaphone";
    }

    @Override
    public String encode(String value) {
        return doubleMetaphone(value).primary();
    }

    public String encodeAlternate(String value) {
        return doubleMetaphone(value).alternate();
    }

    /**
     * Whether both values share the primary code, or the alternate code when {@code alternate} is set.
     */
    public boolean isDoubleMetaphoneEqual(String first, String second, boolean alternate) {
        DoubleMetaphoneResult one = doubleMetaphone(first);
        DoubleMetaphoneResult two = doubleMetaphone(second);
        return alternate ? one.alternate().equals(two.alternate()) : one.primary().equals(two.primary());
    }

    /**
     * Computes both codes of a value. Blank input yields two empty codes.
     */
    public DoubleMetaphoneResult doubleMetaphone(String value) {
        Objects.requireNonNull(value, "value");
        CodeBuilder result = new CodeBuilder(maxCodeLength);
        String text = value.strip();
        if (text.isEmpty()) {
            return result.build();
        }
        text = text.toUpperCase(Locale.ENGLISH);
        boolean slavoGermanic = isSlavoGermanic(text);
        int index = isSilentStart(text) ? 1 : 0;

        while (!result.isComplete() && index < text.length()) {
            index = switch (text.charAt(index)) {
                case 'A', 'E', 'I', 'O', 'U', 'Y' -> {
                    if (index == 0) {
                        result.append('A');
                    }
                    yield index + 1;
                }
                case 'B' -> {
                    result.append('P');
                    yield charAt(text, index + 1) == 'B' ? index + 2 : index + 1;
                }
                case 'Ç' -> {
                    result.append('S');
                    yield index + 1;
                }
                case 'C' -> handleC(text, result, index);
                case 'D' -> handleD(text, result, index);
                case 'F' -> {
                    result.append('F');
                    yield charAt(text, index + 1) == 'F' ? index + 2 : index + 1;
                }
                case 'G' -> handleG(text, result, index, slavoGermanic);
                case 'H' -> handleH(text, result, index);
                case 'J' -> handleJ(text, result, index, slavoGermanic);
                case 'K' -> {
                    result.append('K');
                    yield charAt(text, index + 1) == 'K' ? index + 2 : index + 1;
                }
                case 'L' -> handleL(text, result, index);
                case 'M' -> {
                    result.append('M');
                    yield conditionM0(text, index) ? index + 2 : index + 1;
                }
                case 'N' -> {
                    result.append('N');
                    yield charAt(text, index + 1) == 'N' ? index + 2 : index + 1;
                }
                case 'Ñ' -> {
                    result.append('N');
                    yield index + 1;
                }
                case 'P' -> handleP(text, result, index);
                case 'Q' -> {
                    result.append('K');
                    yield charAt(text, index + 1) == 'Q' ? index + 2 : index + 1;
                }
                case 'R' -> handleR(text, result, index, slavoGermanic);
                case 'S' -> handleS(text, result, index, slavoGermanic);
                case 'T' -> handleT(text, result, index);
                case 'V' -> {
                    result.append('F');
                    yield charAt(text, index + 1) == 'V' ? index + 2 : index + 1;
                }
                case 'W' -> handleW(text, result, index);
                case 'X' -> handleX(text, result, index);
                case 'Z' -> handleZ(text, result, index, slavoGermanic);
                default -> index + 1;
            };
        }
        return result.build();
    }

    private static int handleC(String value, CodeBuilder result, int index) {
        if (conditionC0(value, index)) {
            result.append('K');
            return index + 2;
        }
        if (index == 0 && contains(value, index, 6, "CAESAR")) {
            result.append('S');
            return index + 2;
        }
        if (contains(value, index, 2, "CH")) {
            return handleCH(value, result, index);
        }
        if (contains(value, index, 2, "CZ") && !contains(value, index - 2, 4, "WICZ")) {
            // Czerny
            result.append('S', 'X');
            return index + 2;
        }
        if (contains(value, index + 1, 3, "CIA")) {
            // focaccia
            result.append('X');
            return index + 3;
        }
        if (contains(value, index, 2, "CC") && !(index == 1 && charAt(value, 0) == 'M')) {
            // double cc, but not McClelland
            return handleCC(value, result, index);
        }
        if (contains(value, index, 2, "CK", "CG", "CQ")) {
            result.append('K');
            return index + 2;
        }
        if (contains(value, index, 2, "CI", "CE", "CY")) {
            if (contains(value, index, 3, "CIO", "CIE", "CIA")) {
                result.append('S', 'X');
            } else {
                result.append('S');
            }
            return index + 2;
        }
        result.append('K');
        if (contains(value, index + 1, 2, " C", " Q", " G")) {
            // Mac Caffrey, Mac Gregor
            return index + 3;
        }
        if (contains(value, index + 1, 1, "C", "K", "Q") && !contains(value, index + 1, 2, "CE", "CI")) {
            return index + 2;
        }
        return index + 1;
    }

    private static int handleCC(String value, CodeBuilder result, int index) {
        if (contains(value, index + 2, 1, "I", "E", "H") && !contains(value, index + 2, 2, "HU")) {
            // bellocchio, but not bacchus
            if ((index == 1 && charAt(value, index - 1) == 'A') || contains(value, index - 1, 5, "UCCEE", "UCCES")) {
                result.append("KS");
            } else {
                result.append('X');
            }
            return index + 3;
        }
        result.append('K');
        return index + 2;
    }

    private static int handleCH(String value, CodeBuilder result, int index) {
        if (index > 0 && contains(value, index, 4, "CHAE")) {
            // Michael
            result.append('K', 'X');
        } else if (conditionCH0(value, index) || conditionCH1(value, index)) {
            result.append('K');
        } else if (index > 0) {
            if (contains(value, 0, 2, "MC")) {
                result.append('K');
            } else {
                result.append('X', 'K');
            }
        } else {
            result.append('X');
        }
        return index + 2;
    }

    private static int handleD(String value, CodeBuilder result, int index) {
        if (contains(value, index, 2, "DG")) {
            if (contains(value, index + 2, 1, "I", "E", "Y")) {
                // edge
                result.append('J');
                return index + 3;
            }
            // edgar
            result.append("TK");
            return index + 2;
        }
        result.append('T');
        return contains(value, index, 2, "DT", "DD") ? index + 2 : index + 1;
    }

    private static int handleG(String value, CodeBuilder result, int index, boolean slavoGermanic) {
        if (charAt(value, index + 1) == 'H') {
            return handleGH(value, result, index);
        }
        if (charAt(value, index + 1) == 'N') {
            if (index == 1 && isVowel(charAt(value, 0)) && !slavoGermanic) {
                result.append("KN", "N");
            } else if (!contains(value, index + 2, 2, "EY") && charAt(value, index + 1) != 'Y' && !slavoGermanic) {
                result.append("N", "KN");
            } else {
                result.append("KN");
            }
            return index + 2;
        }
        if (contains(value, index + 1, 2, "LI") && !slavoGermanic) {
            result.append("KL", "L");
            return index + 2;
        }
        if (index == 0 && (charAt(value, index + 1) == 'Y'
                || contains(value, index + 1, 2, ES_EP_EB_EL_EY_IB_IL_IN_IE_EI_ER))) {
            // -ges-, -gep-, -gel-, -gie- at the beginning
            result.append('K', 'J');
            return index + 2;
        }
        if ((contains(value, index + 1, 2, "ER") || charAt(value, index + 1) == 'Y')
                && !contains(value, 0, 6, "DANGER", "RANGER", "MANGER")
                && !contains(value, index - 1, 1, "E", "I")
                && !contains(value, index - 1, 3, "RGY", "OGY")) {
            // -ger-, -gy-
            result.append('K', 'J');
            return index + 2;
        }
        if (contains(value, index + 1, 1, "E", "I", "Y") || contains(value, index - 1, 4, "AGGI", "OGGI")) {
            // Italian biaggi
            if (contains(value, 0, 4, "VAN ", "VON ") || contains(value, 0, 3, "SCH")
                    || contains(value, index + 1, 2, "ET")) {
                result.append('K');
            } else if (contains(value, index + 1, 3, "IER")) {
                result.append('J');
            } else {
                result.append('J', 'K');
            }
            return index + 2;
        }
        result.append('K');
        return charAt(value, index + 1) == 'G' ? index + 2 : index + 1;
    }

    private static int handleGH(String value, CodeBuilder result, int index) {
        if (index > 0 && !isVowel(charAt(value, index - 1))) {
            result.append('K');
        } else if (index == 0) {
            // ghislane, ghiradelli
            result.append(charAt(value, index + 2) == 'I' ? 'J' : 'K');
        } else if ((index > 1 && contains(value, index - 2, 1, "B", "H", "D"))
                || (index > 2 && contains(value, index - 3, 1, "B", "H", "D"))
                || (index > 3 && contains(value, index - 4, 1, "B", "H"))) {
            // Parker's rule: hugh, bough, broughton
            return index + 2;
        } else if (index > 2 && charAt(value, index - 1) == 'U'
                && contains(value, index - 3, 1, "C", "G", "L", "R", "T")) {
            // laugh, McLaughlin, cough, gough, rough, tough
            result.append('F');
        } else if (charAt(value, index - 1) != 'I') {
            result.append('K');
        }
        return index + 2;
    }

    private static int handleH(String value, CodeBuilder result, int index) {
        // kept only when first or between two vowels
        if ((index == 0 || isVowel(charAt(value, index - 1))) && isVowel(charAt(value, index + 1))) {
            result.append('H');
            return index + 2;
        }
        return index + 1;
    }

    private static int handleJ(String value, CodeBuilder result, int index, boolean slavoGermanic) {
        if (contains(value, index, 4, "JOSE") || contains(value, 0, 4, "SAN ")) {
            // Spanish: Jose, San Jacinto
            if ((index == 0 && charAt(value, index + 4) == ' ') || value.length() == 4
                    || contains(value, 0, 4, "SAN ")) {
                result.append('H');
            } else {
                result.append('J', 'H');
            }
            return index + 1;
        }
        if (index == 0) {
            result.append('J', 'A');
        } else if (isVowel(charAt(value, index - 1)) && !slavoGermanic
                && (charAt(value, index + 1) == 'A' || charAt(value, index + 1) == 'O')) {
            result.append('J', 'H');
        } else if (index == value.length() - 1) {
            result.append('J', ' ');
        } else if (!contains(value, index + 1, 1, L_T_K_S_N_M_B_Z) && !contains(value, index - 1, 1, "S", "K", "L")) {
            result.append('J');
        }
        return charAt(value, index + 1) == 'J' ? index + 2 : index + 1;
    }

    private static int handleL(String value, CodeBuilder result, int index) {
        if (charAt(value, index + 1) == 'L') {
            if (conditionL0(value, index)) {
                // Spanish: cabrillo, gallegos
                result.appendPrimary('L');
            } else {
                result.append('L');
            }
            return index + 2;
        }
        result.append('L');
        return index + 1;
    }

    private static int handleP(String value, CodeBuilder result, int index) {
        if (charAt(value, index + 1) == 'H') {
            result.append('F');
            return index + 2;
        }
        result.append('P');
        return contains(value, index + 1, 1, "P", "B") ? index + 2 : index + 1;
    }

    private static int handleR(String value, CodeBuilder result, int index, boolean slavoGermanic) {
        if (index == value.length() - 1 && !slavoGermanic && contains(value, index - 2, 2, "IE")
                && !contains(value, index - 4, 2, "ME", "MA")) {
            // French: rogier
            result.appendAlternate('R');
        } else {
            result.append('R');
        }
        return charAt(value, index + 1) == 'R' ? index + 2 : index + 1;
    }

    private static int handleS(String value, CodeBuilder result, int index, boolean slavoGermanic) {
        if (contains(value, index - 1, 3, "ISL", "YSL")) {
            // island, isle, carlisle, carlysle
            return index + 1;
        }
        if (index == 0 && contains(value, index, 5, "SUGAR")) {
            result.append('X', 'S');
            return index + 1;
        }
        if (contains(value, index, 2, "SH")) {
            if (contains(value, index + 1, 4, "HEIM", "HOEK", "HOLM", "HOLZ")) {
                result.append('S');
            } else {
                result.append('X');
            }
            return index + 2;
        }
        if (contains(value, index, 3, "SIO", "SIA") || contains(value, index, 4, "SIAN")) {
            // Italian and Armenian
            if (slavoGermanic) {
                result.append('S');
            } else {
                result.append('S', 'X');
            }
            return index + 3;
        }
        if ((index == 0 && contains(value, index + 1, 1, "M", "N", "L", "W")) || contains(value, index + 1, 1, "Z")) {
            // smith matches schmidt, snider matches schneider, Slavic -sz-
            result.append('S', 'X');
            return contains(value, index + 1, 1, "Z") ? index + 2 : index + 1;
        }
        if (contains(value, index, 2, "SC")) {
            return handleSC(value, result, index);
        }
        if (index == value.length() - 1 && contains(value, index - 2, 2, "AI", "OI")) {
            // French: resnais, artois
            result.appendAlternate('S');
        } else {
            result.append('S');
        }
        return contains(value, index + 1, 1, "S", "Z") ? index + 2 : index + 1;
    }

    private static int handleSC(String value, CodeBuilder result, int index) {
        if (charAt(value, index + 2) == 'H') {
            // Schlesinger's rule
            if (contains(value, index + 3, 2, "OO", "ER", "EN", "UY", "ED", "EM")) {
                // Dutch: school, schooner, schermerhorn, schenker
                if (contains(value, index + 3, 2, "ER", "EN")) {
                    result.append("X", "SK");
                } else {
                    result.append("SK");
                }
            } else if (index == 0 && !isVowel(charAt(value, 3)) && charAt(value, 3) != 'W') {
                result.append('X', 'S');
            } else {
                result.append('X');
            }
        } else if (contains(value, index + 2, 1, "I", "E", "Y")) {
            result.append('S');
        } else {
            result.append("SK");
        }
        return index + 3;
    }

    private static int handleT(String value, CodeBuilder result, int index) {
        if (contains(value, index, 4, "TION") || contains(value, index, 3, "TIA", "TCH")) {
            result.append('X');
            return index + 3;
        }
        if (contains(value, index, 2, "TH") || contains(value, index, 3, "TTH")) {
            if (contains(value, index + 2, 2, "OM", "AM")
                    || contains(value, 0, 4, "VAN ", "VON ") || contains(value, 0, 3, "SCH")) {
                // thomas, thames, or Germanic
                result.append('T');
            } else {
                result.append('0', 'T');
            }
            return index + 2;
        }
        result.append('T');
        return contains(value, index + 1, 1, "T", "D") ? index + 2 : index + 1;
    }

    private static int handleW(String value, CodeBuilder result, int index) {
        if (contains(value, index, 2, "WR")) {
            result.append('R');
            return index + 2;
        }
        if (index == 0 && (isVowel(charAt(value, index + 1)) || contains(value, index, 2, "WH"))) {
            if (isVowel(charAt(value, index + 1))) {
                // Wasserman matches Vasserman
                result.append('A', 'F');
            } else {
                // Uomo matches Womo
                result.append('A');
            }
            return index + 1;
        }
        if ((index == value.length() - 1 && isVowel(charAt(value, index - 1)))
                || contains(value, index - 1, 5, "EWSKI", "EWSKY", "OWSKI", "OWSKY")
                || contains(value, 0, 3, "SCH")) {
            // Arnow matches Arnoff
            result.appendAlternate('F');
            return index + 1;
        }
        if (contains(value, index, 4, "WICZ", "WITZ")) {
            // Polish: filipowicz
            result.append("TS", "FX");
            return index + 4;
        }
        return index + 1;
    }

    private static int handleX(String value, CodeBuilder result, int index) {
        if (index == 0) {
            result.append('S');
            return index + 1;
        }
        if (!(index == value.length() - 1
                && (contains(value, index - 3, 3, "IAU", "EAU") || contains(value, index - 2, 2, "AU", "OU")))) {
            // not French: breaux
            result.append("KS");
        }
        return contains(value, index + 1, 1, "C", "X") ? index + 2 : index + 1;
    }

    private static int handleZ(String value, CodeBuilder result, int index, boolean slavoGermanic) {
        if (charAt(value, index + 1) == 'H') {
            // Chinese pinyin: zhao
            result.append('J');
            return index + 2;
        }
        if (contains(value, index + 1, 2, "ZO", "ZI", "ZA")
                || (slavoGermanic && index > 0 && charAt(value, index - 1) != 'T')) {
            result.append("S", "TS");
        } else {
            result.append('S');
        }
        return charAt(value, index + 1) == 'Z' ? index + 2 : index + 1;
    }

    private static boolean conditionC0(String value, int index) {
        if (contains(value, index, 4, "CHIA")) {
            return true;
        }
        if (index <= 1 || isVowel(charAt(value, index - 2)) || !contains(value, index - 1, 3, "ACH")) {
            return false;
        }
        char c = charAt(value, index + 2);
        return (c != 'I' && c != 'E') || contains(value, index - 2, 6, "BACHER", "MACHER");
    }

    private static boolean conditionCH0(String value, int index) {
        if (index != 0) {
            return false;
        }
        if (!contains(value, index + 1, 5, "HARAC", "HARIS")
                && !contains(value, index + 1, 3, "HOR", "HYM", "HIA", "HEM")) {
            return false;
        }
        return !contains(value, 0, 5, "CHORE");
    }

    private static boolean conditionCH1(String value, int index) {
        return contains(value, 0, 4, "VAN ", "VON ") || contains(value, 0, 3, "SCH")
                || contains(value, index - 2, 6, "ORCHES", "ARCHIT", "ORCHID")
                || contains(value, index + 2, 1, "T", "S")
                || ((contains(value, index - 1, 1, "A", "O", "U", "E") || index == 0)
                && (contains(value, index + 2, 1, L_R_N_M_B_H_F_V_W_SPACE) || index + 1 == value.length() - 1));
    }

    private static boolean conditionL0(String value, int index) {
        if (index == value.length() - 3 && contains(value, index - 1, 4, "ILLO", "ILLA", "ALLE")) {
            return true;
        }
        return (contains(value, value.length() - 2, 2, "AS", "OS") || contains(value, value.length() - 1, 1, "A", "O"))
                && contains(value, index - 1, 4, "ALLE");
    }

    private static boolean conditionM0(String value, int index) {
        if (charAt(value, index + 1) == 'M') {
            return true;
        }
        return contains(value, index - 1, 3, "UMB")
                && (index + 1 == value.length() - 1 || contains(value, index + 2, 2, "ER"));
    }

    private static boolean isSlavoGermanic(String value) {
        return value.indexOf('W') >= 0 || value.indexOf('K') >= 0
                || value.contains("CZ") || value.contains("WITZ");
    }

    private static boolean isSilentStart(String value) {
        for (String prefix : SILENT_START) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    /**
     * The character at {@code index}, or {@link Character#MIN_VALUE} outside the value.
     */
    private static char charAt(String value, int index) {
        return index < 0 || index >= value.length() ? Character.MIN_VALUE : value.charAt(index);
    }

    /**
     * Whether the {@code length} characters at {@code start} equal one of the candidates.
     */
    private static boolean contains(String value, int start, int length, String... candidates) {
        if (start < 0 || start + length > value.length()) {
            return false;
        }
        String target = value.substring(start, start + length);
        for (String candidate : candidates) {
            if (candidate.equals(target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Accumulates both codes up to the maximum length.
     */
    private static final class CodeBuilder {
        private final StringBuilder primary;
        private final StringBuilder alternate;
        private final int maxLength;

        CodeBuilder(int maxLength) {
            this.primary = new StringBuilder(maxLength);
            this.alternate = new StringBuilder(maxLength);
            this.maxLength = maxLength;
        }

        void append(char value) {
            appendPrimary(value);
            appendAlternate(value);
        }

        void append(char primaryValue, char alternateValue) {
            appendPrimary(primaryValue);
            appendAlternate(alternateValue);
        }

        void appendPrimary(char value) {
            if (primary.length() < maxLength) {
                primary.append(value);
            }
        }

        void appendAlternate(char value) {
            if (alternate.length() < maxLength) {
                alternate.append(value);
            }
        }

        void append(String value) {
            append(value, value);
        }

        void append(String primaryValue, String alternateValue) {
            appendBounded(primary, primaryValue);
            appendBounded(alternate, alternateValue);
        }

        private void appendBounded(StringBuilder code, String value) {
            int remaining = maxLength - code.length();
            code.append(value, 0, Math.min(remaining, value.length()));
        }

        boolean isComplete() {
            return primary.length() >= maxLength && alternate.length() >= maxLength;
        }

        DoubleMetaphoneResult build() {
            return new DoubleMetaphoneResult(primary.toString(), alternate.toString());
        }
    }
}
