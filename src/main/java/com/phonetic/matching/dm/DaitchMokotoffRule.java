package com.phonetic.matching.dm;

import java.util.List;

/**
 * A Daitch-Mokotoff replacement rule. Each replacement field may hold several {@code |}-separated
 * branches.
 *
 * @param pattern          letters matched at the current position
 * @param atStart          replacements at the start of the name
 * @param beforeVowel      replacements when the next letter is a vowel
 * @param otherwise        replacements in every other case
 */
record DaitchMokotoffRule(String pattern, List<String> atStart, List<String> beforeVowel,
                          List<String> otherwise) {

    private static final String VOWELS = "aeiou";

    boolean matches(String context) {
        return context.startsWith(pattern);
    }

    /**
     * Picks the replacements for a match at the start of {@code context}.
     */
    List<String> replacements(String context, boolean atStartOfName) {
        if (atStartOfName) {
            return atStart;
        }
        int next = pattern.length();
        if (next < context.length() && VOWELS.indexOf(context.charAt(next)) >= 0) {
            return beforeVowel;
        }
        return otherwise;
    }
}
