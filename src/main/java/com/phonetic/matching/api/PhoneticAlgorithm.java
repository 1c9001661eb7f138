package com.phonetic.matching.api;

/**
 * Phonetic algorithms available through {@link PhoneticMatcher}.
 */
public enum PhoneticAlgorithm {
    BEIDER_MORSE,
    DAITCH_MOKOTOFF,
    SOUNDEX,
    SOUNDEX_GENEALOGY,
    REFINED_SOUNDEX,
    CAVERPHONE1,
    CAVERPHONE2,
    COLOGNE,
    NYSIIS,
    METAPHONE,
    DOUBLE_METAPHONE,
    MATCH_RATING_APPROACH,
    PHONEX
}
