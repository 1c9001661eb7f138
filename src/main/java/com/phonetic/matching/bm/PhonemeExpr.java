package com.phonetic.matching.bm;

import java.util.List;

/**
 * Right-hand side of a rule: one or more phoneme alternatives.
 */
public interface PhonemeExpr {

    List<Phoneme> getPhonemes();

    default int size() {
        return getPhonemes().size();
    }
}
