package com.phonetic.matching.bm;

import java.util.List;

/**
 * Ordered alternatives written as {@code (a|b[french]|c)} in rule resources.
 * The order is significant when the phoneme cap is reached.
 */
public record PhonemeList(List<Phoneme> phonemes) implements PhonemeExpr {

    public PhonemeList {
        phonemes = List.copyOf(phonemes);
    }

    @Override
    public List<Phoneme> getPhonemes() {
        return phonemes;
    }
}
