package com.phonetic.matching.bm;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The alternatives being built during one encoding, kept sorted by text. Alternatives with the
 * same text collapse into one; the first one inserted keeps its language set.
 */
final class PhonemeBuilder {

    private SortedSet<Phoneme> phonemes;

    private PhonemeBuilder(SortedSet<Phoneme> phonemes) {
        this.phonemes = phonemes;
    }

    /**
     * A builder holding a single empty alternative for the given languages.
     */
    static PhonemeBuilder empty(LanguageSet languages) {
        SortedSet<Phoneme> phonemes = new TreeSet<>();
        phonemes.add(Phoneme.empty(languages));
        return new PhonemeBuilder(phonemes);
    }

    static PhonemeBuilder of(Collection<Phoneme> phonemes) {
        return new PhonemeBuilder(new TreeSet<>(phonemes));
    }

    /**
     * Appends a literal to every alternative.
     */
    void append(CharSequence literal) {
        SortedSet<Phoneme> appended = new TreeSet<>();
        for (Phoneme phoneme : phonemes) {
            appended.add(phoneme.append(literal));
        }
        phonemes = appended;
    }

    /**
     * Replaces the alternatives by their cross product with {@code expr}, dropping combinations
     * whose languages do not intersect. Existing alternatives are walked in text order and the
     * expression in its own order; generation stops altogether once {@code maxPhonemes}
     * alternatives exist.
     */
    void apply(PhonemeExpr expr, int maxPhonemes) {
        SortedSet<Phoneme> next = new TreeSet<>();

        product:
        for (Phoneme left : phonemes) {
            for (Phoneme right : expr.getPhonemes()) {
                LanguageSet languages = left.getLanguages().restrictTo(right.getLanguages());
                if (!languages.isEmpty()) {
                    Phoneme joined = left.join(right, languages);
                    if (next.size() < maxPhonemes) {
                        next.add(joined);
                        if (next.size() >= maxPhonemes) {
                            break product;
                        }
                    }
                }
            }
        }
        phonemes = next;
    }

    Set<Phoneme> getPhonemes() {
        return Collections.unmodifiableSet(phonemes);
    }

    /**
     * Alternatives sorted by text and joined with {@code |}.
     */
    String makeString() {
        return phonemes.stream()
                .map(Phoneme::getText)
                .collect(Collectors.joining("|"));
    }
}
