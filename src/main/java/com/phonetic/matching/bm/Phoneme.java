package com.phonetic.matching.bm;

import java.util.List;

/**
 * A candidate phonetic spelling and the languages it is still plausible for.
 * Equality and ordering use the text only; the language set is auxiliary.
 */
public final class Phoneme implements PhonemeExpr, Comparable<Phoneme> {

    private final String text;
    private final LanguageSet languages;

    public Phoneme(String text, LanguageSet languages) {
        this.text = text;
        this.languages = languages;
    }

    public static Phoneme empty(LanguageSet languages) {
        return new Phoneme("", languages);
    }

    public String getText() {
        return text;
    }

    public LanguageSet getLanguages() {
        return languages;
    }

    /**
     * Returns a phoneme with the literal appended, same languages.
     */
    public Phoneme append(CharSequence literal) {
        return new Phoneme(text + literal, languages);
    }

    /**
     * Returns the concatenation of this phoneme and {@code right}, tagged with {@code joinedLanguages}.
     */
    public Phoneme join(Phoneme right, LanguageSet joinedLanguages) {
        return new Phoneme(text + right.text, joinedLanguages);
    }

    /**
     * Returns this spelling tagged with the union of both language sets.
     */
    public Phoneme mergeWithLanguage(LanguageSet other) {
        return new Phoneme(text, languages.merge(other));
    }

    @Override
    public List<Phoneme> getPhonemes() {
        return List.of(this);
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int compareTo(Phoneme other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((Phoneme) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text + "[" + languages + "]";
    }
}
