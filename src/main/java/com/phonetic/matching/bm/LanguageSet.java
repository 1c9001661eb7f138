package com.phonetic.matching.bm;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The set of languages a phonetic spelling is still compatible with.
 *
 * <p>Three variants form a lattice:</p>
 * <ul>
 *   <li>{@link #ANY}: no constraint, identity for {@link #restrictTo} and absorbing for {@link #merge}</li>
 *   <li>{@link #NO_LANGUAGES}: empty, absorbing for {@link #restrictTo} and identity for {@link #merge}</li>
 *   <li>a concrete non-empty set of language names, built with {@link #from(Collection)}</li>
 * </ul>
 * Instances are immutable.
 */
public abstract class LanguageSet {

    /** Language name used when no single language could be determined. */
    public static final String ANY_LANGUAGE = "any";

    public static final LanguageSet ANY = new AnyLanguage();

    public static final LanguageSet NO_LANGUAGES = new NoLanguages();

    private LanguageSet() {
    }

    /**
     * Builds a language set; an empty collection yields {@link #NO_LANGUAGES}.
     */
    public static LanguageSet from(Collection<String> languages) {
        return languages.isEmpty() ? NO_LANGUAGES : new SomeLanguages(languages);
    }

    public static LanguageSet of(String... languages) {
        return from(Set.of(languages));
    }

    public abstract boolean contains(String language);

    public abstract boolean isEmpty();

    public abstract boolean isSingleton();

    /**
     * Returns one member; the alphabetically first for concrete sets, {@code "any"} otherwise.
     */
    public abstract String any();

    /**
     * Intersection.
     */
    public abstract LanguageSet restrictTo(LanguageSet other);

    /**
     * Union.
     */
    public abstract LanguageSet merge(LanguageSet other);

    /**
     * Concrete members, empty for both {@link #ANY} and {@link #NO_LANGUAGES}.
     */
    public abstract SortedSet<String> getLanguages();

    private static final class AnyLanguage extends LanguageSet {

        @Override
        public boolean contains(String language) {
            return true;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public boolean isSingleton() {
            return false;
        }

        @Override
        public String any() {
            return ANY_LANGUAGE;
        }

        @Override
        public LanguageSet restrictTo(LanguageSet other) {
            return other;
        }

        @Override
        public LanguageSet merge(LanguageSet other) {
            return this;
        }

        @Override
        public SortedSet<String> getLanguages() {
            return Collections.emptySortedSet();
        }

        @Override
        public String toString() {
            return "ANY_LANGUAGE";
        }
    }

    private static final class NoLanguages extends LanguageSet {

        @Override
        public boolean contains(String language) {
            return false;
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public boolean isSingleton() {
            return false;
        }

        @Override
        public String any() {
            return ANY_LANGUAGE;
        }

        @Override
        public LanguageSet restrictTo(LanguageSet other) {
            return this;
        }

        @Override
        public LanguageSet merge(LanguageSet other) {
            return other;
        }

        @Override
        public SortedSet<String> getLanguages() {
            return Collections.emptySortedSet();
        }

        @Override
        public String toString() {
            return "NO_LANGUAGES";
        }
    }

    private static final class SomeLanguages extends LanguageSet {

        private final SortedSet<String> languages;

        private SomeLanguages(Collection<String> languages) {
            this.languages = Collections.unmodifiableSortedSet(new TreeSet<>(languages));
        }

        @Override
        public boolean contains(String language) {
            return languages.contains(language);
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public boolean isSingleton() {
            return languages.size() == 1;
        }

        @Override
        public String any() {
            return languages.first();
        }

        @Override
        public LanguageSet restrictTo(LanguageSet other) {
            if (other == NO_LANGUAGES) {
                return other;
            }
            if (other == ANY) {
                return this;
            }
            SortedSet<String> common = new TreeSet<>(languages);
            common.retainAll(other.getLanguages());
            return from(common);
        }

        @Override
        public LanguageSet merge(LanguageSet other) {
            if (other == NO_LANGUAGES) {
                return this;
            }
            if (other == ANY) {
                return other;
            }
            SortedSet<String> union = new TreeSet<>(languages);
            union.addAll(other.getLanguages());
            return from(union);
        }

        @Override
        public SortedSet<String> getLanguages() {
            return languages;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SomeLanguages that = (SomeLanguages) o;
            return languages.equals(that.languages);
        }

        @Override
        public int hashCode() {
            return Objects.hash(languages);
        }

        @Override
        public String toString() {
            return "Languages(" + languages + ")";
        }
    }
}
