package com.phonetic.matching.bm;

import com.phonetic.matching.rules.RuleGrammar;
import com.phonetic.matching.rules.RuleLine;
import com.phonetic.matching.rules.RuleParseException;
import com.phonetic.matching.rules.RuleParseException.Reason;
import com.phonetic.matching.rules.RuleSource;
import com.phonetic.matching.rules.RuleTextReader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Guesses the language of a name for one name type.
 *
 * <p>Rules from {@code <nt>_lang} are applied in file order to the lower-cased input. A matching
 * accepting rule keeps only its languages, a matching rejecting rule removes them. When nothing is
 * left the guess is {@link LanguageSet#ANY} rather than an impossible empty set.</p>
 */
public final class Lang {

    /**
     * One guessing rule.
     *
     * @param pattern       searched anywhere in the lower-cased input
     * @param languages     languages the rule speaks about
     * @param acceptOnMatch {@code true} to keep only these languages, {@code false} to remove them
     */
    public record LangRule(Pattern pattern, Set<String> languages, boolean acceptOnMatch) {

        public LangRule {
            languages = Set.copyOf(languages);
        }

        public boolean matches(CharSequence text) {
            return pattern.matcher(text).find();
        }
    }

    private final NameType nameType;
    private final Set<String> languages;
    private final List<LangRule> rules;

    public Lang(NameType nameType, Set<String> languages, List<LangRule> rules) {
        this.nameType = nameType;
        this.languages = Set.copyOf(languages);
        this.rules = List.copyOf(rules);
    }

    /**
     * Loads the guessing rules of a name type.
     */
    public static Lang load(RuleSource source, NameType nameType, Languages languages) {
        String resourceName = nameType.getName() + "_lang";
        String text = source.require(resourceName);
        List<LangRule> rules = new ArrayList<>();
        for (RuleLine line : RuleTextReader.read(text)) {
            Matcher matcher = RuleGrammar.LANGUAGE_GUESS.matcher(line.content());
            if (!matcher.matches()) {
                throw new RuleParseException(Reason.BAD_RULE, resourceName, line,
                        "Malformed language rule, expected '<regex> <lang>+<lang> <true|false>'");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(matcher.group(1));
            } catch (PatternSyntaxException e) {
                throw new RuleParseException(Reason.BAD_CONTEXT_REGEX, resourceName, line,
                        "Invalid language pattern: " + e.getDescription(), e);
            }
            Set<String> ruleLanguages = new HashSet<>(Arrays.asList(matcher.group(2).split("\\+")));
            boolean accept = RuleGrammar.parseBoolean(matcher.group(3), resourceName, line);
            rules.add(new LangRule(pattern, ruleLanguages, accept));
        }
        return new Lang(nameType, languages.getLanguages(nameType), rules);
    }

    public NameType getNameType() {
        return nameType;
    }

    public List<LangRule> getRules() {
        return rules;
    }

    /**
     * Guesses the languages of the input, never returning an empty set.
     */
    public LanguageSet guessLanguages(String input) {
        String text = input.toLowerCase(Locale.ENGLISH);
        Set<String> candidates = new HashSet<>(languages);
        for (LangRule rule : rules) {
            if (rule.matches(text)) {
                if (rule.acceptOnMatch()) {
                    candidates.retainAll(rule.languages());
                } else {
                    candidates.removeAll(rule.languages());
                }
            }
        }
        LanguageSet guessed = LanguageSet.from(candidates);
        return guessed.isEmpty() ? LanguageSet.ANY : guessed;
    }

    /**
     * Returns the guessed language if exactly one remains, {@code "any"} otherwise.
     */
    public String guessLanguage(String input) {
        LanguageSet guessed = guessLanguages(input);
        return guessed.isSingleton() ? guessed.any() : LanguageSet.ANY_LANGUAGE;
    }
}
