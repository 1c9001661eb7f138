package com.phonetic.matching.bm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Beider-Morse phonetic engine: turns a name into a {@code |}-separated set of phonetic spellings.
 *
 * <p>An encode call guesses the languages of the input (unless given), splits off name particles,
 * runs the main rules over the name and then the common and language-specific final rules over
 * every alternative. Multi-word names are either encoded as one unit or word by word, depending
 * on {@link EngineOptions#isConcat()}.</p>
 *
 * <p>Engines are immutable and share their {@link BeiderMorseConfig}; one instance can serve any
 * number of threads.</p>
 */
public class PhoneticEngine {
    private static final Logger log = LoggerFactory.getLogger(PhoneticEngine.class);

    private final BeiderMorseConfig config;
    private final NameType nameType;
    private final RuleType ruleType;
    private final boolean concat;
    private final int maxPhonemes;
    private final NamePrefixes prefixes;
    private final Lang lang;

    public PhoneticEngine(BeiderMorseConfig config, EngineOptions options) {
        this(config, options, NamePrefixes.defaults());
    }

    public PhoneticEngine(BeiderMorseConfig config, EngineOptions options, NamePrefixes prefixes) {
        this.config = Objects.requireNonNull(config, "config");
        this.nameType = options.getNameType();
        this.ruleType = options.getRuleType();
        this.concat = options.isConcat();
        this.maxPhonemes = options.getMaxPhonemes();
        this.prefixes = Objects.requireNonNull(prefixes, "prefixes");
        this.lang = config.getLang(nameType);
    }

    public NameType getNameType() {
        return nameType;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public boolean isConcat() {
        return concat;
    }

    public int getMaxPhonemes() {
        return maxPhonemes;
    }

    public Lang getLang() {
        return lang;
    }

    /**
     * Encodes a name, guessing its languages first.
     */
    public String encode(String input) {
        Objects.requireNonNull(input, "input");
        return encode(input, lang.guessLanguages(input));
    }

    /**
     * Encodes a name for the given languages.
     *
     * @throws IllegalArgumentException if {@code languages} names a single language that has no
     *                                  rules for this name type
     */
    public String encode(String input, LanguageSet languages) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(languages, "languages");

        String languageToken = languages.isSingleton() ? languages.any() : LanguageSet.ANY_LANGUAGE;
        Rules rules = config.getRules();
        RulePhase finalPhase = RulePhase.of(ruleType);
        Map<Character, List<Rule>> mainRules = rules.getRules(nameType, RulePhase.RULES, languageToken);
        Map<Character, List<Rule>> commonFinalRules = rules.getRules(nameType, finalPhase, Rules.COMMON);
        Map<Character, List<Rule>> languageFinalRules = rules.getRules(nameType, finalPhase, languageToken);

        String text = input.toLowerCase(Locale.ENGLISH).replace('-', ' ').strip();

        if (nameType == NameType.GENERIC) {
            if (text.startsWith("d'")) {
                String remainder = text.substring(2);
                return "(" + encode(remainder) + ")-(" + encode("d" + remainder) + ")";
            }
            for (String prefix : prefixes.get(NameType.GENERIC)) {
                if (text.startsWith(prefix + " ")) {
                    String remainder = text.substring(prefix.length() + 1);
                    return "(" + encode(remainder) + ")-(" + encode(prefix + remainder) + ")";
                }
            }
        }

        List<String> words = text.isEmpty() ? List.of() : Arrays.asList(text.split("\\s+"));
        List<String> significantWords = significantWords(words);

        if (concat) {
            text = String.join(" ", significantWords);
        } else if (significantWords.size() == 1) {
            text = significantWords.get(0);
        } else if (!significantWords.isEmpty()) {
            return significantWords.stream()
                    .map(this::encode)
                    .collect(Collectors.joining("-"));
        }

        PhonemeBuilder builder = PhonemeBuilder.empty(languages);
        scan(mainRules, text, builder, false);
        builder = applyFinalRules(builder, commonFinalRules);
        builder = applyFinalRules(builder, languageFinalRules);

        String result = builder.makeString();
        log.trace("Encoded '{}' [{}] -> '{}'", input, languageToken, result);
        return result;
    }

    /**
     * Drops particles that carry no phonetic weight for this name type. Sephardic names also lose
     * everything up to the last apostrophe of each word.
     */
    private List<String> significantWords(List<String> words) {
        List<String> result = new ArrayList<>(words.size());
        switch (nameType) {
            case SEPHARDIC -> {
                for (String word : words) {
                    String lastPart = word.substring(word.lastIndexOf('\'') + 1);
                    if (!prefixes.get(NameType.SEPHARDIC).contains(lastPart)) {
                        result.add(lastPart);
                    }
                }
            }
            case ASHKENAZI -> {
                for (String word : words) {
                    if (!prefixes.get(NameType.ASHKENAZI).contains(word)) {
                        result.add(word);
                    }
                }
            }
            case GENERIC -> result.addAll(words);
        }
        return result;
    }

    /**
     * Walks the input; at each position the first rule (longest pattern first) whose pattern and
     * contexts match is applied and the position skips the pattern. Unmatched characters are
     * copied literally only in final passes.
     */
    private void scan(Map<Character, List<Rule>> rules, String input, PhonemeBuilder builder, boolean finalPass) {
        int i = 0;
        while (i < input.length()) {
            int patternLength = 1;
            boolean found = false;
            List<Rule> candidates = rules.get(input.charAt(i));
            if (candidates != null) {
                for (Rule rule : candidates) {
                    if (rule.patternAndContextMatches(input, i)) {
                        builder.apply(rule.getPhoneme(), maxPhonemes);
                        patternLength = rule.getPattern().length();
                        found = true;
                        break;
                    }
                }
            }
            if (!found && finalPass) {
                builder.append(input.subSequence(i, i + 1));
            }
            i += patternLength;
        }
    }

    /**
     * Runs final rules over each alternative separately; identical results from different
     * alternatives are merged with the union of their languages. Final rules may split an
     * alternative further, so the merged result is cut back to the first {@code maxPhonemes}
     * in text order.
     */
    private PhonemeBuilder applyFinalRules(PhonemeBuilder builder, Map<Character, List<Rule>> finalRules) {
        if (finalRules.isEmpty()) {
            return builder;
        }
        Map<String, Phoneme> merged = new TreeMap<>();
        for (Phoneme phoneme : builder.getPhonemes()) {
            PhonemeBuilder sub = PhonemeBuilder.empty(phoneme.getLanguages());
            scan(finalRules, phoneme.getText(), sub, true);
            for (Phoneme result : sub.getPhonemes()) {
                merged.merge(result.getText(), result,
                        (existing, added) -> existing.mergeWithLanguage(added.getLanguages()));
            }
        }
        return PhonemeBuilder.of(merged.values().stream().limit(maxPhonemes).toList());
    }
}
