package com.phonetic.matching.bm;

import com.phonetic.matching.rules.RuleGrammar;
import com.phonetic.matching.rules.RuleLine;
import com.phonetic.matching.rules.RuleParseException;
import com.phonetic.matching.rules.RuleParseException.Reason;
import com.phonetic.matching.rules.RuleSource;
import com.phonetic.matching.rules.RuleTextReader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.PatternSyntaxException;

/**
 * Parses Beider-Morse rule resources ({@code "pattern" "left" "right" "phonemes"} lines and
 * {@code #include} directives) into rules bucketed by the first pattern character.
 */
final class RuleFileParser {

    private final RuleSource source;

    RuleFileParser(RuleSource source) {
        this.source = source;
    }

    /**
     * Parses a resource and everything it includes. Buckets keep file order; sorting is up to the caller.
     */
    Map<Character, List<Rule>> parse(String resourceName) {
        String text = source.read(resourceName).orElseThrow(() -> new RuleParseException(Reason.WRONG_FILENAME,
                "Rule resource '" + resourceName + "' not found in " + source.describe()));
        Map<Character, List<Rule>> buckets = new HashMap<>();
        parseInto(resourceName, text, buckets, new ArrayDeque<>());
        return buckets;
    }

    private void parseInto(String resourceName, String text, Map<Character, List<Rule>> buckets,
                           Deque<String> includeStack) {
        includeStack.push(resourceName);
        for (RuleLine line : RuleTextReader.read(text)) {
            Matcher include = RuleGrammar.INCLUDE.matcher(line.content());
            if (include.matches()) {
                String included = include.group(1);
                if (includeStack.contains(included)) {
                    throw new RuleParseException(Reason.WRONG_FILENAME, resourceName, line,
                            "Circular include of " + included);
                }
                Optional<String> includedText = source.read(included);
                if (includedText.isEmpty()) {
                    throw new RuleParseException(Reason.WRONG_FILENAME, resourceName, line,
                            "Can't include file " + included + " in " + resourceName + " at line " + line.number());
                }
                parseInto(included, includedText.get(), buckets, includeStack);
                continue;
            }

            Matcher quadruplet = RuleGrammar.QUADRUPLET.matcher(line.content());
            if (!quadruplet.matches()) {
                throw new RuleParseException(Reason.BAD_RULE, resourceName, line,
                        "Malformed rule statement split into wrong number of parts");
            }
            Rule rule = parseRule(resourceName, line, quadruplet);
            buckets.computeIfAbsent(rule.getPattern().charAt(0), k -> new ArrayList<>()).add(rule);
        }
        includeStack.pop();
    }

    private Rule parseRule(String resourceName, RuleLine line, Matcher quadruplet) {
        String pattern = quadruplet.group(1);
        String leftContext = quadruplet.group(2);
        String rightContext = quadruplet.group(3);
        PhonemeExpr phoneme = parsePhonemeExpr(quadruplet.group(4), resourceName, line);
        try {
            return new Rule(pattern,
                    ContextMatcher.compile(leftContext + "$"),
                    ContextMatcher.compile("^" + rightContext),
                    phoneme, resourceName, line.number());
        } catch (PatternSyntaxException e) {
            throw new RuleParseException(Reason.BAD_CONTEXT_REGEX, resourceName, line,
                    "Invalid context expression: " + e.getDescription(), e);
        }
    }

    static PhonemeExpr parsePhonemeExpr(String expr, String resourceName, RuleLine line) {
        if (!expr.startsWith("(")) {
            return parsePhoneme(expr, resourceName, line);
        }
        if (!expr.endsWith(")")) {
            throw new RuleParseException(Reason.WRONG_PHONEME, resourceName, line,
                    "Phoneme starts with '(' so must end with ')'");
        }
        List<Phoneme> phonemes = new ArrayList<>();
        for (String part : expr.substring(1, expr.length() - 1).split("\\|", -1)) {
            phonemes.add(parsePhoneme(part, resourceName, line));
        }
        return new PhonemeList(phonemes);
    }

    static Phoneme parsePhoneme(String text, String resourceName, RuleLine line) {
        int open = text.indexOf('[');
        if (open < 0) {
            return new Phoneme(text, LanguageSet.ANY);
        }
        if (!text.endsWith("]")) {
            throw new RuleParseException(Reason.WRONG_PHONEME, resourceName, line,
                    "Phoneme expression contains a '[' but does not end in ']'");
        }
        Set<String> languages = new LinkedHashSet<>(
                Arrays.asList(text.substring(open + 1, text.length() - 1).split("\\+")));
        languages.remove("");
        return new Phoneme(text.substring(0, open), LanguageSet.from(languages));
    }
}
