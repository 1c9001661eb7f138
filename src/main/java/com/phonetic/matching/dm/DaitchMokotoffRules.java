package com.phonetic.matching.dm;

import com.phonetic.matching.logging.LogContext;
import com.phonetic.matching.rules.ClasspathRuleSource;
import com.phonetic.matching.rules.RuleGrammar;
import com.phonetic.matching.rules.RuleLine;
import com.phonetic.matching.rules.RuleParseException;
import com.phonetic.matching.rules.RuleParseException.Reason;
import com.phonetic.matching.rules.RuleSource;
import com.phonetic.matching.rules.RuleTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Parsed Daitch-Mokotoff rule table: replacement rules bucketed by first pattern character
 * (longest pattern first) and the ASCII folding map.
 */
public final class DaitchMokotoffRules {
    private static final Logger log = LoggerFactory.getLogger(DaitchMokotoffRules.class);

    /** Logical name of the rule resource. */
    public static final String RESOURCE_NAME = "dmrules";

    private static final Comparator<DaitchMokotoffRule> LONGEST_PATTERN_FIRST =
            Comparator.comparingInt((DaitchMokotoffRule rule) -> rule.pattern().length()).reversed();

    private final Map<Character, List<DaitchMokotoffRule>> rules;
    private final Map<Character, Character> folding;

    private DaitchMokotoffRules(Map<Character, List<DaitchMokotoffRule>> rules, Map<Character, Character> folding) {
        this.rules = rules;
        this.folding = folding;
    }

    /**
     * Rules shipped with the library.
     */
    public static DaitchMokotoffRules bundled() {
        return load(ClasspathRuleSource.daitchMokotoff());
    }

    public static DaitchMokotoffRules load(RuleSource source) {
        try (LogContext ctx = LogContext.forConfigLoad(source.describe()).with("algorithm", "daitch-mokotoff")) {
            return parse(RESOURCE_NAME, source.require(RESOURCE_NAME));
        }
    }

    /**
     * Parses rule text. Rule lines hold four quoted fields, folding lines read {@code x=y}.
     */
    public static DaitchMokotoffRules parse(String resourceName, String text) {
        Map<Character, List<DaitchMokotoffRule>> rules = new HashMap<>();
        Map<Character, Character> folding = new HashMap<>();
        int ruleCount = 0;

        for (RuleLine line : RuleTextReader.read(text)) {
            Matcher rule = RuleGrammar.QUADRUPLET.matcher(line.content());
            if (rule.matches()) {
                DaitchMokotoffRule parsed = new DaitchMokotoffRule(rule.group(1),
                        branches(rule.group(2)), branches(rule.group(3)), branches(rule.group(4)));
                rules.computeIfAbsent(parsed.pattern().charAt(0), k -> new ArrayList<>()).add(parsed);
                ruleCount++;
                continue;
            }
            Matcher fold = RuleGrammar.FOLDING.matcher(line.content());
            if (fold.matches()) {
                folding.put(fold.group(1).charAt(0), fold.group(2).charAt(0));
                continue;
            }
            throw new RuleParseException(Reason.BAD_RULE, resourceName, line,
                    "Expected a quoted rule or a folding definition");
        }

        Map<Character, List<DaitchMokotoffRule>> sorted = new HashMap<>();
        rules.forEach((c, bucket) -> {
            bucket.sort(LONGEST_PATTERN_FIRST);
            sorted.put(c, List.copyOf(bucket));
        });
        log.debug("Parsed {} Daitch-Mokotoff rules and {} foldings from {}", ruleCount, folding.size(), resourceName);
        return new DaitchMokotoffRules(Collections.unmodifiableMap(sorted), Collections.unmodifiableMap(folding));
    }

    List<DaitchMokotoffRule> rulesFor(char c) {
        return rules.get(c);
    }

    /**
     * Folded form of {@code c}, or {@code c} itself.
     */
    char fold(char c) {
        return folding.getOrDefault(c, c);
    }

    public int foldingCount() {
        return folding.size();
    }

    private static List<String> branches(String field) {
        return List.of(field.split("\\|", -1));
    }
}
