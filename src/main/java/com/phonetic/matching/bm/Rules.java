package com.phonetic.matching.bm;

import com.phonetic.matching.rules.RuleSource;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository of parsed rule groups keyed by name type, phase and language.
 *
 * <p>Within a group rules are bucketed by the first character of their pattern and each bucket is
 * sorted by descending pattern length (stable, so equal lengths keep file order). Scanning a
 * bucket front to back therefore tries the longest pattern first.</p>
 */
public final class Rules {

    /** Language name of the final rules shared by all languages. */
    public static final String COMMON = "common";

    private static final Comparator<Rule> LONGEST_PATTERN_FIRST =
            Comparator.comparingInt((Rule rule) -> rule.getPattern().length()).reversed();

    record GroupKey(NameType nameType, RulePhase phase, String language) {
    }

    private final Map<GroupKey, Map<Character, List<Rule>>> groups;

    private Rules(Map<GroupKey, Map<Character, List<Rule>>> groups) {
        this.groups = Map.copyOf(groups);
    }

    /**
     * Loads every group: for each name type, each listed language gets a main, approx and exact
     * group, plus the {@code common} approx and exact groups.
     */
    public static Rules load(RuleSource source, Languages languages) {
        RuleFileParser parser = new RuleFileParser(source);
        Map<GroupKey, Map<Character, List<Rule>>> groups = new HashMap<>();
        for (NameType nameType : NameType.values()) {
            for (String language : languages.getLanguages(nameType)) {
                for (RulePhase phase : RulePhase.values()) {
                    groups.put(new GroupKey(nameType, phase, language),
                            loadGroup(parser, resourceName(nameType, phase, language)));
                }
            }
            for (RulePhase phase : EnumSet.of(RulePhase.APPROX, RulePhase.EXACT)) {
                groups.put(new GroupKey(nameType, phase, COMMON),
                        loadGroup(parser, resourceName(nameType, phase, COMMON)));
            }
        }
        return new Rules(groups);
    }

    static String resourceName(NameType nameType, RulePhase phase, String language) {
        return nameType.getName() + "_" + phase.getName() + "_" + language;
    }

    private static Map<Character, List<Rule>> loadGroup(RuleFileParser parser, String resourceName) {
        Map<Character, List<Rule>> buckets = parser.parse(resourceName);
        Map<Character, List<Rule>> sorted = new HashMap<>();
        buckets.forEach((firstChar, rules) -> {
            rules.sort(LONGEST_PATTERN_FIRST);
            sorted.put(firstChar, List.copyOf(rules));
        });
        return Collections.unmodifiableMap(sorted);
    }

    /**
     * Returns a group of rules bucketed by first pattern character.
     *
     * @throws IllegalArgumentException if no such group was loaded
     */
    Map<Character, List<Rule>> getRules(NameType nameType, RulePhase phase, String language) {
        Map<Character, List<Rule>> group = groups.get(new GroupKey(nameType, phase, language));
        if (group == null) {
            throw new IllegalArgumentException(String.format("No rules found for %s, %s, %s.",
                    nameType.getName(), phase.getName(), language));
        }
        return group;
    }

    /**
     * Returns the main-pass rules for a language, flattened in scan order.
     */
    public List<Rule> getMainRules(NameType nameType, String language) {
        return flatten(getRules(nameType, RulePhase.RULES, language));
    }

    public boolean hasLanguage(NameType nameType, String language) {
        return groups.containsKey(new GroupKey(nameType, RulePhase.RULES, language));
    }

    public int groupCount() {
        return groups.size();
    }

    private static List<Rule> flatten(Map<Character, List<Rule>> group) {
        return group.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .flatMap(e -> e.getValue().stream())
                .toList();
    }
}
