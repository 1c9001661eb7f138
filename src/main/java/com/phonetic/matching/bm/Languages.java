package com.phonetic.matching.bm;

import com.phonetic.matching.rules.RuleLine;
import com.phonetic.matching.rules.RuleSource;
import com.phonetic.matching.rules.RuleTextReader;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Valid language names per name type, read from {@code <nt>_languages} resources.
 */
public final class Languages {

    private final Map<NameType, SortedSet<String>> languages;

    Languages(Map<NameType, SortedSet<String>> languages) {
        this.languages = new EnumMap<>(languages);
    }

    /**
     * Loads the language list of every name type.
     */
    public static Languages load(RuleSource source) {
        Map<NameType, SortedSet<String>> languages = new EnumMap<>(NameType.class);
        for (NameType nameType : NameType.values()) {
            String text = source.require(resourceName(nameType));
            SortedSet<String> names = new TreeSet<>();
            for (RuleLine line : RuleTextReader.read(text)) {
                String name = RuleTextReader.stripTrailingComment(line.content());
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
            languages.put(nameType, Collections.unmodifiableSortedSet(names));
        }
        return new Languages(languages);
    }

    static String resourceName(NameType nameType) {
        return nameType.getName() + "_languages";
    }

    public SortedSet<String> getLanguages(NameType nameType) {
        return languages.get(nameType);
    }
}
