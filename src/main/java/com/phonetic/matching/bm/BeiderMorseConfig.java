package com.phonetic.matching.bm;

import com.phonetic.matching.logging.LogContext;
import com.phonetic.matching.rules.ClasspathRuleSource;
import com.phonetic.matching.rules.DirectoryRuleSource;
import com.phonetic.matching.rules.RuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything a {@link PhoneticEngine} reads: language lists, language-guessing rules and the
 * rule repository. Built once, read-only afterwards, shareable between engines and threads.
 *
 * <p>Loading is fail-fast: any missing resource or malformed line aborts with a
 * {@link com.phonetic.matching.rules.RuleParseException}, unreadable resources with a
 * {@link com.phonetic.matching.rules.RuleResourceException}.</p>
 */
public final class BeiderMorseConfig {
    private static final Logger log = LoggerFactory.getLogger(BeiderMorseConfig.class);

    private final Languages languages;
    private final Map<NameType, Lang> langs;
    private final Rules rules;
    private final String source;

    private BeiderMorseConfig(Languages languages, Map<NameType, Lang> langs, Rules rules, String source) {
        this.languages = languages;
        this.langs = langs;
        this.rules = rules;
        this.source = source;
    }

    /**
     * Loads the rules shipped with the library.
     */
    public static BeiderMorseConfig bundled() {
        return load(ClasspathRuleSource.beiderMorse());
    }

    /**
     * Loads {@code <name>.txt} rule files from a directory.
     */
    public static BeiderMorseConfig fromDirectory(Path directory) {
        return load(new DirectoryRuleSource(directory));
    }

    public static BeiderMorseConfig load(RuleSource source) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forConfigLoad(source.describe()).with("algorithm", "beider-morse")) {
            Languages languages = Languages.load(source);
            Map<NameType, Lang> langs = new EnumMap<>(NameType.class);
            for (NameType nameType : NameType.values()) {
                langs.put(nameType, Lang.load(source, nameType, languages));
            }
            Rules rules = Rules.load(source, languages);

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("Beider-Morse rules loaded from {}: {} rule groups in {}ms",
                    source.describe(), rules.groupCount(), elapsedMs);
            return new BeiderMorseConfig(languages, langs, rules, source.describe());
        }
    }

    public Languages getLanguages() {
        return languages;
    }

    public Lang getLang(NameType nameType) {
        return langs.get(nameType);
    }

    public Rules getRules() {
        return rules;
    }

    /**
     * Where the rules were loaded from.
     */
    public String getSource() {
        return source;
    }
}
