package com.phonetic.matching.bm;

import com.phonetic.matching.rules.InMemoryRuleSource;
import com.phonetic.matching.rules.RuleParseException;
import com.phonetic.matching.rules.RuleParseException.Reason;
import com.phonetic.matching.rules.RuleResourceException;
import com.phonetic.matching.rules.RuleSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BeiderMorseConfigTest {

    private static RuleParseException loadFailure(Map<String, String> resources) {
        return assertThrows(RuleParseException.class,
                () -> BeiderMorseConfig.load(new InMemoryRuleSource(resources)));
    }

    private static Map<String, String> with(String name, String text) {
        Map<String, String> resources = MinimalRules.resources();
        resources.put(name, text);
        return resources;
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Bundled rules should cover every name type")
        void bundled() {
            BeiderMorseConfig config = BeiderMorseConfig.bundled();

            for (NameType nameType : NameType.values()) {
                assertTrue(config.getLanguages().getLanguages(nameType).contains(LanguageSet.ANY_LANGUAGE));
                assertTrue(config.getRules().hasLanguage(nameType, LanguageSet.ANY_LANGUAGE));
                assertNotNull(config.getLang(nameType));
            }
            assertTrue(config.getLanguages().getLanguages(NameType.GENERIC).contains("english"));
            assertEquals("classpath:com/phonetic/matching/bm/", config.getSource());
        }

        @Test
        @DisplayName("Should load every language and phase plus the common groups")
        void groupCount() {
            BeiderMorseConfig config = BeiderMorseConfig.load(new InMemoryRuleSource(MinimalRules.resources()));

            // 3 name types x (2 languages x 3 phases + 2 common)
            assertEquals(24, config.getRules().groupCount());
        }

        @Test
        @DisplayName("Interleaved comments should not change the loaded rules")
        void commentsAreTransparent() {
            String stripped = String.join("\n",
                    "\"a\" \"\" \"\" \"(a|o)\"",
                    "\"b\" \"\" \"\" \"b\"",
                    "\"ab\" \"\" \"\" \"X\"",
                    "\"c\" \"\" \"[e]\" \"s\"",
                    "\"c\" \"\" \"\" \"k\"",
                    "\"d\" \"\" \"\" \"(t[english]|d[french])\"",
                    "\"x\" \"\" \"\" \"x\"");
            String commented = String.join("\n",
                    "/*",
                    " * Main rules for any language.",
                    " */",
                    "// single letters first",
                    "\"a\" \"\" \"\" \"(a|o)\"",
                    "/* b is stable */",
                    "\"b\" \"\" \"\" \"b\"   // as is",
                    "   // indented note",
                    "\"ab\" \"\" \"\" \"X\"",
                    "/* disabled",
                    "\"c\" \"\" \"\" \"zzz\"",
                    "*/",
                    "\"c\" \"\" \"[e]\" \"s\"",
                    "",
                    "\"c\" \"\" \"\" \"k\" // hard c",
                    "\"d\" \"\" \"\" \"(t[english]|d[french])\"",
                    "// trailing",
                    "\"x\" \"\" \"\" \"x\"",
                    "/* end */");

            BeiderMorseConfig plain = BeiderMorseConfig.load(new InMemoryRuleSource(with("gen_rules_any", stripped)));
            BeiderMorseConfig noisy = BeiderMorseConfig.load(new InMemoryRuleSource(with("gen_rules_any", commented)));

            List<String> plainPatterns = plain.getRules().getMainRules(NameType.GENERIC, "any").stream()
                    .map(Rule::getPattern).toList();
            List<String> noisyPatterns = noisy.getRules().getMainRules(NameType.GENERIC, "any").stream()
                    .map(Rule::getPattern).toList();
            assertEquals(plainPatterns, noisyPatterns);

            for (RuleType ruleType : RuleType.values()) {
                EngineOptions options = EngineOptions.builder().ruleType(ruleType).build();
                PhoneticEngine plainEngine = new PhoneticEngine(plain, options);
                PhoneticEngine noisyEngine = new PhoneticEngine(noisy, options);
                for (String input : List.of("abc", "ce", "aa", "d", "bac", "cab")) {
                    assertEquals(plainEngine.encode(input), noisyEngine.encode(input), input + " " + ruleType);
                }
            }
        }

        @Test
        @DisplayName("Loading should tag the log context with the algorithm")
        void tagsLogContext() {
            RuleSource resources = new InMemoryRuleSource(MinimalRules.resources());
            Set<String> seen = new HashSet<>();
            RuleSource observed = new RuleSource() {
                @Override
                public Optional<String> read(String name) {
                    seen.add(MDC.get("algorithm") + "/" + MDC.get("operation"));
                    return resources.read(name);
                }

                @Override
                public String describe() {
                    return resources.describe();
                }
            };

            BeiderMorseConfig.load(observed);

            assertEquals(Set.of("beider-morse/config-load"), seen);
            assertNull(MDC.get("algorithm"));
        }

        @Test
        @DisplayName("Should follow includes")
        void includes() {
            Map<String, String> resources = with("gen_rules_any", "#include shared_rules // shared\n");
            resources.put("shared_rules", "\"q\" \"\" \"\" \"k\"\n");

            BeiderMorseConfig config = BeiderMorseConfig.load(new InMemoryRuleSource(resources));

            Rule rule = config.getRules().getMainRules(NameType.GENERIC, "any").get(0);
            assertEquals("q", rule.getPattern());
            assertEquals("shared_rules", rule.getLocation());
            assertEquals(1, rule.getLine());
        }

        @Test
        @DisplayName("Should load rule files from a directory")
        void fromDirectory(@TempDir Path dir) throws IOException {
            for (Map.Entry<String, String> entry : MinimalRules.resources().entrySet()) {
                Files.writeString(dir.resolve(entry.getKey() + ".txt"), entry.getValue(), StandardCharsets.UTF_8);
            }

            BeiderMorseConfig config = BeiderMorseConfig.fromDirectory(dir);
            PhoneticEngine engine = new PhoneticEngine(config, EngineOptions.defaults());

            assertEquals("Xg", engine.encode("abc"));
            assertEquals(dir.toString(), config.getSource());
        }

        @Test
        @DisplayName("Main rules should be ordered longest pattern first per bucket")
        void longestFirst() {
            BeiderMorseConfig config = BeiderMorseConfig.load(new InMemoryRuleSource(MinimalRules.resources()));

            var rules = config.getRules().getMainRules(NameType.GENERIC, "any");

            assertEquals("ab", rules.get(0).getPattern());
            assertEquals("a", rules.get(1).getPattern());
        }

        @Test
        @DisplayName("Unknown rule groups should be rejected")
        void unknownGroup() {
            BeiderMorseConfig config = BeiderMorseConfig.load(new InMemoryRuleSource(MinimalRules.resources()));

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> config.getRules().getMainRules(NameType.GENERIC, "klingon"));
            assertEquals("No rules found for gen, rules, klingon.", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Missing resource should fail with WRONG_FILENAME")
        void missingResource() {
            Map<String, String> resources = MinimalRules.resources();
            resources.remove("sep_exact_common");

            RuleParseException ex = loadFailure(resources);

            assertEquals(Reason.WRONG_FILENAME, ex.getReason());
            assertTrue(ex.getMessage().contains("sep_exact_common"));
        }

        @Test
        @DisplayName("Missing include should name the including file and line")
        void missingInclude() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "// header\n#include nowhere\n"));

            assertEquals(Reason.WRONG_FILENAME, ex.getReason());
            assertEquals("gen_rules_any", ex.getResourceName());
            assertEquals(2, ex.getLineNumber());
            assertTrue(ex.getMessage().contains("Can't include file nowhere in gen_rules_any at line 2"));
        }

        @Test
        @DisplayName("Circular include should be rejected")
        void circularInclude() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "#include gen_rules_any\n"));

            assertEquals(Reason.WRONG_FILENAME, ex.getReason());
        }

        @Test
        @DisplayName("Rule with three fields should fail with BAD_RULE")
        void badRule() {
            RuleParseException ex = loadFailure(with("ash_rules_english", "\"a\" \"\" \"\"\n"));

            assertEquals(Reason.BAD_RULE, ex.getReason());
            assertEquals("ash_rules_english", ex.getResourceName());
            assertEquals(1, ex.getLineNumber());
            assertEquals("\"a\" \"\" \"\"", ex.getLineContent());
        }

        @Test
        @DisplayName("Invalid context should fail with BAD_CONTEXT_REGEX")
        void badContext() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "\"a\" \"[\" \"\" \"a\"\n"));

            assertEquals(Reason.BAD_CONTEXT_REGEX, ex.getReason());
            assertNotNull(ex.getCause());
        }

        @Test
        @DisplayName("Unbalanced phoneme list should fail with WRONG_PHONEME")
        void unbalancedPhonemeList() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "\"a\" \"\" \"\" \"(a|o\"\n"));

            assertEquals(Reason.WRONG_PHONEME, ex.getReason());
        }

        @Test
        @DisplayName("Unclosed language tag should fail with WRONG_PHONEME")
        void unclosedLanguageTag() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "\"a\" \"\" \"\" \"a[english\"\n"));

            assertEquals(Reason.WRONG_PHONEME, ex.getReason());
        }

        @Test
        @DisplayName("Language rule with a bad flag should fail with NOT_A_BOOLEAN")
        void notABoolean() {
            RuleParseException ex = loadFailure(with("gen_lang", "^x english maybe\n"));

            assertEquals(Reason.NOT_A_BOOLEAN, ex.getReason());
            assertEquals("gen_lang", ex.getResourceName());
        }

        @Test
        @DisplayName("Language rule with two fields should fail with BAD_RULE")
        void badLanguageRule() {
            RuleParseException ex = loadFailure(with("gen_lang", "^x english\n"));

            assertEquals(Reason.BAD_RULE, ex.getReason());
        }

        @Test
        @DisplayName("Rule line with a trailing block-comment end should fail with BAD_RULE")
        void strayBlockCommentEnd() {
            RuleParseException ex = loadFailure(with("gen_rules_any", "\"a\" \"\" \"\" \"a\" */\n"));

            assertEquals(Reason.BAD_RULE, ex.getReason());
            assertEquals(1, ex.getLineNumber());
        }

        @Test
        @DisplayName("Unreadable rule file should abort loading with RuleResourceException")
        void unreadableResource(@TempDir Path dir) throws IOException {
            for (Map.Entry<String, String> entry : MinimalRules.resources().entrySet()) {
                Files.writeString(dir.resolve(entry.getKey() + ".txt"), entry.getValue(), StandardCharsets.UTF_8);
            }
            Files.write(dir.resolve("gen_rules_english.txt"), new byte[]{'"', (byte) 0xC3, (byte) 0x28});

            RuleResourceException ex = assertThrows(RuleResourceException.class,
                    () -> BeiderMorseConfig.fromDirectory(dir));

            assertTrue(ex.getMessage().contains("gen_rules_english.txt"));
            assertInstanceOf(IOException.class, ex.getCause());
        }

        @Test
        @DisplayName("Unknown name type should fail with UNKNOWN_NAME_TYPE")
        void unknownNameType() {
            RuleParseException ex = assertThrows(RuleParseException.class, () -> NameType.fromName("xyz"));

            assertEquals(Reason.UNKNOWN_NAME_TYPE, ex.getReason());
            assertEquals(NameType.SEPHARDIC, NameType.fromName("sep"));
        }
    }
}
