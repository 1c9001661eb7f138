package com.phonetic.matching.bm;

import java.util.HashMap;
import java.util.Map;

/**
 * A tiny but complete Beider-Morse resource set with the languages {@code any} and {@code english},
 * identical for every name type. Tests override single resources to provoke specific behaviour.
 */
final class MinimalRules {

    static final String ANY_RULES = String.join("\n",
            "// main rules",
            "\"a\" \"\" \"\" \"(a|o)\"",
            "\"b\" \"\" \"\" \"b\"",
            "\"ab\" \"\" \"\" \"X\"",
            "\"c\" \"\" \"[e]\" \"s\"",
            "\"c\" \"\" \"\" \"k\"",
            "\"d\" \"\" \"\" \"(t[english]|d[french])\"",
            "\"x\" \"\" \"\" \"x\"");

    static final String ENGLISH_RULES = String.join("\n",
            "\"a\" \"\" \"\" \"e\"",
            "\"d\" \"\" \"\" \"(t[english]|d[french])\"",
            "\"x\" \"\" \"\" \"x\"");

    private MinimalRules() {
    }

    static Map<String, String> resources() {
        Map<String, String> resources = new HashMap<>();
        for (NameType nameType : NameType.values()) {
            String nt = nameType.getName();
            resources.put(nt + "_languages", "any\nenglish\n");
            resources.put(nt + "_lang", "^x english true\n");
            resources.put(nt + "_rules_any", ANY_RULES);
            resources.put(nt + "_rules_english", ENGLISH_RULES);
            for (String phase : new String[]{"approx", "exact"}) {
                resources.put(nt + "_" + phase + "_any", "");
                resources.put(nt + "_" + phase + "_english", "");
            }
            resources.put(nt + "_approx_common", "\"k\" \"\" \"\" \"g\"\n");
            resources.put(nt + "_exact_common", "");
        }
        return resources;
    }
}
