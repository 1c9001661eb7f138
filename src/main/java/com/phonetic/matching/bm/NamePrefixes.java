package com.phonetic.matching.bm;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Nobiliary particles ("van", "de la", ...) per name type. Order matters: the first particle
 * that prefixes a generic name wins.
 */
public final class NamePrefixes {

    private final Map<NameType, List<String>> prefixes;

    public NamePrefixes(Map<NameType, List<String>> prefixes) {
        Map<NameType, List<String>> copy = new EnumMap<>(NameType.class);
        for (NameType nameType : NameType.values()) {
            List<String> values = prefixes.get(nameType);
            if (values == null) {
                throw new IllegalArgumentException("No prefixes for name type " + nameType);
            }
            copy.put(nameType, List.copyOf(values));
        }
        this.prefixes = copy;
    }

    /**
     * Standard particle lists.
     */
    public static NamePrefixes defaults() {
        Map<NameType, List<String>> prefixes = new EnumMap<>(NameType.class);
        prefixes.put(NameType.ASHKENAZI, List.of("bar", "ben", "da", "de", "van", "von"));
        prefixes.put(NameType.SEPHARDIC, List.of("al", "el", "da", "dal", "de", "del", "dela", "de la",
                "della", "des", "di", "do", "dos", "du", "van", "von"));
        prefixes.put(NameType.GENERIC, List.of("da", "dal", "de", "del", "dela", "de la", "della",
                "des", "di", "do", "dos", "du", "van", "von"));
        return new NamePrefixes(prefixes);
    }

    public List<String> get(NameType nameType) {
        return prefixes.get(nameType);
    }
}
