package com.phonetic.matching.bm;

import com.phonetic.matching.rules.RuleParseException;

/**
 * Cultural profile selecting the rule set, language list and guessing rules.
 */
public enum NameType {

    /** Ashkenazi Jewish names. */
    ASHKENAZI("ash"),

    /** Names of any origin. */
    GENERIC("gen"),

    /** Sephardic Jewish names. */
    SEPHARDIC("sep");

    private final String name;

    NameType(String name) {
        this.name = name;
    }

    /**
     * Short name used in rule resource names, e.g. {@code gen}.
     */
    public String getName() {
        return name;
    }

    /**
     * Parses a short name.
     *
     * @throws RuleParseException with reason {@link RuleParseException.Reason#UNKNOWN_NAME_TYPE}
     */
    public static NameType fromName(String name) {
        for (NameType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new RuleParseException(RuleParseException.Reason.UNKNOWN_NAME_TYPE,
                "Unknown name type '" + name + "'");
    }
}
