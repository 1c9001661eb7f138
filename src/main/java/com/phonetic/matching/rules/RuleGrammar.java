package com.phonetic.matching.rules;

import java.util.regex.Pattern;

/**
 * Line grammars of the rule resources. Every pattern tolerates a trailing {@code //} comment.
 */
public final class RuleGrammar {

    /** Four double-quoted fields separated by whitespace. */
    public static final Pattern QUADRUPLET =
            Pattern.compile("^\\s*\"(.+?)\"\\s+\"(.*?)\"\\s+\"(.*?)\"\\s+\"(.*?)\"\\s*(//.*)?$");

    /** {@code #include other_resource} */
    public static final Pattern INCLUDE =
            Pattern.compile("^\\s*#include\\s+([a-z_]+?)\\s*(//.*)?$");

    /** {@code <regex> <lang1>+<lang2> <true|false>} */
    public static final Pattern LANGUAGE_GUESS =
            Pattern.compile("^(\\S+)\\s+(\\S+)\\s+(\\S+)\\s*(//.*)?$");

    /** {@code <char>=<char>} */
    public static final Pattern FOLDING =
            Pattern.compile("^(.)=(.)\\s*(//.*)?$");

    private RuleGrammar() {
    }

    /**
     * Parses a strict {@code true}/{@code false} token.
     *
     * @throws RuleParseException with reason {@link RuleParseException.Reason#NOT_A_BOOLEAN}
     */
    public static boolean parseBoolean(String token, String resourceName, RuleLine line) {
        if ("true".equals(token)) {
            return true;
        }
        if ("false".equals(token)) {
            return false;
        }
        throw new RuleParseException(RuleParseException.Reason.NOT_A_BOOLEAN, resourceName, line,
                "'" + token + "' is not a boolean");
    }
}
