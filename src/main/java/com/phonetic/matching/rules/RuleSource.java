package com.phonetic.matching.rules;

import java.util.Optional;

/**
 * Supplies the raw text of named rule resources (for example {@code gen_rules_any}).
 * Implementations only locate and read text; parsing happens in the consumers.
 */
public interface RuleSource {

    /**
     * Reads a resource by its logical name.
     *
     * @param name logical resource name, without extension
     * @return the resource text, or empty if no such resource exists
     * @throws RuleResourceException if the resource exists but cannot be read
     */
    Optional<String> read(String name);

    /**
     * Human-readable description of where resources come from, for logs and error messages.
     */
    String describe();

    /**
     * Reads a resource that the configuration requires.
     *
     * @throws RuleParseException with reason {@link RuleParseException.Reason#WRONG_FILENAME} if it is missing
     */
    default String require(String name) {
        return read(name).orElseThrow(() -> new RuleParseException(RuleParseException.Reason.WRONG_FILENAME,
                "Resource '" + name + "' not found in " + describe()));
    }
}
