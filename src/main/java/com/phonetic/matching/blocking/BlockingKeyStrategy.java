package com.phonetic.matching.blocking;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from names.
 * Blocking keys narrow the candidate set for fuzzy matching: only names sharing at least one
 * key are compared in detail.
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking keys of a name.
     *
     * @param name the name
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String name);
}
