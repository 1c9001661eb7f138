package com.phonetic.matching.bm;

/**
 * Final-rule flavour applied after the main transformation pass.
 */
public enum RuleType {

    /** Approximate matching, more alternatives. */
    APPROX,

    /** Exact matching. */
    EXACT
}
