package com.phonetic.matching.bm;

/**
 * Rule groups of a name type: the main pass plus the two final-rule flavours.
 */
enum RulePhase {
    RULES("rules"),
    APPROX("approx"),
    EXACT("exact");

    private final String name;

    RulePhase(String name) {
        this.name = name;
    }

    String getName() {
        return name;
    }

    static RulePhase of(RuleType ruleType) {
        return switch (ruleType) {
            case APPROX -> APPROX;
            case EXACT -> EXACT;
        };
    }
}
