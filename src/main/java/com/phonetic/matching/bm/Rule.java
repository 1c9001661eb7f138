package com.phonetic.matching.bm;

/**
 * A Beider-Morse rewrite rule: when {@code pattern} occurs at a position whose left and right
 * surroundings satisfy the contexts, it is replaced by the phoneme alternatives.
 */
public final class Rule {

    private final String pattern;
    private final ContextMatcher leftContext;
    private final ContextMatcher rightContext;
    private final PhonemeExpr phoneme;
    private final String location;
    private final int line;

    public Rule(String pattern, ContextMatcher leftContext, ContextMatcher rightContext, PhonemeExpr phoneme) {
        this(pattern, leftContext, rightContext, phoneme, null, 0);
    }

    Rule(String pattern, ContextMatcher leftContext, ContextMatcher rightContext, PhonemeExpr phoneme,
         String location, int line) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern cannot be empty");
        }
        this.pattern = pattern;
        this.leftContext = leftContext;
        this.rightContext = rightContext;
        this.phoneme = phoneme;
        this.location = location;
        this.line = line;
    }

    public String getPattern() {
        return pattern;
    }

    public PhonemeExpr getPhoneme() {
        return phoneme;
    }

    /**
     * Resource the rule was read from, {@code null} for rules built in code.
     */
    public String getLocation() {
        return location;
    }

    public int getLine() {
        return line;
    }

    /**
     * Tests the pattern at {@code index} and both contexts around it.
     */
    public boolean patternAndContextMatches(String input, int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Can not match pattern at negative indexes");
        }
        int end = index + pattern.length();
        if (end > input.length()) {
            return false;
        }
        if (!input.startsWith(pattern, index)) {
            return false;
        }
        if (!rightContext.matches(input.subSequence(end, input.length()))) {
            return false;
        }
        return leftContext.matches(input.subSequence(0, index));
    }

    @Override
    public String toString() {
        return "Rule{" +
                "pattern='" + pattern + '\'' +
                ", location=" + location +
                ", line=" + line +
                '}';
    }
}
