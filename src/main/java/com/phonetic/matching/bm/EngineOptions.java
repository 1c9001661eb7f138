package com.phonetic.matching.bm;

/**
 * Options of a {@link PhoneticEngine}.
 */
public class EngineOptions {

    private static final int DEFAULT_MAX_PHONEMES = 20;

    private final NameType nameType;
    private final RuleType ruleType;
    private final boolean concat;
    private final int maxPhonemes;

    private EngineOptions(Builder builder) {
        this.nameType = builder.nameType;
        this.ruleType = builder.ruleType;
        this.concat = builder.concat;
        this.maxPhonemes = builder.maxPhonemes;
    }

    public NameType getNameType() {
        return nameType;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    /**
     * Whether the words of a multi-word name are encoded together rather than one by one.
     */
    public boolean isConcat() {
        return concat;
    }

    /**
     * Upper bound on the number of alternatives kept while applying a rule.
     */
    public int getMaxPhonemes() {
        return maxPhonemes;
    }

    /**
     * Generic names, approximate rules, concatenated words, at most 20 phonemes.
     */
    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EngineOptions{" +
                "nameType=" + nameType +
                ", ruleType=" + ruleType +
                ", concat=" + concat +
                ", maxPhonemes=" + maxPhonemes +
                '}';
    }

    public static class Builder {
        private NameType nameType = NameType.GENERIC;
        private RuleType ruleType = RuleType.APPROX;
        private boolean concat = true;
        private int maxPhonemes = DEFAULT_MAX_PHONEMES;

        public Builder nameType(NameType nameType) {
            if (nameType == null) {
                throw new IllegalArgumentException("nameType cannot be null");
            }
            this.nameType = nameType;
            return this;
        }

        public Builder ruleType(RuleType ruleType) {
            if (ruleType == null) {
                throw new IllegalArgumentException("ruleType cannot be null");
            }
            this.ruleType = ruleType;
            return this;
        }

        public Builder concat(boolean concat) {
            this.concat = concat;
            return this;
        }

        public Builder maxPhonemes(int maxPhonemes) {
            if (maxPhonemes <= 0) {
                throw new IllegalArgumentException("maxPhonemes must be positive");
            }
            this.maxPhonemes = maxPhonemes;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
