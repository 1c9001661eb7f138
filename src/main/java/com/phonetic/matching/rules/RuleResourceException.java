package com.phonetic.matching.rules;

/**
 * Runtime exception thrown when a rule resource exists but cannot be read.
 */
public class RuleResourceException extends RuntimeException {

    public RuleResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
