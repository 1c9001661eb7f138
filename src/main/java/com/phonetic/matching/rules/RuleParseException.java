package com.phonetic.matching.rules;

/**
 * Runtime exception thrown when rule resources cannot be turned into rule tables.
 * Always raised while a configuration is being built, never while encoding.
 */
public class RuleParseException extends RuntimeException {

    /**
     * What went wrong.
     */
    public enum Reason {
        UNKNOWN_NAME_TYPE,
        BAD_RULE,
        NOT_A_BOOLEAN,
        BAD_CONTEXT_REGEX,
        WRONG_FILENAME,
        WRONG_PHONEME
    }

    private final Reason reason;
    private final String resourceName;
    private final int lineNumber;
    private final String lineContent;

    public RuleParseException(Reason reason, String resourceName, RuleLine line, String message) {
        this(reason, resourceName, line, message, null);
    }

    public RuleParseException(Reason reason, String resourceName, RuleLine line, String message, Throwable cause) {
        super(format(reason, resourceName, line, message), cause);
        this.reason = reason;
        this.resourceName = resourceName;
        this.lineNumber = line != null ? line.number() : 0;
        this.lineContent = line != null ? line.content() : null;
    }

    public RuleParseException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
        this.resourceName = null;
        this.lineNumber = 0;
        this.lineContent = null;
    }

    public Reason getReason() {
        return reason;
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * 1-based line number, or 0 when the error is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLineContent() {
        return lineContent;
    }

    private static String format(Reason reason, String resourceName, RuleLine line, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(reason).append(": ").append(message);
        if (resourceName != null) {
            sb.append(" [resource=").append(resourceName);
            if (line != null) {
                sb.append(", line ").append(line.number()).append(": '").append(line.content()).append('\'');
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
