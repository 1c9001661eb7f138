package com.phonetic.matching.rules;

/**
 * A meaningful (non-blank, non-comment) line of a rule resource.
 *
 * @param number  1-based line number within the resource
 * @param content the trimmed line text
 */
public record RuleLine(int number, String content) {
}
