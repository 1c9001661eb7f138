package com.phonetic.matching.bm;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches the text to the left or right of a rule pattern.
 *
 * <p>Rule contexts are anchored regular expressions, and most of them are either a literal or a
 * single character class. {@link #compile(String)} recognises those shapes and answers them with
 * plain string operations; anything else falls back to {@link Pattern#find()} semantics.</p>
 */
@FunctionalInterface
public interface ContextMatcher {

    ContextMatcher ALL = input -> true;

    boolean matches(CharSequence input);

    /**
     * Compiles a context expression.
     *
     * @throws PatternSyntaxException if the expression needs the regex engine and is not valid
     */
    static ContextMatcher compile(String regex) {
        boolean startsWith = regex.startsWith("^");
        boolean endsWith = regex.endsWith("$");
        String content = regex.substring(startsWith ? 1 : 0, endsWith ? regex.length() - 1 : regex.length());

        if (!content.contains("[")) {
            if (startsWith && endsWith) {
                return content.isEmpty() ? input -> input.length() == 0 : input -> content.contentEquals(input);
            }
            if ((startsWith || endsWith) && content.isEmpty()) {
                return ALL;
            }
            if (startsWith) {
                return input -> startsWith(input, content);
            }
            if (endsWith) {
                return input -> endsWith(input, content);
            }
        } else if (content.startsWith("[") && content.endsWith("]")) {
            String box = content.substring(1, content.length() - 1);
            if (!box.contains("[")) {
                boolean negate = box.startsWith("^");
                String chars = negate ? box.substring(1) : box;
                boolean shouldMatch = !negate;
                if (startsWith && endsWith) {
                    return input -> input.length() == 1 && contains(chars, input.charAt(0)) == shouldMatch;
                }
                if (startsWith) {
                    return input -> input.length() > 0 && contains(chars, input.charAt(0)) == shouldMatch;
                }
                if (endsWith) {
                    return input -> input.length() > 0
                            && contains(chars, input.charAt(input.length() - 1)) == shouldMatch;
                }
            }
        }

        Pattern pattern = Pattern.compile(regex);
        return input -> pattern.matcher(input).find();
    }

    private static boolean contains(String chars, char c) {
        return chars.indexOf(c) >= 0;
    }

    private static boolean startsWith(CharSequence input, String prefix) {
        if (prefix.length() > input.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (input.charAt(i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean endsWith(CharSequence input, String suffix) {
        int offset = input.length() - suffix.length();
        if (offset < 0) {
            return false;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (input.charAt(offset + i) != suffix.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
