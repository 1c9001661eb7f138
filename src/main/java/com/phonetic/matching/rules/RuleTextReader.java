package com.phonetic.matching.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits rule resource text into meaningful lines, dropping blank lines and comments.
 *
 * <p>Comment syntax shared by every rule grammar:</p>
 * <ul>
 *   <li>a line starting with {@code //} is discarded</li>
 *   <li>a line starting with {@code /*} opens a block comment, a later line ending with {@code *}{@code /}
 *   closes it</li>
 *   <li>a line both starting with {@code /*} and ending with {@code *}{@code /} is a comment on its own</li>
 * </ul>
 * Outside a block a trailing {@code *}{@code /} means nothing, so such a line reaches the rule grammar.
 */
public final class RuleTextReader {

    private static final String LINE_COMMENT = "//";
    private static final String BLOCK_COMMENT_START = "/*";
    private static final String BLOCK_COMMENT_END = "*/";

    private RuleTextReader() {
    }

    /**
     * Returns the meaningful lines of the given text, in order.
     */
    public static List<RuleLine> read(String text) {
        List<RuleLine> lines = new ArrayList<>();
        boolean inBlockComment = false;
        String[] rawLines = text.split("\\R", -1);

        for (int i = 0; i < rawLines.length; i++) {
            String line = rawLines[i].strip();
            if (inBlockComment) {
                inBlockComment = !line.endsWith(BLOCK_COMMENT_END);
                continue;
            }
            if (line.isEmpty() || line.startsWith(LINE_COMMENT)) {
                continue;
            }
            if (line.startsWith(BLOCK_COMMENT_START)) {
                inBlockComment = !isSingleLineBlock(line);
                continue;
            }
            lines.add(new RuleLine(i + 1, line));
        }
        return lines;
    }

    private static boolean isSingleLineBlock(String line) {
        return line.length() >= BLOCK_COMMENT_START.length() + BLOCK_COMMENT_END.length()
                && line.endsWith(BLOCK_COMMENT_END);
    }

    /**
     * Removes a trailing {@code //} comment from a line.
     */
    public static String stripTrailingComment(String line) {
        int idx = line.indexOf(LINE_COMMENT);
        return idx >= 0 ? line.substring(0, idx).strip() : line;
    }
}
