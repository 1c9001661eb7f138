package com.phonetic.matching.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTextReaderTest {

    private static List<String> contents(String text) {
        return RuleTextReader.read(text).stream().map(RuleLine::content).toList();
    }

    @Nested
    @DisplayName("Comments")
    class CommentTests {

        @Test
        @DisplayName("Should drop line comments and blank lines")
        void dropsLineComments() {
            String text = "// header\n\n  \"a\" \"\" \"\" \"a\"\n   // indented comment\n\"b\" \"\" \"\" \"b\"\n";

            assertEquals(List.of("\"a\" \"\" \"\" \"a\"", "\"b\" \"\" \"\" \"b\""), contents(text));
        }

        @Test
        @DisplayName("Should drop multi-line block comments")
        void dropsBlockComments() {
            String text = "/*\n * licence\n \"x\" \"\" \"\" \"x\"\n */\nkept\n";

            assertEquals(List.of("kept"), contents(text));
        }

        @Test
        @DisplayName("Single-line block comment should not open a block")
        void singleLineBlockComment() {
            String text = "/* one line */\nkept\n";

            assertEquals(List.of("kept"), contents(text));
        }

        @Test
        @DisplayName("Block end outside a block should not hide the line")
        void strayBlockEnd() {
            String text = "\"a\" \"\" \"\" \"a\" */\n/* note */\nkept\n";

            assertEquals(List.of("\"a\" \"\" \"\" \"a\" */", "kept"), contents(text));
        }

        @Test
        @DisplayName("Unterminated block comment should swallow the rest")
        void unterminatedBlock() {
            assertEquals(List.of("first"), contents("first\n/* open\nsecond\nthird"));
        }
    }

    @Test
    @DisplayName("Should keep 1-based physical line numbers")
    void lineNumbers() {
        List<RuleLine> lines = RuleTextReader.read("// c\r\n\r\nfirst\r\nsecond");

        assertEquals(2, lines.size());
        assertEquals(new RuleLine(3, "first"), lines.get(0));
        assertEquals(new RuleLine(4, "second"), lines.get(1));
    }

    @Test
    @DisplayName("Should return nothing for empty text")
    void emptyText() {
        assertTrue(RuleTextReader.read("").isEmpty());
    }

    @Test
    @DisplayName("Should strip trailing comments")
    void stripTrailingComment() {
        assertEquals("english", RuleTextReader.stripTrailingComment("english   // main language"));
        assertEquals("english", RuleTextReader.stripTrailingComment("english"));
    }
}
