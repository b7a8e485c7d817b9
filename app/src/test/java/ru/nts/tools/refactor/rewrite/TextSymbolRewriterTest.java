/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.refactor.rewrite;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты построчной замены с пропуском комментариев и строковых литералов.
 */
class TextSymbolRewriterTest {

    private final TextSymbolRewriter rewriter = new TextSymbolRewriter();

    private RewriteResult rewrite(String content, String oldName, String newName) {
        return rewriter.rewrite(content, oldName, newName, null, SymbolKind.AUTO).orElseThrow();
    }

    @Test
    void testCommentsAndStringsAreSkipped() {
        String content = "// old in comment\nString s = \"old value\";\nint old = 1;";

        RewriteResult result = rewrite(content, "old", "new");

        assertEquals("// old in comment\nString s = \"old value\";\nint new = 1;", result.content());
        assertEquals(1, result.changes());
        assertEquals(Backend.REGEX, result.backend());
    }

    @Test
    void testWholeWordOnly() {
        RewriteResult result = rewrite("old = older + old_value + old;\n", "old", "new");

        assertEquals("new = older + old_value + new;\n", result.content(), "Части других слов не заменяются");
        assertEquals(2, result.changes());
    }

    @Test
    void testMatchAfterStringOnSameLine() {
        RewriteResult result = rewrite("log('old', \"it's old\", old)\n", "old", "new");

        assertEquals("log('old', \"it's old\", new)\n", result.content());
    }

    @Test
    void testEscapedQuoteInsideString() {
        RewriteResult result = rewrite("s = \"say \\\"old\\\" here\" + old\n", "old", "new");

        assertEquals("s = \"say \\\"old\\\" here\" + new\n", result.content(), "Экранированная кавычка не закрывает строку");
    }

    @Test
    void testHashCommentsAndBlockCommentLines() {
        String content = "# old\n  /* old */\n   * old\nold()\n";

        RewriteResult result = rewrite(content, "old", "new");

        assertEquals("# old\n  /* old */\n   * old\nnew()\n", result.content());
    }

    @Test
    void testLineEndingsArePreserved() {
        String content = "a = old\r\nb = old\r\n";

        assertEquals("a = new\r\nb = new\r\n", rewrite(content, "old", "new").content());
    }

    @Test
    void testNoOpCases() {
        RewriteResult same = rewrite("old old", "old", "old");
        assertEquals(0, same.changes());
        assertFalse(same.changed());

        RewriteResult absent = rewrite("nothing here", "old", "new");
        assertEquals("nothing here", absent.content());
        assertEquals(0, absent.changes());
    }

    @Test
    void testStringMask() {
        boolean[] mask = TextSymbolRewriter.stringMask("a 'b' c");
        assertFalse(mask[0]);
        assertTrue(mask[2]);
        assertTrue(mask[3]);
        assertTrue(mask[4]);
        assertFalse(mask[6]);
        assertTrue(TextSymbolRewriter.isCommentLine("   // x"));
        assertFalse(TextSymbolRewriter.isCommentLine("x // y"));
    }
}
