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
 * Тесты выбора способа переписывания.
 */
class RewriterChainTest {

    private final RewriterChain chain = new RewriterChain();

    @Test
    void testParseableJavaUsesAst() {
        RewriteResult result = chain.rewrite("class Foo {}\n", "Foo", "Bar", "java", SymbolKind.CLASS);

        assertEquals(Backend.AST, result.backend());
        assertEquals("class Bar {}\n", result.content());
    }

    @Test
    void testSyntaxErrorFallsBackToRegex() {
        String content = "class Foo {\n  // Foo\n  void x( \n}\n";

        RewriteResult result = chain.rewrite(content, "Foo", "Bar", "java", SymbolKind.CLASS);

        assertEquals(Backend.REGEX, result.backend());
        assertEquals("class Bar {\n  // Foo\n  void x( \n}\n", result.content());
    }

    @Test
    void testLanguageWithoutGrammarUsesRegex() {
        RewriteResult result = chain.rewrite("const Foo = 'Foo';\n", "Foo", "Bar", "javascript", SymbolKind.AUTO);

        assertEquals(Backend.REGEX, result.backend());
        assertEquals("const Bar = 'Foo';\n", result.content());
    }

    @Test
    void testUnknownFileTypeUsesPlainTextOnlyWhenAllowed() {
        String content = "Foo: \"Foo\"\n";

        RewriteResult plain = chain.rewrite(content, "Foo", "Bar", null, SymbolKind.CLASS, true);
        assertEquals(Backend.PLAIN_TEXT, plain.backend());
        assertEquals("Bar: \"Bar\"\n", plain.content());

        RewriteResult regex = chain.rewrite(content, "Foo", "Bar", null, SymbolKind.CLASS);
        assertEquals(Backend.REGEX, regex.backend());
        assertEquals("Bar: \"Foo\"\n", regex.content());
    }

    @Test
    void testSameNameIsNoOp() {
        String content = "class Foo {}\n";

        RewriteResult result = chain.rewrite(content, "Foo", "Foo", "java", SymbolKind.CLASS);

        assertEquals(0, result.changes());
        assertSame(content, result.content(), "Контент без изменений возвращается как есть");
    }

    @Test
    void testSymbolKindParsing() {
        assertEquals(SymbolKind.FUNCTION, SymbolKind.parse("method"));
        assertEquals(SymbolKind.FUNCTION, SymbolKind.parse("Function"));
        assertEquals(SymbolKind.CLASS, SymbolKind.parse("class"));
        assertEquals(SymbolKind.VARIABLE, SymbolKind.parse("variable"));
        assertEquals(SymbolKind.AUTO, SymbolKind.parse(null));
        assertThrows(IllegalArgumentException.class, () -> SymbolKind.parse("module"));
        assertTrue(SymbolKind.AUTO.accepts(SymbolKind.CLASS));
        assertFalse(SymbolKind.CLASS.accepts(SymbolKind.FUNCTION));
    }
}
