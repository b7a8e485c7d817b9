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
package ru.nts.tools.refactor.core.treesitter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты определения языка по расширению и shebang.
 */
class LanguageDetectorTest {

    @Test
    void testDetectByExtension() {
        assertEquals(Optional.of("java"), LanguageDetector.detect(Path.of("src/Main.java")));
        assertEquals(Optional.of("python"), LanguageDetector.detect(Path.of("tool.PY")));
        assertEquals(Optional.of("python"), LanguageDetector.detect(Path.of("stubs.pyi")));
        assertEquals(Optional.of("javascript"), LanguageDetector.detect(Path.of("app.mjs")));
        assertEquals(Optional.of("typescript"), LanguageDetector.detect(Path.of("view.tsx")));
        assertTrue(LanguageDetector.detect(Path.of("README.md")).isEmpty());
        assertTrue(LanguageDetector.detect(Path.of("Makefile")).isEmpty());
        assertTrue(LanguageDetector.detect(Path.of("trailing.")).isEmpty());
    }

    @Test
    void testDetectByShebang() {
        assertEquals(Optional.of("python"), LanguageDetector.detect(Path.of("run"), "#!/usr/bin/env python3\nprint(1)\n"));
        assertEquals(Optional.of("javascript"), LanguageDetector.detect(Path.of("run"), "#!/usr/bin/env node\n"));
        assertTrue(LanguageDetector.detect(Path.of("run"), "#!/bin/sh\n").isEmpty());
        assertEquals(Optional.of("java"), LanguageDetector.detect(Path.of("A.java"), "#!/usr/bin/env python\n"),
                "Расширение важнее shebang");
    }

    @Test
    void testGrammarsAreAvailableForJavaAndPython() {
        TreeSitterManager manager = TreeSitterManager.getInstance();
        assertTrue(manager.hasGrammar("java"));
        assertTrue(manager.hasGrammar("python"));
        assertFalse(manager.hasGrammar("javascript"));
        assertFalse(manager.hasGrammar(null));
    }
}
