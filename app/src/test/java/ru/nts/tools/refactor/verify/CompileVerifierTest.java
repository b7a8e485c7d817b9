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
package ru.nts.tools.refactor.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Тесты рекомендательной проверки компиляции. Проверка никогда не бросает исключений.
 */
class CompileVerifierTest {

    @TempDir
    Path tempDir;

    private final CompileVerifier verifier = new CompileVerifier(Duration.ofSeconds(60));

    @Test
    void testMissingAndEmptyFiles() throws IOException {
        CompileCheck missing = verifier.check(tempDir.resolve("Nope.java"));
        assertFalse(missing.ok());
        assertTrue(missing.skipped());
        assertEquals("Cannot check - file not found", missing.message());

        Path empty = tempDir.resolve("Empty.java");
        Files.createFile(empty);
        assertEquals("Cannot check - empty file", verifier.check(empty).message());
    }

    @Test
    void testUnknownLanguage() throws IOException {
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, "hello");

        CompileCheck result = verifier.check(notes);

        assertEquals("Cannot check - unknown language", result.message());
        assertTrue(result.skipped());
    }

    @Test
    void testPythonSyntaxCheck() throws IOException {
        Path good = tempDir.resolve("good.py");
        Files.writeString(good, "def f(x):\n    return x\n");
        assertEquals(CompileCheck.compiles(), verifier.check(good));

        Path bad = tempDir.resolve("bad.py");
        Files.writeString(bad, "x = 1\ndef f(:\n    pass\n");
        CompileCheck result = verifier.check(bad);
        assertFalse(result.ok());
        assertFalse(result.skipped(), "Синтаксическая ошибка - это провал, а не пропуск проверки");
        assertTrue(result.message().startsWith("Syntax Error (line "), result.message());
    }

    @Test
    void testJavaCompileLeavesNoClassFiles() throws IOException {
        Path source = tempDir.resolve("Hello.java");
        Files.writeString(source, "public class Hello { int x = 1; }\n");

        CompileCheck result = verifier.check(source);
        assumeFalse(result.skipped(), "javac недоступен: " + result.message());

        assertTrue(result.ok(), result.message());
        assertFalse(Files.exists(tempDir.resolve("Hello.class")), "Артефакты компиляции должны быть удалены");
    }

    @Test
    void testJavaCompileError() throws IOException {
        Path source = tempDir.resolve("Broken.java");
        Files.writeString(source, "public class Broken { int x = ; }\n");

        CompileCheck result = verifier.check(source);
        assumeFalse(result.skipped(), "javac недоступен: " + result.message());

        assertFalse(result.ok());
        assertEquals("Compile Error", result.message());
        assertFalse(Files.exists(tempDir.resolve("Broken.class")));
    }
}
