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
package ru.nts.tools.refactor.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.refactor.RefactorCli;
import ru.nts.tools.refactor.core.EngineConfig;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты командной строки: разбор аргументов, коды выхода, JSON-вывод.
 */
class RefactorCliTest {

    @TempDir
    Path tempDir;

    private record CliResult(int exitCode, String out, String err) {}

    private CliResult run(String stdin, boolean interactive, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        RefactorCli cli = new RefactorCli(Map.of("REFACTOR_RETRY_DELAY", "0"),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                tempDir, interactive);
        int exitCode = RefactorCli.commandLine(cli).execute(args);
        return new CliResult(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private CliResult run(String... args) {
        return run("", false, args);
    }

    @Test
    void testUsageErrorExitCode() {
        assertEquals(2, run("rename").exitCode(), "Не хватает аргументов");
        assertEquals(2, run("rename", "A.java", "B", "--content-only", "--no-content").exitCode(),
                "Взаимоисключающие флаги");
        assertEquals(2, run("bogus").exitCode());
        assertEquals(2, run("replace", "a", "b").exitCode(), "--in обязателен");
    }

    @Test
    void testHelp() {
        CliResult result = run("--help");
        assertEquals(0, result.exitCode());
        assertTrue(result.out().contains("rename"));
        assertTrue(result.out().contains("replace"));
    }

    @Test
    void testRenameCommand() throws IOException {
        Files.writeString(tempDir.resolve("Foo.java"), "public class Foo {}\n");

        CliResult result = run("rename", "Foo.java", "Bar", "--yes", "--no-check-compile");

        assertEquals(0, result.exitCode(), result.out() + result.err());
        assertEquals("public class Bar {}\n", Files.readString(tempDir.resolve("Bar.java")));
        assertFalse(Files.exists(tempDir.resolve("Foo.java")));
    }

    @Test
    void testMissingFileIsValidationError() {
        CliResult result = run("rename", "Missing.java", "Bar", "--yes");

        assertEquals(1, result.exitCode());
    }

    @Test
    void testInteractiveDecline() throws IOException {
        Files.writeString(tempDir.resolve("a.py"), "value = 1\n");

        CliResult result = run("n\n", true, "replace", "value", "amount", "--in", "*.py");

        assertEquals(1, result.exitCode());
        assertTrue(result.out().contains("Proceed with these changes?"));
        assertEquals("value = 1\n", Files.readString(tempDir.resolve("a.py")));
    }

    @Test
    void testJsonOutputOnStdout() throws IOException {
        Files.writeString(tempDir.resolve("a.py"), "value = 1\n");

        CliResult result = run("replace", "value", "amount", "--in", "*.py", "--json", "--no-check-compile");

        assertEquals(0, result.exitCode(), result.err());
        JsonNode json = new ObjectMapper().readTree(result.out());
        assertTrue(json.path("success").asBoolean());
        assertEquals(1, json.path("processed").asInt());
        assertEquals("amount = 1\n", Files.readString(tempDir.resolve("a.py")));
    }

    @Test
    void testInvalidOptionValues() {
        assertEquals(1, run("replace", "a", "b", "--in", "*.py", "--symbol-type", "module").exitCode());
        assertEquals(1, run("replace", "a", "b", "--in", "*.py", "--max-retries", "-1").exitCode());
        assertEquals(1, run("replace", "a", "b", "--in", "*.py", "--workers", "0").exitCode());
    }

    @Test
    void testCommonOptionsOverrideEnvironment() {
        CommonOptions options = new CommonOptions();
        options.maxRetries = 7;
        options.retryDelay = 0.5;
        options.workers = 3;
        options.noCheckCompile = true;
        options.verbose = true;

        EngineConfig config = options.toConfig(Map.of("REFACTOR_MAX_RETRIES", "2", "REFACTOR_WORKERS", "8"));

        assertEquals(7, config.writePolicy().maxRetries());
        assertEquals(500, config.writePolicy().retryDelay().toMillis());
        assertEquals(3, config.workers());
        assertFalse(config.checkCompile());
        assertEquals("DEBUG", config.logLevel());
    }
}
