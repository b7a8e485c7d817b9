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
package ru.nts.tools.refactor.orchestrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine.Help.Ansi;
import ru.nts.tools.refactor.core.EngineConfig;
import ru.nts.tools.refactor.engine.FileSetResolver;
import ru.nts.tools.refactor.engine.OperationRecord;
import ru.nts.tools.refactor.engine.RecordKind;
import ru.nts.tools.refactor.engine.RenameEngine;
import ru.nts.tools.refactor.engine.RenameResult;
import ru.nts.tools.refactor.rewrite.SymbolKind;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Тесты двухфазного запуска: предпросмотр, подтверждение, исполнение, отчет.
 */
class RefactorOrchestratorTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private RenameEngine engine;
    private ReportWriter writer;
    private FileSetResolver resolver;

    @BeforeEach
    void setUp() {
        engine = new RenameEngine(EngineConfig.builder()
                .retryDelay(Duration.ZERO)
                .checkCompile(false)
                .build());
        PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8);
        writer = new ReportWriter(stream, stream, false, true, Ansi.OFF);
        resolver = new FileSetResolver(tempDir);
    }

    private List<Path> createFiles(int count, String content) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            Path file = tempDir.resolve("f" + i + ".py");
            Files.writeString(file, content);
            files.add(file);
        }
        return files;
    }

    private SymbolReplaceOperation replace(String oldName, String newName) {
        return new SymbolReplaceOperation(oldName, newName, "*.py", SymbolKind.AUTO, resolver);
    }

    private static ConfirmationPrompt failIfAsked() {
        return question -> {
            fail("Подтверждение не должно запрашиваться");
            return false;
        };
    }

    @Test
    void testBatchWithReadOnlyFileContinues() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        List<Path> files = createFiles(5, "value = 1\nprint(value)\n");
        Files.setPosixFilePermissions(files.get(2), PosixFilePermissions.fromString("r--r--r--"));

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysYes(), writer)
                .run(replace("value", "amount"), false);

        assertEquals(1, outcome.exitCode(), "Ошибка одного файла делает код выхода ненулевым");
        assertEquals(Phase.DONE, outcome.phase());
        List<RenameResult> results = outcome.report().results();
        assertEquals(5, results.size());
        assertEquals(4, results.stream().filter(RenameResult::success).count());
        assertFalse(results.get(2).success());
        assertEquals(1L, outcome.report().summary().get(RecordKind.WRITE_ERROR));
        for (int i : new int[]{0, 1, 3, 4}) {
            assertEquals("amount = 1\nprint(amount)\n", Files.readString(files.get(i)));
        }
        assertEquals("value = 1\nprint(value)\n", Files.readString(files.get(2)));
        assertEquals(4, outcome.report().processed());
        assertFalse(outcome.report().success());
    }

    @Test
    void testExecutionUsesFreshLog() throws IOException {
        createFiles(2, "value = 1\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysYes(), writer)
                .run(replace("value", "amount"), false);

        assertEquals(0, outcome.exitCode());
        assertEquals(List.of(Phase.ANALYZING, Phase.PREVIEWING, Phase.CONFIRMING, Phase.EXECUTING,
                Phase.REPORTING, Phase.DONE), outcome.phases());
        List<RecordKind> kinds = outcome.report().operations().stream().map(OperationRecord::kind).toList();
        assertEquals(List.of(RecordKind.REPLACED, RecordKind.REPLACED), kinds,
                "Записи предпросмотра не попадают в итоговый отчет");
        assertFalse(outcome.report().dryRun());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("WOULD REPLACE"), "Предпросмотр показан пользователю");
    }

    @Test
    void testUserAbort() throws IOException {
        List<Path> files = createFiles(1, "value = 1\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysNo(), writer)
                .run(replace("value", "amount"), false);

        assertEquals(Phase.ABORTED, outcome.phase());
        assertEquals(1, outcome.exitCode());
        assertFalse(outcome.executed());
        assertEquals("value = 1\n", Files.readString(files.get(0)));
    }

    @Test
    void testNothingToDo() throws IOException {
        createFiles(2, "x = 1\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, failIfAsked(), writer)
                .run(replace("value", "amount"), false);

        assertEquals(Phase.DONE, outcome.phase());
        assertEquals(0, outcome.exitCode());
        assertFalse(outcome.phases().contains(Phase.CONFIRMING));
    }

    @Test
    void testNoFilesMatched() {
        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, failIfAsked(), writer)
                .run(new SymbolReplaceOperation("a", "b", "**/*.rs", SymbolKind.AUTO, resolver), false);

        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.report().results().isEmpty());
    }

    @Test
    void testDryRunOnlyPreviews() throws IOException {
        List<Path> files = createFiles(2, "value = 1\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, failIfAsked(), writer)
                .run(replace("value", "amount"), true);

        assertEquals(0, outcome.exitCode());
        assertTrue(outcome.report().dryRun());
        assertEquals(2, outcome.report().processed());
        assertFalse(outcome.executed());
        assertEquals("value = 1\n", Files.readString(files.get(0)));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("DRY RUN MODE"));
    }

    @Test
    void testValidationFailureAborts() {
        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, failIfAsked(), writer)
                .run(new BatchRenameOperation("a", "b", tempDir.resolve("missing"), "*", false, resolver), false);

        assertEquals(Phase.ABORTED, outcome.phase());
        assertEquals(1, outcome.exitCode());
        assertEquals(List.of(Phase.ANALYZING, Phase.ABORTED), outcome.phases());
    }

    @Test
    void testRenameWithRelatedFiles() throws IOException {
        Path main = tempDir.resolve("User.java");
        Files.writeString(main, "public class User {}\n");
        Files.createDirectories(tempDir.resolve("test"));
        Files.writeString(tempDir.resolve("test/UserTest.java"), "class UserTest { User user; }\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysYes(), writer)
                .run(new RenameFileOperation(main, "Account", RenameFileOperation.Mode.FULL, true), false);

        assertEquals(0, outcome.exitCode());
        assertEquals("public class Account {}\n", Files.readString(tempDir.resolve("Account.java")));
        assertTrue(Files.exists(tempDir.resolve("test/AccountTest.java")));
        assertFalse(Files.exists(tempDir.resolve("test/UserTest.java")));
        assertEquals(2, outcome.report().files().size());
    }

    @Test
    void testBatchRename() throws IOException {
        Files.writeString(tempDir.resolve("OldService.java"), "class OldService {}\n");
        Files.writeString(tempDir.resolve("OldRepo.java"), "class OldRepo {}\n");
        Files.writeString(tempDir.resolve("Other.java"), "class Other {}\n");

        RefactorOrchestrator.Outcome outcome = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysYes(), writer)
                .run(new BatchRenameOperation("Old", "New", tempDir, "*.java", false, resolver), false);

        assertEquals(0, outcome.exitCode());
        assertEquals("class NewService {}\n", Files.readString(tempDir.resolve("NewService.java")));
        assertEquals("class NewRepo {}\n", Files.readString(tempDir.resolve("NewRepo.java")));
        assertTrue(Files.exists(tempDir.resolve("Other.java")));
    }

    @Test
    void testCancelledBeforeStart() throws IOException {
        List<Path> files = createFiles(3, "value = 1\n");
        RefactorOrchestrator orchestrator = new RefactorOrchestrator(engine, ConfirmationPrompt.alwaysYes(), writer);
        orchestrator.cancel();

        RefactorOrchestrator.Outcome outcome = orchestrator.run(replace("value", "amount"), false);

        assertEquals(0, outcome.exitCode());
        assertFalse(outcome.phases().contains(Phase.CONFIRMING));
        assertTrue(outcome.report().results().isEmpty());
        assertEquals("value = 1\n", Files.readString(files.get(0)));

        RefactorOrchestrator.Outcome next = orchestrator.run(replace("value", "amount"), false);

        assertEquals(0, next.exitCode());
        assertEquals(3, next.report().processed(), "Отмена не должна переживать завершенный запуск");
        assertEquals("amount = 1\n", Files.readString(files.get(0)));
    }
}
