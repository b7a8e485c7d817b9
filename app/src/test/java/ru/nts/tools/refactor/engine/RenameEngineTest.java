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
package ru.nts.tools.refactor.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.refactor.core.EngineConfig;
import ru.nts.tools.refactor.rewrite.Backend;
import ru.nts.tools.refactor.rewrite.SymbolKind;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Тесты операций над одним файлом.
 */
class RenameEngineTest {

    @TempDir
    Path tempDir;

    private final RenameEngine engine = new RenameEngine(EngineConfig.builder()
            .retryDelay(Duration.ZERO)
            .checkCompile(false)
            .build());

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testUpdateContentRenamesClass() throws IOException {
        Path file = write("Foo.java", "public class Foo {\n  Foo() {}\n  // Foo\n}\n");
        OperationLog log = new OperationLog();

        RenameResult result = engine.updateContent(file, "Foo", "Bar", false, log);

        assertTrue(result.success());
        assertEquals(2, result.changesApplied());
        assertEquals(Backend.AST, result.backendUsed());
        assertEquals("public class Bar {\n  Bar() {}\n  // Foo\n}\n", Files.readString(file));
        assertEquals(1, log.count(RecordKind.CONTENT_UPDATED));
        assertEquals("Foo.java (2 changes, AST)", log.records().get(0).detail());
    }

    @Test
    void testUpdateContentOfUnknownFileTypeIsLiteral() throws IOException {
        Path file = write("settings.cfg", "price priceinticks");
        OperationLog log = new OperationLog();

        RenameResult result = engine.updateContent(file, "price", "priceinticks", false, log);

        assertEquals(Backend.PLAIN_TEXT, result.backendUsed());
        assertEquals("priceinticks priceinticksinticks", Files.readString(file));
    }

    @Test
    void testNoChangesIsRecorded() throws IOException {
        Path file = write("Foo.java", "class Other {}\n");
        OperationLog log = new OperationLog();

        RenameResult result = engine.updateContent(file, "Foo", "Bar", false, log);

        assertTrue(result.success());
        assertFalse(result.affected());
        assertEquals(1, log.count(RecordKind.NO_CHANGES));
        assertFalse(log.hasActionable());
    }

    @Test
    void testDryRunTouchesNothing() throws IOException {
        Path file = write("Foo.java", "public class Foo {}\n");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        if (posix) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r-----"));
        }
        FileTime mtime = Files.getLastModifiedTime(file);
        OperationLog log = new OperationLog();

        RenameResult result = engine.renameFile(file, "Bar", true, true, log);

        assertTrue(result.success());
        assertEquals(tempDir.resolve("Bar.java"), result.newPath());
        assertEquals(1, log.count(RecordKind.CONTENT_UPDATED));
        assertEquals(1, log.count(RecordKind.WOULD_RENAME));
        assertEquals("public class Foo {}\n", Files.readString(file), "Содержимое не должно меняться");
        assertEquals(mtime, Files.getLastModifiedTime(file), "Время изменения не должно меняться");
        if (posix) {
            assertEquals(PosixFilePermissions.fromString("rw-r-----"), Files.getPosixFilePermissions(file));
        }
        assertFalse(Files.exists(tempDir.resolve("Bar.java")));
    }

    @Test
    void testRenameFileMovesAndUpdates() throws IOException {
        Path file = write("Foo.java", "public class Foo {}\n");
        OperationLog log = new OperationLog();

        RenameResult result = engine.renameFile(file, "Bar", true, false, log);

        Path target = tempDir.resolve("Bar.java");
        assertTrue(result.success());
        assertEquals(target, result.finalPath());
        assertFalse(Files.exists(file));
        assertEquals("public class Bar {}\n", Files.readString(target));
        assertEquals(1, log.count(RecordKind.RENAMED));
        assertEquals(target, log.records().get(log.size() - 1).subject());
    }

    @Test
    void testRenameWithoutContent() throws IOException {
        Path file = write("Foo.java", "public class Foo {}\n");
        OperationLog log = new OperationLog();

        engine.renameFile(file, "Bar", false, false, log);

        assertEquals("public class Foo {}\n", Files.readString(tempDir.resolve("Bar.java")));
        assertEquals(0, log.count(RecordKind.CONTENT_UPDATED));
    }

    @Test
    void testRenameOntoExistingFileFails() throws IOException {
        Path file = write("Foo.java", "class Foo {}\n");
        write("Bar.java", "class Bar {}\n");
        OperationLog log = new OperationLog();

        RenameResult result = engine.renameFile(file, "Bar", true, false, log);

        assertFalse(result.success());
        assertTrue(result.errorInfo().orElseThrow().message().contains("already exists"));
        assertEquals(1, log.count(RecordKind.RENAME_ERROR));
        assertEquals("class Foo {}\n", Files.readString(file));
        assertEquals("class Bar {}\n", Files.readString(tempDir.resolve("Bar.java")));
    }

    @Test
    void testRenameMissingFile() {
        OperationLog log = new OperationLog();

        RenameResult result = engine.renameFile(tempDir.resolve("Nope.java"), "Bar", true, false, log);

        assertFalse(result.success());
        assertEquals(1, log.count(RecordKind.RENAME_ERROR));
    }

    @Test
    void testUnreadableContentSkipsMove() throws IOException {
        Path file = tempDir.resolve("Foo.dat");
        Files.write(file, new byte[]{'F', 'o', 'o', 0, 0, 1});
        OperationLog log = new OperationLog();

        RenameResult result = engine.renameFile(file, "Bar", true, false, log);

        assertFalse(result.success());
        assertEquals(1, log.count(RecordKind.WRITE_ERROR));
        assertTrue(Files.exists(file), "Файл не переименовывается, если содержимое не обновлено");
        assertFalse(Files.exists(tempDir.resolve("Bar.dat")));
    }

    @Test
    void testReadOnlyFileIsWriteError() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path file = write("a.py", "value = 1\nprint(value)\n");
        Files.setPosixFilePermissions(file, Set.of(PosixFilePermission.OWNER_READ));
        OperationLog log = new OperationLog();

        RenameResult result = engine.replaceSymbol(file, "value", "amount", SymbolKind.AUTO, false, log);

        assertFalse(result.success());
        assertEquals(1, log.count(RecordKind.WRITE_ERROR));
        assertEquals(1, result.errorInfo().orElseThrow().attempts());
        assertEquals("value = 1\nprint(value)\n", Files.readString(file));
    }

    @Test
    void testReplaceSymbol() throws IOException {
        Path file = write("a.py", "value = 1  # value\nprint(value, 'value')\n");
        OperationLog preview = new OperationLog();

        RenameResult planned = engine.replaceSymbol(file, "value", "amount", SymbolKind.VARIABLE, true, preview);
        assertEquals(1, preview.count(RecordKind.WOULD_REPLACE));
        assertEquals(2, planned.changesApplied());
        assertEquals("value = 1  # value\nprint(value, 'value')\n", Files.readString(file));

        OperationLog log = new OperationLog();
        engine.replaceSymbol(file, "value", "amount", SymbolKind.VARIABLE, false, log);
        assertEquals("amount = 1  # value\nprint(amount, 'value')\n", Files.readString(file));
        assertEquals(1, log.count(RecordKind.REPLACED));
    }

    @Test
    void testReplaceWithoutMatchesRecordsNothing() throws IOException {
        Path file = write("a.py", "x = 1\n");
        OperationLog log = new OperationLog();

        RenameResult result = engine.replaceSymbol(file, "value", "amount", SymbolKind.AUTO, false, log);

        assertTrue(result.success());
        assertEquals(0, result.changesApplied());
        assertTrue(log.isEmpty());
    }

    @Test
    void testCompileCheckIsRecordedWhenEnabled() throws IOException {
        RenameEngine checking = new RenameEngine(EngineConfig.builder().retryDelay(Duration.ZERO).build());
        Path file = write("b.py", "count = 1\n");
        OperationLog log = new OperationLog();

        checking.replaceSymbol(file, "count", "total", SymbolKind.AUTO, false, log);

        assertEquals(1, log.count(RecordKind.COMPILE_CHECK));
        assertEquals("b.py - ✓ Compiles", log.records().get(0).detail());
    }
}
