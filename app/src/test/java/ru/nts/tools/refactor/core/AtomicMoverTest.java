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
package ru.nts.tools.refactor.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты атомарного перемещения без перезаписи цели.
 */
class AtomicMoverTest {

    @TempDir
    Path tempDir;

    private final AtomicMover mover = new AtomicMover(new RetryPolicy(2, Duration.ZERO),
            new LockClassifier(Platform.POSIX), FileOps.NIO);

    @Test
    void testMoveIntoNewDirectory() throws IOException {
        Path src = tempDir.resolve("Old.java");
        Files.writeString(src, "class Old {}");
        Path dst = tempDir.resolve("pkg/New.java");

        assertEquals(1, mover.move(src, dst));
        assertFalse(Files.exists(src));
        assertEquals("class Old {}", Files.readString(dst));
    }

    @Test
    void testExistingDestinationIsNeverOverwritten() throws IOException {
        Path src = tempDir.resolve("a.txt");
        Path dst = tempDir.resolve("b.txt");
        Files.writeString(src, "source");
        Files.writeString(dst, "destination");

        FileOperationException e = assertThrows(FileOperationException.class, () -> mover.move(src, dst));

        assertEquals(ErrorCode.DESTINATION_EXISTS, e.getCode());
        assertEquals("source", Files.readString(src), "Источник должен остаться на месте");
        assertEquals("destination", Files.readString(dst), "Цель не должна быть перезаписана");
    }

    @Test
    void testMissingSource() {
        FileOperationException e = assertThrows(FileOperationException.class,
                () -> mover.move(tempDir.resolve("nope.txt"), tempDir.resolve("b.txt")));
        assertEquals(ErrorCode.SOURCE_NOT_FOUND, e.getCode());
        assertEquals(0, e.getAttempts());
    }

    @Test
    void testLockedMoveIsRetried() throws IOException {
        Path src = tempDir.resolve("a.txt");
        Files.writeString(src, "data");
        Path dst = tempDir.resolve("b.txt");
        AtomicInteger calls = new AtomicInteger();
        FileOps locked = new FileOps() {
            @Override
            public void move(Path source, Path target, CopyOption... options) throws IOException {
                Files.move(source, target, options);
            }

            @Override
            public void link(Path link, Path existing) throws IOException {
                calls.incrementAndGet();
                throw new FileSystemException(existing.toString(), link.toString(), "Text file busy");
            }
        };

        FileOperationException e = assertThrows(FileOperationException.class,
                () -> new AtomicMover(new RetryPolicy(2, Duration.ZERO), new LockClassifier(Platform.POSIX), locked)
                        .move(src, dst));

        assertEquals(ErrorCode.FILE_LOCKED, e.getCode());
        assertTrue(e.isLockContention());
        assertEquals(3, e.getAttempts());
        assertEquals(3, calls.get());
        assertTrue(Files.exists(src));
        assertFalse(Files.exists(dst));
    }

    @Test
    void testDestinationCreatedAfterCheckIsNotOverwritten() throws IOException {
        Path src = tempDir.resolve("a.txt");
        Files.writeString(src, "source");
        Path dst = tempDir.resolve("b.txt");
        // Редактор сохраняет файл под целевым именем между проверкой и переименованием
        FileOps editorSaves = new FileOps() {
            @Override
            public void move(Path source, Path target, CopyOption... options) throws IOException {
                Files.writeString(target, "saved by editor");
                Files.move(source, target, options);
            }

            @Override
            public void link(Path link, Path existing) throws IOException {
                Files.writeString(link, "saved by editor");
                Files.createLink(link, existing);
            }
        };

        FileOperationException e = assertThrows(FileOperationException.class,
                () -> new AtomicMover(new RetryPolicy(2, Duration.ZERO), new LockClassifier(Platform.POSIX), editorSaves)
                        .move(src, dst));

        assertEquals(ErrorCode.DESTINATION_EXISTS, e.getCode());
        assertEquals(1, e.getAttempts());
        assertEquals("saved by editor", Files.readString(dst), "Сохраненный редактором файл не должен пропасть");
        assertEquals("source", Files.readString(src), "Источник должен остаться на месте");
    }

    @Test
    void testFailedUnlinkOfSourceRollsBackLink() throws IOException {
        Path src = tempDir.resolve("a.txt");
        Files.writeString(src, "data");
        Path dst = tempDir.resolve("b.txt");
        FileOps undeletable = new FileOps() {
            @Override
            public void move(Path source, Path target, CopyOption... options) throws IOException {
                Files.move(source, target, options);
            }

            @Override
            public void delete(Path path) throws IOException {
                throw new FileSystemException(path.toString(), null, "Input/output error");
            }
        };

        FileOperationException e = assertThrows(FileOperationException.class,
                () -> new AtomicMover(new RetryPolicy(2, Duration.ZERO), new LockClassifier(Platform.POSIX), undeletable)
                        .move(src, dst));

        assertEquals(ErrorCode.MOVE_FAILED, e.getCode());
        assertEquals("data", Files.readString(src));
        assertFalse(Files.exists(dst), "Файл не должен остаться под двумя именами");
    }
}
