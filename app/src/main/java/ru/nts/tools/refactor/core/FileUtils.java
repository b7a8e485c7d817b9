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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Утилиты для безопасной работы с файловой системой.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Чтение всех байтов файла с повторами на время блокировки.
     *
     * @throws FileOperationException если файл так и не удалось прочитать
     */
    public static byte[] safeReadAllBytes(Path path, RetryExecutor retry, RetryPolicy policy) {
        try {
            return retry.execute("read", policy, List.of(path), attempt -> Files.readAllBytes(path));
        } catch (RetryFailedException e) {
            ErrorCode code = e.isLocked() ? ErrorCode.FILE_LOCKED : ErrorCode.FILE_READ_FAILED;
            throw new FileOperationException(code, path,
                    "Failed to read " + path + " after " + e.getAttempts() + " attempt(s): " + e.getMessage(),
                    e.getAttempts(), e.getOsError(), e.getCause());
        }
    }

    /**
     * Удаляет файл, если он есть. Ошибка удаления только логируется:
     * вызывается на путях отката, где исходная ошибка важнее.
     */
    public static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Cannot remove {}: {}", path, e.getMessage());
        }
    }

    /**
     * fsync директории, чтобы сам факт переименования пережил сбой питания.
     * На платформах, где директорию нельзя открыть как канал, ничего не делает.
     */
    public static void syncDirectory(Path dir, Platform platform) {
        if (dir == null || platform == Platform.WINDOWS) {
            return;
        }
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Directory sync skipped for {}: {}", dir, e.getMessage());
        }
    }
}
