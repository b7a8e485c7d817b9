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
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Атомарное перемещение/переименование файла с повторами на время блокировки.
 * В отличие от {@link AtomicFileWriter} никогда не перезаписывает существующую цель.
 * <p>
 * На POSIX rename(2) молча заменяет цель, появившуюся после проверки, поэтому файл
 * перемещается через жесткую ссылку: link(2) отказывает с EEXIST, затем удаляется старое имя.
 * На Windows перемещение без REPLACE_EXISTING само отказывает при занятом имени.
 */
public final class AtomicMover {

    private static final Logger log = LoggerFactory.getLogger(AtomicMover.class);

    private final RetryPolicy policy;
    private final RetryExecutor retry;
    private final Platform platform;
    private final FileOps ops;

    public AtomicMover(EngineConfig config) {
        this(config.writePolicy(), new LockClassifier(config.platform()), FileOps.NIO);
    }

    public AtomicMover(RetryPolicy policy, LockClassifier classifier, FileOps ops) {
        this.policy = policy;
        this.retry = new RetryExecutor(classifier);
        this.platform = classifier.platform();
        this.ops = ops;
    }

    /**
     * Перемещает {@code src} в {@code dst} одним вызовом rename.
     *
     * @return число потребовавшихся попыток
     * @throws FileOperationException источник не существует, цель уже существует,
     *                                либо перемещение не удалось за все попытки
     */
    public int move(Path src, Path dst) {
        Path source = src.toAbsolutePath().normalize();
        Path target = dst.toAbsolutePath().normalize();

        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileOperationException(ErrorCode.SOURCE_NOT_FOUND, source,
                    "Source file " + source + " does not exist");
        }
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileOperationException(ErrorCode.DESTINATION_EXISTS, target,
                    "Destination file " + target + " already exists");
        }
        try {
            FileUtils.ensureParentExists(target);
        } catch (IOException e) {
            throw new FileOperationException(ErrorCode.MOVE_FAILED, target,
                    "Cannot create parent directory for " + target + ": " + e.getMessage(),
                    0, OsError.from(e, target.getParent()), e);
        }

        try {
            int attempts = retry.execute("move", policy, List.of(source, target), attempt -> {
                moveOnce(source, target);
                return attempt;
            });
            log.debug("Successfully moved {} to {} after {} attempt(s)", source, target, attempts);
            return attempts;
        } catch (RetryFailedException e) {
            if (e.isLocked()) {
                throw new FileOperationException(ErrorCode.FILE_LOCKED, source,
                        "File move failed due to file locking after " + e.getAttempts() + " attempts",
                        e.getAttempts(), e.getOsError(), e.getCause());
            }
            ErrorCode code = OsError.EEXIST.equals(e.getOsError().code())
                    ? ErrorCode.DESTINATION_EXISTS : ErrorCode.MOVE_FAILED;
            throw new FileOperationException(code, source,
                    "File move failed after " + e.getAttempts() + " attempt(s): " + e.getMessage(),
                    e.getAttempts(), e.getOsError(), e.getCause());
        }
    }

    private void moveOnce(Path source, Path target) throws IOException {
        if (platform != Platform.POSIX || Files.isDirectory(source, LinkOption.NOFOLLOW_LINKS)) {
            ops.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            return;
        }
        try {
            ops.link(target, source);
        } catch (UnsupportedOperationException e) {
            log.debug("Hard links unsupported, falling back to rename for {}", source);
            ops.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            return;
        } catch (FileSystemException e) {
            if (!linksUnsupported(e)) {
                throw e;
            }
            log.debug("Hard link refused for {} ({}), falling back to rename", source, e.getReason());
            ops.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            return;
        }
        try {
            ops.delete(source);
        } catch (IOException e) {
            // Второе имя снимаем, чтобы не оставить файл под обоими именами
            FileUtils.deleteQuietly(target);
            throw e;
        }
    }

    /**
     * EPERM/ENOTSUP от link(2): ФС без жестких ссылок (FAT, часть сетевых ФС).
     */
    private static boolean linksUnsupported(FileSystemException e) {
        if (e instanceof FileAlreadyExistsException) {
            return false;
        }
        String reason = e.getReason() == null ? "" : e.getReason().toLowerCase(Locale.ROOT);
        return reason.contains("operation not permitted") || reason.contains("not supported");
    }
}
