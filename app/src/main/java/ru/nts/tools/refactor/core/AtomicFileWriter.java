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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * Атомарная перезапись файла через временный файл (Safe Swap).
 * <p>
 * Алгоритм одной попытки:
 * <ol>
 *   <li>временный файл создается в той же директории, что и цель (rename не пересекает файловые системы);</li>
 *   <li>контент пишется целиком и сбрасывается на диск ({@code force(true)}) до закрытия;</li>
 *   <li>временный файл одним вызовом rename подменяет цель;</li>
 *   <li>права, снятые с цели до первой попытки, возвращаются на новый inode.</li>
 * </ol>
 * Читатель цели в любой момент видит либо старый, либо новый контент целиком,
 * в том числе если процесс убит между созданием временного файла и подменой.
 * Каждая повторная попытка создает новый временный файл.
 * <p>
 * Если ФС не умеет атомарно заменять существующий файл, исходник сначала отодвигается
 * в соседнюю резервную копию и возвращается на место при неудачной подмене.
 */
public final class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    private final RetryPolicy policy;
    private final RetryExecutor retry;
    private final Platform platform;
    private final FileOps ops;

    public AtomicFileWriter(EngineConfig config) {
        this(config.writePolicy(), new LockClassifier(config.platform()), FileOps.NIO);
    }

    public AtomicFileWriter(RetryPolicy policy, LockClassifier classifier, FileOps ops) {
        this.policy = policy;
        this.retry = new RetryExecutor(classifier);
        this.platform = classifier.platform();
        this.ops = ops;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Кодирует текст в указанной кодировке и атомарно записывает его.
     * Непредставимые в кодировке символы дают ошибку, а не тихую замену на '?'.
     *
     * @return число потребовавшихся попыток
     */
    public int write(Path path, String content, Charset charset) {
        return write(path, content, charset, null);
    }

    /**
     * Записывает новый текст в кодировке и с BOM исходного файла.
     *
     * @return число потребовавшихся попыток
     */
    public int write(Path path, String content, EncodingUtils.TextFileContent original) {
        return write(path, content, original.charset(), original.bom());
    }

    private int write(Path path, String content, Charset charset, byte[] bom) {
        byte[] bytes;
        try {
            bytes = EncodingUtils.encode(content, charset, bom);
        } catch (CharacterCodingException e) {
            throw new AtomicWriteException(ErrorCode.ENCODING_ERROR, path,
                    "Cannot write " + path + " in " + charset.name()
                            + " encoding: content contains unmappable characters", 0, null, e);
        }
        return write(path, bytes);
    }

    /**
     * Атомарно заменяет содержимое файла (или создает его).
     *
     * @return число потребовавшихся попыток
     * @throws AtomicWriteException   запись не удалась (ошибка временного файла или фатальная ошибка подмены)
     * @throws FileOperationException цель оставалась заблокированной все попытки
     */
    public int write(Path path, byte[] content) {
        Path target = path.toAbsolutePath().normalize();
        try {
            FileUtils.ensureParentExists(target);
        } catch (IOException e) {
            throw new AtomicWriteException(ErrorCode.TEMP_WRITE_FAILED, target,
                    "Cannot create parent directory for " + target + ": " + e.getMessage(), 0, null, e);
        }

        FileState state = FileState.capture(target);
        try {
            int attempts = retry.execute("write", policy, List.of(target), attempt -> {
                swapOnce(target, content, state, attempt);
                return attempt;
            });
            log.debug("Successfully wrote {} after {} attempt(s)", target, attempts);
            return attempts;
        } catch (RetryFailedException e) {
            if (e.isLocked()) {
                throw new FileOperationException(ErrorCode.FILE_LOCKED, target,
                        "File " + target + " is locked and cannot be written after " + e.getAttempts() + " attempts",
                        e.getAttempts(), e.getOsError(), e.getCause());
            }
            ErrorCode code = OsError.EACCES.equals(e.getOsError().code()) && !e.getOsError().subjectWritable()
                    ? ErrorCode.FILE_READ_ONLY : ErrorCode.ATOMIC_WRITE_FAILED;
            throw new AtomicWriteException(code, target,
                    "Failed to atomically write " + target + " after " + e.getAttempts() + " attempt(s): "
                            + e.getMessage(), e.getAttempts(), e.getOsError(), e.getCause());
        }
    }

    private void swapOnce(Path target, byte[] content, FileState state, int attempt) throws IOException {
        if (state.readOnly()) {
            throw new AccessDeniedException(target.toString(), null, "target file is read-only");
        }
        Path temp = writeTemp(target, content, attempt);
        boolean swapped = false;
        try {
            try {
                ops.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                    throw e;
                }
                log.debug("Atomic replace not supported for {}, swapping through a backup", target);
                swapThroughBackup(temp, target);
            }
            swapped = true;
            restorePermissions(target, state);
            FileUtils.syncDirectory(target.getParent(), platform);
        } finally {
            if (!swapped) {
                FileUtils.deleteQuietly(temp);
            }
        }
    }

    /**
     * Подмена без замены поверх: цель отодвигается в резервную копию, на ее место встает
     * временный файл. Если второй шаг не удался, резервная копия возвращается под исходное имя.
     */
    private void swapThroughBackup(Path temp, Path target) throws IOException {
        Path backup = target.resolveSibling("." + target.getFileName() + "." + System.nanoTime() + ".bak");
        ops.move(target, backup, StandardCopyOption.ATOMIC_MOVE);
        try {
            ops.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                ops.move(backup, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException restoreError) {
                log.error("Cannot restore {} from backup {}: {}", target, backup, restoreError.getMessage());
                e.addSuppressed(restoreError);
            }
            throw e;
        }
        FileUtils.deleteQuietly(backup);
    }

    /**
     * Создает уникальный временный файл рядом с целью и надежно записывает в него контент.
     * Ошибка создания файла передается наружу как IOException (ее классифицирует цикл повторов),
     * ошибка записи в уже созданный файл не повторяется.
     */
    private Path writeTemp(Path target, byte[] content, int attempt) throws IOException {
        Path dir = target.getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            FileUtils.deleteQuietly(temp);
            throw new AtomicWriteException(ErrorCode.TEMP_WRITE_FAILED, target,
                    "Failed to write to temporary file " + temp.getFileName() + ": " + e.getMessage(),
                    attempt, OsError.from(e, temp), e);
        }
        return temp;
    }

    private void restorePermissions(Path target, FileState state) {
        try {
            state.applyTo(target);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Cannot restore permissions of {}: {}", target, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "AtomicFileWriter" + Map.of("policy", policy, "platform", platform);
    }
}
