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

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Снимок ошибки ОС, приведенный к символьному коду.
 * NIO не отдает errno напрямую, поэтому код восстанавливается по типу
 * исключения и тексту strerror / FormatMessage в {@link FileSystemException#getReason()}.
 *
 * @param code            Символьный код: EACCES, EBUSY, ETXTBSY, EAGAIN, ERROR_SHARING_VIOLATION, ...
 * @param number          Числовой код, если он известен (32/33 для Windows), иначе null.
 * @param subjectWritable Был ли объект операции доступен на запись в момент сбоя.
 * @param reason          Исходный текст ошибки.
 */
public record OsError(String code, Integer number, boolean subjectWritable, String reason) {

    public static final String EACCES = "EACCES";
    public static final String EBUSY = "EBUSY";
    public static final String ETXTBSY = "ETXTBSY";
    public static final String EAGAIN = "EAGAIN";
    public static final String ENOENT = "ENOENT";
    public static final String EEXIST = "EEXIST";
    public static final String ENOTEMPTY = "ENOTEMPTY";
    public static final String EXDEV = "EXDEV";
    public static final String EROFS = "EROFS";
    public static final String ENOSPC = "ENOSPC";
    public static final String SHARING_VIOLATION = "ERROR_SHARING_VIOLATION";
    public static final String LOCK_VIOLATION = "ERROR_LOCK_VIOLATION";
    public static final String UNKNOWN = "UNKNOWN";

    public static OsError of(String code, boolean subjectWritable) {
        Integer number = switch (code) {
            case SHARING_VIOLATION -> 32;
            case LOCK_VIOLATION -> 33;
            default -> null;
        };
        return new OsError(code, number, subjectWritable, code);
    }

    /**
     * Восстанавливает код ошибки по исключению NIO.
     *
     * @param e       исключение неудачной операции
     * @param subject путь, к которому относилась операция (для проверки доступности на запись)
     */
    public static OsError from(IOException e, Path subject) {
        boolean writable = subject == null || !FileState.capture(subject).readOnly();
        String reason = reasonOf(e);
        String code = classifyException(e, reason);
        Integer number = switch (code) {
            case SHARING_VIOLATION -> 32;
            case LOCK_VIOLATION -> 33;
            default -> null;
        };
        return new OsError(code, number, writable, reason);
    }

    private static String classifyException(IOException e, String reason) {
        if (e instanceof AccessDeniedException) return EACCES;
        if (e instanceof NoSuchFileException) return ENOENT;
        if (e instanceof FileAlreadyExistsException) return EEXIST;
        if (e instanceof DirectoryNotEmptyException) return ENOTEMPTY;
        if (e instanceof AtomicMoveNotSupportedException) return EXDEV;

        String r = reason.toLowerCase(Locale.ROOT);
        if (r.contains("device or resource busy")) return EBUSY;
        if (r.contains("text file busy")) return ETXTBSY;
        if (r.contains("resource temporarily unavailable") || r.contains("would block")) return EAGAIN;
        if (r.contains("being used by another process")) return SHARING_VIOLATION;
        if (r.contains("locked a portion of the file") || r.contains("lock violation")) return LOCK_VIOLATION;
        if (r.contains("read-only file system")) return EROFS;
        if (r.contains("permission denied") || r.contains("access is denied")
                || r.contains("operation not permitted")) return EACCES;
        if (r.contains("no space left")) return ENOSPC;
        if (r.contains("cross-device") || r.contains("not same device")) return EXDEV;
        return UNKNOWN;
    }

    private static String reasonOf(IOException e) {
        if (e instanceof FileSystemException fse && fse.getReason() != null) {
            return fse.getReason();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return number != null ? code + "(" + number + ")" : code;
    }
}
