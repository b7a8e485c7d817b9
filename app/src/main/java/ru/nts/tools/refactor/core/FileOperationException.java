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

import java.nio.file.Path;

/**
 * Ошибка высокоуровневой файловой операции: перемещение, чтение, либо запись,
 * не удавшаяся именно из-за устойчивой блокировки файла.
 * Несет число попыток и первопричину для диагностики.
 */
public class FileOperationException extends RefactorException {

    private final int attempts;
    private final OsError osError;

    public FileOperationException(ErrorCode code, Path path, String message) {
        this(code, path, message, 0, null, null);
    }

    public FileOperationException(ErrorCode code, Path path, String message, int attempts,
                                  OsError osError, Throwable cause) {
        super(code, message, AtomicWriteException.context(path, attempts, osError), cause);
        this.attempts = attempts;
        this.osError = osError;
    }

    public int getAttempts() {
        return attempts;
    }

    public OsError getOsError() {
        return osError;
    }

    /**
     * True если ошибка вызвана исчерпанием попыток на заблокированном файле.
     */
    public boolean isLockContention() {
        return getCode() == ErrorCode.FILE_LOCKED;
    }

    public ErrorInfo info() {
        return new ErrorInfo(getMessage(), attempts, osError != null ? osError.code() : null);
    }
}
