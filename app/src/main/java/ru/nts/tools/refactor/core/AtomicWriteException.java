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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Запись не могла быть завершена надежно.
 * Покрывает как немедленные ошибки записи временного файла, так и
 * неблокировочные (FATAL) ошибки на шаге атомарной подмены.
 * Исходный файл при этом остается нетронутым.
 */
public class AtomicWriteException extends RefactorException {

    private final int attempts;
    private final OsError osError;

    public AtomicWriteException(ErrorCode code, Path path, String message, int attempts,
                                OsError osError, Throwable cause) {
        super(code, message, context(path, attempts, osError), cause);
        this.attempts = attempts;
        this.osError = osError;
    }

    public int getAttempts() {
        return attempts;
    }

    public OsError getOsError() {
        return osError;
    }

    public ErrorInfo info() {
        return new ErrorInfo(getMessage(), attempts, osError != null ? osError.code() : null);
    }

    static Map<String, Object> context(Path path, int attempts, OsError osError) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (path != null) {
            ctx.put("path", path.toString());
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                ctx.put("dir", parent.toString());
            }
        }
        ctx.put("attempts", attempts);
        if (osError != null) {
            ctx.put("os", osError.code());
        }
        return ctx;
    }
}
