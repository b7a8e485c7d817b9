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

import java.util.Optional;

/**
 * Диагностика неудачной файловой операции.
 * Достаточна, чтобы вызывающий код решил, повторять ли операцию на своем уровне.
 *
 * @param message     Человекочитаемое описание ошибки.
 * @param attempts    Сколько попыток было сделано (0, если операция не начиналась).
 * @param osErrorCode Символьный код ошибки ОС (EBUSY, ERROR_SHARING_VIOLATION, ...) или null.
 */
public record ErrorInfo(String message, int attempts, String osErrorCode) {

    public static ErrorInfo of(String message) {
        return new ErrorInfo(message, 0, null);
    }

    public static ErrorInfo of(RefactorException e) {
        if (e instanceof FileOperationException foe) {
            return foe.info();
        }
        if (e instanceof AtomicWriteException awe) {
            return awe.info();
        }
        return new ErrorInfo(e.getMessage(), 0, null);
    }

    public Optional<String> cause() {
        return Optional.ofNullable(osErrorCode);
    }
}
