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

import ru.nts.tools.refactor.core.ErrorInfo;
import ru.nts.tools.refactor.rewrite.Backend;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Результат обработки одного файла.
 *
 * @param path           исходный путь файла
 * @param success        обработка прошла без ошибок
 * @param newPath        новый путь после переименования (null, если файл не перемещался)
 * @param changesApplied число замен символа в содержимом
 * @param backendUsed    способ замены (null, если содержимое не переписывалось)
 * @param error          описание ошибки (null при успехе)
 */
public record RenameResult(Path path, boolean success, Path newPath, int changesApplied,
                           Backend backendUsed, ErrorInfo error) {

    public static RenameResult failure(Path path, ErrorInfo error) {
        return new RenameResult(path, false, null, 0, null, error);
    }

    public static RenameResult failure(Path path, Backend backend, ErrorInfo error) {
        return new RenameResult(path, false, null, 0, backend, error);
    }

    public static RenameResult unchanged(Path path, Backend backend) {
        return new RenameResult(path, true, null, 0, backend, null);
    }

    public RenameResult withNewPath(Path moved) {
        return new RenameResult(path, success, moved, changesApplied, backendUsed, error);
    }

    /**
     * Файл был (или в предпросмотре был бы) изменен или перемещен.
     */
    public boolean affected() {
        return success && (newPath != null || changesApplied > 0);
    }

    /**
     * Итоговый путь файла.
     */
    public Path finalPath() {
        return newPath != null ? newPath : path;
    }

    public Optional<ErrorInfo> errorInfo() {
        return Optional.ofNullable(error);
    }
}
