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

import java.util.EnumSet;
import java.util.Set;

/**
 * Вид записи журнала операций.
 */
public enum RecordKind {
    RENAMED("RENAMED"),
    CONTENT_UPDATED("CONTENT UPDATED"),
    COMPILE_CHECK("COMPILE CHECK"),
    WRITE_ERROR("WRITE ERROR"),
    RENAME_ERROR("RENAME ERROR"),
    NO_CHANGES("NO CHANGES"),
    WOULD_RENAME("WOULD RENAME"),
    WOULD_REPLACE("WOULD REPLACE"),
    REPLACED("REPLACED");

    private static final Set<RecordKind> ACTIONABLE = EnumSet.of(
            RENAMED, CONTENT_UPDATED, REPLACED, WOULD_RENAME, WOULD_REPLACE);

    private static final Set<RecordKind> ERRORS = EnumSet.of(WRITE_ERROR, RENAME_ERROR);

    private final String label;

    RecordKind(String label) {
        this.label = label;
    }

    /**
     * Подпись для человекочитаемого вывода.
     */
    public String label() {
        return label;
    }

    /**
     * Запись описывает изменение файла (выполненное или планируемое).
     */
    public boolean isActionable() {
        return ACTIONABLE.contains(this);
    }

    public boolean isError() {
        return ERRORS.contains(this);
    }
}
