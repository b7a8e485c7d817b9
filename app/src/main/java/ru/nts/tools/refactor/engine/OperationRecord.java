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

import java.nio.file.Path;
import java.time.Instant;

/**
 * Запись журнала операций.
 *
 * @param kind      вид записи
 * @param subject   файл, к которому относится запись
 * @param detail    человекочитаемое описание
 * @param timestamp момент записи
 */
public record OperationRecord(RecordKind kind, Path subject, String detail, Instant timestamp) {

    @Override
    public String toString() {
        return kind.label() + ": " + detail;
    }
}
