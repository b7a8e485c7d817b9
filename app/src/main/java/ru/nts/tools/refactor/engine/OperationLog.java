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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Журнал операций одного прохода (предпросмотр или исполнение).
 * Потокобезопасен: в него пишут воркеры пакетной обработки.
 */
public final class OperationLog {

    private static final Logger log = LoggerFactory.getLogger(OperationLog.class);

    private final List<OperationRecord> records = new CopyOnWriteArrayList<>();

    public OperationRecord record(RecordKind kind, Path subject, String detail) {
        OperationRecord entry = new OperationRecord(kind, subject, detail, Instant.now());
        records.add(entry);
        if (kind.isError()) {
            log.error("{}: {}", kind.label(), detail);
        } else {
            log.debug("  {}: {}", kind.label(), detail);
        }
        return entry;
    }

    public List<OperationRecord> records() {
        return List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Есть ли в журнале хотя бы одно изменение файла.
     */
    public boolean hasActionable() {
        return records.stream().anyMatch(r -> r.kind().isActionable());
    }

    public boolean hasErrors() {
        return records.stream().anyMatch(r -> r.kind().isError());
    }

    public long count(RecordKind kind) {
        return records.stream().filter(r -> r.kind() == kind).count();
    }

    /**
     * Количество записей по видам, в порядке объявления видов.
     */
    public Map<RecordKind, Long> summary() {
        Map<RecordKind, Long> counts = new EnumMap<>(RecordKind.class);
        for (OperationRecord entry : records) {
            counts.merge(entry.kind(), 1L, Long::sum);
        }
        return counts;
    }
}
