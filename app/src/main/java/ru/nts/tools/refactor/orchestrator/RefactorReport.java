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
package ru.nts.tools.refactor.orchestrator;

import ru.nts.tools.refactor.engine.OperationLog;
import ru.nts.tools.refactor.engine.OperationRecord;
import ru.nts.tools.refactor.engine.RecordKind;
import ru.nts.tools.refactor.engine.RenameResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Итог прохода: журнал, результаты по файлам и сводка по видам записей.
 *
 * @param dryRun     отчет построен по предпросмотру
 * @param processed  число измененных (или планируемых к изменению) файлов
 * @param success    ни один файл не завершился ошибкой
 * @param operations записи журнала
 * @param results    результаты по файлам
 * @param files      итоговые пути измененных файлов
 * @param summary    количество записей по видам
 */
public record RefactorReport(boolean dryRun, int processed, boolean success, List<OperationRecord> operations,
                             List<RenameResult> results, List<Path> files, Map<RecordKind, Long> summary) {

    public static RefactorReport of(OperationLog log, List<RenameResult> results, boolean dryRun) {
        List<Path> files = results.stream()
                .filter(RenameResult::affected)
                .map(RenameResult::finalPath)
                .toList();
        boolean success = !log.hasErrors() && results.stream().allMatch(RenameResult::success);
        return new RefactorReport(dryRun, files.size(), success, log.records(), List.copyOf(results), files,
                log.summary());
    }

    public static RefactorReport empty(boolean dryRun) {
        return of(new OperationLog(), List.of(), dryRun);
    }

    public int failures() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }
}
