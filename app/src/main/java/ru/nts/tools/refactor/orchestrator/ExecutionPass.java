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

import ru.nts.tools.refactor.engine.BatchExecutor;
import ru.nts.tools.refactor.engine.OperationLog;
import ru.nts.tools.refactor.engine.RenameEngine;

/**
 * Один проход операции: предпросмотр или исполнение.
 *
 * @param engine операции над файлами
 * @param dryRun только читать файлы
 * @param log    журнал этого прохода
 * @param batch  пул воркеров для пакетной обработки
 */
public record ExecutionPass(RenameEngine engine, boolean dryRun, OperationLog log, BatchExecutor batch) {
}
