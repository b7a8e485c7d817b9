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

/**
 * Фазы одного запуска рефакторинга.
 * <pre>
 * ANALYZING → PREVIEWING → CONFIRMING → EXECUTING → REPORTING → DONE
 *                 │             │
 *                 └→ DONE       └→ ABORTED
 * </pre>
 * Из ANALYZING возможен переход в ABORTED при ошибке валидации.
 */
public enum Phase {
    /** Операция выполняется в принудительном режиме предпросмотра. */
    ANALYZING,
    /** Предпросмотр показан пользователю. */
    PREVIEWING,
    /** Ожидание подтверждения. */
    CONFIRMING,
    /** Та же операция выполняется заново, на этот раз с изменением файлов. */
    EXECUTING,
    /** Сводка по журналу исполнения. */
    REPORTING,
    DONE,
    ABORTED;
}
