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

import ru.nts.tools.refactor.engine.RenameResult;

import java.util.List;

/**
 * Запрошенная пользователем операция рефакторинга.
 * <p>
 * Один и тот же экземпляр выполняется дважды: сначала в режиме предпросмотра, затем по-настоящему.
 * Набор файлов вычисляется заново на каждом проходе, поэтому реализация не должна
 * сохранять состояние между вызовами {@link #run}.
 */
public interface RefactorOperation {

    /**
     * Краткое описание для вывода ("rename Foo.java → Bar").
     */
    String describe();

    /**
     * Проверяет аргументы до начала работы.
     *
     * @throws ru.nts.tools.refactor.core.RefactorException аргументы некорректны
     */
    void validate();

    /**
     * Выполняет операцию. Ошибки отдельных файлов записываются в журнал прохода, а не выбрасываются.
     *
     * @return результаты по каждому обработанному файлу
     */
    List<RenameResult> run(ExecutionPass pass);
}
