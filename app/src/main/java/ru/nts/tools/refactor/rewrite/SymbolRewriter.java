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
package ru.nts.tools.refactor.rewrite;

import java.util.Optional;

/**
 * Переписывает вхождения символа в тексте файла. Чистая функция: файлы не читает и не пишет.
 */
public interface SymbolRewriter {

    Backend backend();

    /**
     * Может ли переписчик обработать указанный язык.
     *
     * @param langId идентификатор языка или null для неизвестного типа файла
     */
    boolean supports(String langId);

    /**
     * Заменяет {@code oldName} на {@code newName}.
     *
     * @return результат, либо empty если переписчик не смог обработать контент
     *         (например, синтаксические ошибки мешают построить дерево)
     */
    Optional<RewriteResult> rewrite(String content, String oldName, String newName, String langId, SymbolKind kind);
}
