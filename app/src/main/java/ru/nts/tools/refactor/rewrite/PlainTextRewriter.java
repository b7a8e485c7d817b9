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
 * Буквальная замена подстроки (PLAIN_TEXT).
 * <p>
 * Используется только для обновления содержимого файлов, тип которых не распознан.
 * Границы слов не учитываются: при переименовании {@code price} в {@code priceinticks}
 * уже существующий идентификатор {@code priceinticks} превратится в {@code priceinticksinticks}.
 */
public final class PlainTextRewriter implements SymbolRewriter {

    @Override
    public Backend backend() {
        return Backend.PLAIN_TEXT;
    }

    @Override
    public boolean supports(String langId) {
        return true;
    }

    @Override
    public Optional<RewriteResult> rewrite(String content, String oldName, String newName,
                                           String langId, SymbolKind kind) {
        if (oldName.isEmpty() || oldName.equals(newName)) {
            return Optional.of(RewriteResult.unchanged(content, Backend.PLAIN_TEXT));
        }
        int changes = 0;
        int from = content.indexOf(oldName);
        while (from >= 0) {
            changes++;
            from = content.indexOf(oldName, from + oldName.length());
        }
        if (changes == 0) {
            return Optional.of(RewriteResult.unchanged(content, Backend.PLAIN_TEXT));
        }
        return Optional.of(new RewriteResult(content.replace(oldName, newName), changes, Backend.PLAIN_TEXT));
    }
}
