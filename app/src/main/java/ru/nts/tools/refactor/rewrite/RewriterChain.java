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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Выбор способа переписывания: AST, если язык поддерживается и контент разбирается,
 * иначе REGEX. PLAIN_TEXT применяется только к файлам неизвестного типа и только по запросу
 * (обновление содержимого при переименовании файла).
 */
public final class RewriterChain {

    private static final Logger log = LoggerFactory.getLogger(RewriterChain.class);

    private final List<SymbolRewriter> rewriters;
    private final SymbolRewriter plainText;

    public RewriterChain() {
        this(List.of(new AstSymbolRewriter(), new TextSymbolRewriter()), new PlainTextRewriter());
    }

    /**
     * @param rewriters переписчики в порядке предпочтения; последний должен поддерживать любой язык
     * @param plainText переписчик для файлов неизвестного типа
     */
    public RewriterChain(List<SymbolRewriter> rewriters, SymbolRewriter plainText) {
        if (rewriters.isEmpty()) {
            throw new IllegalArgumentException("At least one rewriter is required");
        }
        this.rewriters = List.copyOf(rewriters);
        this.plainText = plainText;
    }

    /**
     * Переписывает символ в контенте кода.
     *
     * @param langId язык файла или null, если тип не распознан
     */
    public RewriteResult rewrite(String content, String oldName, String newName, String langId, SymbolKind kind) {
        return rewrite(content, oldName, newName, langId, kind, false);
    }

    /**
     * @param allowPlainText разрешить буквальную замену для файлов неизвестного типа
     */
    public RewriteResult rewrite(String content, String oldName, String newName, String langId,
                                 SymbolKind kind, boolean allowPlainText) {
        if (langId == null && allowPlainText) {
            return plainText.rewrite(content, oldName, newName, null, kind)
                    .orElseGet(() -> RewriteResult.unchanged(content, Backend.PLAIN_TEXT));
        }
        for (SymbolRewriter rewriter : rewriters) {
            if (!rewriter.supports(langId)) {
                continue;
            }
            Optional<RewriteResult> result = rewriter.rewrite(content, oldName, newName, langId, kind);
            if (result.isPresent()) {
                return result.get();
            }
            log.debug("{} rewriter cannot handle {} content, falling back", rewriter.backend(), langId);
        }
        SymbolRewriter last = rewriters.get(rewriters.size() - 1);
        return RewriteResult.unchanged(content, last.backend());
    }
}
