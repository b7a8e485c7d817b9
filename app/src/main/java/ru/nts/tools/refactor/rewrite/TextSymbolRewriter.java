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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Построчная замена целых слов (REGEX).
 * <p>
 * Строки, начинающиеся с комментария ({@code #}, {@code //}, {@code *}, {@code /*}), пропускаются.
 * Внутри строковых литералов в одинарных и двойных кавычках (с учетом экранирования) замена не делается.
 * Работает для любого языка; вид символа не различает.
 */
public final class TextSymbolRewriter implements SymbolRewriter {

    private static final String[] COMMENT_PREFIXES = {"#", "//", "*", "/*"};

    @Override
    public Backend backend() {
        return Backend.REGEX;
    }

    @Override
    public boolean supports(String langId) {
        return true;
    }

    @Override
    public Optional<RewriteResult> rewrite(String content, String oldName, String newName,
                                           String langId, SymbolKind kind) {
        if (oldName.isEmpty() || oldName.equals(newName) || !content.contains(oldName)) {
            return Optional.of(RewriteResult.unchanged(content, Backend.REGEX));
        }
        Pattern word = Pattern.compile("\\b" + Pattern.quote(oldName) + "\\b");
        String replacement = Matcher.quoteReplacement(newName);

        StringBuilder out = new StringBuilder(content.length());
        int changes = 0;
        // Разбиение с сохранением переводов строк: склейка дает исходный текст байт в байт
        for (String line : content.split("(?<=\n)", -1)) {
            if (isCommentLine(line) || !line.contains(oldName)) {
                out.append(line);
                continue;
            }
            boolean[] inString = stringMask(line);
            Matcher matcher = word.matcher(line);
            StringBuilder rewritten = new StringBuilder(line.length());
            while (matcher.find()) {
                if (inString[matcher.start()]) {
                    continue;
                }
                matcher.appendReplacement(rewritten, replacement);
                changes++;
            }
            matcher.appendTail(rewritten);
            out.append(rewritten);
        }
        if (changes == 0) {
            return Optional.of(RewriteResult.unchanged(content, Backend.REGEX));
        }
        return Optional.of(new RewriteResult(out.toString(), changes, Backend.REGEX));
    }

    static boolean isCommentLine(String line) {
        String stripped = line.strip();
        for (String prefix : COMMENT_PREFIXES) {
            if (stripped.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Для каждого символа строки: находится ли он внутри строкового литерала (кавычки включительно).
     */
    static boolean[] stringMask(String line) {
        boolean[] mask = new boolean[line.length() + 1];
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                mask[i] = true;
                if (ch == '\\' && i + 1 < line.length()) {
                    mask[++i] = true;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                mask[i] = true;
            }
        }
        return mask;
    }
}
