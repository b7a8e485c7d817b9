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

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Знания о грамматике конкретного языка, нужные для переименования по AST:
 * какие узлы являются идентификаторами и какой вид символа обозначает каждое вхождение.
 */
public interface LanguageProfile {

    String language();

    /**
     * Типы листовых узлов, текст которых может совпасть с именем символа.
     */
    Set<String> identifierTypes();

    /**
     * Определяет вид символа, который обозначает вхождение идентификатора.
     *
     * @param node узел-идентификатор
     * @return вид символа, либо null если вхождение - простая ссылка неизвестного вида
     *         (вид будет выведен из объявлений в том же файле)
     */
    SymbolKind classify(TSNode node);

    /**
     * Является ли вхождение объявлением (а не ссылкой).
     */
    boolean isDeclaration(TSNode node);

    /**
     * Находит дочерний узел указанного типа.
     */
    static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Является ли узел первым дочерним узлом указанного типа (для объявлений это имя).
     */
    static boolean isFirstChildOfType(TSNode node, TSNode parent, String type) {
        TSNode first = findChildByType(parent, type);
        return first != null && sameNode(first, node);
    }

    static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte();
    }

    static TSNode parentOf(TSNode node) {
        TSNode parent = node.getParent();
        return parent == null || parent.isNull() ? null : parent;
    }

    /**
     * Извлекает текст узла из байтового массива.
     * КРИТИЧНО: tree-sitter возвращает байтовые смещения UTF-8, а не символьные!
     */
    static String nodeText(TSNode node, byte[] contentBytes) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Имена с заглавной буквы по соглашению обозначают типы.
     */
    static boolean looksLikeType(byte[] contentBytes, TSNode node) {
        String text = nodeText(node, contentBytes);
        return !text.isEmpty() && Character.isUpperCase(text.codePointAt(0));
    }
}
