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
package ru.nts.tools.refactor.core.treesitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка синтаксиса через tree-sitter AST.
 * Ищет ERROR и MISSING узлы в дереве разбора.
 */
public final class SyntaxChecker {

    private static final Logger log = LoggerFactory.getLogger(SyntaxChecker.class);

    private static final int MAX_ERRORS = 5;

    private SyntaxChecker() {}

    public record SyntaxError(int line, int column, String message, String context) {

        @Override
        public String toString() {
            return "line " + line + ":" + column + " " + message + (context.isEmpty() ? "" : " [" + context + "]");
        }
    }

    public record SyntaxCheckResult(List<SyntaxError> errors) {
        public boolean hasErrors() { return !errors.isEmpty(); }
        public int errorCount() { return errors.size(); }
    }

    /**
     * Проверяет синтаксис переданного контента.
     *
     * @param content содержимое файла
     * @param langId язык с подключенной грамматикой
     * @return результат проверки
     * @throws IllegalArgumentException если для языка нет грамматики
     */
    public static SyntaxCheckResult checkContent(String content, String langId) {
        TSTree tree = TreeSitterManager.getInstance().parse(content, langId);
        return check(tree.getRootNode(), content);
    }

    /**
     * Собирает синтаксические ошибки уже построенного дерева.
     */
    public static SyntaxCheckResult check(TSNode root, String content) {
        String[] lines = content.split("\n", -1);
        List<SyntaxError> errors = new ArrayList<>();
        collectErrors(root, lines, errors);
        if (!errors.isEmpty()) {
            log.debug("Found {} syntax error(s), first: {}", errors.size(), errors.get(0));
        }
        return new SyntaxCheckResult(List.copyOf(errors));
    }

    /**
     * Есть ли в дереве хотя бы один ERROR или MISSING узел.
     */
    public static boolean hasErrors(TSNode root) {
        if (root.getType().equals("ERROR") || root.isMissing()) {
            return true;
        }
        int childCount = root.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = root.getChild(i);
            if (child != null && !child.isNull() && hasErrors(child)) {
                return true;
            }
        }
        return false;
    }

    private static void collectErrors(TSNode node, String[] lines, List<SyntaxError> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (node.getType().equals("ERROR") || node.isMissing()) {
            int line = node.getStartPoint().getRow() + 1; // tree-sitter: 0-based -> 1-based
            int column = node.getStartPoint().getColumn() + 1;

            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.getType();
            } else {
                // ERROR-узел: показываем тип родителя для контекста
                TSNode parent = node.getParent();
                String parentType = (parent != null && !parent.isNull()) ? parent.getType() : "unknown";
                message = "Syntax error in " + parentType;
            }

            String context = (line - 1 < lines.length) ? lines[line - 1].trim() : "";
            if (context.length() > 80) {
                context = context.substring(0, 80) + "...";
            }

            errors.add(new SyntaxError(line, column, message, context));
            return; // Не рекурсим в ERROR-узлы - уже нашли ошибку
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collectErrors(child, lines, errors);
            }
        }
    }
}
