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
import ru.nts.tools.refactor.core.treesitter.LanguageDetector;

import java.util.Set;

import static ru.nts.tools.refactor.rewrite.LanguageProfile.*;

/**
 * Классификация идентификаторов грамматики tree-sitter-python.
 * Python не различает ссылки на классы, функции и переменные синтаксически,
 * поэтому большинство ссылок получает вид из объявлений того же файла.
 */
public final class PythonProfile implements LanguageProfile {

    private static final Set<String> IDENTIFIERS = Set.of("identifier");

    private static final Set<String> VARIABLE_DECLARATIONS = Set.of(
            "assignment",
            "augmented_assignment",
            "parameters",
            "default_parameter",
            "typed_parameter",
            "typed_default_parameter",
            "for_statement",
            "global_statement",
            "nonlocal_statement");

    private final byte[] contentBytes;

    public PythonProfile(byte[] contentBytes) {
        this.contentBytes = contentBytes;
    }

    @Override
    public String language() {
        return LanguageDetector.PYTHON;
    }

    @Override
    public Set<String> identifierTypes() {
        return IDENTIFIERS;
    }

    @Override
    public SymbolKind classify(TSNode node) {
        TSNode parent = parentOf(node);
        if (parent == null) {
            return null;
        }
        return switch (parent.getType()) {
            case "class_definition" -> isFirstChildOfType(node, parent, "identifier") ? SymbolKind.CLASS : null;
            case "function_definition" -> isFirstChildOfType(node, parent, "identifier") ? SymbolKind.FUNCTION : null;
            case "call" -> sameNode(parent.getChild(0), node) ? calleeKind(node) : null;
            case "attribute" -> attributeKind(node, parent);
            case "keyword_argument" -> sameNode(parent.getChild(0), node) ? SymbolKind.VARIABLE : null;
            default -> isAssignedName(node, parent) ? SymbolKind.VARIABLE : null;
        };
    }

    @Override
    public boolean isDeclaration(TSNode node) {
        TSNode parent = parentOf(node);
        if (parent == null) {
            return false;
        }
        String parentType = parent.getType();
        if (parentType.equals("class_definition") || parentType.equals("function_definition")) {
            return isFirstChildOfType(node, parent, "identifier");
        }
        return isAssignedName(node, parent);
    }

    /**
     * {@code Foo()} создает экземпляр класса, {@code foo()} вызывает функцию.
     * Вид вызываемого имени уточняется по объявлениям файла, поэтому здесь только подсказка.
     */
    private SymbolKind calleeKind(TSNode node) {
        return looksLikeType(contentBytes, node) ? SymbolKind.CLASS : null;
    }

    /**
     * {@code obj.method()} - вызов метода, {@code obj.field} - атрибут, {@code Cls.attr} - ссылка на класс.
     */
    private SymbolKind attributeKind(TSNode node, TSNode attribute) {
        boolean isObject = sameNode(attribute.getChild(0), node);
        if (isObject) {
            return looksLikeType(contentBytes, node) ? SymbolKind.CLASS : null;
        }
        TSNode outer = parentOf(attribute);
        if (outer != null && outer.getType().equals("call") && sameNode(outer.getChild(0), attribute)) {
            return SymbolKind.FUNCTION;
        }
        return SymbolKind.VARIABLE;
    }

    private static boolean isAssignedName(TSNode node, TSNode parent) {
        String parentType = parent.getType();
        if (!VARIABLE_DECLARATIONS.contains(parentType)) {
            return false;
        }
        return switch (parentType) {
            // Переменная цикла стоит после ключевого слова for
            case "for_statement" -> parent.getChildCount() > 1 && sameNode(parent.getChild(1), node);
            // Только цель присваивания / имя параметра, но не значение по умолчанию
            case "assignment", "augmented_assignment", "default_parameter", "typed_parameter",
                 "typed_default_parameter" -> parent.getChildCount() > 0 && sameNode(parent.getChild(0), node);
            default -> true;
        };
    }
}
