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
 * Классификация идентификаторов грамматики tree-sitter-java.
 */
public final class JavaProfile implements LanguageProfile {

    private static final Set<String> IDENTIFIERS = Set.of("identifier", "type_identifier");

    private static final Set<String> TYPE_DECLARATIONS = Set.of(
            "class_declaration",
            "interface_declaration",
            "enum_declaration",
            "record_declaration",
            "annotation_type_declaration");

    private static final Set<String> VARIABLE_DECLARATIONS = Set.of(
            "variable_declarator",
            "formal_parameter",
            "spread_parameter",
            "catch_formal_parameter",
            "enhanced_for_statement",
            "enum_constant",
            "inferred_parameters",
            "lambda_expression");

    private final byte[] contentBytes;

    /**
     * @param contentBytes UTF-8 байты разбираемого контента (нужны для эвристик по тексту узлов)
     */
    public JavaProfile(byte[] contentBytes) {
        this.contentBytes = contentBytes;
    }

    @Override
    public String language() {
        return LanguageDetector.JAVA;
    }

    @Override
    public Set<String> identifierTypes() {
        return IDENTIFIERS;
    }

    @Override
    public SymbolKind classify(TSNode node) {
        if (node.getType().equals("type_identifier")) {
            return SymbolKind.CLASS;
        }
        TSNode parent = parentOf(node);
        if (parent == null) {
            return null;
        }
        String parentType = parent.getType();

        if (TYPE_DECLARATIONS.contains(parentType) || parentType.equals("constructor_declaration")) {
            return isFirstChildOfType(node, parent, "identifier") ? SymbolKind.CLASS : null;
        }
        return switch (parentType) {
            case "method_declaration" ->
                    isFirstChildOfType(node, parent, "identifier") ? SymbolKind.FUNCTION : null;
            case "method_invocation" -> isInvokedName(node, parent)
                    ? SymbolKind.FUNCTION
                    : receiverKind(node);
            case "method_reference" -> sameNode(parent.getChild(0), node) ? receiverKind(node) : SymbolKind.FUNCTION;
            case "field_access" -> sameNode(parent.getChild(0), node) ? receiverKind(node) : SymbolKind.VARIABLE;
            case "scoped_identifier", "marker_annotation", "annotation" ->
                    looksLikeType(contentBytes, node) ? SymbolKind.CLASS : SymbolKind.VARIABLE;
            default -> VARIABLE_DECLARATIONS.contains(parentType) ? SymbolKind.VARIABLE : null;
        };
    }

    @Override
    public boolean isDeclaration(TSNode node) {
        TSNode parent = parentOf(node);
        if (parent == null || !node.getType().equals("identifier")) {
            return false;
        }
        String parentType = parent.getType();
        if (TYPE_DECLARATIONS.contains(parentType) || parentType.equals("constructor_declaration")
                || parentType.equals("method_declaration")) {
            return isFirstChildOfType(node, parent, "identifier");
        }
        return VARIABLE_DECLARATIONS.contains(parentType);
    }

    /**
     * Имя вызываемого метода - последний идентификатор перед списком аргументов.
     */
    private static boolean isInvokedName(TSNode node, TSNode invocation) {
        TSNode name = null;
        int childCount = invocation.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = invocation.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            if (child.getType().equals("argument_list")) {
                break;
            }
            if (child.getType().equals("identifier")) {
                name = child;
            }
        }
        return name != null && sameNode(name, node);
    }

    /**
     * Получатель вызова: {@code Foo.bar()} ссылается на класс, {@code foo.bar()} - на переменную.
     */
    private SymbolKind receiverKind(TSNode node) {
        return looksLikeType(contentBytes, node) ? SymbolKind.CLASS : SymbolKind.VARIABLE;
    }
}
