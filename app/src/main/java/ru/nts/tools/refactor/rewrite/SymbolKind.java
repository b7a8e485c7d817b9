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

import java.util.Locale;

/**
 * Вид переименовываемого символа.
 */
public enum SymbolKind {
    FUNCTION,
    CLASS,
    VARIABLE,
    /** Все вхождения идентификатора независимо от вида. */
    AUTO;

    /**
     * Разбирает значение опции {@code --symbol-type}: variable, method, function, class, auto.
     *
     * @throws IllegalArgumentException неизвестный вид
     */
    public static SymbolKind parse(String value) {
        if (value == null) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "method", "function" -> FUNCTION;
            case "class" -> CLASS;
            case "variable" -> VARIABLE;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException("Unknown symbol type: " + value
                    + " (expected variable, method, function, class or auto)");
        };
    }

    public boolean accepts(SymbolKind occurrence) {
        return this == AUTO || this == occurrence;
    }
}
