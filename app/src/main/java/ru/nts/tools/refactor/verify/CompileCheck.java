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
package ru.nts.tools.refactor.verify;

/**
 * Результат рекомендательной проверки компиляции.
 *
 * @param ok      файл компилируется (синтаксис корректен)
 * @param message короткое сообщение: "Compiles", "Compile Error", "Syntax Error", "Cannot check - ..."
 */
public record CompileCheck(boolean ok, String message) {

    public static final String COMPILES = "Compiles";

    public static CompileCheck compiles() {
        return new CompileCheck(true, COMPILES);
    }

    public static CompileCheck failed(String message) {
        return new CompileCheck(false, message);
    }

    public static CompileCheck cannotCheck(String reason) {
        return new CompileCheck(false, "Cannot check - " + reason);
    }

    /**
     * Проверка не выполнялась (нет компилятора, неизвестный язык и т.п.), а не провалилась.
     */
    public boolean skipped() {
        return !ok && message.startsWith("Cannot check");
    }
}
