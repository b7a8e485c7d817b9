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

/**
 * Результат переписывания символа в тексте файла.
 *
 * @param content новый контент (совпадает с исходным, если замен не было)
 * @param changes число выполненных замен
 * @param backend способ замены
 */
public record RewriteResult(String content, int changes, Backend backend) {

    public static RewriteResult unchanged(String content, Backend backend) {
        return new RewriteResult(content, 0, backend);
    }

    public boolean changed() {
        return changes > 0;
    }
}
