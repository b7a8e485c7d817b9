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

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык программирования по расширению файла или shebang.
 * Распознаются языки, для которых есть переписчик символов или проверка компиляции:
 * java, python, javascript, typescript.
 */
public final class LanguageDetector {

    public static final String JAVA = "java";
    public static final String PYTHON = "python";
    public static final String JAVASCRIPT = "javascript";
    public static final String TYPESCRIPT = "typescript";

    private LanguageDetector() {}

    /**
     * Отображение расширений файлов на идентификаторы языков.
     */
    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            // Java
            Map.entry("java", JAVA),

            // Python
            Map.entry("py", PYTHON),
            Map.entry("pyi", PYTHON),
            Map.entry("pyw", PYTHON),

            // JavaScript
            Map.entry("js", JAVASCRIPT),
            Map.entry("mjs", JAVASCRIPT),
            Map.entry("cjs", JAVASCRIPT),
            Map.entry("jsx", JAVASCRIPT),

            // TypeScript
            Map.entry("ts", TYPESCRIPT),
            Map.entry("tsx", TYPESCRIPT),
            Map.entry("mts", TYPESCRIPT),
            Map.entry("cts", TYPESCRIPT)
    );

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        String extension = fileName.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Определяет язык по пути к файлу и содержимому (для shebang).
     *
     * @param path путь к файлу
     * @param content содержимое файла (первые строки)
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path, String content) {
        Optional<String> byExtension = detect(path);
        if (byExtension.isPresent()) {
            return byExtension;
        }

        if (content != null && content.startsWith("#!")) {
            String firstLine = content.lines().findFirst().orElse("");

            if (firstLine.contains("python")) {
                return Optional.of(PYTHON);
            }
            if (firstLine.contains("node") || firstLine.contains("deno") || firstLine.contains("bun")) {
                return Optional.of(JAVASCRIPT);
            }
        }

        return Optional.empty();
    }
}
