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
package ru.nts.tools.refactor.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Поиск файлов, связанных с переименовываемым по соглашениям об именах:
 * тесты, реализации, интерфейсы, базовые и абстрактные классы.
 */
public final class RelatedFiles {

    private RelatedFiles() {
    }

    /**
     * Проверяет, связан ли файл с именем {@code stem} по одному из соглашений:
     * {@code {stem}Test}, {@code {stem}Impl}, {@code {stem}Interface}, {@code {stem}Base},
     * {@code {stem}Abstract}, {@code Test{stem}}, {@code I{stem}} (с любым расширением).
     */
    static boolean isRelated(String fileName, String stem) {
        for (String name : List.of(stem + "Test", stem + "Impl", stem + "Interface", stem + "Base",
                stem + "Abstract", "Test" + stem, "I" + stem)) {
            if (fileName.startsWith(name + ".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Находит связанные файлы в директории файла и ее поддиректориях. Сам файл не включается.
     *
     * @return файлы в отсортированном порядке
     */
    public static List<Path> find(Path file, String stem) throws IOException {
        Path main = file.toAbsolutePath().normalize();
        Path dir = main.getParent();
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !p.equals(main))
                    .filter(p -> isRelated(p.getFileName().toString(), stem))
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
