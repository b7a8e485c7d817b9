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
package ru.nts.tools.refactor.core;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Системные вызовы, через которые проходят атомарная подмена и перемещение.
 * Выделены в отдельный шов, чтобы тесты могли эмулировать блокировки и сбои ОС.
 */
@FunctionalInterface
public interface FileOps {

    FileOps NIO = (source, target, options) -> {
        Files.move(source, target, options);
    };

    void move(Path source, Path target, CopyOption... options) throws IOException;

    /**
     * Создает жесткую ссылку {@code link} на {@code existing}; занятое имя дает FileAlreadyExistsException.
     */
    default void link(Path link, Path existing) throws IOException {
        Files.createLink(link, existing);
    }

    default void delete(Path path) throws IOException {
        Files.delete(path);
    }
}
