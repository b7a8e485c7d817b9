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
package ru.nts.tools.refactor.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.refactor.core.ErrorCode;
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.engine.RelatedFiles;
import ru.nts.tools.refactor.engine.RenameResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Переименование одного файла (и, по запросу, связанных с ним файлов)
 * с обновлением имени класса в содержимом.
 */
public final class RenameFileOperation implements RefactorOperation {

    private static final Logger log = LoggerFactory.getLogger(RenameFileOperation.class);

    /**
     * Что делать с файлом.
     */
    public enum Mode {
        /** Обновить содержимое и переименовать файл. */
        FULL,
        /** Только обновить содержимое. */
        CONTENT_ONLY,
        /** Только переименовать файл. */
        NO_CONTENT
    }

    private final Path file;
    private final String newStem;
    private final Mode mode;
    private final boolean related;

    /**
     * @param newName новое имя; расширение, если указано, отбрасывается
     */
    public RenameFileOperation(Path file, String newName, Mode mode, boolean related) {
        this.file = file;
        this.newStem = stemOf(newName);
        this.mode = mode;
        this.related = related;
    }

    @Override
    public String describe() {
        return "rename " + file.getFileName() + " → " + newStem
                + (mode != Mode.FULL ? " (" + mode.name().toLowerCase(Locale.ROOT).replace('_', '-') + ")" : "")
                + (related ? " with related files" : "");
    }

    @Override
    public void validate() {
        if (!Files.isRegularFile(file)) {
            throw new RefactorException(ErrorCode.SOURCE_NOT_FOUND,
                    "File '" + file + "' does not exist", Map.of("path", file));
        }
        if (newStem.isBlank()) {
            throw new RefactorException(ErrorCode.INVALID_ARGUMENT, "New name must not be empty");
        }
    }

    @Override
    public List<RenameResult> run(ExecutionPass pass) {
        String oldStem = stemOf(file.getFileName().toString());
        if (mode == Mode.CONTENT_ONLY) {
            return List.of(pass.engine().updateContent(file, oldStem, newStem, pass.dryRun(), pass.log()));
        }
        boolean updateContent = mode == Mode.FULL;

        // Связанные файлы ищутся до переименования основного
        List<Path> relatedFiles = related ? findRelated(oldStem) : List.of();
        if (!relatedFiles.isEmpty()) {
            log.info("Found {} related file(s): {}", relatedFiles.size(), relatedFiles);
        }

        List<RenameResult> results = new ArrayList<>();
        results.add(pass.engine().renameFile(file, newStem, updateContent, pass.dryRun(), pass.log()));
        results.addAll(pass.batch().map(relatedFiles, relatedFile -> {
            String relatedStem = stemOf(relatedFile.getFileName().toString());
            String relatedNewStem = relatedStem.replace(oldStem, newStem);
            return pass.engine().renameFile(relatedFile, relatedNewStem, updateContent, pass.dryRun(), pass.log());
        }));
        return results;
    }

    private List<Path> findRelated(String oldStem) {
        try {
            return RelatedFiles.find(file, oldStem);
        } catch (IOException e) {
            log.warn("Cannot search related files of {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    static String stemOf(String name) {
        String fileName = Path.of(name).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
