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
import ru.nts.tools.refactor.engine.FileSetResolver;
import ru.nts.tools.refactor.engine.RenameResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Пакетное переименование: в именах файлов директории, подходящих под glob,
 * подстрока {@code pattern} заменяется на {@code replacement}.
 */
public final class BatchRenameOperation implements RefactorOperation {

    private static final Logger log = LoggerFactory.getLogger(BatchRenameOperation.class);

    private final String pattern;
    private final String replacement;
    private final Path directory;
    private final String fileGlob;
    private final boolean recursive;
    private final FileSetResolver resolver;

    public BatchRenameOperation(String pattern, String replacement, Path directory, String fileGlob,
                                boolean recursive, FileSetResolver resolver) {
        this.pattern = pattern;
        this.replacement = replacement;
        this.directory = directory;
        this.fileGlob = fileGlob;
        this.recursive = recursive;
        this.resolver = resolver;
    }

    @Override
    public String describe() {
        return "batch rename '" + pattern + "' → '" + replacement + "' in " + directory
                + " (" + fileGlob + (recursive ? ", recursive" : "") + ")";
    }

    @Override
    public void validate() {
        if (pattern == null || pattern.isEmpty()) {
            throw new RefactorException(ErrorCode.INVALID_ARGUMENT, "Pattern must not be empty");
        }
        if (!Files.isDirectory(directory)) {
            throw new RefactorException(ErrorCode.DIRECTORY_NOT_FOUND,
                    "Directory '" + directory + "' does not exist", Map.of("path", directory));
        }
    }

    @Override
    public List<RenameResult> run(ExecutionPass pass) {
        List<Path> files = resolver.batch(directory, fileGlob, recursive, pattern);
        log.info("Found {} file(s) matching pattern '{}' in '{}'", files.size(), pattern, directory);

        return pass.batch().map(files, file -> {
            String stem = RenameFileOperation.stemOf(file.getFileName().toString());
            String newStem = stem.replace(pattern, replacement);
            if (newStem.equals(stem)) {
                return RenameResult.unchanged(file, null);
            }
            return pass.engine().renameFile(file, newStem, true, pass.dryRun(), pass.log());
        });
    }
}
