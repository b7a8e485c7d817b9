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
import ru.nts.tools.refactor.rewrite.SymbolKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Замена символа с учетом синтаксиса во всех файлах, подходящих под glob-шаблоны.
 */
public final class SymbolReplaceOperation implements RefactorOperation {

    private static final Logger log = LoggerFactory.getLogger(SymbolReplaceOperation.class);

    private final String oldSymbol;
    private final String newSymbol;
    private final String patterns;
    private final SymbolKind kind;
    private final FileSetResolver resolver;

    /**
     * @param patterns glob-шаблоны через запятую ({@code "src/**}{@code /*.py,lib/*.py"})
     */
    public SymbolReplaceOperation(String oldSymbol, String newSymbol, String patterns, SymbolKind kind,
                                  FileSetResolver resolver) {
        this.oldSymbol = oldSymbol;
        this.newSymbol = newSymbol;
        this.patterns = patterns;
        this.kind = kind;
        this.resolver = resolver;
    }

    @Override
    public String describe() {
        return "replace " + kind.name().toLowerCase(Locale.ROOT) + " '" + oldSymbol + "' → '" + newSymbol + "' in " + patterns;
    }

    @Override
    public void validate() {
        if (oldSymbol == null || oldSymbol.isBlank() || newSymbol == null || newSymbol.isBlank()) {
            throw new RefactorException(ErrorCode.INVALID_ARGUMENT, "Old and new symbols must not be empty");
        }
        if (patterns == null || patterns.isBlank()) {
            throw new RefactorException(ErrorCode.INVALID_ARGUMENT, "--in requires at least one file pattern");
        }
    }

    @Override
    public List<RenameResult> run(ExecutionPass pass) {
        List<Path> files = resolver.globs(patterns);
        if (files.isEmpty()) {
            log.warn("No files found matching pattern: {}", patterns);
            return List.of();
        }
        log.info("Processing {} file(s) for symbol replacement", files.size());
        return pass.batch().map(files, file ->
                pass.engine().replaceSymbol(file, oldSymbol, newSymbol, kind, pass.dryRun(), pass.log()));
    }
}
