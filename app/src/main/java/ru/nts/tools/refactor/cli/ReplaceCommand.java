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
package ru.nts.tools.refactor.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ru.nts.tools.refactor.engine.FileSetResolver;
import ru.nts.tools.refactor.orchestrator.RefactorOperation;
import ru.nts.tools.refactor.orchestrator.SymbolReplaceOperation;
import ru.nts.tools.refactor.rewrite.SymbolKind;

/**
 * CLI command: nts-refactor replace &lt;old&gt; &lt;new&gt; --in &lt;globs&gt;
 * <p>
 * Заменяет идентификатор с учетом синтаксиса: строки и комментарии не затрагиваются.
 */
@Command(name = "replace", mixinStandardHelpOptions = true,
        description = "Replace a symbol in code, skipping strings and comments")
public class ReplaceCommand extends RefactorCommand {

    @Parameters(index = "0", paramLabel = "OLD", description = "Symbol to replace")
    String oldSymbol;

    @Parameters(index = "1", paramLabel = "NEW", description = "New symbol name")
    String newSymbol;

    @Option(names = "--in", required = true, paramLabel = "GLOBS",
            description = "Comma-separated file globs, e.g. 'src/**/*.java,lib/*.py'")
    String patterns;

    @Option(names = "--symbol-type", paramLabel = "KIND", defaultValue = "auto",
            description = "variable, method, function, class or auto (default: ${DEFAULT-VALUE})")
    String symbolType;

    @Override
    protected RefactorOperation createOperation(FileSetResolver resolver) {
        return new SymbolReplaceOperation(oldSymbol, newSymbol, patterns, SymbolKind.parse(symbolType), resolver);
    }
}
