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
import ru.nts.tools.refactor.orchestrator.BatchRenameOperation;
import ru.nts.tools.refactor.orchestrator.RefactorOperation;

import java.nio.file.Path;

/**
 * CLI command: nts-refactor batch &lt;pattern&gt; &lt;replacement&gt; &lt;directory&gt; &lt;file_glob&gt;
 */
@Command(name = "batch", mixinStandardHelpOptions = true,
        description = "Rename every matching file whose name contains PATTERN")
public class BatchCommand extends RefactorCommand {

    @Parameters(index = "0", paramLabel = "PATTERN", description = "Substring to replace in file names")
    String pattern;

    @Parameters(index = "1", paramLabel = "REPLACEMENT", description = "Replacement text")
    String replacement;

    @Parameters(index = "2", paramLabel = "DIRECTORY", description = "Directory to search")
    Path directory;

    @Parameters(index = "3", paramLabel = "FILE_GLOB", description = "File glob, e.g. *.java")
    String fileGlob;

    @Option(names = {"-r", "--recursive"}, description = "Search subdirectories")
    boolean recursive;

    @Override
    protected RefactorOperation createOperation(FileSetResolver resolver) {
        return new BatchRenameOperation(pattern, replacement, resolve(directory), fileGlob, recursive, resolver);
    }
}
