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

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ru.nts.tools.refactor.engine.FileSetResolver;
import ru.nts.tools.refactor.orchestrator.RefactorOperation;
import ru.nts.tools.refactor.orchestrator.RenameFileOperation;

import java.nio.file.Path;

/**
 * CLI command: nts-refactor rename &lt;file&gt; &lt;new_name&gt;
 * <p>
 * Переименовывает файл в той же директории, обновляя ссылки на старое имя внутри него.
 */
@Command(name = "rename", mixinStandardHelpOptions = true,
        description = "Rename a file and update references to its old name")
public class RenameCommand extends RefactorCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = "File to rename")
    Path file;

    @Parameters(index = "1", paramLabel = "NEW_NAME", description = "New name (extension is kept)")
    String newName;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ContentMode contentMode;

    @Option(names = "--related", description = "Also rename related files (FooTest, FooImpl, IFoo, ...)")
    boolean related;

    static class ContentMode {
        @Option(names = "--content-only", required = true, description = "Update file content, keep the name")
        boolean contentOnly;

        @Option(names = "--no-content", required = true, description = "Rename the file without touching content")
        boolean noContent;
    }

    @Override
    protected RefactorOperation createOperation(FileSetResolver resolver) {
        RenameFileOperation.Mode mode = RenameFileOperation.Mode.FULL;
        if (contentMode != null) {
            mode = contentMode.contentOnly ? RenameFileOperation.Mode.CONTENT_ONLY : RenameFileOperation.Mode.NO_CONTENT;
        }
        return new RenameFileOperation(resolve(file), newName, mode, related);
    }
}
