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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;
import ru.nts.tools.refactor.ConsoleOutput;
import ru.nts.tools.refactor.RefactorCli;
import ru.nts.tools.refactor.core.EngineConfig;
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.engine.FileSetResolver;
import ru.nts.tools.refactor.engine.RenameEngine;
import ru.nts.tools.refactor.orchestrator.ConsolePrompt;
import ru.nts.tools.refactor.orchestrator.RefactorOperation;
import ru.nts.tools.refactor.orchestrator.RefactorOrchestrator;
import ru.nts.tools.refactor.orchestrator.ReportWriter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Общая часть подкоманд: конфигурация, логирование и запуск операции через оркестратор.
 * Возвращаемое значение становится кодом выхода процесса.
 */
abstract class RefactorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RefactorCommand.class);

    @Mixin
    CommonOptions common;

    @ParentCommand
    RefactorCli root;

    /**
     * Создает операцию из аргументов команды.
     *
     * @throws IllegalArgumentException при недопустимых аргументах
     */
    protected abstract RefactorOperation createOperation(FileSetResolver resolver);

    @Override
    public Integer call() {
        PrintStream console = common.json() ? root.err() : root.out();
        EngineConfig config;
        RefactorOperation operation;
        try {
            config = common.toConfig(root.env());
            operation = createOperation(new FileSetResolver(root.baseDir()));
        } catch (IllegalArgumentException | RefactorException e) {
            ConsoleOutput.error(root.err(), e.getMessage());
            return 1;
        }
        CommonOptions.applyLogLevel(config);
        log.debug("Configuration: {}", config);
        if (common.verbose()) {
            ConsoleOutput.printBanner(console);
        }

        ReportWriter writer = new ReportWriter(root.out(), root.err(), common.json(), common.verbose());
        ConsolePrompt prompt = new ConsolePrompt(root.in(), console, common.yes(), root.interactive());
        RefactorOrchestrator orchestrator = new RefactorOrchestrator(new RenameEngine(config), prompt, writer);
        return orchestrator.run(operation, common.dryRun()).exitCode();
    }

    protected Path resolve(Path path) {
        return root.baseDir().resolve(path);
    }
}
