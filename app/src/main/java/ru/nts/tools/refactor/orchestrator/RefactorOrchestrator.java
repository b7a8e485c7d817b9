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
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.core.RetryPolicy;
import ru.nts.tools.refactor.engine.BatchExecutor;
import ru.nts.tools.refactor.engine.OperationLog;
import ru.nts.tools.refactor.engine.RenameEngine;
import ru.nts.tools.refactor.engine.RenameResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Двухфазный запуск операции рефакторинга.
 * <p>
 * Операция всегда сначала выполняется в режиме предпросмотра, независимо от запрошенного режима.
 * Предпросмотр показывается пользователю; если менять нечего, запуск завершается.
 * После подтверждения журнал создается заново и та же операция выполняется по-настоящему:
 * набор файлов и изменения вычисляются повторно, а не воспроизводятся из предпросмотра.
 */
public final class RefactorOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefactorOrchestrator.class);

    static final String CONFIRM_QUESTION = "Proceed with these changes?";

    private final RenameEngine engine;
    private final ConfirmationPrompt prompt;
    private final ReportWriter writer;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Phase> history = new ArrayList<>();

    private Phase phase;

    public RefactorOrchestrator(RenameEngine engine, ConfirmationPrompt prompt, ReportWriter writer) {
        this.engine = engine;
        this.prompt = prompt;
        this.writer = writer;
    }

    /**
     * Итог запуска.
     *
     * @param phase    конечная фаза (DONE или ABORTED)
     * @param exitCode код выхода процесса
     * @param report   отчет последнего выполненного прохода
     * @param phases   пройденные фазы по порядку
     */
    public record Outcome(Phase phase, int exitCode, RefactorReport report, List<Phase> phases) {

        public boolean executed() {
            return phases.contains(Phase.EXECUTING);
        }
    }

    /**
     * Запрашивает остановку: файлы, обработка которых еще не началась, будут пропущены.
     * Запрос действует на текущий (или ближайший) запуск и снимается по его завершении.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Выполняет операцию.
     *
     * @param dryRun только показать предпросмотр
     */
    public Outcome run(RefactorOperation operation, boolean dryRun) {
        try {
            return execute(operation, dryRun);
        } finally {
            cancelled.set(false);
        }
    }

    private Outcome execute(RefactorOperation operation, boolean dryRun) {
        history.clear();
        BatchExecutor batch = new BatchExecutor(engine.config().workers(), cancelled);

        transition(Phase.ANALYZING);
        if (!dryRun) {
            writer.info("Analyzing changes: " + operation.describe());
        }
        OperationLog previewLog = new OperationLog();
        List<RenameResult> previewResults;
        try {
            operation.validate();
            previewResults = operation.run(new ExecutionPass(engine, true, previewLog, batch));
        } catch (RefactorException e) {
            log.debug(e.toLogMessage());
            writer.failure(e);
            return finish(Phase.ABORTED, 1, RefactorReport.of(previewLog, List.of(), true));
        }
        RefactorReport preview = RefactorReport.of(previewLog, previewResults, true);

        transition(Phase.PREVIEWING);
        writer.preview(previewLog, dryRun);
        int previewExit = previewLog.hasErrors() ? 1 : 0;
        if (dryRun) {
            transition(Phase.REPORTING);
            writer.report(preview);
            return finish(Phase.DONE, previewExit, preview);
        }
        if (!previewLog.hasActionable()) {
            writer.warn("No applicable files or symbols found to rename.");
            return finish(Phase.DONE, previewExit, preview);
        }

        transition(Phase.CONFIRMING);
        if (!prompt.confirm(CONFIRM_QUESTION)) {
            writer.warn("Aborted by user.");
            return finish(Phase.ABORTED, 1, preview);
        }

        transition(Phase.EXECUTING);
        writer.info("Executing changes...");
        if (!engine.config().writePolicy().equals(RetryPolicy.defaults())) {
            log.info("Using retry configuration: {}", engine.config().writePolicy());
        }
        OperationLog executionLog = new OperationLog();
        List<RenameResult> results;
        try {
            results = operation.run(new ExecutionPass(engine, false, executionLog, batch));
        } catch (RefactorException e) {
            // Набор файлов изменился между предпросмотром и исполнением
            log.debug(e.toLogMessage());
            writer.failure(e);
            return finish(Phase.ABORTED, 1, RefactorReport.of(executionLog, List.of(), false));
        }

        transition(Phase.REPORTING);
        RefactorReport report = RefactorReport.of(executionLog, results, false);
        writer.report(report);
        return finish(Phase.DONE, report.success() ? 0 : 1, report);
    }

    private void transition(Phase next) {
        log.debug("Phase {} -> {}", phase, next);
        phase = next;
        history.add(next);
    }

    private Outcome finish(Phase terminal, int exitCode, RefactorReport report) {
        transition(terminal);
        return new Outcome(terminal, exitCode, report, List.copyOf(history));
    }
}
