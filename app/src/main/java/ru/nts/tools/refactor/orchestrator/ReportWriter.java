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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import picocli.CommandLine.Help.Ansi;
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.engine.OperationLog;
import ru.nts.tools.refactor.engine.OperationRecord;
import ru.nts.tools.refactor.engine.RecordKind;
import ru.nts.tools.refactor.engine.RenameResult;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Вывод предпросмотра и итогового отчета.
 * <p>
 * В режиме JSON в {@code out} попадает только JSON-документ отчета, пояснительные сообщения
 * уходят в {@code err}, чтобы вывод можно было разбирать в CI.
 */
public final class ReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final PrintStream out;
    private final PrintStream err;
    private final boolean json;
    private final boolean verbose;
    private final Ansi ansi;

    public ReportWriter(PrintStream out, PrintStream err, boolean json, boolean verbose) {
        this(out, err, json, verbose, Ansi.AUTO);
    }

    public ReportWriter(PrintStream out, PrintStream err, boolean json, boolean verbose, Ansi ansi) {
        this.out = out;
        this.err = err;
        this.json = json;
        this.verbose = verbose;
        this.ansi = ansi;
    }

    /**
     * Сообщение о ходе работы.
     */
    public void info(String message) {
        console().println(ansi.string("@|fg(cyan) [REFACTOR]|@ " + message));
    }

    public void warn(String message) {
        console().println(ansi.string("@|fg(yellow) !|@ " + message));
    }

    public void error(String message) {
        console().println(ansi.string("@|fg(red) x|@ " + message));
    }

    /**
     * Сообщение об ошибке; в подробном режиме дополняется подсказкой по устранению.
     */
    public void failure(RefactorException e) {
        error(e.getMessage());
        if (verbose) {
            console().println(e.toUserMessage());
        }
    }

    /**
     * Показывает журнал предпросмотра.
     */
    public void preview(OperationLog log, boolean dryRunRequested) {
        if (dryRunRequested) {
            info("DRY RUN MODE - No files will be changed");
        }
        PrintStream console = console();
        for (OperationRecord entry : log.records()) {
            console.println("  " + colored(entry.kind()) + ": " + entry.detail());
        }
        summary(log.summary(), log.size());
    }

    /**
     * Итоговый отчет: JSON-документ или сводка для человека.
     */
    public void report(RefactorReport report) {
        if (json) {
            out.println(toJson(report));
            return;
        }
        summary(report.summary(), report.operations().size());
        if (report.processed() > 0) {
            console().println(ansi.string("@|fg(green) +|@ Successfully processed " + report.processed()
                    + " file" + (report.processed() != 1 ? "s" : "")));
            for (Path file : report.files()) {
                console().println("  - " + file);
            }
        } else {
            warn("No files were processed");
        }
        if (!report.success()) {
            error(report.failures() + " file(s) failed, see errors above");
        }
    }

    private void summary(Map<RecordKind, Long> counts, int total) {
        PrintStream console = console();
        console.println();
        console.println(ansi.string("@|bold Summary:|@"));
        console.println("-".repeat(40));
        counts.forEach((kind, count) -> console.println("  " + colored(kind) + ": " + count));
        console.println();
        console.println("Total operations: " + total);
    }

    private String colored(RecordKind kind) {
        String color = kind.isError() ? "fg(red)" : kind.isActionable() ? "fg(green)" : "fg(white)";
        return ansi.string("@|" + color + " " + kind.label() + "|@");
    }

    String toJson(RefactorReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("dryRun", report.dryRun());
        root.put("processed", report.processed());
        root.put("success", report.success());

        ArrayNode operations = root.putArray("operations");
        for (OperationRecord entry : report.operations()) {
            ObjectNode op = operations.addObject();
            op.put("kind", entry.kind().name());
            op.put("path", entry.subject() != null ? entry.subject().toString() : null);
            op.put("detail", entry.detail());
            op.put("timestamp", entry.timestamp().toString());
        }

        ArrayNode results = root.putArray("results");
        for (RenameResult result : report.results()) {
            ObjectNode node = results.addObject();
            node.put("path", result.path().toString());
            if (result.newPath() != null) {
                node.put("newPath", result.newPath().toString());
            }
            node.put("backend", result.backendUsed() != null ? result.backendUsed().name() : null);
            node.put("changes", result.changesApplied());
            node.put("success", result.success());
            if (result.error() != null) {
                ObjectNode error = node.putObject("error");
                error.put("message", result.error().message());
                error.put("attempts", result.error().attempts());
                error.put("osErrorCode", result.error().osErrorCode());
            } else {
                node.putNull("error");
            }
        }

        ArrayNode files = root.putArray("files");
        report.files().forEach(file -> files.add(file.toString()));

        ObjectNode summary = root.putObject("summary");
        report.summary().forEach((kind, count) -> summary.put(kind.name(), count));

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report", e);
        }
    }

    private PrintStream console() {
        return json ? err : out;
    }
}
