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
package ru.nts.tools.refactor.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.refactor.core.AtomicFileWriter;
import ru.nts.tools.refactor.core.AtomicMover;
import ru.nts.tools.refactor.core.EncodingUtils;
import ru.nts.tools.refactor.core.EngineConfig;
import ru.nts.tools.refactor.core.ErrorInfo;
import ru.nts.tools.refactor.core.LockClassifier;
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.core.RetryExecutor;
import ru.nts.tools.refactor.core.treesitter.LanguageDetector;
import ru.nts.tools.refactor.rewrite.Backend;
import ru.nts.tools.refactor.rewrite.RewriteResult;
import ru.nts.tools.refactor.rewrite.RewriterChain;
import ru.nts.tools.refactor.rewrite.SymbolKind;
import ru.nts.tools.refactor.verify.CompileCheck;
import ru.nts.tools.refactor.verify.CompileVerifier;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Операции над одним файлом: обновление содержимого, переименование, замена символа.
 * <p>
 * В режиме предпросмотра ({@code dryRun}) файлы только читаются: журнал получает
 * записи WOULD_*, запись на диск и проверка компиляции не выполняются.
 * Ошибка одного файла записывается в журнал и возвращается в {@link RenameResult},
 * исключение наружу не выходит, поэтому пакет продолжает обработку остальных файлов.
 */
public final class RenameEngine {

    private static final Logger log = LoggerFactory.getLogger(RenameEngine.class);

    private final EngineConfig config;
    private final AtomicFileWriter writer;
    private final AtomicMover mover;
    private final RewriterChain rewriters;
    private final CompileVerifier verifier;
    private final RetryExecutor readRetry;

    public RenameEngine(EngineConfig config) {
        this(config, new AtomicFileWriter(config), new AtomicMover(config), new RewriterChain(),
                new CompileVerifier(config));
    }

    public RenameEngine(EngineConfig config, AtomicFileWriter writer, AtomicMover mover,
                        RewriterChain rewriters, CompileVerifier verifier) {
        this.config = config;
        this.writer = writer;
        this.mover = mover;
        this.rewriters = rewriters;
        this.verifier = verifier;
        this.readRetry = new RetryExecutor(new LockClassifier(config.platform()));
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Переименовывает символ {@code oldName} (класс с именем файла) в содержимом файла.
     * Файлы неизвестного типа обновляются буквальной заменой подстроки.
     */
    public RenameResult updateContent(Path file, String oldName, String newName, boolean dryRun, OperationLog ops) {
        return updateContent(file, oldName, newName, dryRun, true, ops);
    }

    private RenameResult updateContent(Path file, String oldName, String newName, boolean dryRun,
                                       boolean verify, OperationLog ops) {
        EncodingUtils.TextFileContent text;
        try {
            text = EncodingUtils.readTextFile(file, readRetry, config.readPolicy());
        } catch (RefactorException e) {
            return writeError(file, null, e, ops);
        }
        String lang = LanguageDetector.detect(file, text.content()).orElse(null);
        RewriteResult rewrite = rewriters.rewrite(text.content(), oldName, newName, lang, SymbolKind.CLASS, true);
        if (!rewrite.changed()) {
            ops.record(RecordKind.NO_CHANGES, file, file.getFileName() + " (no matching symbols found)");
            return RenameResult.unchanged(file, rewrite.backend());
        }

        if (!dryRun) {
            try {
                writer.write(file, rewrite.content(), text);
            } catch (RefactorException e) {
                return writeError(file, rewrite.backend(), e, ops);
            }
            if (verify) {
                compileCheck(file, lang, ops);
            }
        }
        ops.record(RecordKind.CONTENT_UPDATED, file,
                file.getFileName() + " (" + rewrite.changes() + " changes, " + rewrite.backend() + ")");
        return new RenameResult(file, true, null, rewrite.changes(), rewrite.backend(), null);
    }

    /**
     * Переименовывает файл в той же директории: новое имя без расширения + прежнее расширение.
     *
     * @param newStem       новое имя без расширения
     * @param updateContent переименовать в содержимом символ, совпадающий со старым именем файла
     */
    public RenameResult renameFile(Path file, String newStem, boolean updateContent, boolean dryRun,
                                   OperationLog ops) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            String message = "File '" + file + "' does not exist";
            ops.record(RecordKind.RENAME_ERROR, file, message);
            return RenameResult.failure(file, ErrorInfo.of(message));
        }
        String oldStem = FileSetResolver.stem(file);
        Path target = file.resolveSibling(newStem + FileSetResolver.extension(file));
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            String message = "Destination '" + target + "' already exists";
            ops.record(RecordKind.RENAME_ERROR, file, message);
            return RenameResult.failure(file, ErrorInfo.of(message));
        }

        RenameResult content = RenameResult.unchanged(file, null);
        if (updateContent) {
            content = updateContent(file, oldStem, newStem, dryRun, false, ops);
            if (!content.success()) {
                // Без нового содержимого файл не переименовываем: имя и класс внутри разошлись бы
                log.warn("Skipping rename of {}: content update failed", file);
                return content;
            }
        }

        String detail = file.getFileName() + " → " + target.getFileName();
        if (dryRun) {
            ops.record(RecordKind.WOULD_RENAME, file, detail);
            return content.withNewPath(target);
        }
        try {
            int attempts = mover.move(file, target);
            if (attempts > 1) {
                log.info("Renamed {} after {} attempts", file, attempts);
            }
        } catch (RefactorException e) {
            ErrorInfo error = ErrorInfo.of(e);
            String message = "Failed to rename " + file + " to " + target + ": " + e.getMessage()
                    + (error.attempts() > 1 ? " (attempted " + error.attempts() + " times)" : "");
            ops.record(RecordKind.RENAME_ERROR, file, message);
            return RenameResult.failure(file, content.backendUsed(), new ErrorInfo(message, error.attempts(),
                    error.osErrorCode()));
        }
        compileCheck(target, LanguageDetector.detect(target).orElse(null), ops);
        ops.record(RecordKind.RENAMED, target, detail);
        return content.withNewPath(target);
    }

    /**
     * Заменяет символ в файле с учетом синтаксиса (AST, иначе REGEX).
     */
    public RenameResult replaceSymbol(Path file, String oldSymbol, String newSymbol, SymbolKind kind,
                                      boolean dryRun, OperationLog ops) {
        EncodingUtils.TextFileContent text;
        try {
            text = EncodingUtils.readTextFile(file, readRetry, config.readPolicy());
        } catch (RefactorException e) {
            return writeError(file, null, e, ops);
        }
        String lang = LanguageDetector.detect(file, text.content()).orElse(null);
        RewriteResult rewrite = rewriters.rewrite(text.content(), oldSymbol, newSymbol, lang, kind);
        if (!rewrite.changed()) {
            log.debug("{}: no occurrences of {} ({})", file, oldSymbol, kind);
            return RenameResult.unchanged(file, rewrite.backend());
        }

        if (dryRun) {
            ops.record(RecordKind.WOULD_REPLACE, file, file + " (" + rewrite.changes() + " changes, "
                    + rewrite.backend() + ")");
        } else {
            try {
                writer.write(file, rewrite.content(), text);
            } catch (RefactorException e) {
                return writeError(file, rewrite.backend(), e, ops);
            }
            compileCheck(file, lang, ops);
            ops.record(RecordKind.REPLACED, file, file + " (" + rewrite.changes() + " changes, "
                    + rewrite.backend() + ")");
        }
        return new RenameResult(file, true, null, rewrite.changes(), rewrite.backend(), null);
    }

    private void compileCheck(Path file, String lang, OperationLog ops) {
        if (!config.checkCompile()) {
            return;
        }
        CompileCheck check = verifier.check(file, lang);
        String status = (check.ok() ? "✓ " : "✗ ") + check.message();
        log.info("{} - {}", file.getFileName(), status);
        ops.record(RecordKind.COMPILE_CHECK, file, file.getFileName() + " - " + status);
    }

    private static RenameResult writeError(Path file, Backend backend, RefactorException e, OperationLog ops) {
        ErrorInfo error = ErrorInfo.of(e);
        ops.record(RecordKind.WRITE_ERROR, file, file.getFileName() + " - " + e.getMessage());
        log.debug(e.toLogMessage());
        return RenameResult.failure(file, backend, error);
    }
}
