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
package ru.nts.tools.refactor.verify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.refactor.core.EncodingUtils;
import ru.nts.tools.refactor.core.EngineConfig;
import ru.nts.tools.refactor.core.FileUtils;
import ru.nts.tools.refactor.core.ProcessRunner;
import ru.nts.tools.refactor.core.RefactorException;
import ru.nts.tools.refactor.core.treesitter.LanguageDetector;
import ru.nts.tools.refactor.core.treesitter.SyntaxChecker;
import ru.nts.tools.refactor.core.treesitter.TreeSitterManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Рекомендательная проверка того, что файл после изменения компилируется.
 * <p>
 * Никогда не выбрасывает исключений: любая проблема превращается в {@link CompileCheck}
 * с сообщением "Cannot check - ...". Результат не влияет на успешность самой операции.
 * <ul>
 *   <li>java - {@code javac} во временную директорию, артефакты удаляются;</li>
 *   <li>python - разбор tree-sitter в процессе;</li>
 *   <li>javascript - {@code node --check}, typescript - {@code tsc --noEmit}.</li>
 * </ul>
 */
public final class CompileVerifier {

    private static final Logger log = LoggerFactory.getLogger(CompileVerifier.class);

    static final long MAX_FILE_SIZE = 10L * 1024 * 1024;
    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    static final Duration NODE_TIMEOUT = Duration.ofSeconds(15);
    static final Duration TSC_TIMEOUT = Duration.ofSeconds(20);

    private final Duration compileTimeout;

    public CompileVerifier(EngineConfig config) {
        this(config.compileTimeout());
    }

    public CompileVerifier(Duration compileTimeout) {
        this.compileTimeout = compileTimeout;
    }

    /**
     * Проверяет файл, определяя язык по расширению.
     */
    public CompileCheck check(Path path) {
        return check(path, null);
    }

    /**
     * @param language идентификатор языка или null для автоопределения
     */
    public CompileCheck check(Path path, String language) {
        try {
            CompileCheck result = doCheck(path, language);
            log.debug("Compile check of {}: {}", path, result.message());
            return result;
        } catch (RuntimeException e) {
            log.debug("Compile check of {} failed unexpectedly", path, e);
            return CompileCheck.cannotCheck("internal error");
        }
    }

    private CompileCheck doCheck(Path path, String language) {
        if (path == null || !Files.isRegularFile(path)) {
            return CompileCheck.cannotCheck("file not found");
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            return CompileCheck.cannotCheck("size unknown");
        }
        if (size > MAX_FILE_SIZE) {
            return CompileCheck.cannotCheck("file too large");
        }
        if (size == 0) {
            return CompileCheck.cannotCheck("empty file");
        }

        String lang = language != null ? language : LanguageDetector.detect(path).orElse(null);
        if (lang == null) {
            return CompileCheck.cannotCheck("unknown language");
        }
        return switch (lang) {
            case LanguageDetector.JAVA -> checkJava(path);
            case LanguageDetector.JAVASCRIPT -> checkExternal(path, "node",
                    List.of("node", "--check", path.toString()), NODE_TIMEOUT);
            case LanguageDetector.TYPESCRIPT -> checkExternal(path, "tsc",
                    List.of("tsc", "--noEmit", path.toString()), TSC_TIMEOUT);
            default -> TreeSitterManager.getInstance().hasGrammar(lang)
                    ? checkSyntax(path, lang)
                    : CompileCheck.cannotCheck("unsupported language");
        };
    }

    private CompileCheck checkSyntax(Path path, String lang) {
        String content;
        try {
            content = EncodingUtils.decode(path, Files.readAllBytes(path)).content();
        } catch (IOException e) {
            return CompileCheck.cannotCheck("file unreadable");
        } catch (RefactorException e) {
            return CompileCheck.cannotCheck("encoding issue");
        }
        if (content.isBlank()) {
            return CompileCheck.cannotCheck("empty file");
        }
        SyntaxChecker.SyntaxCheckResult result = SyntaxChecker.checkContent(content, lang);
        if (result.hasErrors()) {
            return CompileCheck.failed("Syntax Error (line " + result.errors().get(0).line() + ")");
        }
        return CompileCheck.compiles();
    }

    private CompileCheck checkJava(Path path) {
        if (!probe("javac", List.of("javac", "-version"))) {
            return CompileCheck.cannotCheck("javac unavailable");
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        Path strayClass = path.resolveSibling((dot > 0 ? name.substring(0, dot) : name) + ".class");
        boolean classExisted = Files.exists(strayClass);
        Path outDir = null;
        try {
            outDir = Files.createTempDirectory("refactor-javac-");
            ProcessRunner.Result result = ProcessRunner.run(
                    List.of("javac", "-d", outDir.toString(), "-cp", ".", path.toString()), null, compileTimeout);
            if (result.timedOut()) {
                return CompileCheck.cannotCheck("compile timeout");
            }
            if (result.exitCode() != 0) {
                log.debug("javac output for {}:\n{}", path, result.output());
                return CompileCheck.failed("Compile Error");
            }
            return CompileCheck.compiles();
        } catch (IOException e) {
            return CompileCheck.cannotCheck("javac not found");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompileCheck.cannotCheck("interrupted");
        } finally {
            deleteTree(outDir);
            // .class рядом с исходником, появившийся во время проверки, - мусор проверки
            if (!classExisted) {
                FileUtils.deleteQuietly(strayClass);
            }
        }
    }

    private CompileCheck checkExternal(Path path, String tool, List<String> command, Duration timeout) {
        if (!probe(tool, List.of(tool, "--version"))) {
            return CompileCheck.cannotCheck(tool + " unavailable");
        }
        try {
            ProcessRunner.Result result = ProcessRunner.run(command, null, timeout);
            if (result.timedOut()) {
                return CompileCheck.cannotCheck("timeout");
            }
            if (result.exitCode() != 0) {
                log.debug("{} output for {}:\n{}", tool, path, result.output());
                return CompileCheck.failed("Syntax Error");
            }
            return CompileCheck.compiles();
        } catch (IOException e) {
            return CompileCheck.cannotCheck("compiler not found");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompileCheck.cannotCheck("interrupted");
        }
    }

    private static boolean probe(String tool, List<String> command) {
        try {
            return ProcessRunner.run(command, null, PROBE_TIMEOUT).succeeded();
        } catch (IOException e) {
            log.debug("{} is not available: {}", tool, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void deleteTree(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(FileUtils::deleteQuietly);
        } catch (IOException e) {
            log.debug("Cannot clean up {}: {}", dir, e.getMessage());
        }
    }
}
