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

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import ru.nts.tools.refactor.core.EngineConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Опции, общие для всех подкоманд. Подключаются через {@code @Mixin}.
 * <p>
 * Явно заданные флаги перекрывают переменные окружения, а те перекрывают значения по умолчанию.
 */
public class CommonOptions {

    @Option(names = "--dry-run", description = "Show what would change without touching any file")
    boolean dryRun;

    @Option(names = {"-y", "--yes"}, description = "Skip the confirmation prompt")
    boolean yes;

    @Option(names = "--json", description = "Print the report as JSON on stdout")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output (DEBUG logging)")
    boolean verbose;

    @Option(names = "--no-check-compile", description = "Do not verify changed files after writing")
    boolean noCheckCompile;

    @Option(names = "--max-retries", paramLabel = "N",
            description = "Retries when a file is locked (default: $REFACTOR_MAX_RETRIES or 3)")
    Integer maxRetries;

    @Option(names = "--retry-delay", paramLabel = "SECONDS",
            description = "Pause between retries in seconds (default: $REFACTOR_RETRY_DELAY or 0.1)")
    Double retryDelay;

    @Option(names = "--workers", paramLabel = "N",
            description = "Parallel workers for multi-file operations (default: $REFACTOR_WORKERS or 1)")
    Integer workers;

    /**
     * Собирает конфигурацию движка.
     *
     * @throws IllegalArgumentException если значение флага вне допустимого диапазона
     */
    public EngineConfig toConfig(Map<String, String> env) {
        EngineConfig.Builder builder = EngineConfig.fromEnvironment(env);
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        if (retryDelay != null) {
            if (retryDelay < 0 || retryDelay.isNaN()) {
                throw new IllegalArgumentException("--retry-delay must be >= 0, got " + retryDelay);
            }
            builder.retryDelay(Duration.ofMillis(Math.round(retryDelay * 1000)));
        }
        if (workers != null) {
            builder.workers(workers);
        }
        if (noCheckCompile) {
            builder.checkCompile(false);
        }
        if (verbose) {
            builder.logLevel("DEBUG");
        }
        return builder.build();
    }

    /**
     * Применяет уровень логирования к корневому логгеру Logback.
     */
    public static void applyLogLevel(EngineConfig config) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(config.logLevel(), Level.INFO));
        }
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean yes() {
        return yes;
    }

    public boolean json() {
        return json;
    }

    public boolean verbose() {
        return verbose;
    }
}
