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
package ru.nts.tools.refactor.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Запуск внешних команд (компиляторы, проверки синтаксиса) с жестким таймаутом.
 * <p>
 * Команда запускается напрямую через ProcessBuilder, без shell.
 * stdout и stderr объединяются; читается не больше {@link #MAX_OUTPUT_LINES} строк.
 * По истечении таймаута процесс принудительно убивается, в фоне он не остается.
 */
public final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /**
     * Максимальное количество строк вывода, сохраняемое в памяти для одной команды.
     */
    static final int MAX_OUTPUT_LINES = 1000;

    private ProcessRunner() {
    }

    /**
     * Результат выполнения внешней команды.
     *
     * @param exitCode Код выхода процесса (-1 при таймауте).
     * @param output   Текстовый вывод (stdout + stderr).
     * @param timedOut true, если процесс был убит по таймауту.
     */
    public record Result(int exitCode, String output, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Выполняет команду и ждет ее завершения не дольше {@code timeout}.
     *
     * @param command   аргументы команды, первый элемент - исполняемый файл
     * @param directory рабочая директория (null - текущая)
     * @param timeout   максимальное время выполнения
     * @throws IOException          исполняемый файл не найден или не запускается
     * @throws InterruptedException поток прерван во время ожидания (процесс при этом убит)
     */
    public static Result run(List<String> command, Path directory, Duration timeout)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (directory != null) {
            pb.directory(directory.toFile());
        }
        pb.redirectErrorStream(true);

        log.debug("Running {} (timeout {} ms)", command, timeout.toMillis());
        Process process = pb.start();
        StringBuilder output = new StringBuilder();

        Thread reader = new Thread(() -> drain(process, output), "process-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                log.debug("{} killed after timeout of {} ms", command.get(0), timeout.toMillis());
                return new Result(-1, snapshot(output), true);
            }
            // Дочитываем хвост вывода после завершения процесса
            reader.join(1000);
            return new Result(process.exitValue(), snapshot(output), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static void drain(Process process, StringBuilder output) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int linesRead = 0;
            while ((line = in.readLine()) != null) {
                synchronized (output) {
                    if (linesRead < MAX_OUTPUT_LINES) {
                        output.append(line).append('\n');
                    } else if (linesRead == MAX_OUTPUT_LINES) {
                        output.append("... [Output truncated due to limit] ...\n");
                    }
                    linesRead++;
                }
            }
        } catch (IOException e) {
            // Поток закрывается при принудительном завершении процесса
            log.trace("Process output stream closed: {}", e.getMessage());
        }
    }

    private static String snapshot(StringBuilder output) {
        synchronized (output) {
            return output.toString();
        }
    }
}
