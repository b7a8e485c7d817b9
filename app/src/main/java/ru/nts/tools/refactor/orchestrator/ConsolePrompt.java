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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Подтверждение через консоль.
 * Подтверждается автоматически при {@code --yes} и при запуске без терминала (CI, пайпы).
 * Иначе принимаются ответы {@code y}/{@code yes}; {@code n}, {@code no}, пустой ответ и конец ввода - отказ.
 */
public final class ConsolePrompt implements ConfirmationPrompt {

    private final BufferedReader in;
    private final PrintStream out;
    private final boolean autoYes;
    private final boolean interactive;

    public ConsolePrompt(boolean autoYes) {
        this(System.in, System.err, autoYes, System.console() != null);
    }

    public ConsolePrompt(InputStream in, PrintStream out, boolean autoYes, boolean interactive) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.autoYes = autoYes;
        this.interactive = interactive;
    }

    @Override
    public boolean confirm(String question) {
        if (autoYes) {
            out.println(question + " [y/N]: y (auto-confirmed)");
            return true;
        }
        if (!interactive) {
            out.println(question + " [y/N]: y (auto-confirmed in non-interactive mode)");
            return true;
        }
        try {
            while (true) {
                out.print(question + " [y/N]: ");
                out.flush();
                String line = in.readLine();
                if (line == null) {
                    out.println();
                    return false;
                }
                String answer = line.trim().toLowerCase(Locale.ROOT);
                if (answer.equals("y") || answer.equals("yes")) {
                    return true;
                }
                if (answer.isEmpty() || answer.equals("n") || answer.equals("no")) {
                    return false;
                }
            }
        } catch (IOException e) {
            out.println();
            return false;
        }
    }
}
