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
package ru.nts.tools.refactor;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import ru.nts.tools.refactor.cli.BatchCommand;
import ru.nts.tools.refactor.cli.RenameCommand;
import ru.nts.tools.refactor.cli.ReplaceCommand;

import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Точка входа командной строки.
 * <p>
 * Потоки ввода-вывода, окружение и базовая директория передаются через конструктор,
 * поэтому команды можно запускать в тестах без подмены {@code System.out}.
 */
@Command(
        name = "nts-refactor",
        mixinStandardHelpOptions = true,
        version = "nts-refactor " + RefactorCli.VERSION,
        description = "Crash-safe file rename and code-aware symbol replacement",
        subcommands = {
                RenameCommand.class,
                BatchCommand.class,
                ReplaceCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class RefactorCli implements Runnable {

    public static final String VERSION = "1.0.0";

    private final Map<String, String> env;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Path baseDir;
    private final boolean interactive;

    @Spec
    CommandSpec spec;

    public RefactorCli() {
        this(System.getenv(), System.in, System.out, System.err, Path.of(""), System.console() != null);
    }

    public RefactorCli(Map<String, String> env, InputStream in, PrintStream out, PrintStream err,
                       Path baseDir, boolean interactive) {
        this.env = env;
        this.in = in;
        this.out = out;
        this.err = err;
        this.baseDir = baseDir;
        this.interactive = interactive;
    }

    public static void main(String[] args) {
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        System.exit(commandLine(new RefactorCli()).execute(args));
    }

    /**
     * Собирает {@link CommandLine}, направляя вывод picocli в потоки приложения.
     */
    public static CommandLine commandLine(RefactorCli cli) {
        CommandLine cmd = new CommandLine(cli);
        cmd.setOut(new PrintWriter(cli.out, true));
        cmd.setErr(new PrintWriter(cli.err, true));
        return cmd;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner(out);
        // Без подкоманды показываем справку
        spec.commandLine().usage(out);
    }

    public Map<String, String> env() {
        return env;
    }

    public InputStream in() {
        return in;
    }

    public PrintStream out() {
        return out;
    }

    public PrintStream err() {
        return err;
    }

    public Path baseDir() {
        return baseDir;
    }

    public boolean interactive() {
        return interactive;
    }
}
