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

import java.io.PrintStream;

/**
 * ANSI-colored terminal output utilities for the refactoring CLI.
 */
public final class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner(PrintStream out) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) NTS REFACTOR " + RefactorCli.VERSION + "|@"));
        out.println("-".repeat(34));
    }

    public static void info(PrintStream out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [REFACTOR]|@ " + message));
    }

    public static void error(PrintStream out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }
}
