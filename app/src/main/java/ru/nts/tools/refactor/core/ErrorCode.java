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

import java.util.Map;

/**
 * Structured error codes for refactoring operations.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: FILE_LOCKED]
 * Message: File locked by another process
 * Solution: Close the file in other applications and retry, or raise REFACTOR_MAX_RETRIES.
 * Context: path=src/Main.java, attempts=4
 * </pre>
 */
public enum ErrorCode {

    // ============ Write / move errors ============

    ATOMIC_WRITE_FAILED("Atomic write failed",
            "The original file was left untouched. Check disk space and directory permissions."),

    TEMP_WRITE_FAILED("Cannot write temporary file",
            "Check free space and write permission for directory %dir%."),

    FILE_LOCKED("File locked by another process",
            "Close the file in other applications and retry, or raise REFACTOR_MAX_RETRIES."),

    FILE_READ_ONLY("File is read-only",
            "Make %path% writable before running the refactoring."),

    MOVE_FAILED("File move failed",
            "Check that source and destination are on the same filesystem."),

    SOURCE_NOT_FOUND("Source file does not exist",
            "Check file path %path%."),

    DESTINATION_EXISTS("Destination already exists",
            "Choose another name or remove %path% first. Existing files are never overwritten by a rename."),

    FILE_READ_FAILED("Cannot read file",
            "Check file permissions. Ensure the file is not locked."),

    ENCODING_ERROR("Cannot encode content",
            "Content contains characters not representable in %charset%."),

    RETRY_INTERRUPTED("Retry interrupted",
            "The operation was cancelled while waiting for a lock to clear."),

    // ============ Validation errors ============

    INVALID_ARGUMENT("Invalid argument",
            "Check command arguments. Use --help for usage."),

    DIRECTORY_NOT_FOUND("Directory not found",
            "Check directory path %path%.");

    private final String message;
    private final String solution;

    ErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, attempts, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]%n", this.name()));
        sb.append(String.format("Message: %s%n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append(String.format("%nContext: "));
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }
}
