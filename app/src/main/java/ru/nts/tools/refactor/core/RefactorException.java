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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for refactoring tools.
 * Provides structured error reporting with error codes and context.
 *
 * <p>Usage:
 * <pre>
 * throw new RefactorException(ErrorCode.DIRECTORY_NOT_FOUND, "Directory 'src' does not exist",
 *         Map.of("path", "src"));
 * </pre>
 */
public class RefactorException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public RefactorException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public RefactorException(ErrorCode code, String message, Map<String, Object> context) {
        this(code, message, context, null);
    }

    public RefactorException(ErrorCode code, String message, Map<String, Object> context, Throwable cause) {
        super(message != null ? message : code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Returns a formatted multi-line message with a solution hint.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
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
