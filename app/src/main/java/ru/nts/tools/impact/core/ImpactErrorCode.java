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
package ru.nts.tools.impact.core;

import java.util.Map;

/**
 * Structured error codes for the analysis core.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example:
 * <pre>
 * [ERROR: PARSE_FAILED]
 * Message: Source could not be parsed
 * Solution: Fix the syntax error at handler.go:12:5 and retry.
 * Context: path=handler.go, line=12, column=5
 * </pre>
 */
public enum ImpactErrorCode {

    PARSE_FAILED("Source could not be parsed",
            "Fix the syntax error at %path%:%line%:%column% and retry."),

    FILE_TOO_LARGE("File too large for analysis",
            "File has %size% bytes, limit is %limit% bytes. Raise IMPACT_MAX_FILE_BYTES or skip the file."),

    INVALID_INPUT("Invalid input",
            "Parameter '%parameter%' must not be null."),

    SESSION_CLOSED("Analysis session is closed",
            "Open a new session with ImpactAnalyzer.newSession() and index the files again.");

    private final String message;
    private final String solution;

    ImpactErrorCode(String message, String solution) {
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
     * Ошибка извлечения символов из конкретного текста (а не ошибка вызова).
     * Для старой ревизии такие ошибки означают "файла не было".
     */
    public boolean isExtractionFailure() {
        return this == PARSE_FAILED || this == FILE_TOO_LARGE;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, line, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

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
            sb.append("\nContext: ");
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
