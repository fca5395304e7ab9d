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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception of the analysis core.
 * Carries an error code and the context the error happened in.
 *
 * <p>Usage:
 * <pre>
 * throw new ImpactException(ImpactErrorCode.SESSION_CLOSED, Map.of("session", sessionId));
 * </pre>
 */
public class ImpactException extends RuntimeException {

    private final ImpactErrorCode code;
    private final Map<String, Object> context;

    public ImpactException(ImpactErrorCode code, Map<String, Object> context) {
        super(code.getMessage());
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public ImpactErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String getMessage() {
        return code.format(context);
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
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

    /**
     * Factory: required argument is null.
     */
    public static ImpactException nullArgument(String parameter) {
        return new ImpactException(ImpactErrorCode.INVALID_INPUT, Map.of("parameter", parameter));
    }

    /**
     * Factory: input exceeds the configured size limit.
     */
    public static ImpactException tooLarge(String path, long size, long limit) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        ctx.put("size", size);
        ctx.put("limit", limit);
        return new ImpactException(ImpactErrorCode.FILE_TOO_LARGE, ctx);
    }
}
