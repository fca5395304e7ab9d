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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for source that the native parser rejected.
 */
public class SymbolParseException extends ImpactException {

    private final int line;
    private final int column;

    public SymbolParseException(String path, int line, int column, String detail) {
        super(ImpactErrorCode.PARSE_FAILED, context(path, line, column, detail));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static Map<String, Object> context(String path, int line, int column, String detail) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        ctx.put("line", line);
        ctx.put("column", column);
        ctx.put("detail", detail);
        return ctx;
    }
}
