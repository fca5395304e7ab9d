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
package ru.nts.tools.impact.core.symbols;

/**
 * Виды символов, которые умеют извлекать парсеры.
 */
public enum SymbolKind {
    FUNCTION("function"),
    METHOD("method"),
    CLASS("class"),
    INTERFACE("interface"),
    STRUCT("struct"),
    VARIABLE("variable"),
    CONSTANT("constant"),
    TYPE("type"),
    IMPORT("import");

    private final String displayName;

    SymbolKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
