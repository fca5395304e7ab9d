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
package ru.nts.tools.impact.core.breaking;

import ru.nts.tools.impact.core.symbols.Symbol;

/**
 * Одно обнаруженное несовместимое изменение.
 *
 * @param type        тип изменения
 * @param symbol      затронутый символ (для удаления - старая версия, иначе новая)
 * @param oldValue    прежнее значение, может быть пустым
 * @param newValue    новое значение, может быть пустым
 * @param filePath    файл
 * @param line        строка символа (1-based)
 * @param severity    серьёзность
 * @param description описание для человека
 * @param suggestion  рекомендация, может быть пустой
 */
public record BreakingChange(
        BreakingChangeType type,
        Symbol symbol,
        String oldValue,
        String newValue,
        String filePath,
        int line,
        BreakingSeverity severity,
        String description,
        String suggestion
) {

    public BreakingChange {
        oldValue = oldValue == null ? "" : oldValue;
        newValue = newValue == null ? "" : newValue;
        filePath = filePath == null ? "" : filePath;
        description = description == null ? "" : description;
        suggestion = suggestion == null ? "" : suggestion;
    }

    public boolean isBreaking() {
        return severity.isBreaking();
    }
}
