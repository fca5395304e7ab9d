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

import java.util.ArrayList;
import java.util.List;

/**
 * Итог проверки одного файла. Счётчики и сводка вычисляются из списка изменений.
 *
 * @param fileName файл
 * @param changes  изменения в порядке обнаружения
 */
public record BreakingChangeReport(String fileName, List<BreakingChange> changes) {

    public BreakingChangeReport {
        fileName = fileName == null ? "" : fileName;
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public int totalChanges() {
        return changes.size();
    }

    public int criticalCount() {
        return count(BreakingSeverity.CRITICAL);
    }

    public int errorCount() {
        return count(BreakingSeverity.ERROR);
    }

    public int warningCount() {
        return count(BreakingSeverity.WARNING);
    }

    public int count(BreakingSeverity severity) {
        int n = 0;
        for (BreakingChange change : changes) {
            if (change.severity() == severity) n++;
        }
        return n;
    }

    /**
     * Есть ли изменения уровня error или critical. Одни предупреждения не считаются.
     */
    public boolean hasBreaking() {
        return criticalCount() > 0 || errorCount() > 0;
    }

    public boolean isBreaking() {
        return hasBreaking();
    }

    /**
     * Только ломающие изменения (critical и error) в исходном порядке.
     */
    public List<BreakingChange> breakingChanges() {
        List<BreakingChange> result = new ArrayList<>();
        for (BreakingChange change : changes) {
            if (change.isBreaking()) result.add(change);
        }
        return result;
    }

    public List<BreakingChange> changesWithSeverity(BreakingSeverity severity) {
        List<BreakingChange> result = new ArrayList<>();
        for (BreakingChange change : changes) {
            if (change.severity() == severity) result.add(change);
        }
        return result;
    }

    /**
     * "Found N breaking changes: X critical, Y error, Z warning" без нулевых групп.
     */
    public String summary() {
        if (changes.isEmpty()) {
            return "No breaking changes detected";
        }
        List<String> parts = new ArrayList<>();
        if (criticalCount() > 0) parts.add(criticalCount() + " critical");
        if (errorCount() > 0) parts.add(errorCount() + " error");
        if (warningCount() > 0) parts.add(warningCount() + " warning");
        return "Found " + totalChanges() + " breaking changes: " + String.join(", ", parts);
    }
}
