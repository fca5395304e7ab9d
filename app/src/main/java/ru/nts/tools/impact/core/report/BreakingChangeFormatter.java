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
package ru.nts.tools.impact.core.report;

import ru.nts.tools.impact.core.breaking.BreakingChange;
import ru.nts.tools.impact.core.breaking.BreakingChangeReport;
import ru.nts.tools.impact.core.breaking.BreakingSeverity;

/**
 * Markdown-представление отчёта о несовместимых изменениях для комментария к PR.
 * Изменения сгруппированы: critical, затем error, затем warning.
 */
public final class BreakingChangeFormatter {

    private BreakingChangeFormatter() {}

    /**
     * @return markdown или пустая строка, если нет ни ломающих изменений, ни предупреждений
     */
    public static String format(BreakingChangeReport report) {
        if (!report.hasBreaking() && report.warningCount() == 0) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("## ⚠️ Breaking Change Analysis\n\n");
        sb.append("**File:** `").append(report.fileName()).append("`\n");
        sb.append("**Summary:** ").append(report.summary()).append("\n\n");

        appendSection(sb, report, BreakingSeverity.CRITICAL, "### 🔴 Critical Breaking Changes\n\n");
        appendSection(sb, report, BreakingSeverity.ERROR, "### 🟠 Error-Level Breaking Changes\n\n");
        appendSection(sb, report, BreakingSeverity.WARNING, "### 🟡 Warnings\n\n");
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, BreakingChangeReport report,
                                      BreakingSeverity severity, String header) {
        if (report.count(severity) == 0) return;
        sb.append(header);
        for (BreakingChange change : report.changesWithSeverity(severity)) {
            sb.append(formatChange(change));
        }
    }

    static String formatChange(BreakingChange change) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(change.type().getWireName()).append("** `")
                .append(change.symbol().name()).append("` (line ").append(change.line()).append(")\n");
        sb.append("- ").append(change.description()).append("\n");
        if (!change.oldValue().isEmpty() && !change.newValue().isEmpty()) {
            sb.append("- Changed: `").append(change.oldValue()).append("` → `").append(change.newValue()).append("`\n");
        }
        if (!change.suggestion().isEmpty()) {
            sb.append("- 💡 ").append(change.suggestion()).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }
}
