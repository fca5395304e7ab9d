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

import ru.nts.tools.impact.core.impact.FileImpact;
import ru.nts.tools.impact.core.impact.Impact;
import ru.nts.tools.impact.core.impact.Reference;

import java.util.Locale;

/**
 * Markdown-представление межфайлового влияния.
 */
public final class ImpactReportFormatter {

    /**
     * Больше стольких ссылок список мест использования не выводится.
     */
    private static final int MAX_LISTED_REFERENCES = 10;

    private ImpactReportFormatter() {}

    public static String format(FileImpact impact) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Impact Analysis for ").append(impact.filePath()).append("\n\n");
        sb.append("**Overall Severity:** ")
                .append(impact.overallSeverity().getWireName().toUpperCase(Locale.ROOT)).append("\n");
        sb.append("**Changed Symbols:** ").append(impact.changedSymbols().size()).append("\n");
        sb.append("**Total References:** ").append(impact.totalReferences()).append("\n");
        sb.append("**Affected Files:** ").append(impact.affectedFiles().size()).append("\n\n");

        if (!impact.affectedFiles().isEmpty()) {
            sb.append("### Affected Files\n");
            for (String file : impact.affectedFiles()) {
                sb.append("- ").append(file).append("\n");
            }
            sb.append("\n");
        }

        if (!impact.impacts().isEmpty()) {
            sb.append("### Symbol Changes\n");
            for (Impact imp : impact.impacts()) {
                sb.append("\n#### ").append(imp.changedSymbol().kind().getDisplayName())
                        .append(" `").append(imp.changedSymbol().name()).append("`\n");
                sb.append("- **Severity:** ").append(imp.severity().getWireName()).append("\n");
                sb.append("- **Description:** ").append(imp.description()).append("\n");
                sb.append("- **References:** ").append(imp.references().size()).append("\n");

                int refs = imp.references().size();
                if (refs > 0 && refs <= MAX_LISTED_REFERENCES) {
                    sb.append("- **Used in:**\n");
                    for (Reference ref : imp.references()) {
                        sb.append("  - ").append(ref.filePath()).append(":").append(ref.line()).append("\n");
                    }
                }
            }
        }
        return sb.toString();
    }
}
