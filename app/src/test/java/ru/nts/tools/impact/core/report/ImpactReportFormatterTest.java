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

import org.junit.jupiter.api.Test;
import ru.nts.tools.impact.core.impact.FileImpact;
import ru.nts.tools.impact.core.impact.Impact;
import ru.nts.tools.impact.core.impact.ImpactSeverity;
import ru.nts.tools.impact.core.impact.Reference;
import ru.nts.tools.impact.core.impact.SymbolChange;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolKind;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImpactReportFormatterTest {

    private static final Symbol NEW_USER = Symbol.of("NewUser", SymbolKind.FUNCTION, "user.go", 8, 10, true);

    private static List<Reference> references(int count) {
        List<Reference> refs = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            refs.add(new Reference("handler.go", i, "NewUser()"));
        }
        return refs;
    }

    private static FileImpact impactWith(int referenceCount) {
        Impact impact = new Impact(NEW_USER, SymbolChange.REMOVED, List.of("handler.go"), List.of(),
                references(referenceCount), ImpactSeverity.CRITICAL,
                "Symbol 'NewUser' was removed (was exported/public)");
        return FileImpact.of("user.go", List.of(impact));
    }

    @Test
    void testHeaderAndAffectedFiles() {
        String text = ImpactReportFormatter.format(impactWith(2));

        assertTrue(text.startsWith("## Impact Analysis for user.go\n\n"));
        assertTrue(text.contains("**Overall Severity:** CRITICAL\n"));
        assertTrue(text.contains("**Changed Symbols:** 1\n"));
        assertTrue(text.contains("**Total References:** 2\n"));
        assertTrue(text.contains("### Affected Files\n- handler.go\n"));
        assertTrue(text.contains("#### function `NewUser`\n"));
        assertTrue(text.contains("- **Severity:** critical\n"));
        assertTrue(text.contains("- **Used in:**\n  - handler.go:1\n  - handler.go:2\n"));
    }

    @Test
    void testLongReferenceListIsOmitted() {
        String text = ImpactReportFormatter.format(impactWith(11));
        assertTrue(text.contains("- **References:** 11\n"));
        assertFalse(text.contains("Used in"));
    }

    @Test
    void testEmptyImpact() {
        String text = ImpactReportFormatter.format(FileImpact.of("user.go", List.of()));
        assertTrue(text.contains("**Overall Severity:** LOW\n"));
        assertFalse(text.contains("### Affected Files"));
        assertFalse(text.contains("### Symbol Changes"));
    }
}
