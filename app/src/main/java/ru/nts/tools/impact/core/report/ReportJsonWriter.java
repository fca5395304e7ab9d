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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.impact.core.breaking.BreakingChange;
import ru.nts.tools.impact.core.breaking.BreakingChangeReport;
import ru.nts.tools.impact.core.impact.FileImpact;
import ru.nts.tools.impact.core.impact.Impact;
import ru.nts.tools.impact.core.impact.Reference;
import ru.nts.tools.impact.core.symbols.Symbol;

/**
 * JSON-представление отчётов для внешних потребителей.
 * Имена полей в snake_case, значения перечислений в нижнем регистре;
 * пустые необязательные строки и списки не выводятся.
 */
public final class ReportJsonWriter {

    private static final ObjectMapper mapper = new ObjectMapper();

    private ReportJsonWriter() {}

    public static String write(BreakingChangeReport report) {
        return toJson(report).toPrettyString();
    }

    public static String write(FileImpact impact) {
        return toJson(impact).toPrettyString();
    }

    public static ObjectNode toJson(BreakingChangeReport report) {
        ObjectNode node = mapper.createObjectNode();
        node.put("file_name", report.fileName());
        node.put("total_changes", report.totalChanges());
        node.put("critical_count", report.criticalCount());
        node.put("error_count", report.errorCount());
        node.put("warning_count", report.warningCount());
        ArrayNode changes = node.putArray("changes");
        for (BreakingChange change : report.changes()) {
            changes.add(toJson(change));
        }
        node.put("summary", report.summary());
        node.put("has_breaking", report.hasBreaking());
        return node;
    }

    public static ObjectNode toJson(BreakingChange change) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", change.type().getWireName());
        node.set("symbol", toJson(change.symbol()));
        putIfNotEmpty(node, "old_value", change.oldValue());
        putIfNotEmpty(node, "new_value", change.newValue());
        node.put("file_path", change.filePath());
        node.put("line", change.line());
        node.put("severity", change.severity().getWireName());
        node.put("description", change.description());
        putIfNotEmpty(node, "suggestion", change.suggestion());
        return node;
    }

    public static ObjectNode toJson(FileImpact impact) {
        ObjectNode node = mapper.createObjectNode();
        node.put("file_path", impact.filePath());
        ArrayNode changed = node.putArray("changed_symbols");
        for (Symbol symbol : impact.changedSymbols()) {
            changed.add(toJson(symbol));
        }
        ArrayNode impacts = node.putArray("impacts");
        for (Impact imp : impact.impacts()) {
            impacts.add(toJson(imp));
        }
        node.put("total_references", impact.totalReferences());
        ArrayNode files = node.putArray("affected_files");
        impact.affectedFiles().forEach(files::add);
        node.put("overall_severity", impact.overallSeverity().getWireName());
        return node;
    }

    public static ObjectNode toJson(Impact impact) {
        ObjectNode node = mapper.createObjectNode();
        node.set("changed_symbol", toJson(impact.changedSymbol()));
        node.put("change", impact.change().getWireName());
        ArrayNode files = node.putArray("affected_files");
        impact.affectedFiles().forEach(files::add);
        ArrayNode symbols = node.putArray("affected_symbols");
        for (Symbol symbol : impact.affectedSymbols()) {
            symbols.add(toJson(symbol));
        }
        ArrayNode refs = node.putArray("references");
        for (Reference ref : impact.references()) {
            ObjectNode r = refs.addObject();
            r.put("file_path", ref.filePath());
            r.put("line", ref.line());
            r.put("context", ref.context());
        }
        node.put("severity", impact.severity().getWireName());
        node.put("description", impact.description());
        return node;
    }

    public static ObjectNode toJson(Symbol symbol) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", symbol.name());
        node.put("kind", symbol.kind().getDisplayName());
        node.put("start_line", symbol.startLine());
        node.put("end_line", symbol.endLine());
        putIfNotEmpty(node, "signature", symbol.signature());
        node.put("exported", symbol.exported());
        if (!symbol.parameters().isEmpty()) {
            ArrayNode params = node.putArray("parameters");
            symbol.parameters().forEach(params::add);
        }
        putIfNotEmpty(node, "return_type", symbol.returnType());
        putIfNotEmpty(node, "parent", symbol.parent());
        node.put("file_path", symbol.filePath());
        return node;
    }

    private static void putIfNotEmpty(ObjectNode node, String field, String value) {
        if (value != null && !value.isEmpty()) {
            node.put(field, value);
        }
    }
}
