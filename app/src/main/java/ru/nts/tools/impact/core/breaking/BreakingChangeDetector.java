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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.impact.core.ImpactException;
import ru.nts.tools.impact.core.SymbolParseException;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolExtractor;
import ru.nts.tools.impact.core.symbols.SymbolMatcher;
import ru.nts.tools.impact.core.symbols.SymbolMatcher.MatchResult;
import ru.nts.tools.impact.core.symbols.SymbolMatcher.Pair;

import java.util.ArrayList;
import java.util.List;

/**
 * Находит несовместимые изменения API между двумя ревизиями одного файла.
 * <p>
 * Правила:
 * <ul>
 *   <li>удалённый экспортированный символ - removal (critical), либо visibility_change (critical),
 *       если в новой версии есть символ того же вида с тем же именем в другом регистре;
 *       удаление неэкспортированного символа не ломает API;</li>
 *   <li>для символа, экспортированного хотя бы в одной ревизии: сначала понижение видимости
 *       (critical, остальные проверки пропускаются), затем параметры, тип возврата и, если
 *       ничего из этого не найдено, общее изменение сигнатуры (warning);</li>
 *   <li>добавленные символы никогда не считаются ломающими.</li>
 * </ul>
 * Ошибка разбора старой версии означает, что файла раньше не было. Ошибка разбора
 * новой версии пробрасывается вызывающему.
 */
public class BreakingChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(BreakingChangeDetector.class);

    private static final String VISIBILITY_SUGGESTION =
            "This breaks all external consumers. Consider keeping it exported or deprecating first";

    private final SymbolExtractor extractor;

    public BreakingChangeDetector() {
        this(SymbolExtractor.getInstance());
    }

    public BreakingChangeDetector(SymbolExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Сравнивает две ревизии файла.
     *
     * @param oldText  прежний текст (пустая строка для нового файла)
     * @param newText  новый текст
     * @param filename имя файла, определяет язык
     * @return отчёт; без изменений - отчёт с нулевыми счётчиками
     * @throws SymbolParseException если новый текст не разбирается
     * @throws ImpactException INVALID_INPUT для null аргументов, FILE_TOO_LARGE для слишком большого нового Go-текста
     */
    public BreakingChangeReport detectBreakingChanges(String oldText, String newText, String filename) {
        if (oldText == null) throw ImpactException.nullArgument("oldText");
        if (newText == null) throw ImpactException.nullArgument("newText");
        if (filename == null) throw ImpactException.nullArgument("filename");

        List<Symbol> oldSymbols = extractOld(oldText, filename);
        List<Symbol> newSymbols = extractor.extract(filename, newText);

        MatchResult match = SymbolMatcher.match(oldSymbols, newSymbols);
        List<BreakingChange> changes = new ArrayList<>();

        for (Symbol removed : match.removed()) {
            if (removed.exported()) {
                changes.add(removedOrRenamed(removed, newSymbols, filename));
            }
        }

        for (Pair pair : match.matched()) {
            compare(pair.oldSymbol(), pair.newSymbol(), filename, changes);
        }

        BreakingChangeReport report = new BreakingChangeReport(filename, changes);
        log.debug("{}: {} old / {} new symbols, {}", filename, oldSymbols.size(), newSymbols.size(), report.summary());
        return report;
    }

    private List<Symbol> extractOld(String oldText, String filename) {
        try {
            return extractor.extract(filename, oldText);
        } catch (ImpactException e) {
            if (!e.getCode().isExtractionFailure()) {
                throw e;
            }
            // Старая версия не разбирается - считаем файл новым
            log.debug("Old revision of {} is unparsable, treating as new file: {}", filename, e.toLogMessage());
            return List.of();
        }
    }

    private BreakingChange removedOrRenamed(Symbol oldSym, List<Symbol> newSymbols, String filename) {
        for (Symbol candidate : newSymbols) {
            if (candidate.kind() == oldSym.kind()
                    && candidate.parent().equals(oldSym.parent())
                    && !candidate.name().equals(oldSym.name())
                    && candidate.name().equalsIgnoreCase(oldSym.name())) {
                return new BreakingChange(BreakingChangeType.VISIBILITY_CHANGE, candidate,
                        "exported", "unexported", filename, candidate.startLine(), BreakingSeverity.CRITICAL,
                        String.format("%s '%s' changed from exported to unexported (renamed to '%s')",
                                oldSym.kind(), oldSym.name(), candidate.name()),
                        VISIBILITY_SUGGESTION);
            }
        }
        return new BreakingChange(BreakingChangeType.REMOVAL, oldSym,
                oldSym.signature(), "", filename, oldSym.startLine(), BreakingSeverity.CRITICAL,
                String.format("Exported %s '%s' was removed", oldSym.kind(), oldSym.name()),
                "If this removal is intentional, consider deprecating first or updating documentation");
    }

    private void compare(Symbol oldSym, Symbol newSym, String filename, List<BreakingChange> out) {
        if (!oldSym.exported() && !newSym.exported()) {
            return;
        }

        if (oldSym.exported() && !newSym.exported()) {
            out.add(new BreakingChange(BreakingChangeType.VISIBILITY_CHANGE, newSym,
                    "exported", "unexported", filename, newSym.startLine(), BreakingSeverity.CRITICAL,
                    String.format("%s '%s' changed from exported to unexported", newSym.kind(), newSym.name()),
                    VISIBILITY_SUGGESTION));
            return;
        }

        boolean paramChanged = detectParameterChanges(oldSym, newSym, filename, out);

        boolean returnChanged = false;
        if (!oldSym.returnType().equals(newSym.returnType())
                && !oldSym.returnType().isEmpty() && !newSym.returnType().isEmpty()) {
            returnChanged = true;
            out.add(new BreakingChange(BreakingChangeType.RETURN_TYPE_CHANGE, newSym,
                    oldSym.returnType(), newSym.returnType(), filename, newSym.startLine(), BreakingSeverity.ERROR,
                    String.format("%s '%s' return type changed from '%s' to '%s'",
                            newSym.kind(), newSym.name(), oldSym.returnType(), newSym.returnType()),
                    "Consider if this change is backward compatible or create a new function"));
        }

        if (!paramChanged && !returnChanged
                && !oldSym.signature().isEmpty() && !newSym.signature().isEmpty()
                && !oldSym.signature().equals(newSym.signature())) {
            out.add(new BreakingChange(BreakingChangeType.SIGNATURE_CHANGE, newSym,
                    oldSym.signature(), newSym.signature(), filename, newSym.startLine(), BreakingSeverity.WARNING,
                    String.format("%s '%s' signature changed", newSym.kind(), newSym.name()),
                    "Review if this change affects callers"));
        }
    }

    /**
     * Сравнивает списки параметров. Возвращает true, если найдено хотя бы одно изменение.
     */
    private boolean detectParameterChanges(Symbol oldSym, Symbol newSym, String filename, List<BreakingChange> out) {
        List<String> oldParams = oldSym.parameters();
        List<String> newParams = newSym.parameters();
        int before = out.size();

        if (newParams.size() > oldParams.size()) {
            out.add(new BreakingChange(BreakingChangeType.REQUIRED_PARAMETER, newSym,
                    oldParams.size() + " parameters", newParams.size() + " parameters",
                    filename, newSym.startLine(), BreakingSeverity.ERROR,
                    String.format("%s '%s' added %d required parameter(s)",
                            newSym.kind(), newSym.name(), newParams.size() - oldParams.size()),
                    "Consider making new parameters optional or provide a new overload"));
        } else if (newParams.size() < oldParams.size()) {
            out.add(new BreakingChange(BreakingChangeType.PARAMETER_CHANGE, newSym,
                    oldParams.size() + " parameters", newParams.size() + " parameters",
                    filename, newSym.startLine(), BreakingSeverity.WARNING,
                    String.format("%s '%s' removed %d parameter(s)",
                            newSym.kind(), newSym.name(), oldParams.size() - newParams.size()),
                    "Verify callers don't rely on removed parameters"));
        }

        int common = Math.min(oldParams.size(), newParams.size());
        for (int i = 0; i < common; i++) {
            if (!oldParams.get(i).equals(newParams.get(i))) {
                out.add(new BreakingChange(BreakingChangeType.PARAMETER_CHANGE, newSym,
                        oldParams.get(i), newParams.get(i), filename, newSym.startLine(), BreakingSeverity.ERROR,
                        String.format("%s '%s' parameter %d changed from '%s' to '%s'",
                                newSym.kind(), newSym.name(), i + 1, oldParams.get(i), newParams.get(i)),
                        "Consider if this change is backward compatible"));
            }
        }
        return out.size() > before;
    }
}
