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
package ru.nts.tools.impact.core.impact;

import ru.nts.tools.impact.core.symbols.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Сводное влияние всех изменённых символов одного файла.
 *
 * @param filePath        анализируемый файл
 * @param changedSymbols  изменённые символы
 * @param impacts         влияние по каждому символу
 * @param totalReferences сумма ссылок по всем символам
 * @param affectedFiles   затронутые файлы без повторов, кроме самого filePath
 * @param overallSeverity максимальная серьёзность среди impacts (low, если их нет)
 */
public record FileImpact(
        String filePath,
        List<Symbol> changedSymbols,
        List<Impact> impacts,
        int totalReferences,
        List<String> affectedFiles,
        ImpactSeverity overallSeverity
) {

    public FileImpact {
        changedSymbols = List.copyOf(changedSymbols);
        impacts = List.copyOf(impacts);
        affectedFiles = List.copyOf(affectedFiles);
    }

    /**
     * Собирает итог по списку влияний.
     */
    public static FileImpact of(String filePath, List<Impact> impacts) {
        List<Symbol> changed = new ArrayList<>();
        Set<String> files = new LinkedHashSet<>();
        int total = 0;
        ImpactSeverity overall = ImpactSeverity.LOW;
        for (Impact impact : impacts) {
            changed.add(impact.changedSymbol());
            total += impact.references().size();
            files.addAll(impact.affectedFiles());
            overall = ImpactSeverity.max(overall, impact.severity());
        }
        files.remove(filePath);
        return new FileImpact(filePath, changed, impacts, total, new ArrayList<>(files), overall);
    }

    public boolean hasChanges() {
        return !impacts.isEmpty();
    }
}
