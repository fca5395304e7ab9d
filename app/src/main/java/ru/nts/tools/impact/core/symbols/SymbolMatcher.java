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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Сопоставляет символы двух ревизий одного файла.
 * <p>
 * Символы группируются по {@link SymbolKey}. Если в группе по одному символу
 * с каждой стороны, они образуют пару. Перегрузки (несколько символов с одним ключом)
 * сопоставляются по порядку предпочтения:
 * <ol>
 *   <li>совпадающий список параметров;</li>
 *   <li>совпадающее число параметров;</li>
 *   <li>оставшиеся в порядке объявления.</li>
 * </ol>
 * Несопоставленные старые символы считаются удалёнными, новые - добавленными.
 */
public final class SymbolMatcher {

    private SymbolMatcher() {}

    /**
     * Пара символов, признанных одним объявлением.
     */
    public record Pair(Symbol oldSymbol, Symbol newSymbol) {}

    /**
     * Результат сопоставления. Порядок детерминирован: пары и удалённые в порядке
     * старой ревизии, добавленные в порядке новой.
     */
    public record MatchResult(List<Pair> matched, List<Symbol> removed, List<Symbol> added) {
        public MatchResult {
            matched = List.copyOf(matched);
            removed = List.copyOf(removed);
            added = List.copyOf(added);
        }
    }

    public static MatchResult match(List<Symbol> oldSymbols, List<Symbol> newSymbols) {
        Map<SymbolKey, List<Symbol>> oldByKey = groupByKey(oldSymbols);
        Map<SymbolKey, List<Symbol>> newByKey = groupByKey(newSymbols);

        List<Pair> matched = new ArrayList<>();
        List<Symbol> removed = new ArrayList<>();
        List<Symbol> added = new ArrayList<>();

        for (Map.Entry<SymbolKey, List<Symbol>> entry : oldByKey.entrySet()) {
            List<Symbol> olds = entry.getValue();
            List<Symbol> news = newByKey.getOrDefault(entry.getKey(), List.of());
            matchGroup(olds, news, matched, removed, added);
        }

        for (Map.Entry<SymbolKey, List<Symbol>> entry : newByKey.entrySet()) {
            if (!oldByKey.containsKey(entry.getKey())) {
                added.addAll(entry.getValue());
            }
        }

        return new MatchResult(matched, removed, added);
    }

    private static void matchGroup(List<Symbol> olds, List<Symbol> news,
                                   List<Pair> matched, List<Symbol> removed, List<Symbol> added) {
        if (olds.size() == 1 && news.size() == 1) {
            matched.add(new Pair(olds.get(0), news.get(0)));
            return;
        }

        Symbol[] pairedNew = new Symbol[olds.size()];
        boolean[] newUsed = new boolean[news.size()];

        // 1. Одинаковые списки параметров
        for (int i = 0; i < olds.size(); i++) {
            int j = findUnused(news, newUsed, olds.get(i), true);
            if (j >= 0) {
                pairedNew[i] = news.get(j);
                newUsed[j] = true;
            }
        }
        // 2. Одинаковая арность
        for (int i = 0; i < olds.size(); i++) {
            if (pairedNew[i] != null) continue;
            int j = findUnused(news, newUsed, olds.get(i), false);
            if (j >= 0) {
                pairedNew[i] = news.get(j);
                newUsed[j] = true;
            }
        }
        // 3. По порядку объявления
        int next = 0;
        for (int i = 0; i < olds.size(); i++) {
            if (pairedNew[i] != null) continue;
            while (next < news.size() && newUsed[next]) next++;
            if (next < news.size()) {
                pairedNew[i] = news.get(next);
                newUsed[next] = true;
            }
        }

        for (int i = 0; i < olds.size(); i++) {
            if (pairedNew[i] != null) {
                matched.add(new Pair(olds.get(i), pairedNew[i]));
            } else {
                removed.add(olds.get(i));
            }
        }
        for (int j = 0; j < news.size(); j++) {
            if (!newUsed[j]) {
                added.add(news.get(j));
            }
        }
    }

    private static int findUnused(List<Symbol> candidates, boolean[] used, Symbol target, boolean exact) {
        for (int j = 0; j < candidates.size(); j++) {
            if (used[j]) continue;
            Symbol candidate = candidates.get(j);
            boolean fits = exact
                    ? Objects.equals(candidate.parameters(), target.parameters())
                    : candidate.parameters().size() == target.parameters().size();
            if (fits) {
                return j;
            }
        }
        return -1;
    }

    private static Map<SymbolKey, List<Symbol>> groupByKey(List<Symbol> symbols) {
        Map<SymbolKey, List<Symbol>> result = new LinkedHashMap<>();
        for (Symbol symbol : symbols) {
            result.computeIfAbsent(symbol.key(), k -> new ArrayList<>()).add(symbol);
        }
        return result;
    }
}
