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

import java.util.List;

/**
 * Межфайловые последствия изменения одного символа.
 *
 * @param changedSymbol   изменённый символ (для удалённого - старая версия)
 * @param change          вид изменения
 * @param affectedFiles   файлы со ссылками на символ, кроме его собственного
 * @param affectedSymbols символы других файлов, внутри которых встречаются ссылки
 * @param references      все известные ссылки на имя символа
 * @param severity        серьёзность влияния
 * @param description     описание для человека
 */
public record Impact(
        Symbol changedSymbol,
        SymbolChange change,
        List<String> affectedFiles,
        List<Symbol> affectedSymbols,
        List<Reference> references,
        ImpactSeverity severity,
        String description
) {

    public Impact {
        affectedFiles = List.copyOf(affectedFiles);
        affectedSymbols = List.copyOf(affectedSymbols);
        references = List.copyOf(references);
    }
}
