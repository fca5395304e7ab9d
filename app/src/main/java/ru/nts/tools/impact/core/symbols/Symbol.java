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

import java.util.List;

/**
 * Объявление, найденное в исходном тексте (функция, тип, константа и т.д.).
 * Неизменяем: сравнение версий всегда работает с двумя независимо извлечёнными списками.
 *
 * @param name имя символа, непустое
 * @param kind вид символа
 * @param startLine начальная строка (1-based)
 * @param endLine конечная строка (1-based), не меньше startLine
 * @param signature текстовое представление объявления, может быть пустым
 * @param exported входит ли символ в публичную поверхность файла
 * @param parameters параметры в порядке объявления ("name type" или "type")
 * @param returnType тип возврата, несколько значений через ", "
 * @param parent владелец метода (receiver/класс), пусто для остальных
 * @param filePath путь к файлу
 */
public record Symbol(
        String name,
        SymbolKind kind,
        int startLine,
        int endLine,
        String signature,
        boolean exported,
        List<String> parameters,
        String returnType,
        String parent,
        String filePath
) {

    public Symbol {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Symbol kind must not be null");
        }
        endLine = Math.max(startLine, endLine);
        signature = signature == null ? "" : signature;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        returnType = returnType == null ? "" : returnType;
        parent = parent == null ? "" : parent;
        filePath = filePath == null ? "" : filePath;
    }

    /**
     * Создает символ без сигнатуры, параметров и родителя.
     */
    public static Symbol of(String name, SymbolKind kind, String filePath,
                            int startLine, int endLine, boolean exported) {
        return new Symbol(name, kind, startLine, endLine, "", exported, List.of(), "", "", filePath);
    }

    /**
     * Ключ идентичности символа между ревизиями.
     */
    public SymbolKey key() {
        return new SymbolKey(name, kind, parent);
    }

    public Symbol withParent(String owner) {
        return new Symbol(name, kind, startLine, endLine, signature, exported, parameters, returnType, owner, filePath);
    }
}
