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
import ru.nts.tools.impact.core.symbols.SymbolKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Межфайловый индекс символов и вхождений имён.
 * <p>
 * Каждый файл токенизируется один раз при индексации; поиск ссылок на имя
 * идёт по обратному индексу токенов, а не сканированием всех строк.
 * Повторная индексация файла заменяет его прежний вклад.
 * <p>
 * Не потокобезопасен: синхронизацию обеспечивает {@link ImpactAnalyzer}.
 */
public final class SymbolTable {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // ==================== ИНДЕКСЫ ====================

    /**
     * Имя символа -> определения во всех файлах (импорты не считаются определениями).
     */
    private final Map<String, List<Symbol>> symbolsByName = new HashMap<>();

    /**
     * Путь файла -> символы файла в порядке извлечения.
     */
    private final Map<String, List<Symbol>> byFile = new LinkedHashMap<>();

    /**
     * Обратный индекс: токен -> файл -> вхождения (не больше одного на строку).
     */
    private final Map<String, Map<String, List<Occurrence>>> occurrences = new HashMap<>();

    /**
     * Путь файла -> токены файла (для удаления при переиндексации).
     */
    private final Map<String, Set<String>> tokensByFile = new HashMap<>();

    /**
     * Вхождение токена в строку файла.
     */
    record Occurrence(int line, String context) {}

    // ==================== ИЗМЕНЕНИЕ ====================

    /**
     * Заменяет вклад файла в индекс.
     */
    public void putFile(String filePath, List<Symbol> symbols, String content) {
        removeFile(filePath);

        byFile.put(filePath, List.copyOf(symbols));
        for (Symbol symbol : symbols) {
            if (symbol.kind() == SymbolKind.IMPORT) continue;
            symbolsByName.computeIfAbsent(symbol.name(), k -> new ArrayList<>()).add(symbol);
        }

        Map<String, List<Occurrence>> tokens = tokenize(content);
        for (Map.Entry<String, List<Occurrence>> entry : tokens.entrySet()) {
            occurrences.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>())
                    .put(filePath, entry.getValue());
        }
        tokensByFile.put(filePath, tokens.keySet());
    }

    /**
     * Удаляет все символы и вхождения файла.
     *
     * @return true, если файл был в индексе
     */
    public boolean removeFile(String filePath) {
        List<Symbol> oldSymbols = byFile.remove(filePath);
        if (oldSymbols != null) {
            for (Symbol symbol : oldSymbols) {
                List<Symbol> named = symbolsByName.get(symbol.name());
                if (named != null) {
                    named.removeIf(s -> s.filePath().equals(filePath));
                    if (named.isEmpty()) {
                        symbolsByName.remove(symbol.name());
                    }
                }
            }
        }

        Set<String> oldTokens = tokensByFile.remove(filePath);
        if (oldTokens != null) {
            for (String token : oldTokens) {
                Map<String, List<Occurrence>> files = occurrences.get(token);
                if (files != null) {
                    files.remove(filePath);
                    if (files.isEmpty()) {
                        occurrences.remove(token);
                    }
                }
            }
        }
        return oldSymbols != null;
    }

    public void clear() {
        symbolsByName.clear();
        byFile.clear();
        occurrences.clear();
        tokensByFile.clear();
    }

    // ==================== ПОИСК ====================

    public List<Symbol> symbolsInFile(String filePath) {
        return byFile.getOrDefault(filePath, List.of());
    }

    public List<Symbol> findSymbol(String name) {
        List<Symbol> symbols = symbolsByName.get(name);
        return symbols == null ? List.of() : List.copyOf(symbols);
    }

    public boolean isDefined(String name) {
        return symbolsByName.containsKey(name);
    }

    public List<String> indexedFiles() {
        return List.copyOf(byFile.keySet());
    }

    /**
     * Ссылки на имя: вхождения во всех файлах, кроме строк определения символа с этим именем.
     * Пока ни один проиндексированный файл не определяет имя, ссылок нет.
     */
    public List<Reference> references(String name) {
        List<Symbol> definitions = symbolsByName.get(name);
        Map<String, List<Occurrence>> files = occurrences.get(name);
        if (definitions == null || files == null) {
            return List.of();
        }

        List<Reference> result = new ArrayList<>();
        for (Map.Entry<String, List<Occurrence>> entry : files.entrySet()) {
            String file = entry.getKey();
            for (Occurrence occurrence : entry.getValue()) {
                if (!isDefinitionLine(definitions, file, occurrence.line())) {
                    result.add(new Reference(file, occurrence.line(), occurrence.context()));
                }
            }
        }
        return result;
    }

    /**
     * Файлы, ссылающиеся на символы, определённые в указанном файле.
     */
    public List<String> dependents(String filePath) {
        Set<String> result = new LinkedHashSet<>();
        Set<String> names = new LinkedHashSet<>();
        for (Symbol symbol : symbolsInFile(filePath)) {
            if (symbol.kind() != SymbolKind.IMPORT) {
                names.add(symbol.name());
            }
        }
        for (String name : names) {
            for (Reference reference : references(name)) {
                if (!reference.filePath().equals(filePath)) {
                    result.add(reference.filePath());
                }
            }
        }
        return List.copyOf(result);
    }

    private static boolean isDefinitionLine(List<Symbol> definitions, String file, int line) {
        for (Symbol symbol : definitions) {
            if (symbol.startLine() == line && symbol.filePath().equals(file)) {
                return true;
            }
        }
        return false;
    }

    // ==================== ТОКЕНИЗАЦИЯ ====================

    /**
     * Разбивает текст на токены-идентификаторы построчно. Строки комментариев пропускаются.
     */
    static Map<String, List<Occurrence>> tokenize(String content) {
        Map<String, List<Occurrence>> result = new HashMap<>();
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty() || isCommentLine(trimmed)) continue;

            Set<String> seen = new LinkedHashSet<>();
            Matcher m = IDENTIFIER.matcher(lines[i]);
            while (m.find()) {
                // Хвост слова, начинающегося с цифры или не-ASCII буквы, не считается
                if (m.start() > 0 && isWordChar(lines[i].charAt(m.start() - 1))) continue;
                seen.add(m.group());
            }
            for (String token : seen) {
                result.computeIfAbsent(token, k -> new ArrayList<>()).add(new Occurrence(i + 1, trimmed));
            }
        }
        return result;
    }

    static boolean isCommentLine(String trimmed) {
        return trimmed.startsWith("//")
                || trimmed.startsWith("#")
                || trimmed.startsWith("/*")
                || trimmed.equals("*")
                || trimmed.startsWith("* ")
                || trimmed.startsWith("*/");
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
