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
package ru.nts.tools.impact.core.symbols.extractors;

import ru.nts.tools.impact.core.symbols.Symbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Базовый класс эвристических экстракторов.
 * <p>
 * Каждая форма объявления ищется отдельным регулярным выражением.
 * Эвристика никогда не падает: на некорректном тексте она просто находит меньше символов.
 */
public abstract class RegexSymbolExtractor implements LanguageSymbolExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public final List<Symbol> extract(String filePath, String content) {
        SourceText source = new SourceText(content);
        List<Symbol> symbols = new ArrayList<>();
        collect(source, filePath, symbols);
        symbols.sort(Comparator.comparingInt(Symbol::startLine));
        return symbols;
    }

    /**
     * Собирает символы файла в {@code out}. Порядок не важен, результат сортируется по строке.
     */
    protected abstract void collect(SourceText source, String filePath, List<Symbol> out);

    /**
     * Разбивает список параметров по запятым верхнего уровня
     * (запятые внутри &lt;&gt;, (), [], {} не разделяют параметры).
     */
    protected static List<String> splitParameters(String raw) {
        List<String> result = new ArrayList<>();
        if (raw == null || raw.isBlank()) return result;

        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '<', '(', '[', '{' -> depth++;
                case '>', ')', ']', '}' -> depth = Math.max(0, depth - 1);
                default -> { }
            }
            // '->' и '=>' не закрывают скобку
            if (c == '>' && i > 0 && (raw.charAt(i - 1) == '-' || raw.charAt(i - 1) == '=')) {
                depth++;
            }
            if (c == ',' && depth == 0) {
                addParameter(result, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addParameter(result, current);
        return result;
    }

    private static void addParameter(List<String> result, StringBuilder current) {
        String param = normalizeSpace(current.toString());
        if (!param.isEmpty()) {
            result.add(param);
        }
    }

    protected static String normalizeSpace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Есть ли в тексте отдельное слово {@code token}.
     */
    protected static boolean containsWord(String text, String token) {
        return Pattern.compile("\\b" + Pattern.quote(token) + "\\b").matcher(text).find();
    }

    protected static String group(Matcher m, int group) {
        String value = m.group(group);
        return value == null ? "" : value;
    }

    /**
     * Находит самый вложенный контейнер (класс, impl-блок), содержащий строку.
     */
    protected static Container enclosing(List<Container> containers, int line) {
        Container best = null;
        for (Container c : containers) {
            if (c.startLine() < line && line <= c.endLine()) {
                if (best == null || c.startLine() >= best.startLine()) {
                    best = c;
                }
            }
        }
        return best;
    }

    /**
     * Диапазон строк объявления-владельца методов.
     */
    protected record Container(String name, int startLine, int endLine, boolean exported) {}

    /**
     * Исходный текст с индексом начала строк.
     */
    protected static final class SourceText {

        private final String content;
        private final String[] lines;
        private final int[] lineStarts;

        SourceText(String content) {
            this.content = content;
            this.lines = content.split("\n", -1);
            this.lineStarts = new int[lines.length];
            int offset = 0;
            for (int i = 0; i < lines.length; i++) {
                lineStarts[i] = offset;
                offset += lines[i].length() + 1;
            }
        }

        public String content() {
            return content;
        }

        public Matcher matcher(Pattern pattern) {
            return pattern.matcher(content);
        }

        /**
         * Номер строки (1-based) для смещения: число переводов строки до него плюс один.
         */
        public int lineAt(int offset) {
            int idx = Arrays.binarySearch(lineStarts, offset);
            return idx >= 0 ? idx + 1 : -idx - 1;
        }

        public String line(int lineNumber) {
            return lines[lineNumber - 1];
        }

        public int lineCount() {
            return lines.length;
        }

        /**
         * Конечная строка блока в фигурных скобках, начиная со смещения объявления.
         * Если до первой '{' встретилась ';', объявление однострочное.
         * Без скобок возвращает строку начала.
         */
        public int braceBlockEnd(int offset) {
            int depth = 0;
            boolean opened = false;
            for (int i = offset; i < content.length(); i++) {
                char c = content.charAt(i);
                if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return lineAt(i);
                    }
                } else if (c == ';' && !opened) {
                    return lineAt(i);
                }
            }
            return lineAt(offset);
        }

        /**
         * Конечная строка блока, заданного отступом (Python).
         * Блок продолжается, пока непустые строки имеют отступ больше, чем у заголовка.
         */
        public int indentBlockEnd(int startLine) {
            int baseIndent = indentOf(line(startLine));
            int end = startLine;
            for (int n = startLine + 1; n <= lines.length; n++) {
                String text = line(n);
                if (text.isBlank()) continue;
                if (indentOf(text) <= baseIndent) break;
                end = n;
            }
            return end;
        }

        static int indentOf(String text) {
            int indent = 0;
            while (indent < text.length() && (text.charAt(indent) == ' ' || text.charAt(indent) == '\t')) {
                indent++;
            }
            return indent;
        }
    }
}
