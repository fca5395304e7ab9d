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
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Эвристическое извлечение символов Java.
 * <p>
 * Методы ищутся по модификаторам, абстрактные методы интерфейсов - по завершающей ';'.
 * Конструкторы не извлекаются. Экспортированность определяется модификатором {@code public},
 * для методов интерфейса - публичностью самого интерфейса.
 */
public class JavaSymbolExtractor extends RegexSymbolExtractor {

    private static final String GENERIC = "(?:<[^<>]*(?:<[^<>]*(?:<[^<>]*>[^<>]*)*>[^<>]*)*>)";
    private static final String TYPE = "([\\w.$]+" + GENERIC + "?(?:\\[\\])*)";

    private static final Pattern CLASS = Pattern.compile(
            "(?m)^[ \\t]*((?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*)"
                    + "(class|record|enum)\\s+(\\w+)");
    private static final Pattern INTERFACE = Pattern.compile(
            "(?m)^[ \\t]*((?:(?:public|protected|private|abstract|static|sealed|non-sealed|strictfp)\\s+)*)"
                    + "interface\\s+(\\w+)");
    private static final Pattern METHOD = Pattern.compile(
            "(?m)^[ \\t]+((?:(?:public|private|protected|static|final|abstract|synchronized|native|default|strictfp)\\s+)+)"
                    + "(?:" + GENERIC + "\\s+)?" + TYPE + "\\s+(\\w+)\\s*\\(([^)]*)\\)");
    private static final Pattern INTERFACE_METHOD = Pattern.compile(
            "(?m)^[ \\t]+(?:" + GENERIC + "\\s+)?" + TYPE + "\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*(?:throws\\s+[^;{]+)?;");
    private static final Pattern CONSTANT = Pattern.compile(
            "(?m)^[ \\t]+((?:(?:public|private|protected|static|final|transient)\\s+)+)" + TYPE + "\\s+(\\w+)\\s*=");

    private static final Pattern ANNOTATION = Pattern.compile("@[\\w.]+(?:\\([^)]*\\))?\\s*");

    private static final Set<String> NOT_TYPES = Set.of(
            "return", "new", "throw", "else", "case", "yield", "package", "import",
            "public", "private", "protected", "static", "final", "abstract", "default");

    @Override
    public String languageId() {
        return LanguageDetector.JAVA;
    }

    @Override
    protected void collect(SourceText source, String filePath, List<Symbol> out) {
        List<Container> types = new ArrayList<>();
        List<Container> interfaces = new ArrayList<>();

        Matcher m = source.matcher(CLASS);
        while (m.find()) {
            String name = m.group(3);
            boolean exported = containsWord(m.group(1), "public");
            int start = source.lineAt(m.start());
            int end = source.braceBlockEnd(m.start());
            SymbolKind kind = m.group(2).equals("enum") ? SymbolKind.TYPE : SymbolKind.CLASS;
            types.add(new Container(name, start, end, exported));
            out.add(Symbol.of(name, kind, filePath, start, end, exported));
        }

        m = source.matcher(INTERFACE);
        while (m.find()) {
            String name = m.group(2);
            boolean exported = containsWord(m.group(1), "public");
            int start = source.lineAt(m.start());
            int end = source.braceBlockEnd(m.start());
            Container container = new Container(name, start, end, exported);
            types.add(container);
            interfaces.add(container);
            out.add(Symbol.of(name, SymbolKind.INTERFACE, filePath, start, end, exported));
        }

        Set<Integer> methodLines = new HashSet<>();
        m = source.matcher(METHOD);
        while (m.find()) {
            String returnType = normalizeSpace(m.group(2));
            if (NOT_TYPES.contains(returnType)) continue;
            int start = source.lineAt(m.start());
            Container owner = enclosing(types, start);
            boolean exported = containsWord(m.group(1), "public")
                    || (owner != null && interfaces.contains(owner) && owner.exported()
                        && !containsWord(m.group(1), "private"));
            methodLines.add(start);
            addMethod(m.group(3), returnType, m.group(4), start, source.braceBlockEnd(m.end()),
                    owner, exported, filePath, out);
        }

        m = source.matcher(INTERFACE_METHOD);
        while (m.find()) {
            String returnType = normalizeSpace(m.group(1));
            if (NOT_TYPES.contains(returnType)) continue;
            int start = source.lineAt(m.start());
            if (methodLines.contains(start)) continue;
            Container owner = enclosing(types, start);
            // Без модификаторов объявление без тела допустимо только в интерфейсе
            if (owner == null || !interfaces.contains(owner)) continue;
            // Объявление без тела занимает одну строку: m.end() уже за ';'
            addMethod(m.group(2), returnType, m.group(3), start, start, owner, owner.exported(), filePath, out);
        }

        m = source.matcher(CONSTANT);
        while (m.find()) {
            String modifiers = m.group(1);
            if (!containsWord(modifiers, "static") || !containsWord(modifiers, "final")) continue;
            int line = source.lineAt(m.start());
            out.add(Symbol.of(m.group(3), SymbolKind.CONSTANT, filePath, line, line,
                    containsWord(modifiers, "public")));
        }
    }

    private static void addMethod(String name, String returnType, String rawParams, int start, int end,
                                  Container owner, boolean exported, String filePath, List<Symbol> out) {
        List<String> params = new ArrayList<>();
        for (String param : splitParameters(rawParams)) {
            String cleaned = ANNOTATION.matcher(param).replaceAll("");
            cleaned = normalizeSpace(cleaned.replaceFirst("^final\\s+", ""));
            if (!cleaned.isEmpty()) {
                params.add(cleaned);
            }
        }
        String signature = returnType + " " + name + "(" + String.join(", ", params) + ")";
        out.add(new Symbol(name, SymbolKind.METHOD, start, end, signature,
                exported, params, returnType, owner != null ? owner.name() : "", filePath));
    }
}
