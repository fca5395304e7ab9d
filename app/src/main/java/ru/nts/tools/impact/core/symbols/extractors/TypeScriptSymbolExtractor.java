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
 * Эвристическое извлечение символов TypeScript и JavaScript.
 * <p>
 * Поддерживаются: class, interface, enum, function, type, const и стрелочные функции в const.
 * Стрелочная функция не дублируется как константа.
 */
public class TypeScriptSymbolExtractor extends RegexSymbolExtractor {

    private static final Pattern CLASS = Pattern.compile(
            "(?m)^(export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+(\\w+)");
    private static final Pattern INTERFACE = Pattern.compile(
            "(?m)^(export\\s+)?(?:declare\\s+)?interface\\s+(\\w+)");
    private static final Pattern ENUM = Pattern.compile(
            "(?m)^(export\\s+)?(?:declare\\s+)?(?:const\\s+)?enum\\s+(\\w+)");
    private static final Pattern FUNCTION = Pattern.compile(
            "(?m)^(export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)\\s*(?:<[^>(]*>)?\\s*\\(([^)]*)\\)"
                    + "(?:\\s*:\\s*([^{;=]+?)(?=\\s*[{;]))?");
    private static final Pattern TYPE_ALIAS = Pattern.compile(
            "(?m)^(export\\s+)?(?:declare\\s+)?type\\s+(\\w+)");
    private static final Pattern ARROW = Pattern.compile(
            "(?m)^(export\\s+)?const\\s+(\\w+)\\s*=\\s*(?:async\\s+)?(?:\\(([^)]*)\\)|(\\w+))\\s*(?::\\s*([^=]+?)\\s*)?=>");
    private static final Pattern CONST = Pattern.compile(
            "(?m)^(export\\s+)?const\\s+(\\w+)");
    private static final Pattern METHOD = Pattern.compile(
            "(?m)^[ \\t]+((?:(?:public|private|protected|static|async|readonly|abstract|override|get|set)\\s+)*)"
                    + "(#?\\w+)\\s*(?:<[^>(]*>)?\\s*\\(([^)]*)\\)(?:\\s*:\\s*([^{;=]+?)(?=\\s*\\{))?\\s*\\{");

    private static final Set<String> NOT_METHODS = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return", "with", "do", "else");

    private final String languageId;

    public TypeScriptSymbolExtractor() {
        this(LanguageDetector.TYPESCRIPT);
    }

    public TypeScriptSymbolExtractor(String languageId) {
        this.languageId = languageId;
    }

    @Override
    public String languageId() {
        return languageId;
    }

    @Override
    protected void collect(SourceText source, String filePath, List<Symbol> out) {
        List<Container> classes = new ArrayList<>();

        Matcher m = source.matcher(CLASS);
        while (m.find()) {
            String name = m.group(2);
            int start = source.lineAt(m.start());
            int end = source.braceBlockEnd(m.start());
            boolean exported = m.group(1) != null;
            classes.add(new Container(name, start, end, exported));
            out.add(Symbol.of(name, SymbolKind.CLASS, filePath, start, end, exported));
        }

        addBlocks(source, INTERFACE, SymbolKind.INTERFACE, filePath, out);
        addBlocks(source, ENUM, SymbolKind.TYPE, filePath, out);

        m = source.matcher(FUNCTION);
        while (m.find()) {
            String name = m.group(2);
            List<String> params = splitParameters(m.group(3));
            String returnType = normalizeSpace(group(m, 4));
            String signature = "function " + name + "(" + String.join(", ", params) + ")"
                    + (returnType.isEmpty() ? "" : ": " + returnType);
            out.add(new Symbol(name, SymbolKind.FUNCTION, source.lineAt(m.start()), source.braceBlockEnd(m.end()),
                    signature, m.group(1) != null, params, returnType, "", filePath));
        }

        m = source.matcher(TYPE_ALIAS);
        while (m.find()) {
            int line = source.lineAt(m.start());
            out.add(Symbol.of(m.group(2), SymbolKind.TYPE, filePath, line, line, m.group(1) != null));
        }

        Set<Integer> arrowLines = new HashSet<>();
        m = source.matcher(ARROW);
        while (m.find()) {
            String name = m.group(2);
            int line = source.lineAt(m.start());
            arrowLines.add(line);
            List<String> params = m.group(3) != null ? splitParameters(m.group(3)) : List.of(m.group(4));
            String returnType = normalizeSpace(group(m, 5));
            String signature = "const " + name + " = (" + String.join(", ", params) + ")"
                    + (returnType.isEmpty() ? "" : ": " + returnType) + " =>";
            out.add(new Symbol(name, SymbolKind.FUNCTION, line, source.braceBlockEnd(m.end()),
                    signature, m.group(1) != null, params, returnType, "", filePath));
        }

        m = source.matcher(CONST);
        while (m.find()) {
            int line = source.lineAt(m.start());
            String name = m.group(2);
            // const-стрелки уже учтены как функции, "const enum" - как тип
            if (arrowLines.contains(line) || name.equals("enum")) continue;
            out.add(Symbol.of(name, SymbolKind.CONSTANT, filePath, line, line, m.group(1) != null));
        }

        m = source.matcher(METHOD);
        while (m.find()) {
            String name = m.group(2);
            if (NOT_METHODS.contains(name)) continue;
            int line = source.lineAt(m.start());
            Container owner = enclosing(classes, line);
            if (owner == null) continue;

            String modifiers = group(m, 1);
            boolean exported = owner.exported() && !containsWord(modifiers, "private") && !name.startsWith("#");
            List<String> params = splitParameters(m.group(3));
            String returnType = normalizeSpace(group(m, 4));
            String signature = name + "(" + String.join(", ", params) + ")"
                    + (returnType.isEmpty() ? "" : ": " + returnType);
            out.add(new Symbol(name, SymbolKind.METHOD, line, source.braceBlockEnd(m.start()),
                    signature, exported, params, returnType, owner.name(), filePath));
        }
    }

    private static void addBlocks(SourceText source, Pattern pattern, SymbolKind kind,
                                  String filePath, List<Symbol> out) {
        Matcher m = source.matcher(pattern);
        while (m.find()) {
            out.add(Symbol.of(m.group(2), kind, filePath, source.lineAt(m.start()),
                    source.braceBlockEnd(m.start()), m.group(1) != null));
        }
    }
}
