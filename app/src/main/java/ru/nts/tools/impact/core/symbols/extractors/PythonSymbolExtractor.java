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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Эвристическое извлечение символов Python.
 * Экспортируется всё, что не начинается с '_'. Границы блоков определяются по отступам.
 */
public class PythonSymbolExtractor extends RegexSymbolExtractor {

    private static final Pattern CLASS = Pattern.compile("(?m)^([ \\t]*)class\\s+(\\w+)");
    private static final Pattern DEF = Pattern.compile(
            "(?m)^([ \\t]*)(?:async\\s+)?def\\s+(\\w+)\\s*\\(([^)]*)\\)(?:\\s*->\\s*([^:]+?))?\\s*:");
    private static final Pattern CONSTANT = Pattern.compile("(?m)^([A-Z][A-Z0-9_]*)\\s*(?::\\s*[^=\\n]+)?=(?!=)");

    @Override
    public String languageId() {
        return LanguageDetector.PYTHON;
    }

    @Override
    protected void collect(SourceText source, String filePath, List<Symbol> out) {
        List<Container> classes = new ArrayList<>();
        List<Container> defs = new ArrayList<>();

        Matcher m = source.matcher(CLASS);
        while (m.find()) {
            String name = m.group(2);
            int start = source.lineAt(m.start());
            int end = source.indentBlockEnd(start);
            classes.add(new Container(name, start, end, isExported(name)));
            // Вложенные классы не попадают в список символов файла
            if (m.group(1).isEmpty()) {
                out.add(Symbol.of(name, SymbolKind.CLASS, filePath, start, end, isExported(name)));
            }
        }

        m = source.matcher(DEF);
        while (m.find()) {
            int start = source.lineAt(m.start());
            defs.add(new Container(m.group(2), start, source.indentBlockEnd(start), isExported(m.group(2))));
        }

        m = source.matcher(DEF);
        while (m.find()) {
            String name = m.group(2);
            int start = source.lineAt(m.start());
            int end = source.indentBlockEnd(start);
            List<String> params = splitParameters(m.group(3));
            String returnType = normalizeSpace(group(m, 4));

            if (m.group(1).isEmpty()) {
                out.add(new Symbol(name, SymbolKind.FUNCTION, start, end, signature(name, params, returnType),
                        isExported(name), params, returnType, "", filePath));
                continue;
            }

            Container owner = enclosing(classes, start);
            Container outerDef = enclosing(defs, start);
            // Функция, вложенная в функцию, не является методом
            if (owner == null || (outerDef != null && outerDef.startLine() > owner.startLine())) {
                continue;
            }
            if (!params.isEmpty() && isReceiver(params.get(0))) {
                params = params.subList(1, params.size());
            }
            out.add(new Symbol(name, SymbolKind.METHOD, start, end, signature(name, params, returnType),
                    isExported(name), params, returnType, owner.name(), filePath));
        }

        m = source.matcher(CONSTANT);
        while (m.find()) {
            int line = source.lineAt(m.start());
            out.add(Symbol.of(m.group(1), SymbolKind.CONSTANT, filePath, line, line, isExported(m.group(1))));
        }
    }

    private static String signature(String name, List<String> params, String returnType) {
        return "def " + name + "(" + String.join(", ", params) + ")"
                + (returnType.isEmpty() ? "" : " -> " + returnType);
    }

    private static boolean isReceiver(String param) {
        String name = param.split("[:=\\s]", 2)[0];
        return name.equals("self") || name.equals("cls");
    }

    private static boolean isExported(String name) {
        return !name.startsWith("_");
    }
}
