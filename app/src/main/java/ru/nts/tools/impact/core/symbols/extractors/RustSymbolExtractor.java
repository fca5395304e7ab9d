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
 * Эвристическое извлечение символов Rust.
 * <p>
 * Функции внутри {@code impl T} и {@code trait T} становятся методами с parent = T.
 * Методы реализации трейта и методы pub-трейта считаются экспортированными без {@code pub}.
 */
public class RustSymbolExtractor extends RegexSymbolExtractor {

    private static final String VISIBILITY = "(pub(?:\\s*\\([^)]*\\))?\\s+)?";
    private static final String GENERICS = "(?:<[^<>{(]*(?:<[^<>{(]*>[^<>{(]*)*>)?";

    private static final Pattern STRUCT = Pattern.compile("(?m)^[ \\t]*" + VISIBILITY + "struct\\s+(\\w+)");
    private static final Pattern ENUM = Pattern.compile("(?m)^[ \\t]*" + VISIBILITY + "enum\\s+(\\w+)");
    private static final Pattern TRAIT = Pattern.compile(
            "(?m)^[ \\t]*" + VISIBILITY + "(?:unsafe\\s+)?trait\\s+(\\w+)");
    private static final Pattern TYPE_ALIAS = Pattern.compile("(?m)^" + VISIBILITY + "type\\s+(\\w+)");
    private static final Pattern IMPL = Pattern.compile(
            "(?m)^[ \\t]*(?:unsafe\\s+)?impl\\b\\s*" + GENERICS + "\\s*(?:([\\w:]+)\\s*" + GENERICS + "\\s+for\\s+)?([\\w:]+)");
    private static final Pattern FN = Pattern.compile(
            "(?m)^([ \\t]*)" + VISIBILITY
                    + "(?:default\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:extern\\s+\"[^\"]*\"\\s+)?"
                    + "fn\\s+(\\w+)\\s*" + GENERICS + "\\s*\\(([^)]*)\\)"
                    + "(?:\\s*->\\s*([^{;]+?)(?=\\s*(?:where\\b|\\{|;)))?");
    private static final Pattern CONST = Pattern.compile(
            "(?m)^" + VISIBILITY + "(const|static)\\s+(?:mut\\s+)?([A-Za-z_]\\w*)\\s*:");

    private static final Pattern SELF_PARAM = Pattern.compile("^&?\\s*(?:'\\w+\\s+)?(?:mut\\s+)?self\\b.*");

    @Override
    public String languageId() {
        return LanguageDetector.RUST;
    }

    @Override
    protected void collect(SourceText source, String filePath, List<Symbol> out) {
        addBlocks(source, STRUCT, SymbolKind.STRUCT, filePath, out, null);
        addBlocks(source, ENUM, SymbolKind.TYPE, filePath, out, null);

        List<Container> owners = new ArrayList<>();
        addBlocks(source, TRAIT, SymbolKind.INTERFACE, filePath, out, owners);

        Matcher m = source.matcher(IMPL);
        while (m.find()) {
            String typeName = lastSegment(m.group(2));
            boolean traitImpl = m.group(1) != null;
            owners.add(new Container(typeName, source.lineAt(m.start()), source.braceBlockEnd(m.start()), traitImpl));
        }

        m = source.matcher(TYPE_ALIAS);
        while (m.find()) {
            int line = source.lineAt(m.start());
            out.add(Symbol.of(m.group(2), SymbolKind.TYPE, filePath, line, line, m.group(1) != null));
        }

        m = source.matcher(FN);
        while (m.find()) {
            String name = m.group(3);
            int start = source.lineAt(m.start());
            boolean pub = m.group(2) != null;
            Container owner = enclosing(owners, start);
            if (owner == null && !m.group(1).isEmpty()) {
                // Вложенные функции и функции модулей (mod tests) пропускаем
                continue;
            }

            List<String> params = new ArrayList<>(splitParameters(m.group(4)));
            if (!params.isEmpty() && SELF_PARAM.matcher(params.get(0)).matches()) {
                params.remove(0);
            }
            String returnType = normalizeSpace(group(m, 5));
            String signature = "fn " + name + "(" + String.join(", ", params) + ")"
                    + (returnType.isEmpty() ? "" : " -> " + returnType);
            int end = source.braceBlockEnd(m.start());

            if (owner != null) {
                out.add(new Symbol(name, SymbolKind.METHOD, start, end, signature,
                        pub || owner.exported(), params, returnType, owner.name(), filePath));
            } else {
                out.add(new Symbol(name, SymbolKind.FUNCTION, start, end, signature,
                        pub, params, returnType, "", filePath));
            }
        }

        m = source.matcher(CONST);
        while (m.find()) {
            int line = source.lineAt(m.start());
            SymbolKind kind = m.group(2).equals("const") ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
            out.add(Symbol.of(m.group(3), kind, filePath, line, line, m.group(1) != null));
        }
    }

    private static void addBlocks(SourceText source, Pattern pattern, SymbolKind kind, String filePath,
                                  List<Symbol> out, List<Container> owners) {
        Matcher m = source.matcher(pattern);
        while (m.find()) {
            String name = m.group(2);
            boolean exported = m.group(1) != null;
            int start = source.lineAt(m.start());
            int end = source.braceBlockEnd(m.start());
            out.add(Symbol.of(name, kind, filePath, start, end, exported));
            if (owners != null) {
                owners.add(new Container(name, start, end, exported));
            }
        }
    }

    private static String lastSegment(String path) {
        int idx = path.lastIndexOf("::");
        return idx >= 0 ? path.substring(idx + 2) : path;
    }
}
