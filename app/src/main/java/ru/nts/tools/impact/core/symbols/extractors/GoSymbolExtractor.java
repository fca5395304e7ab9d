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

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.impact.core.SymbolParseException;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;
import ru.nts.tools.impact.core.treesitter.SyntaxChecker;
import ru.nts.tools.impact.core.treesitter.SyntaxChecker.SyntaxCheckResult;
import ru.nts.tools.impact.core.treesitter.SyntaxChecker.SyntaxError;
import ru.nts.tools.impact.core.treesitter.TreeSitterManager;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static ru.nts.tools.impact.core.treesitter.SymbolExtractorUtils.*;

/**
 * Извлечение символов Go через tree-sitter.
 * <p>
 * Единственный язык с настоящим парсером: синтаксически неверный текст
 * отклоняется с {@link SymbolParseException}. Сигнатура функции строится
 * заново из узлов дерева, поэтому переформатирование исходника её не меняет.
 */
public class GoSymbolExtractor implements LanguageSymbolExtractor {

    @Override
    public String languageId() {
        return LanguageDetector.GO;
    }

    @Override
    public List<Symbol> extract(String filePath, String content) {
        TSTree tree = TreeSitterManager.getInstance().parse(content, LanguageDetector.GO);

        SyntaxCheckResult check = SyntaxChecker.check(tree, content);
        if (check.hasErrors()) {
            SyntaxError first = check.first().orElseThrow();
            throw new SymbolParseException(filePath, first.line(), first.column(),
                    first.message() + (first.context().isEmpty() ? "" : ": " + first.context()));
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        List<Symbol> symbols = new ArrayList<>();
        for (TSNode node : children(tree.getRootNode())) {
            switch (node.getType()) {
                case "function_declaration" -> extractFunction(node, bytes, filePath, symbols);
                case "method_declaration" -> extractMethod(node, bytes, filePath, symbols);
                case "type_declaration" -> extractTypeDeclaration(node, bytes, filePath, symbols);
                case "const_declaration" -> extractValues(node, "const_spec", SymbolKind.CONSTANT, bytes, filePath, symbols);
                case "var_declaration" -> extractValues(node, "var_spec", SymbolKind.VARIABLE, bytes, filePath, symbols);
                case "import_declaration" -> extractImports(node, bytes, filePath, symbols);
                default -> { }
            }
        }
        return symbols;
    }

    private void extractFunction(TSNode node, byte[] bytes, String path, List<Symbol> out) {
        TSNode nameNode = findChildByType(node, "identifier");
        if (nameNode == null) return;

        String name = getNodeText(nameNode, bytes);
        TSNode typeParams = findChildByType(node, "type_parameter_list");
        List<TSNode> lists = findChildrenByType(node, "parameter_list");
        if (lists.isEmpty()) return;

        List<String> params = renderParameters(lists.get(0), bytes);
        List<String> results = renderResults(node, lists.get(0), bytes);

        StringBuilder sig = new StringBuilder("func ").append(name);
        if (typeParams != null) {
            sig.append(normalizeType(getNodeText(typeParams, bytes)));
        }
        appendParamsAndResults(sig, params, results);

        out.add(new Symbol(name, SymbolKind.FUNCTION, startLine(node), endLine(node), sig.toString(),
                isExported(name), params, String.join(", ", results), "", path));
    }

    private void extractMethod(TSNode node, byte[] bytes, String path, List<Symbol> out) {
        TSNode nameNode = findChildByType(node, "field_identifier");
        if (nameNode == null) return;

        String name = getNodeText(nameNode, bytes);
        List<TSNode> lists = findChildrenByType(node, "parameter_list");
        if (lists.size() < 2) return;

        // Первый parameter_list - receiver
        TSNode receiver = lists.get(0);
        String receiverText = "";
        String receiverType = "";
        TSNode receiverDecl = findChildByType(receiver, "parameter_declaration");
        if (receiverDecl != null) {
            TSNode receiverName = findChildByType(receiverDecl, "identifier");
            TSNode typeNode = lastTypeChild(receiverDecl);
            receiverType = typeNode != null ? normalizeType(getNodeText(typeNode, bytes)) : "";
            receiverText = receiverName != null
                    ? getNodeText(receiverName, bytes) + " " + receiverType
                    : receiverType;
        }

        List<String> params = renderParameters(lists.get(1), bytes);
        List<String> results = renderResults(node, lists.get(1), bytes);

        StringBuilder sig = new StringBuilder("func (").append(receiverText).append(") ").append(name);
        appendParamsAndResults(sig, params, results);

        out.add(new Symbol(name, SymbolKind.METHOD, startLine(node), endLine(node), sig.toString(),
                isExported(name), params, String.join(", ", results), receiverOwner(receiverType), path));
    }

    /**
     * Имя типа-владельца метода: без '*' и без аргументов дженерика.
     */
    static String receiverOwner(String receiverType) {
        String owner = receiverType.trim();
        while (owner.startsWith("*")) {
            owner = owner.substring(1).trim();
        }
        int bracket = owner.indexOf('[');
        if (bracket > 0) {
            owner = owner.substring(0, bracket);
        }
        return owner.trim();
    }

    private static void appendParamsAndResults(StringBuilder sig, List<String> params, List<String> results) {
        sig.append("(").append(String.join(", ", params)).append(")");
        if (results.size() == 1) {
            sig.append(" ").append(results.get(0));
        } else if (results.size() > 1) {
            sig.append(" (").append(String.join(", ", results)).append(")");
        }
    }

    /**
     * Параметры в формате "name type" (по одному на каждое имя) или "type" для безымянных.
     */
    private List<String> renderParameters(TSNode paramList, byte[] bytes) {
        List<String> params = new ArrayList<>();
        for (TSNode child : children(paramList)) {
            String childType = child.getType();
            if (!childType.equals("parameter_declaration") && !childType.equals("variadic_parameter_declaration")) {
                continue;
            }
            boolean variadic = childType.equals("variadic_parameter_declaration");
            List<String> names = new ArrayList<>();
            for (TSNode id : findChildrenByType(child, "identifier")) {
                names.add(getNodeText(id, bytes));
            }
            TSNode typeNode = lastTypeChild(child);
            String type = typeNode != null ? normalizeType(getNodeText(typeNode, bytes)) : "";
            if (variadic) {
                type = "..." + type;
            }
            if (names.isEmpty()) {
                params.add(type);
            } else {
                for (String name : names) {
                    params.add(name + " " + type);
                }
            }
        }
        return params;
    }

    /**
     * Типы результатов: по одному на объявление, имена результатов отбрасываются.
     */
    private List<String> renderResults(TSNode decl, TSNode paramList, byte[] bytes) {
        List<String> results = new ArrayList<>();
        boolean afterParams = false;
        for (TSNode child : children(decl)) {
            if (!afterParams) {
                afterParams = child.getStartByte() == paramList.getStartByte()
                        && child.getType().equals(paramList.getType());
                continue;
            }
            String childType = child.getType();
            if (childType.equals("block") || childType.equals("comment")) {
                break;
            }
            if (childType.equals("parameter_list")) {
                for (TSNode result : children(child)) {
                    String resultType = result.getType();
                    if (resultType.equals("parameter_declaration") || resultType.equals("variadic_parameter_declaration")) {
                        TSNode typeNode = lastTypeChild(result);
                        if (typeNode != null) {
                            results.add(normalizeType(getNodeText(typeNode, bytes)));
                        }
                    }
                }
            } else {
                results.add(normalizeType(getNodeText(child, bytes)));
            }
            break;
        }
        return results;
    }

    /**
     * Последний именованный дочерний узел, не являющийся именем параметра.
     */
    private static TSNode lastTypeChild(TSNode decl) {
        TSNode type = null;
        for (TSNode child : children(decl)) {
            String t = child.getType();
            if (t.equals("identifier") || t.equals(",") || t.equals("...") || t.equals("comment")) {
                continue;
            }
            type = child;
        }
        return type;
    }

    private void extractTypeDeclaration(TSNode node, byte[] bytes, String path, List<Symbol> out) {
        for (TSNode spec : children(node)) {
            String specType = spec.getType();
            if (!specType.equals("type_spec") && !specType.equals("type_alias")) continue;

            TSNode nameNode = findChildByType(spec, "type_identifier");
            if (nameNode == null) continue;

            String name = getNodeText(nameNode, bytes);
            TSNode typeNode = lastTypeChild(spec);
            SymbolKind kind = SymbolKind.TYPE;
            if (typeNode != null && specType.equals("type_spec")) {
                if (typeNode.getType().equals("struct_type")) kind = SymbolKind.STRUCT;
                else if (typeNode.getType().equals("interface_type")) kind = SymbolKind.INTERFACE;
            }
            out.add(Symbol.of(name, kind, path, startLine(spec), endLine(spec), isExported(name)));
        }
    }

    private void extractValues(TSNode node, String specType, SymbolKind kind,
                               byte[] bytes, String path, List<Symbol> out) {
        for (TSNode child : children(node)) {
            if (child.getType().equals(specType)) {
                extractValueSpec(child, kind, bytes, path, out);
            } else if (child.getType().equals(specType + "_list")) {
                // var ( ... ) в новых версиях грамматики
                for (TSNode spec : findChildrenByType(child, specType)) {
                    extractValueSpec(spec, kind, bytes, path, out);
                }
            }
        }
    }

    private void extractValueSpec(TSNode spec, SymbolKind kind, byte[] bytes, String path, List<Symbol> out) {
        for (TSNode id : findChildrenByType(spec, "identifier")) {
            String name = getNodeText(id, bytes);
            if (name.equals("_")) continue;
            out.add(Symbol.of(name, kind, path, startLine(id), startLine(id), isExported(name)));
        }
    }

    private void extractImports(TSNode node, byte[] bytes, String path, List<Symbol> out) {
        List<TSNode> specs = new ArrayList<>(findChildrenByType(node, "import_spec"));
        TSNode list = findChildByType(node, "import_spec_list");
        if (list != null) {
            specs.addAll(findChildrenByType(list, "import_spec"));
        }
        for (TSNode spec : specs) {
            TSNode pathNode = findChildByType(spec, "interpreted_string_literal");
            if (pathNode == null) {
                pathNode = findChildByType(spec, "raw_string_literal");
            }
            if (pathNode == null) continue;

            String importPath = getNodeText(pathNode, bytes);
            importPath = importPath.substring(1, Math.max(1, importPath.length() - 1));
            TSNode alias = findChildByType(spec, "package_identifier");
            String name = alias != null
                    ? getNodeText(alias, bytes)
                    : importPath.substring(importPath.lastIndexOf('/') + 1);
            if (name.isEmpty()) continue;

            out.add(new Symbol(name, SymbolKind.IMPORT, startLine(spec), endLine(spec), "import \"" + importPath + "\"",
                    false, List.of(), "", "", path));
        }
    }

    /**
     * Канонический вид типа: пробелы схлопнуты, лишние пробелы у скобок убраны.
     */
    static String normalizeType(String text) {
        String s = text.replaceAll("\\s+", " ").trim();
        s = s.replaceAll("\\s*,\\s*", ", ");
        s = s.replaceAll("([\\[(*.])\\s+", "$1");
        s = s.replaceAll("\\s+([\\]).])", "$1");
        s = s.replaceAll("]\\s+(?=[\\w*\\[])", "]");
        return s;
    }

    static boolean isExported(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.codePointAt(0));
    }
}
