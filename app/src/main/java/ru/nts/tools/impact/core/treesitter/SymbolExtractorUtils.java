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
package ru.nts.tools.impact.core.treesitter;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Утилиты для извлечения информации из AST дерева tree-sitter.
 */
public final class SymbolExtractorUtils {

    private SymbolExtractorUtils() {}

    /**
     * Находит первый дочерний узел указанного типа.
     */
    public static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Возвращает все дочерние узлы указанного типа в порядке следования.
     */
    public static List<TSNode> findChildrenByType(TSNode parent, String type) {
        List<TSNode> result = new ArrayList<>();
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Возвращает все непустые дочерние узлы.
     */
    public static List<TSNode> children(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Извлекает текст узла из байтового массива (корректно для UTF-8).
     * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные!
     */
    public static String getNodeText(TSNode node, byte[] contentBytes) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Начальная строка узла (1-based).
     */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Конечная строка узла (1-based).
     */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }
}
