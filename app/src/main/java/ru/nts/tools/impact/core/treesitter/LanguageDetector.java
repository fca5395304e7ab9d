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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык программирования по расширению файла.
 * Поддерживаемые языки: go, typescript, javascript, python, rust, java.
 * <p>
 * Go разбирается полноценным парсером tree-sitter, остальные языки
 * обрабатываются эвристическими извлекателями на регулярных выражениях.
 */
public final class LanguageDetector {

    public static final String GO = "go";
    public static final String TYPESCRIPT = "typescript";
    public static final String JAVASCRIPT = "javascript";
    public static final String PYTHON = "python";
    public static final String RUST = "rust";
    public static final String JAVA = "java";

    private LanguageDetector() {}

    /**
     * Отображение расширений файлов на идентификаторы языков.
     */
    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            // Go
            Map.entry("go", GO),

            // TypeScript
            Map.entry("ts", TYPESCRIPT),
            Map.entry("tsx", TYPESCRIPT),

            // JavaScript
            Map.entry("js", JAVASCRIPT),
            Map.entry("jsx", JAVASCRIPT),
            Map.entry("mjs", JAVASCRIPT),

            // Python
            Map.entry("py", PYTHON),

            // Rust
            Map.entry("rs", RUST),

            // Java
            Map.entry("java", JAVA)
    );

    private static final List<String> SUPPORTED_LANGUAGES = List.of(
            GO, TYPESCRIPT, JAVASCRIPT, PYTHON, RUST, JAVA
    );

    /**
     * Определяет язык по имени или пути файла.
     *
     * @param filename имя файла (может содержать каталоги)
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(String filename) {
        if (filename == null) {
            return Optional.empty();
        }

        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String baseName = filename.substring(slash + 1);
        int dotIndex = baseName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == baseName.length() - 1) {
            return Optional.empty();
        }

        String extension = baseName.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Возвращает имя языка файла или пустую строку для неизвестного расширения.
     */
    public static String languageName(String filename) {
        return detect(filename).orElse("");
    }

    /**
     * Проверяет, разбирается ли язык настоящим парсером (а не эвристиками).
     * Только для таких языков извлечение может завершиться ошибкой разбора.
     */
    public static boolean hasNativeParser(String langId) {
        return GO.equals(langId);
    }

    /**
     * Проверяет, поддерживается ли указанный язык.
     */
    public static boolean isSupported(String langId) {
        return langId != null && SUPPORTED_LANGUAGES.contains(langId.toLowerCase(Locale.ROOT));
    }

    /**
     * Возвращает список всех поддерживаемых языков.
     */
    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }

    /**
     * Возвращает основное расширение файла для указанного языка.
     */
    public static Optional<String> getFileExtension(String langId) {
        return switch (langId) {
            case GO -> Optional.of("go");
            case TYPESCRIPT -> Optional.of("ts");
            case JAVASCRIPT -> Optional.of("js");
            case PYTHON -> Optional.of("py");
            case RUST -> Optional.of("rs");
            case JAVA -> Optional.of("java");
            default -> Optional.empty();
        };
    }
}
