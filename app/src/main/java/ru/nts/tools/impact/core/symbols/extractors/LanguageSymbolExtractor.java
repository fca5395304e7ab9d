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

import java.util.List;

/**
 * Интерфейс для извлечения символов для конкретного языка.
 * Детектор и анализатор работают только через него, поэтому эвристическую
 * реализацию можно заменить настоящим парсером без изменения их контрактов.
 */
public interface LanguageSymbolExtractor {

    /**
     * Идентификатор языка (см. {@link ru.nts.tools.impact.core.treesitter.LanguageDetector}).
     */
    String languageId();

    /**
     * Извлекает символы из исходного текста.
     *
     * @param filePath путь к файлу, попадает в {@link Symbol#filePath()}
     * @param content  содержимое файла
     * @return символы в порядке появления в тексте
     * @throws ru.nts.tools.impact.core.SymbolParseException если парсер языка отверг текст
     */
    List<Symbol> extract(String filePath, String content);
}
