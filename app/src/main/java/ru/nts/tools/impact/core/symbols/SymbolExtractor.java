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
package ru.nts.tools.impact.core.symbols;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.impact.core.AnalysisConfig;
import ru.nts.tools.impact.core.ImpactException;
import ru.nts.tools.impact.core.symbols.extractors.GoSymbolExtractor;
import ru.nts.tools.impact.core.symbols.extractors.JavaSymbolExtractor;
import ru.nts.tools.impact.core.symbols.extractors.LanguageSymbolExtractor;
import ru.nts.tools.impact.core.symbols.extractors.PythonSymbolExtractor;
import ru.nts.tools.impact.core.symbols.extractors.RustSymbolExtractor;
import ru.nts.tools.impact.core.symbols.extractors.TypeScriptSymbolExtractor;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Извлекает символы из исходного текста: {@code (filename, text) -> List<Symbol>}.
 * <p>
 * Язык выбирается по расширению файла. Для неизвестных расширений возвращается
 * пустой список, это не ошибка. Ошибкой может завершиться только разбор языка
 * с настоящим парсером (Go): синтаксическая ошибка или превышение лимита размера.
 * Эвристические языки не падают никогда. Сам фасад состояния не хранит и безопасен
 * для вызова из нескольких потоков.
 */
public final class SymbolExtractor {

    private static final Logger log = LoggerFactory.getLogger(SymbolExtractor.class);

    private static final class Holder {
        private static final SymbolExtractor INSTANCE = new SymbolExtractor(AnalysisConfig.fromEnvironment());
    }

    private final Map<String, LanguageSymbolExtractor> extractors = new ConcurrentHashMap<>();
    private final long maxFileBytes;

    public SymbolExtractor(AnalysisConfig config) {
        this.maxFileBytes = config.maxFileBytes();
        registerExtractors();
    }

    /**
     * Экземпляр с настройками из окружения процесса.
     */
    public static SymbolExtractor getInstance() {
        return Holder.INSTANCE;
    }

    private void registerExtractors() {
        register(new GoSymbolExtractor());
        register(new TypeScriptSymbolExtractor(LanguageDetector.TYPESCRIPT));
        register(new TypeScriptSymbolExtractor(LanguageDetector.JAVASCRIPT));
        register(new PythonSymbolExtractor());
        register(new RustSymbolExtractor());
        register(new JavaSymbolExtractor());
    }

    /**
     * Регистрирует (или заменяет) извлекатель для языка {@link LanguageSymbolExtractor#languageId()}.
     */
    public void register(LanguageSymbolExtractor extractor) {
        extractors.put(extractor.languageId(), extractor);
    }

    /**
     * Извлекает символы файла.
     *
     * @param filename имя или путь файла, определяет язык и попадает в {@link Symbol#filePath()}
     * @param content  исходный текст
     * @return символы в порядке появления; пустой список для неподдерживаемого языка
     * @throws ImpactException INVALID_INPUT для null, FILE_TOO_LARGE если Go-текст превышает лимит
     * @throws ru.nts.tools.impact.core.SymbolParseException если Go-текст синтаксически неверен
     */
    public List<Symbol> extract(String filename, String content) {
        if (filename == null) throw ImpactException.nullArgument("filename");
        if (content == null) throw ImpactException.nullArgument("content");

        Optional<String> langId = LanguageDetector.detect(filename);
        LanguageSymbolExtractor extractor = langId.map(extractors::get).orElse(null);
        if (extractor == null) {
            log.debug("No extractor for {}, skipping", filename);
            return List.of();
        }

        if (LanguageDetector.hasNativeParser(extractor.languageId())) {
            checkSize(filename, content);
        }

        List<Symbol> symbols = extractor.extract(filename, content);
        log.debug("Extracted {} symbols from {} ({})", symbols.size(), filename, extractor.languageId());
        return List.copyOf(symbols);
    }

    /**
     * Поддерживается ли язык файла.
     */
    public boolean supports(String filename) {
        return LanguageDetector.detect(filename).map(extractors::containsKey).orElse(false);
    }

    private void checkSize(String filename, String content) {
        // В UTF-8 символ занимает не больше 3 байт на char
        if ((long) content.length() * 3 <= maxFileBytes) return;
        long size = content.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxFileBytes) {
            throw ImpactException.tooLarge(filename, size, maxFileBytes);
        }
    }
}
