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

import org.junit.jupiter.api.BeforeEach;
import ru.nts.tools.impact.core.AnalysisConfig;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolExtractor;
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;

import java.util.List;

import static org.junit.jupiter.api.Assertions.fail;

public abstract class AbstractSymbolExtractorTest {

    protected SymbolExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SymbolExtractor(AnalysisConfig.defaults());
    }

    protected List<Symbol> parseAndExtract(String code, String langId) {
        String path = "test." + LanguageDetector.getFileExtension(langId).orElse("txt");
        return extractor.extract(path, code);
    }

    protected static Symbol find(List<Symbol> symbols, String name, SymbolKind kind) {
        return symbols.stream()
                .filter(s -> s.name().equals(name) && s.kind() == kind)
                .findFirst()
                .orElseGet(() -> fail("Symbol " + kind + " " + name + " not found in " + symbols));
    }

    protected static Symbol findMethod(List<Symbol> symbols, String name, String parent) {
        return symbols.stream()
                .filter(s -> s.name().equals(name) && s.kind() == SymbolKind.METHOD && s.parent().equals(parent))
                .findFirst()
                .orElseGet(() -> fail("Method " + parent + "." + name + " not found in " + symbols));
    }
}
