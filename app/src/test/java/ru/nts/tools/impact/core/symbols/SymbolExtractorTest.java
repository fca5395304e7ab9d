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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.nts.tools.impact.core.AnalysisConfig;
import ru.nts.tools.impact.core.ImpactErrorCode;
import ru.nts.tools.impact.core.ImpactException;
import ru.nts.tools.impact.core.SymbolParseException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolExtractorTest {

    private final SymbolExtractor extractor = new SymbolExtractor(AnalysisConfig.defaults());

    @Test
    @DisplayName("Неизвестное расширение даёт пустой список")
    void unknownExtensionYieldsNoSymbols() {
        assertTrue(extractor.extract("README.md", "# Title\nfunc Foo() {}").isEmpty());
        assertTrue(extractor.extract("Makefile", "all:\n\tgo build").isEmpty());
        assertFalse(extractor.supports("notes.txt"));
        assertTrue(extractor.supports("main.go"));
    }

    @Test
    @DisplayName("null аргументы отклоняются с INVALID_INPUT")
    void nullArgumentsAreRejected() {
        ImpactException e = assertThrows(ImpactException.class, () -> extractor.extract("a.go", null));
        assertEquals(ImpactErrorCode.INVALID_INPUT, e.getCode());
        assertEquals("content", e.getContext().get("parameter"));

        e = assertThrows(ImpactException.class, () -> extractor.extract(null, ""));
        assertEquals(ImpactErrorCode.INVALID_INPUT, e.getCode());
    }

    @Test
    @DisplayName("Слишком большой Go-файл отклоняется")
    void oversizedGoContentIsRejected() {
        SymbolExtractor small = new SymbolExtractor(new AnalysisConfig(10, 50, 32));
        ImpactException e = assertThrows(ImpactException.class,
                () -> small.extract("big.go", "package main\n\nfunc FunctionWithLongName() {}\n"));
        assertEquals(ImpactErrorCode.FILE_TOO_LARGE, e.getCode());
        assertEquals("big.go", e.getContext().get("path"));

        assertFalse(small.extract("ok.go", "package main\n\nfunc A() {}\n").isEmpty());
    }

    @Test
    @DisplayName("Лимит размера не касается эвристических языков")
    void sizeLimitDoesNotApplyToHeuristicLanguages() {
        SymbolExtractor small = new SymbolExtractor(new AnalysisConfig(10, 50, 100));
        StringBuilder python = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            python.append("def handler_").append(i).append("(request):\n    pass\n");
        }
        assertTrue(python.length() > 100);

        List<Symbol> symbols = assertDoesNotThrow(() -> small.extract("handlers.py", python.toString()));
        assertEquals(20, symbols.size());

        String typescript = "export function load(id: string): User {\n  return null;\n}\n".repeat(5);
        assertDoesNotThrow(() -> small.extract("api.ts", typescript));
        assertDoesNotThrow(() -> small.extract("lib.rs", "pub fn parse(input: &str) -> u32 {\n    0\n}\n".repeat(5)));
        assertDoesNotThrow(() -> small.extract("Api.java", "public class Api {\n    public void call(int x) {\n    }\n}\n".repeat(5)));
    }

    @Test
    @DisplayName("Ошибка разбора Go сообщает позицию")
    void goParseErrorCarriesPosition() {
        SymbolParseException e = assertThrows(SymbolParseException.class,
                () -> extractor.extract("broken.go", "package main\n\nfunc Broken( {\n"));
        assertEquals(ImpactErrorCode.PARSE_FAILED, e.getCode());
        assertEquals("broken.go", e.getContext().get("path"));
    }

    @Test
    @DisplayName("Эвристические языки не бросают ошибок разбора")
    void heuristicLanguagesNeverFail() {
        assertDoesNotThrow(() -> extractor.extract("broken.ts", "export function (((( {{{"));
        assertDoesNotThrow(() -> extractor.extract("broken.py", "def :\n  class"));
        assertDoesNotThrow(() -> extractor.extract("broken.rs", "pub fn <<< {"));
        assertDoesNotThrow(() -> extractor.extract("Broken.java", "public class { void ("));
    }

    @Test
    @DisplayName("Результат неизменяем")
    void resultIsImmutable() {
        List<Symbol> symbols = extractor.extract("a.py", "def f():\n    pass\n");
        assertThrows(UnsupportedOperationException.class, () -> symbols.add(symbols.get(0)));
    }
}
