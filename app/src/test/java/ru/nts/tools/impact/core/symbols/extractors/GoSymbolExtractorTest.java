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

import org.junit.jupiter.api.Test;
import ru.nts.tools.impact.core.SymbolParseException;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoSymbolExtractorTest extends AbstractSymbolExtractorTest {

    @Test
    void testFunction() {
        String code = """
            package main

            func Add(a, b int) (int, error) {
                return a + b, nil
            }

            func helper() {
            }
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        Symbol add = find(symbols, "Add", SymbolKind.FUNCTION);
        assertTrue(add.exported());
        assertEquals(List.of("a int", "b int"), add.parameters());
        assertEquals("int, error", add.returnType());
        assertEquals("func Add(a int, b int) (int, error)", add.signature());
        assertEquals(3, add.startLine());
        assertEquals(5, add.endLine());

        Symbol helper = find(symbols, "helper", SymbolKind.FUNCTION);
        assertFalse(helper.exported());
        assertTrue(helper.parameters().isEmpty());
        assertEquals("", helper.returnType());
    }

    @Test
    void testMethodWithPointerReceiver() {
        String code = """
            package main

            type Service struct {
                name string
            }

            func (s *Service) Start(port int) error {
                return nil
            }
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        Symbol service = find(symbols, "Service", SymbolKind.STRUCT);
        assertTrue(service.exported());

        Symbol start = findMethod(symbols, "Start", "Service");
        assertTrue(start.exported());
        assertEquals(List.of("port int"), start.parameters());
        assertEquals("error", start.returnType());
        assertEquals("func (s *Service) Start(port int) error", start.signature());
    }

    @Test
    void testGenericReceiver() {
        String code = """
            package main

            type Stack[T any] struct {
                items []T
            }

            func (s *Stack[T]) Push(v T) {
                s.items = append(s.items, v)
            }
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        find(symbols, "Stack", SymbolKind.STRUCT);
        Symbol push = findMethod(symbols, "Push", "Stack");
        assertEquals(List.of("v T"), push.parameters());
    }

    @Test
    void testVariadicParameter() {
        String code = """
            package main

            func Logf(format string, args ...interface{}) {
            }
            """;
        Symbol logf = find(parseAndExtract(code, LanguageDetector.GO), "Logf", SymbolKind.FUNCTION);
        assertEquals(List.of("format string", "args ...interface{}"), logf.parameters());
    }

    @Test
    void testSignatureIgnoresFormatting() {
        String tidy = """
            package main

            func Add(a int, b int) (int, error) {
                return 0, nil
            }
            """;
        String messy = """
            package main

            func   Add( a   int,b int )  ( int ,  error ) {
                return 0, nil
            }
            """;
        Symbol first = find(parseAndExtract(tidy, LanguageDetector.GO), "Add", SymbolKind.FUNCTION);
        Symbol second = find(parseAndExtract(messy, LanguageDetector.GO), "Add", SymbolKind.FUNCTION);
        assertEquals(first.signature(), second.signature());
        assertEquals(first.parameters(), second.parameters());
        assertEquals(first.returnType(), second.returnType());
    }

    @Test
    void testTypes() {
        String code = """
            package main

            type Reader interface {
                Read(p []byte) (int, error)
            }

            type ID string
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        Symbol reader = find(symbols, "Reader", SymbolKind.INTERFACE);
        assertEquals(3, reader.startLine());
        assertEquals(5, reader.endLine());
        assertEquals("", reader.signature());
        find(symbols, "ID", SymbolKind.TYPE);
    }

    @Test
    void testConstantsAndVariables() {
        String code = """
            package main

            const (
                MaxUsers = 100
                minAge   = 18
            )

            var DefaultName = "guest"
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        assertTrue(find(symbols, "MaxUsers", SymbolKind.CONSTANT).exported());
        assertFalse(find(symbols, "minAge", SymbolKind.CONSTANT).exported());
        assertTrue(find(symbols, "DefaultName", SymbolKind.VARIABLE).exported());
    }

    @Test
    void testImports() {
        String code = """
            package main

            import (
                "fmt"
                str "strings"
            )
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.GO);

        Symbol fmt = find(symbols, "fmt", SymbolKind.IMPORT);
        assertFalse(fmt.exported());
        find(symbols, "str", SymbolKind.IMPORT);
    }

    @Test
    void testSymbolsCarryFilePath() {
        String code = """
            package main

            func Run() {}
            """;
        List<Symbol> symbols = extractor.extract("cmd/app/main.go", code);
        assertEquals("cmd/app/main.go", find(symbols, "Run", SymbolKind.FUNCTION).filePath());
    }

    // ==================== Edge Cases ====================

    @Test
    void testSyntaxErrorFails() {
        String code = """
            package main

            func Broken( {
            """;
        SymbolParseException e = assertThrows(SymbolParseException.class,
                () -> parseAndExtract(code, LanguageDetector.GO));
        assertTrue(e.getLine() >= 1);
    }

    @Test
    void testEmptyFileHasNoSymbols() {
        assertTrue(parseAndExtract("package main\n", LanguageDetector.GO).isEmpty());
    }
}
