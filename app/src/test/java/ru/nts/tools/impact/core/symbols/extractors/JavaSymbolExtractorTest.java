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
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.treesitter.LanguageDetector;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaSymbolExtractorTest extends AbstractSymbolExtractorTest {

    private static final String CODE = """
        package com.example;

        public class UserService {
            public static final int MAX_USERS = 100;
            private final Map<String, User> cache = new HashMap<>();

            public UserService(Repository repo) {
            }

            public User getUser(String id) {
                return cache.get(id);
            }

            private void evict(@NotNull String id, final int reason) {
            }

            public Map<String, List<User>> groupUsers(List<User> users) {
                return null;
            }
        }

        interface Repository {
            User find(String id);
            default int count() { return 0; }
        }
        """;

    @Test
    void testClass() {
        Symbol service = find(parseAndExtract(CODE, LanguageDetector.JAVA), "UserService", SymbolKind.CLASS);
        assertTrue(service.exported());
        assertEquals(3, service.startLine());
        assertEquals(20, service.endLine());
    }

    @Test
    void testMethods() {
        List<Symbol> symbols = parseAndExtract(CODE, LanguageDetector.JAVA);

        Symbol getUser = findMethod(symbols, "getUser", "UserService");
        assertTrue(getUser.exported());
        assertEquals(List.of("String id"), getUser.parameters());
        assertEquals("User", getUser.returnType());
        assertEquals("User getUser(String id)", getUser.signature());

        Symbol evict = findMethod(symbols, "evict", "UserService");
        assertFalse(evict.exported());
        assertEquals(List.of("String id", "int reason"), evict.parameters());

        Symbol group = findMethod(symbols, "groupUsers", "UserService");
        assertEquals("Map<String, List<User>>", group.returnType());
        assertEquals(List.of("List<User> users"), group.parameters());
    }

    @Test
    void testConstructorsAreNotExtracted() {
        List<Symbol> symbols = parseAndExtract(CODE, LanguageDetector.JAVA);
        assertEquals(1, symbols.stream().filter(s -> s.name().equals("UserService")).count());
    }

    @Test
    void testInterfaceMethods() {
        List<Symbol> symbols = parseAndExtract(CODE, LanguageDetector.JAVA);

        Symbol repository = find(symbols, "Repository", SymbolKind.INTERFACE);
        assertFalse(repository.exported());

        Symbol findMethod = findMethod(symbols, "find", "Repository");
        assertEquals(List.of("String id"), findMethod.parameters());
        assertFalse(findMethod.exported());

        findMethod(symbols, "count", "Repository");
    }

    @Test
    void testBodilessMethodsEndOnTheirOwnLine() {
        String code = """
            interface Store {
                User find(String id);
                void save(User u);
                public abstract long count();
            }

            class Cache {
                public void put(String k) {
                }
            }
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.JAVA);

        Symbol find = findMethod(symbols, "find", "Store");
        assertEquals(2, find.startLine());
        assertEquals(2, find.endLine());

        Symbol save = findMethod(symbols, "save", "Store");
        assertEquals(3, save.startLine());
        assertEquals(3, save.endLine());

        Symbol count = findMethod(symbols, "count", "Store");
        assertEquals(4, count.startLine());
        assertEquals(4, count.endLine());

        Symbol store = find(symbols, "Store", SymbolKind.INTERFACE);
        assertEquals(1, store.startLine());
        assertEquals(5, store.endLine());

        Symbol cache = find(symbols, "Cache", SymbolKind.CLASS);
        assertEquals(7, cache.startLine());
        assertEquals(10, cache.endLine());

        Symbol put = findMethod(symbols, "put", "Cache");
        assertEquals(8, put.startLine());
        assertEquals(9, put.endLine());
    }

    @Test
    void testConstants() {
        List<Symbol> symbols = parseAndExtract(CODE, LanguageDetector.JAVA);

        assertTrue(find(symbols, "MAX_USERS", SymbolKind.CONSTANT).exported());
        assertFalse(symbols.stream().anyMatch(s -> s.name().equals("cache")));
    }

    @Test
    void testPublicInterfaceMethodsAreExported() {
        String code = """
            public interface Clock {
                long now();
                private long offset() { return 0; }
            }
            """;
        List<Symbol> symbols = parseAndExtract(code, LanguageDetector.JAVA);

        assertTrue(findMethod(symbols, "now", "Clock").exported());
        assertFalse(findMethod(symbols, "offset", "Clock").exported());
    }
}
