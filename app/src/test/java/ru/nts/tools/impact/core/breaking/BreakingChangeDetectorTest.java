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
package ru.nts.tools.impact.core.breaking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import ru.nts.tools.impact.core.AnalysisConfig;
import ru.nts.tools.impact.core.ImpactErrorCode;
import ru.nts.tools.impact.core.ImpactException;
import ru.nts.tools.impact.core.SymbolParseException;
import ru.nts.tools.impact.core.symbols.SymbolExtractor;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class BreakingChangeDetectorTest {

    private static final String USER_GO = """
        package models

        type User struct {
            ID   int
            Name string
        }

        func GetUser(id int) *User {
            return nil
        }

        func DeleteUser(id int) error {
            return nil
        }
        """;

    private BreakingChangeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new BreakingChangeDetector(new SymbolExtractor(AnalysisConfig.defaults()));
    }

    private static String goFile(String body) {
        return "package models\n\n" + body + "\n";
    }

    // ==================== Идемпотентность ====================

    static Stream<Arguments> sameSources() {
        return Stream.of(
                Arguments.of("user.go", USER_GO),
                Arguments.of("api.ts", "export function load(id: string): User {\n  return null;\n}\n"),
                Arguments.of("repo.py", "class Repo:\n    def find(self, id):\n        pass\n"),
                Arguments.of("lib.rs", "pub fn parse(input: &str) -> Result<Ast, Error> {\n    todo!()\n}\n"),
                Arguments.of("Api.java", "public class Api {\n    public void call(int x) {\n    }\n}\n"),
                Arguments.of("notes.txt", "anything at all")
        );
    }

    @ParameterizedTest
    @MethodSource("sameSources")
    @DisplayName("Сравнение файла с самим собой не даёт изменений")
    void identicalRevisionsHaveNoChanges(String filename, String content) {
        BreakingChangeReport report = detector.detectBreakingChanges(content, content, filename);
        assertEquals(0, report.totalChanges());
        assertFalse(report.hasBreaking());
        assertEquals("No breaking changes detected", report.summary());
    }

    // ==================== Удаление ====================

    @Test
    @DisplayName("Удаление экспортированной функции - critical removal")
    void removedExportedFunction() {
        String after = """
            package models

            type User struct {
                ID   int
                Name string
            }

            func GetUser(id int) *User {
                return nil
            }
            """;
        BreakingChangeReport report = detector.detectBreakingChanges(USER_GO, after, "user.go");

        assertEquals(1, report.totalChanges());
        assertEquals(1, report.criticalCount());
        assertTrue(report.hasBreaking());

        BreakingChange change = report.changes().get(0);
        assertEquals(BreakingChangeType.REMOVAL, change.type());
        assertEquals("DeleteUser", change.symbol().name());
        assertEquals(BreakingSeverity.CRITICAL, change.severity());
        assertEquals("func DeleteUser(id int) error", change.oldValue());
        assertEquals(12, change.line());
        assertEquals("Exported function 'DeleteUser' was removed", change.description());
        assertEquals("user.go", change.filePath());
        assertEquals("Found 1 breaking changes: 1 critical", report.summary());
    }

    @Test
    @DisplayName("Удаление неэкспортированного символа не сообщается")
    void removedUnexportedIsSilent() {
        String before = goFile("func helper() {}\n\nfunc Run() {}");
        String after = goFile("func Run() {}");
        assertEquals(0, detector.detectBreakingChanges(before, after, "run.go").totalChanges());
    }

    @Test
    @DisplayName("Добавление символа не ломает совместимость")
    void additionIsNotBreaking() {
        String after = USER_GO + "\nfunc ListUsers() []User {\n    return nil\n}\n";
        BreakingChangeReport report = detector.detectBreakingChanges(USER_GO, after, "user.go");
        assertEquals(0, report.totalChanges());
    }

    // ==================== Видимость ====================

    @Test
    @DisplayName("Переименование GetUser -> getUser - смена видимости")
    void goRenameToLowercaseIsVisibilityChange() {
        String before = goFile("func GetUser(id int) *User {\n    return nil\n}");
        String after = goFile("func getUser(id int) *User {\n    return nil\n}");

        BreakingChangeReport report = detector.detectBreakingChanges(before, after, "user.go");

        assertEquals(1, report.totalChanges());
        BreakingChange change = report.changes().get(0);
        assertEquals(BreakingChangeType.VISIBILITY_CHANGE, change.type());
        assertEquals(BreakingSeverity.CRITICAL, change.severity());
        assertEquals("getUser", change.symbol().name());
        assertEquals("exported", change.oldValue());
        assertEquals("unexported", change.newValue());
        assertEquals("function 'GetUser' changed from exported to unexported (renamed to 'getUser')",
                change.description());
    }

    @Test
    void goMethodRenameKeepsReceiver() {
        String before = goFile("type Service struct{}\n\nfunc (s *Service) Start() {}");
        String after = goFile("type Service struct{}\n\nfunc (s *Service) start() {}");

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "svc.go").changes();

        assertEquals(1, changes.size());
        assertEquals(BreakingChangeType.VISIBILITY_CHANGE, changes.get(0).type());
    }

    @Test
    void typeScriptExportDroppedIsVisibilityChange() {
        String before = "export function helper(x: number): number {\n  return x;\n}\n";
        String after = "function helper(x: number): number {\n  return x;\n}\n";

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "util.ts").changes();

        assertEquals(1, changes.size());
        BreakingChange change = changes.get(0);
        assertEquals(BreakingChangeType.VISIBILITY_CHANGE, change.type());
        assertEquals("function 'helper' changed from exported to unexported", change.description());
    }

    @Test
    void javaMethodMadePrivateIsVisibilityChangeOnly() {
        String before = "public class Job {\n    public void run(int times) {\n    }\n}\n";
        String after = "public class Job {\n    private void run(long times) {\n    }\n}\n";

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "Job.java").changes();

        assertEquals(1, changes.size());
        assertEquals(BreakingChangeType.VISIBILITY_CHANGE, changes.get(0).type());
    }

    // ==================== Параметры и типы ====================

    @Test
    @DisplayName("Новый параметр - required_parameter без signature_change")
    void addedParameterIsRequiredParameter() {
        String before = goFile("func GetUser(id int) *User {\n    return nil\n}");
        String after = goFile("func GetUser(id int, withDeleted bool) *User {\n    return nil\n}");

        BreakingChangeReport report = detector.detectBreakingChanges(before, after, "user.go");

        assertEquals(1, report.totalChanges());
        BreakingChange change = report.changes().get(0);
        assertEquals(BreakingChangeType.REQUIRED_PARAMETER, change.type());
        assertEquals(BreakingSeverity.ERROR, change.severity());
        assertEquals("1 parameters", change.oldValue());
        assertEquals("2 parameters", change.newValue());
        assertEquals("function 'GetUser' added 1 required parameter(s)", change.description());
        assertEquals("Consider making new parameters optional or provide a new overload", change.suggestion());
    }

    @Test
    @DisplayName("Удалённый хвостовой параметр - предупреждение")
    void removedTrailingParameterIsWarning() {
        String before = goFile("func Search(q string, limit int) {}");
        String after = goFile("func Search(q string) {}");

        BreakingChangeReport report = detector.detectBreakingChanges(before, after, "search.go");

        assertEquals(1, report.totalChanges());
        BreakingChange change = report.changes().get(0);
        assertEquals(BreakingChangeType.PARAMETER_CHANGE, change.type());
        assertEquals(BreakingSeverity.WARNING, change.severity());
        assertFalse(report.hasBreaking());
        assertEquals("Found 1 breaking changes: 1 warning", report.summary());
    }

    @Test
    void changedParameterTypeIsError() {
        String before = goFile("func Get(id int) {}");
        String after = goFile("func Get(id string) {}");

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "get.go").changes();

        assertEquals(1, changes.size());
        BreakingChange change = changes.get(0);
        assertEquals(BreakingChangeType.PARAMETER_CHANGE, change.type());
        assertEquals(BreakingSeverity.ERROR, change.severity());
        assertEquals("id int", change.oldValue());
        assertEquals("id string", change.newValue());
        assertEquals("function 'Get' parameter 1 changed from 'id int' to 'id string'", change.description());
    }

    @Test
    void changedReturnTypeIsError() {
        String before = goFile("func Count() int {\n    return 0\n}");
        String after = goFile("func Count() int64 {\n    return 0\n}");

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "count.go").changes();

        assertEquals(1, changes.size());
        assertEquals(BreakingChangeType.RETURN_TYPE_CHANGE, changes.get(0).type());
        assertEquals(BreakingSeverity.ERROR, changes.get(0).severity());
        assertEquals("int", changes.get(0).oldValue());
        assertEquals("int64", changes.get(0).newValue());
    }

    @Test
    @DisplayName("Появление типа возврата - только signature_change")
    void gainedReturnTypeIsSignatureWarning() {
        String before = goFile("func Reset() {}");
        String after = goFile("func Reset() error {\n    return nil\n}");

        List<BreakingChange> changes = detector.detectBreakingChanges(before, after, "reset.go").changes();

        assertEquals(1, changes.size());
        BreakingChange change = changes.get(0);
        assertEquals(BreakingChangeType.SIGNATURE_CHANGE, change.type());
        assertEquals(BreakingSeverity.WARNING, change.severity());
        assertEquals("func Reset()", change.oldValue());
        assertEquals("func Reset() error", change.newValue());
    }

    @Test
    void reformattingIsNotAChange() {
        String before = goFile("func Add(a int, b int) int {\n    return a + b\n}");
        String after = goFile("func Add(a int,\n    b int) int {\n    return a + b\n}");
        assertEquals(0, detector.detectBreakingChanges(before, after, "add.go").totalChanges());
    }

    @Test
    void unexportedSignatureChangeIsIgnored() {
        String before = goFile("func helper(a int) {}");
        String after = goFile("func helper(a int, b int) {}");
        assertEquals(0, detector.detectBreakingChanges(before, after, "h.go").totalChanges());
    }

    @Test
    void mixedReportSummary() {
        String after = """
            package models

            type User struct {
                ID   int
                Name string
            }

            func GetUser(id string) *User {
                return nil
            }
            """;
        BreakingChangeReport report = detector.detectBreakingChanges(USER_GO, after, "user.go");

        assertEquals(2, report.totalChanges());
        assertEquals(1, report.criticalCount());
        assertEquals(1, report.errorCount());
        assertEquals("Found 2 breaking changes: 1 critical, 1 error", report.summary());
        assertEquals(2, report.breakingChanges().size());
    }

    // ==================== Ошибки ====================

    @Test
    @DisplayName("Неразбираемая старая версия считается новым файлом")
    void unparsableOldRevisionIsTolerated() {
        BreakingChangeReport report = detector.detectBreakingChanges("package models\nfunc Broken( {", USER_GO, "user.go");
        assertEquals(0, report.totalChanges());
    }

    @Test
    @DisplayName("Неразбираемая новая версия - ошибка")
    void unparsableNewRevisionFails() {
        assertThrows(SymbolParseException.class,
                () -> detector.detectBreakingChanges(USER_GO, "package models\nfunc Broken( {", "user.go"));
    }

    @Test
    @DisplayName("Слишком большая старая версия считается новым файлом")
    void oversizedOldRevisionIsTolerated() {
        BreakingChangeDetector small = new BreakingChangeDetector(
                new SymbolExtractor(new AnalysisConfig(10, 50, 64)));
        BreakingChangeReport report = small.detectBreakingChanges(USER_GO, goFile("func Run() {}"), "user.go");
        assertEquals(0, report.totalChanges());
    }

    @Test
    @DisplayName("Слишком большая новая версия - ошибка")
    void oversizedNewRevisionFails() {
        BreakingChangeDetector small = new BreakingChangeDetector(
                new SymbolExtractor(new AnalysisConfig(10, 50, 64)));
        ImpactException e = assertThrows(ImpactException.class,
                () -> small.detectBreakingChanges(goFile("func Run() {}"), USER_GO, "user.go"));
        assertEquals(ImpactErrorCode.FILE_TOO_LARGE, e.getCode());
    }

    @Test
    void nullArgumentsAreRejected() {
        ImpactException e = assertThrows(ImpactException.class,
                () -> detector.detectBreakingChanges(null, "", "a.go"));
        assertEquals(ImpactErrorCode.INVALID_INPUT, e.getCode());
    }

    @Test
    void unsupportedLanguageHasNoChanges() {
        assertEquals(0, detector.detectBreakingChanges("a", "b", "data.csv").totalChanges());
    }
}
