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
package ru.nts.tools.impact.core.impact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.impact.core.AnalysisConfig;
import ru.nts.tools.impact.core.ImpactErrorCode;
import ru.nts.tools.impact.core.ImpactException;
import ru.nts.tools.impact.core.SymbolParseException;
import ru.nts.tools.impact.core.symbols.Symbol;
import ru.nts.tools.impact.core.symbols.SymbolExtractor;
import ru.nts.tools.impact.core.symbols.SymbolKind;
import ru.nts.tools.impact.core.symbols.SymbolMatcher;
import ru.nts.tools.impact.core.symbols.SymbolMatcher.MatchResult;
import ru.nts.tools.impact.core.symbols.SymbolMatcher.Pair;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Анализ межфайлового влияния изменений.
 * <p>
 * Сессия владеет индексом {@link SymbolTable}: сначала вызывающий индексирует
 * интересующие файлы через {@link #indexFile}, затем запрашивает
 * {@link #analyzeImpact} для изменённого файла. analyzeImpact не пересканирует
 * кодовую базу, он использует только уже проиндексированные данные.
 * <p>
 * Индексация - запись под write-lock, запросы и анализ - чтение под read-lock.
 * После {@link #close()} любой вызов завершается ошибкой SESSION_CLOSED.
 *
 * <pre>
 * try (ImpactAnalyzer analyzer = ImpactAnalyzer.newSession()) {
 *     analyzer.indexFile("user.go", userSource);
 *     analyzer.indexFile("handler.go", handlerSource);
 *     FileImpact impact = analyzer.analyzeImpact(oldUser, newUser, "user.go");
 * }
 * </pre>
 */
public class ImpactAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    private static final AtomicLong SESSION_IDS = new AtomicLong();

    private final long sessionId = SESSION_IDS.incrementAndGet();
    private final SymbolExtractor extractor;
    private final AnalysisConfig config;
    private final SymbolTable table = new SymbolTable();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();

    private volatile boolean closed;

    public ImpactAnalyzer(SymbolExtractor extractor, AnalysisConfig config) {
        this.extractor = extractor;
        this.config = config;
        log.info("Impact analysis session #{} opened", sessionId);
    }

    /**
     * Новая сессия с настройками из окружения процесса.
     */
    public static ImpactAnalyzer newSession() {
        return newSession(AnalysisConfig.fromEnvironment());
    }

    public static ImpactAnalyzer newSession(AnalysisConfig config) {
        return new ImpactAnalyzer(new SymbolExtractor(config), config);
    }

    // ==================== ИНДЕКСАЦИЯ ====================

    /**
     * Индексирует файл, заменяя его прежний вклад в индекс.
     * При ошибке разбора индекс не меняется.
     *
     * @throws SymbolParseException если Go-текст синтаксически неверен
     */
    public void indexFile(String filename, String content) {
        ensureOpen();
        if (filename == null) throw ImpactException.nullArgument("filename");
        if (content == null) throw ImpactException.nullArgument("content");

        List<Symbol> symbols = extractor.extract(filename, content);

        writeLock.lock();
        try {
            ensureOpen();
            table.putFile(filename, symbols, content);
        } finally {
            writeLock.unlock();
        }
        log.debug("Session #{}: indexed {} ({} symbols)", sessionId, filename, symbols.size());
    }

    /**
     * Удаляет файл из индекса.
     *
     * @return true, если файл был проиндексирован
     */
    public boolean removeFile(String filename) {
        ensureOpen();
        writeLock.lock();
        try {
            ensureOpen();
            return table.removeFile(filename);
        } finally {
            writeLock.unlock();
        }
    }

    // ==================== ЗАПРОСЫ ====================

    public List<Symbol> getSymbolsInFile(String filename) {
        return read(() -> table.symbolsInFile(filename));
    }

    public List<Reference> getSymbolReferences(String symbolName) {
        return read(() -> table.references(symbolName));
    }

    public List<Symbol> findSymbol(String name) {
        return read(() -> table.findSymbol(name));
    }

    /**
     * Файлы, которые ссылаются на символы указанного файла.
     */
    public List<String> getDependents(String filename) {
        return read(() -> table.dependents(filename));
    }

    public List<String> getIndexedFiles() {
        return read(table::indexedFiles);
    }

    // ==================== АНАЛИЗ ====================

    /**
     * Оценивает влияние изменения файла на остальную кодовую базу.
     *
     * @param oldContent прежний текст (пустая строка для нового файла)
     * @param newContent новый текст
     * @param filename   файл
     * @return сводное влияние; без изменений - пустой результат с severity low
     * @throws SymbolParseException если новый текст не разбирается
     * @throws ImpactException       FILE_TOO_LARGE если новый Go-текст превышает лимит
     */
    public FileImpact analyzeImpact(String oldContent, String newContent, String filename) {
        ensureOpen();
        if (oldContent == null) throw ImpactException.nullArgument("oldContent");
        if (newContent == null) throw ImpactException.nullArgument("newContent");
        if (filename == null) throw ImpactException.nullArgument("filename");

        List<Symbol> oldSymbols = withoutImports(extractOld(oldContent, filename));
        List<Symbol> newSymbols = withoutImports(extractor.extract(filename, newContent));
        List<ChangedSymbol> changed = classify(oldSymbols, newSymbols);

        FileImpact result = read(() -> {
            List<Impact> impacts = new ArrayList<>();
            for (ChangedSymbol c : changed) {
                impacts.add(analyzeSymbol(c));
            }
            return FileImpact.of(filename, impacts);
        });
        log.debug("Session #{}: {} changed symbols in {}, overall severity {}",
                sessionId, result.changedSymbols().size(), filename, result.overallSeverity());
        return result;
    }

    /**
     * Изменённый символ и его прежняя версия (null для добавленного).
     */
    private record ChangedSymbol(Symbol symbol, Symbol previous, SymbolChange change) {}

    private List<ChangedSymbol> classify(List<Symbol> oldSymbols, List<Symbol> newSymbols) {
        MatchResult match = SymbolMatcher.match(oldSymbols, newSymbols);
        Map<Symbol, Symbol> pairs = new IdentityHashMap<>();
        for (Pair pair : match.matched()) {
            pairs.put(pair.oldSymbol(), pair.newSymbol());
        }

        List<ChangedSymbol> result = new ArrayList<>();
        for (Symbol oldSym : oldSymbols) {
            Symbol newSym = pairs.get(oldSym);
            if (newSym == null) {
                result.add(new ChangedSymbol(oldSym, oldSym, SymbolChange.REMOVED));
            } else if (symbolChanged(oldSym, newSym)) {
                result.add(new ChangedSymbol(newSym, oldSym, SymbolChange.MODIFIED));
            }
        }
        for (Symbol added : match.added()) {
            result.add(new ChangedSymbol(added, null, SymbolChange.ADDED));
        }
        return result;
    }

    static boolean symbolChanged(Symbol oldSym, Symbol newSym) {
        return !oldSym.signature().equals(newSym.signature())
                || !oldSym.parameters().equals(newSym.parameters())
                || !oldSym.returnType().equals(newSym.returnType())
                || oldSym.exported() != newSym.exported();
    }

    private Impact analyzeSymbol(ChangedSymbol c) {
        Symbol sym = c.symbol();
        List<Reference> refs = table.references(sym.name());

        Set<String> files = new LinkedHashSet<>();
        Set<Symbol> affectedSymbols = new LinkedHashSet<>();
        for (Reference ref : refs) {
            if (ref.filePath().equals(sym.filePath())) continue;
            files.add(ref.filePath());
            Symbol owner = enclosingSymbol(ref);
            if (owner != null) {
                affectedSymbols.add(owner);
            }
        }

        ImpactSeverity severity;
        String description;
        switch (c.change()) {
            case REMOVED -> {
                severity = sym.exported() ? ImpactSeverity.CRITICAL : ImpactSeverity.HIGH;
                description = String.format("Symbol '%s' was removed", sym.name())
                        + (sym.exported() ? " (was exported/public)" : "");
            }
            case ADDED -> {
                severity = ImpactSeverity.LOW;
                description = String.format("New symbol '%s' added", sym.name());
            }
            default -> {
                Symbol old = c.previous();
                severity = ImpactSeverity.MEDIUM;
                List<String> what = new ArrayList<>();
                if (!old.signature().equals(sym.signature())) {
                    what.add("signature");
                }
                if (old.parameters().size() != sym.parameters().size()) {
                    what.add("parameters");
                    severity = ImpactSeverity.HIGH;
                } else if (!old.parameters().equals(sym.parameters())) {
                    what.add("parameters");
                }
                if (!old.returnType().equals(sym.returnType())) {
                    what.add("return type");
                    severity = ImpactSeverity.HIGH;
                }
                if (old.exported() != sym.exported()) {
                    what.add("visibility");
                    if (old.exported()) {
                        severity = ImpactSeverity.CRITICAL;
                    }
                }
                description = String.format("Symbol '%s' modified: %s", sym.name(), String.join(", ", what));
            }
        }

        severity = escalate(severity, refs.size());
        return new Impact(sym, c.change(), new ArrayList<>(files), new ArrayList<>(affectedSymbols),
                refs, severity, description);
    }

    /**
     * Повышение серьёзности по числу ссылок: больше criticalReferenceThreshold - critical,
     * больше highReferenceThreshold - medium становится high.
     */
    ImpactSeverity escalate(ImpactSeverity severity, int referenceCount) {
        if (referenceCount > config.criticalReferenceThreshold()) {
            return ImpactSeverity.CRITICAL;
        }
        if (referenceCount > config.highReferenceThreshold() && severity == ImpactSeverity.MEDIUM) {
            return ImpactSeverity.HIGH;
        }
        return severity;
    }

    /**
     * Самый узкий символ файла ссылки, в диапазон строк которого попадает ссылка.
     */
    private Symbol enclosingSymbol(Reference ref) {
        Symbol best = null;
        for (Symbol candidate : table.symbolsInFile(ref.filePath())) {
            if (candidate.kind() == SymbolKind.IMPORT) continue;
            if (candidate.startLine() <= ref.line() && ref.line() <= candidate.endLine()) {
                if (best == null || span(candidate) < span(best)) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private static int span(Symbol symbol) {
        return symbol.endLine() - symbol.startLine();
    }

    private List<Symbol> extractOld(String oldContent, String filename) {
        try {
            return extractor.extract(filename, oldContent);
        } catch (ImpactException e) {
            if (!e.getCode().isExtractionFailure()) {
                throw e;
            }
            log.debug("Old revision of {} is unparsable, treating as new file: {}", filename, e.toLogMessage());
            return List.of();
        }
    }

    private static List<Symbol> withoutImports(List<Symbol> symbols) {
        List<Symbol> result = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            if (symbol.kind() != SymbolKind.IMPORT) {
                result.add(symbol);
            }
        }
        return result;
    }

    // ==================== ЖИЗНЕННЫЙ ЦИКЛ ====================

    public boolean isClosed() {
        return closed;
    }

    /**
     * Закрывает сессию и освобождает индекс. Повторный вызов ничего не делает.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            table.clear();
        } finally {
            writeLock.unlock();
        }
        log.info("Impact analysis session #{} closed", sessionId);
    }

    private void ensureOpen() {
        if (closed) {
            throw new ImpactException(ImpactErrorCode.SESSION_CLOSED, Map.of("session", sessionId));
        }
    }

    private <T> T read(Supplier<T> action) {
        ensureOpen();
        readLock.lock();
        try {
            ensureOpen();
            return action.get();
        } finally {
            readLock.unlock();
        }
    }
}
