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
package ru.nts.tools.refactor.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterPython;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров.
 * Thread-safe через ThreadLocal парсеров: один и тот же менеджер используется
 * воркерами пакетной обработки параллельно.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Языки, грамматики которых подключены к сборке.
     */
    private static final Set<String> GRAMMARS = Set.of(LanguageDetector.JAVA, LanguageDetector.PYTHON);

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Есть ли грамматика для указанного языка.
     */
    public boolean hasGrammar(String langId) {
        return langId != null && GRAMMARS.contains(langId);
    }

    /**
     * Получает TSLanguage объект для указанного языка.
     * Ленивая загрузка - нативная грамматика загружается только при первом обращении.
     *
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSLanguage getLanguage(String langId) {
        return languages.computeIfAbsent(langId, this::loadLanguage);
    }

    private TSLanguage loadLanguage(String langId) {
        return switch (langId) {
            case LanguageDetector.JAVA -> new TreeSitterJava();
            case LanguageDetector.PYTHON -> new TreeSitterPython();
            default -> throw new IllegalArgumentException("Unsupported language: " + langId);
        };
    }

    private TSParser getParser(String langId) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(getLanguage(k));
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого и возвращает AST дерево.
     *
     * @param content исходный код
     * @param langId идентификатор языка
     * @return AST дерево
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSTree parse(String content, String langId) {
        TSParser parser = getParser(langId);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + langId);
        }
        return tree;
    }
}
