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
package ru.nts.tools.refactor.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.refactor.core.treesitter.SyntaxChecker;
import ru.nts.tools.refactor.core.treesitter.TreeSitterManager;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Переименование символа по синтаксическому дереву tree-sitter.
 * <p>
 * Находит идентификаторы с текстом старого имени, определяет вид каждого вхождения
 * (объявление или статически распознаваемая ссылка) и заменяет байтовые диапазоны
 * подходящих вхождений. Смещения берутся из исходного массива байтов, новый контент
 * собирается за один проход, поэтому замена одного вхождения не сдвигает остальные.
 * Строки и комментарии в дереве не являются идентификаторами и не затрагиваются.
 * Контент с синтаксическими ошибками не переписывается: результат empty.
 */
public final class AstSymbolRewriter implements SymbolRewriter {

    private static final Logger log = LoggerFactory.getLogger(AstSymbolRewriter.class);

    private final TreeSitterManager treeSitter;

    public AstSymbolRewriter() {
        this(TreeSitterManager.getInstance());
    }

    public AstSymbolRewriter(TreeSitterManager treeSitter) {
        this.treeSitter = treeSitter;
    }

    @Override
    public Backend backend() {
        return Backend.AST;
    }

    @Override
    public boolean supports(String langId) {
        return treeSitter.hasGrammar(langId);
    }

    @Override
    public Optional<RewriteResult> rewrite(String content, String oldName, String newName,
                                           String langId, SymbolKind kind) {
        if (!supports(langId)) {
            return Optional.empty();
        }
        if (oldName.isEmpty() || oldName.equals(newName) || !content.contains(oldName)) {
            return Optional.of(RewriteResult.unchanged(content, Backend.AST));
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        TSTree tree;
        try {
            tree = treeSitter.parse(content, langId);
        } catch (RuntimeException e) {
            log.debug("tree-sitter failed to parse {} content: {}", langId, e.getMessage());
            return Optional.empty();
        }
        TSNode root = tree.getRootNode();
        if (SyntaxChecker.hasErrors(root)) {
            log.debug("{} content has syntax errors, AST rewrite skipped", langId);
            return Optional.empty();
        }

        LanguageProfile profile = profileFor(langId).apply(bytes);
        List<Occurrence> occurrences = new ArrayList<>();
        collect(root, profile, bytes, oldName, occurrences);

        // Простые ссылки получают вид объявления из того же файла; без объявлений подходят для любого вида
        Set<SymbolKind> declared = EnumSet.noneOf(SymbolKind.class);
        for (Occurrence occurrence : occurrences) {
            if (occurrence.declaration() && occurrence.kind() != null) {
                declared.add(occurrence.kind());
            }
        }
        SymbolKind inferred = declared.size() == 1 ? declared.iterator().next()
                : declared.isEmpty() ? null : SymbolKind.VARIABLE;

        List<Occurrence> selected = new ArrayList<>();
        for (Occurrence occurrence : occurrences) {
            SymbolKind effective = occurrence.kind() != null ? occurrence.kind() : inferred;
            if (effective == null || kind.accepts(effective)) {
                selected.add(occurrence);
            }
        }
        if (selected.isEmpty()) {
            return Optional.of(RewriteResult.unchanged(content, Backend.AST));
        }

        String replaced = replaceSpans(bytes, selected, newName.getBytes(StandardCharsets.UTF_8));
        log.debug("AST rewrite {} -> {} ({}): {} of {} occurrence(s)",
                oldName, newName, kind, selected.size(), occurrences.size());
        return Optional.of(new RewriteResult(replaced, selected.size(), Backend.AST));
    }

    private static Function<byte[], LanguageProfile> profileFor(String langId) {
        return switch (langId) {
            case "java" -> JavaProfile::new;
            case "python" -> PythonProfile::new;
            default -> throw new IllegalArgumentException("No language profile for " + langId);
        };
    }

    private static void collect(TSNode node, LanguageProfile profile, byte[] bytes, String name,
                                List<Occurrence> out) {
        int childCount = node.getChildCount();
        if (childCount == 0) {
            if (profile.identifierTypes().contains(node.getType())
                    && name.equals(LanguageProfile.nodeText(node, bytes))) {
                out.add(new Occurrence(node.getStartByte(), node.getEndByte(),
                        profile.classify(node), profile.isDeclaration(node)));
            }
            return;
        }
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collect(child, profile, bytes, name, out);
            }
        }
    }

    private static String replaceSpans(byte[] bytes, List<Occurrence> spans, byte[] replacement) {
        List<Occurrence> ordered = new ArrayList<>(spans);
        ordered.sort(Comparator.comparingInt(Occurrence::start));
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + spans.size() * replacement.length);
        int position = 0;
        for (Occurrence span : ordered) {
            out.write(bytes, position, span.start() - position);
            out.write(replacement, 0, replacement.length);
            position = span.end();
        }
        out.write(bytes, position, bytes.length - position);
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Вхождение идентификатора.
     *
     * @param kind        вид символа или null для ссылки неизвестного вида
     * @param declaration является ли вхождение объявлением
     */
    private record Occurrence(int start, int end, SymbolKind kind, boolean declaration) {}
}
