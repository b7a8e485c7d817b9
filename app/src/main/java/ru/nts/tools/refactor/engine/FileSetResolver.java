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
package ru.nts.tools.refactor.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.refactor.core.ErrorCode;
import ru.nts.tools.refactor.core.RefactorException;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Разрешение наборов файлов для пакетных операций.
 */
public final class FileSetResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSetResolver.class);

    private static final String GLOB_CHARS = "*?[{";

    private final Path baseDir;

    /**
     * @param baseDir директория, относительно которой разрешаются шаблоны (обычно текущая)
     */
    public FileSetResolver(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    /**
     * Файлы директории, имя которых подходит под glob, а имя без расширения содержит {@code pattern}.
     *
     * @param recursive искать и в поддиректориях
     * @throws RefactorException директория не существует
     */
    public List<Path> batch(Path directory, String fileGlob, boolean recursive, String pattern) {
        Path dir = baseDir.resolve(directory).normalize();
        if (!Files.isDirectory(dir)) {
            throw new RefactorException(ErrorCode.DIRECTORY_NOT_FOUND,
                    "Directory '" + directory + "' does not exist", Map.of("path", directory));
        }
        String glob = fileGlob == null || fileGlob.isBlank() ? "*" : fileGlob.trim();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        boolean byName = !glob.contains("/");

        Set<Path> files = new TreeSet<>();
        walk(dir, recursive ? Integer.MAX_VALUE : 1, false, file -> {
            Path candidate = byName ? file.getFileName() : dir.relativize(file);
            if (matcher.matches(candidate) && stem(file).contains(pattern)) {
                files.add(file);
            }
        });
        log.debug("Batch selection in {} ({}, recursive={}): {} file(s) contain '{}'",
                dir, glob, recursive, files.size(), pattern);
        return List.copyOf(files);
    }

    /**
     * Файлы по списку glob-шаблонов через запятую. {@code **} проходит директории рекурсивно
     * и может не совпасть ни с одной директорией ({@code src/**}{@code /*.py} включает {@code src/a.py}).
     * Скрытые директории пропускаются, если они не указаны в шаблоне явно.
     *
     * @return уникальные файлы в отсортированном порядке
     */
    public List<Path> globs(String patterns) {
        Set<Path> files = new TreeSet<>();
        for (String raw : patterns.split(",")) {
            String pattern = raw.trim().replace('\\', '/');
            if (pattern.isEmpty()) {
                continue;
            }
            files.addAll(expand(pattern));
        }
        log.debug("Patterns '{}' matched {} file(s)", patterns, files.size());
        return List.copyOf(files);
    }

    private Set<Path> expand(String pattern) {
        // Литеральный префикс шаблона задает корень обхода
        String[] segments = pattern.split("/");
        StringBuilder prefix = new StringBuilder(pattern.startsWith("/") ? "/" : "");
        int firstGlob = 0;
        while (firstGlob < segments.length - 1 && !hasGlob(segments[firstGlob])) {
            if (!segments[firstGlob].isEmpty()) {
                prefix.append(segments[firstGlob]).append('/');
            }
            firstGlob++;
        }
        Path root = baseDir.resolve(prefix.toString()).normalize();
        String rest = String.join("/", List.of(segments).subList(firstGlob, segments.length));

        Set<Path> matched = new TreeSet<>();
        if (!hasGlob(rest)) {
            Path file = root.resolve(rest);
            if (Files.isRegularFile(file)) {
                matched.add(file);
            }
            return matched;
        }
        if (!Files.isDirectory(root)) {
            return matched;
        }

        List<PathMatcher> matchers = new ArrayList<>();
        matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + rest));
        if (rest.contains("**/")) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + rest.replace("**/", "")));
        }
        boolean recursive = rest.contains("**");
        int depth = recursive ? Integer.MAX_VALUE : rest.split("/").length;
        walk(root, depth, rest.startsWith("."), file -> {
            Path relative = root.relativize(file);
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(relative)) {
                    matched.add(file);
                    return;
                }
            }
        });
        return matched;
    }

    private static boolean hasGlob(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (GLOB_CHARS.indexOf(segment.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static void walk(Path root, int maxDepth, boolean includeHidden, FileSink sink) {
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && !includeHidden && dir.getFileName().toString().startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        sink.accept(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new RefactorException(ErrorCode.DIRECTORY_NOT_FOUND,
                    "Cannot walk directory " + root + ": " + e.getMessage(), Map.of("path", root), e);
        }
    }

    @FunctionalInterface
    private interface FileSink {
        void accept(Path file);
    }
}
