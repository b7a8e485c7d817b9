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
package ru.nts.tools.refactor.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.DosFileAttributeView;
import java.nio.file.attribute.DosFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Снимок существования и прав доступа файла, сделанный до разрушающей записи.
 * Атомарная подмена заменяет inode, поэтому права нужно вернуть на новый файл.
 *
 * @param exists            существовал ли файл в момент снимка
 * @param posixPermissions  POSIX-права (null на файловых системах без POSIX-атрибутов)
 * @param dosReadOnly       DOS-атрибут read-only (только для не-POSIX файловых систем)
 */
public record FileState(boolean exists, Set<PosixFilePermission> posixPermissions, boolean dosReadOnly) {

    /**
     * Права для файлов, которые создаются впервые (временный файл создается с rw-------).
     */
    public static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private static final FileState ABSENT = new FileState(false, null, false);

    public static FileState capture(Path path) {
        if (path == null || !Files.exists(path)) {
            return ABSENT;
        }
        try {
            return new FileState(true, Set.copyOf(Files.getPosixFilePermissions(path)), false);
        } catch (UnsupportedOperationException e) {
            try {
                DosFileAttributes attrs = Files.readAttributes(path, DosFileAttributes.class);
                return new FileState(true, null, attrs.isReadOnly());
            } catch (IOException | UnsupportedOperationException ex) {
                return new FileState(true, null, false);
            }
        } catch (IOException e) {
            return new FileState(true, null, false);
        }
    }

    /**
     * Файл существует, но владелец не может в него писать.
     * Проверяются биты прав, а не access(2): под root тот всегда отвечает "можно".
     */
    public boolean readOnly() {
        if (!exists) {
            return false;
        }
        if (posixPermissions != null) {
            return !posixPermissions.contains(PosixFilePermission.OWNER_WRITE);
        }
        return dosReadOnly;
    }

    /**
     * Переносит снятые права на указанный файл.
     * Для ранее не существовавшего файла выставляет {@link #NEW_FILE_PERMISSIONS}.
     */
    public void applyTo(Path target) throws IOException {
        if (posixPermissions != null) {
            Files.setPosixFilePermissions(target, posixPermissions);
            return;
        }
        if (!exists) {
            // На не-POSIX файловой системе права по умолчанию уже подходящие
            if (Files.getFileAttributeView(target, PosixFileAttributeView.class) != null) {
                Files.setPosixFilePermissions(target, NEW_FILE_PERMISSIONS);
            }
            return;
        }
        DosFileAttributeView dos = Files.getFileAttributeView(target, DosFileAttributeView.class);
        if (dos != null) {
            dos.setReadOnly(dosReadOnly);
        }
    }
}
