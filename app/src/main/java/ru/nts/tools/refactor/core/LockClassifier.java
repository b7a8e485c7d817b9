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

import java.util.Set;

/**
 * Решает, является ли ошибка ОС временной блокировкой (повторяем) или фатальной (прерываем).
 * Единственное место, где живет платформо-зависимая семантика кодов ошибок:
 * алгоритм повторов в {@link RetryExecutor} от платформы не зависит.
 * Классификация чистая и без побочных эффектов.
 */
public final class LockClassifier {

    private static final Set<String> POSIX_LOCK_CODES = Set.of(
            OsError.EBUSY,
            OsError.ETXTBSY,
            OsError.EAGAIN
    );

    private static final Set<String> WINDOWS_LOCK_CODES = Set.of(
            OsError.EBUSY,
            OsError.ETXTBSY,
            OsError.EAGAIN,
            OsError.SHARING_VIOLATION,
            OsError.LOCK_VIOLATION
    );

    private static final Set<Integer> WINDOWS_LOCK_NUMBERS = Set.of(32, 33);

    private final Platform platform;

    public LockClassifier(Platform platform) {
        this.platform = platform;
    }

    public Platform platform() {
        return platform;
    }

    public LockState classify(OsError error) {
        if (error == null) {
            return LockState.FATAL;
        }
        // Отказ в доступе к файлу, который сам по себе доступен на запись, означает
        // чужой эксклюзивный дескриптор (редактор, антивирус), а не права доступа.
        if (OsError.EACCES.equals(error.code())) {
            return error.subjectWritable() ? LockState.LOCKED : LockState.FATAL;
        }
        return switch (platform) {
            case POSIX -> POSIX_LOCK_CODES.contains(error.code()) ? LockState.LOCKED : LockState.FATAL;
            case WINDOWS -> WINDOWS_LOCK_CODES.contains(error.code())
                    || (error.number() != null && WINDOWS_LOCK_NUMBERS.contains(error.number()))
                    ? LockState.LOCKED : LockState.FATAL;
        };
    }
}
