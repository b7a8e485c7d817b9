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

/**
 * Все попытки операции исчерпаны, либо ошибка оказалась фатальной с первой попытки.
 * Вызывающий компонент превращает ее в {@link AtomicWriteException} или {@link FileOperationException}.
 */
public class RetryFailedException extends Exception {

    private final int attempts;
    private final OsError osError;
    private final LockState state;

    public RetryFailedException(IOException cause, int attempts, OsError osError, LockState state) {
        super(cause.getMessage(), cause);
        this.attempts = attempts;
        this.osError = osError;
        this.state = state;
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }

    public int getAttempts() {
        return attempts;
    }

    public OsError getOsError() {
        return osError;
    }

    public boolean isLocked() {
        return state == LockState.LOCKED;
    }
}
