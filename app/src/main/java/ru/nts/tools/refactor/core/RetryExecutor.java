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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Выполняет IO-операцию с ограниченным числом повторов.
 * Повторяются только ошибки, которые {@link LockClassifier} признал временной блокировкой;
 * фатальная ошибка прерывает цикл после первой же попытки.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final LockClassifier classifier;

    public RetryExecutor(LockClassifier classifier) {
        this.classifier = classifier;
    }

    public LockClassifier classifier() {
        return classifier;
    }

    /**
     * Выполняет действие не более {@code policy.maxRetries() + 1} раз.
     *
     * @param operation имя операции для логов
     * @param policy    политика повторов
     * @param subjects  пути, участвующие в операции; блокировка любого из них дает повтор
     * @param action    действие; получает номер попытки, начиная с 1
     * @return результат первой успешной попытки
     * @throws RetryFailedException если попытки исчерпаны или ошибка фатальна
     */
    public <T> T execute(String operation, RetryPolicy policy, List<Path> subjects, IOAction<T> action)
            throws RetryFailedException {
        int maxAttempts = policy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                T result = action.run(attempt);
                if (attempt > 1) {
                    log.debug("{} succeeded on attempt {}/{}", operation, attempt, maxAttempts);
                }
                return result;
            } catch (IOException e) {
                OsError osError = null;
                LockState state = LockState.FATAL;
                for (Path subject : subjects) {
                    OsError candidate = OsError.from(e, subject);
                    if (osError == null) {
                        osError = candidate;
                    }
                    if (classifier.classify(candidate) == LockState.LOCKED) {
                        osError = candidate;
                        state = LockState.LOCKED;
                        break;
                    }
                }
                if (state == LockState.FATAL || attempt >= maxAttempts) {
                    throw new RetryFailedException(e, attempt, osError, state);
                }
                log.warn("Attempt {}/{}: {} on {} appears locked ({}), retrying in {} ms",
                        attempt, maxAttempts, operation, subjects.get(0), osError, policy.retryDelay().toMillis());
                pause(policy, subjects.get(0), attempt, osError);
            }
        }
    }

    private static void pause(RetryPolicy policy, Path subject, int attempt, OsError osError) {
        long millis = policy.retryDelay().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FileOperationException(ErrorCode.RETRY_INTERRUPTED, subject,
                    "Retry interrupted after " + attempt + " attempt(s) on " + subject, attempt, osError, ie);
        }
    }

    @FunctionalInterface
    public interface IOAction<T> {
        T run(int attempt) throws IOException;
    }
}
