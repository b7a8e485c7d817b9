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

import java.time.Duration;

/**
 * Ограниченная политика повторов для одной файловой операции.
 * Всего делается не более {@code maxRetries + 1} попыток с фиксированной паузой между ними.
 *
 * @param maxRetries число повторов после первой попытки (не меньше 0)
 * @param retryDelay пауза между попытками
 */
public record RetryPolicy(int maxRetries, Duration retryDelay) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(100);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be a non-negative duration");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    public static RetryPolicy ofSeconds(int maxRetries, double delaySeconds) {
        return new RetryPolicy(maxRetries, Duration.ofNanos(Math.round(delaySeconds * 1_000_000_000d)));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
