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
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация движка, собираемая один раз на запуск и передаваемая во все компоненты.
 * <p>
 * Приоритет (от высшего): явные значения из {@link Builder} (флаги CLI), переменные окружения, значения по умолчанию.
 *
 * <table border="1">
 *   <tr><th>Параметр</th><th>Переменная окружения</th><th>По умолчанию</th></tr>
 *   <tr><td>writePolicy.maxRetries</td><td>REFACTOR_MAX_RETRIES</td><td>3</td></tr>
 *   <tr><td>writePolicy.retryDelay</td><td>REFACTOR_RETRY_DELAY (сек.)</td><td>0.1</td></tr>
 *   <tr><td>readPolicy.maxRetries</td><td>REFACTOR_READ_MAX_RETRIES</td><td>= write</td></tr>
 *   <tr><td>readPolicy.retryDelay</td><td>REFACTOR_READ_RETRY_DELAY (сек.)</td><td>= write</td></tr>
 *   <tr><td>workers</td><td>REFACTOR_WORKERS</td><td>1</td></tr>
 *   <tr><td>compileTimeout</td><td>REFACTOR_COMPILE_TIMEOUT (сек.)</td><td>30</td></tr>
 *   <tr><td>logLevel</td><td>LOG_LEVEL</td><td>INFO</td></tr>
 * </table>
 */
public final class EngineConfig {

    public static final String ENV_MAX_RETRIES = "REFACTOR_MAX_RETRIES";
    public static final String ENV_RETRY_DELAY = "REFACTOR_RETRY_DELAY";
    public static final String ENV_READ_MAX_RETRIES = "REFACTOR_READ_MAX_RETRIES";
    public static final String ENV_READ_RETRY_DELAY = "REFACTOR_READ_RETRY_DELAY";
    public static final String ENV_WORKERS = "REFACTOR_WORKERS";
    public static final String ENV_COMPILE_TIMEOUT = "REFACTOR_COMPILE_TIMEOUT";
    public static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    public static final int DEFAULT_WORKERS = 1;
    public static final int MAX_WORKERS = 64;
    public static final Duration DEFAULT_COMPILE_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    private final RetryPolicy writePolicy;
    private final RetryPolicy readPolicy;
    private final int workers;
    private final Duration compileTimeout;
    private final boolean checkCompile;
    private final String logLevel;
    private final Platform platform;

    private EngineConfig(Builder b) {
        this.writePolicy = b.writePolicy;
        this.readPolicy = new RetryPolicy(
                b.readMaxRetries != null ? b.readMaxRetries : b.writePolicy.maxRetries(),
                b.readRetryDelay != null ? b.readRetryDelay : b.writePolicy.retryDelay());
        this.workers = b.workers;
        this.compileTimeout = b.compileTimeout;
        this.checkCompile = b.checkCompile;
        this.logLevel = b.logLevel;
        this.platform = b.platform;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Конфигурация из переменных окружения процесса.
     */
    public static Builder fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Конфигурация из переданной карты окружения (удобно для тестов).
     * Возвращает builder, чтобы поверх можно было наложить флаги командной строки.
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        int maxRetries = EnvVars.getIntClamped(env, ENV_MAX_RETRIES, RetryPolicy.DEFAULT_MAX_RETRIES, 0, 1000);
        double delay = EnvVars.getDoubleClamped(env, ENV_RETRY_DELAY,
                RetryPolicy.DEFAULT_RETRY_DELAY.toMillis() / 1000d, 0d, 60d);
        int workers = EnvVars.getIntClamped(env, ENV_WORKERS, DEFAULT_WORKERS, 1, MAX_WORKERS);
        int compileTimeout = EnvVars.getIntClamped(env, ENV_COMPILE_TIMEOUT,
                (int) DEFAULT_COMPILE_TIMEOUT.toSeconds(), 1, 3600);
        String logLevel = EnvVars.getOrDefault(env, ENV_LOG_LEVEL, DEFAULT_LOG_LEVEL);

        Builder builder = builder().writePolicy(RetryPolicy.ofSeconds(maxRetries, delay));
        // Политика чтения наследует политику записи (включая флаги CLI), если не задана явно
        if (env.containsKey(ENV_READ_MAX_RETRIES)) {
            builder.readMaxRetries(EnvVars.getIntClamped(env, ENV_READ_MAX_RETRIES, maxRetries, 0, 1000));
        }
        if (env.containsKey(ENV_READ_RETRY_DELAY)) {
            double readDelay = EnvVars.getDoubleClamped(env, ENV_READ_RETRY_DELAY, delay, 0d, 60d);
            builder.readRetryDelay(RetryPolicy.ofSeconds(0, readDelay).retryDelay());
        }
        return builder
                .workers(workers)
                .compileTimeout(Duration.ofSeconds(compileTimeout))
                .logLevel(logLevel);
    }

    public RetryPolicy writePolicy() {
        return writePolicy;
    }

    public RetryPolicy readPolicy() {
        return readPolicy;
    }

    public int workers() {
        return workers;
    }

    public Duration compileTimeout() {
        return compileTimeout;
    }

    public boolean checkCompile() {
        return checkCompile;
    }

    public String logLevel() {
        return logLevel;
    }

    public Platform platform() {
        return platform;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EngineConfig{write=" + writePolicy + ", read=" + readPolicy + ", workers=" + workers
                + ", compileTimeout=" + compileTimeout + ", checkCompile=" + checkCompile
                + ", logLevel=" + logLevel + ", platform=" + platform + "}";
    }

    public static final class Builder {
        private RetryPolicy writePolicy = RetryPolicy.defaults();
        private Integer readMaxRetries;
        private Duration readRetryDelay;
        private int workers = DEFAULT_WORKERS;
        private Duration compileTimeout = DEFAULT_COMPILE_TIMEOUT;
        private boolean checkCompile = true;
        private String logLevel = DEFAULT_LOG_LEVEL;
        private Platform platform = Platform.current();

        private Builder() {
        }

        public Builder writePolicy(RetryPolicy policy) {
            this.writePolicy = policy;
            return this;
        }

        public Builder readPolicy(RetryPolicy policy) {
            this.readMaxRetries = policy.maxRetries();
            this.readRetryDelay = policy.retryDelay();
            return this;
        }

        public Builder readMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("readMaxRetries must be >= 0, got " + maxRetries);
            }
            this.readMaxRetries = maxRetries;
            return this;
        }

        public Builder readRetryDelay(Duration delay) {
            this.readRetryDelay = delay;
            return this;
        }

        /**
         * Переопределяет число повторов записи, сохраняя паузу.
         */
        public Builder maxRetries(int maxRetries) {
            this.writePolicy = new RetryPolicy(maxRetries, writePolicy.retryDelay());
            return this;
        }

        /**
         * Переопределяет паузу между повторами записи, сохраняя их число.
         */
        public Builder retryDelay(Duration delay) {
            this.writePolicy = new RetryPolicy(writePolicy.maxRetries(), delay);
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, got " + workers);
            }
            this.workers = Math.min(workers, MAX_WORKERS);
            return this;
        }

        public Builder compileTimeout(Duration timeout) {
            this.compileTimeout = timeout;
            return this;
        }

        public Builder checkCompile(boolean checkCompile) {
            this.checkCompile = checkCompile;
            return this;
        }

        public Builder logLevel(String level) {
            this.logLevel = level == null ? DEFAULT_LOG_LEVEL : level.trim().toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder platform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
