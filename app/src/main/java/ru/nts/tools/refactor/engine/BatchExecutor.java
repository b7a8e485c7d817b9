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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Обработка набора файлов на ограниченном пуле воркеров.
 * При одном воркере файлы обрабатываются синхронно в вызывающем потоке.
 * Флаг отмены проверяется перед каждым файлом: уже начатые файлы доводятся до конца.
 */
public final class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private final int workers;
    private final AtomicBoolean cancelled;

    public BatchExecutor(int workers, AtomicBoolean cancelled) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.workers = workers;
        this.cancelled = cancelled;
    }

    /**
     * Применяет задачу к каждому элементу.
     *
     * @return результаты в порядке входных элементов; элементы, пропущенные из-за отмены, не входят
     */
    public <I, R> List<R> map(List<I> items, Function<I, R> task) {
        if (workers == 1 || items.size() <= 1) {
            List<R> results = new ArrayList<>(items.size());
            for (I item : items) {
                if (cancelled.get()) {
                    log.warn("Batch cancelled, {} item(s) left unprocessed", items.size() - results.size());
                    break;
                }
                results.add(task.apply(item));
            }
            return results;
        }

        int poolSize = Math.min(workers, items.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            List<Future<R>> futures = new ArrayList<>(items.size());
            for (I item : items) {
                futures.add(pool.submit(() -> cancelled.get() ? null : task.apply(item)));
            }
            List<R> results = new ArrayList<>(items.size());
            for (Future<R> future : futures) {
                R result = await(future);
                if (result != null) {
                    results.add(result);
                }
            }
            if (cancelled.get() && results.size() < items.size()) {
                log.warn("Batch cancelled, {} item(s) left unprocessed", items.size() - results.size());
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            future.cancel(true);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Batch task failed", cause);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "refactor-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
