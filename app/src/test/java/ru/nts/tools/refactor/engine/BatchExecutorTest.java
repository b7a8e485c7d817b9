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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты пакетной обработки на пуле воркеров.
 */
class BatchExecutorTest {

    @Test
    void testSingleWorkerRunsInCallerThread() {
        Thread caller = Thread.currentThread();
        List<Boolean> sameThread = new BatchExecutor(1, new AtomicBoolean())
                .map(List.of(1, 2, 3), i -> Thread.currentThread() == caller);

        assertEquals(List.of(true, true, true), sameThread);
    }

    @Test
    void testParallelResultsKeepInputOrder() {
        List<Integer> input = IntStream.range(0, 50).boxed().toList();
        Set<String> threads = ConcurrentHashMap.newKeySet();

        List<Integer> squares = new BatchExecutor(4, new AtomicBoolean()).map(input, i -> {
            threads.add(Thread.currentThread().getName());
            return i * i;
        });

        assertEquals(input.stream().map(i -> i * i).toList(), squares);
        assertTrue(threads.stream().allMatch(name -> name.startsWith("refactor-worker-")));
    }

    @Test
    void testCancellationSkipsRemainingItems() {
        AtomicBoolean cancelled = new AtomicBoolean();

        List<Integer> done = new BatchExecutor(1, cancelled).map(List.of(1, 2, 3, 4), i -> {
            if (i == 2) {
                cancelled.set(true);
            }
            return i;
        });

        assertEquals(List.of(1, 2), done, "Начатый элемент доводится до конца, следующие пропускаются");
    }

    @Test
    void testTaskExceptionPropagates() {
        BatchExecutor executor = new BatchExecutor(2, new AtomicBoolean());

        assertThrows(IllegalStateException.class, () -> executor.map(List.of(1, 2), i -> {
            throw new IllegalStateException("boom");
        }));
        assertThrows(IllegalArgumentException.class, () -> new BatchExecutor(0, new AtomicBoolean()));
    }
}
