/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.recall.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs best-effort memory work (failure recording, correction learning,
 * episode and procedure logging) off the conversational turn.
 *
 * <p>
 * {@link #submit(String, Runnable)} never blocks: when the bounded queue is
 * full the task is dropped and counted. Task failures are logged and counted
 * per task name instead of propagating.
 */
@Service
@Slf4j
public class BackgroundTaskSupervisor {

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final ThreadPoolExecutor executor;
    private final Map<String, AtomicLong> failures = new ConcurrentHashMap<>();
    private final AtomicLong dropped = new AtomicLong();

    public BackgroundTaskSupervisor(RecallProperties properties) {
        int capacity = properties.getBackground().getQueueCapacity();
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity), r -> {
                    Thread t = new Thread(r, "recall-background");
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queues a task without waiting.
     *
     * @return false when the task was dropped because the queue is full or the
     *         supervisor is shut down
     */
    public boolean submit(String name, Runnable task) {
        try {
            executor.execute(() -> run(name, task));
            return true;
        } catch (RejectedExecutionException e) {
            long total = dropped.incrementAndGet();
            log.warn("[Background] Dropped task {} (queue full or shut down, {} dropped so far)", name, total);
            return false;
        }
    }

    public long getFailureCount(String name) {
        AtomicLong count = failures.get(name);
        return count != null ? count.get() : 0L;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getQueuedCount() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Background] Shut down");
    }

    private void run(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            long total = failures.computeIfAbsent(name, key -> new AtomicLong()).incrementAndGet();
            log.warn("[Background] Task {} failed ({} failures): {}", name, total, e.getMessage(), e);
        }
    }
}
