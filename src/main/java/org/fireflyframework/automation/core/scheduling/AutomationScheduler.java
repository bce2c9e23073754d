/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.automation.core.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small task scheduler on a daemon thread pool. Tasks are registered under an id;
 * registering the same id again replaces the previous task. A failing task is logged
 * and keeps its schedule.
 */
@Slf4j
public class AutomationScheduler {

    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public AutomationScheduler(int threadPoolSize) {
        var counter = new AtomicInteger(0);
        this.executor = Executors.newScheduledThreadPool(threadPoolSize, r -> {
            Thread t = new Thread(r, "automation-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void scheduleWithFixedDelay(String taskId, Runnable task, Duration initialDelay, Duration delay) {
        var future = executor.scheduleWithFixedDelay(() -> runSafely(taskId, task),
                initialDelay.toMillis(), delay.toMillis(), TimeUnit.MILLISECONDS);
        replace(taskId, future);
        log.info("[scheduler] Scheduled task '{}' with fixed delay {}ms", taskId, delay.toMillis());
    }

    /**
     * Runs {@code task} at every time matching {@code cronExpression}, evaluated in
     * {@code zone}, or in the system zone when {@code zone} is blank.
     */
    public void scheduleWithCron(String taskId, Runnable task, String cronExpression, String zone) {
        CronExpression cron = CronExpression.parse(cronExpression);
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        scheduleNextCronExecution(taskId, task, cron, zoneId);
        log.info("[scheduler] Registered cron task '{}' with expression '{}' in zone '{}'",
                taskId, cronExpression, zoneId);
    }

    private void scheduleNextCronExecution(String taskId, Runnable task, CronExpression cron, ZoneId zoneId) {
        ZonedDateTime now = ZonedDateTime.now(zoneId);
        ZonedDateTime next = cron.next(now);
        if (next == null) {
            log.warn("[scheduler] Cron expression for '{}' has no future execution time", taskId);
            return;
        }
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> {
            runSafely(taskId, task);
            if (scheduledTasks.containsKey(taskId) && !executor.isShutdown()) {
                scheduleNextCronExecution(taskId, task, cron, zoneId);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        scheduledTasks.put(taskId, future);
    }

    public void cancel(String taskId) {
        var future = scheduledTasks.remove(taskId);
        if (future != null) {
            future.cancel(false);
            log.info("[scheduler] Cancelled task '{}'", taskId);
        }
    }

    public void shutdown() {
        scheduledTasks.values().forEach(f -> f.cancel(false));
        scheduledTasks.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[scheduler] Scheduler shutdown completed");
    }

    public int activeTaskCount() {
        return scheduledTasks.size();
    }

    private void replace(String taskId, ScheduledFuture<?> future) {
        var existing = scheduledTasks.put(taskId, future);
        if (existing != null) {
            existing.cancel(false);
        }
    }

    private static void runSafely(String taskId, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("[scheduler] Task '{}' failed: {}", taskId, e.getMessage(), e);
        }
    }
}
