package me.golemcore.chartwatch.auto;

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

import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.RunTrigger;
import me.golemcore.chartwatch.domain.service.AutomationRunExecutor;
import me.golemcore.chartwatch.domain.service.RunLeaseRegistry;
import me.golemcore.chartwatch.domain.service.ScheduleService;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic driver of automation runs.
 *
 * <p>
 * This component owns two executors:
 * <ul>
 * <li>a single tick thread that selects due schedules at a fixed rate</li>
 * <li>a fixed worker pool that performs the runs, bounding concurrent
 * analysis calls</li>
 * </ul>
 *
 * <p>
 * On start, {@code running} job logs left by a previous process are closed
 * as failed. A tick never blocks on a run. A schedule that is already queued or running
 * is dropped instead of being submitted again. Tick failures are logged and
 * the next tick retries.
 *
 * @see AutomationRunExecutor
 * @see ScheduleService
 */
@Component
@Slf4j
public class AutomationScheduler {

    private final ScheduleService scheduleService;
    private final AutomationRunExecutor runExecutor;
    private final RunLeaseRegistry leaseRegistry;
    private final ChartWatchProperties properties;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private ExecutorService workerPool;

    public AutomationScheduler(ScheduleService scheduleService, AutomationRunExecutor runExecutor,
            RunLeaseRegistry leaseRegistry, ChartWatchProperties properties) {
        this.scheduleService = scheduleService;
        this.runExecutor = runExecutor;
        this.leaseRegistry = leaseRegistry;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getAutomation().isEnabled()) {
            log.info("[Scheduler] Automation disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running.get()) {
            return;
        }
        ChartWatchProperties.AutomationProperties config = properties.getAutomation();
        recoverInterruptedRuns();

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(Math.max(1, config.getWorkerPoolSize()),
                    namedDaemonThreads("automation-worker"));
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "automation-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = Math.max(1, config.getTickIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                Math.max(0, config.getInitialDelaySeconds()),
                tickIntervalSeconds,
                TimeUnit.SECONDS);
        running.set(true);

        log.info("[Scheduler] Started with tick interval: {}s, workers: {}",
                tickIntervalSeconds, config.getWorkerPoolSize());
    }

    @PreDestroy
    public synchronized void shutdown() {
        running.set(false);
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        long timeoutSeconds = properties.getAutomation().getShutdownTimeoutSeconds();
        if (scheduler != null) {
            awaitShutdown(scheduler, timeoutSeconds);
            scheduler = null;
        }
        if (workerPool != null) {
            awaitShutdown(workerPool, timeoutSeconds);
            workerPool = null;
        }
        log.info("[Scheduler] Shut down");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Submit every enabled schedule regardless of its due time.
     *
     * @return number of runs actually submitted
     * @throws IllegalStateException
     *             if the scheduler is not running
     */
    public int triggerAllNow() {
        if (!running.get()) {
            throw new IllegalStateException("Automation scheduler is not running");
        }
        List<AutomationSchedule> schedules = scheduleService.getEnabledSchedules();
        int submitted = submitAll(schedules, RunTrigger.MANUAL);
        log.info("[Scheduler] Manual trigger: {} of {} enabled schedules submitted",
                submitted, schedules.size());
        return submitted;
    }

    void tick() {
        try {
            List<AutomationSchedule> dueSchedules = scheduleService.getDueSchedules();
            if (dueSchedules.isEmpty()) {
                return;
            }
            int submitted = submitAll(dueSchedules, RunTrigger.SCHEDULED);
            log.info("[Scheduler] Tick: {} due schedules, {} submitted", dueSchedules.size(), submitted);
        } catch (Exception e) {
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Replace the worker pool before {@link #start()}. Visible for tests.
     */
    void setWorkerPool(ExecutorService workerPool) {
        this.workerPool = workerPool;
    }

    private void recoverInterruptedRuns() {
        try {
            runExecutor.recoverInterruptedRuns();
        } catch (Exception e) {
            log.error("[Scheduler] Failed to recover interrupted runs: {}", e.getMessage(), e);
        }
    }

    private int submitAll(List<AutomationSchedule> schedules, RunTrigger trigger) {
        int submitted = 0;
        for (AutomationSchedule schedule : schedules) {
            if (submit(schedule.getId(), trigger)) {
                submitted++;
            }
        }
        return submitted;
    }

    private boolean submit(String scheduleId, RunTrigger trigger) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            log.warn("[Scheduler] No worker pool, schedule {} not submitted", scheduleId);
            return false;
        }
        if (!inFlight.add(scheduleId)) {
            log.debug("[Scheduler] Schedule {} already queued or running, dropped", scheduleId);
            return false;
        }
        if (leaseRegistry.isHeld(scheduleId)) {
            inFlight.remove(scheduleId);
            log.debug("[Scheduler] Schedule {} holds a run lease, dropped", scheduleId);
            return false;
        }
        try {
            pool.execute(() -> runSchedule(scheduleId, trigger));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(scheduleId);
            log.warn("[Scheduler] Worker pool rejected schedule {}: {}", scheduleId, e.getMessage());
            return false;
        }
    }

    private void runSchedule(String scheduleId, RunTrigger trigger) {
        try {
            runExecutor.execute(scheduleId, trigger);
        } catch (Exception e) {
            log.error("[Scheduler] Run of schedule {} escaped the executor: {}", scheduleId, e.getMessage(), e);
        } finally {
            inFlight.remove(scheduleId);
        }
    }

    private static void awaitShutdown(ExecutorService executor, long timeoutSeconds) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
