package me.golemcore.chartwatch.domain.service;

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

import me.golemcore.chartwatch.domain.model.AnalysisException;
import me.golemcore.chartwatch.domain.model.AnalysisResult;
import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.DispatchDecision;
import me.golemcore.chartwatch.domain.model.JobLog;
import me.golemcore.chartwatch.domain.model.JobStatus;
import me.golemcore.chartwatch.domain.model.RunTrigger;
import me.golemcore.chartwatch.domain.model.SignalAction;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import me.golemcore.chartwatch.port.outbound.AnalysisPort;
import me.golemcore.chartwatch.port.outbound.NotificationPort;
import me.golemcore.chartwatch.port.outbound.ScheduleStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs one attempt of one schedule and guarantees it ends in a terminal
 * {@link JobLog}.
 *
 * <p>
 * Sequence: take the run lease, insert a {@code running} log row, call the
 * analysis provider, compare with the previous recorded action, evaluate the
 * filters, optionally notify, close the log row, advance
 * {@code nextRunAt = now + frequency}, release the lease.
 *
 * <p>
 * Lease contention is not an error: the call returns empty and writes nothing.
 * Analysis failures end as {@code failed}. Notification failures are recorded
 * on the row but never change its status.
 */
@Service
@Slf4j
public class AutomationRunExecutor {

    static final String NO_CHAT_CONFIGURED = "No Telegram chat configured";
    static final String CHANNEL_UNAVAILABLE = "Telegram notifications are not configured";
    static final String INTERRUPTED_RUN = "Run interrupted before completion";
    private static final Set<JobStatus> SIGNAL_HISTORY_STATUSES = EnumSet.of(JobStatus.SUCCESS, JobStatus.SKIPPED);
    private static final int MAX_STACK_LENGTH = 8000;

    private final ScheduleStorePort storePort;
    private final AnalysisPort analysisPort;
    private final NotificationPort notificationPort;
    private final SignalDecisionEngine decisionEngine;
    private final AlertMessageFormatter messageFormatter;
    private final RunLeaseRegistry leaseRegistry;
    private final ChartWatchProperties properties;
    private final Clock clock;

    public AutomationRunExecutor(ScheduleStorePort storePort, AnalysisPort analysisPort,
            NotificationPort notificationPort, SignalDecisionEngine decisionEngine,
            AlertMessageFormatter messageFormatter, RunLeaseRegistry leaseRegistry,
            ChartWatchProperties properties, Clock clock) {
        this.storePort = storePort;
        this.analysisPort = analysisPort;
        this.notificationPort = notificationPort;
        this.decisionEngine = decisionEngine;
        this.messageFormatter = messageFormatter;
        this.leaseRegistry = leaseRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run the schedule once.
     *
     * @return the terminal job log, or empty if the lease was unavailable or the
     *         schedule is gone or disabled
     */
    public Optional<JobLog> execute(String scheduleId, RunTrigger trigger) {
        Optional<RunLeaseRegistry.RunLease> acquired = leaseRegistry.tryAcquire(scheduleId);
        if (acquired.isEmpty()) {
            log.debug("[Run] Schedule {} skipped: run already in progress", scheduleId);
            return Optional.empty();
        }

        try (RunLeaseRegistry.RunLease lease = acquired.get()) {
            Optional<AutomationSchedule> schedule = storePort.findSchedule(lease.getScheduleId());
            if (schedule.isEmpty()) {
                log.debug("[Run] Schedule {} no longer exists", scheduleId);
                return Optional.empty();
            }
            if (!schedule.get().isEnabled()) {
                log.debug("[Run] Schedule {} was disabled before it started", scheduleId);
                return Optional.empty();
            }
            return runLeased(schedule.get(), trigger);
        }
    }

    private Optional<JobLog> runLeased(AutomationSchedule schedule, RunTrigger trigger) {
        Instant startedAt = clock.instant();
        JobLog jobLog;
        try {
            jobLog = storePort.insertJobLog(JobLog.builder()
                    .scheduleId(schedule.getId())
                    .trigger(trigger)
                    .startedAt(startedAt)
                    .status(JobStatus.RUNNING)
                    .build());
        } catch (RuntimeException e) {
            log.error("[Run] Could not open job log for schedule {}", schedule.getId(), e);
            reschedule(schedule, clock.instant());
            return Optional.empty();
        }

        log.info("[Run] Starting {} run of schedule {} ({}), job {}",
                trigger.toJson(), schedule.getId(), schedule.getDisplayLabel(), jobLog.getId());

        try {
            AnalysisResult result = analyze(schedule);
            recordSignal(jobLog, schedule, result);
        } catch (RuntimeException e) {
            markFailed(jobLog, e);
            sendErrorAlert(schedule, jobLog.getErrorMessage());
        } catch (Error e) {
            markFailed(jobLog, e);
            throw e;
        } finally {
            finish(schedule, jobLog);
        }

        log.info("[Run] Schedule {} finished: status={}, action={}, confidence={}, telegramSent={}, {}ms",
                schedule.getId(), jobLog.getStatus().toJson(), jobLog.getAction(), jobLog.getConfidence(),
                jobLog.isTelegramSent(), jobLog.getDurationMs());
        return Optional.of(jobLog);
    }

    /**
     * Close {@code running} rows left behind by a previous process. Rows of
     * schedules whose lease is held in this process are left alone.
     *
     * @return number of rows closed as {@code failed}
     */
    public int recoverInterruptedRuns() {
        List<JobLog> running = storePort.findJobLogsByStatus(JobStatus.RUNNING);
        int recovered = 0;
        for (JobLog jobLog : running) {
            if (leaseRegistry.isHeld(jobLog.getScheduleId())) {
                continue;
            }
            jobLog.setErrorMessage(INTERRUPTED_RUN);
            jobLog.setTelegramSent(false);
            jobLog.complete(JobStatus.FAILED, clock.instant());
            try {
                storePort.updateJobLog(jobLog);
                recovered++;
            } catch (RuntimeException e) {
                log.error("[Run] Could not close interrupted job {} of schedule {}",
                        jobLog.getId(), jobLog.getScheduleId(), e);
            }
        }
        if (recovered > 0) {
            log.warn("[Run] Closed {} interrupted runs as failed", recovered);
        }
        return recovered;
    }

    private void finish(AutomationSchedule schedule, JobLog jobLog) {
        Instant completedAt = clock.instant();
        JobStatus terminalStatus = jobLog.getStatus().isTerminal() ? jobLog.getStatus() : JobStatus.FAILED;
        jobLog.complete(terminalStatus, completedAt);
        closeJobLog(jobLog);
        reschedule(schedule, completedAt);
    }

    private AnalysisResult analyze(AutomationSchedule schedule) {
        Duration timeout = properties.getAutomation().getAnalysisTimeout();
        CompletableFuture<AnalysisResult> future = analysisPort.analyze(schedule.getTargetRef());
        AnalysisResult result = await(future, timeout, "Analysis");
        if (result == null || result.getAction() == null) {
            throw new AnalysisException("Analysis returned no action");
        }
        if (result.getConfidence() < 0 || result.getConfidence() > 100) {
            throw new AnalysisException("Analysis confidence out of range: " + result.getConfidence());
        }
        return result;
    }

    private void recordSignal(JobLog jobLog, AutomationSchedule schedule, AnalysisResult result) {
        SignalAction previousAction = storePort
                .findLatestJobLog(schedule.getId(), SIGNAL_HISTORY_STATUSES, jobLog.getId())
                .map(JobLog::getAction)
                .orElse(null);

        DispatchDecision decision = decisionEngine.decide(
                result.getAction(), result.getConfidence(), previousAction, schedule);

        jobLog.setAction(result.getAction());
        jobLog.setConfidence(result.getConfidence());
        jobLog.setAnalysisId(result.getAnalysisId());
        jobLog.setPreviousAction(previousAction);
        jobLog.setSignalChanged(decision.signalChanged());
        jobLog.setMetMinConfidence(decision.metMinConfidence());
        jobLog.setTelegramSent(false);

        if (!decision.shouldDispatch()) {
            jobLog.setSkipReason(decision.skipReason());
            jobLog.setStatus(JobStatus.SKIPPED);
            log.info("[Run] Schedule {} skipped: {} ({} {}%, previous {})", schedule.getId(),
                    decision.skipReason(), result.getAction(), result.getConfidence(), previousAction);
            return;
        }

        if (schedule.isSendToTelegram()) {
            deliverAlert(jobLog, schedule, result);
        }
        jobLog.setStatus(JobStatus.SUCCESS);
    }

    private void deliverAlert(JobLog jobLog, AutomationSchedule schedule, AnalysisResult result) {
        String chatId = resolveChatId(schedule);
        jobLog.setTelegramChatId(chatId);
        if (chatId == null) {
            jobLog.setTelegramError(NO_CHAT_CONFIGURED);
            log.warn("[Run] Schedule {} qualifies for an alert but no chat is configured", schedule.getId());
            return;
        }
        if (!notificationPort.isAvailable()) {
            jobLog.setTelegramError(CHANNEL_UNAVAILABLE);
            log.warn("[Run] Schedule {} qualifies for an alert but Telegram is unavailable", schedule.getId());
            return;
        }

        String message = messageFormatter.formatTradingAlert(schedule, result, clock.instant());
        try {
            await(notificationPort.send(chatId, message),
                    properties.getAutomation().getNotificationTimeout(), "Telegram delivery");
            jobLog.setTelegramSent(true);
            log.info("[Run] Alert for schedule {} sent to chat {}", schedule.getId(), chatId);
        } catch (RuntimeException e) {
            jobLog.setTelegramError(describe(e));
            log.warn("[Run] Alert for schedule {} not delivered: {}", schedule.getId(), describe(e));
        }
    }

    private void sendErrorAlert(AutomationSchedule schedule, String errorMessage) {
        String chatId = resolveChatId(schedule);
        if (!schedule.isSendToTelegram() || chatId == null || !notificationPort.isAvailable()) {
            return;
        }
        try {
            String message = messageFormatter.formatErrorAlert(schedule, errorMessage, clock.instant());
            await(notificationPort.send(chatId, message),
                    properties.getAutomation().getNotificationTimeout(), "Telegram delivery");
        } catch (RuntimeException e) {
            log.warn("[Run] Failed to send error alert for schedule {}: {}", schedule.getId(), describe(e));
        }
    }

    private void markFailed(JobLog jobLog, Throwable error) {
        jobLog.setStatus(JobStatus.FAILED);
        jobLog.setErrorMessage(describe(error));
        jobLog.setErrorStack(stackTraceOf(error));
        jobLog.setTelegramSent(false);
        jobLog.setTelegramError(null);
        jobLog.setSkipReason(null);
        log.error("[Run] Schedule {} failed: {}", jobLog.getScheduleId(), describe(error), error);
    }

    private void closeJobLog(JobLog jobLog) {
        try {
            storePort.updateJobLog(jobLog);
        } catch (RuntimeException e) {
            log.error("[Run] Could not close job log {} of schedule {}",
                    jobLog.getId(), jobLog.getScheduleId(), e);
        }
    }

    private void reschedule(AutomationSchedule schedule, Instant now) {
        Instant nextRunAt = now.plus(schedule.getFrequency().getInterval());
        try {
            if (storePort.updateRunTimes(schedule.getId(), now, nextRunAt).isEmpty()) {
                log.debug("[Run] Schedule {} was deleted during its run", schedule.getId());
            }
        } catch (RuntimeException e) {
            log.error("[Run] Could not reschedule schedule {}", schedule.getId(), e);
        }
    }

    private String resolveChatId(AutomationSchedule schedule) {
        String chatId = schedule.getTelegramChatId();
        if (chatId == null || chatId.isBlank()) {
            chatId = properties.getTelegram().getDefaultChatId();
        }
        return chatId == null || chatId.isBlank() ? null : chatId.trim();
    }

    private static <T> T await(CompletableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisTimeoutException(operation + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operation + " interrupted", e);
        }
    }

    private static String describe(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getMessage() == null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null && !message.isBlank() ? message : current.getClass().getSimpleName();
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        String stack = writer.toString();
        return stack.length() > MAX_STACK_LENGTH ? stack.substring(0, MAX_STACK_LENGTH) : stack;
    }

    /**
     * A collaborator call exceeded its deadline.
     */
    static class AnalysisTimeoutException extends IllegalStateException {

        AnalysisTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
