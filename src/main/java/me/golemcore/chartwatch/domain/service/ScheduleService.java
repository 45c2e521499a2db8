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

import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.JobLog;
import me.golemcore.chartwatch.domain.model.ScheduleSettings;
import me.golemcore.chartwatch.port.outbound.ScheduleStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator-facing management of automation schedules and their run history.
 *
 * <p>
 * There is at most one schedule per target: {@link #upsertSchedule} updates the
 * existing schedule of a target instead of creating a second one. Any settings
 * change moves {@code nextRunAt} to now so the schedule runs on the next tick,
 * unless a run currently holds its lease.
 */
@Service
@Slf4j
public class ScheduleService {

    public static final int DEFAULT_LOG_LIMIT = 50;
    public static final int MAX_LOG_LIMIT = 500;

    private static final int ID_SUFFIX_LENGTH = 8;

    private final ScheduleStorePort storePort;
    private final RunLeaseRegistry leaseRegistry;
    private final Clock clock;

    public ScheduleService(ScheduleStorePort storePort, RunLeaseRegistry leaseRegistry, Clock clock) {
        this.storePort = storePort;
        this.leaseRegistry = leaseRegistry;
        this.clock = clock;
    }

    /**
     * Result of {@link #upsertSchedule}.
     */
    public record UpsertResult(AutomationSchedule schedule, boolean created) {
    }

    /**
     * Create the schedule of a target, or update it if the target already has
     * one.
     */
    public UpsertResult upsertSchedule(String targetRef, ScheduleSettings settings) {
        if (targetRef == null || targetRef.isBlank()) {
            throw new IllegalArgumentException("targetRef is required");
        }
        ScheduleSettings effective = settings != null ? settings : new ScheduleSettings();
        validate(effective);

        String normalizedTarget = targetRef.trim();
        Optional<AutomationSchedule> existing = storePort.findScheduleByTarget(normalizedTarget);
        if (existing.isPresent()) {
            AutomationSchedule updated = applyAndSave(existing.get().getId(), effective);
            log.info("[Scheduler] Updated schedule {} for target {}", updated.getId(), normalizedTarget);
            return new UpsertResult(updated, false);
        }

        Instant now = clock.instant();
        AutomationSchedule schedule = AutomationSchedule.builder()
                .id(generateId())
                .targetRef(normalizedTarget)
                .createdAt(now)
                .updatedAt(now)
                .nextRunAt(now)
                .build();
        apply(schedule, effective);
        AutomationSchedule saved = storePort.saveSchedule(schedule);
        log.info("[Scheduler] Created schedule {} for target {} every {}",
                saved.getId(), normalizedTarget, saved.getFrequency().getCode());
        return new UpsertResult(saved, true);
    }

    /**
     * Partially update a schedule.
     *
     * @throws NoSuchElementException
     *             if the schedule does not exist
     */
    public AutomationSchedule updateSchedule(String scheduleId, ScheduleSettings settings) {
        ScheduleSettings effective = settings != null ? settings : new ScheduleSettings();
        validate(effective);
        AutomationSchedule updated = applyAndSave(scheduleId, effective);
        log.info("[Scheduler] Updated schedule {}", scheduleId);
        return updated;
    }

    /**
     * @throws NoSuchElementException
     *             if the schedule does not exist
     */
    public void deleteSchedule(String scheduleId) {
        if (!storePort.deleteSchedule(scheduleId)) {
            throw new NoSuchElementException("Schedule not found: " + scheduleId);
        }
        log.info("[Scheduler] Deleted schedule {}", scheduleId);
    }

    /**
     * @throws NoSuchElementException
     *             if the schedule does not exist
     */
    public AutomationSchedule getSchedule(String scheduleId) {
        return storePort.findSchedule(scheduleId)
                .orElseThrow(() -> new NoSuchElementException("Schedule not found: " + scheduleId));
    }

    /**
     * All schedules, most recently created first.
     */
    public List<AutomationSchedule> getSchedules() {
        return storePort.findAllSchedules().stream()
                .sorted(Comparator.comparing(AutomationSchedule::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public List<AutomationSchedule> getEnabledSchedules() {
        return storePort.findAllSchedules().stream()
                .filter(AutomationSchedule::isEnabled)
                .toList();
    }

    public List<AutomationSchedule> getDueSchedules() {
        return storePort.findDueSchedules(clock.instant());
    }

    /**
     * Run history of one schedule, newest first.
     *
     * @throws NoSuchElementException
     *             if the schedule does not exist
     */
    public List<JobLog> getJobLogs(String scheduleId, Integer limit) {
        getSchedule(scheduleId);
        return storePort.findJobLogs(scheduleId, normalizeLimit(limit));
    }

    /**
     * Run history across all schedules, newest first.
     */
    public List<JobLog> getRecentJobLogs(Integer limit) {
        return storePort.findRecentJobLogs(normalizeLimit(limit));
    }

    static int normalizeLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LOG_LIMIT;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_LOG_LIMIT);
    }

    // Run times are never copied from a caller's snapshot: a finishing run may
    // have rescheduled the schedule since it was read.
    private AutomationSchedule applyAndSave(String scheduleId, ScheduleSettings settings) {
        Instant now = clock.instant();
        return storePort.updateSchedule(scheduleId, schedule -> {
            apply(schedule, settings);
            schedule.setUpdatedAt(now);
            if (!leaseRegistry.isHeld(scheduleId)) {
                schedule.setNextRunAt(now);
            }
        }).orElseThrow(() -> new NoSuchElementException("Schedule not found: " + scheduleId));
    }

    private static void apply(AutomationSchedule schedule, ScheduleSettings settings) {
        if (settings.getTargetLabel() != null) {
            schedule.setTargetLabel(blankToNull(settings.getTargetLabel()));
        }
        if (settings.getEnabled() != null) {
            schedule.setEnabled(settings.getEnabled());
        }
        if (settings.getFrequency() != null) {
            schedule.setFrequency(settings.getFrequency());
        }
        if (settings.getSendToTelegram() != null) {
            schedule.setSendToTelegram(settings.getSendToTelegram());
        }
        if (settings.getOnlyOnSignalChange() != null) {
            schedule.setOnlyOnSignalChange(settings.getOnlyOnSignalChange());
        }
        if (settings.getMinConfidence() != null) {
            schedule.setMinConfidence(settings.getMinConfidence());
        }
        if (settings.getSendOnHold() != null) {
            schedule.setSendOnHold(settings.getSendOnHold());
        }
        if (settings.getTelegramChatId() != null) {
            schedule.setTelegramChatId(blankToNull(settings.getTelegramChatId()));
        }
    }

    private static void validate(ScheduleSettings settings) {
        Integer minConfidence = settings.getMinConfidence();
        if (minConfidence != null && (minConfidence < 0 || minConfidence > 100)) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 100");
        }
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value.trim();
    }

    private static String generateId() {
        return "sched-" + UUID.randomUUID().toString().substring(0, ID_SUFFIX_LENGTH);
    }
}
