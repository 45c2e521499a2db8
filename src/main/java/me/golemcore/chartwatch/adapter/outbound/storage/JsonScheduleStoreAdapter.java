package me.golemcore.chartwatch.adapter.outbound.storage;

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
import me.golemcore.chartwatch.domain.model.JobStatus;
import me.golemcore.chartwatch.port.outbound.ScheduleStorePort;
import me.golemcore.chartwatch.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link ScheduleStorePort} backed by JSON documents in the workspace:
 * {@code automation/schedules.json} holds every schedule and
 * {@code automation/logs/<scheduleId>.json} holds one schedule's run history.
 *
 * <p>
 * Documents are loaded lazily and cached. All access is serialized on this
 * instance; every mutation is written atomically before the cache is
 * replaced, so a failed write leaves the previous state visible.
 */
@Component
@Slf4j
public class JsonScheduleStoreAdapter implements ScheduleStorePort {

    static final String AUTOMATION_DIR = "automation";
    static final String SCHEDULES_FILE = "schedules.json";
    static final String LOGS_PREFIX = "logs/";
    static final int MAX_LOGS_PER_SCHEDULE = 1000;

    private static final TypeReference<List<AutomationSchedule>> SCHEDULE_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<JobLog>> JOB_LOG_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final Comparator<JobLog> NEWEST_FIRST = Comparator
            .comparing(JobLog::getStartedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .reversed();

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private List<AutomationSchedule> schedulesCache;
    private final Map<String, List<JobLog>> jobLogsCache = new HashMap<>();

    public JsonScheduleStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    // ==================== SCHEDULES ====================

    @Override
    public synchronized List<AutomationSchedule> findAllSchedules() {
        return getSchedules().stream().map(JsonScheduleStoreAdapter::copy).toList();
    }

    @Override
    public synchronized Optional<AutomationSchedule> findSchedule(String scheduleId) {
        return getSchedules().stream()
                .filter(s -> s.getId().equals(scheduleId))
                .findFirst()
                .map(JsonScheduleStoreAdapter::copy);
    }

    @Override
    public synchronized Optional<AutomationSchedule> findScheduleByTarget(String targetRef) {
        return getSchedules().stream()
                .filter(s -> s.getTargetRef() != null && s.getTargetRef().equals(targetRef))
                .findFirst()
                .map(JsonScheduleStoreAdapter::copy);
    }

    @Override
    public synchronized AutomationSchedule saveSchedule(AutomationSchedule schedule) {
        if (schedule.getId() == null || schedule.getId().isBlank()) {
            throw new IllegalArgumentException("Schedule id is required");
        }
        List<AutomationSchedule> updated = new ArrayList<>(getSchedules());
        AutomationSchedule stored = copy(schedule);
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(schedule.getId())) {
                stored.setLastRunAt(updated.get(i).getLastRunAt());
                updated.set(i, stored);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            updated.add(stored);
        }
        writeSchedules(updated);
        return copy(stored);
    }

    @Override
    public synchronized Optional<AutomationSchedule> updateSchedule(String scheduleId,
            Consumer<AutomationSchedule> update) {
        List<AutomationSchedule> updated = new ArrayList<>(getSchedules());
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(scheduleId)) {
                AutomationSchedule stored = copy(updated.get(i));
                update.accept(stored);
                if (!scheduleId.equals(stored.getId())) {
                    throw new IllegalArgumentException("Schedule id cannot be changed: " + scheduleId);
                }
                updated.set(i, stored);
                writeSchedules(updated);
                return Optional.of(copy(stored));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<AutomationSchedule> updateRunTimes(String scheduleId, Instant lastRunAt,
            Instant nextRunAt) {
        List<AutomationSchedule> updated = new ArrayList<>(getSchedules());
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(scheduleId)) {
                AutomationSchedule stored = updated.get(i).toBuilder()
                        .lastRunAt(lastRunAt)
                        .nextRunAt(nextRunAt)
                        .build();
                updated.set(i, stored);
                writeSchedules(updated);
                return Optional.of(copy(stored));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized boolean deleteSchedule(String scheduleId) {
        List<AutomationSchedule> updated = new ArrayList<>(getSchedules());
        boolean removed = updated.removeIf(s -> s.getId().equals(scheduleId));
        if (!removed) {
            return false;
        }
        writeSchedules(updated);
        storagePort.deleteObject(AUTOMATION_DIR, logsPath(scheduleId)).join();
        jobLogsCache.remove(scheduleId);
        log.info("[Store] Deleted schedule {} and its job history", scheduleId);
        return true;
    }

    @Override
    public synchronized List<AutomationSchedule> findDueSchedules(Instant now) {
        return getSchedules().stream()
                .filter(s -> s.isDue(now))
                .map(JsonScheduleStoreAdapter::copy)
                .toList();
    }

    // ==================== JOB LOGS ====================

    @Override
    public synchronized JobLog insertJobLog(JobLog jobLog) {
        if (jobLog.getScheduleId() == null) {
            throw new IllegalArgumentException("Job log scheduleId is required");
        }
        JobLog stored = jobLog.toBuilder()
                .id(jobLog.getId() != null ? jobLog.getId() : "job-" + UUID.randomUUID())
                .build();
        List<JobLog> updated = new ArrayList<>(getJobLogs(stored.getScheduleId()));
        updated.add(stored);
        if (updated.size() > MAX_LOGS_PER_SCHEDULE) {
            updated = new ArrayList<>(updated.subList(updated.size() - MAX_LOGS_PER_SCHEDULE, updated.size()));
        }
        writeJobLogs(stored.getScheduleId(), updated);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized JobLog updateJobLog(JobLog jobLog) {
        List<JobLog> updated = new ArrayList<>(getJobLogs(jobLog.getScheduleId()));
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(jobLog.getId())) {
                JobLog stored = jobLog.toBuilder().build();
                updated.set(i, stored);
                writeJobLogs(jobLog.getScheduleId(), updated);
                return stored.toBuilder().build();
            }
        }
        throw new NoSuchElementException("Job log not found: " + jobLog.getId());
    }

    @Override
    public synchronized Optional<JobLog> findLatestJobLog(String scheduleId, Set<JobStatus> statuses,
            String excludeJobLogId) {
        JobLog latest = null;
        for (JobLog candidate : getJobLogs(scheduleId)) {
            if (candidate.getId().equals(excludeJobLogId) || !statuses.contains(candidate.getStatus())) {
                continue;
            }
            if (latest == null || isNotBefore(candidate.getStartedAt(), latest.getStartedAt())) {
                latest = candidate;
            }
        }
        return Optional.ofNullable(latest).map(l -> l.toBuilder().build());
    }

    @Override
    public synchronized List<JobLog> findJobLogsByStatus(JobStatus status) {
        List<JobLog> matching = new ArrayList<>();
        for (AutomationSchedule schedule : getSchedules()) {
            for (JobLog jobLog : getJobLogs(schedule.getId())) {
                if (jobLog.getStatus() == status) {
                    matching.add(jobLog.toBuilder().build());
                }
            }
        }
        return matching;
    }

    @Override
    public synchronized List<JobLog> findJobLogs(String scheduleId, int limit) {
        return newestFirst(getJobLogs(scheduleId), limit);
    }

    @Override
    public synchronized List<JobLog> findRecentJobLogs(int limit) {
        List<JobLog> all = new ArrayList<>();
        for (AutomationSchedule schedule : getSchedules()) {
            all.addAll(getJobLogs(schedule.getId()));
        }
        return newestFirst(all, limit);
    }

    // ==================== PERSISTENCE ====================

    private List<AutomationSchedule> getSchedules() {
        if (schedulesCache == null) {
            schedulesCache = readList(SCHEDULES_FILE, SCHEDULE_LIST_TYPE_REF);
        }
        return schedulesCache;
    }

    private List<JobLog> getJobLogs(String scheduleId) {
        return jobLogsCache.computeIfAbsent(scheduleId,
                id -> readList(logsPath(id), JOB_LOG_LIST_TYPE_REF));
    }

    private void writeSchedules(List<AutomationSchedule> schedules) {
        write(SCHEDULES_FILE, schedules);
        schedulesCache = schedules;
    }

    private void writeJobLogs(String scheduleId, List<JobLog> jobLogs) {
        write(logsPath(scheduleId), jobLogs);
        jobLogsCache.put(scheduleId, jobLogs);
    }

    private void write(String path, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + path, e);
        }
        try {
            storagePort.putTextAtomic(AUTOMATION_DIR, path, json, false).join();
        } catch (RuntimeException e) {
            log.error("[Store] Failed to write {}/{}", AUTOMATION_DIR, path, e);
            throw new IllegalStateException("Failed to write " + path, e);
        }
    }

    private <T> List<T> readList(String path, TypeReference<List<T>> type) {
        String json = storagePort.getText(AUTOMATION_DIR, path).join();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted document " + AUTOMATION_DIR + "/" + path, e);
        }
    }

    private static List<JobLog> newestFirst(List<JobLog> jobLogs, int limit) {
        List<JobLog> reversed = new ArrayList<>(jobLogs);
        // reverse first so that equal start times keep the newest insert on top
        Collections.reverse(reversed);
        return reversed.stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .map(l -> l.toBuilder().build())
                .toList();
    }

    private static boolean isNotBefore(Instant candidate, Instant current) {
        if (candidate == null) {
            return current == null;
        }
        return current == null || !candidate.isBefore(current);
    }

    private static String logsPath(String scheduleId) {
        return LOGS_PREFIX + scheduleId + ".json";
    }

    private static AutomationSchedule copy(AutomationSchedule schedule) {
        return schedule.toBuilder().build();
    }
}
