package me.golemcore.chartwatch.port.outbound;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Durable store for automation schedules and their run history.
 *
 * <p>
 * Returned objects are detached copies: mutating them has no effect until
 * they are passed back to a save/update method. Implementations must be safe
 * for concurrent use by the scheduler's worker threads.
 */
public interface ScheduleStorePort {

    List<AutomationSchedule> findAllSchedules();

    Optional<AutomationSchedule> findSchedule(String scheduleId);

    Optional<AutomationSchedule> findScheduleByTarget(String targetRef);

    /**
     * Insert or replace a schedule by id. When replacing, the stored
     * {@code lastRunAt} is kept: it is owned by {@link #updateRunTimes}.
     */
    AutomationSchedule saveSchedule(AutomationSchedule schedule);

    /**
     * Apply {@code update} to the currently stored schedule and persist the
     * result as one atomic step. The callback receives a copy of the stored
     * state, never the caller's snapshot, and must not change the id.
     *
     * @return the updated schedule, or empty if no schedule had that id
     */
    Optional<AutomationSchedule> updateSchedule(String scheduleId, Consumer<AutomationSchedule> update);

    /**
     * Atomically set the run timestamps of a schedule without touching any
     * other field.
     *
     * @return the updated schedule, or empty if it was deleted meanwhile
     */
    Optional<AutomationSchedule> updateRunTimes(String scheduleId, Instant lastRunAt, Instant nextRunAt);

    /**
     * Delete a schedule together with its job log history.
     *
     * @return {@code false} if no schedule had that id
     */
    boolean deleteSchedule(String scheduleId);

    /**
     * Enabled schedules whose {@code nextRunAt} is null or not after
     * {@code now}.
     */
    List<AutomationSchedule> findDueSchedules(Instant now);

    /**
     * Append a new job log row. The id is assigned by the store when absent.
     */
    JobLog insertJobLog(JobLog jobLog);

    /**
     * Replace an existing job log row by id.
     *
     * @throws java.util.NoSuchElementException
     *             if the row does not exist
     */
    JobLog updateJobLog(JobLog jobLog);

    /**
     * Most recent row (by {@code startedAt}) of the schedule whose status is
     * one of {@code statuses}, ignoring the row with id {@code excludeJobLogId}.
     */
    Optional<JobLog> findLatestJobLog(String scheduleId, Set<JobStatus> statuses, String excludeJobLogId);

    /**
     * Job logs of every schedule that currently have {@code status}.
     */
    List<JobLog> findJobLogsByStatus(JobStatus status);

    /**
     * Job logs of one schedule, newest first.
     */
    List<JobLog> findJobLogs(String scheduleId, int limit);

    /**
     * Job logs across all schedules, newest first.
     */
    List<JobLog> findRecentJobLogs(int limit);
}
