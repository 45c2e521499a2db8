package me.golemcore.chartwatch.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one execution attempt of a schedule. Created as
 * {@link JobStatus#RUNNING} and updated exactly once to a terminal state.
 *
 * <p>
 * The notification outcome ({@code telegramSent}, {@code telegramError}) is
 * recorded independently of {@code status}: a failed delivery never turns a
 * successful run into a failed one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobLog {

    private String id;
    private String scheduleId;

    @Builder.Default
    private RunTrigger trigger = RunTrigger.SCHEDULED;

    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;

    @Builder.Default
    private JobStatus status = JobStatus.RUNNING;

    private SignalAction action;
    private Integer confidence;
    private SignalAction previousAction;
    private boolean signalChanged;
    private boolean metMinConfidence;

    private boolean telegramSent;
    private String telegramChatId;
    private String telegramError;

    private String skipReason;
    private String errorMessage;
    private String errorStack;

    private String analysisId;

    /**
     * Stamp completion time and derive the duration from {@code startedAt}.
     */
    public void complete(JobStatus terminalStatus, Instant now) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        Instant completed = startedAt != null && now.isBefore(startedAt) ? startedAt : now;
        this.status = terminalStatus;
        this.completedAt = completed;
        this.durationMs = startedAt != null ? completed.toEpochMilli() - startedAt.toEpochMilli() : 0L;
    }
}
