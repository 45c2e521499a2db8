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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's recurring analysis job for one chart target, together with the
 * filters that decide whether a result is worth a notification.
 *
 * <p>
 * {@code lastRunAt} and {@code nextRunAt} are written only by the run that
 * holds the schedule's lease.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationSchedule {

    public static final int DEFAULT_MIN_CONFIDENCE = 50;

    private String id;
    private String targetRef;
    private String targetLabel;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private Frequency frequency = Frequency.ONE_HOUR;

    @Builder.Default
    private boolean sendToTelegram = true;

    private boolean onlyOnSignalChange;

    @Builder.Default
    private int minConfidence = DEFAULT_MIN_CONFIDENCE;

    private boolean sendOnHold;

    /** Destination override; {@code null} falls back to the configured chat. */
    private String telegramChatId;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastRunAt;
    private Instant nextRunAt;

    /**
     * Whether the periodic tick should pick this schedule up at {@code now}.
     */
    public boolean isDue(Instant now) {
        return enabled && (nextRunAt == null || !nextRunAt.isAfter(now));
    }

    @JsonIgnore
    public String getDisplayLabel() {
        return targetLabel != null && !targetLabel.isBlank() ? targetLabel : targetRef;
    }
}
