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

/**
 * Operator-supplied schedule settings. A {@code null} field means "keep the
 * current value" (or the default, when creating).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSettings {

    private String targetLabel;
    private Boolean enabled;
    private Frequency frequency;
    private Boolean sendToTelegram;
    private Boolean onlyOnSignalChange;
    private Integer minConfidence;
    private Boolean sendOnHold;
    private String telegramChatId;
}
