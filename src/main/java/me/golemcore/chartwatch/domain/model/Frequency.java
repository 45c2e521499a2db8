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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * Period between two runs of an automation schedule. Each value maps to a fixed
 * duration; there is no calendar alignment.
 */
public enum Frequency {

    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    ONE_DAY("1d", Duration.ofDays(1)),
    ONE_WEEK("1w", Duration.ofDays(7));

    private final String code;
    private final Duration interval;

    Frequency(String code, Duration interval) {
        this.code = code;
        this.interval = interval;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Parse a frequency code such as {@code "15m"} or {@code "4h"}.
     *
     * @throws IllegalArgumentException
     *             if the code is blank or unknown
     */
    @JsonCreator
    public static Frequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("frequency is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Frequency frequency : values()) {
            if (frequency.code.equals(normalized)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unsupported frequency: " + code);
    }
}
