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

/**
 * Outcome of filter evaluation for one run. The boolean snapshots are filled in
 * even when the run is skipped so that skip reasons stay auditable.
 */
public record DispatchDecision(
        boolean shouldDispatch,
        boolean signalChanged,
        boolean metMinConfidence,
        String skipReason) {

    public static final String HOLD_SUPPRESSED = "hold suppressed";
    public static final String SIGNAL_UNCHANGED = "signal unchanged";
    public static final String CONFIDENCE_BELOW_THRESHOLD = "confidence below threshold";

    public static DispatchDecision dispatch(boolean signalChanged, boolean metMinConfidence) {
        return new DispatchDecision(true, signalChanged, metMinConfidence, null);
    }

    public static DispatchDecision skip(boolean signalChanged, boolean metMinConfidence, String reason) {
        return new DispatchDecision(false, signalChanged, metMinConfidence, reason);
    }
}
