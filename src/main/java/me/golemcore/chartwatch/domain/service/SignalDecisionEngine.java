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
import me.golemcore.chartwatch.domain.model.DispatchDecision;
import me.golemcore.chartwatch.domain.model.SignalAction;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides whether a fresh signal is worth a notification, given the previous
 * recorded signal and the schedule's filters.
 *
 * <p>
 * Rules are evaluated in a fixed order and the first failing rule becomes the
 * skip reason:
 * <ol>
 * <li>HOLD while {@code sendOnHold} is off: {@value DispatchDecision#HOLD_SUPPRESSED}</li>
 * <li>unchanged action while {@code onlyOnSignalChange} is on:
 * {@value DispatchDecision#SIGNAL_UNCHANGED}</li>
 * <li>confidence under {@code minConfidence}:
 * {@value DispatchDecision#CONFIDENCE_BELOW_THRESHOLD}</li>
 * </ol>
 * Stateless; the same inputs always produce the same decision.
 */
@Component
public class SignalDecisionEngine {

    public DispatchDecision decide(SignalAction action, int confidence, SignalAction previousAction,
            AutomationSchedule schedule) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(schedule, "schedule");

        boolean signalChanged = previousAction == null || previousAction != action;
        boolean metMinConfidence = confidence >= schedule.getMinConfidence();

        if (action == SignalAction.HOLD && !schedule.isSendOnHold()) {
            return DispatchDecision.skip(signalChanged, metMinConfidence, DispatchDecision.HOLD_SUPPRESSED);
        }
        if (schedule.isOnlyOnSignalChange() && !signalChanged) {
            return DispatchDecision.skip(signalChanged, metMinConfidence, DispatchDecision.SIGNAL_UNCHANGED);
        }
        if (!metMinConfidence) {
            return DispatchDecision.skip(signalChanged, metMinConfidence,
                    DispatchDecision.CONFIDENCE_BELOW_THRESHOLD);
        }
        return DispatchDecision.dispatch(signalChanged, metMinConfidence);
    }
}
