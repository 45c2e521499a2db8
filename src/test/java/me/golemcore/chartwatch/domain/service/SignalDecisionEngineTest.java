package me.golemcore.chartwatch.domain.service;

import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.DispatchDecision;
import me.golemcore.chartwatch.domain.model.SignalAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalDecisionEngineTest {

    private SignalDecisionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SignalDecisionEngine();
    }

    @Test
    void shouldDispatchChangedSignalAboveThreshold() {
        AutomationSchedule schedule = schedule(true, 70, false);

        DispatchDecision decision = engine.decide(SignalAction.BUY, 80, SignalAction.SELL, schedule);

        assertTrue(decision.shouldDispatch());
        assertTrue(decision.signalChanged());
        assertTrue(decision.metMinConfidence());
        assertNull(decision.skipReason());
    }

    @Test
    void shouldSkipUnchangedSignalWhenOnlyOnChange() {
        AutomationSchedule schedule = schedule(true, 70, false);

        DispatchDecision decision = engine.decide(SignalAction.BUY, 85, SignalAction.BUY, schedule);

        assertFalse(decision.shouldDispatch());
        assertFalse(decision.signalChanged());
        assertTrue(decision.metMinConfidence());
        assertEquals(DispatchDecision.SIGNAL_UNCHANGED, decision.skipReason());
    }

    @Test
    void shouldTreatMissingPreviousActionAsChange() {
        DispatchDecision decision = engine.decide(SignalAction.SELL, 60, null, schedule(true, 50, false));

        assertTrue(decision.shouldDispatch());
        assertTrue(decision.signalChanged());
    }

    @Test
    void shouldSuppressHoldBeforeCheckingOtherRules() {
        AutomationSchedule schedule = schedule(true, 90, false);

        DispatchDecision decision = engine.decide(SignalAction.HOLD, 10, SignalAction.HOLD, schedule);

        assertFalse(decision.shouldDispatch());
        assertEquals(DispatchDecision.HOLD_SUPPRESSED, decision.skipReason());
        assertFalse(decision.signalChanged());
        assertFalse(decision.metMinConfidence());
    }

    @Test
    void shouldReportUnchangedBeforeLowConfidence() {
        AutomationSchedule schedule = schedule(true, 90, false);

        DispatchDecision decision = engine.decide(SignalAction.SELL, 10, SignalAction.SELL, schedule);

        assertEquals(DispatchDecision.SIGNAL_UNCHANGED, decision.skipReason());
    }

    @Test
    void shouldSkipLowConfidence() {
        DispatchDecision decision = engine.decide(SignalAction.BUY, 49, SignalAction.SELL, schedule(false, 50, false));

        assertFalse(decision.shouldDispatch());
        assertFalse(decision.metMinConfidence());
        assertEquals(DispatchDecision.CONFIDENCE_BELOW_THRESHOLD, decision.skipReason());
    }

    @Test
    void shouldAcceptConfidenceEqualToThreshold() {
        DispatchDecision decision = engine.decide(SignalAction.BUY, 50, SignalAction.BUY, schedule(false, 50, false));

        assertTrue(decision.shouldDispatch());
        assertTrue(decision.metMinConfidence());
        assertFalse(decision.signalChanged());
    }

    @Test
    void shouldDispatchHoldWhenSendOnHoldEnabled() {
        DispatchDecision decision = engine.decide(SignalAction.HOLD, 75, SignalAction.BUY, schedule(false, 50, true));

        assertTrue(decision.shouldDispatch());
    }

    @Test
    void shouldReturnSameDecisionForSameInputs() {
        AutomationSchedule schedule = schedule(true, 60, false);

        DispatchDecision first = engine.decide(SignalAction.SELL, 55, SignalAction.BUY, schedule);
        DispatchDecision second = engine.decide(SignalAction.SELL, 55, SignalAction.BUY, schedule);

        assertEquals(first, second);
    }

    @Test
    void shouldRejectMissingAction() {
        AutomationSchedule schedule = schedule(false, 50, false);

        assertThrows(NullPointerException.class, () -> engine.decide(null, 50, null, schedule));
    }

    private static AutomationSchedule schedule(boolean onlyOnSignalChange, int minConfidence, boolean sendOnHold) {
        return AutomationSchedule.builder()
                .id("sched-1")
                .targetRef("layout-1")
                .onlyOnSignalChange(onlyOnSignalChange)
                .minConfidence(minConfidence)
                .sendOnHold(sendOnHold)
                .build();
    }
}
