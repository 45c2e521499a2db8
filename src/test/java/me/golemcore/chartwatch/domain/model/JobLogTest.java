package me.golemcore.chartwatch.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobLogTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void completeShouldSetDuration() {
        JobLog jobLog = JobLog.builder().scheduleId("sched-1").startedAt(STARTED).build();

        jobLog.complete(JobStatus.SUCCESS, STARTED.plusMillis(1500));

        assertEquals(JobStatus.SUCCESS, jobLog.getStatus());
        assertEquals(STARTED.plusMillis(1500), jobLog.getCompletedAt());
        assertEquals(1500L, jobLog.getDurationMs());
    }

    @Test
    void completeShouldNeverEndBeforeStart() {
        JobLog jobLog = JobLog.builder().scheduleId("sched-1").startedAt(STARTED).build();

        jobLog.complete(JobStatus.FAILED, STARTED.minusSeconds(5));

        assertEquals(STARTED, jobLog.getCompletedAt());
        assertEquals(0L, jobLog.getDurationMs());
    }

    @Test
    void completeShouldRejectRunningStatus() {
        JobLog jobLog = JobLog.builder().scheduleId("sched-1").startedAt(STARTED).build();

        assertThrows(IllegalArgumentException.class, () -> jobLog.complete(JobStatus.RUNNING, STARTED));
    }

    @Test
    void newRowShouldDefaultToRunningScheduledTrigger() {
        JobLog jobLog = JobLog.builder().scheduleId("sched-1").build();

        assertEquals(JobStatus.RUNNING, jobLog.getStatus());
        assertEquals(RunTrigger.SCHEDULED, jobLog.getTrigger());
    }
}
