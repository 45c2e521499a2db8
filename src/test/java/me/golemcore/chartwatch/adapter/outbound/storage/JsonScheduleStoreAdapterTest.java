package me.golemcore.chartwatch.adapter.outbound.storage;

import me.golemcore.chartwatch.domain.model.AutomationSchedule;
import me.golemcore.chartwatch.domain.model.Frequency;
import me.golemcore.chartwatch.domain.model.JobLog;
import me.golemcore.chartwatch.domain.model.JobStatus;
import me.golemcore.chartwatch.domain.model.SignalAction;
import me.golemcore.chartwatch.infrastructure.config.AutomationConfiguration;
import me.golemcore.chartwatch.infrastructure.config.ChartWatchProperties;
import me.golemcore.chartwatch.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonScheduleStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private JsonScheduleStoreAdapter store;

    @BeforeEach
    void setUp() {
        ChartWatchProperties properties = new ChartWatchProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutomationConfiguration.objectMapper();
        store = new JsonScheduleStoreAdapter(storage, objectMapper);
    }

    @Test
    void shouldPersistSchedulesAcrossInstances() {
        store.saveSchedule(schedule("sched-1", "layout-1").toBuilder().frequency(Frequency.ONE_DAY).build());

        JsonScheduleStoreAdapter reloaded = new JsonScheduleStoreAdapter(storage, objectMapper);

        AutomationSchedule schedule = reloaded.findSchedule("sched-1").orElseThrow();
        assertEquals(Frequency.ONE_DAY, schedule.getFrequency());
        assertEquals(NOW, schedule.getNextRunAt());
        assertEquals("sched-1", reloaded.findScheduleByTarget("layout-1").orElseThrow().getId());
        assertTrue(Files.exists(tempDir.resolve("automation").resolve("schedules.json")));
    }

    @Test
    void returnedSchedulesShouldBeCopies() {
        store.saveSchedule(schedule("sched-1", "layout-1"));

        store.findSchedule("sched-1").orElseThrow().setMinConfidence(99);

        assertEquals(50, store.findSchedule("sched-1").orElseThrow().getMinConfidence());
    }

    @Test
    void saveShouldKeepStoredLastRunAt() {
        store.saveSchedule(schedule("sched-1", "layout-1"));
        store.updateRunTimes("sched-1", NOW, NOW.plusSeconds(3600));

        AutomationSchedule edited = schedule("sched-1", "layout-1");
        edited.setLastRunAt(null);
        AutomationSchedule saved = store.saveSchedule(edited);

        assertEquals(NOW, saved.getLastRunAt());
    }

    @Test
    void updateRunTimesShouldReturnEmptyForDeletedSchedule() {
        Optional<AutomationSchedule> result = store.updateRunTimes("sched-missing", NOW, NOW);

        assertTrue(result.isEmpty());
        assertTrue(store.findAllSchedules().isEmpty());
    }

    @Test
    void updateScheduleShouldApplyChangesToStoredState() {
        store.saveSchedule(schedule("sched-1", "layout-1"));
        store.updateRunTimes("sched-1", NOW, NOW.plusSeconds(3600));

        AutomationSchedule updated = store.updateSchedule("sched-1", s -> s.setSendOnHold(true)).orElseThrow();

        assertTrue(updated.isSendOnHold());
        assertEquals(NOW, updated.getLastRunAt());
        assertEquals(NOW.plusSeconds(3600), updated.getNextRunAt());
        assertTrue(store.findSchedule("sched-1").orElseThrow().isSendOnHold());
    }

    @Test
    void updateScheduleShouldReturnEmptyForUnknownSchedule() {
        assertTrue(store.updateSchedule("sched-missing", s -> s.setEnabled(false)).isEmpty());
    }

    @Test
    void updateScheduleShouldRejectIdChange() {
        store.saveSchedule(schedule("sched-1", "layout-1"));

        assertThrows(IllegalArgumentException.class, () -> store.updateSchedule("sched-1", s -> s.setId("sched-2")));
        assertTrue(store.findSchedule("sched-1").isPresent());
    }

    @Test
    void findJobLogsByStatusShouldScanAllSchedules() {
        store.saveSchedule(schedule("sched-1", "a"));
        store.saveSchedule(schedule("sched-2", "b"));
        store.insertJobLog(log("sched-1", NOW, JobStatus.RUNNING, null));
        store.insertJobLog(log("sched-1", NOW.minusSeconds(60), JobStatus.SUCCESS, SignalAction.BUY));
        store.insertJobLog(log("sched-2", NOW, JobStatus.RUNNING, null));

        List<JobLog> running = store.findJobLogsByStatus(JobStatus.RUNNING);

        assertEquals(2, running.size());
        assertTrue(running.stream().allMatch(l -> l.getStatus() == JobStatus.RUNNING));
    }

    @Test
    void shouldSelectOnlyDueEnabledSchedules() {
        store.saveSchedule(schedule("sched-due", "a"));
        store.saveSchedule(schedule("sched-never-run", "b").toBuilder().nextRunAt(null).build());
        store.saveSchedule(schedule("sched-future", "c").toBuilder().nextRunAt(NOW.plusSeconds(1)).build());
        store.saveSchedule(schedule("sched-disabled", "d").toBuilder().enabled(false).build());

        List<String> due = store.findDueSchedules(NOW).stream().map(AutomationSchedule::getId).toList();

        assertEquals(List.of("sched-due", "sched-never-run"), due);
    }

    @Test
    void insertShouldAssignIdAndUpdateShouldReplace() {
        store.saveSchedule(schedule("sched-1", "layout-1"));
        JobLog inserted = store.insertJobLog(JobLog.builder().scheduleId("sched-1").startedAt(NOW).build());
        assertNotNull(inserted.getId());
        assertTrue(inserted.getId().startsWith("job-"));

        inserted.setAction(SignalAction.SELL);
        inserted.complete(JobStatus.SUCCESS, NOW.plusSeconds(2));
        store.updateJobLog(inserted);

        JobLog stored = store.findJobLogs("sched-1", 10).get(0);
        assertEquals(JobStatus.SUCCESS, stored.getStatus());
        assertEquals(SignalAction.SELL, stored.getAction());
        assertEquals(2000L, stored.getDurationMs());
    }

    @Test
    void updateShouldThrowForUnknownJobLog() {
        JobLog unknown = JobLog.builder().id("job-missing").scheduleId("sched-1").startedAt(NOW).build();

        assertThrows(NoSuchElementException.class, () -> store.updateJobLog(unknown));
    }

    @Test
    void findLatestJobLogShouldFilterStatusAndExcludeCurrent() {
        store.saveSchedule(schedule("sched-1", "layout-1"));
        store.insertJobLog(log("sched-1", NOW, JobStatus.SUCCESS, SignalAction.BUY));
        store.insertJobLog(log("sched-1", NOW.plusSeconds(60), JobStatus.FAILED, null));
        JobLog current = store.insertJobLog(log("sched-1", NOW.plusSeconds(120), JobStatus.RUNNING, null));

        Optional<JobLog> latest = store.findLatestJobLog("sched-1",
                EnumSet.of(JobStatus.SUCCESS, JobStatus.SKIPPED), current.getId());

        assertEquals(SignalAction.BUY, latest.orElseThrow().getAction());
    }

    @Test
    void findLatestJobLogShouldPreferLaterInsertOnTie() {
        store.insertJobLog(log("sched-1", NOW, JobStatus.SUCCESS, SignalAction.BUY));
        store.insertJobLog(log("sched-1", NOW, JobStatus.SKIPPED, SignalAction.SELL));

        JobLog latest = store.findLatestJobLog("sched-1", EnumSet.of(JobStatus.SUCCESS, JobStatus.SKIPPED), null)
                .orElseThrow();

        assertEquals(SignalAction.SELL, latest.getAction());
    }

    @Test
    void recentJobLogsShouldMergeSchedulesNewestFirst() {
        store.saveSchedule(schedule("sched-1", "a"));
        store.saveSchedule(schedule("sched-2", "b"));
        store.insertJobLog(log("sched-1", NOW, JobStatus.SUCCESS, SignalAction.BUY));
        store.insertJobLog(log("sched-2", NOW.plusSeconds(10), JobStatus.SKIPPED, SignalAction.HOLD));
        store.insertJobLog(log("sched-1", NOW.plusSeconds(20), JobStatus.FAILED, null));

        List<JobLog> recent = store.findRecentJobLogs(2);

        assertEquals(2, recent.size());
        assertEquals(NOW.plusSeconds(20), recent.get(0).getStartedAt());
        assertEquals("sched-2", recent.get(1).getScheduleId());
    }

    @Test
    void deleteShouldRemoveLogsFile() {
        store.saveSchedule(schedule("sched-1", "layout-1"));
        store.insertJobLog(log("sched-1", NOW, JobStatus.SUCCESS, SignalAction.BUY));
        Path logsFile = tempDir.resolve("automation").resolve("logs").resolve("sched-1.json");
        assertTrue(Files.exists(logsFile));

        assertTrue(store.deleteSchedule("sched-1"));

        assertFalse(Files.exists(logsFile));
        assertTrue(store.findJobLogs("sched-1", 10).isEmpty());
        assertFalse(store.deleteSchedule("sched-1"));
    }

    @Test
    void shouldTrimOldestLogsBeyondCap() {
        for (int i = 0; i < JsonScheduleStoreAdapter.MAX_LOGS_PER_SCHEDULE + 5; i++) {
            store.insertJobLog(log("sched-1", NOW.plusSeconds(i), JobStatus.SUCCESS, SignalAction.BUY));
        }

        List<JobLog> logs = store.findJobLogs("sched-1", Integer.MAX_VALUE);

        assertEquals(JsonScheduleStoreAdapter.MAX_LOGS_PER_SCHEDULE, logs.size());
        assertEquals(NOW.plusSeconds(5), logs.get(logs.size() - 1).getStartedAt());
    }

    @Test
    void corruptedDocumentShouldFailLoudly() throws Exception {
        Files.writeString(tempDir.resolve("automation").resolve("schedules.json"), "{not json");

        assertThrows(IllegalStateException.class, () -> store.findAllSchedules());
    }

    @Test
    void failedWriteShouldKeepPreviousState() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        JsonScheduleStoreAdapter failingStore = new JsonScheduleStoreAdapter(failing, objectMapper);
        AutomationSchedule schedule = schedule("sched-1", "layout-1");

        assertThrows(IllegalStateException.class, () -> failingStore.saveSchedule(schedule));
        assertTrue(failingStore.findAllSchedules().isEmpty());
    }

    private static AutomationSchedule schedule(String id, String targetRef) {
        return AutomationSchedule.builder()
                .id(id)
                .targetRef(targetRef)
                .createdAt(NOW)
                .updatedAt(NOW)
                .nextRunAt(NOW)
                .build();
    }

    private static JobLog log(String scheduleId, Instant startedAt, JobStatus status, SignalAction action) {
        return JobLog.builder()
                .scheduleId(scheduleId)
                .startedAt(startedAt)
                .status(status)
                .action(action)
                .build();
    }
}
