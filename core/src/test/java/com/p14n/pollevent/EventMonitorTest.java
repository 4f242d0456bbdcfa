package com.p14n.pollevent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.broker.TestAsyncExecutor;
import com.p14n.pollevent.data.BackupRecord;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.data.ControlValue;
import com.p14n.pollevent.data.PersistedEvent;
import com.p14n.pollevent.group.ManualPollResult;
import com.p14n.pollevent.group.UnknownGroupException;
import com.p14n.pollevent.health.HealthMonitor;
import com.p14n.pollevent.health.HealthTier;
import com.p14n.pollevent.query.EventQuery;
import com.p14n.pollevent.query.EventStatistics;
import com.p14n.pollevent.query.QueryResult;
import com.p14n.pollevent.telemetry.TelemetryConfig;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class EventMonitorTest {

    @TempDir
    Path dir;

    private final TestAsyncExecutor executor = new TestAsyncExecutor();
    private final FakeControlPort port = new FakeControlPort();

    private EventMonitor monitor(ConfigData config) {
        return new EventMonitor(config, port, TelemetryConfig.of(OpenTelemetry.noop(), EventMonitor.SCOPE),
                executor, TestUtil.fixedClock(), () -> 0.1);
    }

    @Test
    void testChangesArePolledBufferedAndQueried() {
        port.set("Mixer.gain", -3.0, "-3.0 dB").set("Mixer.mute", false);
        try (EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).build())) {
            monitor.start();
            monitor.createGroup("mixer", 0.5);
            assertTrue(monitor.addControls("mixer", List.of("Mixer.gain", "Mixer.mute")).allAccepted());

            executor.runScheduled();
            assertEquals(2, monitor.buffer().size());
            monitor.flush();

            port.set("Mixer.mute", true, "muted");
            executor.runScheduled();
            monitor.flush();

            QueryResult all = monitor.query(EventQuery.builder().changeGroupId("mixer").build());
            assertEquals(3, all.totalCount());
            PersistedEvent last = all.events().get(2);
            assertEquals("Mixer.mute", last.controlPath());
            assertEquals(ControlValue.of(true), last.value());
            assertEquals("muted", last.stringValue());

            QueryResult gain = monitor.query(EventQuery.builder().controls(List.of("gain")).build());
            assertEquals(1, gain.totalCount());

            EventStatistics stats = monitor.statistics();
            assertEquals(3, stats.totalEvents());
            assertEquals(2, stats.distinctControls());
            assertEquals(0, stats.bufferedEvents());
            assertEquals(HealthTier.HEALTHY, monitor.health().tier());
            assertEquals(1, monitor.listGroups().size());
            assertEquals(2, monitor.group("mixer").controlCount());
        }
    }

    @Test
    void testBufferedEventsSurviveCloseAndReopen() {
        ConfigData config = TestUtil.memoryConfig(dir.resolve("backups"))
                .storagePath(dir.resolve("store").toString()).build();
        port.set("a.x", 1);
        try (EventMonitor monitor = monitor(config)) {
            monitor.createGroup("g");
            monitor.addControls("g", List.of("a.x"));
            executor.runScheduled();
            assertEquals(1, monitor.buffer().size());
        }
        try (EventMonitor reopened = monitor(config)) {
            assertEquals(1, reopened.storedEvents());
            assertTrue(reopened.statistics().storeSizeBytes() > 0);
        }
    }

    @Test
    void testManualPollDoesNotStoreEvents() throws Exception {
        port.set("a.x", 1);
        try (EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).build())) {
            monitor.createGroup("g");
            monitor.stopAutoPoll("g");
            monitor.addControls("g", List.of("a.x"));

            ManualPollResult result = monitor.manualPoll("g", "ui", false);

            assertEquals(1, result.changes().size());
            assertEquals(0, monitor.buffer().size());
            monitor.flush();
            assertEquals(0, monitor.storedEvents());
        }
    }

    @Test
    void testDestroyKeepsAlreadyBufferedEvents() {
        port.set("a.x", 1);
        try (EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).build())) {
            monitor.createGroup("g");
            monitor.addControls("g", List.of("a.x"));
            executor.runScheduled();

            monitor.destroyGroup("g");
            port.set("a.x", 2);
            executor.runScheduled();

            assertEquals(1, monitor.flush());
            assertThrows(UnknownGroupException.class, () -> monitor.group("g"));
            assertTrue(monitor.listGroups().isEmpty());
        }
    }

    @Test
    void testMalformedDataIsolatesGroup() {
        List<MonitorNotification> notifications = new ArrayList<>();
        port.set("a.x", 1).set("b.x", 1);
        try (EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).build())) {
            monitor.subscribe(MonitorNotification.Type.GROUP_ISOLATED, notifications::add);
            monitor.createGroup("a");
            monitor.addControls("a", List.of("a.x"));
            monitor.createGroup("b");
            monitor.addControls("b", List.of("b.x"));
            executor.runScheduled();

            port.set("b.x", Double.NaN);
            executor.runScheduled();

            assertTrue(monitor.healthMonitor().isIsolated("b"));
            assertEquals(1, monitor.buffer().size());
            assertTrue(monitor.health().mitigations().contains(HealthMonitor.GROUP_ISOLATED_PREFIX + "b"));
            assertEquals(1, notifications.size());

            monitor.resetHealth();
            assertTrue(monitor.health().healthy());
        }
    }

    @Test
    void testBackupThroughMonitorIncludesBufferedEvents() {
        port.set("a.x", 1);
        try (EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).build())) {
            monitor.createGroup("g");
            monitor.addControls("g", List.of("a.x"));
            executor.runScheduled();

            BackupRecord backup = monitor.performBackup();

            assertEquals(1L, backup.eventsCount());
            assertEquals(List.of(backup.filename()),
                    monitor.listBackups().stream().map(BackupRecord::filename).toList());
            assertEquals(1, monitor.verifyStore());
            assertEquals(0, monitor.sweepRetention());
        }
    }

    @Test
    void testDisabledMonitoringStillPolls() throws Exception {
        port.set("a.x", 1);
        try (EventMonitor monitor = monitor(ConfigData.builder().monitoringEnabled(false).build())) {
            monitor.start();
            monitor.createGroup("g");
            monitor.addControls("g", List.of("a.x"));
            executor.runScheduled();

            assertEquals(0, monitor.buffer().size());
            assertEquals(1, monitor.manualPoll("g", "ui", false).changes().size());
            assertEquals(0, monitor.flush());
            assertEquals(0, monitor.storedEvents());
            assertFalse(monitor.statistics().monitoringEnabled());
            assertThrows(IllegalStateException.class, () -> monitor.query(EventQuery.all()));
            assertThrows(IllegalStateException.class, monitor::performBackup);
            assertThrows(IllegalStateException.class, monitor::listBackups);
            assertThrows(IllegalStateException.class, monitor::sweepRetention);
        }
    }

    @Test
    void testCloseStopsTimers() {
        EventMonitor monitor = monitor(TestUtil.memoryConfig(dir).backupIntervalMillis(60_000).build());
        monitor.start();
        monitor.createGroup("g");
        assertEquals(4, executor.scheduledCount());
        monitor.close();
        assertEquals(0, executor.scheduledCount());
        monitor.close();
    }
}
