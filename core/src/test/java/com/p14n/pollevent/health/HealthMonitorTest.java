package com.p14n.pollevent.health;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.pollevent.TestUtil;
import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.broker.NotificationBroker;
import com.p14n.pollevent.broker.TestAsyncExecutor;
import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.group.GroupDirectory;
import com.p14n.pollevent.group.GroupPriority;
import com.p14n.pollevent.telemetry.MonitorMetrics;

import io.opentelemetry.api.OpenTelemetry;

import static com.p14n.pollevent.TestUtil.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HealthMonitorTest {

    private EventBuffer buffer;
    private GroupDirectory groups;
    private List<MonitorNotification> notifications;
    private double memory;
    private HealthMonitor health;

    @BeforeEach
    void setUp() {
        buffer = new EventBuffer(100);
        groups = mock(GroupDirectory.class);
        when(groups.priorityOf(anyString())).thenReturn(GroupPriority.NORMAL);
        notifications = new ArrayList<>();
        NotificationBroker broker = new NotificationBroker(new TestAsyncExecutor());
        broker.subscribe(notifications::add);
        memory = 0.1;
        health = new HealthMonitor(ConfigData.builder().build(), buffer, groups, () -> memory, broker,
                new MonitorMetrics(OpenTelemetry.noop().getMeter("test")), TestUtil.fixedClock());
    }

    @Test
    void testStartsHealthy() {
        HealthStatus status = health.status();
        assertTrue(status.healthy());
        assertEquals(0, status.errorCount());
        assertNull(status.lastError());
        assertTrue(status.issues().isEmpty());
        assertEquals(TestUtil.NOW, status.checkedAt());
    }

    @Test
    void testErrorCountTiers() {
        for (int i = 0; i < 10; i++) {
            health.handleFailure(FailureKind.TRANSIENT_IO, "blip", null);
        }
        health.recordWriteSuccess(Set.of());
        assertEquals(HealthTier.HEALTHY, health.status().tier());

        health.handleFailure(FailureKind.TRANSIENT_IO, "blip", null);
        health.recordWriteSuccess(Set.of());
        assertEquals(HealthTier.DEGRADED, health.status().tier());
        assertTrue(health.status().issues().contains("High error count: 11"));

        for (int i = 0; i < 40; i++) {
            health.handleFailure(FailureKind.TRANSIENT_IO, "blip", null);
            health.recordWriteSuccess(Set.of());
        }
        assertEquals(HealthTier.UNHEALTHY, health.status().tier());
        assertEquals(51, health.errorCount());
    }

    @Test
    void testRecurringTransientFailuresDegrade() {
        for (int i = 0; i < 5; i++) {
            health.handleFailure(FailureKind.TRANSIENT_IO, "timeout", null);
        }
        HealthStatus status = health.status();
        assertEquals(HealthTier.DEGRADED, status.tier());
        assertEquals(FailureKind.TRANSIENT_IO, status.lastError().kind());

        health.recordWriteSuccess(Set.of());
        assertEquals(HealthTier.HEALTHY, health.status().tier());
    }

    @Test
    void testUtilizationTiers() {
        for (int i = 0; i < 85; i++) {
            buffer.add(event(i + 1, "g", "x", i));
        }
        assertEquals(HealthTier.DEGRADED, health.status().tier());
        for (int i = 85; i < 95; i++) {
            buffer.add(event(i + 1, "g", "x", i));
        }
        assertEquals(HealthTier.UNHEALTHY, health.status().tier());
    }

    @Test
    void testStorageFailureDisablesSpilloverUntilWriteSucceeds() {
        health.handleFailure(FailureKind.STORAGE_EXHAUSTED, "disk full", null);
        health.handleFailure(FailureKind.STORAGE_EXHAUSTED, "disk full", null);

        assertFalse(health.spilloverEnabled());
        HealthStatus status = health.status();
        assertEquals(List.of(HealthMonitor.SPILLOVER_DISABLED), status.mitigations());
        assertEquals(HealthTier.DEGRADED, status.tier());
        assertEquals(1, count(MonitorNotification.Type.SPILLOVER_DISABLED));

        health.recordWriteSuccess(Set.of("g"));
        assertTrue(health.spilloverEnabled());
        assertEquals(1, count(MonitorNotification.Type.SPILLOVER_RESUMED));
    }

    @Test
    void testManualSpilloverResume() {
        health.handleFailure(FailureKind.STORAGE_EXHAUSTED, "disk full", null);
        health.resumeSpillover();
        assertTrue(health.spilloverEnabled());
        health.resumeSpillover();
        assertEquals(1, count(MonitorNotification.Type.SPILLOVER_RESUMED));
    }

    @Test
    void testMemoryFailureEvictsHalfTheBuffer() {
        for (int i = 0; i < 10; i++) {
            buffer.add(event(i + 1, "g", "x", i));
        }
        health.handleFailure(FailureKind.MEMORY_EXHAUSTED, "heap", null);

        assertEquals(5, buffer.size());
        assertEquals(5, health.status().lastEviction().removed());
        assertEquals(1, count(MonitorNotification.Type.EVICTION));
    }

    @Test
    void testMemoryPressureCheck() {
        buffer.add(event(1, "g", "x", 1));
        buffer.add(event(2, "g", "x", 2));
        assertFalse(health.checkMemoryPressure());
        memory = 0.97;
        assertTrue(health.checkMemoryPressure());
        assertEquals(1, buffer.size());
        assertEquals(FailureKind.MEMORY_EXHAUSTED, health.status().lastError().kind());
    }

    @Test
    void testCorruptionIsolatesGroup() {
        buffer.add(event(1, "bad", "x", 1));
        buffer.add(event(2, "good", "x", 1));

        health.handleFailure(FailureKind.CORRUPTION_DETECTED, "malformed", "bad");

        assertTrue(health.isIsolated("bad"));
        assertEquals(1, buffer.size());
        assertEquals("good", buffer.snapshot().get(0).changeGroupId());
        verify(groups).resetCache("bad");
        assertTrue(health.status().mitigations().contains(HealthMonitor.GROUP_ISOLATED_PREFIX + "bad"));
        MonitorNotification isolated = notifications.stream()
                .filter(n -> n.type() == MonitorNotification.Type.GROUP_ISOLATED).findFirst().orElseThrow();
        assertEquals("bad", isolated.changeGroupId());
        assertEquals(1L, isolated.counts().get("dropped"));

        health.recordWriteSuccess(Set.of("good"));
        assertTrue(health.isIsolated("bad"));
        health.recordWriteSuccess(Set.of("bad"));
        assertFalse(health.isIsolated("bad"));
    }

    @Test
    void testDestroyedGroupLeavesIsolation() {
        health.handleFailure(FailureKind.CORRUPTION_DETECTED, "malformed", "bad");
        health.groupDestroyed("bad");
        assertFalse(health.isIsolated("bad"));
    }

    @Test
    void testRecordFailureClassifies() {
        assertEquals(FailureKind.STORAGE_EXHAUSTED,
                health.recordFailure(new java.sql.SQLException("No space left on device")));
        assertFalse(health.spilloverEnabled());
    }

    @Test
    void testResetClearsEverything() {
        health.handleFailure(FailureKind.STORAGE_EXHAUSTED, "disk full", null);
        health.handleFailure(FailureKind.CORRUPTION_DETECTED, "malformed", "bad");
        for (int i = 0; i < 60; i++) {
            health.handleFailure(FailureKind.TRANSIENT_IO, "blip", null);
        }

        health.reset();

        HealthStatus status = health.status();
        assertTrue(status.healthy());
        assertEquals(0, status.errorCount());
        assertTrue(status.mitigations().isEmpty());
        assertTrue(health.spilloverEnabled());
    }

    private long count(MonitorNotification.Type type) {
        return notifications.stream().filter(n -> n.type() == type).count();
    }
}
