package com.p14n.pollevent.group;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.pollevent.FakeControlPort;
import com.p14n.pollevent.TestUtil;
import com.p14n.pollevent.broker.TestAsyncExecutor;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.poll.EventSink;
import com.p14n.pollevent.poll.PollEngine;
import com.p14n.pollevent.telemetry.MonitorMetrics;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class ChangeGroupRegistryTest {

    private TestAsyncExecutor executor;
    private ChangeGroupRegistry registry;

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        MonitorMetrics metrics = new MonitorMetrics(OpenTelemetry.noop().getMeter("test"));
        PollEngine engine = new PollEngine(ConfigData.builder().build(), executor, new FakeControlPort(),
                EventSink.DISCARD, metrics, TestUtil.fixedClock());
        registry = new ChangeGroupRegistry(engine, metrics);
    }

    @Test
    void testCreateStartsPolling() {
        GroupSummary summary = registry.create("mixer", 0.5);
        assertEquals("mixer", summary.id());
        assertEquals(0.5, summary.pollRateSeconds());
        assertTrue(summary.running());
        assertEquals(GroupPriority.NORMAL, summary.priority());
        assertEquals(0, summary.controlCount());
        assertEquals(List.of(500_000L), executor.periods(TimeUnit.MICROSECONDS));
    }

    @Test
    void testDefaultRateIsOneSecond() {
        assertEquals(ChangeGroupRegistry.DEFAULT_POLL_RATE_SECONDS, registry.create("g").pollRateSeconds());
    }

    @Test
    void testRatesAreClampedIntoConfiguredBounds() {
        assertEquals(ConfigData.DEFAULT_MIN_POLL_INTERVAL_SECONDS, registry.create("fast", 0.001).pollRateSeconds());
        assertEquals(ConfigData.DEFAULT_MAX_POLL_INTERVAL_SECONDS, registry.create("slow", 1e6).pollRateSeconds());
    }

    @Test
    void testInvalidRatesAreRejected() {
        assertThrows(InvalidPollRateException.class, () -> registry.create("a", 0));
        assertThrows(InvalidPollRateException.class, () -> registry.create("b", -1));
        assertThrows(InvalidPollRateException.class, () -> registry.create("c", Double.NaN));
        assertThrows(InvalidPollRateException.class, () -> registry.create("d", Double.POSITIVE_INFINITY));
        assertEquals(0, registry.size());
    }

    @Test
    void testDuplicateAndBlankIds() {
        registry.create("g");
        assertThrows(DuplicateGroupException.class, () -> registry.create("g"));
        assertThrows(IllegalArgumentException.class, () -> registry.create(" "));
        assertThrows(IllegalArgumentException.class, () -> registry.create(null));
        assertEquals(1, executor.scheduledCount());
    }

    @Test
    void testAddControlsReportsEachReference() {
        registry.create("g");
        AddControlsResult result = registry.addControls("g", List.of("Mixer.gain", "bad..name", "volume", "Mixer.gain"));

        assertEquals(List.of(ControlReference.parse("Mixer.gain"), ControlReference.parse("volume")),
                result.accepted());
        assertFalse(result.allAccepted());
        assertEquals(2, result.rejected().size());
        assertEquals(RejectedControl.Status.INVALID, result.rejected().get(0).status());
        assertEquals("bad..name", result.rejected().get(0).reference());
        assertEquals(RejectedControl.Status.SKIPPED, result.rejected().get(1).status());
        assertEquals(2, registry.summary("g").controlCount());
    }

    @Test
    void testRemoveAndClearControls() {
        registry.create("g");
        registry.addControls("g", List.of("a.x", "a.y", "a.z"));

        AddControlsResult removed = registry.removeControls("g", List.of("a.x", "a.missing"));
        assertEquals(1, removed.accepted().size());
        assertEquals(RejectedControl.Status.SKIPPED, removed.rejected().get(0).status());
        assertEquals(List.of(ControlReference.parse("a.y"), ControlReference.parse("a.z")),
                registry.summary("g").controls());

        registry.clear("g");
        assertEquals(0, registry.summary("g").controlCount());
    }

    @Test
    void testDestroyStopsTimerAndNotifiesListeners() {
        List<String> destroyed = new ArrayList<>();
        registry.addListener(destroyed::add);
        registry.create("g");
        ChangeGroup group = registry.get("g");

        registry.destroy("g");

        assertTrue(group.isDestroyed());
        assertEquals(0, executor.scheduledCount());
        assertEquals(List.of("g"), destroyed);
        assertThrows(UnknownGroupException.class, () -> registry.destroy("g"));
        assertThrows(UnknownGroupException.class, () -> registry.summary("g"));
        assertNull(registry.priorityOf("g"));
    }

    @Test
    void testUnknownGroupOperations() {
        assertThrows(UnknownGroupException.class, () -> registry.addControls("nope", List.of("a")));
        assertThrows(UnknownGroupException.class, () -> registry.removeControls("nope", List.of("a")));
        assertThrows(UnknownGroupException.class, () -> registry.clear("nope"));
        assertThrows(UnknownGroupException.class, () -> registry.setAutoPoll("nope", 1));
        assertThrows(UnknownGroupException.class, () -> registry.stopAutoPoll("nope"));
        assertThrows(UnknownGroupException.class, () -> registry.manualPoll("nope", "me", false));
    }

    @Test
    void testSetAutoPollRestartsTimer() {
        registry.create("g", 1);
        GroupSummary updated = registry.setAutoPoll("g", 2);
        assertEquals(2.0, updated.pollRateSeconds());
        assertEquals(List.of(2_000_000L), executor.periods(TimeUnit.MICROSECONDS));

        GroupSummary stopped = registry.stopAutoPoll("g");
        assertFalse(stopped.running());
        assertEquals(0, executor.scheduledCount());

        assertTrue(registry.setAutoPoll("g", 1).running());
    }

    @Test
    void testListIsSortedById() {
        registry.create("b");
        registry.create("a", 1, GroupPriority.HIGH);
        List<GroupSummary> groups = registry.list();
        assertEquals(List.of("a", "b"), groups.stream().map(GroupSummary::id).toList());
        assertEquals(GroupPriority.HIGH, registry.priorityOf("a"));
    }

    @Test
    void testStopAllKeepsGroupsRegistered() {
        registry.create("a");
        registry.create("b");
        registry.stopAll();
        assertEquals(0, executor.scheduledCount());
        assertEquals(2, registry.size());
    }
}
