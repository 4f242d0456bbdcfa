package com.p14n.pollevent.retention;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.pollevent.TestUtil;
import com.p14n.pollevent.broker.NotificationBroker;
import com.p14n.pollevent.broker.TestAsyncExecutor;
import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.data.PersistedEvent;
import com.p14n.pollevent.db.DatabaseSetup;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.PoolSetup;
import com.p14n.pollevent.db.WritePath;
import com.p14n.pollevent.group.GroupDirectory;
import com.p14n.pollevent.health.HealthMonitor;
import com.p14n.pollevent.telemetry.MonitorMetrics;
import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.api.OpenTelemetry;

import static com.p14n.pollevent.TestUtil.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RetentionManagerTest {

    private final ConfigData config = ConfigData.builder().storagePath(ConfigData.IN_MEMORY).retentionDays(7)
            .build();
    private HikariDataSource ds;
    private EventStore store;
    private RetentionManager retention;

    @BeforeEach
    void setUp() {
        ds = PoolSetup.createPool(config);
        new DatabaseSetup(ds).setupAll(config.retentionDays());
        store = new EventStore(ds, null, TestUtil.fixedClock());
        HealthMonitor health = new HealthMonitor(config, new EventBuffer(10), mock(GroupDirectory.class),
                () -> 0.1, new NotificationBroker(new TestAsyncExecutor()),
                new MonitorMetrics(OpenTelemetry.noop().getMeter("test")), TestUtil.fixedClock());
        retention = new RetentionManager(config, store, new WritePath(), health, TestUtil.fixedClock());
    }

    @AfterEach
    void tearDown() {
        retention.close();
        ds.close();
    }

    @Test
    void testCutoffIsRetentionDaysBeforeNow() {
        assertEquals(TestUtil.NOW.minus(Duration.ofDays(7)).toEpochMilli(), retention.cutoffMillis());
    }

    @Test
    void testSweepDeletesOnlyStrictlyOlderEvents() throws SQLException {
        long cutoff = retention.cutoffMillis();
        store.insertBatch(List.of(event(1, "g", "a", 1, cutoff - 1), event(2, "g", "a", 2, cutoff),
                event(3, "g", "a", 3, cutoff + 1)));

        assertEquals(1, retention.sweep());

        assertEquals(List.of(cutoff, cutoff + 1),
                store.findRange(null, null).stream().map(PersistedEvent::timestamp).toList());
        assertEquals(0, retention.sweep());
    }

    @Test
    void testScheduledSweep() throws SQLException {
        TestAsyncExecutor executor = new TestAsyncExecutor();
        retention.start(executor);
        assertEquals(List.of(config.retentionSweepIntervalMillis()), executor.periods(TimeUnit.MILLISECONDS));

        store.insertBatch(List.of(event(1, "g", "a", 1, 1)));
        executor.runScheduled();
        assertEquals(0, store.count());

        retention.close();
        assertEquals(0, executor.scheduledCount());
    }
}
