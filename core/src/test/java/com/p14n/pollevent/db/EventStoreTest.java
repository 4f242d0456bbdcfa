package com.p14n.pollevent.db;

import java.sql.Connection;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.pollevent.TestUtil;
import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.data.ControlValue;
import com.p14n.pollevent.data.PersistedEvent;
import com.zaxxer.hikari.HikariDataSource;

import static com.p14n.pollevent.TestUtil.event;
import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    private HikariDataSource ds;
    private EventStore store;

    @BeforeEach
    void setUp() {
        ds = PoolSetup.createPool(ConfigData.builder().storagePath(ConfigData.IN_MEMORY).build());
        new DatabaseSetup(ds).setupAll(30);
        store = new EventStore(ds, null, TestUtil.fixedClock());
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    @Test
    void testValuesOfEveryKindRoundTrip() throws SQLException {
        store.insertBatch(List.of(
                new ChangeEvent(1, "g", ControlReference.parse("Mixer.gain"), ControlValue.of(-3.5), "-3.5 dB", 100, 0),
                new ChangeEvent(2, "g", ControlReference.parse("mute"), ControlValue.of(true), null, 100, 1),
                new ChangeEvent(3, "g", ControlReference.parse("Router.input"), ControlValue.of("A"), null, 100, 2)));

        List<PersistedEvent> rows = store.findRange(null, null);

        assertEquals(3, rows.size());
        PersistedEvent gain = rows.get(0);
        assertEquals("Mixer.gain", gain.controlPath());
        assertEquals("Mixer", gain.componentName());
        assertEquals("gain", gain.controlName());
        assertEquals(ControlValue.of(-3.5), gain.value());
        assertEquals("-3.5 dB", gain.stringValue());
        assertEquals(TestUtil.NOW, gain.createdAt());
        assertNull(rows.get(1).componentName());
        assertEquals(ControlValue.of(true), rows.get(1).value());
        assertEquals(ControlValue.of("A"), rows.get(2).value());
    }

    @Test
    void testRangeIsHalfOpenAndOrdered() throws SQLException {
        store.insertBatch(List.of(event(1, "g", "a", 1, 300), event(2, "g", "a", 2, 100),
                event(3, "g", "a", 3, 200)));

        assertEquals(List.of(100L, 200L, 300L),
                store.findRange(null, null).stream().map(PersistedEvent::timestamp).toList());
        assertEquals(List.of(100L, 200L),
                store.findRange(100L, 300L).stream().map(PersistedEvent::timestamp).toList());
    }

    @Test
    void testFailedBatchWritesNothing() throws SQLException {
        String tooLong = "x".repeat(300);
        List<ChangeEvent> batch = List.of(event(1, "g", "a", 1),
                new ChangeEvent(2, tooLong, ControlReference.parse("a"), ControlValue.of(1), null, 1, 0));

        assertThrows(SQLException.class, () -> store.insertBatch(batch));
        assertEquals(0, store.count());
    }

    @Test
    void testDeleteOlderThanKeepsBoundary() throws SQLException {
        store.insertBatch(List.of(event(1, "g", "a", 1, 99), event(2, "g", "a", 2, 100),
                event(3, "g", "a", 3, 101)));
        long before = store.version();

        assertEquals(1, store.deleteOlderThan(100));
        assertEquals(2, store.count());
        assertTrue(store.version() > before);
    }

    @Test
    void testVersionChangesOnWrite() throws SQLException {
        long v0 = store.version();
        store.insertBatch(List.of());
        assertEquals(v0, store.version());
        store.insertBatch(List.of(event(1, "g", "a", 1)));
        assertEquals(v0 + 1, store.version());
    }

    @Test
    void testVerifyDetectsUndecodableRows() throws SQLException {
        store.insertBatch(List.of(event(1, "g", "a", 1), event(2, "g", "b", 2)));
        assertEquals(2, store.verify());

        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("UPDATE events SET value_kind = 'BOGUS' WHERE control_path = 'b'");
        }
        assertThrows(SQLDataException.class, () -> store.verify());
    }

    @Test
    void testMetadata() throws SQLException {
        assertNull(store.metadata("missing"));
        store.putMetadata("k", "v1");
        store.putMetadata("k", "v2");
        assertEquals("v2", store.metadata("k"));
        assertEquals("30", store.metadata(SQL.META_RETENTION_DAYS));
    }

    @Test
    void testInMemoryStoreHasNoFileSize() {
        assertEquals(0, store.sizeBytes());
    }
}
