package com.p14n.pollevent.db;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.PersistedEvent;

/**
 * JDBC access to the events table.
 *
 * <p>
 * Mutating methods expect the caller to hold the {@link WritePath}; each runs
 * in its own transaction and rolls back on failure. Every successful mutation
 * bumps {@link #version()}.
 * </p>
 */
public class EventStore {

    private static final Logger logger = LoggerFactory.getLogger(EventStore.class);

    private final DataSource ds;
    private final Path storeFile;
    private final Clock clock;
    private final AtomicLong version = new AtomicLong();

    /**
     * @param ds        pooled data source
     * @param storeFile database file used for size reporting, {@code null} in memory
     * @param clock     source of insertion times
     */
    public EventStore(DataSource ds, Path storeFile, Clock clock) {
        this.ds = ds;
        this.storeFile = storeFile;
        this.clock = clock;
    }

    public DataSource dataSource() {
        return ds;
    }

    /**
     * Writes a batch in one transaction.
     *
     * @param events events in the order they should be stored
     * @return the number of rows written
     * @throws SQLException if the batch could not be committed; nothing is written
     */
    public int insertBatch(List<ChangeEvent> events) throws SQLException {
        if (events.isEmpty()) {
            return 0;
        }
        var createdAt = clock.instant();
        Connection conn = null;
        try {
            conn = ds.getConnection();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(SQL.INSERT_EVENT)) {
                for (ChangeEvent event : events) {
                    SQL.setEventOnStatement(stmt, event, createdAt);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            conn.commit();
            version.incrementAndGet();
            logger.atDebug().log("Inserted {} events", events.size());
            return events.size();
        } catch (SQLException e) {
            SQL.handleSQLException(e, conn);
            throw e;
        } finally {
            restoreAutoCommit(conn);
            SQL.closeConnection(conn);
        }
    }

    /**
     * Appends previously exported rows with new row ids.
     *
     * @return the number of rows written
     */
    public int insertPersisted(List<PersistedEvent> events) throws SQLException {
        if (events.isEmpty()) {
            return 0;
        }
        var now = clock.instant();
        Connection conn = null;
        try {
            conn = ds.getConnection();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(SQL.INSERT_EVENT)) {
                for (PersistedEvent event : events) {
                    SQL.setPersistedOnStatement(stmt, event, event.createdAt() == null ? now : event.createdAt());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            conn.commit();
            version.incrementAndGet();
            return events.size();
        } catch (SQLException e) {
            SQL.handleSQLException(e, conn);
            throw e;
        } finally {
            restoreAutoCommit(conn);
            SQL.closeConnection(conn);
        }
    }

    /**
     * Deletes rows whose event time is strictly before the cutoff.
     *
     * @param cutoffMillis epoch millis; rows at exactly this time are kept
     * @return the number of rows deleted
     */
    public int deleteOlderThan(long cutoffMillis) throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("DELETE FROM events WHERE event_time < ?")) {
            stmt.setLong(1, cutoffMillis);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                version.incrementAndGet();
            }
            return deleted;
        }
    }

    /**
     * Reads every row in a time range, in storage order.
     *
     * @param start inclusive lower bound, or {@code null}
     * @param end   exclusive upper bound, or {@code null}
     */
    public List<PersistedEvent> findRange(Long start, Long end) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(SQL.SELECT_COLS).append(" FROM events WHERE 1=1");
        List<Long> params = new ArrayList<>();
        if (start != null) {
            sql.append(" AND event_time >= ?");
            params.add(start);
        }
        if (end != null) {
            sql.append(" AND event_time < ?");
            params.add(end);
        }
        sql.append(SQL.ORDER);
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setLong(i + 1, params.get(i));
            }
            List<PersistedEvent> events = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(SQL.eventFromResultSet(rs));
                }
            }
            return events;
        }
    }

    /**
     * Reads every row and decodes its value.
     *
     * @return the number of rows checked
     * @throws SQLException if a row cannot be decoded or the table cannot be read
     */
    public long verify() throws SQLException {
        long checked = 0;
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT " + SQL.SELECT_COLS + " FROM events");
                ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                SQL.eventFromResultSet(rs);
                checked++;
            }
        }
        return checked;
    }

    public long count() throws SQLException {
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM events");
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public String metadata(String key) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            return SQL.getMetadata(conn, key);
        }
    }

    public void putMetadata(String key, String value) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            SQL.putMetadata(conn, key, value);
        }
    }

    /**
     * Counter that changes whenever the stored data may have changed.
     */
    public long version() {
        return version.get();
    }

    /**
     * Marks the data as changed by an operation outside this class, such as a
     * restore.
     */
    public void bumpVersion() {
        version.incrementAndGet();
    }

    /**
     * @return size of the database file, 0 for an in-memory store
     */
    public long sizeBytes() {
        if (storeFile == null) {
            return 0;
        }
        try {
            return Files.exists(storeFile) ? Files.size(storeFile) : 0;
        } catch (IOException e) {
            logger.atWarn().setCause(e).log("Cannot read size of {}", storeFile);
            return 0;
        }
    }

    private static void restoreAutoCommit(Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.setAutoCommit(true);
                }
            } catch (SQLException e) {
                logger.atDebug().setCause(e).log("Cannot reset auto-commit");
            }
        }
    }
}
