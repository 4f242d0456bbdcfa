package com.p14n.pollevent.db;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.ControlValue;
import com.p14n.pollevent.data.PersistedEvent;

/**
 * Column lists, statement mapping and transaction helpers for the events
 * tables.
 */
public class SQL {

    private static final Logger logger = LoggerFactory.getLogger(SQL.class);

    private SQL() {
    }

    /** Columns written for every event, in statement parameter order. */
    public static final String INSERT_COLS = "change_group_id, control_path, component_name, control_name, "
            + "value_kind, num_value, text_value, string_value, event_time, seq_no, created_at";

    /** Placeholders matching {@link #INSERT_COLS}. */
    public static final String INSERT_PH = "?,?,?,?,?,?,?,?,?,?,?";

    /** All columns, as selected by queries. */
    public static final String SELECT_COLS = "id, " + INSERT_COLS;

    public static final String INSERT_EVENT = "INSERT INTO events (" + INSERT_COLS + ") VALUES (" + INSERT_PH + ")";

    /** Ordering applied to every read of the events table. */
    public static final String ORDER = " ORDER BY event_time, seq_no, id";

    public static final String META_RETENTION_DAYS = "retention_days";
    public static final String META_SCHEMA_VERSION = "schema_version";
    public static final String META_CREATED_AT = "created_at";
    public static final String META_LAST_RESTORE = "last_restore";

    /**
     * Sets a change event on an insert statement built from {@link #INSERT_EVENT}.
     */
    public static void setEventOnStatement(PreparedStatement stmt, ChangeEvent event, Instant createdAt)
            throws SQLException {
        stmt.setString(1, event.changeGroupId());
        stmt.setString(2, event.control().path());
        stmt.setString(3, event.control().component());
        stmt.setString(4, event.control().control());
        setValue(stmt, 5, event.value());
        stmt.setString(8, event.stringValue());
        stmt.setLong(9, event.timestamp());
        stmt.setInt(10, event.sequence());
        stmt.setObject(11, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
    }

    /**
     * Sets an already persisted event, e.g. from an export, on an insert
     * statement. The row id is not carried over.
     */
    public static void setPersistedOnStatement(PreparedStatement stmt, PersistedEvent event, Instant createdAt)
            throws SQLException {
        stmt.setString(1, event.changeGroupId());
        stmt.setString(2, event.controlPath());
        stmt.setString(3, event.componentName());
        stmt.setString(4, event.controlName());
        setValue(stmt, 5, event.value());
        stmt.setString(8, event.stringValue());
        stmt.setLong(9, event.timestamp());
        stmt.setInt(10, event.sequence());
        stmt.setObject(11, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
    }

    private static void setValue(PreparedStatement stmt, int index, ControlValue value) throws SQLException {
        stmt.setString(index, value.kind().name());
        switch (value.kind()) {
            case NUMBER -> {
                stmt.setDouble(index + 1, value.asNumber());
                stmt.setNull(index + 2, Types.VARCHAR);
            }
            case STRING -> {
                stmt.setNull(index + 1, Types.DOUBLE);
                stmt.setString(index + 2, value.asString());
            }
            case BOOLEAN -> {
                stmt.setNull(index + 1, Types.DOUBLE);
                stmt.setString(index + 2, Boolean.toString(value.asBoolean()));
            }
        }
    }

    /**
     * Maps the current row of a result set selected with {@link #SELECT_COLS}.
     */
    public static PersistedEvent eventFromResultSet(ResultSet rs) throws SQLException {
        return new PersistedEvent(
                rs.getLong("id"),
                rs.getString("change_group_id"),
                rs.getString("control_path"),
                rs.getString("component_name"),
                rs.getString("control_name"),
                valueFromResultSet(rs),
                rs.getString("string_value"),
                rs.getLong("event_time"),
                rs.getInt("seq_no"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant());
    }

    private static ControlValue valueFromResultSet(ResultSet rs) throws SQLException {
        String kind = rs.getString("value_kind");
        try {
            return switch (ControlValue.Kind.valueOf(kind)) {
                case NUMBER -> ControlValue.ofNumber(rs.getDouble("num_value"));
                case STRING -> ControlValue.ofString(rs.getString("text_value"));
                case BOOLEAN -> ControlValue.ofBoolean(Boolean.parseBoolean(rs.getString("text_value")));
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SQLDataException("Corrupt value in row " + rs.getLong("id") + ": kind=" + kind, e);
        }
    }

    public static String getMetadata(Connection conn, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT meta_value FROM monitor_metadata WHERE meta_key = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public static void putMetadata(Connection conn, String key, String value) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "MERGE INTO monitor_metadata (meta_key, meta_value) KEY (meta_key) VALUES (?, ?)")) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.executeUpdate();
        }
    }

    /**
     * Quotes a value as an SQL string literal, for statements such as
     * {@code SCRIPT TO} that do not accept parameters.
     */
    public static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Safely closes a database connection.
     *
     * @param conn Connection to close (may be null)
     */
    public static void closeConnection(Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.close();
                }
            } catch (SQLException closeEx) {
                logger.atDebug().setCause(closeEx).log("Error closing connection");
            }
        }
    }

    /**
     * Handles SQLException by attempting to rollback the transaction.
     * If rollback fails, the rollback exception is added as a suppressed exception.
     *
     * @param e    Original SQLException that triggered the rollback
     * @param conn Connection to rollback (may be null)
     */
    public static void handleSQLException(SQLException e, Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.rollback();
                }
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
        }
    }
}
