package com.p14n.pollevent.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the events schema in an H2 database.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * new DatabaseSetup(ds)
 *         .setupAll(30);
 * }
 * </pre>
 */
public class DatabaseSetup {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    /** Version recorded in the metadata table. */
    public static final String SCHEMA_VERSION = "1";

    private final DataSource ds;

    public DatabaseSetup(DataSource ds) {
        this.ds = ds;
    }

    /**
     * Creates tables, indexes and metadata.
     *
     * @param retentionDays retention period recorded in the metadata
     * @return this instance for method chaining
     * @throws RuntimeException if database operations fail
     */
    public DatabaseSetup setupAll(int retentionDays) {
        createEventsTableIfNotExists();
        createIndexesIfNotExist();
        createMetadataTableIfNotExists();
        initMetadata(retentionDays);
        return this;
    }

    public DatabaseSetup createEventsTableIfNotExists() {
        String sql = """
                CREATE TABLE IF NOT EXISTS events (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    change_group_id VARCHAR(255) NOT NULL,
                    control_path VARCHAR(512) NOT NULL,
                    component_name VARCHAR(255),
                    control_name VARCHAR(255) NOT NULL,
                    value_kind VARCHAR(16) NOT NULL,
                    num_value DOUBLE PRECISION,
                    text_value VARCHAR(4096),
                    string_value VARCHAR(4096),
                    event_time BIGINT NOT NULL,
                    seq_no INT NOT NULL,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL
                )""";
        return execute(sql, "events table");
    }

    public DatabaseSetup createIndexesIfNotExist() {
        execute("CREATE INDEX IF NOT EXISTS idx_events_time ON events(event_time)", "time index");
        execute("CREATE INDEX IF NOT EXISTS idx_events_group_time ON events(change_group_id, event_time)",
                "group index");
        execute("CREATE INDEX IF NOT EXISTS idx_events_control ON events(control_path)", "control index");
        return execute("CREATE INDEX IF NOT EXISTS idx_events_component_time ON events(component_name, event_time)",
                "component index");
    }

    public DatabaseSetup createMetadataTableIfNotExists() {
        String sql = """
                CREATE TABLE IF NOT EXISTS monitor_metadata (
                    meta_key VARCHAR(64) PRIMARY KEY,
                    meta_value VARCHAR(1024)
                )""";
        return execute(sql, "metadata table");
    }

    public DatabaseSetup initMetadata(int retentionDays) {
        try (Connection conn = ds.getConnection()) {
            SQL.putMetadata(conn, SQL.META_SCHEMA_VERSION, SCHEMA_VERSION);
            SQL.putMetadata(conn, SQL.META_RETENTION_DAYS, Integer.toString(retentionDays));
            if (SQL.getMetadata(conn, SQL.META_CREATED_AT) == null) {
                SQL.putMetadata(conn, SQL.META_CREATED_AT, Instant.now().toString());
            }
            return this;
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error initializing metadata");
            throw new RuntimeException("Failed to initialize metadata", e);
        }
    }

    private DatabaseSetup execute(String sql, String what) {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            logger.atDebug().log("Ensured {}", what);
            return this;
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating {}", what);
            throw new RuntimeException("Failed to create " + what, e);
        }
    }
}
