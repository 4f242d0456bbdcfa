package com.p14n.pollevent.db;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import com.p14n.pollevent.data.MonitorConfig;
import com.zaxxer.hikari.HikariDataSource;

public class PoolSetup {

    /** Database file name inside the storage directory. */
    public static final String DB_NAME = "events";

    private PoolSetup() {
    }

    /**
     * Creates and configures a connection pool using HikariCP.
     *
     * @param cfg Configuration naming the storage directory
     * @return Configured DataSource
     */
    public static HikariDataSource createPool(MonitorConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(jdbcUrl(cfg));
        ds.setUsername("sa");
        ds.setPassword("");
        ds.setPoolName("pollevent");
        ds.setMaximumPoolSize(4);
        return ds;
    }

    /**
     * Builds the H2 url for the configured storage path. {@link MonitorConfig#IN_MEMORY}
     * selects a private in-memory database kept alive until shutdown.
     */
    public static String jdbcUrl(MonitorConfig cfg) {
        if (cfg.inMemory()) {
            return "jdbc:h2:mem:pollevent-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        }
        Path dir = Path.of(cfg.storagePath()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directory " + dir, e);
        }
        return "jdbc:h2:file:" + dir.resolve(DB_NAME) + ";DB_CLOSE_ON_EXIT=FALSE";
    }

    /**
     * @return the database file for a file based store, or {@code null} in memory
     */
    public static Path storeFile(MonitorConfig cfg) {
        if (cfg.inMemory()) {
            return null;
        }
        return Path.of(cfg.storagePath()).toAbsolutePath().resolve(DB_NAME + ".mv.db");
    }
}
