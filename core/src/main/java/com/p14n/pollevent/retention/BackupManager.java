package com.p14n.pollevent.retention;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.p14n.pollevent.broker.AsyncExecutor;
import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.broker.NotificationBroker;
import com.p14n.pollevent.data.BackupRecord;
import com.p14n.pollevent.data.ControlValue;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.data.PersistedEvent;
import com.p14n.pollevent.db.DatabaseSetup;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.SQL;
import com.p14n.pollevent.db.WritePath;
import com.p14n.pollevent.persistence.RestoreConflictException;

import io.opentelemetry.api.trace.Tracer;

import static com.p14n.pollevent.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Snapshots, restores, exports and imports the event store.
 *
 * <p>
 * Snapshots are H2 SQL scripts named
 * {@code events-backup-<yyyy-MM-dd'T'HH-mm-ss-SSS'Z'>.sql[.gz]} in the backup
 * directory; only the newest {@link MonitorConfig#maxBackups()} are kept.
 * Every operation that writes to the store holds the {@link WritePath}.
 * </p>
 */
public class BackupManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BackupManager.class);

    static final String BACKUP_PREFIX = "events-backup-";
    static final String EXPORT_PREFIX = "events-export-";
    static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'")
            .withZone(ZoneOffset.UTC);
    private static final Pattern BACKUP_NAME = Pattern
            .compile("events-backup-(\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}-\\d{3}Z)\\.sql(\\.gz)?");

    private final MonitorConfig config;
    private final EventStore store;
    private final WritePath writePath;
    private final Runnable flush;
    private final NotificationBroker notifications;
    private final Tracer tracer;
    private final Clock clock;
    private final ObjectMapper mapper;
    private ScheduledFuture<?> timer;

    /**
     * @param flush run before a snapshot so buffered events are included
     */
    public BackupManager(MonitorConfig config, EventStore store, WritePath writePath, Runnable flush,
            NotificationBroker notifications, Tracer tracer, Clock clock) {
        this.config = config;
        this.store = store;
        this.writePath = writePath;
        this.flush = flush;
        this.notifications = notifications;
        this.tracer = tracer;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Schedules automatic backups; does nothing when the interval is 0.
     */
    public synchronized void start(AsyncExecutor executor) {
        long interval = config.backupIntervalMillis();
        if (interval <= 0 || timer != null) {
            return;
        }
        timer = executor.scheduleAtFixedRate(() -> {
            try {
                performBackup();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Scheduled backup failed");
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        logger.atInfo().log("Automatic backups every {}ms to {}", interval, backupDir());
    }

    public Path backupDir() {
        return Path.of(config.backupPath()).toAbsolutePath();
    }

    /**
     * Flushes pending events and writes a consistent snapshot, then prunes old
     * snapshots.
     *
     * @return the new snapshot
     * @throws BackupException if the snapshot cannot be written
     */
    public BackupRecord performBackup() {
        return processWithTelemetry(tracer, "backup", () -> {
            flush.run();
            BackupRecord backup;
            writePath.lock();
            try {
                Files.createDirectories(backupDir());
                Instant createdAt = clock.instant();
                String suffix = config.backupCompression() ? ".sql.gz" : ".sql";
                Path file = backupDir().resolve(BACKUP_PREFIX + FILE_TIME.format(createdAt) + suffix);
                while (Files.exists(file)) {
                    createdAt = createdAt.plusMillis(1);
                    file = backupDir().resolve(BACKUP_PREFIX + FILE_TIME.format(createdAt) + suffix);
                }
                long count = store.count();
                try (Connection conn = store.dataSource().getConnection();
                        Statement stmt = conn.createStatement()) {
                    stmt.execute("SCRIPT TO " + SQL.literal(file.toString())
                            + (config.backupCompression() ? " COMPRESSION GZIP" : ""));
                }
                backup = new BackupRecord(file.getFileName().toString(), file, createdAt, Files.size(file),
                        config.backupCompression(), count);
            } catch (IOException | SQLException e) {
                logger.atError().setCause(e).log("Backup failed");
                throw new BackupException("Backup failed: " + e.getMessage(), e);
            } finally {
                writePath.unlock();
            }
            logger.atInfo().log("Backup {} written with {} events ({} bytes)", backup.filename(),
                    backup.eventsCount(), backup.size());
            prune();
            notifications.publish(new MonitorNotification(MonitorNotification.Type.BACKUP_COMPLETED, null,
                    backup.filename(), Map.of("events", backup.eventsCount(), "bytes", backup.size()),
                    clock.instant()));
            return backup;
        });
    }

    /**
     * Deletes snapshots beyond {@link MonitorConfig#maxBackups()}, oldest first.
     *
     * @return the number of snapshots deleted
     */
    public int prune() {
        List<BackupRecord> backups = listBackups();
        int deleted = 0;
        for (int i = config.maxBackups(); i < backups.size(); i++) {
            try {
                Files.deleteIfExists(backups.get(i).path());
                deleted++;
                logger.atInfo().log("Pruned old backup {}", backups.get(i).filename());
            } catch (IOException e) {
                logger.atWarn().setCause(e).log("Cannot delete old backup {}", backups.get(i).filename());
            }
        }
        return deleted;
    }

    /**
     * @return snapshots in the backup directory, newest first
     */
    public List<BackupRecord> listBackups() {
        Path dir = backupDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<BackupRecord> backups = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher m = BACKUP_NAME.matcher(file.getFileName().toString());
                if (m.matches() && Files.isRegularFile(file)) {
                    backups.add(new BackupRecord(file.getFileName().toString(), file, createdAt(m.group(1), file),
                            Files.size(file), m.group(2) != null, null));
                }
            }
        } catch (IOException e) {
            throw new BackupException("Cannot list backups in " + dir, e);
        }
        backups.sort(Comparator.comparing(BackupRecord::createdAt).thenComparing(BackupRecord::filename)
                .reversed());
        return backups;
    }

    public Optional<BackupRecord> latestBackup() {
        List<BackupRecord> backups = listBackups();
        return backups.isEmpty() ? Optional.empty() : Optional.of(backups.get(0));
    }

    private static Instant createdAt(String stamp, Path file) throws IOException {
        try {
            return FILE_TIME.parse(stamp, Instant::from);
        } catch (DateTimeParseException e) {
            return Files.getLastModifiedTime(file).toInstant();
        }
    }

    /**
     * Replaces the store's contents with a snapshot. The snapshot is applied to
     * a scratch database first; a file that does not load there, or holds no
     * events table, leaves the store untouched. If applying it to the store
     * still fails, the store's previous contents are put back.
     *
     * @param file snapshot written by {@link #performBackup()}
     * @throws RestoreConflictException if another write operation holds the write path
     * @throws BackupException          if the file is missing or cannot be applied
     */
    public void restoreFromBackup(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new BackupException("Backup file not found: " + file);
        }
        boolean compressed = file.getFileName().toString().endsWith(".gz");
        try {
            checkSnapshot(file, compressed);
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Backup {} cannot be applied, store left unchanged", file);
            throw new BackupException("Restore failed, invalid backup: " + e.getMessage(), e);
        }
        if (!writePath.tryLock()) {
            throw new RestoreConflictException("A write operation is in progress, restore refused");
        }
        Path previous = null;
        try {
            previous = Files.createTempFile("pollevent-restore-", ".sql.gz");
            try (Connection conn = store.dataSource().getConnection();
                    Statement stmt = conn.createStatement()) {
                stmt.execute("SCRIPT TO " + SQL.literal(previous.toString()) + " COMPRESSION GZIP");
                try {
                    replaceContents(stmt, file, compressed);
                } catch (SQLException e) {
                    logger.atError().setCause(e).log("Restore from {} failed, putting back previous contents", file);
                    try {
                        replaceContents(stmt, previous, true);
                    } catch (SQLException rollback) {
                        e.addSuppressed(rollback);
                    }
                    throw e;
                }
            }
            new DatabaseSetup(store.dataSource()).setupAll(config.retentionDays());
            store.putMetadata(SQL.META_LAST_RESTORE, clock.instant().toString());
            store.bumpVersion();
        } catch (IOException | SQLException | RuntimeException e) {
            logger.atError().setCause(e).log("Restore from {} failed", file);
            throw new BackupException("Restore failed: " + e.getMessage(), e);
        } finally {
            writePath.unlock();
            deleteQuietly(previous);
        }
        logger.atInfo().log("Restored store from {}", file);
        notifications.publish(MonitorNotification.of(MonitorNotification.Type.RESTORE_COMPLETED,
                file.getFileName().toString(), clock.instant()));
    }

    private static void replaceContents(Statement stmt, Path script, boolean compressed) throws SQLException {
        stmt.execute("DROP ALL OBJECTS");
        stmt.execute(runScript(script, compressed));
    }

    private static String runScript(Path script, boolean compressed) {
        return "RUNSCRIPT FROM " + SQL.literal(script.toAbsolutePath().toString())
                + (compressed ? " COMPRESSION GZIP" : "");
    }

    /**
     * Loads a snapshot into a throwaway in-memory database and checks that it
     * carries the events table.
     */
    static void checkSnapshot(Path file, boolean compressed) throws SQLException {
        String url = "jdbc:h2:mem:restore-check-" + UUID.randomUUID();
        try (Connection conn = DriverManager.getConnection(url, "sa", "");
                Statement stmt = conn.createStatement()) {
            stmt.execute(runScript(file, compressed));
            try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = 'EVENTS'")) {
                if (!rs.next() || rs.getInt(1) == 0) {
                    throw new SQLException("Snapshot " + file.getFileName() + " has no events table");
                }
            }
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.atWarn().log("Could not delete {}: {}", file, e.getMessage());
        }
    }

    /**
     * Writes events in a time range to a JSON document in the backup directory.
     *
     * @param start inclusive lower bound, or {@code null}
     * @param end   exclusive upper bound, or {@code null}
     * @return the written file
     */
    public Path exportData(Long start, Long end) {
        if (start != null && end != null && start >= end) {
            throw new IllegalArgumentException("start must be before end");
        }
        try {
            List<PersistedEvent> rows = store.findRange(start, end);
            Instant now = clock.instant();
            List<ExportDocument.ExportedEvent> events = new ArrayList<>(rows.size());
            for (PersistedEvent e : rows) {
                events.add(new ExportDocument.ExportedEvent(e.id(), e.changeGroupId(), e.controlPath(),
                        e.componentName(), e.controlName(), e.value().kind().name(), e.value().raw(),
                        e.stringValue(), e.timestamp(), e.sequence(), e.createdAt().toString()));
            }
            ExportDocument doc = new ExportDocument(now.toString(), events.size(), start, end, events);
            Files.createDirectories(backupDir());
            Path file = backupDir().resolve(EXPORT_PREFIX + FILE_TIME.format(now) + ".json");
            mapper.writeValue(file.toFile(), doc);
            logger.atInfo().log("Exported {} events to {}", events.size(), file);
            return file;
        } catch (IOException | SQLException e) {
            throw new BackupException("Export failed: " + e.getMessage(), e);
        }
    }

    /**
     * Appends the events of an export document to the store.
     *
     * @param file document written by {@link #exportData(Long, Long)}
     * @return the number of events imported
     * @throws IllegalArgumentException if the document is malformed
     */
    public int importData(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new BackupException("Import file not found: " + file);
        }
        List<PersistedEvent> rows;
        try {
            ExportDocument doc = mapper.readValue(file.toFile(), ExportDocument.class);
            rows = toRows(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid export document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BackupException("Cannot read " + file, e);
        }
        writePath.lock();
        try {
            int imported = store.insertPersisted(rows);
            logger.atInfo().log("Imported {} events from {}", imported, file);
            return imported;
        } catch (SQLException e) {
            throw new BackupException("Import failed: " + e.getMessage(), e);
        } finally {
            writePath.unlock();
        }
    }

    private static List<PersistedEvent> toRows(ExportDocument doc) {
        if (doc == null || doc.events() == null) {
            throw new IllegalArgumentException("Invalid export document: no events");
        }
        List<PersistedEvent> rows = new ArrayList<>(doc.events().size());
        for (ExportDocument.ExportedEvent e : doc.events()) {
            if (e.changeGroupId() == null || e.controlPath() == null || e.controlName() == null
                    || e.valueKind() == null) {
                throw new IllegalArgumentException("Invalid export document: incomplete event " + e.id());
            }
            try {
                ControlValue value = switch (ControlValue.Kind.valueOf(e.valueKind())) {
                    case NUMBER -> ControlValue.ofNumber(((Number) e.value()).doubleValue());
                    case STRING -> ControlValue.ofString((String) e.value());
                    case BOOLEAN -> ControlValue.ofBoolean((Boolean) e.value());
                };
                Instant createdAt = e.createdAt() == null ? null : Instant.parse(e.createdAt());
                rows.add(new PersistedEvent(e.id(), e.changeGroupId(), e.controlPath(), e.componentName(),
                        e.controlName(), value, e.stringValue(), e.timestamp(), e.sequence(), createdAt));
            } catch (ClassCastException | NullPointerException | DateTimeParseException e2) {
                throw new IllegalArgumentException("Invalid export document: bad value in event " + e.id(), e2);
            }
        }
        return rows;
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
