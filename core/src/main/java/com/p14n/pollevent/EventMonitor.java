package com.p14n.pollevent;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.broker.AsyncExecutor;
import com.p14n.pollevent.broker.DefaultExecutor;
import com.p14n.pollevent.broker.MessageSubscriber;
import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.broker.NotificationBroker;
import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.data.BackupRecord;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.db.DatabaseSetup;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.PoolSetup;
import com.p14n.pollevent.db.WritePath;
import com.p14n.pollevent.group.AddControlsResult;
import com.p14n.pollevent.group.ChangeGroupRegistry;
import com.p14n.pollevent.group.GroupPriority;
import com.p14n.pollevent.group.GroupSummary;
import com.p14n.pollevent.group.ManualPollResult;
import com.p14n.pollevent.health.FailureKind;
import com.p14n.pollevent.health.HealthMonitor;
import com.p14n.pollevent.health.HealthStatus;
import com.p14n.pollevent.health.MemoryProbe;
import com.p14n.pollevent.persistence.PersistenceWriter;
import com.p14n.pollevent.poll.EventSink;
import com.p14n.pollevent.poll.PollEngine;
import com.p14n.pollevent.query.EventQuery;
import com.p14n.pollevent.query.EventStatistics;
import com.p14n.pollevent.query.QueryResult;
import com.p14n.pollevent.query.QueryService;
import com.p14n.pollevent.remote.RemoteControlPort;
import com.p14n.pollevent.remote.TransportException;
import com.p14n.pollevent.retention.BackupException;
import com.p14n.pollevent.retention.BackupManager;
import com.p14n.pollevent.retention.RetentionManager;
import com.p14n.pollevent.telemetry.MonitorMetrics;
import com.p14n.pollevent.telemetry.TelemetryConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Entry point wiring the change group registry, poll engine, buffer, writer,
 * store, retention, health monitor and query service together.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * try (var monitor = new EventMonitor(config, port, OpenTelemetry.noop())) {
 *     monitor.start();
 *     monitor.createGroup("mixer", 0.5);
 *     monitor.addControls("mixer", List.of("Mixer.gain", "Mixer.mute"));
 *     ...
 *     QueryResult page = monitor.query(EventQuery.builder().changeGroupId("mixer").build());
 * }
 * }
 * </pre>
 *
 * <p>
 * With monitoring disabled no database is opened: polling still runs, events
 * are discarded, queries fail with {@link IllegalStateException} and
 * statistics report zeros.
 * </p>
 */
public class EventMonitor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventMonitor.class);

    /** Instrumentation scope used for meters and tracers. */
    public static final String SCOPE = "com.p14n.pollevent";

    private final MonitorConfig config;
    private final AsyncExecutor executor;
    private final boolean ownsExecutor;
    private final EventBuffer buffer;
    private final NotificationBroker notifications;
    private final MonitorMetrics metrics;
    private final PollEngine pollEngine;
    private final ChangeGroupRegistry registry;
    private final HealthMonitor health;
    private final QueryService queries;

    private final HikariDataSource dataSource;
    private final EventStore store;
    private final PersistenceWriter writer;
    private final RetentionManager retention;
    private final BackupManager backups;

    private boolean started;
    private boolean closed;

    public EventMonitor(MonitorConfig config, RemoteControlPort port, OpenTelemetry ot) {
        this(config, port, TelemetryConfig.of(ot, SCOPE), new DefaultExecutor(4), true, Clock.systemUTC(),
                MemoryProbe.runtime());
    }

    public EventMonitor(MonitorConfig config, RemoteControlPort port, TelemetryConfig telemetry) {
        this(config, port, telemetry, new DefaultExecutor(4), true, Clock.systemUTC(), MemoryProbe.runtime());
    }

    public EventMonitor(MonitorConfig config, RemoteControlPort port, TelemetryConfig telemetry,
            AsyncExecutor executor, Clock clock, MemoryProbe memoryProbe) {
        this(config, port, telemetry, executor, false, clock, memoryProbe);
    }

    private EventMonitor(MonitorConfig config, RemoteControlPort port, TelemetryConfig telemetry,
            AsyncExecutor executor, boolean ownsExecutor, Clock clock, MemoryProbe memoryProbe) {
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.buffer = new EventBuffer(config.bufferCapacity(), clock);
        this.notifications = new NotificationBroker(executor);
        this.metrics = new MonitorMetrics(telemetry.getMeter());

        EventSink sink = config.monitoringEnabled()
                ? events -> metrics.recordDropped("overflow", buffer.addAll(events))
                : EventSink.DISCARD;
        this.pollEngine = new PollEngine(config, executor, port, sink, metrics, clock);
        this.registry = new ChangeGroupRegistry(pollEngine, metrics);
        this.health = new HealthMonitor(config, buffer, registry, memoryProbe, notifications, metrics, clock);
        registry.addListener(health);
        pollEngine.setIntegrityListener(
                (groupId, message) -> health.handleFailure(FailureKind.CORRUPTION_DETECTED, message, groupId));

        if (config.monitoringEnabled()) {
            this.dataSource = PoolSetup.createPool(config);
            new DatabaseSetup(dataSource).setupAll(config.retentionDays());
            this.store = new EventStore(dataSource, PoolSetup.storeFile(config), clock);
            WritePath writePath = new WritePath();
            this.writer = new PersistenceWriter(config, buffer, store, writePath, health, metrics,
                    telemetry.getTracer(), clock);
            this.retention = new RetentionManager(config, store, writePath, health, clock);
            this.backups = new BackupManager(config, store, writePath, writer::flushNow, notifications,
                    telemetry.getTracer(), clock);
            logger.atInfo().log("Event monitoring enabled, store at {}", config.storagePath());
        } else {
            this.dataSource = null;
            this.store = null;
            this.writer = null;
            this.retention = null;
            this.backups = null;
            logger.atInfo().log("Event monitoring disabled, change events will not be stored");
        }
        this.queries = new QueryService(config, store, buffer);
    }

    /**
     * Starts the flush, retention and backup timers. Groups poll from the
     * moment they are created whether or not this has been called.
     */
    public synchronized EventMonitor start() {
        if (started) {
            return this;
        }
        started = true;
        if (config.monitoringEnabled()) {
            writer.start(executor);
            retention.start(executor);
            backups.start(executor);
        }
        return this;
    }

    public MonitorConfig config() {
        return config;
    }

    // control plane

    public GroupSummary createGroup(String id) {
        return registry.create(id);
    }

    public GroupSummary createGroup(String id, double pollRateSeconds) {
        return registry.create(id, pollRateSeconds);
    }

    public GroupSummary createGroup(String id, double pollRateSeconds, GroupPriority priority) {
        return registry.create(id, pollRateSeconds, priority);
    }

    public AddControlsResult addControls(String id, Collection<String> controls) {
        return registry.addControls(id, controls);
    }

    public AddControlsResult removeControls(String id, Collection<String> controls) {
        return registry.removeControls(id, controls);
    }

    public void clearGroup(String id) {
        registry.clear(id);
    }

    public void destroyGroup(String id) {
        registry.destroy(id);
    }

    public GroupSummary setAutoPoll(String id, double pollRateSeconds) {
        return registry.setAutoPoll(id, pollRateSeconds);
    }

    public GroupSummary stopAutoPoll(String id) {
        return registry.stopAutoPoll(id);
    }

    public ManualPollResult manualPoll(String id, String callerId, boolean showAll) throws TransportException {
        return registry.manualPoll(id, callerId, showAll);
    }

    public List<GroupSummary> listGroups() {
        return registry.list();
    }

    public GroupSummary group(String id) {
        return registry.summary(id);
    }

    // query

    public QueryResult query(EventQuery query) {
        return queries.query(query);
    }

    public EventStatistics statistics() {
        return queries.statistics();
    }

    // health

    public HealthStatus health() {
        return health.status();
    }

    public void resetHealth() {
        health.reset();
    }

    public void resumeSpillover() {
        health.resumeSpillover();
    }

    public boolean subscribe(MessageSubscriber<MonitorNotification> subscriber) {
        return notifications.subscribe(subscriber);
    }

    public boolean subscribe(MonitorNotification.Type type, MessageSubscriber<MonitorNotification> subscriber) {
        return notifications.subscribe(type, subscriber);
    }

    public boolean unsubscribe(MessageSubscriber<MonitorNotification> subscriber) {
        return notifications.unsubscribe(subscriber);
    }

    // storage

    /**
     * Writes buffered events now.
     *
     * @return the number of events committed, 0 when monitoring is disabled
     */
    public int flush() {
        return writer == null ? 0 : writer.flushNow();
    }

    public BackupRecord performBackup() {
        return requireBackups().performBackup();
    }

    public List<BackupRecord> listBackups() {
        return requireBackups().listBackups();
    }

    public Optional<BackupRecord> latestBackup() {
        return requireBackups().latestBackup();
    }

    public void restoreFromBackup(Path file) {
        requireBackups().restoreFromBackup(file);
    }

    public Path exportData(Long start, Long end) {
        return requireBackups().exportData(start, end);
    }

    public int importData(Path file) {
        return requireBackups().importData(file);
    }

    /**
     * Runs a retention sweep now.
     *
     * @return the number of events deleted
     */
    public int sweepRetention() {
        requireBackups();
        try {
            return retention.sweep();
        } catch (SQLException e) {
            health.recordFailure(e);
            throw new BackupException("Retention sweep failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes every stored row.
     *
     * @return the number of rows checked
     */
    public long verifyStore() {
        requireBackups();
        try {
            return store.verify();
        } catch (SQLException e) {
            throw new BackupException("Store verification failed: " + e.getMessage(), e);
        }
    }

    /**
     * @return number of stored events, 0 when monitoring is disabled
     */
    public long storedEvents() {
        if (store == null) {
            return 0;
        }
        try {
            return store.count();
        } catch (SQLException e) {
            throw new BackupException("Cannot count events: " + e.getMessage(), e);
        }
    }

    private BackupManager requireBackups() {
        if (backups == null) {
            throw new IllegalStateException("Event monitoring is disabled");
        }
        return backups;
    }

    ChangeGroupRegistry registry() {
        return registry;
    }

    PollEngine pollEngine() {
        return pollEngine;
    }

    EventBuffer buffer() {
        return buffer;
    }

    HealthMonitor healthMonitor() {
        return health;
    }

    /**
     * Stops polling, writes what is buffered and closes the store.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        registry.stopAll();
        if (config.monitoringEnabled()) {
            backups.close();
            retention.close();
            try {
                writer.close();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Final flush failed");
            }
            shutdownDatabase();
        }
        notifications.close();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        logger.atInfo().log("Event monitor closed");
    }

    private void shutdownDatabase() {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Database shutdown failed");
        } finally {
            dataSource.close();
        }
    }
}
