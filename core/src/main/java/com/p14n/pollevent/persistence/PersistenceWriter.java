package com.p14n.pollevent.persistence;

import java.sql.SQLException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.broker.AsyncExecutor;
import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.WritePath;
import com.p14n.pollevent.health.FailureKind;
import com.p14n.pollevent.health.HealthMonitor;
import com.p14n.pollevent.telemetry.MonitorMetrics;

import io.opentelemetry.api.trace.Tracer;

import static com.p14n.pollevent.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Moves buffered events into the store.
 *
 * <p>
 * A flush holds the write path, drains the buffer, drops events failing the
 * integrity check and commits the rest in one transaction. A failed batch is
 * returned to the head of the buffer and the failure handed to the
 * {@link HealthMonitor}; it is retried on the next flush, not immediately.
 * While spillover is disabled scheduled flushes only probe the store every
 * {@link MonitorConfig#spilloverProbeIntervalMillis()}.
 * </p>
 */
public class PersistenceWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceWriter.class);

    private final MonitorConfig config;
    private final EventBuffer buffer;
    private final EventStore store;
    private final WritePath writePath;
    private final HealthMonitor health;
    private final MonitorMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;

    private ScheduledFuture<?> timer;
    private volatile long lastProbeMillis;

    public PersistenceWriter(MonitorConfig config, EventBuffer buffer, EventStore store, WritePath writePath,
            HealthMonitor health, MonitorMetrics metrics, Tracer tracer, Clock clock) {
        this.config = config;
        this.buffer = buffer;
        this.store = store;
        this.writePath = writePath;
        this.health = health;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }

    public synchronized void start(AsyncExecutor executor) {
        if (timer != null) {
            return;
        }
        timer = executor.scheduleAtFixedRate(this::scheduledFlush, config.flushIntervalMillis(),
                config.flushIntervalMillis(), TimeUnit.MILLISECONDS);
        logger.atInfo().log("Flushing every {}ms", config.flushIntervalMillis());
    }

    /**
     * One run of the flush timer.
     */
    void scheduledFlush() {
        try {
            health.checkMemoryPressure();
            if (!buffer.isDirty()) {
                return;
            }
            if (!health.spilloverEnabled()) {
                long now = clock.millis();
                if (now - lastProbeMillis < config.spilloverProbeIntervalMillis()) {
                    return;
                }
                lastProbeMillis = now;
                logger.atInfo().log("Probing store while spillover is disabled");
            }
            flushNow();
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unexpected error in scheduled flush");
        }
    }

    /**
     * Flushes the whole buffer now, waiting for the write path.
     *
     * @return the number of events committed
     */
    public int flushNow() {
        writePath.lock();
        try {
            return processWithTelemetry(tracer, "flush", this::flushLocked);
        } finally {
            writePath.unlock();
        }
    }

    private int flushLocked() {
        List<ChangeEvent> batch = buffer.drainAll();
        if (batch.isEmpty()) {
            return 0;
        }

        Map<String, String> corrupt = new LinkedHashMap<>();
        for (ChangeEvent event : batch) {
            String problem = EventIntegrity.check(event);
            if (problem != null) {
                corrupt.putIfAbsent(event.changeGroupId(), problem);
            }
        }
        List<ChangeEvent> valid = new ArrayList<>(batch.size());
        for (ChangeEvent event : batch) {
            if (!corrupt.containsKey(event.changeGroupId())) {
                valid.add(event);
            }
        }
        if (!corrupt.isEmpty()) {
            metrics.recordDropped("integrity", batch.size() - valid.size());
            corrupt.forEach((group, problem) -> health.handleFailure(FailureKind.CORRUPTION_DETECTED,
                    problem, group));
        }

        try {
            int written = store.insertBatch(valid);
            metrics.recordPersisted(written);
            Set<String> groups = new HashSet<>();
            valid.forEach(e -> groups.add(e.changeGroupId()));
            health.recordWriteSuccess(groups);
            logger.atDebug().log("Flushed {} events", written);
            return written;
        } catch (SQLException e) {
            int dropped = buffer.requeueFront(valid);
            metrics.recordDropped("overflow", dropped);
            FailureKind kind = health.recordFailure(e);
            metrics.recordFlushFailure(kind.name());
            logger.atWarn().setCause(e).log("Flush of {} events failed ({}), {} returned to buffer", valid.size(),
                    kind, valid.size() - dropped);
            return 0;
        }
    }

    /**
     * Stops the flush timer and writes whatever is still buffered.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
        int written = flushNow();
        logger.atInfo().log("Writer closed after final flush of {} events", written);
    }
}
