package com.p14n.pollevent.retention;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.broker.AsyncExecutor;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.WritePath;
import com.p14n.pollevent.health.HealthMonitor;

/**
 * Deletes events older than the retention period on a fixed schedule.
 */
public class RetentionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetentionManager.class);

    private final MonitorConfig config;
    private final EventStore store;
    private final WritePath writePath;
    private final HealthMonitor health;
    private final Clock clock;
    private ScheduledFuture<?> timer;

    public RetentionManager(MonitorConfig config, EventStore store, WritePath writePath, HealthMonitor health,
            Clock clock) {
        this.config = config;
        this.store = store;
        this.writePath = writePath;
        this.health = health;
        this.clock = clock;
    }

    public synchronized void start(AsyncExecutor executor) {
        if (timer == null) {
            long interval = config.retentionSweepIntervalMillis();
            timer = executor.scheduleAtFixedRate(this::scheduledSweep, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Retention sweep failed");
            health.recordFailure(e);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unexpected error in retention sweep");
        }
    }

    /**
     * Oldest event time that survives a sweep run now.
     */
    public long cutoffMillis() {
        return clock.millis() - Duration.ofDays(config.retentionDays()).toMillis();
    }

    /**
     * Deletes events strictly older than {@link #cutoffMillis()}.
     *
     * @return the number of events deleted
     */
    public int sweep() throws SQLException {
        long cutoff = cutoffMillis();
        writePath.lock();
        try {
            int deleted = store.deleteOlderThan(cutoff);
            logger.atInfo().log("Retention sweep removed {} events older than {} days", deleted,
                    config.retentionDays());
            return deleted;
        } finally {
            writePath.unlock();
        }
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
