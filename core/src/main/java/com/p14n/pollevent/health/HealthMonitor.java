package com.p14n.pollevent.health;

import java.time.Clock;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.broker.NotificationBroker;
import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.buffer.EvictionResult;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.group.GroupDirectory;
import com.p14n.pollevent.group.GroupListener;
import com.p14n.pollevent.telemetry.MonitorMetrics;

/**
 * Tracks failures of the persistence pipeline and applies recovery policies.
 *
 * <ul>
 * <li>STORAGE_EXHAUSTED disables spillover until a write succeeds</li>
 * <li>MEMORY_EXHAUSTED evicts half of the buffered events</li>
 * <li>CORRUPTION_DETECTED isolates the affected group</li>
 * <li>TRANSIENT_IO is logged; repeated occurrences degrade the tier</li>
 * </ul>
 *
 * <p>
 * State changes happen under this monitor's lock; recovery actions touching
 * the buffer or groups run after it is released.
 * </p>
 */
public class HealthMonitor implements GroupListener {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    public static final String SPILLOVER_DISABLED = "spillover-disabled";
    public static final String GROUP_ISOLATED_PREFIX = "group-isolated:";

    static final double UNHEALTHY_UTILIZATION = 0.9;
    static final double DEGRADED_UTILIZATION = 0.8;
    static final long UNHEALTHY_ERRORS = 50;
    static final long DEGRADED_ERRORS = 10;

    private final MonitorConfig config;
    private final EventBuffer buffer;
    private final GroupDirectory groups;
    private final MemoryProbe memoryProbe;
    private final NotificationBroker notifications;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private long errorCount;
    private ErrorRecord lastError;
    private boolean spilloverDisabled;
    private int consecutiveTransient;
    private final Set<String> isolatedGroups = new TreeSet<>();
    private EvictionResult lastEviction;

    public HealthMonitor(MonitorConfig config, EventBuffer buffer, GroupDirectory groups, MemoryProbe memoryProbe,
            NotificationBroker notifications, MonitorMetrics metrics, Clock clock) {
        this.config = config;
        this.buffer = buffer;
        this.groups = groups;
        this.memoryProbe = memoryProbe;
        this.notifications = notifications;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Classifies and handles a failure of a store operation.
     *
     * @param failure the exception raised
     * @return the kind it was classified as
     */
    public FailureKind recordFailure(Throwable failure) {
        FailureKind kind = FailureClassifier.classify(failure);
        handleFailure(kind, String.valueOf(failure.getMessage()), null);
        return kind;
    }

    /**
     * Records a failure and applies the policy for its kind.
     *
     * @param kind          the failure kind
     * @param message       description
     * @param changeGroupId group concerned; required for corruption to isolate a group
     */
    public void handleFailure(FailureKind kind, String message, String changeGroupId) {
        boolean newlyDisabled = false;
        boolean newlyIsolated = false;
        synchronized (this) {
            errorCount++;
            lastError = new ErrorRecord(kind, message, changeGroupId, clock.instant());
            if (kind == FailureKind.TRANSIENT_IO) {
                consecutiveTransient++;
            }
            if (kind == FailureKind.STORAGE_EXHAUSTED && !spilloverDisabled) {
                spilloverDisabled = true;
                newlyDisabled = true;
            }
            if (kind == FailureKind.CORRUPTION_DETECTED && changeGroupId != null) {
                newlyIsolated = isolatedGroups.add(changeGroupId);
            }
        }

        switch (kind) {
            case STORAGE_EXHAUSTED -> {
                logger.atError().log("Storage exhausted: {}", message);
                if (newlyDisabled) {
                    logger.atWarn().log("Spillover disabled, buffering up to {} events", buffer.capacity());
                    notifications.publish(MonitorNotification.of(MonitorNotification.Type.SPILLOVER_DISABLED,
                            "Spillover disabled: " + message, clock.instant()));
                }
            }
            case MEMORY_EXHAUSTED -> {
                logger.atError().log("Memory exhausted: {}", message);
                emergencyEvict();
            }
            case CORRUPTION_DETECTED -> {
                logger.atError().log("Integrity failure for group {}: {}", changeGroupId, message);
                if (changeGroupId != null) {
                    isolate(changeGroupId, newlyIsolated, message);
                }
            }
            case TRANSIENT_IO -> logger.atWarn().log("Transient failure: {}", message);
        }
    }

    private void isolate(String changeGroupId, boolean newlyIsolated, String message) {
        int dropped = buffer.removeGroup(changeGroupId);
        groups.resetCache(changeGroupId);
        metrics.recordDropped("isolation", dropped);
        logger.atWarn().log("Isolated group {}, dropped {} buffered events", changeGroupId, dropped);
        if (newlyIsolated) {
            notifications.publish(new MonitorNotification(MonitorNotification.Type.GROUP_ISOLATED, changeGroupId,
                    message, Map.of("dropped", (long) dropped), clock.instant()));
        }
    }

    /**
     * Removes {@code floor(n/2)} buffered events, lowest priority groups first.
     *
     * @return what was removed
     */
    public EvictionResult emergencyEvict() {
        EvictionResult result = buffer.evictHalf(groups::priorityOf);
        synchronized (this) {
            lastEviction = result;
        }
        metrics.recordDropped("eviction", result.removed());
        logger.atWarn().log("Emergency eviction removed {} of {} buffered events", result.removed(),
                result.before());
        notifications.publish(new MonitorNotification(MonitorNotification.Type.EVICTION, null,
                "Evicted " + result.removed() + " of " + result.before() + " buffered events",
                result.perGroup(), result.at()));
        return result;
    }

    /**
     * Checks heap usage and evicts when it is above the configured threshold.
     *
     * @return true if an eviction ran
     */
    public boolean checkMemoryPressure() {
        double used = memoryProbe.utilization();
        if (used > config.memoryPressureThreshold()) {
            handleFailure(FailureKind.MEMORY_EXHAUSTED,
                    String.format(Locale.ROOT, "Heap utilization %.2f above %.2f", used,
                            config.memoryPressureThreshold()),
                    null);
            return true;
        }
        return false;
    }

    /**
     * Records a committed flush: clears the transient streak, re-enables
     * spillover and lifts the isolation of every group whose events were
     * written.
     *
     * @param persistedGroups ids of the groups in the committed batch
     */
    public void recordWriteSuccess(Set<String> persistedGroups) {
        boolean resumed;
        List<String> released = new ArrayList<>();
        synchronized (this) {
            consecutiveTransient = 0;
            resumed = spilloverDisabled;
            spilloverDisabled = false;
            for (String id : persistedGroups) {
                if (isolatedGroups.remove(id)) {
                    released.add(id);
                }
            }
        }
        if (resumed) {
            logger.atInfo().log("Write succeeded, spillover re-enabled");
            notifications.publish(MonitorNotification.of(MonitorNotification.Type.SPILLOVER_RESUMED,
                    "Spillover re-enabled after successful write", clock.instant()));
        }
        released.forEach(id -> logger.atInfo().log("Group {} persisted cleanly, isolation lifted", id));
    }

    public synchronized boolean spilloverEnabled() {
        return !spilloverDisabled;
    }

    public synchronized boolean isIsolated(String changeGroupId) {
        return isolatedGroups.contains(changeGroupId);
    }

    /**
     * Re-enables spillover without waiting for a successful write.
     */
    public void resumeSpillover() {
        boolean resumed;
        synchronized (this) {
            resumed = spilloverDisabled;
            spilloverDisabled = false;
        }
        if (resumed) {
            logger.atInfo().log("Spillover re-enabled manually");
            notifications.publish(MonitorNotification.of(MonitorNotification.Type.SPILLOVER_RESUMED,
                    "Spillover re-enabled manually", clock.instant()));
        }
    }

    @Override
    public void groupDestroyed(String id) {
        synchronized (this) {
            isolatedGroups.remove(id);
        }
    }

    /**
     * Clears errors and mitigations after an operator has dealt with them.
     */
    public void reset() {
        synchronized (this) {
            errorCount = 0;
            lastError = null;
            consecutiveTransient = 0;
            isolatedGroups.clear();
            lastEviction = null;
        }
        resumeSpillover();
        logger.atInfo().log("Health state reset");
    }

    public synchronized long errorCount() {
        return errorCount;
    }

    public HealthStatus status() {
        double bufferUtilization = buffer.utilization();
        double memoryUtilization = memoryProbe.utilization();
        double utilization = Math.max(bufferUtilization, memoryUtilization);
        synchronized (this) {
            List<String> mitigations = new ArrayList<>();
            if (spilloverDisabled) {
                mitigations.add(SPILLOVER_DISABLED);
            }
            isolatedGroups.forEach(id -> mitigations.add(GROUP_ISOLATED_PREFIX + id));

            List<String> issues = new ArrayList<>();
            if (utilization > DEGRADED_UTILIZATION) {
                issues.add(String.format(Locale.ROOT, "High utilization: %.0f%%", utilization * 100));
            }
            if (errorCount > DEGRADED_ERRORS) {
                issues.add("High error count: " + errorCount);
            }
            boolean recurringTransient = consecutiveTransient >= config.transientFailureThreshold();
            if (recurringTransient) {
                issues.add("Recurring transient I/O failures: " + consecutiveTransient);
            }
            mitigations.forEach(m -> issues.add("Active mitigation: " + m));

            HealthTier tier;
            if (utilization > UNHEALTHY_UTILIZATION || errorCount > UNHEALTHY_ERRORS) {
                tier = HealthTier.UNHEALTHY;
            } else if (!issues.isEmpty()) {
                tier = HealthTier.DEGRADED;
            } else {
                tier = HealthTier.HEALTHY;
            }
            return new HealthStatus(tier, errorCount, lastError, mitigations, issues, bufferUtilization,
                    memoryUtilization, lastEviction, clock.instant());
        }
    }
}
