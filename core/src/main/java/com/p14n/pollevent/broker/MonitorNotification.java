package com.p14n.pollevent.broker;

import java.time.Instant;
import java.util.Map;

/**
 * Notification about a recovery action or lifecycle event of the monitor.
 *
 * @param type          what happened
 * @param changeGroupId group concerned, or {@code null} when not group specific
 * @param message       human readable description
 * @param counts        numeric details, e.g. evicted events per group
 * @param timestamp     when it happened
 */
public record MonitorNotification(Type type,
        String changeGroupId,
        String message,
        Map<String, Long> counts,
        Instant timestamp) {

    public enum Type {
        EVICTION,
        SPILLOVER_DISABLED,
        SPILLOVER_RESUMED,
        GROUP_ISOLATED,
        BACKUP_COMPLETED,
        RESTORE_COMPLETED
    }

    public MonitorNotification {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
    }

    public static MonitorNotification of(Type type, String message, Instant timestamp) {
        return new MonitorNotification(type, null, message, Map.of(), timestamp);
    }
}
