package com.p14n.pollevent.query;

/**
 * Aggregate view of the stored events and the live buffer.
 *
 * @param totalEvents         rows in the store
 * @param distinctControls    distinct control paths
 * @param distinctGroups      distinct change group ids
 * @param oldestEvent         earliest event time, or {@code null} when empty
 * @param newestEvent         latest event time, or {@code null} when empty
 * @param storeSizeBytes      size of the database file
 * @param bufferedEvents      events waiting to be persisted
 * @param bufferCapacity      buffer capacity
 * @param overflowCount       events dropped because the buffer was full
 * @param monitoringEnabled   whether events are persisted at all
 * @param retentionDays       configured retention
 */
public record EventStatistics(long totalEvents,
        long distinctControls,
        long distinctGroups,
        Long oldestEvent,
        Long newestEvent,
        long storeSizeBytes,
        int bufferedEvents,
        int bufferCapacity,
        long overflowCount,
        boolean monitoringEnabled,
        int retentionDays) {

    public static EventStatistics disabled(int retentionDays) {
        return new EventStatistics(0, 0, 0, null, null, 0, 0, 0, 0, false, retentionDays);
    }

    EventStatistics withBuffer(int buffered, int capacity, long overflow, long storeSize) {
        return new EventStatistics(totalEvents, distinctControls, distinctGroups, oldestEvent, newestEvent,
                storeSize, buffered, capacity, overflow, monitoringEnabled, retentionDays);
    }
}
