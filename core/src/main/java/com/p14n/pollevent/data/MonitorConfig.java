package com.p14n.pollevent.data;

/**
 * Configuration of the event monitoring subsystem.
 * An instance is built once at startup and passed to every component; nothing
 * reads process-wide settings while handling requests.
 */
public interface MonitorConfig {

    /** Value of {@link #storagePath()} selecting an in-memory database. */
    String IN_MEMORY = ":memory:";

    /**
     * Whether change events are buffered and persisted at all.
     *
     * @return true when monitoring is enabled
     */
    boolean monitoringEnabled();

    /**
     * Directory (or {@link #IN_MEMORY}) holding the events database.
     *
     * @return the storage path
     */
    String storagePath();

    /**
     * Number of days persisted events are kept.
     *
     * @return the retention period in days
     */
    int retentionDays();

    /**
     * Maximum number of events held in memory before the oldest are dropped.
     *
     * @return the buffer capacity
     */
    int bufferCapacity();

    /**
     * Interval between buffer flushes.
     *
     * @return the flush interval in milliseconds
     */
    long flushIntervalMillis();

    /**
     * Lowest accepted poll interval; faster requests are clamped to it.
     *
     * @return the floor in seconds
     */
    double minPollIntervalSeconds();

    /**
     * Highest accepted poll interval; slower requests are clamped to it.
     *
     * @return the ceiling in seconds
     */
    double maxPollIntervalSeconds();

    /**
     * Upper bound of a single batched remote read.
     *
     * @return the timeout in milliseconds
     */
    long remoteTimeoutMillis();

    /**
     * Directory receiving snapshots and exports.
     *
     * @return the backup directory
     */
    String backupPath();

    /**
     * Interval between automatic backups, 0 disables them.
     *
     * @return the interval in milliseconds
     */
    long backupIntervalMillis();

    /**
     * Number of snapshots kept after a backup.
     *
     * @return the maximum number of backups
     */
    int maxBackups();

    /**
     * Whether snapshots are gzip compressed.
     *
     * @return true to compress
     */
    boolean backupCompression();

    /**
     * Interval between retention sweeps.
     *
     * @return the interval in milliseconds
     */
    long retentionSweepIntervalMillis();

    /**
     * Interval between write attempts while spillover is disabled.
     *
     * @return the interval in milliseconds
     */
    default long spilloverProbeIntervalMillis() {
        return 30_000;
    }

    /**
     * Heap utilization above which an emergency eviction is triggered.
     *
     * @return a ratio between 0 and 1
     */
    default double memoryPressureThreshold() {
        return 0.95;
    }

    /**
     * Consecutive transient write failures tolerated before they count as an
     * issue on their own.
     *
     * @return the threshold
     */
    default int transientFailureThreshold() {
        return 5;
    }

    default boolean inMemory() {
        return IN_MEMORY.equals(storagePath());
    }
}
