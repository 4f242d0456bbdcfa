package com.p14n.pollevent.data;

public record ConfigData(boolean monitoringEnabled,
        String storagePath,
        int retentionDays,
        int bufferCapacity,
        long flushIntervalMillis,
        double minPollIntervalSeconds,
        double maxPollIntervalSeconds,
        long remoteTimeoutMillis,
        String backupPath,
        long backupIntervalMillis,
        int maxBackups,
        boolean backupCompression,
        long retentionSweepIntervalMillis) implements MonitorConfig {

    public static final String DEFAULT_STORAGE_PATH = "./data/events";
    public static final String DEFAULT_BACKUP_PATH = "./data/backups";
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_BUFFER_CAPACITY = 1000;
    public static final long DEFAULT_FLUSH_INTERVAL_MILLIS = 100;
    public static final double DEFAULT_MIN_POLL_INTERVAL_SECONDS = 0.03;
    public static final double DEFAULT_MAX_POLL_INTERVAL_SECONDS = 3600;
    public static final long DEFAULT_REMOTE_TIMEOUT_MILLIS = 5000;
    public static final long DEFAULT_BACKUP_INTERVAL_MILLIS = 86_400_000L;
    public static final int DEFAULT_MAX_BACKUPS = 7;
    public static final long DEFAULT_RETENTION_SWEEP_INTERVAL_MILLIS = 3_600_000L;

    public ConfigData {
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("storagePath cannot be null or empty");
        }
        if (backupPath == null || backupPath.isBlank()) {
            throw new IllegalArgumentException("backupPath cannot be null or empty");
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be at least 1");
        }
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be at least 1");
        }
        if (flushIntervalMillis < 1) {
            throw new IllegalArgumentException("flushIntervalMillis must be positive");
        }
        if (!(minPollIntervalSeconds > 0) || !(maxPollIntervalSeconds >= minPollIntervalSeconds)) {
            throw new IllegalArgumentException("poll interval bounds must satisfy 0 < min <= max");
        }
        if (remoteTimeoutMillis < 1) {
            throw new IllegalArgumentException("remoteTimeoutMillis must be positive");
        }
        if (backupIntervalMillis < 0) {
            throw new IllegalArgumentException("backupIntervalMillis cannot be negative");
        }
        if (maxBackups < 1) {
            throw new IllegalArgumentException("maxBackups must be at least 1");
        }
        if (retentionSweepIntervalMillis < 1) {
            throw new IllegalArgumentException("retentionSweepIntervalMillis must be positive");
        }
    }

    public ConfigData(boolean monitoringEnabled, String storagePath) {
        this(monitoringEnabled, storagePath, DEFAULT_RETENTION_DAYS, DEFAULT_BUFFER_CAPACITY,
                DEFAULT_FLUSH_INTERVAL_MILLIS, DEFAULT_MIN_POLL_INTERVAL_SECONDS,
                DEFAULT_MAX_POLL_INTERVAL_SECONDS, DEFAULT_REMOTE_TIMEOUT_MILLIS, DEFAULT_BACKUP_PATH,
                DEFAULT_BACKUP_INTERVAL_MILLIS, DEFAULT_MAX_BACKUPS, true,
                DEFAULT_RETENTION_SWEEP_INTERVAL_MILLIS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .monitoringEnabled(monitoringEnabled)
                .storagePath(storagePath)
                .retentionDays(retentionDays)
                .bufferCapacity(bufferCapacity)
                .flushIntervalMillis(flushIntervalMillis)
                .minPollIntervalSeconds(minPollIntervalSeconds)
                .maxPollIntervalSeconds(maxPollIntervalSeconds)
                .remoteTimeoutMillis(remoteTimeoutMillis)
                .backupPath(backupPath)
                .backupIntervalMillis(backupIntervalMillis)
                .maxBackups(maxBackups)
                .backupCompression(backupCompression)
                .retentionSweepIntervalMillis(retentionSweepIntervalMillis);
    }

    /**
     * Builder starting from the documented defaults; monitoring is off unless
     * enabled explicitly.
     */
    public static final class Builder {
        private boolean monitoringEnabled = false;
        private String storagePath = DEFAULT_STORAGE_PATH;
        private int retentionDays = DEFAULT_RETENTION_DAYS;
        private int bufferCapacity = DEFAULT_BUFFER_CAPACITY;
        private long flushIntervalMillis = DEFAULT_FLUSH_INTERVAL_MILLIS;
        private double minPollIntervalSeconds = DEFAULT_MIN_POLL_INTERVAL_SECONDS;
        private double maxPollIntervalSeconds = DEFAULT_MAX_POLL_INTERVAL_SECONDS;
        private long remoteTimeoutMillis = DEFAULT_REMOTE_TIMEOUT_MILLIS;
        private String backupPath = DEFAULT_BACKUP_PATH;
        private long backupIntervalMillis = DEFAULT_BACKUP_INTERVAL_MILLIS;
        private int maxBackups = DEFAULT_MAX_BACKUPS;
        private boolean backupCompression = true;
        private long retentionSweepIntervalMillis = DEFAULT_RETENTION_SWEEP_INTERVAL_MILLIS;

        private Builder() {
        }

        public Builder monitoringEnabled(boolean monitoringEnabled) {
            this.monitoringEnabled = monitoringEnabled;
            return this;
        }

        public Builder storagePath(String storagePath) {
            this.storagePath = storagePath;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder flushIntervalMillis(long flushIntervalMillis) {
            this.flushIntervalMillis = flushIntervalMillis;
            return this;
        }

        public Builder minPollIntervalSeconds(double minPollIntervalSeconds) {
            this.minPollIntervalSeconds = minPollIntervalSeconds;
            return this;
        }

        public Builder maxPollIntervalSeconds(double maxPollIntervalSeconds) {
            this.maxPollIntervalSeconds = maxPollIntervalSeconds;
            return this;
        }

        public Builder remoteTimeoutMillis(long remoteTimeoutMillis) {
            this.remoteTimeoutMillis = remoteTimeoutMillis;
            return this;
        }

        public Builder backupPath(String backupPath) {
            this.backupPath = backupPath;
            return this;
        }

        public Builder backupIntervalMillis(long backupIntervalMillis) {
            this.backupIntervalMillis = backupIntervalMillis;
            return this;
        }

        public Builder maxBackups(int maxBackups) {
            this.maxBackups = maxBackups;
            return this;
        }

        public Builder backupCompression(boolean backupCompression) {
            this.backupCompression = backupCompression;
            return this;
        }

        public Builder retentionSweepIntervalMillis(long retentionSweepIntervalMillis) {
            this.retentionSweepIntervalMillis = retentionSweepIntervalMillis;
            return this;
        }

        public ConfigData build() {
            return new ConfigData(monitoringEnabled, storagePath, retentionDays, bufferCapacity,
                    flushIntervalMillis, minPollIntervalSeconds, maxPollIntervalSeconds, remoteTimeoutMillis,
                    backupPath, backupIntervalMillis, maxBackups, backupCompression,
                    retentionSweepIntervalMillis);
        }
    }
}
