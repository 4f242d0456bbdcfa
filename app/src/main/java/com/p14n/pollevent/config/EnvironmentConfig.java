package com.p14n.pollevent.config;

import java.util.Locale;
import java.util.Map;

import com.p14n.pollevent.data.ConfigData;

/**
 * Builds the monitor configuration from environment variables. Unset
 * variables take their defaults; malformed values fail naming the variable.
 */
public class EnvironmentConfig {

    public static final String ENABLED = "EVENT_MONITORING_ENABLED";
    public static final String DB_PATH = "EVENT_MONITORING_DB_PATH";
    public static final String RETENTION_DAYS = "EVENT_MONITORING_RETENTION_DAYS";
    public static final String BUFFER_SIZE = "EVENT_MONITORING_BUFFER_SIZE";
    public static final String FLUSH_INTERVAL = "EVENT_MONITORING_FLUSH_INTERVAL";
    public static final String POLL_MIN_INTERVAL = "EVENT_POLL_MIN_INTERVAL";
    public static final String POLL_MAX_INTERVAL = "EVENT_POLL_MAX_INTERVAL";
    public static final String REMOTE_TIMEOUT = "EVENT_REMOTE_TIMEOUT";
    public static final String BACKUP_PATH = "EVENT_BACKUP_PATH";
    public static final String BACKUP_INTERVAL = "EVENT_BACKUP_INTERVAL";
    public static final String MAX_BACKUPS = "EVENT_MAX_BACKUPS";
    public static final String BACKUP_COMPRESSION = "EVENT_BACKUP_COMPRESSION";
    public static final String RETENTION_SWEEP_INTERVAL = "EVENT_RETENTION_SWEEP_INTERVAL";

    private EnvironmentConfig() {
    }

    public static ConfigData fromSystem() {
        return load(System.getenv());
    }

    public static ConfigData load(Map<String, String> env) {
        return ConfigData.builder()
                .monitoringEnabled(bool(env, ENABLED, false))
                .storagePath(string(env, DB_PATH, ConfigData.DEFAULT_STORAGE_PATH))
                .retentionDays(integer(env, RETENTION_DAYS, ConfigData.DEFAULT_RETENTION_DAYS))
                .bufferCapacity(integer(env, BUFFER_SIZE, ConfigData.DEFAULT_BUFFER_CAPACITY))
                .flushIntervalMillis(longValue(env, FLUSH_INTERVAL, ConfigData.DEFAULT_FLUSH_INTERVAL_MILLIS))
                .minPollIntervalSeconds(doubleValue(env, POLL_MIN_INTERVAL,
                        ConfigData.DEFAULT_MIN_POLL_INTERVAL_SECONDS))
                .maxPollIntervalSeconds(doubleValue(env, POLL_MAX_INTERVAL,
                        ConfigData.DEFAULT_MAX_POLL_INTERVAL_SECONDS))
                .remoteTimeoutMillis(longValue(env, REMOTE_TIMEOUT, ConfigData.DEFAULT_REMOTE_TIMEOUT_MILLIS))
                .backupPath(string(env, BACKUP_PATH, ConfigData.DEFAULT_BACKUP_PATH))
                .backupIntervalMillis(longValue(env, BACKUP_INTERVAL, ConfigData.DEFAULT_BACKUP_INTERVAL_MILLIS))
                .maxBackups(integer(env, MAX_BACKUPS, ConfigData.DEFAULT_MAX_BACKUPS))
                .backupCompression(bool(env, BACKUP_COMPRESSION, true))
                .retentionSweepIntervalMillis(longValue(env, RETENTION_SWEEP_INTERVAL,
                        ConfigData.DEFAULT_RETENTION_SWEEP_INTERVAL_MILLIS))
                .build();
    }

    private static String raw(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static String string(Map<String, String> env, String name, String defaultValue) {
        String value = raw(env, name);
        return value == null ? defaultValue : value;
    }

    private static boolean bool(Map<String, String> env, String name, boolean defaultValue) {
        String value = raw(env, name);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(name + " must be true or false: " + value);
        };
    }

    private static int integer(Map<String, String> env, String name, int defaultValue) {
        String value = raw(env, name);
        try {
            return value == null ? defaultValue : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static long longValue(Map<String, String> env, String name, long defaultValue) {
        String value = raw(env, name);
        try {
            return value == null ? defaultValue : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static double doubleValue(Map<String, String> env, String name, double defaultValue) {
        String value = raw(env, name);
        try {
            return value == null ? defaultValue : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }
}
