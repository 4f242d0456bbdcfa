package com.p14n.pollevent.cli;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

final class Formats {

    private Formats() {
    }

    static String bytes(long size) {
        if (size < 1024) {
            return size + " B";
        }
        if (size < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", size / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", size / (1024.0 * 1024));
    }

    static String time(Long millis) {
        return millis == null ? "-" : Instant.ofEpochMilli(millis).toString();
    }

    /**
     * Accepts epoch millis or an ISO-8601 instant.
     */
    static Long parseTime(String value, String option) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            try {
                return Instant.parse(value).toEpochMilli();
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException(option + " must be epoch millis or an ISO-8601 instant: " + value);
            }
        }
    }
}
