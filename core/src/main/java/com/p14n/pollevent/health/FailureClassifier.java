package com.p14n.pollevent.health;

import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.Locale;

import org.h2.api.ErrorCode;

/**
 * Maps exceptions raised while writing to the store onto a {@link FailureKind}.
 */
public class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            FailureKind kind = classifyOne(t);
            if (kind != null) {
                return kind;
            }
        }
        return FailureKind.TRANSIENT_IO;
    }

    private static FailureKind classifyOne(Throwable t) {
        if (t instanceof OutOfMemoryError) {
            return FailureKind.MEMORY_EXHAUSTED;
        }
        if (mentionsNoSpace(t.getMessage())) {
            return FailureKind.STORAGE_EXHAUSTED;
        }
        if (t instanceof SQLDataException) {
            return FailureKind.CORRUPTION_DETECTED;
        }
        if (t instanceof SQLException e) {
            switch (e.getErrorCode()) {
                case ErrorCode.OUT_OF_MEMORY:
                    return FailureKind.MEMORY_EXHAUSTED;
                case ErrorCode.FILE_CORRUPTED_1:
                case ErrorCode.DATA_CONVERSION_ERROR_1:
                case ErrorCode.VALUE_TOO_LONG_2:
                case ErrorCode.NULL_NOT_ALLOWED:
                case ErrorCode.NUMERIC_VALUE_OUT_OF_RANGE_1:
                    return FailureKind.CORRUPTION_DETECTED;
                case ErrorCode.DATABASE_IS_READ_ONLY:
                case ErrorCode.FILE_CREATION_FAILED_1:
                    return FailureKind.STORAGE_EXHAUSTED;
                default:
                    return null;
            }
        }
        if (t instanceof AccessDeniedException) {
            return FailureKind.STORAGE_EXHAUSTED;
        }
        if (t instanceof FileSystemException fse && fse.getReason() != null && mentionsNoSpace(fse.getReason())) {
            return FailureKind.STORAGE_EXHAUSTED;
        }
        return null;
    }

    static boolean mentionsNoSpace(String message) {
        if (message == null) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("no space left")
                || m.contains("disk full")
                || m.contains("not enough space")
                || m.contains("quota exceeded");
    }
}
