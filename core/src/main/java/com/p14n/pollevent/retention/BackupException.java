package com.p14n.pollevent.retention;

/**
 * A backup, restore, export or import failed. Wraps the underlying I/O or SQL
 * error.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
