package com.p14n.pollevent.remote;

/**
 * Raised when the remote control plane cannot be read.
 */
public class TransportException extends Exception {

    private final boolean timeout;

    public TransportException(String message) {
        this(message, null, false);
    }

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private TransportException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static TransportException timeout(long timeoutMillis) {
        return new TransportException("Remote read timed out after " + timeoutMillis + "ms", null, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
