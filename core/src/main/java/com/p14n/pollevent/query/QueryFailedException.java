package com.p14n.pollevent.query;

/**
 * The store could not be read.
 */
public class QueryFailedException extends RuntimeException {

    public QueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
