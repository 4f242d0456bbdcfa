package com.p14n.pollevent.persistence;

public class RestoreConflictException extends RuntimeException {

    public RestoreConflictException(String message) {
        super(message);
    }
}
