package com.p14n.pollevent.group;

public class UnknownGroupException extends RuntimeException {

    public UnknownGroupException(String id) {
        super("Unknown change group: " + id);
    }
}
