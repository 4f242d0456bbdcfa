package com.p14n.pollevent.group;

public class DuplicateGroupException extends RuntimeException {

    public DuplicateGroupException(String id) {
        super("Change group already exists: " + id);
    }
}
