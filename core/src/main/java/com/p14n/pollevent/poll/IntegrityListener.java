package com.p14n.pollevent.poll;

/**
 * Notified when a group's data fails normalization or an integrity check.
 */
@FunctionalInterface
public interface IntegrityListener {

    IntegrityListener NONE = (changeGroupId, message) -> {
    };

    void integrityFailure(String changeGroupId, String message);
}
