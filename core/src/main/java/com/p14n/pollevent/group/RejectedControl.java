package com.p14n.pollevent.group;

/**
 * A control reference that was not applied by a membership change.
 *
 * @param reference the reference as supplied by the caller
 * @param status    why it was not applied
 * @param reason    human readable detail
 */
public record RejectedControl(String reference, Status status, String reason) {

    public enum Status {
        /** The reference breaks the naming rule. */
        INVALID,
        /** The reference is valid but the change was a no-op. */
        SKIPPED
    }
}
