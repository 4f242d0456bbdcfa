package com.p14n.pollevent.health;

import java.time.Instant;

/**
 * @param kind          classification of the failure
 * @param message       description
 * @param changeGroupId group concerned, or {@code null}
 * @param timestamp     when it was recorded
 */
public record ErrorRecord(FailureKind kind, String message, String changeGroupId, Instant timestamp) {
}
