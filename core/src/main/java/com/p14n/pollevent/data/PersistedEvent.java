package com.p14n.pollevent.data;

import java.time.Instant;

/**
 * A change event as stored in the events table.
 */
public record PersistedEvent(long id,
        String changeGroupId,
        String controlPath,
        String componentName,
        String controlName,
        ControlValue value,
        String stringValue,
        long timestamp,
        int sequence,
        Instant createdAt) {
}
