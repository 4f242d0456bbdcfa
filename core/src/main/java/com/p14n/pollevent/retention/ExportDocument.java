package com.p14n.pollevent.retention;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Portable JSON form of a set of events.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportDocument(String exportedAt,
        long eventsCount,
        Long startTime,
        Long endTime,
        List<ExportedEvent> events) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportedEvent(long id,
            String changeGroupId,
            String controlPath,
            String componentName,
            String controlName,
            String valueKind,
            Object value,
            String stringValue,
            long timestamp,
            int sequence,
            String createdAt) {
    }
}
