package com.p14n.pollevent.data;

/**
 * Immutable record of a control value change detected by polling.
 *
 * @param id            monotonically increasing id assigned by the poll engine
 * @param changeGroupId owning change group
 * @param control       control that changed
 * @param value         new value
 * @param stringValue   optional string representation
 * @param timestamp     milliseconds since the epoch, shared by all events of a tick
 * @param sequence      position of the event within its tick
 */
public record ChangeEvent(long id,
        String changeGroupId,
        ControlReference control,
        ControlValue value,
        String stringValue,
        long timestamp,
        int sequence) {

    public ChangeEvent {
        if (changeGroupId == null || changeGroupId.isEmpty()) {
            throw new IllegalArgumentException("changeGroupId cannot be null or empty");
        }
        if (control == null) {
            throw new IllegalArgumentException("control cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * @return the component name, or {@code null} for bare control names
     */
    public String component() {
        return control.component();
    }
}
