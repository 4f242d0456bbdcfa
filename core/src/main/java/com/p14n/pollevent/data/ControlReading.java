package com.p14n.pollevent.data;

/**
 * One current value read from the remote control plane.
 *
 * @param value       normalized value
 * @param stringValue optional human readable form supplied by the device
 */
public record ControlReading(ControlValue value, String stringValue) {

    public ControlReading {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static ControlReading of(Object raw, String stringValue) {
        return new ControlReading(ControlValue.of(raw), stringValue);
    }

    public static ControlReading of(Object raw) {
        return of(raw, null);
    }
}
