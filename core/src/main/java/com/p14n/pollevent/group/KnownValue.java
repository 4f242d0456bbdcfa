package com.p14n.pollevent.group;

import com.p14n.pollevent.data.ControlValue;

/**
 * Last value seen for a control by auto-polling.
 */
public record KnownValue(ControlValue value, String stringValue, long timestamp) {
}
