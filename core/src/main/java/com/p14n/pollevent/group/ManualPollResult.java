package com.p14n.pollevent.group;

import java.util.List;

import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.data.ControlValue;

/**
 * Changes seen by one caller since its previous manual poll.
 *
 * @param changeGroupId the polled group
 * @param callerId      the caller whose cursor was used
 * @param changes       changed controls, or every control for a full snapshot
 * @param timestamp     when the read completed
 */
public record ManualPollResult(String changeGroupId, String callerId, List<Change> changes, long timestamp) {

    public record Change(ControlReference control, ControlValue value, String stringValue) {
    }

    public ManualPollResult {
        changes = List.copyOf(changes);
    }
}
