package com.p14n.pollevent.group;

import java.util.List;

import com.p14n.pollevent.data.ControlReference;

/**
 * Outcome of adding or removing controls. A batch is never aborted: every
 * supplied reference ends up in exactly one of the two lists.
 *
 * @param accepted references that were applied
 * @param rejected references that were not, with the reason
 */
public record AddControlsResult(List<ControlReference> accepted, List<RejectedControl> rejected) {

    public AddControlsResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public boolean allAccepted() {
        return rejected.isEmpty();
    }
}
