package com.p14n.pollevent.group;

import java.util.List;

import com.p14n.pollevent.data.ControlReference;

/**
 * Point-in-time copy of a change group's state.
 *
 * @param errorCount          failed reads since creation
 * @param consecutiveFailures failed reads since the last successful one
 * @param skippedTicks        ticks skipped because a read was still in flight
 */
public record GroupSummary(String id,
        List<ControlReference> controls,
        double pollRateSeconds,
        boolean running,
        GroupPriority priority,
        long errorCount,
        long consecutiveFailures,
        long skippedTicks) {

    public GroupSummary {
        controls = List.copyOf(controls);
    }

    public int controlCount() {
        return controls.size();
    }
}
