package com.p14n.pollevent.buffer;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of an emergency eviction.
 *
 * @param before   buffered events before the eviction
 * @param removed  number of events removed
 * @param perGroup removed events keyed by change group id
 * @param at       when the eviction ran
 */
public record EvictionResult(int before, int removed, Map<String, Long> perGroup, Instant at) {

    public EvictionResult {
        perGroup = Map.copyOf(perGroup);
    }

    public int remaining() {
        return before - removed;
    }
}
