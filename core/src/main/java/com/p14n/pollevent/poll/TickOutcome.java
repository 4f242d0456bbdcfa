package com.p14n.pollevent.poll;

public enum TickOutcome {
    /** The read succeeded and the results were diffed against the cache. */
    APPLIED,
    /** A read for the group was still in flight. */
    SKIPPED,
    /** The group was destroyed or re-generated while the read was in flight. */
    STALE,
    /** The read failed or timed out. */
    FAILED,
    /** The read returned malformed data. */
    CORRUPT
}
