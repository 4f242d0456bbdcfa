package com.p14n.pollevent.health;

public enum FailureKind {
    /** The disk holding the store is full or not writable. */
    STORAGE_EXHAUSTED,
    /** The heap is close to its limit. */
    MEMORY_EXHAUSTED,
    /** Data failed normalization or an integrity check. */
    CORRUPTION_DETECTED,
    /** Anything else; assumed to resolve by itself. */
    TRANSIENT_IO
}
