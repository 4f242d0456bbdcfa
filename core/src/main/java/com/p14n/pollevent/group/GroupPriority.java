package com.p14n.pollevent.group;

/**
 * Relative importance of a change group. Emergency eviction removes events of
 * lower priority groups first.
 */
public enum GroupPriority {
    LOW,
    NORMAL,
    HIGH
}
