package com.p14n.pollevent.group;

/**
 * Lookups on change groups needed by recovery actions.
 */
public interface GroupDirectory {

    /**
     * @param id change group id
     * @return the group's priority, or {@code null} if the group no longer exists
     */
    GroupPriority priorityOf(String id);

    /**
     * Forgets every last known value of a group so the next poll re-baselines it.
     * Unknown ids are ignored.
     *
     * @param id change group id
     */
    void resetCache(String id);
}
