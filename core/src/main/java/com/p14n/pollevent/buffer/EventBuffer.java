package com.p14n.pollevent.buffer;

import java.time.Clock;
import java.util.*;
import java.util.function.Function;

import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.group.GroupPriority;

/**
 * Bounded, ordered holding area for change events that have not been
 * persisted yet.
 *
 * <p>
 * Producers never block: adding to a full buffer drops the oldest event and
 * increments the overflow counter by exactly the number of events dropped.
 * All methods are synchronized on the buffer; callers holding a group lock
 * may call in, the buffer never calls out.
 * </p>
 */
public class EventBuffer {

    private final int capacity;
    private final Clock clock;
    private final ArrayDeque<ChangeEvent> events;
    private long overflowCount;
    private boolean dirty;

    public EventBuffer(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public EventBuffer(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.clock = clock;
        this.events = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    /**
     * Appends an event, dropping the oldest when full.
     *
     * @param event the event to add
     * @return the number of events dropped to make room (0 or 1)
     */
    public synchronized int add(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        int dropped = 0;
        if (events.size() >= capacity) {
            events.pollFirst();
            overflowCount++;
            dropped = 1;
        }
        events.addLast(event);
        dirty = true;
        return dropped;
    }

    /**
     * Appends events in order.
     *
     * @param batch the events to add
     * @return the number of events dropped
     */
    public synchronized int addAll(List<ChangeEvent> batch) {
        int dropped = 0;
        for (ChangeEvent e : batch) {
            dropped += add(e);
        }
        return dropped;
    }

    /**
     * Removes and returns every buffered event, oldest first.
     *
     * @return the drained events
     */
    public synchronized List<ChangeEvent> drainAll() {
        List<ChangeEvent> drained = new ArrayList<>(events);
        events.clear();
        dirty = false;
        return drained;
    }

    /**
     * Puts a batch that failed to persist back in front of the events added
     * since it was drained. When the result exceeds the capacity the oldest
     * events are dropped and counted as overflow.
     *
     * @param batch the batch to return, oldest first
     * @return the number of events dropped
     */
    public synchronized int requeueFront(List<ChangeEvent> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        for (ListIterator<ChangeEvent> it = batch.listIterator(batch.size()); it.hasPrevious();) {
            events.addFirst(it.previous());
        }
        int dropped = 0;
        while (events.size() > capacity) {
            events.pollFirst();
            dropped++;
        }
        overflowCount += dropped;
        dirty = true;
        return dropped;
    }

    /**
     * Discards every buffered event of one change group.
     *
     * @param changeGroupId the group
     * @return the number of events removed
     */
    public synchronized int removeGroup(String changeGroupId) {
        int before = events.size();
        events.removeIf(e -> e.changeGroupId().equals(changeGroupId));
        return before - events.size();
    }

    /**
     * Emergency eviction of {@code floor(n/2)} events.
     *
     * <p>
     * Groups are visited lowest priority first, ties broken by group id. A
     * first pass removes a group's events oldest first but keeps its newest
     * event; only if that is not enough does a second pass remove those
     * remaining representatives in the same group order.
     * </p>
     *
     * @param priorityOf priority lookup by change group id
     * @return what was removed
     */
    public synchronized EvictionResult evictHalf(Function<String, GroupPriority> priorityOf) {
        int before = events.size();
        int target = before / 2;
        Map<String, Long> perGroup = new TreeMap<>();
        if (target == 0) {
            return new EvictionResult(before, 0, perGroup, clock.instant());
        }

        Map<String, List<ChangeEvent>> byGroup = new HashMap<>();
        for (ChangeEvent e : events) {
            byGroup.computeIfAbsent(e.changeGroupId(), k -> new ArrayList<>()).add(e);
        }
        List<String> order = new ArrayList<>(byGroup.keySet());
        order.sort(Comparator
                .comparing((String id) -> priorityOrDefault(priorityOf, id))
                .thenComparing(Comparator.naturalOrder()));

        Set<ChangeEvent> victims = Collections.newSetFromMap(new IdentityHashMap<>());
        for (String id : order) {
            List<ChangeEvent> groupEvents = byGroup.get(id);
            for (int i = 0; i < groupEvents.size() - 1 && victims.size() < target; i++) {
                victims.add(groupEvents.get(i));
                perGroup.merge(id, 1L, Long::sum);
            }
        }
        for (String id : order) {
            if (victims.size() >= target) {
                break;
            }
            List<ChangeEvent> groupEvents = byGroup.get(id);
            victims.add(groupEvents.get(groupEvents.size() - 1));
            perGroup.merge(id, 1L, Long::sum);
        }

        events.removeIf(victims::contains);
        return new EvictionResult(before, victims.size(), perGroup, clock.instant());
    }

    private static GroupPriority priorityOrDefault(Function<String, GroupPriority> priorityOf, String id) {
        GroupPriority p = priorityOf.apply(id);
        return p == null ? GroupPriority.LOW : p;
    }

    public synchronized List<ChangeEvent> snapshot() {
        return List.copyOf(events);
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized long overflowCount() {
        return overflowCount;
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized double utilization() {
        return (double) events.size() / capacity;
    }
}
