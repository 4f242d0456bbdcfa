package com.p14n.pollevent.group;

import java.util.*;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;

/**
 * Mutable state of one change group.
 *
 * <p>
 * Membership, the value cache, manual poll cursors, the generation and the
 * timer handle are guarded by {@link #lock()}. Counters and the in-flight flag
 * are atomic so they can be read without the lock.
 * </p>
 */
public class ChangeGroup {

    private final String id;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashSet<ControlReference> controls = new LinkedHashSet<>();
    private final Map<ControlReference, KnownValue> lastKnown = new HashMap<>();
    private final Map<String, Map<ControlReference, ControlReading>> manualCursors = new HashMap<>();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong consecutiveFailures = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final GroupPriority priority;

    private volatile double pollRateSeconds;
    private volatile boolean destroyed;
    private long generation;
    private ScheduledFuture<?> timer;

    public ChangeGroup(String id, double pollRateSeconds, GroupPriority priority) {
        this.id = id;
        this.pollRateSeconds = pollRateSeconds;
        this.priority = priority;
    }

    public String id() {
        return id;
    }

    public GroupPriority priority() {
        return priority;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public double pollRateSeconds() {
        return pollRateSeconds;
    }

    public void setPollRateSeconds(double pollRateSeconds) {
        this.pollRateSeconds = pollRateSeconds;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /** Marks the group destroyed and invalidates outstanding reads. Caller holds the lock. */
    public void markDestroyed() {
        destroyed = true;
        generation++;
    }

    public long generation() {
        return generation;
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return timer != null && !destroyed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the timer handle, returning the previous one. Caller holds the lock.
     */
    public ScheduledFuture<?> swapTimer(ScheduledFuture<?> next) {
        ScheduledFuture<?> previous = timer;
        timer = next;
        return previous;
    }

    public List<ControlReference> members() {
        lock.lock();
        try {
            return List.copyOf(controls);
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds the lock. */
    public boolean addMember(ControlReference ref) {
        return controls.add(ref);
    }

    /** Caller holds the lock. */
    public boolean removeMember(ControlReference ref) {
        if (!controls.remove(ref)) {
            return false;
        }
        lastKnown.remove(ref);
        manualCursors.values().forEach(c -> c.remove(ref));
        return true;
    }

    /** Caller holds the lock. */
    public void clearMembers() {
        controls.clear();
        lastKnown.clear();
        manualCursors.clear();
    }

    /** Caller holds the lock. */
    public boolean isMember(ControlReference ref) {
        return controls.contains(ref);
    }

    /** Caller holds the lock. */
    public KnownValue lastKnown(ControlReference ref) {
        return lastKnown.get(ref);
    }

    /** Caller holds the lock. */
    public void remember(ControlReference ref, KnownValue value) {
        lastKnown.put(ref, value);
    }

    public void resetCache() {
        lock.lock();
        try {
            lastKnown.clear();
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds the lock. */
    public Map<ControlReference, ControlReading> cursor(String callerId) {
        return manualCursors.computeIfAbsent(callerId, k -> new HashMap<>());
    }

    public boolean tryStartRead() {
        return inFlight.compareAndSet(false, true);
    }

    public void readFinished() {
        inFlight.set(false);
    }

    public boolean readInFlight() {
        return inFlight.get();
    }

    public void recordSkippedTick() {
        skippedTicks.incrementAndGet();
    }

    public long recordFailure() {
        consecutiveFailures.incrementAndGet();
        return errorCount.incrementAndGet();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public long errorCount() {
        return errorCount.get();
    }

    public GroupSummary summary() {
        lock.lock();
        try {
            return new GroupSummary(id, List.copyOf(controls), pollRateSeconds, timer != null && !destroyed,
                    priority, errorCount.get(), consecutiveFailures.get(), skippedTicks.get());
        } finally {
            lock.unlock();
        }
    }
}
