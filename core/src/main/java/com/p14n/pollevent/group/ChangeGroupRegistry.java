package com.p14n.pollevent.group;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.poll.PollEngine;
import com.p14n.pollevent.remote.TransportException;
import com.p14n.pollevent.telemetry.MonitorMetrics;

/**
 * Owns the set of change groups and their membership.
 *
 * <p>
 * Groups start polling as soon as they are created. Every operation on an
 * absent id fails with {@link UnknownGroupException}; summaries returned to
 * callers are copies.
 * </p>
 */
public class ChangeGroupRegistry implements GroupDirectory {

    private static final Logger logger = LoggerFactory.getLogger(ChangeGroupRegistry.class);

    /** Poll interval used when none is requested. */
    public static final double DEFAULT_POLL_RATE_SECONDS = 1.0;

    private final ConcurrentHashMap<String, ChangeGroup> groups = new ConcurrentHashMap<>();
    private final List<GroupListener> listeners = new CopyOnWriteArrayList<>();
    private final PollEngine pollEngine;
    private final MonitorMetrics metrics;

    public ChangeGroupRegistry(PollEngine pollEngine, MonitorMetrics metrics) {
        this.pollEngine = pollEngine;
        this.metrics = metrics;
    }

    public void addListener(GroupListener listener) {
        listeners.add(listener);
    }

    public GroupSummary create(String id) {
        return create(id, DEFAULT_POLL_RATE_SECONDS, GroupPriority.NORMAL);
    }

    public GroupSummary create(String id, double pollRateSeconds) {
        return create(id, pollRateSeconds, GroupPriority.NORMAL);
    }

    /**
     * Creates a group and starts polling it.
     *
     * @param id              unique, non-blank id
     * @param pollRateSeconds requested interval, clamped into the configured bounds
     * @param priority        eviction priority
     * @return a summary of the new group
     * @throws DuplicateGroupException   if the id is taken
     * @throws InvalidPollRateException  for a non-positive or non-finite rate
     */
    public GroupSummary create(String id, double pollRateSeconds, GroupPriority priority) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Change group id cannot be null or blank");
        }
        double rate = pollEngine.effectiveRate(pollRateSeconds);
        ChangeGroup group = new ChangeGroup(id, rate, priority == null ? GroupPriority.NORMAL : priority);
        if (groups.putIfAbsent(id, group) != null) {
            throw new DuplicateGroupException(id);
        }
        metrics.recordGroupCreated();
        pollEngine.start(group);
        logger.atInfo().log("Created change group {} polling every {}s", id, rate);
        return group.summary();
    }

    public AddControlsResult addControls(String id, Collection<String> refs) {
        ChangeGroup group = require(id);
        List<ControlReference> accepted = new ArrayList<>();
        List<RejectedControl> rejected = new ArrayList<>();
        group.lock().lock();
        try {
            for (String raw : refs) {
                String problem = ControlReference.validate(raw);
                if (problem != null) {
                    rejected.add(new RejectedControl(raw, RejectedControl.Status.INVALID, problem));
                    continue;
                }
                ControlReference ref = ControlReference.parse(raw);
                if (group.addMember(ref)) {
                    accepted.add(ref);
                } else {
                    rejected.add(new RejectedControl(raw, RejectedControl.Status.SKIPPED, "Already a member"));
                }
            }
        } finally {
            group.lock().unlock();
        }
        logger.atDebug().log("Group {}: added {} controls, rejected {}", id, accepted.size(), rejected.size());
        return new AddControlsResult(accepted, rejected);
    }

    public AddControlsResult removeControls(String id, Collection<String> refs) {
        ChangeGroup group = require(id);
        List<ControlReference> accepted = new ArrayList<>();
        List<RejectedControl> rejected = new ArrayList<>();
        group.lock().lock();
        try {
            for (String raw : refs) {
                String problem = ControlReference.validate(raw);
                if (problem != null) {
                    rejected.add(new RejectedControl(raw, RejectedControl.Status.INVALID, problem));
                    continue;
                }
                ControlReference ref = ControlReference.parse(raw);
                if (group.removeMember(ref)) {
                    accepted.add(ref);
                } else {
                    rejected.add(new RejectedControl(raw, RejectedControl.Status.SKIPPED, "Not a member"));
                }
            }
        } finally {
            group.lock().unlock();
        }
        return new AddControlsResult(accepted, rejected);
    }

    public void clear(String id) {
        ChangeGroup group = require(id);
        group.lock().lock();
        try {
            group.clearMembers();
        } finally {
            group.lock().unlock();
        }
    }

    /**
     * Stops the group's timer and invalidates any in-flight read, then removes
     * the group.
     *
     * @param id the group id
     * @throws UnknownGroupException if the group is absent or already destroyed
     */
    public void destroy(String id) {
        ChangeGroup group = require(id);
        group.lock().lock();
        try {
            if (group.isDestroyed()) {
                throw new UnknownGroupException(id);
            }
            group.markDestroyed();
            ScheduledFuture<?> timer = group.swapTimer(null);
            if (timer != null) {
                timer.cancel(false);
            }
            groups.remove(id, group);
        } finally {
            group.lock().unlock();
        }
        metrics.recordGroupDestroyed();
        listeners.forEach(l -> l.groupDestroyed(id));
        logger.atInfo().log("Destroyed change group {}", id);
    }

    /**
     * Changes the poll interval and restarts the timer.
     *
     * @return the updated summary
     */
    public GroupSummary setAutoPoll(String id, double pollRateSeconds) {
        ChangeGroup group = require(id);
        group.setPollRateSeconds(pollEngine.effectiveRate(pollRateSeconds));
        pollEngine.start(group);
        return group.summary();
    }

    public GroupSummary stopAutoPoll(String id) {
        ChangeGroup group = require(id);
        pollEngine.stop(group);
        return group.summary();
    }

    public ManualPollResult manualPoll(String id, String callerId, boolean showAll) throws TransportException {
        return pollEngine.manualPoll(require(id), callerId, showAll);
    }

    public List<GroupSummary> list() {
        List<GroupSummary> summaries = new ArrayList<>();
        for (ChangeGroup group : groups.values()) {
            summaries.add(group.summary());
        }
        summaries.sort(Comparator.comparing(GroupSummary::id));
        return summaries;
    }

    public GroupSummary summary(String id) {
        return require(id).summary();
    }

    /**
     * Live access for the poll engine and tests.
     */
    public ChangeGroup get(String id) {
        return require(id);
    }

    public int size() {
        return groups.size();
    }

    @Override
    public GroupPriority priorityOf(String id) {
        ChangeGroup group = groups.get(id);
        return group == null ? null : group.priority();
    }

    @Override
    public void resetCache(String id) {
        ChangeGroup group = groups.get(id);
        if (group != null) {
            group.resetCache();
        }
    }

    /**
     * Stops every timer; used on shutdown. Groups stay registered.
     */
    public void stopAll() {
        groups.values().forEach(pollEngine::stop);
    }

    private ChangeGroup require(String id) {
        ChangeGroup group = id == null ? null : groups.get(id);
        if (group == null || group.isDestroyed()) {
            throw new UnknownGroupException(id);
        }
        return group;
    }
}
