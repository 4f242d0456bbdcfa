package com.p14n.pollevent.poll;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.broker.AsyncExecutor;
import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.group.ChangeGroup;
import com.p14n.pollevent.group.InvalidPollRateException;
import com.p14n.pollevent.group.KnownValue;
import com.p14n.pollevent.group.ManualPollResult;
import com.p14n.pollevent.group.UnknownGroupException;
import com.p14n.pollevent.remote.RemoteControlPort;
import com.p14n.pollevent.remote.TransportException;
import com.p14n.pollevent.telemetry.MonitorMetrics;

/**
 * Turns periodic reads of a group's controls into change events.
 *
 * <p>
 * Each running group has one fixed-rate task. A tick issues at most one
 * batched read per group; reads run on the executor's worker pool so the
 * remote timeout can be enforced. Results are applied under the group's lock
 * and only if the group's generation is unchanged since the read was issued.
 * </p>
 */
public class PollEngine {

    private static final Logger logger = LoggerFactory.getLogger(PollEngine.class);

    private final MonitorConfig config;
    private final AsyncExecutor executor;
    private final RemoteControlPort port;
    private final EventSink sink;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final AtomicLong nextEventId = new AtomicLong(1);
    private volatile IntegrityListener integrityListener = IntegrityListener.NONE;

    public PollEngine(MonitorConfig config, AsyncExecutor executor, RemoteControlPort port, EventSink sink,
            MonitorMetrics metrics, Clock clock) {
        this.config = config;
        this.executor = executor;
        this.port = port;
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void setIntegrityListener(IntegrityListener integrityListener) {
        this.integrityListener = integrityListener == null ? IntegrityListener.NONE : integrityListener;
    }

    /**
     * Validates a requested poll interval and clamps it into the configured
     * bounds.
     *
     * @param seconds requested interval
     * @return the effective interval
     * @throws InvalidPollRateException for zero, negative, NaN or infinite values
     */
    public double effectiveRate(double seconds) {
        if (!(seconds > 0) || Double.isInfinite(seconds)) {
            throw new InvalidPollRateException(seconds);
        }
        return Math.min(config.maxPollIntervalSeconds(), Math.max(config.minPollIntervalSeconds(), seconds));
    }

    /**
     * (Re)starts the group's timer at its current poll rate. The first tick
     * fires immediately.
     */
    public void start(ChangeGroup group) {
        long periodMicros = Math.max(1, Math.round(group.pollRateSeconds() * 1_000_000));
        group.lock().lock();
        try {
            if (group.isDestroyed()) {
                throw new UnknownGroupException(group.id());
            }
            ScheduledFuture<?> timer = executor.scheduleAtFixedRate(() -> scheduledTick(group), 0, periodMicros,
                    TimeUnit.MICROSECONDS);
            ScheduledFuture<?> previous = group.swapTimer(timer);
            if (previous != null) {
                previous.cancel(false);
            }
        } finally {
            group.lock().unlock();
        }
        logger.atDebug().log("Polling group {} every {}s", group.id(), group.pollRateSeconds());
    }

    /**
     * Cancels the group's timer. A read already in flight completes but is
     * applied only if the generation still matches.
     */
    public void stop(ChangeGroup group) {
        group.lock().lock();
        try {
            ScheduledFuture<?> previous = group.swapTimer(null);
            if (previous != null) {
                previous.cancel(false);
            }
        } finally {
            group.lock().unlock();
        }
    }

    private void scheduledTick(ChangeGroup group) {
        try {
            tick(group);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Unexpected error polling group {}", group.id());
        }
    }

    /**
     * Runs one poll cycle for the group.
     *
     * @param group the group to poll
     * @return what happened
     */
    public TickOutcome tick(ChangeGroup group) {
        if (group.isDestroyed()) {
            return TickOutcome.STALE;
        }
        if (!group.tryStartRead()) {
            group.recordSkippedTick();
            logger.atDebug().log("Read for group {} still in flight, skipping tick", group.id());
            return TickOutcome.SKIPPED;
        }

        long generation;
        List<ControlReference> members;
        group.lock().lock();
        try {
            generation = group.generation();
            members = group.members();
        } finally {
            group.lock().unlock();
        }

        if (members.isEmpty()) {
            group.readFinished();
            return TickOutcome.APPLIED;
        }

        Map<ControlReference, ControlReading> results;
        try {
            results = read(members, group::readFinished);
        } catch (IllegalArgumentException | NullPointerException e) {
            group.recordFailure();
            metrics.recordPollFailure(group.id());
            logger.atWarn().log("Group {} returned malformed data: {}", group.id(), e.getMessage());
            integrityListener.integrityFailure(group.id(), "Malformed control data: " + e.getMessage());
            return TickOutcome.CORRUPT;
        } catch (TransportException e) {
            long errors = group.recordFailure();
            metrics.recordPollFailure(group.id());
            logger.atWarn().log("Poll of group {} failed ({} errors): {}", group.id(), errors, e.getMessage());
            return TickOutcome.FAILED;
        }

        return apply(group, generation, members, results);
    }

    private TickOutcome apply(ChangeGroup group, long generation, List<ControlReference> members,
            Map<ControlReference, ControlReading> results) {
        List<ChangeEvent> events = new ArrayList<>();
        group.lock().lock();
        try {
            if (group.isDestroyed() || group.generation() != generation) {
                logger.atDebug().log("Discarding stale poll result for group {}", group.id());
                return TickOutcome.STALE;
            }
            long timestamp = clock.millis();
            int sequence = 0;
            for (ControlReference ref : members) {
                ControlReading reading = results.get(ref);
                if (reading == null || !group.isMember(ref)) {
                    continue;
                }
                KnownValue known = group.lastKnown(ref);
                if (known != null && known.value().equals(reading.value())) {
                    continue;
                }
                events.add(new ChangeEvent(nextEventId.getAndIncrement(), group.id(), ref, reading.value(),
                        reading.stringValue(), timestamp, sequence++));
                group.remember(ref, new KnownValue(reading.value(), reading.stringValue(), timestamp));
            }
            group.recordSuccess();
            if (!events.isEmpty()) {
                sink.accept(events);
            }
        } finally {
            group.lock().unlock();
        }
        metrics.recordEmitted(group.id(), events.size());
        return TickOutcome.APPLIED;
    }

    /**
     * Reads the group's controls directly and diffs them against the caller's
     * own cursor. The shared cache, the buffer and the store are not touched.
     *
     * @param group    the group to read
     * @param callerId identifies the cursor
     * @param showAll  return every current value instead of the delta
     * @return the changes since the caller's previous manual poll
     * @throws TransportException when the read fails or times out
     */
    public ManualPollResult manualPoll(ChangeGroup group, String callerId, boolean showAll)
            throws TransportException {
        if (callerId == null || callerId.isEmpty()) {
            throw new IllegalArgumentException("callerId cannot be null or empty");
        }
        List<ControlReference> members = group.members();
        Map<ControlReference, ControlReading> results = members.isEmpty() ? Map.of() : read(members, () -> {
        });

        List<ManualPollResult.Change> changes = new ArrayList<>();
        group.lock().lock();
        try {
            if (group.isDestroyed()) {
                throw new UnknownGroupException(group.id());
            }
            Map<ControlReference, ControlReading> cursor = group.cursor(callerId);
            for (ControlReference ref : members) {
                ControlReading reading = results.get(ref);
                if (reading == null || !group.isMember(ref)) {
                    continue;
                }
                ControlReading previous = cursor.put(ref, reading);
                if (showAll || previous == null || !previous.value().equals(reading.value())) {
                    changes.add(new ManualPollResult.Change(ref, reading.value(), reading.stringValue()));
                }
            }
        } finally {
            group.lock().unlock();
        }
        return new ManualPollResult(group.id(), callerId, changes, clock.millis());
    }

    /**
     * Runs one remote read on the read pool, bounded by the remote timeout. A
     * read that times out is cancelled and interrupted; {@code onDone} runs
     * exactly once, when the read ends or when it is cancelled before starting.
     */
    private Map<ControlReference, ControlReading> read(List<ControlReference> members, Runnable onDone)
            throws TransportException {
        AtomicBoolean started = new AtomicBoolean();
        AtomicBoolean done = new AtomicBoolean();
        Runnable release = () -> {
            if (done.compareAndSet(false, true)) {
                onDone.run();
            }
        };
        Future<Map<ControlReference, ControlReading>> future;
        try {
            future = executor.submit(() -> {
                started.set(true);
                try {
                    return port.read(members);
                } finally {
                    release.run();
                }
            });
        } catch (RejectedExecutionException e) {
            release.run();
            throw new TransportException("Read executor is shut down", e);
        }
        try {
            Map<ControlReference, ControlReading> results = future.get(config.remoteTimeoutMillis(),
                    TimeUnit.MILLISECONDS);
            if (results == null) {
                throw new TransportException("Remote returned no result");
            }
            return results;
        } catch (TimeoutException e) {
            if (future.cancel(true) && !started.get()) {
                release.run();
            }
            throw TransportException.timeout(config.remoteTimeoutMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted waiting for remote read", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException te) {
                throw te;
            }
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            if (cause instanceof NullPointerException npe) {
                throw npe;
            }
            throw new TransportException("Remote read failed: " + cause, cause);
        }
    }
}
