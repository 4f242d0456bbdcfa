package com.p14n.pollevent.poll;

import java.util.List;

import com.p14n.pollevent.data.ChangeEvent;

/**
 * Receives the events of one poll tick, in sequence order. Called while the
 * owning group's lock is held, so implementations must not block.
 */
@FunctionalInterface
public interface EventSink {

    /** Sink used while monitoring is disabled. */
    EventSink DISCARD = events -> {
    };

    void accept(List<ChangeEvent> events);
}
