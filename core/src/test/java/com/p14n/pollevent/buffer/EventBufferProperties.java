package com.p14n.pollevent.buffer;

import java.util.List;

import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.group.GroupPriority;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import static com.p14n.pollevent.TestUtil.event;
import static org.junit.jupiter.api.Assertions.*;

class EventBufferProperties {

    @Property
    void sizeNeverExceedsCapacityAndOverflowIsExact(@ForAll @IntRange(min = 1, max = 50) int capacity,
            @ForAll @IntRange(min = 0, max = 200) int added) {
        EventBuffer buffer = new EventBuffer(capacity);
        long dropped = 0;
        for (int i = 0; i < added; i++) {
            dropped += buffer.add(event(i + 1, "g", "x", i));
            assertTrue(buffer.size() <= capacity);
        }
        assertEquals(Math.min(capacity, added), buffer.size());
        assertEquals(Math.max(0, added - capacity), buffer.overflowCount());
        assertEquals(dropped, buffer.overflowCount());
    }

    @Property
    void survivorsKeepInsertionOrder(@ForAll @IntRange(min = 1, max = 20) int capacity,
            @ForAll @IntRange(min = 0, max = 60) int added) {
        EventBuffer buffer = new EventBuffer(capacity);
        for (int i = 0; i < added; i++) {
            buffer.add(event(i + 1, "g", "x", i));
        }
        List<ChangeEvent> events = buffer.snapshot();
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i - 1).id() < events.get(i).id());
        }
    }

    @Property
    void evictionRemovesHalfRoundedDown(@ForAll("groupAssignments") List<Integer> groups) {
        EventBuffer buffer = new EventBuffer(1000);
        for (int i = 0; i < groups.size(); i++) {
            buffer.add(event(i + 1, "g" + groups.get(i), "x", i));
        }
        EvictionResult result = buffer.evictHalf(id -> GroupPriority.values()[Math.abs(id.hashCode()) % 3]);

        assertEquals(groups.size() / 2, result.removed());
        assertEquals(groups.size() - groups.size() / 2, buffer.size());
        assertEquals(result.removed(), result.perGroup().values().stream().mapToLong(Long::longValue).sum());
    }

    @Provide
    Arbitrary<List<Integer>> groupAssignments() {
        return Arbitraries.integers().between(0, 5).list().ofMaxSize(100);
    }
}
