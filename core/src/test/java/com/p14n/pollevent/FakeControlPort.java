package com.p14n.pollevent;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.remote.RemoteControlPort;
import com.p14n.pollevent.remote.TransportException;

/**
 * In-memory control plane. Raw values are normalized on every read, so
 * storing an unsupported value makes the next read fail the way a malformed
 * device response does.
 */
public class FakeControlPort implements RemoteControlPort {

    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, String> strings = new HashMap<>();
    private final AtomicInteger reads = new AtomicInteger();
    private TransportException failure;

    public synchronized FakeControlPort set(String path, Object raw) {
        return set(path, raw, null);
    }

    public synchronized FakeControlPort set(String path, Object raw, String stringValue) {
        values.put(path, raw);
        if (stringValue == null) {
            strings.remove(path);
        } else {
            strings.put(path, stringValue);
        }
        return this;
    }

    public synchronized void remove(String path) {
        values.remove(path);
        strings.remove(path);
    }

    public synchronized void failWith(TransportException failure) {
        this.failure = failure;
    }

    public int reads() {
        return reads.get();
    }

    @Override
    public synchronized Map<ControlReference, ControlReading> read(List<ControlReference> controls)
            throws TransportException {
        reads.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        Map<ControlReference, ControlReading> result = new HashMap<>();
        for (ControlReference ref : controls) {
            if (values.containsKey(ref.path())) {
                result.put(ref, ControlReading.of(values.get(ref.path()), strings.get(ref.path())));
            }
        }
        return result;
    }
}
