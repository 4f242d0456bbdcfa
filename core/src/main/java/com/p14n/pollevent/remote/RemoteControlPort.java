package com.p14n.pollevent.remote;

import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;

import java.util.List;
import java.util.Map;

/**
 * Batched read access to the current values of remote controls.
 * The remote side offers no change notifications; callers poll.
 */
public interface RemoteControlPort {

    /**
     * Reads the current value of each requested control in one round trip.
     * Controls unknown to the device are simply absent from the result.
     *
     * @param controls the controls to read
     * @return current readings keyed by control
     * @throws TransportException on disconnect, timeout or a malformed response
     */
    Map<ControlReference, ControlReading> read(List<ControlReference> controls) throws TransportException;
}
