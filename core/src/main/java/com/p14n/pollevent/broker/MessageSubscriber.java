package com.p14n.pollevent.broker;

/**
 * Receiver of notifications published by the monitor.
 *
 * @param <T> The type of messages this subscriber handles
 */
public interface MessageSubscriber<T> {

    /**
     * Called for every published message, on a worker thread.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when {@link #onMessage(Object)} threw.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }
}
