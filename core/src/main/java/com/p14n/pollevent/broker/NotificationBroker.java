package com.p14n.pollevent.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers {@link MonitorNotification}s to subscribers asynchronously.
 * Subscribers register for one notification type or for all of them; a
 * notification without subscribers is silently dropped.
 */
public class NotificationBroker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotificationBroker.class);

    private final ConcurrentHashMap<MonitorNotification.Type, Set<MessageSubscriber<MonitorNotification>>> subscribers = new ConcurrentHashMap<>();
    private final Set<MessageSubscriber<MonitorNotification>> allSubscribers = new CopyOnWriteArraySet<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AsyncExecutor asyncExecutor;

    public NotificationBroker(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    public void publish(MonitorNotification notification) {
        if (notification == null) {
            throw new IllegalArgumentException("Notification cannot be null");
        }
        if (closed.get()) {
            logger.atDebug().log("Broker closed, dropping notification {}", notification.type());
            return;
        }
        Set<MessageSubscriber<MonitorNotification>> typed = subscribers.get(notification.type());
        if (typed != null) {
            typed.forEach(s -> deliver(s, notification));
        }
        allSubscribers.forEach(s -> deliver(s, notification));
    }

    private void deliver(MessageSubscriber<MonitorNotification> subscriber, MonitorNotification notification) {
        try {
            asyncExecutor.submit(() -> {
                try {
                    subscriber.onMessage(notification);
                } catch (RuntimeException e) {
                    logger.atWarn().setCause(e).log("Subscriber failed to handle {}", notification.type());
                    subscriber.onError(e);
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            logger.atDebug().log("Executor shut down, notification {} not delivered", notification.type());
        }
    }

    public boolean subscribe(MonitorNotification.Type type, MessageSubscriber<MonitorNotification> subscriber) {
        checkSubscribe(subscriber);
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        return subscribers.computeIfAbsent(type, k -> new CopyOnWriteArraySet<>()).add(subscriber);
    }

    public boolean subscribe(MessageSubscriber<MonitorNotification> subscriber) {
        checkSubscribe(subscriber);
        return allSubscribers.add(subscriber);
    }

    public boolean unsubscribe(MessageSubscriber<MonitorNotification> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        boolean removed = allSubscribers.remove(subscriber);
        for (Set<MessageSubscriber<MonitorNotification>> set : subscribers.values()) {
            removed |= set.remove(subscriber);
        }
        return removed;
    }

    private void checkSubscribe(MessageSubscriber<MonitorNotification> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
    }

    @Override
    public void close() {
        closed.set(true);
        subscribers.clear();
        allSubscribers.clear();
    }
}
