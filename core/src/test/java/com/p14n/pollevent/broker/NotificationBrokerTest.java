package com.p14n.pollevent.broker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class NotificationBrokerTest {

    private TestAsyncExecutor executor;
    private NotificationBroker broker;

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        broker = new NotificationBroker(executor);
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void testTypedSubscribersOnlyReceiveTheirType() {
        List<MonitorNotification> evictions = new ArrayList<>();
        List<MonitorNotification> all = new ArrayList<>();
        broker.subscribe(MonitorNotification.Type.EVICTION, evictions::add);
        broker.subscribe(all::add);

        broker.publish(notification(MonitorNotification.Type.EVICTION));
        broker.publish(notification(MonitorNotification.Type.BACKUP_COMPLETED));

        assertEquals(1, evictions.size());
        assertEquals(2, all.size());
    }

    @Test
    void testUnsubscribeRemovesEverywhere() {
        List<MonitorNotification> received = new ArrayList<>();
        MessageSubscriber<MonitorNotification> subscriber = received::add;
        broker.subscribe(subscriber);
        broker.subscribe(MonitorNotification.Type.EVICTION, subscriber);

        assertTrue(broker.unsubscribe(subscriber));
        broker.publish(notification(MonitorNotification.Type.EVICTION));

        assertTrue(received.isEmpty());
        assertFalse(broker.unsubscribe(subscriber));
    }

    @Test
    void testFailingSubscriberGetsOnErrorAndOthersStillReceive() {
        List<Throwable> errors = new ArrayList<>();
        List<MonitorNotification> received = new ArrayList<>();
        broker.subscribe(new MessageSubscriber<>() {
            @Override
            public void onMessage(MonitorNotification message) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        broker.subscribe(received::add);

        broker.publish(notification(MonitorNotification.Type.EVICTION));

        assertEquals(1, errors.size());
        assertEquals(1, received.size());
    }

    @Test
    void testDeliveryIsAsynchronousWithRealExecutor() throws InterruptedException {
        try (DefaultExecutor real = new DefaultExecutor(1, 2)) {
            NotificationBroker async = new NotificationBroker(real);
            CountDownLatch latch = new CountDownLatch(1);
            async.subscribe(m -> latch.countDown());
            async.publish(notification(MonitorNotification.Type.RESTORE_COMPLETED));
            assertTrue(latch.await(2, TimeUnit.SECONDS));
            async.close();
        }
    }

    @Test
    void testClosedBrokerDropsAndRefuses() {
        List<MonitorNotification> received = new ArrayList<>();
        broker.subscribe(received::add);
        broker.close();

        broker.publish(notification(MonitorNotification.Type.EVICTION));
        assertTrue(received.isEmpty());
        assertThrows(IllegalStateException.class, () -> broker.subscribe(received::add));
    }

    @Test
    void testShutDownExecutorDoesNotFailPublisher() {
        broker.subscribe(m -> fail("should not be delivered"));
        executor.shutdownNow();
        assertDoesNotThrow(() -> broker.publish(notification(MonitorNotification.Type.EVICTION)));
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> broker.publish(null));
        assertThrows(IllegalArgumentException.class, () -> broker.subscribe(null));
        assertThrows(IllegalArgumentException.class, () -> broker.subscribe(null, m -> {
        }));
    }

    private static MonitorNotification notification(MonitorNotification.Type type) {
        return MonitorNotification.of(type, type.name(), Instant.EPOCH);
    }
}
