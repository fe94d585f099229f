package io.agentrelay.transport;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

final class InMemoryTransportTest {

    @Test
    void broadcastReachesEverySubscriberInOrder() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            BlockingQueue<String> first = new LinkedBlockingQueue<>();
            BlockingQueue<String> second = new LinkedBlockingQueue<>();
            transport.subscribe("agents:results:t1", first::add);
            transport.subscribe("agents:results:t1", second::add);

            Assertions.assertEquals(2L, transport.publish("agents:results:t1", "a"));
            Assertions.assertEquals(2L, transport.publish("agents:results:t1", "b"));

            Assertions.assertEquals("a", first.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals("b", first.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals("a", second.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals("b", second.poll(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void messageWithoutSubscriberIsDropped() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            Assertions.assertEquals(0L, transport.publish("agents:results:t2", "lost"));

            BlockingQueue<String> late = new LinkedBlockingQueue<>();
            transport.subscribe("agents:results:t2", late::add);
            Assertions.assertNull(late.poll(200, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void sharedSubscribersReceiveEachMessageOnce() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch all = new CountDownLatch(20);
            transport.subscribeShared(Topics.TASKS, message -> {
                received.add(message);
                all.countDown();
            });
            transport.subscribeShared(Topics.TASKS, message -> {
                received.add(message);
                all.countDown();
            });

            for (int i = 0; i < 20; i++) {
                Assertions.assertEquals(1L, transport.publish(Topics.TASKS, "task-" + i));
            }

            Assertions.assertTrue(all.await(5, TimeUnit.SECONDS));
            Thread.sleep(100L);
            Assertions.assertEquals(20, received.size());
            Assertions.assertEquals(20, new HashSet<>(received).size());
        }
    }

    @Test
    void busySharedSubscriberIsSkippedUntilIdle() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            CountDownLatch release = new CountDownLatch(1);
            BlockingQueue<String> slow = new LinkedBlockingQueue<>();
            BlockingQueue<String> fast = new LinkedBlockingQueue<>();
            transport.subscribeShared(Topics.TASKS, message -> {
                slow.add(message);
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            transport.publish(Topics.TASKS, "first");
            Assertions.assertEquals("first", slow.poll(5, TimeUnit.SECONDS));

            transport.subscribeShared(Topics.TASKS, fast::add);
            transport.publish(Topics.TASKS, "second");
            Assertions.assertEquals("second", fast.poll(5, TimeUnit.SECONDS));
            Assertions.assertTrue(slow.isEmpty());

            release.countDown();
        }
    }

    @Test
    void sharedMessagesWaitWhileAllMembersAreBusy() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            CountDownLatch release = new CountDownLatch(1);
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            transport.subscribeShared(Topics.TASKS, message -> {
                received.add(message);
                if (message.equals("first")) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            transport.publish(Topics.TASKS, "first");
            Assertions.assertEquals("first", received.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals(1L, transport.publish(Topics.TASKS, "second"));
            Assertions.assertNull(received.poll(150, TimeUnit.MILLISECONDS));

            release.countDown();
            Assertions.assertEquals("second", received.poll(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void failingListenerKeepsReceiving() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            transport.subscribe("topic", message -> {
                received.add(message);
                if (message.equals("boom")) {
                    throw new IllegalStateException("listener failure");
                }
            });

            transport.publish("topic", "boom");
            transport.publish("topic", "ok");

            Assertions.assertEquals("boom", received.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals("ok", received.poll(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closedSubscriptionStopsDelivery() throws Exception {
        try (InMemoryTransport transport = new InMemoryTransport()) {
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            Subscription subscription = transport.subscribe("topic", received::add);
            Assertions.assertTrue(subscription.isActive());

            subscription.close();
            subscription.close();

            Assertions.assertFalse(subscription.isActive());
            Assertions.assertEquals(0L, transport.publish("topic", "after-close"));
            Assertions.assertNull(received.poll(100, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void closedTransportRejectsUse() {
        InMemoryTransport transport = new InMemoryTransport();
        transport.close();

        Assertions.assertThrows(TransportException.class, () -> transport.publish("topic", "x"));
        Assertions.assertThrows(TransportException.class, () -> transport.subscribe("topic", m -> {
        }));
    }

    @Test
    void topicsAreDerivedFromTaskId() {
        Set<String> topics = Set.of(Topics.results("abc"), Topics.progress("abc"), Topics.cancel("abc"));
        Assertions.assertEquals(Set.of("agents:results:abc", "agents:progress:abc", "agents:cancel:abc"), topics);
        Assertions.assertThrows(IllegalArgumentException.class, () -> Topics.results(" "));
    }
}
