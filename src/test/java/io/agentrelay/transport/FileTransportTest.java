package io.agentrelay.transport;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class FileTransportTest {

    @Test
    void broadcastCrossesTransportInstancesOnSameDirectory() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport publisher = new FileTransport(root, 20L, 2_000L);
        FileTransport subscriber = new FileTransport(root, 20L, 2_000L);
        try {
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            subscriber.subscribe("agents:results:t1", received::add);

            Assertions.assertEquals(1L, publisher.publish("agents:results:t1", "{\"n\":1}"));
            Assertions.assertEquals(1L, publisher.publish("agents:results:t1", "{\"n\":2}"));

            Assertions.assertEquals("{\"n\":1}", received.poll(5, TimeUnit.SECONDS));
            Assertions.assertEquals("{\"n\":2}", received.poll(5, TimeUnit.SECONDS));
        } finally {
            publisher.close();
            subscriber.close();
            deleteRecursively(root);
        }
    }

    @Test
    void publishWithoutSubscriberReturnsZero() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport transport = new FileTransport(root, 20L, 2_000L);
        try {
            Assertions.assertEquals(0L, transport.publish("agents:results:nobody", "x"));

            Subscription subscription = transport.subscribe("agents:results:nobody", m -> {
            });
            subscription.close();
            Assertions.assertEquals(0L, transport.publish("agents:results:nobody", "y"));
        } finally {
            transport.close();
            deleteRecursively(root);
        }
    }

    @Test
    void sharedMembersAcrossInstancesClaimEachMessageOnce() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport a = new FileTransport(root, 20L, 2_000L);
        FileTransport b = new FileTransport(root, 20L, 2_000L);
        FileTransport publisher = new FileTransport(root, 20L, 2_000L);
        try {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch all = new CountDownLatch(12);
            a.subscribeShared(Topics.TASKS, message -> {
                received.add(message);
                all.countDown();
            });
            b.subscribeShared(Topics.TASKS, message -> {
                received.add(message);
                all.countDown();
            });

            for (int i = 0; i < 12; i++) {
                Assertions.assertEquals(1L, publisher.publish(Topics.TASKS, "task-" + i));
            }

            Assertions.assertTrue(all.await(10, TimeUnit.SECONDS));
            Thread.sleep(200L);
            Assertions.assertEquals(12, received.size());
            Assertions.assertEquals(12, new HashSet<>(received).size());
        } finally {
            a.close();
            b.close();
            publisher.close();
            deleteRecursively(root);
        }
    }

    @Test
    void staleSubscriberIsPrunedByPublisher() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport transport = new FileTransport(root, 20L, 1_000L);
        try {
            Path ghost = root.resolve("topics")
                    .resolve(URLEncoder.encode("agents:results:t9", StandardCharsets.UTF_8))
                    .resolve("subscribers")
                    .resolve("ghost");
            Files.createDirectories(ghost.resolve("inbox"));
            Path heartbeat = ghost.resolve("heartbeat");
            Files.writeString(heartbeat, "0", StandardCharsets.UTF_8);
            FileTime old = FileTime.fromMillis(System.currentTimeMillis() - 60_000L);
            Files.setLastModifiedTime(heartbeat, old);
            Files.setLastModifiedTime(ghost, old);

            Assertions.assertEquals(0L, transport.publish("agents:results:t9", "x"));
            Assertions.assertFalse(Files.exists(ghost));
        } finally {
            transport.close();
            deleteRecursively(root);
        }
    }

    @Test
    void closingSubscriptionsRemovesPerTaskTopicDirectories() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport transport = new FileTransport(root, 20L, 2_000L);
        try {
            for (int i = 0; i < 20; i++) {
                String taskId = "task-" + i;
                List<Subscription> subscriptions = List.of(
                        transport.subscribe(Topics.results(taskId), m -> {
                        }),
                        transport.subscribe(Topics.progress(taskId), m -> {
                        }),
                        transport.subscribe(Topics.cancel(taskId), m -> {
                        })
                );
                subscriptions.forEach(Subscription::close);
            }

            try (Stream<Path> topics = Files.list(root.resolve("topics"))) {
                Assertions.assertEquals(List.of(), topics.toList());
            }

            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            Subscription again = transport.subscribe(Topics.results("task-0"), received::add);
            Subscription other = transport.subscribe(Topics.results("task-0"), m -> {
            });
            other.close();
            Assertions.assertEquals(1L, transport.publish(Topics.results("task-0"), "{\"n\":1}"));
            Assertions.assertEquals("{\"n\":1}", received.poll(5, TimeUnit.SECONDS));
            again.close();
        } finally {
            transport.close();
            deleteRecursively(root);
        }
    }

    @Test
    void closingSharedMemberKeepsOtherMembersRegistered() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport transport = new FileTransport(root, 20L, 2_000L);
        try {
            BlockingQueue<String> received = new LinkedBlockingQueue<>();
            Subscription leaving = transport.subscribeShared(Topics.TASKS, m -> {
            });
            transport.subscribeShared(Topics.TASKS, received::add);
            leaving.close();

            Assertions.assertEquals(1L, transport.publish(Topics.TASKS, "{\"taskId\":\"t\"}"));
            Assertions.assertEquals("{\"taskId\":\"t\"}", received.poll(5, TimeUnit.SECONDS));
        } finally {
            transport.close();
            deleteRecursively(root);
        }
    }

    @Test
    void closedTransportRejectsPublish() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-file-transport-");
        FileTransport transport = new FileTransport(root, 20L, 1_000L);
        try {
            transport.close();
            Assertions.assertThrows(TransportException.class, () -> transport.publish(Topics.TASKS, "x"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
