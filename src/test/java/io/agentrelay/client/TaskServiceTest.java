package io.agentrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentrelay.broker.BrokerOptions;
import io.agentrelay.broker.PubSubTaskBroker;
import io.agentrelay.model.TaskProgress;
import io.agentrelay.model.TaskRequest;
import io.agentrelay.model.TaskResult;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.storage.InMemoryResultStore;
import io.agentrelay.transport.InMemoryTransport;
import io.agentrelay.transport.Topics;
import io.agentrelay.transport.TransportException;
import io.agentrelay.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class TaskServiceTest {
    private InMemoryTransport transport;
    private InMemoryResultStore store;
    private PubSubTaskBroker broker;
    private TaskService service;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
        store = new InMemoryResultStore();
        broker = new PubSubTaskBroker(transport, store, new BrokerOptions(256L, Duration.ofHours(1)));
        service = new TaskService(broker);
    }

    @AfterEach
    void tearDown() {
        service.close();
        broker.close();
        transport.close();
    }

    @Test
    void submittedTaskReceivesItsResult() throws Exception {
        BlockingQueue<TaskRequest> received = new LinkedBlockingQueue<>();
        broker.subscribeToTasks(received::add);

        String taskId = service.submitTask("summarize", "summarize this", "out/summary.json");
        TaskRequest request = received.poll(5, TimeUnit.SECONDS);
        Assertions.assertNotNull(request);
        Assertions.assertEquals(taskId, request.taskId());
        Assertions.assertEquals("summarize", request.agentType());
        Assertions.assertEquals("out/summary.json", request.outputPath());
        Assertions.assertEquals(Set.of(taskId), service.getPendingTaskIds());

        broker.publishResult(TaskResult.completed(taskId, Jsons.readTree("{\"summary\":\"short\"}"), Instant.now()));

        Optional<TaskResult> result = service.waitForResult(taskId, Duration.ofSeconds(5));
        Assertions.assertTrue(result.isPresent());
        Assertions.assertEquals(TaskStatus.COMPLETED, result.get().status());
        Assertions.assertEquals("short", result.get().data().get("summary").asText());
        Assertions.assertTrue(service.getPendingTaskIds().isEmpty());
        Assertions.assertEquals(result, service.getResult(taskId));
    }

    @Test
    void concurrentTasksAreCorrelatedById() throws Exception {
        broker.subscribeToTasks(request -> {
        });
        String first = service.submitTask("echo", "one");
        String second = service.submitTask("echo", "two");
        Assertions.assertNotEquals(first, second);

        broker.publishResult(TaskResult.failed(second, "boom", Instant.now()));
        broker.publishResult(TaskResult.completed(first, Jsons.readTree("{\"n\":1}"), Instant.now()));

        TaskResult firstResult = service.waitForResult(first, Duration.ofSeconds(5)).orElseThrow();
        TaskResult secondResult = service.waitForResult(second, Duration.ofSeconds(5)).orElseThrow();
        Assertions.assertEquals(first, firstResult.taskId());
        Assertions.assertEquals(TaskStatus.COMPLETED, firstResult.status());
        Assertions.assertEquals(second, secondResult.taskId());
        Assertions.assertEquals("boom", secondResult.error());
    }

    @Test
    void timedOutWaitReturnsEmptyAndKeepsTaskPending() throws Exception {
        broker.subscribeToTasks(request -> {
        });
        String taskId = service.submitTask("echo", "slow one");

        Assertions.assertEquals(Optional.empty(), service.waitForResult(taskId, Duration.ofMillis(100)));
        Assertions.assertTrue(service.getPendingTaskIds().contains(taskId));

        broker.publishResult(TaskResult.completed(taskId, Jsons.readTree("{}"), Instant.now()));
        Assertions.assertTrue(service.waitForResult(taskId, Duration.ofSeconds(5)).isPresent());
    }

    @Test
    void resultPublishedBeforeSubmissionIsNotSeen() throws Exception {
        broker.publishResult(TaskResult.completed("early-1", Jsons.readTree("{}"), Instant.now()));

        service.submitTask(TaskRequest.create("early-1", "echo", "late subscriber", Instant.now(), null));

        Assertions.assertEquals(Optional.empty(), service.waitForResult("early-1", Duration.ofMillis(150)));
    }

    @Test
    void unknownTaskIdYieldsEmpty() throws Exception {
        Assertions.assertEquals(Optional.empty(), service.waitForResult("never-submitted", Duration.ofMillis(50)));
        Assertions.assertEquals(Optional.empty(), service.getResult("never-submitted"));
        Assertions.assertEquals(Optional.empty(), service.pollResult("never-submitted"));
    }

    @Test
    void reusedTaskIdIsRejected() {
        service.submitTask(TaskRequest.create("dup-1", "echo", "p", Instant.now(), null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> service.submitTask(TaskRequest.create("dup-1", "echo", "p", Instant.now(), null)));
    }

    @Test
    void concurrentSubmissionsOfSameIdAcceptExactlyOne() throws Exception {
        int callers = 8;
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    gate.await();
                    try {
                        service.submitTask(TaskRequest.create("race-1", "echo", "p", Instant.now(), null));
                        accepted.incrementAndGet();
                    } catch (IllegalArgumentException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            gate.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Assertions.assertEquals(1, accepted.get());
        Assertions.assertEquals(callers - 1, rejected.get());
        Assertions.assertEquals(Set.of("race-1"), service.getPendingTaskIds());
    }

    @Test
    void overflowedResultIsResolvedTransparently() throws Exception {
        broker.subscribeToTasks(request -> {
        });
        String taskId = service.submitTask("research", "big answer");
        JsonNode big = Jsons.mapper().createObjectNode().put("text", "x".repeat(4_000));

        broker.publishResult(TaskResult.completed(taskId, big, Instant.now()));

        TaskResult result = service.waitForResult(taskId, Duration.ofSeconds(5)).orElseThrow();
        Assertions.assertEquals(TaskStatus.COMPLETED, result.status());
        Assertions.assertEquals(4_000, result.data().get("text").asText().length());
    }

    @Test
    void pollResultRecoversOverflowedResultForLateSubmitterInstance() throws Exception {
        String taskId = "late-poll-1";
        JsonNode big = Jsons.mapper().createObjectNode().put("text", "y".repeat(2_000));
        broker.publishResult(TaskResult.completed(taskId, big, Instant.now()));

        try (TaskService other = new TaskService(broker)) {
            Optional<TaskResult> polled = other.pollResult(taskId);
            Assertions.assertTrue(polled.isPresent());
            Assertions.assertEquals(2_000, polled.get().data().get("text").asText().length());
            Assertions.assertEquals(polled, other.getResult(taskId));
        }
    }

    @Test
    void completedTasksAreOrderedByCompletionTime() throws Exception {
        broker.subscribeToTasks(request -> {
        });
        String first = service.submitTask("echo", "a");
        String second = service.submitTask("echo", "b");
        Instant base = Instant.parse("2026-01-01T00:00:00Z");

        broker.publishResult(TaskResult.completed(second, Jsons.readTree("{}"), base.plusSeconds(10)));
        broker.publishResult(TaskResult.completed(first, Jsons.readTree("{}"), base));
        service.waitForResult(first, Duration.ofSeconds(5));
        service.waitForResult(second, Duration.ofSeconds(5));

        List<TaskResult> done = service.getCompletedTasks();
        Assertions.assertEquals(2, done.size());
        Assertions.assertEquals(first, done.get(0).taskId());
        Assertions.assertEquals(second, done.get(1).taskId());
    }

    @Test
    void progressIsForwardedToSubscriber() throws Exception {
        String taskId = service.submitTask("echo", "p");
        BlockingQueue<TaskProgress> progress = new LinkedBlockingQueue<>();
        service.subscribeToProgress(taskId, progress::add);

        broker.publishProgress(TaskProgress.of(taskId, "halfway", Instant.now()));

        TaskProgress received = progress.poll(5, TimeUnit.SECONDS);
        Assertions.assertNotNull(received);
        Assertions.assertEquals("halfway", received.message());
    }

    @Test
    void cancelTaskReportsWhetherAWorkerListened() throws Exception {
        String taskId = service.submitTask("echo", "p");
        Assertions.assertFalse(service.cancelTask(taskId));

        CompletableFuture<Void> heard = new CompletableFuture<>();
        broker.subscribeToCancellation(taskId, () -> heard.complete(null));
        Assertions.assertTrue(service.cancelTask(taskId));
        heard.get(5, TimeUnit.SECONDS);
    }

    @Test
    void failedSubmissionLeavesNothingPending() {
        transport.close();

        Assertions.assertThrows(TransportException.class, () -> service.submitTask("echo", "p"));
        Assertions.assertTrue(service.getPendingTaskIds().isEmpty());
    }

    @Test
    void closeAbandonsPendingWaitsAndRejectsNewWork() throws Exception {
        String taskId = service.submitTask("echo", "p");
        CompletableFuture<Optional<TaskResult>> wait = service.awaitResult(taskId, Duration.ofSeconds(30));

        service.close();

        Assertions.assertEquals(Optional.empty(), wait.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(service.getPendingTaskIds().isEmpty());
        Assertions.assertThrows(IllegalStateException.class, () -> service.submitTask("echo", "again"));
        Assertions.assertEquals(0L, transport.publish(Topics.results(taskId), "{}"));
    }
}
