package io.agentrelay.client;

import io.agentrelay.broker.TaskBroker;
import io.agentrelay.model.TaskProgress;
import io.agentrelay.model.TaskRequest;
import io.agentrelay.model.TaskResult;
import io.agentrelay.transport.TransportException;
import io.agentrelay.util.TaskIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Submitter-side facade. Keeps one correlation entry per submitted task: pending until the
 * matching result arrives, then moved to the completed set.
 *
 * <p>Waiting is local. A wait that times out or is cancelled returns empty and leaves the
 * remote task running; closing the service does not cancel remote work either.
 */
public final class TaskService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskBroker broker;
    private final Clock clock;
    private final Map<String, PendingTask> pending;
    private final Map<String, TaskResult> completed;
    private volatile boolean closed;

    public TaskService(TaskBroker broker) {
        this(broker, Clock.systemUTC());
    }

    public TaskService(TaskBroker broker, Clock clock) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pending = new ConcurrentHashMap<>();
        this.completed = new ConcurrentHashMap<>();
        this.closed = false;
    }

    public String submitTask(String agentType, String prompt) {
        return submitTask(agentType, prompt, null);
    }

    /**
     * @throws TransportException when the request could not be published; nothing stays registered
     */
    public String submitTask(String agentType, String prompt, String outputPath) {
        ensureOpen();
        return submitTask(TaskRequest.create(TaskIds.newTaskId(), agentType, prompt, clock.instant(), outputPath));
    }

    public String submitTask(TaskRequest request) {
        ensureOpen();
        String taskId = request.taskId();
        CompletableFuture<TaskResult> completion = new CompletableFuture<>();
        PendingTask entry = new PendingTask(completion);
        if (completed.containsKey(taskId) || pending.putIfAbsent(taskId, entry) != null) {
            throw new IllegalArgumentException("Task id already used: " + taskId);
        }
        try {
            entry.subscription = broker.subscribeToResult(taskId, this::resolve);
            broker.submit(request);
        } catch (RuntimeException e) {
            pending.remove(taskId, entry);
            if (entry.subscription != null) {
                entry.subscription.cancel(false);
            }
            completion.cancel(false);
            throw e;
        }
        log.debug("Submitted task {} to agent {}", taskId, request.agentType());
        return taskId;
    }

    /**
     * Non-blocking wait. Completes with the result, or with empty on timeout, local cancellation
     * or when the task id is unknown.
     */
    public CompletableFuture<Optional<TaskResult>> awaitResult(String taskId, Duration timeout) {
        PendingTask entry = pending.get(taskId);
        if (entry == null) {
            return CompletableFuture.completedFuture(Optional.ofNullable(completed.get(taskId)));
        }
        long timeoutMs = timeout == null ? 0L : Math.max(0L, timeout.toMillis());
        return entry.completion
                .thenApply(Optional::of)
                .completeOnTimeout(Optional.empty(), timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> Optional.empty());
    }

    public Optional<TaskResult> waitForResult(String taskId, Duration timeout) throws InterruptedException {
        try {
            return awaitResult(taskId, timeout).get();
        } catch (ExecutionException | CancellationException e) {
            return Optional.empty();
        }
    }

    public Optional<TaskResult> getResult(String taskId) {
        return Optional.ofNullable(completed.get(taskId));
    }

    /**
     * Like {@link #getResult(String)}, then asks the result store for an overflowed result. A hit
     * resolves the pending entry.
     */
    public Optional<TaskResult> pollResult(String taskId) {
        TaskResult known = completed.get(taskId);
        if (known != null) {
            return Optional.of(known);
        }
        Optional<TaskResult> stored = broker.fetchStoredResult(taskId);
        stored.ifPresent(this::resolve);
        return stored;
    }

    public Set<String> getPendingTaskIds() {
        return Set.copyOf(pending.keySet());
    }

    public List<TaskResult> getCompletedTasks() {
        return completed.values().stream()
                .sorted(Comparator.comparing(TaskResult::completedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    public CompletableFuture<Void> subscribeToProgress(String taskId, Consumer<TaskProgress> listener) {
        ensureOpen();
        return broker.subscribeToProgress(taskId, listener);
    }

    /**
     * Asks the worker running {@code taskId} to stop. The cancelled result arrives like any other.
     *
     * @return true when at least one worker was listening for the request
     */
    public boolean cancelTask(String taskId) {
        ensureOpen();
        return broker.requestCancellation(taskId) > 0L;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Map.Entry<String, PendingTask> e : pending.entrySet()) {
            PendingTask entry = e.getValue();
            if (entry.subscription != null) {
                entry.subscription.cancel(false);
            }
            entry.completion.cancel(false);
        }
        int abandoned = pending.size();
        pending.clear();
        if (abandoned > 0) {
            log.info("Task service closed with {} pending task(s)", abandoned);
        }
    }

    private void resolve(TaskResult result) {
        String taskId = result.taskId();
        completed.putIfAbsent(taskId, result);
        PendingTask entry = pending.remove(taskId);
        if (entry != null) {
            entry.completion.complete(completed.get(taskId));
            if (entry.subscription != null) {
                entry.subscription.cancel(false);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Task service is closed");
        }
    }

    private static final class PendingTask {
        private final CompletableFuture<TaskResult> completion;
        private volatile CompletableFuture<TaskResult> subscription;

        PendingTask(CompletableFuture<TaskResult> completion) {
            this.completion = completion;
        }
    }
}
