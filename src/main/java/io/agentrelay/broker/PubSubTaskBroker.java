package io.agentrelay.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.model.TaskProgress;
import io.agentrelay.model.TaskRequest;
import io.agentrelay.model.TaskResult;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.storage.ResultStore;
import io.agentrelay.transport.Subscription;
import io.agentrelay.transport.TaskChannelTransport;
import io.agentrelay.transport.Topics;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * {@link TaskBroker} over a {@link TaskChannelTransport} and a {@link ResultStore}.
 * The transport and the store are owned by the caller and are not closed by {@link #close()}.
 */
public final class PubSubTaskBroker implements TaskBroker {
    private static final Logger log = LoggerFactory.getLogger(PubSubTaskBroker.class);

    private final TaskChannelTransport transport;
    private final ResultStore resultStore;
    private final BrokerOptions options;
    private final Clock clock;
    private final Set<CompletableFuture<?>> listeners;
    private volatile boolean closed;

    public PubSubTaskBroker(TaskChannelTransport transport, ResultStore resultStore, BrokerOptions options) {
        this(transport, resultStore, options, Clock.systemUTC());
    }

    public PubSubTaskBroker(TaskChannelTransport transport, ResultStore resultStore, BrokerOptions options, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.resultStore = Objects.requireNonNull(resultStore, "resultStore");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listeners = ConcurrentHashMap.newKeySet();
        this.closed = false;
    }

    @Override
    public void submit(TaskRequest request) {
        ensureOpen();
        Objects.requireNonNull(request, "request");
        long receivers = transport.publish(Topics.TASKS, Jsons.toJson(request));
        if (receivers == 0L) {
            log.warn("No worker is subscribed to {}; task {} was dropped", Topics.TASKS, request.taskId());
        } else {
            log.debug("Submitted task {} for agent {}", request.taskId(), request.agentType());
        }
    }

    @Override
    public CompletableFuture<TaskResult> subscribeToResult(String taskId, Consumer<TaskResult> onResult) {
        ensureOpen();
        Objects.requireNonNull(onResult, "onResult");
        String topic = Topics.results(taskId);
        CompletableFuture<TaskResult> future = new CompletableFuture<>();
        Subscription subscription = transport.subscribe(topic, message -> {
            if (future.isDone()) {
                return;
            }
            TaskResult result;
            try {
                result = Jsons.fromJson(message, TaskResult.class);
            } catch (IllegalArgumentException e) {
                log.warn("Discarding malformed message on {}: {}", topic, e.getMessage());
                return;
            }
            if (!taskId.equals(result.taskId())) {
                log.warn("Discarding result for task {} delivered on {}", result.taskId(), topic);
                return;
            }
            TaskResult resolved = resolveOverflow(result);
            try {
                onResult.accept(resolved);
                future.complete(resolved);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        track(future, subscription);
        return future;
    }

    @Override
    public CompletableFuture<Void> subscribeToProgress(String taskId, Consumer<TaskProgress> onProgress) {
        ensureOpen();
        Objects.requireNonNull(onProgress, "onProgress");
        String topic = Topics.progress(taskId);
        CompletableFuture<Void> future = new CompletableFuture<>();
        Subscription subscription = transport.subscribe(topic, message -> {
            TaskProgress progress;
            try {
                progress = Jsons.fromJson(message, TaskProgress.class);
            } catch (IllegalArgumentException e) {
                log.warn("Discarding malformed message on {}: {}", topic, e.getMessage());
                return;
            }
            if (!taskId.equals(progress.taskId())) {
                return;
            }
            try {
                onProgress.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener for task {} failed", taskId, e);
            }
        });
        track(future, subscription);
        return future;
    }

    @Override
    public void publishResult(TaskResult result) {
        ensureOpen();
        Objects.requireNonNull(result, "result");
        TaskResult outbound = overflowIfNeeded(result);
        long receivers = transport.publish(Topics.results(result.taskId()), Jsons.toJson(outbound));
        log.debug("Published {} result of task {} to {} subscriber(s)", result.status().wireName(), result.taskId(), receivers);
    }

    @Override
    public void publishProgress(TaskProgress progress) {
        if (closed || progress == null) {
            return;
        }
        try {
            transport.publish(Topics.progress(progress.taskId()), Jsons.toJson(progress));
        } catch (RuntimeException e) {
            log.warn("Dropped progress of task {}: {}", progress.taskId(), e.getMessage());
        }
    }

    @Override
    public Subscription subscribeToTasks(Consumer<TaskRequest> handler) {
        return subscribeToTasks(handler, (taskId, reason) -> {
        });
    }

    @Override
    public Subscription subscribeToTasks(Consumer<TaskRequest> handler, BiConsumer<String, String> onMalformed) {
        ensureOpen();
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(onMalformed, "onMalformed");
        return transport.subscribeShared(Topics.TASKS, message -> {
            TaskRequest request;
            try {
                request = Jsons.fromJson(message, TaskRequest.class);
            } catch (IllegalArgumentException e) {
                Optional<String> taskId = readTaskId(message);
                if (taskId.isEmpty()) {
                    log.warn("Discarding malformed message on {}: {}", Topics.TASKS, e.getMessage());
                    return;
                }
                log.warn("Malformed request for task {} on {}: {}", taskId.get(), Topics.TASKS, e.getMessage());
                onMalformed.accept(taskId.get(), e.getMessage());
                return;
            }
            handler.accept(request);
        });
    }

    @Override
    public Optional<TaskResult> fetchStoredResult(String taskId) {
        ensureOpen();
        String reference = ResultStore.storageKey(taskId);
        Optional<String> payload = resultStore.get(reference);
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            TaskResult stored = Jsons.fromJson(payload.get(), TaskResult.class);
            return taskId.equals(stored.taskId()) ? Optional.of(stored) : Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Stored result {} is unreadable: {}", reference, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public long requestCancellation(String taskId) {
        ensureOpen();
        ObjectNode request = Jsons.mapper().createObjectNode();
        request.put("taskId", taskId);
        request.put("requestedAt", clock.instant().toString());
        long receivers = transport.publish(Topics.cancel(taskId), Jsons.toJson(request));
        log.info("Cancellation of task {} reached {} worker(s)", taskId, receivers);
        return receivers;
    }

    @Override
    public Subscription subscribeToCancellation(String taskId, Runnable onCancel) {
        ensureOpen();
        Objects.requireNonNull(onCancel, "onCancel");
        return transport.subscribe(Topics.cancel(taskId), message -> onCancel.run());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (CompletableFuture<?> listener : listeners) {
            listener.cancel(false);
        }
        listeners.clear();
    }

    private TaskResult overflowIfNeeded(TaskResult result) {
        if (result.status() != TaskStatus.COMPLETED || result.data() == null) {
            return result;
        }
        long size = Jsons.toJson(result.data()).getBytes(StandardCharsets.UTF_8).length;
        if (size <= options.overflowThresholdBytes()) {
            return result;
        }
        try {
            String reference = resultStore.put(result.taskId(), Jsons.toJson(result), options.overflowTtl());
            log.info("Result of task {} is {} bytes; stored as {}", result.taskId(), size, reference);
            return result.withData(OverflowReference.of(reference));
        } catch (RuntimeException e) {
            log.error("Failed to store oversized result of task {}", result.taskId(), e);
            return TaskResult.failed(result.taskId(), "result payload of " + size + " bytes could not be stored", result.completedAt());
        }
    }

    private TaskResult resolveOverflow(TaskResult result) {
        Optional<String> reference = OverflowReference.referenceOf(result.data());
        if (reference.isEmpty()) {
            return result;
        }
        Optional<String> payload;
        try {
            payload = resultStore.get(reference.get());
        } catch (RuntimeException e) {
            log.warn("Result store lookup of {} failed", reference.get(), e);
            return TaskResult.failed(result.taskId(), "result payload unavailable: " + reference.get(), result.completedAt());
        }
        if (payload.isEmpty()) {
            return TaskResult.failed(result.taskId(), "result payload expired or missing: " + reference.get(), result.completedAt());
        }
        try {
            TaskResult stored = Jsons.fromJson(payload.get(), TaskResult.class);
            if (stored.taskId().equals(result.taskId())) {
                return stored;
            }
            log.warn("Stored result {} belongs to task {}", reference.get(), stored.taskId());
        } catch (IllegalArgumentException e) {
            log.warn("Stored result {} is unreadable: {}", reference.get(), e.getMessage());
        }
        return TaskResult.failed(result.taskId(), "result payload unreadable: " + reference.get(), result.completedAt());
    }

    private static Optional<String> readTaskId(String message) {
        JsonNode tree;
        try {
            tree = Jsons.readTree(message);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        JsonNode taskId = tree == null ? null : tree.get("taskId");
        if (taskId == null || !taskId.isTextual() || taskId.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(taskId.asText());
    }

    private void track(CompletableFuture<?> future, Subscription subscription) {
        listeners.add(future);
        future.whenComplete((ignored, error) -> {
            subscription.close();
            listeners.remove(future);
        });
        if (closed) {
            future.cancel(false);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Task broker is closed");
        }
    }
}
