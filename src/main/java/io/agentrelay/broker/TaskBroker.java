package io.agentrelay.broker;

import io.agentrelay.model.TaskProgress;
import io.agentrelay.model.TaskRequest;
import io.agentrelay.model.TaskResult;
import io.agentrelay.transport.Subscription;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Shared abstraction submitters and workers use to talk to the transport and the result store.
 * The broker does not enforce single publication per task; the worker dispatcher does.
 */
public interface TaskBroker extends AutoCloseable {

    void submit(TaskRequest request);

    /**
     * {@code onResult} runs at most once, with any overflowed payload already resolved. Cancelling
     * the returned future drops the subscription; it completes exceptionally when
     * {@code onResult} throws.
     */
    CompletableFuture<TaskResult> subscribeToResult(String taskId, Consumer<TaskResult> onResult);

    CompletableFuture<Void> subscribeToProgress(String taskId, Consumer<TaskProgress> onProgress);

    void publishResult(TaskResult result);

    void publishProgress(TaskProgress progress);

    Subscription subscribeToTasks(Consumer<TaskRequest> handler);

    /**
     * Like {@link #subscribeToTasks(Consumer)}. A message that cannot be read as a request but
     * still names a task id goes to {@code onMalformed} with that id and the parse error.
     */
    Subscription subscribeToTasks(Consumer<TaskRequest> handler, BiConsumer<String, String> onMalformed);

    Optional<TaskResult> fetchStoredResult(String taskId);

    /**
     * @return number of listeners the request reached; 0 when the task is not in flight anywhere
     */
    long requestCancellation(String taskId);

    Subscription subscribeToCancellation(String taskId, Runnable onCancel);

    @Override
    void close();
}
