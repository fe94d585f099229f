package io.agentrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of a task. At most one is ever published per task id.
 *
 * <p>{@code data} is present only for {@link TaskStatus#COMPLETED}; {@code error} is present for
 * {@link TaskStatus#FAILED} and may carry a short reason for {@link TaskStatus#CANCELLED}.
 */
public record TaskResult(
        String taskId,
        TaskStatus status,
        JsonNode data,
        String error,
        Instant completedAt
) {
    public TaskResult {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be empty");
        }
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status.wireName());
        }
        if (status != TaskStatus.COMPLETED && data != null && !data.isNull()) {
            throw new IllegalArgumentException("Only completed results carry data");
        }
        if (status == TaskStatus.FAILED && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("Failed results must carry an error message");
        }
        if (status == TaskStatus.COMPLETED && error != null) {
            throw new IllegalArgumentException("Completed results cannot carry an error");
        }
    }

    public static TaskResult completed(String taskId, JsonNode data, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, data, null, completedAt);
    }

    public static TaskResult failed(String taskId, String error, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.FAILED, null, error, completedAt);
    }

    public static TaskResult cancelled(String taskId, String reason, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.CANCELLED, null, reason, completedAt);
    }

    public TaskResult withData(JsonNode replacement) {
        return new TaskResult(taskId, status, replacement, error, completedAt);
    }
}
