package io.agentrelay.model;

import java.time.Instant;

/**
 * Best-effort progress notice for a running task. Delivery and ordering are not guaranteed.
 */
public record TaskProgress(
        String taskId,
        String message,
        Instant timestamp,
        String toolName,
        String agentName,
        String modelId,
        Integer inputTokens,
        Integer outputTokens
) {
    public TaskProgress {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be empty");
        }
        message = message == null ? "" : message;
    }

    public static TaskProgress of(String taskId, String message, Instant timestamp) {
        return new TaskProgress(taskId, message, timestamp, null, null, null, null, null);
    }
}
