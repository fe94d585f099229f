package io.agentrelay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work handed to the worker pool. Immutable once created by the submitter.
 *
 * <p>Only {@code taskId} is mandatory on the wire: a request that names no agent type is still
 * answered by the dispatcher with a {@link TaskStatus#FAILED} result. {@code outputPath} is a
 * caller hint that neither the broker nor the worker interprets.
 */
public record TaskRequest(
        String taskId,
        String agentType,
        String prompt,
        Instant submittedAt,
        String outputPath
) {
    public TaskRequest {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be empty");
        }
    }

    public static TaskRequest create(String taskId, String agentType, String prompt, Instant submittedAt, String outputPath) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType cannot be empty");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be empty");
        }
        Objects.requireNonNull(submittedAt, "submittedAt");
        String safeOutput = outputPath == null || outputPath.isBlank() ? null : outputPath;
        return new TaskRequest(taskId, agentType.trim(), prompt, submittedAt, safeOutput);
    }
}
