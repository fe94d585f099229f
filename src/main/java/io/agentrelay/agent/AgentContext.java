package io.agentrelay.agent;

import java.util.function.BooleanSupplier;

public record AgentContext(
        String taskId,
        String agentType,
        String prompt,
        String outputPath,
        ProgressReporter progress,
        BooleanSupplier cancellation
) {
    public AgentContext {
        progress = progress == null ? ProgressReporter.NONE : progress;
        cancellation = cancellation == null ? () -> false : cancellation;
    }

    public void reportProgress(String message) {
        progress.report(message, null);
    }

    public void reportProgress(String message, String toolName) {
        progress.report(message, toolName);
    }

    public boolean isCancelled() {
        return cancellation.getAsBoolean() || Thread.currentThread().isInterrupted();
    }
}
