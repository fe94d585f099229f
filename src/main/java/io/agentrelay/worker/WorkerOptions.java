package io.agentrelay.worker;

import io.agentrelay.config.AgentRelaySettings;

import java.time.Duration;

/**
 * {@code shutdownGrace} bounds how long {@link WorkerDispatcher#close()} waits for cancelled tasks to report.
 */
public record WorkerOptions(
        String workerId,
        int concurrency,
        Duration executionTimeout,
        Duration shutdownGrace
) {
    public WorkerOptions {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId cannot be empty");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (executionTimeout == null || executionTimeout.isNegative() || executionTimeout.isZero()) {
            throw new IllegalArgumentException("executionTimeout must be positive");
        }
        shutdownGrace = shutdownGrace == null || shutdownGrace.isNegative() ? Duration.ZERO : shutdownGrace;
    }

    public static WorkerOptions from(AgentRelaySettings settings, String workerId) {
        return new WorkerOptions(
                workerId,
                settings.workerConcurrency(),
                settings.executionTimeout(),
                Duration.ofMillis(settings.shutdownGraceMs())
        );
    }
}
