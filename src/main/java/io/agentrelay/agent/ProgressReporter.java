package io.agentrelay.agent;

@FunctionalInterface
public interface ProgressReporter {
    ProgressReporter NONE = (message, toolName) -> {
    };

    void report(String message, String toolName);
}
