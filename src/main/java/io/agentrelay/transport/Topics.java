package io.agentrelay.transport;

/**
 * Topic names shared by submitters and workers. These strings are part of the wire contract.
 */
public final class Topics {
    public static final String TASKS = "agents:tasks";
    public static final String RESULTS_PREFIX = "agents:results:";
    public static final String PROGRESS_PREFIX = "agents:progress:";
    public static final String CANCEL_PREFIX = "agents:cancel:";

    private Topics() {
    }

    public static String results(String taskId) {
        return RESULTS_PREFIX + requireTaskId(taskId);
    }

    public static String progress(String taskId) {
        return PROGRESS_PREFIX + requireTaskId(taskId);
    }

    public static String cancel(String taskId) {
        return CANCEL_PREFIX + requireTaskId(taskId);
    }

    private static String requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be empty");
        }
        return taskId;
    }
}
