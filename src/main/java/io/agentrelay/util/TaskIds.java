package io.agentrelay.util;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class TaskIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TaskIds() {
    }

    /**
     * 128 random bits as 32 lower-case hex characters.
     */
    public static String newTaskId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String shortForm(String taskId) {
        if (taskId == null) {
            return "";
        }
        return taskId.length() <= 8 ? taskId : taskId.substring(0, 8);
    }
}
