package io.agentrelay.worker;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns executor failures into the short text that travels in a failed result.
 */
public final class ErrorMessages {
    public static final int MAX_CHARS = 512;

    private ErrorMessages() {
    }

    /**
     * Single line, at most {@value #MAX_CHARS} characters, no stack trace or exception class names.
     */
    public static String sanitize(Throwable error) {
        Throwable root = error;
        while ((root instanceof ExecutionException || root instanceof CompletionException) && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root == null ? null : root.getMessage();
        if (message == null || message.isBlank()) {
            return "agent failed without a message";
        }
        return normalize(message);
    }

    public static String normalize(String message) {
        String normalized = message == null ? "" : message.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_CHARS - 3) + "...";
    }
}
