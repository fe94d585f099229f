package io.agentrelay.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry expiry, used for result payloads too large to travel on the
 * transport. Writes for the same key are last-writer-wins.
 */
public interface ResultStore {
    String KEY_PREFIX = "agents:results:data:";

    static String storageKey(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be empty");
        }
        return KEY_PREFIX + taskId;
    }

    /**
     * @return the reference to hand to {@link #get(String)}
     */
    String put(String taskId, String payload, Duration ttl);

    /**
     * @return the payload, or empty when the reference is unknown or has expired
     */
    Optional<String> get(String reference);

    boolean delete(String reference);

    /**
     * @return number of expired entries removed
     */
    int purgeExpired();
}
