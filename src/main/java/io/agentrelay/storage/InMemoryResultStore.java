package io.agentrelay.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryResultStore implements ResultStore {
    private final Map<String, Entry> entries;
    private final Clock clock;

    public InMemoryResultStore() {
        this(Clock.systemUTC());
    }

    public InMemoryResultStore(Clock clock) {
        this.entries = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    @Override
    public String put(String taskId, String payload, Duration ttl) {
        String key = ResultStore.storageKey(taskId);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        entries.put(key, new Entry(payload, clock.millis() + ttl.toMillis()));
        return key;
    }

    @Override
    public Optional<String> get(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(reference);
        if (entry == null || entry.expiresAtMs() <= clock.millis()) {
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    @Override
    public boolean delete(String reference) {
        return reference != null && entries.remove(reference) != null;
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().expiresAtMs() <= now && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private record Entry(String payload, long expiresAtMs) {
    }
}
