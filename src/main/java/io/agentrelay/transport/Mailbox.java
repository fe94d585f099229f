package io.agentrelay.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Serial delivery queue of one subscription: at most one listener call runs at a time and
 * messages are handed over in the order they were offered.
 */
final class Mailbox {
    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final String topic;
    private final Consumer<String> listener;
    private final Executor executor;
    private final Runnable onIdle;
    private final Queue<String> queue;
    private final AtomicBoolean draining;
    private volatile boolean active;

    Mailbox(String topic, Consumer<String> listener, Executor executor, Runnable onIdle) {
        this.topic = topic;
        this.listener = listener;
        this.executor = executor;
        this.onIdle = onIdle;
        this.queue = new ConcurrentLinkedQueue<>();
        this.draining = new AtomicBoolean(false);
        this.active = true;
    }

    String topic() {
        return topic;
    }

    boolean isActive() {
        return active;
    }

    boolean isIdle() {
        return active && queue.isEmpty() && !draining.get();
    }

    void offer(String message) {
        if (!active) {
            return;
        }
        queue.add(message);
        schedule();
    }

    void close() {
        active = false;
        queue.clear();
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Delivery executor rejected messages for topic {}", topic);
        }
    }

    private void drain() {
        try {
            String message;
            while (active && (message = queue.poll()) != null) {
                try {
                    listener.accept(message);
                } catch (RuntimeException e) {
                    log.warn("Listener for topic {} failed", topic, e);
                }
            }
        } finally {
            draining.set(false);
        }
        if (!active) {
            return;
        }
        if (!queue.isEmpty()) {
            schedule();
        } else {
            onIdle.run();
        }
    }
}
