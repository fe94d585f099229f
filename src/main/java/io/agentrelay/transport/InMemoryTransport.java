package io.agentrelay.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Process-local transport. Used by tests and when submitter and workers share one JVM.
 */
public final class InMemoryTransport implements TaskChannelTransport {
    private final Map<String, List<Mailbox>> broadcast;
    private final Map<String, SharedGroup> shared;
    private final ExecutorService delivery;
    private volatile boolean closed;

    public InMemoryTransport() {
        this.broadcast = new ConcurrentHashMap<>();
        this.shared = new ConcurrentHashMap<>();
        this.delivery = Executors.newCachedThreadPool(daemonThreads("agentrelay-memory-delivery-"));
        this.closed = false;
    }

    @Override
    public long publish(String topic, String message) {
        ensureOpen();
        requireTopic(topic);
        long receivers = 0L;
        for (Mailbox mailbox : broadcast.getOrDefault(topic, List.of())) {
            if (mailbox.isActive()) {
                mailbox.offer(message);
                receivers++;
            }
        }
        SharedGroup group = shared.get(topic);
        if (group != null && group.enqueue(message)) {
            receivers++;
        }
        return receivers;
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> listener) {
        ensureOpen();
        requireTopic(topic);
        Mailbox mailbox = new Mailbox(topic, listener, delivery, () -> {
        });
        broadcast.compute(topic, (key, list) -> {
            List<Mailbox> subscribers = list == null ? new CopyOnWriteArrayList<>() : list;
            subscribers.add(mailbox);
            return subscribers;
        });
        return new MemorySubscription(mailbox, () -> broadcast.computeIfPresent(topic, (key, list) -> {
            list.remove(mailbox);
            return list.isEmpty() ? null : list;
        }));
    }

    @Override
    public Subscription subscribeShared(String topic, Consumer<String> listener) {
        ensureOpen();
        requireTopic(topic);
        SharedGroup group = shared.computeIfAbsent(topic, ignored -> new SharedGroup());
        Mailbox mailbox = new Mailbox(topic, listener, delivery, group::dispatch);
        group.join(mailbox);
        return new MemorySubscription(mailbox, () -> group.leave(mailbox));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (List<Mailbox> mailboxes : broadcast.values()) {
            mailboxes.forEach(Mailbox::close);
        }
        for (SharedGroup group : shared.values()) {
            group.closeAll();
        }
        broadcast.clear();
        shared.clear();
        delivery.shutdownNow();
    }

    private void ensureOpen() {
        if (closed) {
            throw new TransportException("In-memory transport is closed");
        }
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Pending messages of a shared topic wait here until a member is idle.
     */
    private static final class SharedGroup {
        private final List<Mailbox> members = new ArrayList<>();
        private final Queue<String> pending = new ArrayDeque<>();
        private int cursor = 0;

        synchronized void join(Mailbox mailbox) {
            members.add(mailbox);
        }

        void leave(Mailbox mailbox) {
            synchronized (this) {
                members.remove(mailbox);
                if (members.isEmpty()) {
                    pending.clear();
                }
            }
            dispatch();
        }

        boolean enqueue(String message) {
            synchronized (this) {
                if (members.isEmpty()) {
                    return false;
                }
                pending.add(message);
            }
            dispatch();
            return true;
        }

        synchronized void dispatch() {
            int size = members.size();
            while (!pending.isEmpty() && size > 0) {
                Mailbox target = null;
                for (int i = 0; i < size; i++) {
                    Mailbox candidate = members.get((cursor + i) % size);
                    if (candidate.isIdle()) {
                        target = candidate;
                        cursor = (cursor + i + 1) % size;
                        break;
                    }
                }
                if (target == null) {
                    return;
                }
                target.offer(pending.poll());
            }
        }

        synchronized void closeAll() {
            members.forEach(Mailbox::close);
            members.clear();
            pending.clear();
        }
    }

    private static final class MemorySubscription implements Subscription {
        private final Mailbox mailbox;
        private final Runnable onClose;

        MemorySubscription(Mailbox mailbox, Runnable onClose) {
            this.mailbox = mailbox;
            this.onClose = onClose;
        }

        @Override
        public String topic() {
            return mailbox.topic();
        }

        @Override
        public boolean isActive() {
            return mailbox.isActive();
        }

        @Override
        public void close() {
            if (!mailbox.isActive()) {
                return;
            }
            mailbox.close();
            onClose.run();
        }
    }
}
