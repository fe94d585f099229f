package io.agentrelay.transport;

import io.agentrelay.util.TaskIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Cross-process transport over a shared directory.
 *
 * <pre>
 * topics/&lt;topic&gt;/subscribers/&lt;subscriber&gt;/heartbeat
 * topics/&lt;topic&gt;/subscribers/&lt;subscriber&gt;/inbox/*.msg.json
 * topics/&lt;topic&gt;/shared/members/&lt;subscriber&gt;.heartbeat
 * topics/&lt;topic&gt;/shared/inbox/*.msg.json
 * topics/&lt;topic&gt;/shared/claimed/&lt;subscriber&gt;/*.msg.json
 * tmp/
 * </pre>
 *
 * Publishers fan a message out to the inbox of every live broadcast subscriber and, when at
 * least one shared member is live, to the shared inbox. Messages become visible through an
 * atomic rename only. Subscribers poll; shared members claim one message at a time by moving
 * it into their own claimed directory. A subscriber whose heartbeat is older than the
 * subscriber TTL is considered gone and is pruned by the next publisher. A closing subscriber
 * removes the directories it leaves empty.
 */
public final class FileTransport implements TaskChannelTransport {
    private static final Logger log = LoggerFactory.getLogger(FileTransport.class);
    private static final String MESSAGE_SUFFIX = ".msg.json";
    private static final String SUBSCRIBERS = "subscribers";
    private static final String SHARED = "shared";
    private static final String MEMBERS = "members";
    private static final String INBOX = "inbox";
    private static final String CLAIMED = "claimed";
    private static final String HEARTBEAT = "heartbeat";
    private static final String HEARTBEAT_SUFFIX = ".heartbeat";
    private static final int REGISTER_ATTEMPTS = 3;

    private final Path root;
    private final long pollIntervalMs;
    private final long subscriberTtlMs;
    private final String instanceId;
    private final AtomicLong sequence;
    private final List<FileSubscription> subscriptions;
    private final ScheduledExecutorService poller;
    private final ExecutorService delivery;
    private volatile boolean closed;

    public FileTransport(Path root, long pollIntervalMs, long subscriberTtlMs) {
        this.root = root;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        this.subscriberTtlMs = Math.max(this.pollIntervalMs * 3L, subscriberTtlMs);
        this.instanceId = TaskIds.newTaskId().substring(0, 12);
        this.sequence = new AtomicLong(0L);
        this.subscriptions = new CopyOnWriteArrayList<>();
        try {
            Files.createDirectories(root.resolve("topics"));
            Files.createDirectories(tmpDir());
        } catch (IOException e) {
            throw new TransportException("Failed to initialize file transport at " + root, e);
        }
        this.poller = Executors.newSingleThreadScheduledExecutor(InMemoryTransport.daemonThreads("agentrelay-file-poller-"));
        this.delivery = Executors.newCachedThreadPool(InMemoryTransport.daemonThreads("agentrelay-file-delivery-"));
        this.poller.scheduleWithFixedDelay(this::pollAll, this.pollIntervalMs, this.pollIntervalMs, TimeUnit.MILLISECONDS);
        this.closed = false;
    }

    public Path root() {
        return root;
    }

    @Override
    public long publish(String topic, String message) {
        ensureOpen();
        Path topicDir = topicDir(topic);
        if (!Files.isDirectory(topicDir)) {
            return 0L;
        }
        long now = System.currentTimeMillis();
        String fileName = now + "_" + String.format("%012d", sequence.incrementAndGet()) + "_" + instanceId + MESSAGE_SUFFIX;
        long receivers = 0L;
        Path staged = tmpDir().resolve(instanceId + "_" + sequence.incrementAndGet() + ".staged");
        try {
            Files.writeString(staged, message, StandardCharsets.UTF_8);
            try {
                for (Path subscriberDir : listDirectories(topicDir.resolve(SUBSCRIBERS))) {
                    Path heartbeat = subscriberDir.resolve(HEARTBEAT);
                    if (!isAlive(heartbeat, subscriberDir, now)) {
                        prune(subscriberDir, heartbeat, now);
                        continue;
                    }
                    if (deliverCopy(staged, subscriberDir.resolve(INBOX), fileName)) {
                        receivers++;
                    }
                }
                Path sharedDir = topicDir.resolve(SHARED);
                if (hasLiveMember(sharedDir, now) && deliverCopy(staged, sharedDir.resolve(INBOX), fileName)) {
                    receivers++;
                }
            } finally {
                Files.deleteIfExists(staged);
            }
        } catch (IOException e) {
            throw new TransportException("Failed to publish to topic " + topic, e);
        }
        return receivers;
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> listener) {
        ensureOpen();
        String subscriberId = newSubscriberId();
        Path dir = topicDir(topic).resolve(SUBSCRIBERS).resolve(subscriberId);
        Mailbox mailbox = new Mailbox(topic, listener, delivery, () -> {
        });
        FileSubscription subscription = new FileSubscription(
                topic, subscriberId, false, mailbox, dir.resolve(INBOX), dir.resolve(HEARTBEAT), dir
        );
        register(subscription);
        return subscription;
    }

    @Override
    public Subscription subscribeShared(String topic, Consumer<String> listener) {
        ensureOpen();
        String subscriberId = newSubscriberId();
        Path sharedDir = topicDir(topic).resolve(SHARED);
        FileSubscription[] self = new FileSubscription[1];
        Mailbox mailbox = new Mailbox(topic, listener, delivery, () -> scheduleSharedPoll(self[0]));
        FileSubscription subscription = new FileSubscription(
                topic,
                subscriberId,
                true,
                mailbox,
                sharedDir.resolve(INBOX),
                sharedDir.resolve(MEMBERS).resolve(subscriberId + HEARTBEAT_SUFFIX),
                sharedDir.resolve(CLAIMED).resolve(subscriberId)
        );
        self[0] = subscription;
        register(subscription);
        return subscription;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        poller.shutdownNow();
        for (FileSubscription subscription : subscriptions) {
            subscription.close();
        }
        delivery.shutdownNow();
    }

    private void register(FileSubscription subscription) {
        for (int attempt = 1; ; attempt++) {
            try {
                Files.createDirectories(subscription.inbox);
                Files.createDirectories(subscription.ownDir);
                Files.createDirectories(subscription.heartbeat.getParent());
                touch(subscription.heartbeat, System.currentTimeMillis());
                break;
            } catch (NoSuchFileException e) {
                // A closing subscriber removed an empty parent directory mid-way.
                if (attempt >= REGISTER_ATTEMPTS) {
                    throw new TransportException("Failed to subscribe to topic " + subscription.topic(), e);
                }
            } catch (IOException e) {
                throw new TransportException("Failed to subscribe to topic " + subscription.topic(), e);
            }
        }
        subscriptions.add(subscription);
    }

    private void pollAll() {
        long now = System.currentTimeMillis();
        for (FileSubscription subscription : subscriptions) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                subscription.heartbeatIfDue(now);
                if (subscription.shared) {
                    pollShared(subscription);
                } else {
                    pollBroadcast(subscription);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Polling topic {} failed", subscription.topic(), e);
            }
        }
    }

    private void pollBroadcast(FileSubscription subscription) throws IOException {
        for (Path file : listMessageFiles(subscription.inbox)) {
            if (!subscription.isActive()) {
                return;
            }
            String message;
            try {
                message = Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException ignored) {
                continue;
            }
            Files.deleteIfExists(file);
            subscription.mailbox.offer(message);
        }
    }

    private void pollShared(FileSubscription subscription) throws IOException {
        if (!subscription.mailbox.isIdle()) {
            return;
        }
        for (Path candidate : listMessageFiles(subscription.inbox)) {
            Path claimed = subscription.ownDir.resolve(candidate.getFileName().toString());
            try {
                moveAtomically(candidate, claimed);
            } catch (NoSuchFileException ignored) {
                // Another member claimed it first.
                continue;
            }
            String message = Files.readString(claimed, StandardCharsets.UTF_8);
            Files.deleteIfExists(claimed);
            subscription.mailbox.offer(message);
            return;
        }
    }

    private void scheduleSharedPoll(FileSubscription subscription) {
        if (subscription == null || closed || !subscription.isActive()) {
            return;
        }
        try {
            poller.execute(() -> {
                try {
                    pollShared(subscription);
                } catch (IOException | RuntimeException e) {
                    log.warn("Polling topic {} failed", subscription.topic(), e);
                }
            });
        } catch (RejectedExecutionException ignored) {
            // Transport is shutting down.
        }
    }

    private boolean deliverCopy(Path staged, Path inbox, String fileName) throws IOException {
        Path copy = tmpDir().resolve(instanceId + "_" + sequence.incrementAndGet() + ".copy");
        try {
            Files.copy(staged, copy, StandardCopyOption.REPLACE_EXISTING);
            moveAtomically(copy, inbox.resolve(fileName));
            return true;
        } catch (NoSuchFileException e) {
            // Subscriber went away between listing and delivery.
            return false;
        } finally {
            Files.deleteIfExists(copy);
        }
    }

    private boolean hasLiveMember(Path sharedDir, long now) throws IOException {
        Path membersDir = sharedDir.resolve(MEMBERS);
        if (!Files.isDirectory(membersDir)) {
            return false;
        }
        boolean alive = false;
        List<Path> members = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(membersDir, "*" + HEARTBEAT_SUFFIX)) {
            for (Path member : stream) {
                members.add(member);
            }
        } catch (NoSuchFileException e) {
            return false;
        }
        for (Path member : members) {
            if (isAlive(member, null, now)) {
                alive = true;
            } else {
                String name = member.getFileName().toString();
                String memberId = name.substring(0, name.length() - HEARTBEAT_SUFFIX.length());
                log.info("Pruning stale shared subscriber {} of {}", memberId, sharedDir.getParent().getFileName());
                Files.deleteIfExists(member);
                deleteRecursively(sharedDir.resolve(CLAIMED).resolve(memberId));
            }
        }
        return alive;
    }

    private boolean isAlive(Path heartbeat, Path ownerDir, long now) throws IOException {
        try {
            return Files.getLastModifiedTime(heartbeat).toMillis() >= now - subscriberTtlMs;
        } catch (NoSuchFileException e) {
            // Directory created but heartbeat not written yet: only young directories get the benefit of the doubt.
            return ownerDir != null
                    && Files.exists(ownerDir)
                    && Files.getLastModifiedTime(ownerDir).toMillis() >= now - subscriberTtlMs;
        }
    }

    private void prune(Path subscriberDir, Path heartbeat, long now) {
        try {
            if (!isAlive(heartbeat, subscriberDir, now)) {
                log.info("Pruning stale subscriber {}", subscriberDir.getFileName());
                deleteRecursively(subscriberDir);
            }
        } catch (IOException e) {
            log.warn("Failed to prune stale subscriber {}", subscriberDir, e);
        }
    }

    private void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ignored) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<Path> listMessageFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + MESSAGE_SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException ignored) {
            return files;
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private List<Path> listDirectories(Path dir) throws IOException {
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return dirs;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path path : stream) {
                dirs.add(path);
            }
        } catch (NoSuchFileException e) {
            return dirs;
        }
        return dirs;
    }

    private Path topicDir(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
        return root.resolve("topics").resolve(URLEncoder.encode(topic, StandardCharsets.UTF_8));
    }

    private Path tmpDir() {
        return root.resolve("tmp");
    }

    private String newSubscriberId() {
        return instanceId + "-" + sequence.incrementAndGet();
    }

    private void ensureOpen() {
        if (closed) {
            throw new TransportException("File transport is closed: " + root);
        }
    }

    private static void touch(Path file, long nowMs) throws IOException {
        if (!Files.exists(file)) {
            Files.writeString(file, Long.toString(nowMs), StandardCharsets.UTF_8);
        }
        Files.setLastModifiedTime(file, FileTime.fromMillis(nowMs));
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static void deleteIfEmpty(Path dir) throws IOException {
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException ignored) {
            // Still used by another subscriber.
        }
    }

    private final class FileSubscription implements Subscription {
        private final String topic;
        private final String subscriberId;
        private final boolean shared;
        private final Mailbox mailbox;
        private final Path inbox;
        private final Path heartbeat;
        private final Path ownDir;
        private volatile long lastHeartbeatMs;

        FileSubscription(String topic, String subscriberId, boolean shared, Mailbox mailbox, Path inbox, Path heartbeat, Path ownDir) {
            this.topic = topic;
            this.subscriberId = subscriberId;
            this.shared = shared;
            this.mailbox = mailbox;
            this.inbox = inbox;
            this.heartbeat = heartbeat;
            this.ownDir = ownDir;
            this.lastHeartbeatMs = System.currentTimeMillis();
        }

        void heartbeatIfDue(long nowMs) throws IOException {
            if (nowMs - lastHeartbeatMs < subscriberTtlMs / 3L) {
                return;
            }
            if (!Files.exists(heartbeat.getParent()) || !Files.exists(ownDir) || !Files.exists(inbox)) {
                log.warn("Subscriber {} on {} was pruned while alive; re-registering", subscriberId, topic);
                Files.createDirectories(inbox);
                Files.createDirectories(ownDir);
                Files.createDirectories(heartbeat.getParent());
            }
            touch(heartbeat, nowMs);
            lastHeartbeatMs = nowMs;
        }

        @Override
        public String topic() {
            return topic;
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
            subscriptions.remove(this);
            try {
                if (shared) {
                    Files.deleteIfExists(heartbeat);
                    deleteRecursively(ownDir);
                    deleteIfEmpty(ownDir.getParent());
                    deleteIfEmpty(heartbeat.getParent());
                } else {
                    deleteRecursively(ownDir);
                    deleteIfEmpty(ownDir.getParent());
                    deleteIfEmpty(topicDir(topic));
                }
            } catch (IOException e) {
                log.warn("Failed to clean up subscriber {} on {}", subscriberId, topic, e);
            }
        }
    }
}
