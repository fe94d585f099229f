package io.agentrelay.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.agentrelay.agent.Agent;
import io.agentrelay.agent.AgentContext;
import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.agent.ProgressReporter;
import io.agentrelay.broker.TaskBroker;
import io.agentrelay.model.TaskProgress;
import io.agentrelay.model.TaskRequest;
import io.agentrelay.model.TaskResult;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumes the task topic and turns every received request into exactly one terminal result.
 *
 * <p>At most {@link WorkerOptions#concurrency()} agents run at once. A slot is held until the
 * agent's thread has returned, even when the task was already answered as timed out or
 * cancelled. While all slots are busy the dispatcher stops taking deliveries, so further tasks
 * stay with the transport.
 */
public final class WorkerDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerDispatcher.class);
    static final String SHUTDOWN_REASON = "worker shutting down";
    static final String REMOTE_CANCEL_REASON = "cancelled by request";
    static final String MALFORMED_PREFIX = "malformed task request: ";
    private static final long PERMIT_WAIT_SLICE_MS = 100L;
    private static final Duration LEDGER_RETENTION = Duration.ofHours(1);

    private final TaskBroker broker;
    private final AgentRegistry registry;
    private final WorkerOptions options;
    private final Clock clock;
    private final Semaphore permits;
    private final ExecutorService taskPool;
    private final ExecutorService executionPool;
    private final Map<String, Long> inFlight;
    private final Map<String, Long> published;
    private final AtomicBoolean started;
    private final AtomicBoolean stopping;
    private volatile Subscription subscription;

    public WorkerDispatcher(TaskBroker broker, AgentRegistry registry, WorkerOptions options) {
        this(broker, registry, options, Clock.systemUTC());
    }

    public WorkerDispatcher(TaskBroker broker, AgentRegistry registry, WorkerOptions options, Clock clock) {
        this.broker = broker;
        this.registry = registry;
        this.options = options;
        this.clock = clock;
        this.permits = new Semaphore(options.concurrency());
        this.taskPool = Executors.newFixedThreadPool(options.concurrency(), threads("agentrelay-" + options.workerId() + "-task-"));
        this.executionPool = Executors.newCachedThreadPool(threads("agentrelay-" + options.workerId() + "-exec-"));
        this.inFlight = new ConcurrentHashMap<>();
        this.published = new ConcurrentHashMap<>();
        this.started = new AtomicBoolean(false);
        this.stopping = new AtomicBoolean(false);
    }

    public void start() {
        if (stopping.get()) {
            throw new IllegalStateException("Worker " + options.workerId() + " is stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker " + options.workerId() + " already started");
        }
        subscription = broker.subscribeToTasks(this::accept, this::rejectMalformed);
        log.info("Worker {} listening for tasks with concurrency {} and timeout {} ms",
                options.workerId(), options.concurrency(), options.executionTimeout().toMillis());
    }

    public String workerId() {
        return options.workerId();
    }

    public Set<String> inFlightTaskIds() {
        return Set.copyOf(inFlight.keySet());
    }

    public boolean isRunning() {
        return started.get() && !stopping.get();
    }

    /**
     * Blocks the delivering thread until a slot is free.
     */
    void accept(TaskRequest request) {
        String taskId = request.taskId();
        if (published.containsKey(taskId)) {
            log.warn("Task {} was already answered; ignoring duplicate delivery", taskId);
            return;
        }
        if (inFlight.putIfAbsent(taskId, clock.millis()) != null) {
            log.warn("Task {} is already in flight; ignoring duplicate delivery", taskId);
            return;
        }
        if (!acquirePermit()) {
            inFlight.remove(taskId);
            publishTerminal(TaskResult.cancelled(taskId, SHUTDOWN_REASON, clock.instant()));
            return;
        }
        try {
            taskPool.execute(new DispatchJob(request));
        } catch (RejectedExecutionException e) {
            permits.release();
            inFlight.remove(taskId);
            publishTerminal(TaskResult.cancelled(taskId, SHUTDOWN_REASON, clock.instant()));
        }
    }

    void rejectMalformed(String taskId, String reason) {
        if (inFlight.containsKey(taskId)) {
            log.warn("Ignoring malformed duplicate of in-flight task {}", taskId);
            return;
        }
        String detail = reason == null || reason.isBlank() ? "unreadable message" : reason;
        publishTerminal(TaskResult.failed(taskId, ErrorMessages.normalize(MALFORMED_PREFIX + detail), clock.instant()));
    }

    private boolean acquirePermit() {
        try {
            while (!permits.tryAcquire(PERMIT_WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (stopping.get()) {
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (stopping.get()) {
            permits.release();
            return false;
        }
        return true;
    }

    private void process(TaskRequest request) {
        String taskId = request.taskId();
        String agentType = request.agentType();
        Optional<Agent> found = registry.findByType(agentType);
        if (found.isEmpty()) {
            log.warn("Task {} names unknown agent type {}", taskId, agentType);
            publishTerminal(TaskResult.failed(taskId, "unknown agent type: " + (agentType == null ? "" : agentType), clock.instant()));
            return;
        }
        Agent agent = found.get();
        log.info("Processing task {} of type {}", taskId, agent.agentType());

        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        ProgressReporter reporter = (message, toolName) -> broker.publishProgress(new TaskProgress(
                taskId, message, clock.instant(), toolName, agent.agentType(), null, null, null
        ));
        AgentContext context = new AgentContext(taskId, agentType, request.prompt(), request.outputPath(), reporter, cancelRequested::get);
        AtomicReference<Future<?>> executionRef = new AtomicReference<>();
        Subscription cancelSubscription = subscribeToCancellation(taskId, cancelRequested, executionRef);
        reporter.report(TaskStatus.RUNNING.wireName() + " on worker " + options.workerId(), null);

        AgentRun run = new AgentRun(agent, context);
        Future<JsonNode> execution = executionPool.submit(run);
        executionRef.set(execution);
        if (cancelRequested.get()) {
            execution.cancel(true);
        }
        boolean interrupted = false;
        TaskResult result;
        try {
            JsonNode data = execution.get(options.executionTimeout().toMillis(), TimeUnit.MILLISECONDS);
            result = TaskResult.completed(taskId, data == null ? NullNode.getInstance() : data, clock.instant());
        } catch (TimeoutException e) {
            cancelRequested.set(true);
            execution.cancel(true);
            log.warn("Task {} exceeded {} ms", taskId, options.executionTimeout().toMillis());
            result = TaskResult.cancelled(taskId, "execution timed out after " + options.executionTimeout().toMillis() + " ms", clock.instant());
        } catch (CancellationException e) {
            result = TaskResult.cancelled(taskId, REMOTE_CANCEL_REASON, clock.instant());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                result = TaskResult.cancelled(taskId, REMOTE_CANCEL_REASON, clock.instant());
            } else {
                String message = ErrorMessages.sanitize(e.getCause());
                log.warn("Task {} failed: {}", taskId, message);
                result = TaskResult.failed(taskId, message, clock.instant());
            }
        } catch (InterruptedException e) {
            cancelRequested.set(true);
            execution.cancel(true);
            interrupted = true;
            result = TaskResult.cancelled(taskId, SHUTDOWN_REASON, clock.instant());
        } finally {
            if (cancelSubscription != null) {
                cancelSubscription.close();
            }
        }
        // Publish before restoring the flag; interruptible channels refuse I/O otherwise.
        publishTerminal(result);
        if (interrupted) {
            Thread.currentThread().interrupt();
            return;
        }
        awaitAgentExit(taskId, run);
    }

    private void awaitAgentExit(String taskId, AgentRun run) {
        try {
            if (!run.awaitExit(options.executionTimeout().toMillis())) {
                log.warn("Agent for task {} ignores cancellation; its slot stays busy until it returns", taskId);
                run.awaitExit(Long.MAX_VALUE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Subscription subscribeToCancellation(String taskId, AtomicBoolean cancelRequested, AtomicReference<Future<?>> executionRef) {
        try {
            return broker.subscribeToCancellation(taskId, () -> {
                if (cancelRequested.compareAndSet(false, true)) {
                    log.info("Cancellation requested for task {}", taskId);
                    Future<?> execution = executionRef.get();
                    if (execution != null) {
                        execution.cancel(true);
                    }
                }
            });
        } catch (RuntimeException e) {
            log.warn("Remote cancellation unavailable for task {}: {}", taskId, e.getMessage());
            return null;
        }
    }

    /**
     * Single publication point. A second terminal result for the same task is refused.
     */
    boolean publishTerminal(TaskResult result) {
        Long previous = published.putIfAbsent(result.taskId(), clock.millis());
        if (previous != null) {
            log.error("Refusing second terminal result {} for task {}", result.status().wireName(), result.taskId());
            return false;
        }
        try {
            broker.publishResult(result);
            log.info("Task {} finished: {}", result.taskId(), result.status().wireName());
        } catch (RuntimeException e) {
            log.error("Failed to publish {} result of task {}", result.status().wireName(), result.taskId(), e);
        }
        long cutoff = clock.millis() - LEDGER_RETENTION.toMillis();
        published.values().removeIf(publishedAt -> publishedAt < cutoff);
        return true;
    }

    @Override
    public void close() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Worker {} stopping with {} task(s) in flight", options.workerId(), inFlight.size());
        Subscription current = subscription;
        if (current != null) {
            current.close();
        }
        for (Runnable queued : taskPool.shutdownNow()) {
            if (queued instanceof DispatchJob job) {
                job.abandon();
            }
        }
        try {
            if (!taskPool.awaitTermination(Math.max(1L, options.shutdownGrace().toMillis()), TimeUnit.MILLISECONDS)) {
                log.warn("Worker {} gave up waiting for {} task(s)", options.workerId(), inFlight.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executionPool.shutdownNow();
        log.info("Worker {} stopped", options.workerId());
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * One agent invocation. Tells the dispatcher when the agent's thread has really returned,
     * including after the future was cancelled.
     */
    private static final class AgentRun implements Callable<JsonNode> {
        private static final int IDLE = 0;
        private static final int RUNNING = 1;
        private static final int EXITED = 2;

        private final Agent agent;
        private final AgentContext context;
        private final AtomicInteger state;
        private final CountDownLatch exited;

        AgentRun(Agent agent, AgentContext context) {
            this.agent = agent;
            this.context = context;
            this.state = new AtomicInteger(IDLE);
            this.exited = new CountDownLatch(1);
        }

        @Override
        public JsonNode call() throws Exception {
            if (!state.compareAndSet(IDLE, RUNNING)) {
                return null;
            }
            try {
                return agent.execute(context);
            } finally {
                state.set(EXITED);
                exited.countDown();
            }
        }

        boolean awaitExit(long timeoutMs) throws InterruptedException {
            if (state.compareAndSet(IDLE, EXITED)) {
                return true;
            }
            return exited.await(timeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    private final class DispatchJob implements Runnable {
        private final TaskRequest request;

        DispatchJob(TaskRequest request) {
            this.request = request;
        }

        @Override
        public void run() {
            try {
                process(request);
            } catch (RuntimeException e) {
                log.error("Dispatch of task {} failed", request.taskId(), e);
                publishTerminal(TaskResult.failed(request.taskId(), ErrorMessages.sanitize(e), clock.instant()));
            } finally {
                inFlight.remove(request.taskId());
                permits.release();
            }
        }

        void abandon() {
            try {
                publishTerminal(TaskResult.cancelled(request.taskId(), SHUTDOWN_REASON, clock.instant()));
            } finally {
                inFlight.remove(request.taskId());
                permits.release();
            }
        }
    }
}
