package io.agentrelay.cli;

import io.agentrelay.client.TaskService;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.AgentRelaySettings;
import io.agentrelay.model.TaskResult;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.util.Jsons;
import io.agentrelay.util.TaskIds;
import io.agentrelay.worker.WorkerDispatcher;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "agentrelay",
        mixinStandardHelpOptions = true,
        description = "AgentRelay asynchronous agent task broker CLI",
        subcommands = {
                AgentRelayCommand.InitCommand.class,
                AgentRelayCommand.WorkerCommand.class,
                AgentRelayCommand.SubmitCommand.class,
                AgentRelayCommand.ResultCommand.class,
                AgentRelayCommand.CancelCommand.class,
                AgentRelayCommand.AgentsCommand.class,
                AgentRelayCommand.PurgeResultsCommand.class
        }
)
public final class AgentRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = AgentRelayConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | worker | submit | result | cancel | agents | purge-results");
    }

    AgentRelayConfig config() {
        return AgentRelayConfig.fromRoot(root);
    }

    AgentRelayRuntime runtime() {
        return new AgentRelayRuntime(config());
    }

    @Command(name = "init", description = "Create the runtime root, result database and default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() throws Exception {
            AgentRelayConfig config = parent.config();
            try (AgentRelayRuntime runtime = new AgentRelayRuntime(config)) {
                runtime.init();
                Path settingsFile = config.settingsFile();
                boolean wroteSettings = false;
                if (!Files.exists(settingsFile)) {
                    Files.writeString(settingsFile, Jsons.toPrettyJson(runtime.settings()) + System.lineSeparator(), StandardCharsets.UTF_8);
                    wroteSettings = true;
                }
                System.out.println(Jsons.toJson(new InitOutcome(config.rootDir().toString(), settingsFile.toString(), wroteSettings)));
            }
            return 0;
        }
    }

    @Command(name = "worker", description = "Run a worker until interrupted")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--worker-id"}, description = "Worker identity; random when omitted")
        String workerId;

        @Option(names = {"--concurrency"}, description = "Tasks executed at the same time (overrides settings)")
        Integer concurrency;

        @Option(names = {"--timeout-ms"}, description = "Per-task execution timeout in ms (overrides settings)")
        Long timeoutMs;

        @Override
        public Integer call() throws Exception {
            AgentRelayConfig config = parent.config();
            AgentRelaySettings settings = AgentRelaySettings.load(config.settingsFile());
            if (concurrency != null) {
                settings = settings.withWorkerConcurrency(concurrency);
            }
            if (timeoutMs != null) {
                settings = settings.withExecutionTimeoutMs(timeoutMs);
            }
            String id = workerId == null || workerId.isBlank() ? "worker-" + TaskIds.shortForm(TaskIds.newTaskId()) : workerId.trim();
            AgentRelayRuntime runtime = new AgentRelayRuntime(config, settings);
            runtime.init();
            WorkerDispatcher dispatcher = runtime.newWorkerDispatcher(id);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                dispatcher.close();
                runtime.close();
                stopped.countDown();
            }, "agentrelay-shutdown-hook"));
            dispatcher.start();
            System.out.println(Jsons.toJson(new WorkerStarted(id, settings.workerConcurrency(), settings.executionTimeoutMs(),
                    runtime.agentRegistry().listAgentTypes())));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a task and optionally wait for its result")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent type")
        String agent;

        @Option(names = {"--prompt"}, required = true, description = "Task prompt")
        String prompt;

        @Option(names = {"--output"}, description = "Write completed result data to this file")
        String output;

        @Option(names = {"--wait-ms"}, defaultValue = "0", description = "Wait this long for the result; 0 returns right after submission")
        long waitMs;

        @Option(names = {"--progress"}, defaultValue = "false", description = "Print progress messages while waiting")
        boolean progress;

        @Override
        public Integer call() throws Exception {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                try (TaskService service = runtime.newTaskService()) {
                    String taskId = service.submitTask(agent, prompt, output);
                    System.out.println(Jsons.toJson(new SubmitOutcome(taskId, agent, output)));
                    if (waitMs <= 0L) {
                        return 0;
                    }
                    CompletableFuture<Void> progressFeed = progress
                            ? service.subscribeToProgress(taskId, p -> System.out.println(Jsons.toJson(p)))
                            : CompletableFuture.completedFuture(null);
                    try {
                        Optional<TaskResult> result = service.waitForResult(taskId, Duration.ofMillis(waitMs));
                        if (result.isEmpty()) {
                            System.out.println(Jsons.toJson(new WaitTimeout(taskId, waitMs)));
                            return 2;
                        }
                        System.out.println(Jsons.toJson(result.get()));
                        if (result.get().status() != TaskStatus.COMPLETED) {
                            return 1;
                        }
                        writeOutput(result.get());
                        return 0;
                    } finally {
                        progressFeed.cancel(false);
                    }
                }
            }
        }

        private void writeOutput(TaskResult result) throws Exception {
            if (output == null || output.isBlank()) {
                return;
            }
            Path target = Path.of(output).toAbsolutePath().normalize();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, Jsons.toPrettyJson(result.data()) + System.lineSeparator(), StandardCharsets.UTF_8);
        }
    }

    @Command(name = "result", description = "Fetch a stored result, or listen for it")
    static final class ResultCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--wait-ms"}, defaultValue = "0", description = "Listen this long when nothing is stored")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                Optional<TaskResult> stored = runtime.broker().fetchStoredResult(taskId);
                if (stored.isPresent()) {
                    System.out.println(Jsons.toJson(stored.get()));
                    return 0;
                }
                if (waitMs > 0L) {
                    CompletableFuture<TaskResult> live = runtime.broker().subscribeToResult(taskId, r -> {
                    });
                    try {
                        System.out.println(Jsons.toJson(live.get(waitMs, TimeUnit.MILLISECONDS)));
                        return 0;
                    } catch (TimeoutException | ExecutionException e) {
                        live.cancel(false);
                    }
                }
                System.out.println("{\"error\":\"result not found\"}");
                return 1;
            }
        }
    }

    @Command(name = "cancel", description = "Ask the worker running a task to cancel it")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                long delivered = runtime.broker().requestCancellation(taskId);
                System.out.println(Jsons.toJson(new CancelOutcome(taskId, delivered)));
                return delivered > 0L ? 0 : 1;
            }
        }
    }

    @Command(name = "agents", description = "List agent types this runtime can execute")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.agentRegistry().listAgentTypes()));
                return 0;
            }
        }
    }

    @Command(name = "purge-results", description = "Delete expired overflow payloads from the result store")
    static final class PurgeResultsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(new PurgeOutcome(runtime.purgeExpiredResults())));
                return 0;
            }
        }
    }

    record InitOutcome(String root, String settingsFile, boolean settingsCreated) {
    }

    record WorkerStarted(String workerId, int concurrency, long executionTimeoutMs, Collection<String> agents) {
    }

    record SubmitOutcome(String taskId, String agentType, String outputPath) {
    }

    record WaitTimeout(String taskId, long waitedMs) {
    }

    record CancelOutcome(String taskId, long delivered) {
    }

    record PurgeOutcome(int purged) {
    }
}
