package io.agentrelay.runtime;

import io.agentrelay.agent.ScriptAgent;
import io.agentrelay.client.TaskService;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.TaskResult;
import io.agentrelay.model.TaskStatus;
import io.agentrelay.storage.ResultStore;
import io.agentrelay.worker.WorkerDispatcher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class AgentRelayRuntimeTest {

    @Test
    void echoTaskRoundTripsOverFileTransportAndSqlite() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-runtime-");
        writeSettings(root, "{\"pollIntervalMs\":20,\"subscriberTtlMs\":2000,\"shutdownGraceMs\":2000}");
        AgentRelayRuntime runtime = new AgentRelayRuntime(new AgentRelayConfig(root));
        try {
            runtime.init();
            Assertions.assertTrue(Files.exists(root.resolve("agentrelay.db")));
            try (WorkerDispatcher worker = runtime.newWorkerDispatcher("w-test");
                 TaskService service = runtime.newTaskService()) {
                worker.start();
                String taskId = service.submitTask("echo", "hello relay");

                TaskResult result = service.waitForResult(taskId, Duration.ofSeconds(10)).orElseThrow();

                Assertions.assertEquals(TaskStatus.COMPLETED, result.status());
                Assertions.assertEquals("hello relay", result.data().get("received").asText());
                Assertions.assertEquals(taskId, result.data().get("taskId").asText());
            }
        } finally {
            runtime.close();
            deleteRecursively(root);
        }
    }

    @Test
    void workerAndSubmitterInSeparateRuntimesShareOverflowedResults() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-runtime-");
        writeSettings(root, "{\"pollIntervalMs\":20,\"subscriberTtlMs\":2000,\"overflowThresholdBytes\":128,\"shutdownGraceMs\":2000}");
        AgentRelayRuntime workerSide = new AgentRelayRuntime(new AgentRelayConfig(root));
        AgentRelayRuntime submitterSide = new AgentRelayRuntime(new AgentRelayConfig(root));
        try {
            workerSide.init();
            submitterSide.init();
            try (WorkerDispatcher worker = workerSide.newWorkerDispatcher("w-remote");
                 TaskService service = submitterSide.newTaskService()) {
                worker.start();
                String prompt = "p".repeat(1_000);
                String taskId = service.submitTask("echo", prompt);

                TaskResult result = service.waitForResult(taskId, Duration.ofSeconds(10)).orElseThrow();

                Assertions.assertEquals(TaskStatus.COMPLETED, result.status());
                Assertions.assertEquals(prompt, result.data().get("received").asText());
                Assertions.assertTrue(submitterSide.resultStore().get(ResultStore.storageKey(taskId)).isPresent());

                String failing = service.submitTask("fail", "please fail");
                TaskResult failed = service.waitForResult(failing, Duration.ofSeconds(10)).orElseThrow();
                Assertions.assertEquals(TaskStatus.FAILED, failed.status());
                Assertions.assertEquals("intentional failure from fail agent", failed.error());
            }
        } finally {
            workerSide.close();
            submitterSide.close();
            deleteRecursively(root);
        }
    }

    @Test
    void scriptAgentsAreLoadedFromAgentsDirectory() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-runtime-");
        writeSettings(root, "{\"transport\":\"memory\",\"resultStore\":\"memory\"}");
        Files.createDirectories(root.resolve("agents"));
        Files.writeString(root.resolve("agents").resolve("tool.sh"), "cat\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("agents").resolve("scripts.json"),
                "{\"agents\":[{\"id\":\"summarize\",\"command\":[\"sh\",\"agents/tool.sh\"],\"timeoutMs\":5000},"
                        + "{\"id\":\"\",\"command\":[\"ignored\"]}]}", StandardCharsets.UTF_8);
        AgentRelayRuntime runtime = new AgentRelayRuntime(new AgentRelayConfig(root));
        try {
            runtime.init();

            Assertions.assertEquals(List.of("echo", "fail", "summarize"), List.copyOf(runtime.agentRegistry().listAgentTypes()));
            ScriptAgent script = (ScriptAgent) runtime.agentRegistry().findByType("summarize").orElseThrow();
            Assertions.assertEquals("sh", script.command().get(0));
            Assertions.assertEquals(root.resolve("agents/tool.sh").normalize().toString(), script.command().get(1));
        } finally {
            runtime.close();
            deleteRecursively(root);
        }
    }

    @Test
    void uninitializedRuntimeRejectsAccess() throws Exception {
        Path root = Files.createTempDirectory("agentrelay-runtime-");
        try {
            AgentRelayRuntime runtime = new AgentRelayRuntime(new AgentRelayConfig(root));
            Assertions.assertThrows(IllegalStateException.class, runtime::broker);
            Assertions.assertThrows(IllegalStateException.class, runtime::purgeExpiredResults);
            runtime.close();
        } finally {
            deleteRecursively(root);
        }
    }

    private static void writeSettings(Path root, String json) throws IOException {
        Files.writeString(root.resolve(AgentRelayConfig.SETTINGS_FILE_NAME), json, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
