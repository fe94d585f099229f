package io.agentrelay.runtime;

import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.agent.EchoAgent;
import io.agentrelay.agent.FailAgent;
import io.agentrelay.agent.ScriptAgent;
import io.agentrelay.broker.BrokerOptions;
import io.agentrelay.broker.PubSubTaskBroker;
import io.agentrelay.broker.TaskBroker;
import io.agentrelay.client.TaskService;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.AgentRelaySettings;
import io.agentrelay.storage.Database;
import io.agentrelay.storage.InMemoryResultStore;
import io.agentrelay.storage.ResultStore;
import io.agentrelay.storage.SqliteResultStore;
import io.agentrelay.transport.FileTransport;
import io.agentrelay.transport.InMemoryTransport;
import io.agentrelay.transport.TaskChannelTransport;
import io.agentrelay.util.Jsons;
import io.agentrelay.worker.WorkerDispatcher;
import io.agentrelay.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires transport, result store, broker and agents for one process, as described by the
 * runtime root and its settings file.
 */
public final class AgentRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentRelayRuntime.class);
    private static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;

    private final AgentRelayConfig config;
    private final AgentRelaySettings settings;
    private final AgentRegistry agentRegistry;
    private TaskChannelTransport transport;
    private ResultStore resultStore;
    private TaskBroker broker;
    private boolean initialized;

    public AgentRelayRuntime(AgentRelayConfig config) {
        this(config, AgentRelaySettings.load(config.settingsFile()));
    }

    public AgentRelayRuntime(AgentRelayConfig config, AgentRelaySettings settings) {
        this.config = config;
        this.settings = settings;
        this.agentRegistry = new AgentRegistry();
        this.initialized = false;
        registerDefaultAgents();
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.agentsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
        this.resultStore = createResultStore();
        this.transport = createTransport();
        this.broker = new PubSubTaskBroker(transport, resultStore, BrokerOptions.from(settings));
        registerConfiguredScriptAgents();
        initialized = true;
        log.info("Runtime ready at {} (transport={}, resultStore={})", config.rootDir(), settings.transport(), settings.resultStore());
    }

    public AgentRelayConfig config() {
        return config;
    }

    public AgentRelaySettings settings() {
        return settings;
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public synchronized TaskBroker broker() {
        ensureInitialized();
        return broker;
    }

    public synchronized ResultStore resultStore() {
        ensureInitialized();
        return resultStore;
    }

    public WorkerDispatcher newWorkerDispatcher(String workerId) {
        return new WorkerDispatcher(broker(), agentRegistry, WorkerOptions.from(settings, workerId));
    }

    public TaskService newTaskService() {
        return new TaskService(broker());
    }

    public int purgeExpiredResults() {
        int removed = resultStore().purgeExpired();
        log.info("Purged {} expired result payload(s)", removed);
        return removed;
    }

    @Override
    public synchronized void close() {
        if (!initialized) {
            return;
        }
        broker.close();
        transport.close();
        initialized = false;
    }

    private TaskChannelTransport createTransport() {
        if (AgentRelaySettings.TRANSPORT_MEMORY.equals(settings.transport())) {
            return new InMemoryTransport();
        }
        return new FileTransport(config.busDir(settings), settings.pollIntervalMs(), settings.subscriberTtlMs());
    }

    private ResultStore createResultStore() {
        if (AgentRelaySettings.STORE_MEMORY.equals(settings.resultStore())) {
            return new InMemoryResultStore();
        }
        Database database = new Database(config.dbFile(settings));
        database.init();
        return new SqliteResultStore(database);
    }

    private void registerDefaultAgents() {
        agentRegistry.register(new EchoAgent());
        agentRegistry.register(new FailAgent());
    }

    private void registerConfiguredScriptAgents() {
        Path cfg = config.scriptAgentsFile();
        if (!Files.exists(cfg)) {
            return;
        }
        try {
            ScriptAgentFile file = Jsons.mapper().readValue(cfg.toFile(), ScriptAgentFile.class);
            if (file == null || file.agents() == null || file.agents().isEmpty()) {
                return;
            }
            int loaded = 0;
            int skipped = 0;
            for (ScriptAgentSpec spec : file.agents()) {
                if (spec == null || spec.id() == null || spec.id().isBlank() || spec.command() == null || spec.command().isEmpty()) {
                    skipped++;
                    continue;
                }
                try {
                    long timeoutMs = spec.timeoutMs() == null ? DEFAULT_SCRIPT_TIMEOUT_MS : spec.timeoutMs();
                    agentRegistry.register(new ScriptAgent(spec.id(), resolveScriptCommand(spec.command()), timeoutMs));
                    loaded++;
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping script agent {}: {}", spec.id(), e.getMessage());
                }
            }
            log.info("Loaded {} script agent(s) from {}, skipped {}", loaded, cfg, skipped);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load script agent config: " + cfg, e);
        }
    }

    private List<String> resolveScriptCommand(List<String> rawCommand) {
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = config.rootDir().resolve(token).normalize();
            if (Files.exists(candidate)) {
                resolved.add(candidate.toString());
            } else {
                resolved.add(token);
            }
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("script command became empty after normalization");
        }
        return resolved;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Runtime is not initialized");
        }
    }

    private record ScriptAgentFile(List<ScriptAgentSpec> agents) {
    }

    private record ScriptAgentSpec(String id, List<String> command, Long timeoutMs) {
    }
}
