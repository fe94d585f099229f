package io.agentrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "agentrelay-settings.json";

    private final Path rootDir;

    public AgentRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path dbFile() {
        return rootDir.resolve("agentrelay.db");
    }

    public Path busDir() {
        return rootDir.resolve("bus");
    }

    public Path agentsDir() {
        return rootDir.resolve("agents");
    }

    public Path scriptAgentsFile() {
        return agentsDir().resolve("scripts.json");
    }

    /**
     * Transport address: the settings override when present, relative paths resolved against the root.
     */
    public Path busDir(AgentRelaySettings settings) {
        return resolveOverride(settings.busDir(), busDir());
    }

    public Path dbFile(AgentRelaySettings settings) {
        return resolveOverride(settings.resultDbFile(), dbFile());
    }

    private Path resolveOverride(String override, Path fallback) {
        if (override == null || override.isBlank()) {
            return fallback;
        }
        Path candidate = Paths.get(override.trim());
        return candidate.isAbsolute() ? candidate.normalize() : rootDir.resolve(candidate).normalize();
    }
}
