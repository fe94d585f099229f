package io.agentrelay.agent;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agents by type. Lookup ignores case; registering the same type again replaces the agent.
 */
public final class AgentRegistry {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public void register(Agent agent) {
        String type = agent.agentType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("agent type cannot be empty");
        }
        agents.put(normalize(type), agent);
    }

    public Optional<Agent> findByType(String agentType) {
        if (agentType == null || agentType.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(normalize(agentType)));
    }

    public Collection<String> listAgentTypes() {
        return agents.values().stream().map(Agent::agentType).sorted().toList();
    }

    private static String normalize(String agentType) {
        return agentType.trim().toLowerCase(Locale.ROOT);
    }
}
