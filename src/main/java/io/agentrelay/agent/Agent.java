package io.agentrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pluggable executor for one agent type. Implementations must be safe to call from several
 * threads at once and should return promptly once the thread is interrupted or
 * {@link AgentContext#isCancelled()} turns true.
 */
public interface Agent {
    String agentType();

    /**
     * @return structured result document; becomes {@code data} of the completed result
     * @throws Exception any failure; only its message reaches the submitter
     */
    JsonNode execute(AgentContext context) throws Exception;
}
