package io.agentrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;

public final class FailAgent implements Agent {
    @Override
    public String agentType() {
        return "fail";
    }

    @Override
    public JsonNode execute(AgentContext context) {
        throw new IllegalStateException("intentional failure from fail agent");
    }
}
