package io.agentrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.util.Jsons;

import java.time.Instant;

public final class EchoAgent implements Agent {
    @Override
    public String agentType() {
        return "echo";
    }

    @Override
    public JsonNode execute(AgentContext context) {
        context.reportProgress("echoing " + (context.prompt() == null ? 0 : context.prompt().length()) + " chars");
        ObjectNode output = Jsons.mapper().createObjectNode();
        output.put("agent", agentType());
        output.put("taskId", context.taskId());
        output.put("timestamp", Instant.now().toString());
        output.put("received", context.prompt());
        return output;
    }
}
