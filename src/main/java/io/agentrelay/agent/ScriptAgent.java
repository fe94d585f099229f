package io.agentrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per task. The prompt is written to stdin; stdout lines starting with
 * {@value #PROGRESS_PREFIX} are forwarded as progress, everything else is the result. JSON output
 * is returned as is, any other output as {@code {"text": ...}}.
 */
public final class ScriptAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(ScriptAgent.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final long WAIT_SLICE_MS = 100L;
    static final String PROGRESS_PREFIX = "::progress ";

    private final String agentType;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String agentType, List<String> command, long timeoutMs) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("script agent type cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + agentType);
        }
        this.agentType = agentType.trim();
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String agentType() {
        return agentType;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public JsonNode execute(AgentContext context) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("AGENTRELAY_TASK_ID", context.taskId());
        pb.environment().put("AGENTRELAY_AGENT_TYPE", agentType);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IllegalStateException("script spawn failed: " + e.getMessage(), e);
        }

        StringBuilder output = new StringBuilder();
        Thread pump = new Thread(() -> pumpOutput(process, context, output), "agentrelay-script-" + agentType);
        pump.setDaemon(true);
        pump.start();
        try {
            writePrompt(process, context.prompt());
            long deadline = System.currentTimeMillis() + timeoutMs;
            while (!process.waitFor(WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (context.isCancelled()) {
                    process.destroyForcibly();
                    throw new CancellationException("script cancelled");
                }
                if (System.currentTimeMillis() >= deadline) {
                    process.destroyForcibly();
                    throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
                }
            }
            pump.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        String combined;
        synchronized (output) {
            combined = output.toString().strip();
        }
        if (process.exitValue() != 0) {
            throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(combined));
        }
        return toResult(combined);
    }

    private static void writePrompt(Process process, String prompt) throws IOException {
        byte[] input = prompt == null ? new byte[0] : prompt.getBytes(StandardCharsets.UTF_8);
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            // The script may exit without reading stdin.
            if (process.isAlive()) {
                throw e;
            }
        }
    }

    private static void pumpOutput(Process process, AgentContext context, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(PROGRESS_PREFIX)) {
                    context.reportProgress(line.substring(PROGRESS_PREFIX.length()).trim());
                    continue;
                }
                synchronized (output) {
                    output.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            log.debug("Output of script for task {} closed early: {}", context.taskId(), e.getMessage());
        }
    }

    private static JsonNode toResult(String stdout) {
        if (!stdout.isEmpty()) {
            try {
                JsonNode parsed = Jsons.readTree(stdout);
                if (parsed != null && (parsed.isObject() || parsed.isArray())) {
                    return parsed;
                }
            } catch (IllegalArgumentException ignored) {
                // Plain text output.
            }
        }
        ObjectNode text = Jsons.mapper().createObjectNode();
        text.put("text", stdout);
        return text;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
