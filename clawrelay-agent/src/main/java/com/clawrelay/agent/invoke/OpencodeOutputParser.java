package com.clawrelay.agent.invoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Parses the {@code opencode run --format json} event stream (one JSON event
 * per line). Non-JSON lines are ignored; a stream with no recognised event is
 * a parse failure.
 */
public class OpencodeOutputParser implements AgentOutputParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ParsedAgentOutput parse(String raw) throws AgentInvocationException {
        StringBuilder text = new StringBuilder();
        boolean valid = false;
        Long startTime = null;
        Long endTime = null;
        String sessionId = null;
        double cost = 0;
        long inputTokens = 0;
        long outputTokens = 0;

        for (String line : (raw != null ? raw : "").split("\\n+")) {
            JsonNode event = readEvent(line);
            if (event == null) {
                continue;
            }
            if (sessionId == null && event.hasNonNull("sessionID")) {
                sessionId = event.get("sessionID").asText();
            }
            String type = event.path("type").asText("");
            JsonNode part = event.path("part");
            switch (type) {
                case "step_start" -> {
                    valid = true;
                    if (event.path("timestamp").isNumber()) {
                        long ts = event.get("timestamp").asLong();
                        startTime = startTime == null ? ts : Math.min(startTime, ts);
                    }
                }
                case "text" -> {
                    if (part.path("text").isTextual()) {
                        text.append(part.get("text").asText());
                        valid = true;
                    }
                }
                case "step_finish" -> {
                    valid = true;
                    if (event.path("timestamp").isNumber()) {
                        endTime = event.get("timestamp").asLong();
                    }
                    if (part.path("cost").isNumber()) {
                        cost += part.get("cost").asDouble();
                    }
                    inputTokens += part.path("tokens").path("input").asLong(0);
                    outputTokens += part.path("tokens").path("output").asLong(0);
                }
                case "tool_use" -> valid = true;
                default -> {
                }
            }
        }

        if (!valid) {
            throw new AgentInvocationException(AgentInvocationException.Reason.PARSE,
                    "opencode output has no recognised events");
        }
        Long durationMs = startTime != null && endTime != null ? endTime - startTime : null;
        AgentUsage usage = cost > 0 || inputTokens > 0 || outputTokens > 0
                ? new AgentUsage(inputTokens, outputTokens, cost > 0 ? cost : null)
                : null;
        String reply = text.toString().trim();
        return new ParsedAgentOutput(reply.isEmpty() ? List.of() : List.of(reply), sessionId, durationMs, usage);
    }

    @Override
    public String toolResult(String line) {
        JsonNode event = readEvent(line);
        if (event == null || !"tool_use".equals(event.path("type").asText())) {
            return null;
        }
        JsonNode part = event.path("part");
        String tool = part.path("tool").asText("tool");
        String output = part.path("state").path("output").asText("").trim();
        return output.isEmpty() ? "🛠️ " + tool : "🛠️ " + tool + ": " + output;
    }

    private static JsonNode readEvent(String line) {
        String trimmed = line != null ? line.trim() : "";
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
