package com.clawrelay.agent.invoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code claude --output-format json}: a single JSON blob, or
 * newline-delimited JSON where the first object carrying text wins.
 */
public class ClaudeOutputParser implements AgentOutputParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final List<String> TEXT_FIELDS = List.of("result", "text", "completion", "output");

    @Override
    public ParsedAgentOutput parse(String raw) throws AgentInvocationException {
        String trimmed = raw != null ? raw.trim() : "";
        List<String> candidates = new ArrayList<>();
        candidates.add(trimmed);
        for (String line : trimmed.split("\\n+")) {
            if (!line.isBlank()) {
                candidates.add(line.trim());
            }
        }

        JsonNode first = null;
        for (String candidate : candidates) {
            JsonNode node = readTree(candidate);
            if (node == null) {
                continue;
            }
            if (first == null) {
                first = node;
            }
            String text = extractText(node);
            if (text != null && !text.isEmpty()) {
                return toOutput(node, text);
            }
        }
        if (first == null) {
            throw new AgentInvocationException(AgentInvocationException.Reason.PARSE,
                    "claude output is not JSON");
        }
        return toOutput(first, null);
    }

    private ParsedAgentOutput toOutput(JsonNode node, String text) throws AgentInvocationException {
        if (node.path("is_error").asBoolean(false)) {
            throw new AgentInvocationException(AgentInvocationException.Reason.EXIT,
                    "claude reported an error: " + (text != null ? text : node.path("subtype").asText("unknown")));
        }
        String sessionId = node.hasNonNull("session_id") ? node.get("session_id").asText() : null;
        Long durationMs = node.hasNonNull("duration_ms") ? node.get("duration_ms").asLong() : null;
        return new ParsedAgentOutput(text != null ? List.of(text) : List.of(), sessionId, durationMs, usage(node));
    }

    private static AgentUsage usage(JsonNode node) {
        JsonNode usage = node.path("usage");
        Long input = usage.hasNonNull("input_tokens") ? usage.get("input_tokens").asLong() : null;
        Long output = usage.hasNonNull("output_tokens") ? usage.get("output_tokens").asLong() : null;
        Double cost = node.hasNonNull("total_cost_usd") ? node.get("total_cost_usd").asDouble() : null;
        if (input == null && output == null && cost == null) {
            return null;
        }
        return new AgentUsage(input, output, cost);
    }

    private static JsonNode readTree(String candidate) {
        if (candidate.isEmpty() || (candidate.charAt(0) != '{' && candidate.charAt(0) != '[')) {
            return null;
        }
        try {
            return MAPPER.readTree(candidate);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * First text found in the known reply fields, nested messages or text
     * content blocks.
     */
    static String extractText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String found = extractText(item);
                if (found != null && !found.isEmpty()) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        for (String field : TEXT_FIELDS) {
            if (node.path(field).isTextual()) {
                return node.get(field).asText();
            }
        }
        String inner = extractText(node.get("message"));
        if (inner != null && !inner.isEmpty()) {
            return inner;
        }
        if (node.path("messages").isArray()) {
            inner = extractText(node.get("messages"));
            if (inner != null && !inner.isEmpty()) {
                return inner;
            }
        }
        JsonNode content = node.path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                    return block.get("text").asText();
                }
                String found = extractText(block);
                if (found != null && !found.isEmpty()) {
                    return found;
                }
            }
        }
        return null;
    }
}
