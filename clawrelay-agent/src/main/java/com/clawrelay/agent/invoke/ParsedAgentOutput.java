package com.clawrelay.agent.invoke;

import java.util.List;

/**
 * What an {@link AgentOutputParser} extracted from raw agent output.
 */
public record ParsedAgentOutput(List<String> texts, String sessionId, Long durationMs, AgentUsage usage) {

    public ParsedAgentOutput {
        texts = texts != null ? List.copyOf(texts) : List.of();
    }

    public static ParsedAgentOutput ofText(String text) {
        return new ParsedAgentOutput(text == null || text.isEmpty() ? List.of() : List.of(text), null, null, null);
    }
}
