package com.clawrelay.agent.invoke;

/**
 * Agents that print their reply as plain text.
 */
public final class PlainTextOutputParser implements AgentOutputParser {

    public static final PlainTextOutputParser INSTANCE = new PlainTextOutputParser();

    private PlainTextOutputParser() {
    }

    @Override
    public ParsedAgentOutput parse(String raw) {
        return ParsedAgentOutput.ofText(raw != null ? raw.trim() : "");
    }
}
