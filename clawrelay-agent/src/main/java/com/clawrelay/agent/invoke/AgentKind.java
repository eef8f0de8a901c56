package com.clawrelay.agent.invoke;

import java.util.List;
import java.util.Locale;

/**
 * Supported agent CLIs: how to call each one and how to read its output.
 */
public enum AgentKind {
    CLAUDE("claude", new ClaudeOutputParser(), List.of("claude", "-p", "{{Body}}")),
    OPENCODE("opencode", new OpencodeOutputParser(), List.of("opencode", "run", "{{Body}}")),
    GEMINI("gemini", PlainTextOutputParser.INSTANCE, List.of("gemini", "-p", "{{Body}}")),
    PI("pi", PlainTextOutputParser.INSTANCE, List.of("pi", "-p", "{{Body}}")),
    CODEX("codex", PlainTextOutputParser.INSTANCE, List.of("codex", "exec", "{{Body}}"));

    private final String id;
    private final AgentOutputParser parser;
    private final List<String> defaultCommand;

    AgentKind(String id, AgentOutputParser parser, List<String> defaultCommand) {
        this.id = id;
        this.parser = parser;
        this.defaultCommand = defaultCommand;
    }

    public String id() {
        return id;
    }

    public AgentOutputParser parser() {
        return parser;
    }

    public List<String> defaultCommand() {
        return defaultCommand;
    }

    /** Flag requesting machine-readable output, and its value. */
    List<String> formatArgs() {
        return switch (this) {
            case CLAUDE -> List.of("--output-format", "json");
            case OPENCODE -> List.of("--format", "json");
            default -> List.of();
        };
    }

    List<String> modelArgs(String provider, String model) {
        return switch (this) {
            case OPENCODE -> List.of("--model", provider + "/" + model);
            case PI -> List.of("--provider", provider, "--model", model);
            default -> List.of("--model", model);
        };
    }

    List<String> resumeArgs(String sessionId) {
        return switch (this) {
            case CLAUDE -> List.of("--resume", sessionId);
            case OPENCODE, PI -> List.of("--session", sessionId);
            default -> List.of();
        };
    }

    /**
     * @return the kind, or null if unknown
     */
    public static AgentKind fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentKind kind : values()) {
            if (kind.id.equals(key)) {
                return kind;
            }
        }
        return null;
    }
}
