package com.clawrelay.agent.runtime;

import com.clawrelay.common.config.RelayConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Elevated permissions: capability switches and sender allowlists, global and
 * per agent.
 */
public final class ElevatedGate {

    private ElevatedGate() {
    }

    /** A failed gate and the config key that controls it. */
    public record GateFailure(String gate, String key) {
    }

    /** Result of elevated permission resolution. */
    public record ElevatedPermissions(boolean enabled, boolean allowed, List<GateFailure> failures) {
    }

    /* ── token helpers ─────────────────────────────────────── */

    private static final Pattern SENDER_PREFIX_RE = Pattern.compile(
            "^(whatsapp|telegram|discord|slack|signal|matrix|webchat|twilio|web|user|group|channel):",
            Pattern.CASE_INSENSITIVE);

    static String normalizeAllowToken(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }

    static String slugAllowToken(String value) {
        if (value == null) {
            return "";
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return "";
        }
        text = text.replaceAll("^[@#]+", "");
        text = text.replaceAll("[\\s_]+", "-");
        text = text.replaceAll("[^a-z0-9+-]+", "-");
        return text.replaceAll("-{2,}", "-").replaceAll("^-+|-+$", "");
    }

    static String stripSenderPrefix(String value) {
        if (value == null) {
            return "";
        }
        return SENDER_PREFIX_RE.matcher(value.trim()).replaceFirst("");
    }

    /* ── switches ──────────────────────────────────────────── */

    public static boolean isGloballyEnabled(RelayConfig cfg) {
        RelayConfig.ElevatedConfig global = globalConfig(cfg);
        return global == null || !Boolean.FALSE.equals(global.getEnabled());
    }

    public static boolean isEnabledForAgent(RelayConfig cfg, String agentId) {
        RelayConfig.ElevatedConfig agent = agentConfig(cfg, agentId);
        return agent == null || !Boolean.FALSE.equals(agent.getEnabled());
    }

    /** Capability available at all for this agent (both switches on). */
    public static boolean isAvailable(RelayConfig cfg, String agentId) {
        return isGloballyEnabled(cfg) && isEnabledForAgent(cfg, agentId);
    }

    /* ── allowlists ────────────────────────────────────────── */

    /**
     * Whether {@code sender} is on {@code allowFrom[transport]}. An absent or
     * empty list admits nobody; {@code "*"} admits everyone.
     */
    public static boolean isApprovedSender(Map<String, List<String>> allowFrom, String transport, String sender) {
        if (allowFrom == null || transport == null) {
            return false;
        }
        List<String> rawAllow = allowFrom.get(transport.trim().toLowerCase(Locale.ROOT));
        if (rawAllow == null) {
            rawAllow = allowFrom.get(transport);
        }
        if (rawAllow == null || rawAllow.isEmpty()) {
            return false;
        }
        List<String> allowTokens = rawAllow.stream()
                .map(e -> e != null ? e.trim() : "")
                .filter(e -> !e.isEmpty())
                .toList();
        if (allowTokens.contains("*")) {
            return true;
        }

        Set<String> tokens = new HashSet<>();
        addToken(tokens, sender);
        addToken(tokens, stripSenderPrefix(sender));

        for (String entry : allowTokens) {
            String stripped = stripSenderPrefix(entry);
            if (tokens.contains(entry) || tokens.contains(stripped)) {
                return true;
            }
            String normalized = normalizeAllowToken(stripped);
            if (!normalized.isEmpty() && tokens.contains(normalized)) {
                return true;
            }
            String slugged = slugAllowToken(stripped);
            if (!slugged.isEmpty() && tokens.contains(slugged)) {
                return true;
            }
        }
        return false;
    }

    private static void addToken(Set<String> tokens, String value) {
        if (value == null) {
            return;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        tokens.add(trimmed);
        String normalized = normalizeAllowToken(trimmed);
        if (!normalized.isEmpty()) {
            tokens.add(normalized);
        }
        String slugged = slugAllowToken(trimmed);
        if (!slugged.isEmpty()) {
            tokens.add(slugged);
        }
    }

    /* ── permission resolution ─────────────────────────────── */

    /**
     * Check every gate for {@code sender} on {@code transport} talking to
     * {@code agentId}. A per-agent allowlist that is not configured at all does
     * not restrict; one that is configured must admit the sender.
     */
    public static ElevatedPermissions resolve(RelayConfig cfg, String agentId, String transport, String sender) {
        boolean globalEnabled = isGloballyEnabled(cfg);
        boolean agentEnabled = isEnabledForAgent(cfg, agentId);
        List<GateFailure> failures = new ArrayList<>();

        if (!globalEnabled) {
            failures.add(new GateFailure("enabled", "tools.elevated.enabled"));
        }
        if (!agentEnabled) {
            failures.add(new GateFailure("enabled", "agents.list[].tools.elevated.enabled"));
        }
        if (!globalEnabled || !agentEnabled) {
            return new ElevatedPermissions(false, false, failures);
        }

        if (transport == null || transport.isBlank()) {
            failures.add(new GateFailure("transport", "inbound transport"));
            return new ElevatedPermissions(true, false, failures);
        }
        String provider = transport.trim().toLowerCase(Locale.ROOT);

        RelayConfig.ElevatedConfig global = globalConfig(cfg);
        if (!isApprovedSender(global != null ? global.getAllowFrom() : null, provider, sender)) {
            failures.add(new GateFailure("allowFrom", "tools.elevated.allowFrom." + provider));
            return new ElevatedPermissions(true, false, failures);
        }

        RelayConfig.ElevatedConfig agent = agentConfig(cfg, agentId);
        Map<String, List<String>> agentAllowFrom = agent != null ? agent.getAllowFrom() : null;
        if (agentAllowFrom != null && !isApprovedSender(agentAllowFrom, provider, sender)) {
            failures.add(new GateFailure("allowFrom", "agents.list[].tools.elevated.allowFrom." + provider));
            return new ElevatedPermissions(true, false, failures);
        }
        return new ElevatedPermissions(true, true, failures);
    }

    /**
     * Explain why elevated is unavailable.
     */
    public static String formatUnavailableMessage(List<GateFailure> failures) {
        List<String> lines = new ArrayList<>();
        lines.add("elevated is not available right now (runtime=direct).");
        if (failures != null && !failures.isEmpty()) {
            lines.add("Failing gates: " + String.join(", ", failures.stream()
                    .map(f -> f.gate() + " (" + f.key() + ")")
                    .toList()));
        } else {
            lines.add("Failing gates: enabled (tools.elevated.enabled / agents.list[].tools.elevated.enabled), "
                    + "allowFrom (tools.elevated.allowFrom.<transport>).");
        }
        lines.add("Fix-it keys:");
        lines.add("- tools.elevated.enabled");
        lines.add("- tools.elevated.allowFrom.<transport>");
        lines.add("- agents.list[].tools.elevated.enabled");
        lines.add("- agents.list[].tools.elevated.allowFrom.<transport>");
        return String.join("\n", lines);
    }

    private static RelayConfig.ElevatedConfig globalConfig(RelayConfig cfg) {
        return cfg != null && cfg.getTools() != null ? cfg.getTools().getElevated() : null;
    }

    private static RelayConfig.ElevatedConfig agentConfig(RelayConfig cfg, String agentId) {
        if (cfg == null || cfg.getAgents() == null) {
            return null;
        }
        RelayConfig.AgentEntry entry = cfg.getAgents().find(agentId);
        return entry != null && entry.getTools() != null ? entry.getTools().getElevated() : null;
    }
}
