package com.clawrelay.common.session;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Session key normalization and agent addressing.
 * A key of the form {@code agent:<agentId>:<rest>} addresses that agent;
 * anything else addresses {@link #DEFAULT_AGENT_ID}.
 */
public final class SessionKeys {

    public static final String DEFAULT_AGENT_ID = "main";

    private static final Pattern AGENT_KEY_RE = Pattern.compile("^agent:([^:]+):(.+)$");

    private SessionKeys() {
    }

    /**
     * Trim a session key.
     *
     * @throws IllegalArgumentException if the key is null or blank
     */
    public static String normalize(String sessionKey) {
        String trimmed = sessionKey != null ? sessionKey.trim() : "";
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("session key is required");
        }
        return trimmed;
    }

    /**
     * Resolve the agent id addressed by a session key.
     */
    public static String agentId(String sessionKey) {
        if (sessionKey == null) {
            return DEFAULT_AGENT_ID;
        }
        Matcher m = AGENT_KEY_RE.matcher(sessionKey.trim());
        if (m.matches()) {
            return m.group(1).trim().toLowerCase(Locale.ROOT);
        }
        return DEFAULT_AGENT_ID;
    }
}
