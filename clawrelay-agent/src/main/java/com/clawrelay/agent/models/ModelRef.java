package com.clawrelay.agent.models;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code provider/model} pair.
 */
public record ModelRef(String provider, String model) {

    public static final String DEFAULT_PROVIDER = "anthropic";
    public static final String DEFAULT_MODEL = "claude-opus-4-5";

    private static final Pattern ANTHROPIC_SHORTHAND = Pattern.compile(
            "^(?:claude-)?(opus|sonnet|haiku)-(\\d+)[.-](\\d+)(-\\d{8})?$");

    public static ModelRef defaultRef() {
        return new ModelRef(DEFAULT_PROVIDER, DEFAULT_MODEL);
    }

    public String key() {
        return provider + "/" + model;
    }

    /**
     * Parse a model reference such as {@code "openai/gpt-4.1-mini"} or a bare
     * {@code "gpt-4.1-mini"} under {@code defaultProvider}.
     *
     * @return parsed ref, or null if invalid
     */
    public static ModelRef parse(String raw, String defaultProvider) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        int slash = trimmed.indexOf('/');
        if (slash == -1) {
            String provider = normalizeProviderId(defaultProvider);
            return new ModelRef(provider, normalizeModelId(provider, trimmed));
        }
        String provider = normalizeProviderId(trimmed.substring(0, slash));
        String model = trimmed.substring(slash + 1).trim();
        if (provider.isEmpty() || model.isEmpty()) {
            return null;
        }
        return new ModelRef(provider, normalizeModelId(provider, model));
    }

    /**
     * Normalize provider ID (handle common aliases).
     */
    public static String normalizeProviderId(String provider) {
        if (provider == null) {
            return "";
        }
        String normalized = provider.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "z.ai", "z-ai" -> "zai";
            case "opencode-zen" -> "opencode";
            case "claude" -> "anthropic";
            case "gemini" -> "google";
            case "kimi" -> "moonshot";
            default -> normalized;
        };
    }

    /**
     * Expand vendor shorthands: for Anthropic, {@code opus-4.5} and
     * {@code claude-opus-4.5} both become {@code claude-opus-4-5}.
     */
    public static String normalizeModelId(String provider, String model) {
        if (model == null) {
            return null;
        }
        String trimmed = model.trim();
        if (!DEFAULT_PROVIDER.equals(provider)) {
            return trimmed;
        }
        Matcher m = ANTHROPIC_SHORTHAND.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return trimmed;
        }
        String suffix = m.group(4) != null ? m.group(4) : "";
        return "claude-" + m.group(1) + "-" + m.group(2) + "-" + m.group(3) + suffix;
    }

    @Override
    public String toString() {
        return key();
    }
}
