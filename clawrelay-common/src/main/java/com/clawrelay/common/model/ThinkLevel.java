package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thinking effort passed to the agent. Accepts the usual shorthands
 * ("on" means low, "max" means high, and so on).
 */
public enum ThinkLevel {
    OFF("off"),
    MINIMAL("minimal"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private static final Map<String, ThinkLevel> ALIASES = Map.ofEntries(
            Map.entry("off", OFF),
            Map.entry("none", OFF),
            Map.entry("think", MINIMAL),
            Map.entry("min", MINIMAL),
            Map.entry("minimal", MINIMAL),
            Map.entry("on", LOW),
            Map.entry("enable", LOW),
            Map.entry("enabled", LOW),
            Map.entry("low", LOW),
            Map.entry("thinkhard", LOW),
            Map.entry("mid", MEDIUM),
            Map.entry("med", MEDIUM),
            Map.entry("medium", MEDIUM),
            Map.entry("harder", MEDIUM),
            Map.entry("thinkharder", MEDIUM),
            Map.entry("high", HIGH),
            Map.entry("max", HIGH),
            Map.entry("highest", HIGH),
            Map.entry("ultra", HIGH),
            Map.entry("ultrathink", HIGH),
            Map.entry("thinkhardest", HIGH));

    private final String value;

    ThinkLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Normalize a user-provided level.
     *
     * @return the level, or {@code null} if unrecognized
     */
    @JsonCreator
    public static ThinkLevel normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        return ALIASES.get(key);
    }

    /** "off, minimal, low, medium, high" */
    public static String options() {
        return Arrays.stream(values()).map(ThinkLevel::value).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return value;
    }
}
