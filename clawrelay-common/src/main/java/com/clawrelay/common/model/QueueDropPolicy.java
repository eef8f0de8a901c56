package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a collect batch does with an arrival once it is at capacity.
 */
public enum QueueDropPolicy {
    OLD("old"),
    NEW("new"),
    SUMMARIZE("summarize");

    private final String value;

    QueueDropPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static QueueDropPolicy normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "old", "oldest" -> OLD;
            case "new", "newest" -> NEW;
            case "summarize", "summary" -> SUMMARIZE;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
