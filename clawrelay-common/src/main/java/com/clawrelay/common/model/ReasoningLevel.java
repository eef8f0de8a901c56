package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Visibility of the agent's reasoning trace.
 */
public enum ReasoningLevel {
    ON("on"),
    OFF("off"),
    STREAM("stream");

    private final String value;

    ReasoningLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ReasoningLevel normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        if ("stream".equals(key) || "streaming".equals(key) || "live".equals(key)) {
            return STREAM;
        }
        Boolean flag = OnOff.parse(key);
        if (flag == null) {
            return null;
        }
        return flag ? ON : OFF;
    }

    @Override
    public String toString() {
        return value;
    }
}
