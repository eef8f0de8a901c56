package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How inbound messages that arrive for a session become agent turns.
 */
public enum QueueMode {
    STEER("steer"),
    FOLLOWUP("followup"),
    COLLECT("collect"),
    STEER_BACKLOG("steer-backlog"),
    INTERRUPT("interrupt");

    private final String value;

    QueueMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Label used in chat output ("steer+backlog" rather than the stored form). */
    public String label() {
        return this == STEER_BACKLOG ? "steer+backlog" : value;
    }

    @JsonCreator
    public static QueueMode normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "steer", "steering", "queue", "queued" -> STEER;
            case "followup", "follow-up", "followups", "follow-ups" -> FOLLOWUP;
            case "collect", "coalesce" -> COLLECT;
            case "steer+backlog", "steer-backlog", "steer_backlog" -> STEER_BACKLOG;
            case "interrupt", "interrupts", "abort" -> INTERRUPT;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return label();
    }
}
