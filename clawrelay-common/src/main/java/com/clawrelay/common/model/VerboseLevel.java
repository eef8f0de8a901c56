package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether intermediate tool results are relayed to the chat.
 */
public enum VerboseLevel {
    ON("on"),
    OFF("off");

    private final String value;

    VerboseLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static VerboseLevel normalize(String raw) {
        Boolean flag = OnOff.parse(raw);
        if (flag == null) {
            return null;
        }
        return flag ? ON : OFF;
    }

    public boolean isOn() {
        return this == ON;
    }

    @Override
    public String toString() {
        return value;
    }
}
