package com.clawrelay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Elevated-privilege mode for agent tool execution.
 */
public enum ElevatedLevel {
    ON("on"),
    OFF("off");

    private final String value;

    ElevatedLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ElevatedLevel normalize(String raw) {
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
