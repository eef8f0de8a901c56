package com.clawrelay.common.model;

import java.util.Locale;
import java.util.Set;

/**
 * Shared parsing for binary on/off levels.
 */
final class OnOff {

    private static final Set<String> ON = Set.of("on", "true", "yes", "1", "enable", "enabled", "full");
    private static final Set<String> OFF = Set.of("off", "false", "no", "0", "disable", "disabled");

    private OnOff() {
    }

    static Boolean parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        if (ON.contains(key)) {
            return Boolean.TRUE;
        }
        if (OFF.contains(key)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
