package com.clawrelay.autoreply.queue;

import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Argument parsing for the {@code /queue} directive.
 */
public final class QueueDirective {

    private static final Pattern DURATION_RE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CAP_RE = Pattern.compile("^\\d+$");

    private QueueDirective() {
    }

    /**
     * Parsed {@code /queue} arguments. Every invalid token leaves one line in
     * {@code errors}; callers must not apply anything when errors exist.
     */
    public record Args(QueueMode mode, boolean reset, Integer debounceMs, Integer cap, QueueDropPolicy drop,
            List<String> errors) {

        public boolean isEmpty() {
            return mode == null && !reset && !hasOptions() && errors.isEmpty();
        }

        public boolean hasOptions() {
            return debounceMs != null || cap != null || drop != null;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    public static Args parse(String raw) {
        String text = raw != null ? raw.trim() : "";
        if (text.startsWith(":")) {
            text = text.substring(1).trim();
        }
        QueueMode mode = null;
        boolean reset = false;
        Integer debounceMs = null;
        Integer cap = null;
        QueueDropPolicy drop = null;
        List<String> errors = new ArrayList<>();

        for (String token : text.isEmpty() ? new String[0] : text.split("\\s+")) {
            String lowered = token.toLowerCase(Locale.ROOT);
            if (lowered.equals("reset") || lowered.equals("default") || lowered.equals("clear")) {
                reset = true;
                continue;
            }
            String value = optionValue(token, "debounce");
            if (value != null) {
                debounceMs = parseDurationMs(value);
                if (debounceMs == null) {
                    errors.add("Invalid debounce \"" + value + "\". Use ms/s/m (e.g. debounce:1500ms, debounce:2s).");
                }
                continue;
            }
            value = optionValue(token, "cap");
            if (value != null) {
                cap = parseCap(value);
                if (cap == null) {
                    errors.add("Invalid cap \"" + value + "\". Use a positive integer (e.g. cap:10).");
                }
                continue;
            }
            value = optionValue(token, "drop");
            if (value != null) {
                drop = QueueDropPolicy.normalize(value);
                if (drop == null) {
                    errors.add("Invalid drop policy \"" + value + "\". Use drop:old, drop:new, or drop:summarize.");
                }
                continue;
            }
            QueueMode parsed = QueueMode.normalize(token);
            if (parsed != null) {
                mode = parsed;
            } else {
                errors.add("Unrecognized queue mode \"" + token
                        + "\". Valid modes: steer, followup, collect, steer+backlog, interrupt.");
            }
        }
        return new Args(mode, reset, debounceMs, cap, drop, Collections.unmodifiableList(errors));
    }

    /**
     * Milliseconds from {@code 1500}, {@code 1500ms}, {@code 2s}, {@code 1.5s}
     * or {@code 1m}; null when malformed or out of range.
     */
    public static Integer parseDurationMs(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = DURATION_RE.matcher(raw.trim());
        if (!m.matches()) {
            return null;
        }
        double value = Double.parseDouble(m.group(1));
        String unit = m.group(2) != null ? m.group(2).toLowerCase(Locale.ROOT) : "ms";
        double ms = switch (unit) {
            case "s" -> value * 1000;
            case "m" -> value * 60_000;
            default -> value;
        };
        if (!Double.isFinite(ms) || ms > Integer.MAX_VALUE) {
            return null;
        }
        return (int) Math.round(ms);
    }

    static Integer parseCap(String raw) {
        String text = raw != null ? raw.trim() : "";
        if (!CAP_RE.matcher(text).matches() || text.length() > 9) {
            return null;
        }
        int cap = Integer.parseInt(text);
        return cap >= 1 ? cap : null;
    }

    private static String optionValue(String token, String name) {
        String lowered = token.toLowerCase(Locale.ROOT);
        if (lowered.startsWith(name + ":") || lowered.startsWith(name + "=")) {
            return token.substring(name.length() + 1);
        }
        return null;
    }
}
