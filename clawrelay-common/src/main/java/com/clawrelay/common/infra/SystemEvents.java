package com.clawrelay.common.infra;

import com.clawrelay.common.session.SessionKeys;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * In-memory queue of human-readable system events that are prefixed to the
 * next prompt of a session. Events are session-scoped and not persisted.
 */
public class SystemEvents {

    private static final int MAX_EVENTS = 20;

    /**
     * A system event with text and timestamp.
     */
    public record Event(String text, long ts) {
    }

    private static final class SessionQueue {
        final List<Event> queue = new ArrayList<>();
        String lastText;
    }

    private final Map<String, SessionQueue> queues = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public SystemEvents() {
        this(System::currentTimeMillis);
    }

    public SystemEvents(LongSupplier clock) {
        this.clock = clock;
    }

    // ── Public API ──────────────────────────────────────────────────────

    /**
     * Enqueue a system event for a session. Skips blank text and consecutive
     * duplicates; keeps at most the latest {@value #MAX_EVENTS} events.
     */
    public void enqueue(String sessionKey, String text) {
        String key = SessionKeys.normalize(sessionKey);
        String cleaned = text != null ? text.trim() : "";
        if (cleaned.isEmpty()) {
            return;
        }
        SessionQueue entry = queues.computeIfAbsent(key, k -> new SessionQueue());
        synchronized (entry) {
            if (cleaned.equals(entry.lastText)) {
                return;
            }
            entry.lastText = cleaned;
            entry.queue.add(new Event(cleaned, clock.getAsLong()));
            if (entry.queue.size() > MAX_EVENTS) {
                entry.queue.remove(0);
            }
        }
    }

    /**
     * Drain all event texts for a session, removing them from the queue.
     */
    public List<String> drain(String sessionKey) {
        String key = SessionKeys.normalize(sessionKey);
        SessionQueue entry = queues.remove(key);
        if (entry == null) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            List<String> out = entry.queue.stream().map(Event::text).collect(Collectors.toList());
            entry.queue.clear();
            entry.lastText = null;
            return out;
        }
    }

    /**
     * Peek at current event texts without draining.
     */
    public List<String> peek(String sessionKey) {
        String key = SessionKeys.normalize(sessionKey);
        SessionQueue entry = queues.get(key);
        if (entry == null) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            return entry.queue.stream().map(Event::text).collect(Collectors.toList());
        }
    }

    public boolean hasEvents(String sessionKey) {
        SessionQueue entry = queues.get(SessionKeys.normalize(sessionKey));
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            return !entry.queue.isEmpty();
        }
    }
}
