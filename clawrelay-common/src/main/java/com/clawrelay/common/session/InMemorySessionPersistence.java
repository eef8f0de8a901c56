package com.clawrelay.common.session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable persistence, for embedding and tests.
 */
public class InMemorySessionPersistence implements SessionPersistence {

    private final Map<String, SessionEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionEntry> load(String sessionKey) {
        return Optional.ofNullable(entries.get(sessionKey));
    }

    @Override
    public void save(String sessionKey, SessionEntry entry) {
        entries.put(sessionKey, entry);
    }

    @Override
    public Map<String, SessionEntry> loadAll() {
        return new LinkedHashMap<>(entries);
    }
}
