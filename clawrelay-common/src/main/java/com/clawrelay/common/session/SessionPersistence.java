package com.clawrelay.common.session;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key to {@link SessionEntry} storage backing a {@link SessionStore}.
 * Implementations must make {@link #save} atomic per entry; the store takes
 * care of per-key serialization.
 */
public interface SessionPersistence {

    Optional<SessionEntry> load(String sessionKey) throws IOException;

    void save(String sessionKey, SessionEntry entry) throws IOException;

    Map<String, SessionEntry> loadAll() throws IOException;
}
