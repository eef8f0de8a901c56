package com.clawrelay.common.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Keyed session state with a read/modify/persist primitive.
 *
 * <p>
 * Updates to one key are serialized by a per-key lock, so each mutator sees
 * the result of the previous one. Different keys never contend. Reads go to the
 * persistence layer each time; a key whose last write failed is served from
 * memory until a write for it succeeds again.
 * </p>
 *
 * <p>
 * Successfully persisted entries are remembered in a bounded cache that only
 * answers reads while the persistence layer is failing. Locks are held weakly
 * and disappear once no thread uses them.
 * </p>
 */
@Slf4j
public class SessionStore {

    public static final int DEFAULT_LAST_KNOWN_LIMIT = 1_000;

    private final SessionPersistence persistence;
    private final LongSupplier clock;
    private final Cache<String, SessionEntry> lastKnown;
    private final LoadingCache<String, ReentrantLock> locks;
    private final Map<String, SessionEntry> unsaved = new ConcurrentHashMap<>();

    public SessionStore(SessionPersistence persistence) {
        this(persistence, System::currentTimeMillis);
    }

    public SessionStore(SessionPersistence persistence, LongSupplier clock) {
        this(persistence, clock, DEFAULT_LAST_KNOWN_LIMIT);
    }

    SessionStore(SessionPersistence persistence, LongSupplier clock, int lastKnownLimit) {
        this.persistence = persistence;
        this.clock = clock;
        this.lastKnown = Caffeine.newBuilder()
                .maximumSize(lastKnownLimit)
                .executor(Runnable::run)
                .build();
        this.locks = Caffeine.newBuilder()
                .weakValues()
                .build(k -> new ReentrantLock());
    }

    // ── Read ────────────────────────────────────────────────────────────

    /**
     * Current entry for a key, or {@link SessionEntry#empty()} when none
     * exists. Never throws for I/O problems.
     */
    public SessionEntry get(String sessionKey) {
        String key = SessionKeys.normalize(sessionKey);
        SessionEntry pending = unsaved.get(key);
        if (pending != null) {
            return pending;
        }
        try {
            Optional<SessionEntry> loaded = persistence.load(key);
            return loaded.orElseGet(SessionEntry::empty);
        } catch (IOException e) {
            log.warn("Failed to read session {}: {}", key, e.getMessage());
            SessionEntry known = lastKnown.getIfPresent(key);
            return known != null ? known : SessionEntry.empty();
        }
    }

    /**
     * Snapshot of all persisted entries (plus unsaved in-memory ones).
     */
    public Map<String, SessionEntry> snapshot() {
        Map<String, SessionEntry> all = new ConcurrentHashMap<>();
        try {
            all.putAll(persistence.loadAll());
        } catch (IOException e) {
            log.warn("Failed to read session store: {}", e.getMessage());
            all.putAll(lastKnown.asMap());
        }
        all.putAll(unsaved);
        return all;
    }

    // ── Update ──────────────────────────────────────────────────────────

    /**
     * Apply {@code mutator} to the current entry and persist the result.
     *
     * @return the new entry
     * @throws SessionStoreException if persisting failed; the new entry is kept
     *                               in memory and carried by the exception
     */
    public SessionEntry update(String sessionKey, UnaryOperator<SessionEntry> mutator)
            throws SessionStoreException {
        String key = SessionKeys.normalize(sessionKey);
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            SessionEntry current = get(key);
            SessionEntry mutated = mutator.apply(current);
            if (mutated == null) {
                mutated = SessionEntry.empty();
            }
            SessionEntry next = mutated.toBuilder().updatedAt(clock.getAsLong()).build();
            try {
                persistence.save(key, next);
                unsaved.remove(key);
                lastKnown.put(key, next);
            } catch (IOException e) {
                unsaved.put(key, next);
                lastKnown.invalidate(key);
                log.warn("Failed to persist session {}: {}", key, e.getMessage());
                throw new SessionStoreException(key, next, e);
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    long lastKnownCount() {
        lastKnown.cleanUp();
        return lastKnown.estimatedSize();
    }

    int unsavedCount() {
        return unsaved.size();
    }
}
