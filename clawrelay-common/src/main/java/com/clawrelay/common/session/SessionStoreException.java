package com.clawrelay.common.session;

import lombok.Getter;

/**
 * Raised when a session entry could not be persisted. The entry that failed to
 * persist is still held in memory and is returned here so callers can keep
 * working with it.
 */
@Getter
public class SessionStoreException extends Exception {

    private final String sessionKey;
    private final transient SessionEntry entry;

    public SessionStoreException(String sessionKey, SessionEntry entry, Throwable cause) {
        super("Failed to persist session " + sessionKey + ": " + cause.getMessage(), cause);
        this.sessionKey = sessionKey;
        this.entry = entry;
    }
}
