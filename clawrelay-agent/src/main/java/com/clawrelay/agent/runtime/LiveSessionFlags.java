package com.clawrelay.agent.runtime;

import com.clawrelay.agent.invoke.LiveFlags;
import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.VerboseLevel;
import com.clawrelay.common.session.SessionEntry;
import com.clawrelay.common.session.SessionStore;

import java.util.function.Supplier;

/**
 * Live view of a session's verbose and elevated flags for an in-flight run.
 * Every call re-reads the store, so {@code /verbose} or {@code /elevated}
 * sent mid-run takes effect at the run's next decision point.
 */
public class LiveSessionFlags implements LiveFlags {

    private final SessionStore store;
    private final String sessionKey;
    private final Supplier<RelayConfig> config;
    private final VerboseLevel turnVerbose;
    private final ElevatedLevel turnElevated;
    private final boolean elevatedApproved;

    public LiveSessionFlags(SessionStore store, String sessionKey, Supplier<RelayConfig> config,
            VerboseLevel turnVerbose, ElevatedLevel turnElevated, boolean elevatedApproved) {
        this.store = store;
        this.sessionKey = sessionKey;
        this.config = config;
        this.turnVerbose = turnVerbose;
        this.turnElevated = turnElevated;
        this.elevatedApproved = elevatedApproved;
    }

    @Override
    public boolean isVerbose() {
        SessionEntry entry = store.get(sessionKey);
        return EffectiveSettings.verbose(entry, turnVerbose, config.get()).isOn();
    }

    @Override
    public boolean isElevated() {
        SessionEntry entry = store.get(sessionKey);
        return EffectiveSettings.elevated(entry, turnElevated, config.get(), elevatedApproved).isOn();
    }

    public String getSessionKey() {
        return sessionKey;
    }
}
