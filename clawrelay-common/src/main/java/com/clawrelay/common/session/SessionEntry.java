package com.clawrelay.common.session;

import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Persisted per-session state, one per session key in {@code sessions.json}.
 *
 * <p>
 * Every field is optional. {@code null} always means "unset, use the
 * configured default"; an explicit {@code OFF} level is a stored choice and is
 * never collapsed into unset. Instances are immutable; mutate through
 * {@link #toBuilder()}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionEntry {

    private static final SessionEntry EMPTY = SessionEntry.builder().build();

    /** Agent-side conversation handle, forwarded on resume. */
    String sessionId;
    /** Epoch millis of the last mutation. */
    Long updatedAt;

    String modelOverride;
    String providerOverride;
    String authProfileOverride;

    ThinkLevel thinkingLevel;
    VerboseLevel verboseLevel;
    ElevatedLevel elevatedLevel;
    ReasoningLevel reasoningLevel;

    QueueMode queueMode;
    Integer queueDebounceMs;
    Integer queueCap;
    QueueDropPolicy queueDrop;

    public static SessionEntry empty() {
        return EMPTY;
    }

    public boolean hasModelOverride() {
        return modelOverride != null && !modelOverride.isBlank();
    }

    /** Copy with the model, provider and auth-profile overrides removed. */
    public SessionEntry withoutModelOverride() {
        return toBuilder().modelOverride(null).providerOverride(null).authProfileOverride(null).build();
    }

    /** Copy with all four queue fields unset. */
    public SessionEntry withoutQueueSettings() {
        return toBuilder().queueMode(null).queueDebounceMs(null).queueCap(null).queueDrop(null).build();
    }
}
