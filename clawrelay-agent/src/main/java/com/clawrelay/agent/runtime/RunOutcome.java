package com.clawrelay.agent.runtime;

import com.clawrelay.agent.invoke.AgentInvocationException;
import com.clawrelay.agent.invoke.AgentUsage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a run produced. Failed, busy and aborted outcomes never carry
 * payloads.
 */
@Value
@Builder(toBuilder = true)
public class RunOutcome {

    public enum Status {
        OK,
        FAILED,
        /** Another run holds the session's lane. */
        BUSY,
        ABORTED
    }

    Status status;
    @Singular
    List<String> payloads;
    /** Agent session id after the run (the previous one when the run failed). */
    String sessionId;
    Long durationMs;
    AgentUsage usage;
    String error;
    AgentInvocationException.Reason failureReason;
    /** User-facing notices, for example a refused elevated request. */
    @Singular
    List<String> notices;
    /** Set when the new agent session id could not be persisted. */
    String persistenceWarning;

    public boolean isOk() {
        return status == Status.OK;
    }

    static RunOutcome busy(String sessionId) {
        return RunOutcome.builder()
                .status(Status.BUSY)
                .sessionId(sessionId)
                .error("A run is already active for this session.")
                .build();
    }
}
