package com.clawrelay.agent.invoke;

import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

/**
 * Everything an {@link AgentInvoker} needs to run one turn.
 */
@Value
@Builder
public class AgentInvocationRequest {
    String sessionKey;
    String provider;
    String model;
    /** Auth profile pinned for this session, or null. */
    String authProfile;
    @Builder.Default
    ThinkLevel thinkLevel = ThinkLevel.OFF;
    @Builder.Default
    ReasoningLevel reasoningLevel = ReasoningLevel.OFF;
    boolean elevated;
    String prompt;
    /** Agent-side conversation to resume, or null for a fresh one. */
    String resumeSessionId;
    @Builder.Default
    LiveFlags liveFlags = LiveFlags.fixed(false, false);
    /** Receives tool results while the run is going; may be null. */
    Consumer<String> toolResultListener;
}
