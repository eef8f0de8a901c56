package com.clawrelay.agent.invoke;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Reply texts and metadata of a completed invocation.
 */
@Value
@Builder
public class AgentInvocationResult {

    @Singular
    List<String> payloads;
    Meta meta;

    public record Meta(String sessionId, long durationMs, AgentUsage usage) {
    }
}
