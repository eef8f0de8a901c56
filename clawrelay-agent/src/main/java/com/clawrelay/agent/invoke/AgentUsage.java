package com.clawrelay.agent.invoke;

/**
 * Token and cost accounting reported by an agent, when it reports any.
 */
public record AgentUsage(Long inputTokens, Long outputTokens, Double costUsd) {
}
