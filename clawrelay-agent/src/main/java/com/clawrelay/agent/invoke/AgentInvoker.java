package com.clawrelay.agent.invoke;

/**
 * Starts agent turns.
 */
public interface AgentInvoker {

    /**
     * @throws AgentInvocationException with {@code LAUNCH} when the agent could
     *                                  not be started
     */
    AgentRun start(AgentInvocationRequest request) throws AgentInvocationException;
}
