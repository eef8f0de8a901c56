package com.clawrelay.agent.invoke;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for an agent invocation in progress.
 */
public interface AgentRun {

    /**
     * Completes with the result, or exceptionally with an
     * {@link AgentInvocationException}.
     */
    CompletableFuture<AgentInvocationResult> result();

    /** Whether {@link #steer(String)} can reach the running agent. */
    default boolean supportsSteering() {
        return false;
    }

    /**
     * Deliver a message into the running agent's live input.
     *
     * @return true if delivered
     */
    default boolean steer(String text) {
        return false;
    }

    /** Kill the run. The result completes with {@code ABORTED}. */
    void cancel();
}
