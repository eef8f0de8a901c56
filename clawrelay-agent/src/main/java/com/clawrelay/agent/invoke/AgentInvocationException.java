package com.clawrelay.agent.invoke;

import lombok.Getter;

/**
 * An agent invocation that did not produce a usable result.
 */
@Getter
public class AgentInvocationException extends Exception {

    public enum Reason {
        /** The process could not be started. */
        LAUNCH,
        /** The process outlived its timeout and was killed. */
        TIMEOUT,
        /** The process exited non-zero or reported an error. */
        EXIT,
        /** The output could not be understood. */
        PARSE,
        /** The run was aborted by the caller. */
        ABORTED
    }

    private final Reason reason;

    public AgentInvocationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AgentInvocationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
