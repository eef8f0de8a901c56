package com.clawrelay.agent.invoke;

/**
 * Turns one agent kind's stdout into texts and run metadata. The rest of the
 * relay only ever sees {@link ParsedAgentOutput}.
 */
public interface AgentOutputParser {

    /**
     * @throws AgentInvocationException with {@code PARSE} when the output is
     *                                  not in the expected shape
     */
    ParsedAgentOutput parse(String raw) throws AgentInvocationException;

    /**
     * Tool result carried by a single stdout line, or null. Called as lines
     * arrive so results can be relayed while the run is still going.
     */
    default String toolResult(String line) {
        return null;
    }
}
