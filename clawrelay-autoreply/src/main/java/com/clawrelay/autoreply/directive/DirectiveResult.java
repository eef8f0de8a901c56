package com.clawrelay.autoreply.directive;

import java.util.List;

/**
 * Outcome of directive processing for one inbound message.
 *
 * @param acks     acknowledgement and error lines, in directive order
 * @param residual text left for an agent turn (may be empty)
 * @param inline   one-turn level overrides found in the residual text
 */
public record DirectiveResult(List<String> acks, String residual, InlineLevels inline) {

    public boolean hasAcks() {
        return !acks.isEmpty();
    }

    public String ackText() {
        return String.join("\n", acks);
    }

    public boolean shouldRunAgent() {
        return residual != null && !residual.isBlank();
    }
}
