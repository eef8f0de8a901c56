package com.clawrelay.autoreply.queue;

import com.clawrelay.autoreply.directive.InlineLevels;

/**
 * One agent turn produced by the queue: the prompt plus routing taken from
 * the latest message that went into it.
 */
public record QueuedTurn(String sessionKey, String prompt, String sender, String transport, String messageId,
        InlineLevels levels, int messageCount) {

    static QueuedTurn single(String sessionKey, QueuedMessage msg) {
        return new QueuedTurn(sessionKey, msg.text(), msg.sender(), msg.transport(), msg.messageId(),
                msg.levels(), 1);
    }
}
