package com.clawrelay.autoreply.reply;

/**
 * Outbound side of a chat transport.
 */
@FunctionalInterface
public interface ReplySink {

    void deliver(String sessionKey, ReplyPayload payload);
}
