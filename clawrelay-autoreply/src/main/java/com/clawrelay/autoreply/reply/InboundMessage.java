package com.clawrelay.autoreply.reply;

/**
 * A message received from a chat transport.
 *
 * @param sessionKey conversation the message belongs to
 * @param text       raw message text, directives included
 * @param sender     sender identity as the transport reports it
 * @param transport  transport id, for example {@code whatsapp}
 * @param messageId  transport message id, used for reply threading
 */
public record InboundMessage(String sessionKey, String text, String sender, String transport, String messageId) {

    public InboundMessage {
        text = text != null ? text : "";
    }
}
