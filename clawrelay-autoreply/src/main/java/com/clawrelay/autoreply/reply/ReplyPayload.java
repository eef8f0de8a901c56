package com.clawrelay.autoreply.reply;

/**
 * One outbound message. Every field is optional; a payload with neither text
 * nor media is never delivered.
 */
public record ReplyPayload(String text, String mediaRef, String replyToId) {

    public static ReplyPayload text(String text) {
        return new ReplyPayload(text, null, null);
    }

    public boolean isEmpty() {
        return (text == null || text.isBlank()) && (mediaRef == null || mediaRef.isBlank());
    }
}
