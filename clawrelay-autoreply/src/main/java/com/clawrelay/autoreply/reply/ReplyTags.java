package com.clawrelay.autoreply.reply;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw agent text into a {@link ReplyPayload}: reply-threading tags and
 * the first {@code MEDIA:} line are lifted out of the text.
 */
public final class ReplyTags {

    private static final Pattern REPLY_TO_CURRENT_RE = Pattern.compile("[ \\t]*\\[\\[\\s*reply_to_current\\s*\\]\\]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REPLY_TO_RE = Pattern.compile(
            "[ \\t]*\\[\\[\\s*reply_to\\s*:\\s*([^\\]\\n]+?)\\s*\\]\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEDIA_LINE_RE = Pattern.compile("^[ \\t]*MEDIA:[ \\t]*(\\S+)[ \\t]*$",
            Pattern.MULTILINE);

    private ReplyTags() {
    }

    /**
     * Shape agent output into a payload.
     *
     * @param raw              agent text
     * @param currentMessageId id of the inbound message the turn answers
     * @return the payload, or null when nothing is left to send
     */
    public static ReplyPayload shape(String raw, String currentMessageId) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw;

        String replyToId = null;
        boolean replyToCurrent = false;
        Matcher explicit = REPLY_TO_RE.matcher(text);
        while (explicit.find()) {
            String id = explicit.group(1).trim();
            if ("current".equalsIgnoreCase(id)) {
                replyToCurrent = true;
            } else if (replyToId == null && !id.isEmpty()) {
                replyToId = id;
            }
        }
        text = REPLY_TO_RE.matcher(text).replaceAll("");
        if (REPLY_TO_CURRENT_RE.matcher(text).find()) {
            replyToCurrent = true;
            text = REPLY_TO_CURRENT_RE.matcher(text).replaceAll("");
        }
        if (replyToId == null && replyToCurrent && currentMessageId != null && !currentMessageId.isBlank()) {
            replyToId = currentMessageId.trim();
        }

        String mediaRef = null;
        Matcher media = MEDIA_LINE_RE.matcher(text);
        if (media.find()) {
            mediaRef = media.group(1);
            text = text.substring(0, media.start()) + text.substring(media.end());
        }

        String cleaned = tidy(text);
        ReplyPayload payload = new ReplyPayload(cleaned.isEmpty() ? null : cleaned, mediaRef, replyToId);
        return payload.isEmpty() ? null : payload;
    }

    private static String tidy(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : text.split("\\R", -1)) {
            out.append(line.stripTrailing()).append('\n');
        }
        return out.toString().replaceAll("\\n{3,}", "\n\n").strip();
    }
}
