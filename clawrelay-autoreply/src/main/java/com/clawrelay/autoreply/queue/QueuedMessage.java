package com.clawrelay.autoreply.queue;

import com.clawrelay.autoreply.directive.InlineLevels;

/**
 * A message waiting to become (part of) an agent turn. {@code text} is the
 * residual text after directives were removed.
 */
public record QueuedMessage(String text, String sender, String transport, String messageId, InlineLevels levels) {

    public QueuedMessage {
        text = text != null ? text.trim() : "";
        levels = levels != null ? levels : InlineLevels.none();
    }
}
