package com.clawrelay.autoreply.queue;

import java.util.List;

/**
 * Prompt layout for collect batches.
 */
public final class CollectPrompt {

    static final String HEADER = "[Queued messages while agent was busy]";
    static final int SUMMARY_LINE_MAX = 160;

    private CollectPrompt() {
    }

    /** Combined prompt; a lone entry is sent as-is. */
    public static String build(List<String> entries) {
        if (entries.size() == 1) {
            return entries.get(0);
        }
        StringBuilder sb = new StringBuilder(HEADER);
        for (int i = 0; i < entries.size(); i++) {
            sb.append("\n---\nQueued #").append(i + 1).append('\n').append(entries.get(i).trim());
        }
        return sb.toString();
    }

    /** {@code [Summary of K queued messages]} plus one bullet per line. */
    public static String summary(List<String> lines) {
        StringBuilder sb = new StringBuilder("[Summary of ").append(lines.size()).append(" queued messages]");
        for (String line : lines) {
            sb.append("\n- ").append(line);
        }
        return sb.toString();
    }

    /** First non-blank line, trimmed and cut to {@value #SUMMARY_LINE_MAX} chars. */
    public static String summaryLine(String text) {
        String line = "";
        for (String candidate : (text != null ? text : "").split("\\R")) {
            if (!candidate.isBlank()) {
                line = candidate.trim();
                break;
            }
        }
        if (line.length() > SUMMARY_LINE_MAX) {
            line = line.substring(0, SUMMARY_LINE_MAX - 1).trim() + "…";
        }
        return line;
    }
}
