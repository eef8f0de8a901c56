package com.clawrelay.autoreply.directive;

import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an inbound message into directive lines, residual text and inline
 * one-turn level overrides.
 *
 * <p>
 * A line is a directive when it starts with {@code /<command>} and its
 * arguments fit the command (level commands and {@code /model} take at most
 * one token). Anything else is free text, from which inline level directives
 * such as {@code /think:high} are stripped.
 * </p>
 */
public final class DirectiveParser {

    /** Recognized commands. */
    public enum Command {
        MODEL,
        MODELS,
        THINK,
        VERBOSE,
        ELEVATED,
        REASONING,
        QUEUE,
        STATUS,
        HELP
    }

    /** One directive, with its argument text (possibly empty). */
    public record Directive(Command command, String args) {
    }

    /** Result of splitting a message. */
    public record Parsed(List<Directive> directives, String residual, InlineLevels inline) {
    }

    private static final Map<String, Command> COMMANDS = new LinkedHashMap<>();

    static {
        COMMANDS.put("model", Command.MODEL);
        COMMANDS.put("models", Command.MODELS);
        COMMANDS.put("think", Command.THINK);
        COMMANDS.put("thinking", Command.THINK);
        COMMANDS.put("t", Command.THINK);
        COMMANDS.put("verbose", Command.VERBOSE);
        COMMANDS.put("v", Command.VERBOSE);
        COMMANDS.put("elevated", Command.ELEVATED);
        COMMANDS.put("elev", Command.ELEVATED);
        COMMANDS.put("reasoning", Command.REASONING);
        COMMANDS.put("reason", Command.REASONING);
        COMMANDS.put("queue", Command.QUEUE);
        COMMANDS.put("status", Command.STATUS);
        COMMANDS.put("help", Command.HELP);
    }

    private static final Pattern INLINE_LEVEL_RE = Pattern.compile(
            "(^|\\s)/(thinking|think|t|verbose|v|elevated|elev|reasoning|reason)(?::\\s*|\\s+)([A-Za-z0-9+_-]+)"
                    + "(?=$|\\s|[.,!?;])",
            Pattern.CASE_INSENSITIVE);

    private DirectiveParser() {
    }

    /** Command names that can never be used as {@code /<alias>} shortcuts. */
    public static boolean isReserved(String name) {
        return name != null && COMMANDS.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    public static Parsed parse(String text, Collection<String> modelAliases) {
        Map<String, String> aliasByLower = new LinkedHashMap<>();
        if (modelAliases != null) {
            for (String alias : modelAliases) {
                if (alias != null && !alias.isBlank() && !isReserved(alias)) {
                    aliasByLower.putIfAbsent(alias.trim().toLowerCase(Locale.ROOT), alias.trim());
                }
            }
        }

        List<Directive> directives = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        InlineLevels inline = InlineLevels.none();

        for (String rawLine : (text != null ? text : "").split("\\R", -1)) {
            String line = rawLine.trim();
            Directive directive = lineDirective(line, aliasByLower);
            if (directive != null) {
                directives.add(directive);
                continue;
            }
            List<Directive> found = new ArrayList<>();
            InlineLevels levels = InlineLevels.none();
            StringBuilder stripped = new StringBuilder();
            Matcher m = INLINE_LEVEL_RE.matcher(line);
            int last = 0;
            while (m.find()) {
                Command command = COMMANDS.get(m.group(2).toLowerCase(Locale.ROOT));
                InlineLevels next = applyLevel(levels, command, m.group(3));
                if (next == null) {
                    continue;
                }
                levels = next;
                found.add(new Directive(command, m.group(3)));
                stripped.append(line, last, m.start()).append(m.group(1));
                last = m.end();
            }
            stripped.append(line.substring(last));
            String residualLine = stripped.toString().replaceAll("[ \\t]{2,}", " ").trim();

            if (found.isEmpty()) {
                kept.add(line);
            } else if (residualLine.isEmpty()) {
                // a line made only of level directives is a set of regular directives
                directives.addAll(found);
            } else {
                inline = inline.merge(levels);
                kept.add(residualLine);
            }
        }
        return new Parsed(Collections.unmodifiableList(directives), joinResidual(kept), inline);
    }

    private static Directive lineDirective(String line, Map<String, String> aliasByLower) {
        if (!line.startsWith("/") || line.length() < 2) {
            return null;
        }
        int end = 1;
        while (end < line.length() && !Character.isWhitespace(line.charAt(end)) && line.charAt(end) != ':') {
            end++;
        }
        String name = line.substring(1, end).toLowerCase(Locale.ROOT);
        String args = line.substring(end).trim();
        if (args.startsWith(":")) {
            args = args.substring(1).trim();
        }
        int tokens = args.isEmpty() ? 0 : args.split("\\s+").length;

        Command command = COMMANDS.get(name);
        if (command == null) {
            String alias = aliasByLower.get(name);
            return alias != null && tokens == 0 ? new Directive(Command.MODEL, alias) : null;
        }
        return switch (command) {
            case QUEUE -> new Directive(command, args);
            case MODELS, STATUS, HELP -> tokens == 0 ? new Directive(command, "") : null;
            default -> tokens <= 1 ? new Directive(command, args) : null;
        };
    }

    /** Levels with {@code raw} applied, or null when it is not a valid level for the command. */
    private static InlineLevels applyLevel(InlineLevels levels, Command command, String raw) {
        switch (command) {
            case THINK -> {
                ThinkLevel level = ThinkLevel.normalize(raw);
                return level != null ? levels.withThink(level) : null;
            }
            case VERBOSE -> {
                VerboseLevel level = VerboseLevel.normalize(raw);
                return level != null ? levels.withVerbose(level) : null;
            }
            case ELEVATED -> {
                ElevatedLevel level = ElevatedLevel.normalize(raw);
                return level != null ? levels.withElevated(level) : null;
            }
            case REASONING -> {
                ReasoningLevel level = ReasoningLevel.normalize(raw);
                return level != null ? levels.withReasoning(level) : null;
            }
            default -> {
                return null;
            }
        }
    }

    private static String joinResidual(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isEmpty()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isEmpty()) {
            end--;
        }
        return String.join("\n", lines.subList(start, end));
    }
}
