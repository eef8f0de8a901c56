package com.clawrelay.agent.invoke;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the argv for one invocation from a command template.
 *
 * <p>
 * Placeholders {@code {{Body}}}, {@code {{Model}}}, {@code {{Provider}}},
 * {@code {{Think}}} and {@code {{SessionId}}} are substituted in every
 * element. Kind-specific output, model and resume flags are inserted before
 * the body unless the template already carries them.
 * </p>
 */
public final class AgentArgv {

    static final String BODY = "{{Body}}";

    private AgentArgv() {
    }

    public static List<String> build(AgentKind kind, List<String> template, AgentInvocationRequest request) {
        List<String> source = template == null || template.isEmpty() ? kind.defaultCommand() : template;
        int bodyIndex = -1;
        for (int i = 0; i < source.size(); i++) {
            if (source.get(i).contains(BODY)) {
                bodyIndex = i;
                break;
            }
        }
        List<String> before = new ArrayList<>(bodyIndex >= 0 ? source.subList(0, bodyIndex) : source);
        String body = bodyIndex >= 0 ? source.get(bodyIndex) : BODY;
        List<String> after = bodyIndex >= 0 ? source.subList(bodyIndex + 1, source.size()) : List.of();

        List<String> formatArgs = kind.formatArgs();
        if (!formatArgs.isEmpty() && !hasFlag(source, formatArgs.get(0))) {
            before.addAll(formatArgs);
        }
        if (request.getModel() != null && !mentions(source, "{{Model}}") && !hasFlag(source, "--model")) {
            before.addAll(kind.modelArgs(request.getProvider(), request.getModel()));
        }
        String sessionId = request.getResumeSessionId();
        if (sessionId != null && !sessionId.isBlank() && !mentions(source, "{{SessionId}}")) {
            before.addAll(kind.resumeArgs(sessionId));
        }

        List<String> argv = new ArrayList<>();
        for (String part : before) {
            argv.add(substitute(part, request));
        }
        argv.add(substitute(body, request));
        for (String part : after) {
            argv.add(substitute(part, request));
        }
        return argv;
    }

    static String substitute(String part, AgentInvocationRequest request) {
        // body last, so placeholder-like text in the prompt is left alone
        return part
                .replace("{{Model}}", nullToEmpty(request.getModel()))
                .replace("{{Provider}}", nullToEmpty(request.getProvider()))
                .replace("{{Think}}", request.getThinkLevel() != null ? request.getThinkLevel().value() : "off")
                .replace("{{SessionId}}", nullToEmpty(request.getResumeSessionId()))
                .replace(BODY, nullToEmpty(request.getPrompt()));
    }

    private static boolean hasFlag(List<String> argv, String flag) {
        for (String part : argv) {
            if (part.equals(flag) || part.startsWith(flag + "=")) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentions(List<String> argv, String placeholder) {
        for (String part : argv) {
            if (part.contains(placeholder)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
