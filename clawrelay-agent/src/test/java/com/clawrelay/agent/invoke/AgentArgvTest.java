package com.clawrelay.agent.invoke;

import com.clawrelay.common.model.ThinkLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentArgvTest {

    private static AgentInvocationRequest.AgentInvocationRequestBuilder request() {
        return AgentInvocationRequest.builder().sessionKey("main").prompt("hi");
    }

    @Test
    void defaultClaudeCommand_getsFormatModelAndResumeBeforeBody() {
        List<String> argv = AgentArgv.build(AgentKind.CLAUDE, List.of(),
                request().provider("anthropic").model("claude-opus-4-5").resumeSessionId("s-1").build());

        assertEquals(List.of("claude", "-p", "--output-format", "json", "--model", "claude-opus-4-5",
                "--resume", "s-1", "hi"), argv);
    }

    @Test
    void opencode_passesProviderQualifiedModel() {
        List<String> argv = AgentArgv.build(AgentKind.OPENCODE, null,
                request().provider("openai").model("gpt-4.1").build());

        assertEquals(List.of("opencode", "run", "--format", "json", "--model", "openai/gpt-4.1", "hi"), argv);
    }

    @Test
    void templatePlaceholders_areSubstitutedAndSuppressInsertedFlags() {
        List<String> template = List.of("my-agent", "--llm={{Provider}}:{{Model}}", "--think", "{{Think}}",
                "--conv", "{{SessionId}}", "{{Body}}", "--trailing");

        List<String> argv = AgentArgv.build(AgentKind.GEMINI, template,
                request().provider("google").model("gemini-2.5-pro").thinkLevel(ThinkLevel.HIGH)
                        .resumeSessionId("c-9").build());

        assertEquals(List.of("my-agent", "--llm=google:gemini-2.5-pro", "--think", "high", "--conv", "c-9", "hi",
                "--trailing"), argv);
    }

    @Test
    void placeholderTextInsidePrompt_isLeftAlone() {
        List<String> argv = AgentArgv.build(AgentKind.GEMINI, List.of("gemini", "-p", "{{Body}}"),
                request().prompt("print {{Model}}").build());

        assertEquals("print {{Model}}", argv.get(argv.size() - 1));
    }

    @Test
    void existingFormatFlag_isNotDuplicated() {
        List<String> argv = AgentArgv.build(AgentKind.CLAUDE,
                List.of("claude", "--output-format=json", "-p", "{{Body}}"), request().build());

        assertEquals(List.of("claude", "--output-format=json", "-p", "hi"), argv);
    }

    @Test
    void templateWithoutBody_appendsPrompt() {
        assertEquals(List.of("codex", "exec", "hi"),
                AgentArgv.build(AgentKind.CODEX, List.of("codex", "exec"), request().build()));
    }

    @Test
    void fromId_isCaseInsensitive() {
        assertEquals(AgentKind.OPENCODE, AgentKind.fromId(" OpenCode "));
        assertNull(AgentKind.fromId("vim"));
    }
}
