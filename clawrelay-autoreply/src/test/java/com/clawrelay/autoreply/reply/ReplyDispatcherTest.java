package com.clawrelay.autoreply.reply;

import com.clawrelay.agent.invoke.AgentInvocationException;
import com.clawrelay.agent.invoke.AgentInvocationRequest;
import com.clawrelay.agent.invoke.AgentInvocationResult;
import com.clawrelay.agent.invoke.AgentInvoker;
import com.clawrelay.agent.invoke.AgentRun;
import com.clawrelay.agent.models.AuthProfileStore;
import com.clawrelay.agent.models.ModelCatalogService;
import com.clawrelay.agent.runtime.RunCoordinator;
import com.clawrelay.agent.runtime.RunOutcome;
import com.clawrelay.agent.runtime.RunRequest;
import com.clawrelay.autoreply.ManualScheduler;
import com.clawrelay.autoreply.RelayConfigs;
import com.clawrelay.autoreply.directive.DirectiveEngine;
import com.clawrelay.autoreply.queue.QueueEngine;
import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.infra.SystemEvents;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.session.InMemorySessionPersistence;
import com.clawrelay.common.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ReplyDispatcherTest {

    private static final String KEY = "agent:main:telegram:42";
    private static final String SENDER = "+15550001";

    private record Delivery(String sessionKey, ReplyPayload payload) {
    }

    /** Agent whose runs are finished by the test. */
    private static class ScriptedAgent implements AgentInvoker {

        final List<AgentInvocationRequest> requests = new ArrayList<>();
        final List<CompletableFuture<AgentInvocationResult>> results = new ArrayList<>();

        @Override
        public AgentRun start(AgentInvocationRequest request) {
            requests.add(request);
            CompletableFuture<AgentInvocationResult> result = new CompletableFuture<>();
            results.add(result);
            return new AgentRun() {
                @Override
                public CompletableFuture<AgentInvocationResult> result() {
                    return result;
                }

                @Override
                public void cancel() {
                    result.completeExceptionally(
                            new AgentInvocationException(AgentInvocationException.Reason.ABORTED, "cancelled"));
                }
            };
        }

        void reply(int index, String... payloads) {
            results.get(index).complete(AgentInvocationResult.builder()
                    .payloads(List.of(payloads))
                    .meta(new AgentInvocationResult.Meta("agent-session-1", 10, null))
                    .build());
        }

        void toolResult(int index, String text) {
            AgentInvocationRequest request = requests.get(index);
            if (request.getLiveFlags().shouldEmitToolResult()) {
                request.getToolResultListener().accept(text);
            }
        }
    }

    /** Coordinator whose lane is taken by outside runs for the first few attempts. */
    private static class ContestedCoordinator extends RunCoordinator {

        int busyAttempts;
        boolean waitTimesOut;
        int runCalls;
        int waits;

        ContestedCoordinator(SessionStore store, RelayConfig cfg, AgentInvoker invoker) {
            super(store, () -> cfg, new ModelCatalogService(), AuthProfileStore.empty(), invoker, new SystemEvents());
        }

        @Override
        public CompletableFuture<RunOutcome> run(RunRequest request) {
            runCalls++;
            if (busyAttempts > 0) {
                busyAttempts--;
                return CompletableFuture.completedFuture(RunOutcome.builder()
                        .status(RunOutcome.Status.BUSY)
                        .error("A run is already active for this session.")
                        .build());
            }
            return super.run(request);
        }

        @Override
        public CompletableFuture<Boolean> waitForRunEnd(String sessionKey, long timeoutMs) {
            waits++;
            return CompletableFuture.completedFuture(!waitTimesOut);
        }
    }

    private RelayConfig cfg;
    private SessionStore store;
    private ScriptedAgent agent;
    private RunCoordinator coordinator;
    private ManualScheduler scheduler;
    private List<Delivery> delivered;
    private ReplyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        cfg = RelayConfigs.defaultModel("anthropic/claude-opus-4-5")
                .allow("anthropic/claude-opus-4-5", "Opus")
                .allow("openai/gpt-4.1-mini", null)
                .queue("followup", null, null, null)
                .build();
        store = new SessionStore(new InMemorySessionPersistence());
        SystemEvents events = new SystemEvents();
        ModelCatalogService catalog = new ModelCatalogService();
        agent = new ScriptedAgent();
        coordinator = new RunCoordinator(store, () -> cfg, catalog, AuthProfileStore.empty(), agent, events);
        scheduler = new ManualScheduler();
        delivered = new ArrayList<>();
        DirectiveEngine directives = new DirectiveEngine(store, () -> cfg, catalog, AuthProfileStore.empty(), events);
        dispatcher = new ReplyDispatcher(directives, coordinator, store, () -> cfg, scheduler,
                (key, payload) -> delivered.add(new Delivery(key, payload)));
    }

    private QueueEngine.Disposition inbound(String text, String messageId) {
        return dispatcher.onInbound(new InboundMessage(KEY, text, SENDER, "telegram", messageId));
    }

    private List<String> texts() {
        return delivered.stream().map(d -> d.payload().text()).toList();
    }

    @Test
    void directiveOnlyMessage_isAcknowledged_withoutRunningAgent() {
        assertNull(inbound("/think high", "m-1"));

        assertEquals(List.of("⚙️ Thinking level set to high."), texts());
        assertTrue(agent.requests.isEmpty());
        assertEquals(ThinkLevel.HIGH, store.get(KEY).getThinkingLevel());
    }

    @Test
    void text_runsAgent_andShapedReplyIsDelivered() {
        assertEquals(QueueEngine.Disposition.DISPATCHED, inbound("hello", "m-1"));
        assertEquals("hello", agent.requests.get(0).getPrompt());

        agent.reply(0, "[[reply_to_current]] Hi there!", "MEDIA: /tmp/wave.gif");

        assertEquals(List.of(
                new Delivery(KEY, new ReplyPayload("Hi there!", null, "m-1")),
                new Delivery(KEY, new ReplyPayload(null, "/tmp/wave.gif", null))), delivered);
        assertFalse(coordinator.isActive(KEY));
        assertEquals("agent-session-1", store.get(KEY).getSessionId());
    }

    @Test
    void directivesAndText_ackFirst_thenRunWithNewSettings() {
        inbound("/model openai/gpt-4.1-mini\nwhat model are you?", "m-1");

        assertEquals(List.of("Model set to openai/gpt-4.1-mini."), texts());
        AgentInvocationRequest request = agent.requests.get(0);
        assertEquals("openai", request.getProvider());
        assertEquals("gpt-4.1-mini", request.getModel());
        assertEquals("System: Model switched to openai/gpt-4.1-mini.\n\nwhat model are you?", request.getPrompt());
    }

    @Test
    void inlineLevel_reachesTheRunOnly() {
        inbound("summarize this /think:high", "m-1");

        assertEquals("summarize this", agent.requests.get(0).getPrompt());
        assertEquals(ThinkLevel.HIGH, agent.requests.get(0).getThinkLevel());
        assertNull(store.get(KEY).getThinkingLevel());
    }

    @Test
    void failedRun_isReported() {
        inbound("hello", "m-1");

        agent.results.get(0).completeExceptionally(
                new AgentInvocationException(AgentInvocationException.Reason.EXIT, "agent exited with code 1"));

        assertEquals(List.of("⚠️ Agent run failed: agent exited with code 1"), texts());
        assertFalse(coordinator.isActive(KEY));
    }

    @Test
    void toolResults_flowOnlyWhenVerbose() {
        inbound("check the build", "m-1");
        agent.toolResult(0, "quiet tool output");
        agent.reply(0, "done");

        inbound("/verbose on", "m-2");
        inbound("check again", "m-3");
        agent.toolResult(1, "loud tool output");
        agent.reply(1, "done again");

        assertEquals(List.of("done", "⚙️ Verbose logging enabled.", "loud tool output", "done again"), texts());
    }

    @Test
    void messagesWhileBusy_runAfterTheCurrentTurn() {
        inbound("first", "m-1");
        assertEquals(QueueEngine.Disposition.FOLLOWUP, inbound("second", "m-2"));
        assertEquals(1, agent.requests.size());

        agent.reply(0, "one");

        assertEquals(2, agent.requests.size());
        assertEquals("second", agent.requests.get(1).getPrompt());
        agent.reply(1, "[[reply_to_current]] two");
        assertEquals(new ReplyPayload("two", null, "m-2"), delivered.get(1).payload());
    }

    @Test
    void collectMode_batchesUntilDebounceElapses() {
        inbound("/queue collect debounce:500ms", "m-0");
        inbound("part one", "m-1");
        inbound("part two", "m-2");
        assertTrue(agent.requests.isEmpty());

        scheduler.advance(500);

        assertEquals(1, agent.requests.size());
        assertEquals("[Queued messages while agent was busy]\n---\nQueued #1\npart one\n---\nQueued #2\npart two",
                agent.requests.get(0).getPrompt());
    }

    @Test
    void runStartedElsewhere_isWaitedFor() {
        CompletableFuture<RunOutcome> foreign = coordinator.run(RunRequest.builder()
                .sessionKey(KEY)
                .prompt("heartbeat")
                .sender(SENDER)
                .transport("telegram")
                .build());

        assertEquals(QueueEngine.Disposition.FOLLOWUP, inbound("are you there?", "m-1"));
        assertEquals(1, agent.requests.size());

        agent.reply(0, "HEARTBEAT_OK");

        assertTrue(foreign.isDone());
        assertEquals(2, agent.requests.size());
        assertEquals("are you there?", agent.requests.get(1).getPrompt());
    }

    @Test
    void sinkFailure_doesNotBreakTheQueue() {
        ReplyDispatcher failing = new ReplyDispatcher(
                new DirectiveEngine(store, () -> cfg, new ModelCatalogService(), AuthProfileStore.empty(), new SystemEvents()),
                coordinator, store, () -> cfg, scheduler, (key, payload) -> {
                    throw new IllegalStateException("transport down");
                });

        failing.onInbound(new InboundMessage(KEY, "a", SENDER, "telegram", "m-1"));
        failing.onInbound(new InboundMessage(KEY, "b", SENDER, "telegram", "m-2"));
        agent.reply(0, "reply a");

        assertEquals(2, agent.requests.size());
    }

    @Test
    void laneTakenRepeatedlyByOtherRuns_turnStillRuns() {
        ContestedCoordinator contested = new ContestedCoordinator(store, cfg, agent);
        contested.busyAttempts = 3;
        ReplyDispatcher retrying = new ReplyDispatcher(
                new DirectiveEngine(store, () -> cfg, new ModelCatalogService(), AuthProfileStore.empty(),
                        new SystemEvents()),
                contested, store, () -> cfg, scheduler, (key, payload) -> delivered.add(new Delivery(key, payload)));

        retrying.onInbound(new InboundMessage(KEY, "hello", SENDER, "telegram", "m-1"));

        assertEquals(4, contested.runCalls);
        assertEquals(3, contested.waits);
        assertEquals(1, agent.requests.size());
        agent.reply(0, "hi");
        assertEquals(List.of("hi"), texts());
    }

    @Test
    void laneNeverFrees_userIsTold() {
        ContestedCoordinator contested = new ContestedCoordinator(store, cfg, agent);
        contested.busyAttempts = 1;
        contested.waitTimesOut = true;
        ReplyDispatcher retrying = new ReplyDispatcher(
                new DirectiveEngine(store, () -> cfg, new ModelCatalogService(), AuthProfileStore.empty(),
                        new SystemEvents()),
                contested, store, () -> cfg, scheduler, (key, payload) -> delivered.add(new Delivery(key, payload)));

        retrying.onInbound(new InboundMessage(KEY, "hello", SENDER, "telegram", "m-1"));

        assertTrue(agent.requests.isEmpty());
        assertEquals(List.of(ReplyDispatcher.BUSY_NOTICE), texts());
    }
}
