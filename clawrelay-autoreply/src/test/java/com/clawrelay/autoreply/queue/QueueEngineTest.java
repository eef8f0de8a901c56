package com.clawrelay.autoreply.queue;

import com.clawrelay.autoreply.ManualScheduler;
import com.clawrelay.autoreply.directive.InlineLevels;
import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class QueueEngineTest {

    private static final String KEY = "agent:main:telegram:42";

    private ManualScheduler scheduler;
    private FakeLanes lanes;
    private List<QueuedTurn> turns;
    private List<CompletableFuture<Void>> running;
    private QueueEngine engine;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        lanes = new FakeLanes();
        turns = new ArrayList<>();
        running = new ArrayList<>();
        engine = new QueueEngine(lanes, scheduler, turn -> {
            turns.add(turn);
            CompletableFuture<Void> future = new CompletableFuture<>();
            running.add(future);
            return future;
        });
    }

    private static QueuedMessage msg(String text) {
        return new QueuedMessage(text, "+15550001", "telegram", "m-" + text, InlineLevels.none());
    }

    private static QueueSettings mode(QueueMode mode) {
        return new QueueSettings(mode, 1000, 20, QueueDropPolicy.SUMMARIZE);
    }

    private QueueEngine.Disposition send(String text, QueueSettings settings) {
        return engine.enqueue(KEY, msg(text), settings);
    }

    private void endTurn(int index) {
        running.get(index).complete(null);
    }

    private List<String> prompts() {
        return turns.stream().map(QueuedTurn::prompt).toList();
    }

    @Nested
    class Collect {

        @Test
        void arrivalsInsideDebounceWindow_becomeOneTurn() {
            assertEquals(QueueEngine.Disposition.COLLECTED, send("a", mode(QueueMode.COLLECT)));
            send("b", mode(QueueMode.COLLECT));

            scheduler.advance(999);
            assertTrue(turns.isEmpty());

            scheduler.advance(1);
            assertEquals(1, turns.size());
            assertEquals("[Queued messages while agent was busy]\n---\nQueued #1\na\n---\nQueued #2\nb",
                    turns.get(0).prompt());
            assertEquals(2, turns.get(0).messageCount());
            assertEquals("m-b", turns.get(0).messageId());
        }

        @Test
        void eachArrival_restartsTheTimer() {
            send("a", mode(QueueMode.COLLECT));
            scheduler.advance(800);
            send("b", mode(QueueMode.COLLECT));
            scheduler.advance(800);

            assertTrue(turns.isEmpty());

            scheduler.advance(200);
            assertEquals(1, turns.size());
        }

        @Test
        void loneMessage_isSentWithoutHeader() {
            send("just one", mode(QueueMode.COLLECT));
            scheduler.advance(1000);

            assertEquals(List.of("just one"), prompts());
        }

        @Test
        void reachingCap_flushesWithoutWaiting() {
            QueueSettings settings = new QueueSettings(QueueMode.COLLECT, 1000, 3, QueueDropPolicy.SUMMARIZE);
            send("a", settings);
            send("b", settings);
            send("c", settings);

            assertEquals(1, turns.size());
            assertEquals(3, turns.get(0).messageCount());
            assertEquals(0, scheduler.pending());
        }

        @Test
        void timerElapsingWhileBusy_flushesAtTurnEnd() {
            send("a", mode(QueueMode.COLLECT));
            scheduler.advance(1000);
            send("b", mode(QueueMode.COLLECT));
            scheduler.advance(1000);

            assertEquals(1, turns.size());

            endTurn(0);
            assertEquals(List.of("a", "b"), prompts());
        }

        @Test
        void batch_carriesLatestLevelsAndRouting() {
            engine.enqueue(KEY, new QueuedMessage("first", "+1", "telegram", "m-1",
                    new InlineLevels(ThinkLevel.HIGH, null, null, null)), mode(QueueMode.COLLECT));
            engine.enqueue(KEY, new QueuedMessage("second", "+2", "telegram", "m-2",
                    new InlineLevels(null, VerboseLevel.ON, null, null)), mode(QueueMode.COLLECT));
            scheduler.advance(1000);

            QueuedTurn turn = turns.get(0);
            assertEquals("+2", turn.sender());
            assertEquals("m-2", turn.messageId());
            assertEquals(ThinkLevel.HIGH, turn.levels().think());
            assertEquals(VerboseLevel.ON, turn.levels().verbose());
        }
    }

    @Nested
    class CapPolicies {

        /** Starts one turn, then fills the next batch to cap 2 with c and d while it runs. */
        private QueueSettings fillWhileBusy(QueueDropPolicy drop) {
            QueueSettings settings = new QueueSettings(QueueMode.COLLECT, 1000, 2, drop);
            send("a", settings);
            send("b", settings);
            assertEquals(1, turns.size());
            send("c", settings);
            send("d", settings);
            assertEquals(1, turns.size());
            return settings;
        }

        @Test
        void dropNew_discardsTheArrival() {
            QueueSettings settings = fillWhileBusy(QueueDropPolicy.NEW);

            assertEquals(QueueEngine.Disposition.DROPPED, send("e", settings));

            endTurn(0);
            assertEquals("[Queued messages while agent was busy]\n---\nQueued #1\nc\n---\nQueued #2\nd",
                    turns.get(1).prompt());
        }

        @Test
        void dropOld_discardsTheEarliest() {
            QueueSettings settings = fillWhileBusy(QueueDropPolicy.OLD);

            assertEquals(QueueEngine.Disposition.COLLECTED, send("e", settings));

            endTurn(0);
            assertEquals("[Queued messages while agent was busy]\n---\nQueued #1\nd\n---\nQueued #2\ne",
                    turns.get(1).prompt());
        }

        @Test
        void summarize_collapsesBatchThenAppends() {
            QueueSettings settings = fillWhileBusy(QueueDropPolicy.SUMMARIZE);

            send("e", settings);
            endTurn(0);

            QueuedTurn turn = turns.get(1);
            assertEquals("[Queued messages while agent was busy]\n---\nQueued #1\n"
                    + "[Summary of 2 queued messages]\n- c\n- d\n---\nQueued #2\ne", turn.prompt());
            assertEquals(3, turn.messageCount());
        }
    }

    @Nested
    class Followup {

        @Test
        void idle_dispatchesImmediately() {
            assertEquals(QueueEngine.Disposition.DISPATCHED, send("hi", mode(QueueMode.FOLLOWUP)));
            assertEquals(List.of("hi"), prompts());
        }

        @Test
        void busy_keepsOnlyTheLatestFollowup() {
            send("a", mode(QueueMode.FOLLOWUP));
            assertEquals(QueueEngine.Disposition.FOLLOWUP, send("b", mode(QueueMode.FOLLOWUP)));
            assertEquals(QueueEngine.Disposition.FOLLOWUP, send("c", mode(QueueMode.FOLLOWUP)));

            endTurn(0);
            endTurn(1);

            assertEquals(List.of("a", "c"), prompts());
        }
    }

    @Nested
    class Steer {

        @Test
        void liveRun_receivesTheMessage() {
            send("a", mode(QueueMode.STEER));
            lanes.steerable = true;

            assertEquals(QueueEngine.Disposition.STEERED, send("also this", mode(QueueMode.STEER)));
            assertEquals(List.of("also this"), lanes.steered);
            assertEquals(1, turns.size());
        }

        @Test
        void refusedSteer_runsBacklogInArrivalOrder() {
            send("a", mode(QueueMode.STEER));
            assertEquals(QueueEngine.Disposition.BACKLOGGED, send("b", mode(QueueMode.STEER)));
            assertEquals(QueueEngine.Disposition.BACKLOGGED, send("c", mode(QueueMode.STEER)));

            endTurn(0);
            assertEquals(List.of("a", "b"), prompts());
            endTurn(1);
            assertEquals(List.of("a", "b", "c"), prompts());
        }

        @Test
        void steerBacklog_fallsBackToTheFollowupSlot() {
            send("a", mode(QueueMode.STEER_BACKLOG));
            assertEquals(QueueEngine.Disposition.FOLLOWUP, send("b", mode(QueueMode.STEER_BACKLOG)));
            send("c", mode(QueueMode.STEER_BACKLOG));

            endTurn(0);
            endTurn(1);

            assertEquals(List.of("a", "c"), prompts());
        }

        @Test
        void steerBacklog_steersWhenPossible() {
            send("a", mode(QueueMode.STEER_BACKLOG));
            lanes.steerable = true;

            assertEquals(QueueEngine.Disposition.STEERED, send("b", mode(QueueMode.STEER_BACKLOG)));
            assertEquals(0, engine.pendingCount(KEY));
        }
    }

    @Nested
    class Interrupt {

        @Test
        void abortsRun_dropsPending_runsNewMessageAlone() {
            send("a", mode(QueueMode.FOLLOWUP));
            send("b", mode(QueueMode.FOLLOWUP));

            assertEquals(QueueEngine.Disposition.INTERRUPTED, send("stop, do this", mode(QueueMode.INTERRUPT)));

            assertEquals(List.of(KEY), lanes.aborted);
            assertEquals(List.of("a", "stop, do this"), prompts());
            assertEquals(0, engine.pendingCount(KEY));
        }

        @Test
        void endOfAbortedTurn_startsNothing() {
            send("a", mode(QueueMode.FOLLOWUP));
            send("stop", mode(QueueMode.INTERRUPT));

            endTurn(0);
            endTurn(1);

            assertEquals(2, turns.size());
        }
    }

    @Test
    void runNotStartedByQueue_isWaitedOut() {
        lanes.busy.add(KEY);

        assertEquals(QueueEngine.Disposition.FOLLOWUP, send("later", mode(QueueMode.FOLLOWUP)));
        assertTrue(turns.isEmpty());

        lanes.finishForeignRun(KEY);
        assertEquals(List.of("later"), prompts());
    }

    @Test
    void turnEnd_prefersBacklogThenFollowupThenBatch() {
        send("a", mode(QueueMode.FOLLOWUP));
        send("x", mode(QueueMode.COLLECT));
        scheduler.advance(1000);
        send("f", mode(QueueMode.FOLLOWUP));
        send("s", mode(QueueMode.STEER));
        assertEquals(3, engine.pendingCount(KEY));

        endTurn(0);
        endTurn(1);
        endTurn(2);

        assertEquals(List.of("a", "s", "f", "x"), prompts());
    }

    @Test
    void sessions_doNotBlockEachOther() {
        send("a", mode(QueueMode.FOLLOWUP));

        assertEquals(QueueEngine.Disposition.DISPATCHED,
                engine.enqueue("agent:main:telegram:99", msg("b"), mode(QueueMode.FOLLOWUP)));
        assertEquals(2, turns.size());
    }

    @Test
    void failedTurn_stillDrainsNextItem() {
        send("a", mode(QueueMode.FOLLOWUP));
        send("b", mode(QueueMode.FOLLOWUP));

        running.get(0).completeExceptionally(new IllegalStateException("boom"));

        assertEquals(List.of("a", "b"), prompts());
    }

    @Test
    void clear_dropsPendingButNotTheRunningTurn() {
        send("a", mode(QueueMode.FOLLOWUP));
        send("b", mode(QueueMode.FOLLOWUP));

        engine.clear(KEY);
        endTurn(0);

        assertEquals(0, engine.pendingCount(KEY));
        assertEquals(List.of("a"), prompts());
    }
}
