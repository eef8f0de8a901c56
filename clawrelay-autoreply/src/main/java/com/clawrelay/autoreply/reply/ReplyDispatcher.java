package com.clawrelay.autoreply.reply;

import com.clawrelay.agent.runtime.RunCoordinator;
import com.clawrelay.agent.runtime.RunOutcome;
import com.clawrelay.agent.runtime.RunRequest;
import com.clawrelay.autoreply.directive.DirectiveEngine;
import com.clawrelay.autoreply.directive.DirectiveResult;
import com.clawrelay.autoreply.directive.InlineLevels;
import com.clawrelay.autoreply.queue.QueueEngine;
import com.clawrelay.autoreply.queue.QueueSettings;
import com.clawrelay.autoreply.queue.QueueSettingsResolver;
import com.clawrelay.autoreply.queue.QueuedMessage;
import com.clawrelay.autoreply.queue.QueuedTurn;
import com.clawrelay.autoreply.queue.SessionLanes;
import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.session.SessionKeys;
import com.clawrelay.common.session.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Inbound pipeline: directives first, then the queue, then the run
 * coordinator; replies go out through the {@link ReplySink}.
 */
@Slf4j
public class ReplyDispatcher {

    static final long BUSY_RETRY_WAIT_MS = 10 * 60_000L;
    static final String BUSY_NOTICE = "⚠️ The agent is still busy with another run; your message was not processed. "
            + "Please send it again.";

    private final DirectiveEngine directives;
    private final RunCoordinator coordinator;
    private final SessionStore store;
    private final Supplier<RelayConfig> config;
    private final ReplySink sink;
    private final QueueEngine queue;

    public ReplyDispatcher(DirectiveEngine directives, RunCoordinator coordinator, SessionStore store,
            Supplier<RelayConfig> config, ScheduledExecutorService scheduler, ReplySink sink) {
        this.directives = directives;
        this.coordinator = coordinator;
        this.store = store;
        this.config = config;
        this.sink = sink;
        this.queue = new QueueEngine(SessionLanes.of(coordinator), scheduler, this::runTurn);
    }

    /**
     * Handle one inbound message. Directive acknowledgements are delivered
     * before this returns; any agent reply follows asynchronously.
     *
     * @return what the queue did with the residual text, or null when the
     *         message held only directives
     */
    public QueueEngine.Disposition onInbound(InboundMessage message) {
        String key = SessionKeys.normalize(message.sessionKey());
        DirectiveResult result = directives.apply(key, message.text(), message.sender(), message.transport());
        if (result.hasAcks()) {
            deliver(key, ReplyPayload.text(result.ackText()));
        }
        if (!result.shouldRunAgent()) {
            return null;
        }
        QueueSettings settings = QueueSettingsResolver.resolve(config.get(), message.transport(), store.get(key));
        QueuedMessage queued = new QueuedMessage(result.residual(), message.sender(), message.transport(),
                message.messageId(), result.inline());
        return queue.enqueue(key, queued, settings);
    }

    public QueueEngine getQueue() {
        return queue;
    }

    // ── Turns ───────────────────────────────────────────────────────────

    private CompletableFuture<RunOutcome> runTurn(QueuedTurn turn) {
        InlineLevels levels = turn.levels();
        RunRequest request = RunRequest.builder()
                .sessionKey(turn.sessionKey())
                .prompt(turn.prompt())
                .sender(turn.sender())
                .transport(turn.transport())
                .thinkOverride(levels.think())
                .verboseOverride(levels.verbose())
                .elevatedOverride(levels.elevated())
                .reasoningOverride(levels.reasoning())
                .toolResultListener(text -> deliver(turn.sessionKey(), ReplyPayload.text(text)))
                .build();
        return runWhenIdle(request)
                .whenComplete((outcome, error) -> {
                    if (outcome != null) {
                        deliverOutcome(turn, outcome);
                    }
                });
    }

    /**
     * Run, and while the lane is held by a run this dispatcher did not start,
     * wait for it to end and try again. Gives up with the {@code BUSY} outcome
     * only when a wait times out.
     */
    private CompletableFuture<RunOutcome> runWhenIdle(RunRequest request) {
        return coordinator.run(request).thenCompose(outcome -> {
            if (outcome.getStatus() != RunOutcome.Status.BUSY) {
                return CompletableFuture.completedFuture(outcome);
            }
            log.debug("lane busy, waiting: session={}", request.getSessionKey());
            return coordinator.waitForRunEnd(request.getSessionKey(), BUSY_RETRY_WAIT_MS)
                    .thenCompose(ended -> ended
                            ? runWhenIdle(request)
                            : CompletableFuture.completedFuture(outcome));
        });
    }

    private void deliverOutcome(QueuedTurn turn, RunOutcome outcome) {
        String key = turn.sessionKey();
        for (String notice : outcome.getNotices()) {
            deliver(key, ReplyPayload.text(notice));
        }
        switch (outcome.getStatus()) {
            case OK -> {
                for (String text : outcome.getPayloads()) {
                    ReplyPayload payload = ReplyTags.shape(text, turn.messageId());
                    if (payload != null) {
                        deliver(key, payload);
                    }
                }
            }
            case FAILED -> deliver(key, ReplyPayload.text("⚠️ Agent run failed: " + outcome.getError()));
            case BUSY -> {
                log.warn("turn dropped, lane still busy: session={}", key);
                deliver(key, ReplyPayload.text(BUSY_NOTICE));
            }
            case ABORTED -> log.debug("turn aborted: session={}", key);
        }
        if (outcome.getPersistenceWarning() != null) {
            deliver(key, ReplyPayload.text(outcome.getPersistenceWarning()));
        }
    }

    private void deliver(String key, ReplyPayload payload) {
        if (payload == null || payload.isEmpty()) {
            return;
        }
        try {
            sink.deliver(key, payload);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver reply for {}: {}", key, e.getMessage());
        }
    }
}
