package com.clawrelay.autoreply.queue;

import com.clawrelay.autoreply.directive.InlineLevels;
import com.clawrelay.common.session.SessionKeys;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns inbound messages into agent turns according to the session's queue
 * mode.
 *
 * <p>
 * Each session has its own state object; every mutation of it happens under
 * that object's monitor, so sessions never contend with each other. Turns are
 * handed to the {@link TurnHandler} outside the monitor. When a turn ends the
 * next pending item is dispatched in this order: the steer backlog (FIFO), the
 * followup slot, then a collect batch whose flush came due while the lane was
 * busy.
 * </p>
 */
@Slf4j
public class QueueEngine {

    /** What happened to an enqueued message. */
    public enum Disposition {
        /** A turn was started for it right away. */
        DISPATCHED,
        /** Delivered into the live run. */
        STEERED,
        /** Appended to the steer backlog. */
        BACKLOGGED,
        /** Placed in the followup slot. */
        FOLLOWUP,
        /** Added to the collect batch. */
        COLLECTED,
        /** Discarded by {@code drop:new}. */
        DROPPED,
        /** The running turn was aborted and a new one started. */
        INTERRUPTED
    }

    /** Runs one turn; the returned future completes when the turn has ended. */
    @FunctionalInterface
    public interface TurnHandler {
        CompletableFuture<?> runTurn(QueuedTurn turn);
    }

    static final long FOREIGN_RUN_WAIT_MS = 10 * 60_000L;

    private record BatchItem(String text, List<String> summaryLines) {
    }

    private static final class SessionQueue {
        final List<BatchItem> batch = new ArrayList<>();
        QueuedMessage batchLast;
        InlineLevels batchLevels = InlineLevels.none();
        ScheduledFuture<?> debounce;
        long debounceSeq;
        boolean flushDue;

        QueuedMessage followup;
        final Deque<QueuedMessage> backlog = new ArrayDeque<>();

        boolean running;
        long generation;
        boolean watching;
        boolean retired;

        boolean hasPending() {
            return !batch.isEmpty() || followup != null || !backlog.isEmpty();
        }

        int batchMessages() {
            int count = 0;
            for (BatchItem item : batch) {
                count += item.summaryLines() != null ? item.summaryLines().size() : 1;
            }
            return count;
        }
    }

    private final SessionLanes lanes;
    private final ScheduledExecutorService scheduler;
    private final TurnHandler handler;
    private final Map<String, SessionQueue> queues = new ConcurrentHashMap<>();

    public QueueEngine(SessionLanes lanes, ScheduledExecutorService scheduler, TurnHandler handler) {
        this.lanes = lanes;
        this.scheduler = scheduler;
        this.handler = handler;
    }

    // ── Enqueue ─────────────────────────────────────────────────────────

    public Disposition enqueue(String sessionKey, QueuedMessage message, QueueSettings settings) {
        String key = SessionKeys.normalize(sessionKey);
        QueueSettings effective = settings != null ? settings : QueueSettings.defaults();
        while (true) {
            SessionQueue q = queues.computeIfAbsent(key, k -> new SessionQueue());
            QueuedTurn turn = null;
            long generation = 0;
            boolean watch = false;
            Disposition disposition;
            synchronized (q) {
                if (q.retired) {
                    continue;
                }
                boolean active = q.running || lanes.isActive(key);
                switch (effective.mode()) {
                    case INTERRUPT -> {
                        clearPending(q);
                        q.generation++;
                        q.running = false;
                        boolean aborted = lanes.abort(key);
                        turn = QueuedTurn.single(key, message);
                        disposition = aborted ? Disposition.INTERRUPTED : Disposition.DISPATCHED;
                    }
                    case STEER -> {
                        if (!active) {
                            turn = QueuedTurn.single(key, message);
                            disposition = Disposition.DISPATCHED;
                        } else if (lanes.steer(key, message.text())) {
                            disposition = Disposition.STEERED;
                        } else {
                            q.backlog.addLast(message);
                            watch = !q.running;
                            disposition = Disposition.BACKLOGGED;
                        }
                    }
                    case STEER_BACKLOG -> {
                        if (!active) {
                            turn = QueuedTurn.single(key, message);
                            disposition = Disposition.DISPATCHED;
                        } else if (lanes.steer(key, message.text())) {
                            disposition = Disposition.STEERED;
                        } else {
                            fillFollowup(key, q, message);
                            watch = !q.running;
                            disposition = Disposition.FOLLOWUP;
                        }
                    }
                    case FOLLOWUP -> {
                        if (!active) {
                            turn = QueuedTurn.single(key, message);
                            disposition = Disposition.DISPATCHED;
                        } else {
                            fillFollowup(key, q, message);
                            watch = !q.running;
                            disposition = Disposition.FOLLOWUP;
                        }
                    }
                    default -> {
                        disposition = collect(key, q, message, effective);
                        if (disposition == Disposition.COLLECTED && q.flushDue) {
                            if (!active) {
                                turn = takeBatch(key, q);
                            } else {
                                watch = !q.running;
                            }
                        }
                    }
                }
                if (turn != null) {
                    q.running = true;
                    generation = ++q.generation;
                }
            }
            log.debug("queue {}: session={} mode={}", disposition.name().toLowerCase(), key, effective.mode());
            if (turn != null) {
                start(key, q, turn, generation);
            } else if (watch) {
                watchForeignRun(key, q);
            }
            return disposition;
        }
    }

    private void fillFollowup(String key, SessionQueue q, QueuedMessage message) {
        if (q.followup != null) {
            log.debug("followup replaced: session={}", key);
        }
        q.followup = message;
    }

    private Disposition collect(String key, SessionQueue q, QueuedMessage message, QueueSettings settings) {
        int cap = Math.max(1, settings.cap());
        if (q.batch.size() >= cap) {
            switch (settings.drop()) {
                case NEW -> {
                    log.debug("collect batch full, dropping arrival: session={} cap={}", key, cap);
                    return Disposition.DROPPED;
                }
                case OLD -> {
                    while (q.batch.size() >= cap) {
                        q.batch.remove(0);
                    }
                }
                default -> summarize(q);
            }
        }
        q.batch.add(new BatchItem(message.text(), null));
        q.batchLast = message;
        q.batchLevels = q.batchLevels.merge(message.levels());

        if (q.batch.size() >= cap) {
            cancelDebounce(q);
            q.flushDue = true;
        } else if (!q.flushDue) {
            restartDebounce(key, q, settings.debounceMs());
        }
        return Disposition.COLLECTED;
    }

    private static void summarize(SessionQueue q) {
        List<String> lines = new ArrayList<>();
        for (BatchItem item : q.batch) {
            if (item.summaryLines() != null) {
                lines.addAll(item.summaryLines());
            } else {
                lines.add(CollectPrompt.summaryLine(item.text()));
            }
        }
        q.batch.clear();
        q.batch.add(new BatchItem(CollectPrompt.summary(lines), List.copyOf(lines)));
    }

    // ── Debounce ────────────────────────────────────────────────────────

    private void restartDebounce(String key, SessionQueue q, int debounceMs) {
        cancelDebounce(q);
        long seq = ++q.debounceSeq;
        q.debounce = scheduler.schedule(() -> onDebounce(key, q, seq), Math.max(0, debounceMs),
                TimeUnit.MILLISECONDS);
    }

    private static void cancelDebounce(SessionQueue q) {
        if (q.debounce != null) {
            q.debounce.cancel(false);
            q.debounce = null;
        }
        q.debounceSeq++;
    }

    private void onDebounce(String key, SessionQueue q, long seq) {
        synchronized (q) {
            if (seq != q.debounceSeq || q.batch.isEmpty()) {
                return;
            }
            q.debounce = null;
            q.flushDue = true;
        }
        log.debug("collect debounce elapsed: session={}", key);
        drain(key, q);
    }

    // ── Dispatch ────────────────────────────────────────────────────────

    private QueuedTurn takeBatch(String key, SessionQueue q) {
        List<String> entries = q.batch.stream().map(BatchItem::text).toList();
        QueuedMessage last = q.batchLast;
        QueuedTurn turn = new QueuedTurn(key, CollectPrompt.build(entries),
                last != null ? last.sender() : null,
                last != null ? last.transport() : null,
                last != null ? last.messageId() : null,
                q.batchLevels, q.batchMessages());
        q.batch.clear();
        q.batchLast = null;
        q.batchLevels = InlineLevels.none();
        q.flushDue = false;
        cancelDebounce(q);
        log.debug("collect batch flushed: session={} messages={}", key, turn.messageCount());
        return turn;
    }

    private QueuedTurn pollNext(String key, SessionQueue q) {
        QueuedMessage next = q.backlog.pollFirst();
        if (next != null) {
            return QueuedTurn.single(key, next);
        }
        if (q.followup != null) {
            next = q.followup;
            q.followup = null;
            return QueuedTurn.single(key, next);
        }
        if (q.flushDue && !q.batch.isEmpty()) {
            return takeBatch(key, q);
        }
        return null;
    }

    private void start(String key, SessionQueue q, QueuedTurn turn, long generation) {
        CompletableFuture<?> future;
        try {
            future = handler.runTurn(turn);
        } catch (RuntimeException e) {
            log.error("turn dispatch failed: session={} error={}", key, e.getMessage());
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(null);
        }
        future.whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("turn failed: session={} error={}", key, error.getMessage());
            }
            onTurnEnd(key, q, generation);
        });
    }

    private void onTurnEnd(String key, SessionQueue q, long generation) {
        synchronized (q) {
            if (generation != q.generation || !q.running) {
                return;
            }
            q.running = false;
        }
        drain(key, q);
    }

    /** Start the next pending turn if the lane is free. */
    private void drain(String key, SessionQueue q) {
        QueuedTurn next;
        long generation;
        boolean watch = false;
        synchronized (q) {
            if (q.running) {
                return;
            }
            if (lanes.isActive(key)) {
                next = null;
                generation = 0;
                watch = q.hasPending();
            } else {
                next = pollNext(key, q);
                if (next == null) {
                    retireIfIdle(key, q);
                    return;
                }
                q.running = true;
                generation = ++q.generation;
            }
        }
        if (next != null) {
            start(key, q, next, generation);
        } else if (watch) {
            watchForeignRun(key, q);
        }
    }

    /** Pending items behind a run this engine did not start: drain once it ends. */
    private void watchForeignRun(String key, SessionQueue q) {
        synchronized (q) {
            if (q.watching) {
                return;
            }
            q.watching = true;
        }
        lanes.waitForRunEnd(key, FOREIGN_RUN_WAIT_MS).whenComplete((ended, error) -> {
            synchronized (q) {
                q.watching = false;
            }
            drain(key, q);
        });
    }

    private void retireIfIdle(String key, SessionQueue q) {
        if (!q.running && !q.watching && !q.hasPending() && q.debounce == null) {
            q.retired = true;
            queues.remove(key, q);
        }
    }

    private static void clearPending(SessionQueue q) {
        cancelDebounce(q);
        q.batch.clear();
        q.batchLast = null;
        q.batchLevels = InlineLevels.none();
        q.flushDue = false;
        q.followup = null;
        q.backlog.clear();
    }

    // ── Query ───────────────────────────────────────────────────────────

    /** Messages waiting in the batch, the followup slot and the backlog. */
    public int pendingCount(String sessionKey) {
        SessionQueue q = queues.get(SessionKeys.normalize(sessionKey));
        if (q == null) {
            return 0;
        }
        synchronized (q) {
            return q.batchMessages() + (q.followup != null ? 1 : 0) + q.backlog.size();
        }
    }

    /** Drop everything pending for a session without touching a running turn. */
    public void clear(String sessionKey) {
        SessionQueue q = queues.get(SessionKeys.normalize(sessionKey));
        if (q == null) {
            return;
        }
        synchronized (q) {
            clearPending(q);
        }
    }
}
