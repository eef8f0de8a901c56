package com.clawrelay.agent.runtime;

import com.clawrelay.agent.invoke.AgentInvocationException;
import com.clawrelay.agent.invoke.AgentInvocationRequest;
import com.clawrelay.agent.invoke.AgentInvocationResult;
import com.clawrelay.agent.invoke.AgentInvoker;
import com.clawrelay.agent.invoke.AgentRun;
import com.clawrelay.agent.models.AuthProfileStore;
import com.clawrelay.agent.models.ModelCatalogService;
import com.clawrelay.agent.models.ModelRef;
import com.clawrelay.agent.models.ModelSelectionState;
import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.infra.SystemEvents;
import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.session.SessionEntry;
import com.clawrelay.common.session.SessionKeys;
import com.clawrelay.common.session.SessionStore;
import com.clawrelay.common.session.SessionStoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * One lane per session: starts, steers and aborts agent runs.
 *
 * <p>
 * A run re-reads the session at start, clears stale overrides, resolves the
 * effective settings, prepends pending system events and invokes the agent.
 * Lanes are the only mutual exclusion; distinct sessions never wait on each
 * other.
 * </p>
 */
@Slf4j
public class RunCoordinator {

    private final SessionStore store;
    private final Supplier<RelayConfig> config;
    private final ModelCatalogService catalogService;
    private final AuthProfileStore authProfiles;
    private final AgentInvoker invoker;
    private final SystemEvents systemEvents;
    private final LongSupplier clock;

    private final Map<String, ActiveRun> lanes = new ConcurrentHashMap<>();
    private final Map<String, Set<CompletableFuture<Boolean>>> waiters = new ConcurrentHashMap<>();

    private record PreparedRun(SessionEntry entry, AgentInvocationRequest invocation, List<String> notices,
            long startedAt) {
    }

    public RunCoordinator(SessionStore store, Supplier<RelayConfig> config, ModelCatalogService catalogService,
            AuthProfileStore authProfiles, AgentInvoker invoker, SystemEvents systemEvents) {
        this(store, config, catalogService, authProfiles, invoker, systemEvents, System::currentTimeMillis);
    }

    public RunCoordinator(SessionStore store, Supplier<RelayConfig> config, ModelCatalogService catalogService,
            AuthProfileStore authProfiles, AgentInvoker invoker, SystemEvents systemEvents, LongSupplier clock) {
        this.store = store;
        this.config = config;
        this.catalogService = catalogService;
        this.authProfiles = authProfiles != null ? authProfiles : AuthProfileStore.empty();
        this.invoker = invoker;
        this.systemEvents = systemEvents;
        this.clock = clock;
    }

    // ── Run ────────────────────────────────────────────────────────────

    /**
     * Start a run on the session's lane. Completes with a {@code BUSY} outcome
     * right away when another run holds the lane. Never completes
     * exceptionally.
     */
    public CompletableFuture<RunOutcome> run(RunRequest request) {
        String key = SessionKeys.normalize(request.getSessionKey());
        ActiveRun run = new ActiveRun(key, clock.getAsLong());
        if (lanes.putIfAbsent(key, run) != null) {
            log.debug("lane busy: session={}", key);
            return CompletableFuture.completedFuture(RunOutcome.busy(store.get(key).getSessionId()));
        }
        log.debug("lane acquired: session={}", key);

        PreparedRun prepared;
        try {
            prepared = prepare(key, request, run.startedAt());
        } catch (RuntimeException e) {
            log.error("run preparation failed: session={} error={}", key, e.getMessage());
            release(key, run);
            return CompletableFuture.completedFuture(RunOutcome.builder()
                    .status(RunOutcome.Status.FAILED)
                    .sessionId(store.get(key).getSessionId())
                    .error(e.getMessage())
                    .build());
        }

        AgentRun handle;
        try {
            handle = invoker.start(prepared.invocation());
        } catch (AgentInvocationException e) {
            log.error("agent launch failed: session={} error={}", key, e.getMessage());
            release(key, run);
            return CompletableFuture.completedFuture(failure(prepared, e.getReason(), e.getMessage(), false));
        } catch (RuntimeException e) {
            log.error("agent launch failed: session={} error={}", key, e.getMessage());
            release(key, run);
            return CompletableFuture.completedFuture(
                    failure(prepared, AgentInvocationException.Reason.LAUNCH, e.getMessage(), false));
        }
        log.info("run started: session={} model={}/{}", key, prepared.invocation().getProvider(),
                prepared.invocation().getModel());
        run.attach(handle);
        return handle.result().handle((result, error) -> complete(key, run, prepared, result, error));
    }

    private PreparedRun prepare(String key, RunRequest request, long startedAt) {
        RelayConfig cfg = config.get();
        ModelSelectionState state = ModelSelectionState.create(cfg, catalogService);
        SessionEntry entry = reconcile(key, store.get(key), state);
        ModelRef model = state.effectiveModel(entry);

        String agentId = SessionKeys.agentId(key);
        ElevatedGate.ElevatedPermissions permissions = ElevatedGate.resolve(
                cfg, agentId, request.getTransport(), request.getSender());
        List<String> notices = new ArrayList<>();
        ElevatedLevel requested = EffectiveSettings.explicitElevated(entry, request.getElevatedOverride(), cfg);
        if (requested == ElevatedLevel.ON && !permissions.allowed()) {
            log.warn("elevated refused: session={} gates={}", key, permissions.failures());
            notices.add(ElevatedGate.formatUnavailableMessage(permissions.failures()));
        }

        LiveSessionFlags flags = new LiveSessionFlags(store, key, config,
                request.getVerboseOverride(), request.getElevatedOverride(), permissions.allowed());
        AgentInvocationRequest invocation = AgentInvocationRequest.builder()
                .sessionKey(key)
                .provider(model.provider())
                .model(model.model())
                .authProfile(entry.getAuthProfileOverride())
                .thinkLevel(EffectiveSettings.think(entry, request.getThinkOverride(), cfg, state.isReasoning(model)))
                .reasoningLevel(EffectiveSettings.reasoning(entry, request.getReasoningOverride(), cfg))
                .elevated(EffectiveSettings.elevated(entry, request.getElevatedOverride(), cfg,
                        permissions.allowed()).isOn())
                .prompt(withSystemEvents(key, request.getPrompt()))
                .resumeSessionId(entry.getSessionId())
                .liveFlags(flags)
                .toolResultListener(request.getToolResultListener())
                .build();
        return new PreparedRun(entry, invocation, notices, startedAt);
    }

    private SessionEntry reconcile(String key, SessionEntry entry, ModelSelectionState state) {
        SessionEntry reconciled = OverrideReconciler.reconcile(entry, state, authProfiles);
        if (reconciled.equals(entry)) {
            return entry;
        }
        log.info("clearing stale overrides: session={}", key);
        try {
            return store.update(key, current -> OverrideReconciler.reconcile(current, state, authProfiles));
        } catch (SessionStoreException e) {
            log.warn("Failed to persist reconciled session {}: {}", key, e.getMessage());
            return e.getEntry();
        }
    }

    private String withSystemEvents(String key, String prompt) {
        List<String> events = systemEvents != null ? systemEvents.drain(key) : List.of();
        if (events.isEmpty()) {
            return prompt;
        }
        StringBuilder sb = new StringBuilder();
        for (String event : events) {
            sb.append("System: ").append(event).append('\n');
        }
        if (prompt != null && !prompt.isBlank()) {
            sb.append('\n').append(prompt);
        }
        return sb.toString().trim();
    }

    private RunOutcome complete(String key, ActiveRun run, PreparedRun prepared,
            AgentInvocationResult result, Throwable error) {
        boolean aborted = run.markFinishing();
        try {
            if (error != null) {
                Throwable cause = unwrap(error);
                AgentInvocationException.Reason reason = cause instanceof AgentInvocationException aie
                        ? aie.getReason()
                        : AgentInvocationException.Reason.EXIT;
                if (aborted || reason == AgentInvocationException.Reason.ABORTED) {
                    log.info("run aborted: session={}", key);
                } else {
                    log.error("run failed: session={} reason={} error={}", key, reason, cause.getMessage());
                }
                return failure(prepared, reason, cause.getMessage(), aborted);
            }
            if (aborted) {
                log.info("run aborted: session={}", key);
                return failure(prepared, AgentInvocationException.Reason.ABORTED, "agent run aborted", true);
            }
            return success(key, prepared, result);
        } finally {
            release(key, run);
        }
    }

    private RunOutcome success(String key, PreparedRun prepared, AgentInvocationResult result) {
        String previous = prepared.entry().getSessionId();
        AgentInvocationResult.Meta meta = result.getMeta();
        String sessionId = previous;
        String warning = null;
        String reported = meta != null ? meta.sessionId() : null;
        if (reported != null && !reported.isBlank() && !reported.equals(previous)) {
            sessionId = reported;
            try {
                store.update(key, e -> e.toBuilder().sessionId(reported).build());
            } catch (SessionStoreException e) {
                log.warn("Failed to persist agent session id for {}: {}", key, e.getMessage());
                warning = "⚠️ Session state could not be saved: " + e.getCause().getMessage();
            }
        }
        long durationMs = meta != null ? meta.durationMs() : clock.getAsLong() - prepared.startedAt();
        log.info("run finished: session={} payloads={} durationMs={}", key, result.getPayloads().size(), durationMs);
        return RunOutcome.builder()
                .status(RunOutcome.Status.OK)
                .payloads(result.getPayloads())
                .sessionId(sessionId)
                .durationMs(durationMs)
                .usage(meta != null ? meta.usage() : null)
                .notices(prepared.notices())
                .persistenceWarning(warning)
                .build();
    }

    private RunOutcome failure(PreparedRun prepared, AgentInvocationException.Reason reason, String message,
            boolean aborted) {
        boolean wasAborted = aborted || reason == AgentInvocationException.Reason.ABORTED;
        return RunOutcome.builder()
                .status(wasAborted ? RunOutcome.Status.ABORTED : RunOutcome.Status.FAILED)
                .sessionId(prepared.entry().getSessionId())
                .durationMs(clock.getAsLong() - prepared.startedAt())
                .error(message)
                .failureReason(wasAborted ? AgentInvocationException.Reason.ABORTED : reason)
                .notices(prepared.notices())
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    // ── Query ──────────────────────────────────────────────────────────

    public boolean isActive(String sessionKey) {
        return lanes.containsKey(SessionKeys.normalize(sessionKey));
    }

    /** Whether the active run has started and not yet reached its terminal state. */
    public boolean isStreaming(String sessionKey) {
        ActiveRun run = lanes.get(SessionKeys.normalize(sessionKey));
        return run != null && run.isStreaming();
    }

    public int activeCount() {
        return lanes.size();
    }

    // ── Steer / abort ──────────────────────────────────────────────────

    /**
     * Deliver a message into the active run's live input.
     *
     * @return false if there is no run, the run is finishing, or it has no
     *         live input
     */
    public boolean steer(String sessionKey, String text) {
        String key = SessionKeys.normalize(sessionKey);
        ActiveRun run = lanes.get(key);
        if (run == null) {
            log.debug("steer failed: session={} reason=no_active_run", key);
            return false;
        }
        boolean delivered = run.steer(text);
        log.debug("steer {}: session={}", delivered ? "delivered" : "refused", key);
        return delivered;
    }

    /**
     * Kill the active run and free the lane immediately.
     *
     * @return true if a run was found and aborted
     */
    public boolean abort(String sessionKey) {
        String key = SessionKeys.normalize(sessionKey);
        ActiveRun run = lanes.get(key);
        if (run == null) {
            log.debug("abort failed: session={} reason=no_active_run", key);
            return false;
        }
        log.info("aborting run: session={}", key);
        run.abort();
        release(key, run);
        return true;
    }

    // ── Wait ───────────────────────────────────────────────────────────

    /**
     * Wait for the session's lane to free.
     *
     * @return completes with true when the lane frees, false on timeout
     */
    public CompletableFuture<Boolean> waitForRunEnd(String sessionKey, long timeoutMs) {
        String key = SessionKeys.normalize(sessionKey);
        if (!lanes.containsKey(key)) {
            return CompletableFuture.completedFuture(true);
        }
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        waiters.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(future);

        long effectiveTimeout = Math.max(1, timeoutMs);
        CompletableFuture.delayedExecutor(effectiveTimeout, TimeUnit.MILLISECONDS).execute(() -> {
            if (future.complete(false)) {
                removeWaiter(key, future);
                log.warn("wait timeout: session={} timeoutMs={}", key, effectiveTimeout);
            }
        });

        // the run may have ended between the check and registration
        if (!lanes.containsKey(key) && future.complete(true)) {
            removeWaiter(key, future);
        }
        return future;
    }

    private void removeWaiter(String key, CompletableFuture<Boolean> future) {
        Set<CompletableFuture<Boolean>> set = waiters.get(key);
        if (set != null) {
            set.remove(future);
            if (set.isEmpty()) {
                waiters.remove(key, set);
            }
        }
    }

    private void release(String key, ActiveRun run) {
        if (!lanes.remove(key, run)) {
            return;
        }
        log.debug("lane released: session={}", key);
        Set<CompletableFuture<Boolean>> set = waiters.remove(key);
        if (set == null) {
            return;
        }
        for (CompletableFuture<Boolean> f : set) {
            f.complete(true);
        }
    }
}
