package com.clawrelay.autoreply.directive;

import com.clawrelay.agent.models.AuthProfileStore;
import com.clawrelay.agent.models.ModelAliasIndex;
import com.clawrelay.agent.models.ModelCatalogEntry;
import com.clawrelay.agent.models.ModelCatalogService;
import com.clawrelay.agent.models.ModelRef;
import com.clawrelay.agent.models.ModelResolution;
import com.clawrelay.agent.models.ModelResolver;
import com.clawrelay.agent.models.ModelSelection;
import com.clawrelay.agent.models.ModelSelectionState;
import com.clawrelay.agent.runtime.EffectiveSettings;
import com.clawrelay.agent.runtime.ElevatedGate;
import com.clawrelay.autoreply.queue.QueueDirective;
import com.clawrelay.autoreply.queue.QueueSettings;
import com.clawrelay.autoreply.queue.QueueSettingsResolver;
import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.infra.SystemEvents;
import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import com.clawrelay.common.session.SessionEntry;
import com.clawrelay.common.session.SessionKeys;
import com.clawrelay.common.session.SessionStore;
import com.clawrelay.common.session.SessionStoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Applies in-band directives to session state and produces the
 * acknowledgement text.
 *
 * <p>
 * Directives run in textual order, each against a fresh read of the store, so
 * a {@code /status} after {@code /verbose on} in the same message already
 * shows the change. Validation, resolution and authorization failures come
 * back as text and leave the entry untouched.
 * </p>
 */
@Slf4j
public class DirectiveEngine {

    static final String QUEUE_OPTIONS = "Options: modes steer, followup, collect, steer+backlog, interrupt; "
            + "debounce:<ms|s|m>, cap:<n>, drop:old|new|summarize.";

    private static final Pattern INDEX_RE = Pattern.compile("^\\d{1,4}$");

    private final SessionStore store;
    private final Supplier<RelayConfig> config;
    private final ModelCatalogService catalogService;
    private final AuthProfileStore authProfiles;
    private final SystemEvents systemEvents;

    public DirectiveEngine(SessionStore store, Supplier<RelayConfig> config, ModelCatalogService catalogService,
            AuthProfileStore authProfiles, SystemEvents systemEvents) {
        this.store = store;
        this.config = config;
        this.catalogService = catalogService;
        this.authProfiles = authProfiles != null ? authProfiles : AuthProfileStore.empty();
        this.systemEvents = systemEvents;
    }

    /** Per-message context; the model state is built on first use. */
    private final class Context {
        final String key;
        final String agentId;
        final String sender;
        final String transport;
        final RelayConfig cfg;
        private ModelSelectionState state;

        Context(String key, String sender, String transport, RelayConfig cfg) {
            this.key = key;
            this.agentId = SessionKeys.agentId(key);
            this.sender = sender;
            this.transport = transport;
            this.cfg = cfg;
        }

        ModelSelectionState state() {
            if (state == null) {
                state = ModelSelectionState.create(cfg, catalogService);
            }
            return state;
        }

        SessionEntry entry() {
            return store.get(key);
        }
    }

    // ── Entry point ─────────────────────────────────────────────────────

    public DirectiveResult apply(String sessionKey, String text, String sender, String transport) {
        String key = SessionKeys.normalize(sessionKey);
        RelayConfig cfg = config.get();
        List<String> aliases = new ArrayList<>(
                ModelAliasIndex.fromConfig(cfg, ModelRef.DEFAULT_PROVIDER).aliases().keySet());
        DirectiveParser.Parsed parsed = DirectiveParser.parse(text, aliases);

        Context ctx = new Context(key, sender, transport, cfg);
        List<String> acks = new ArrayList<>();
        for (DirectiveParser.Directive directive : parsed.directives()) {
            log.debug("directive: session={} command={}", key, directive.command());
            String ack = execute(ctx, directive);
            if (ack != null && !ack.isBlank()) {
                acks.add(ack);
            }
        }
        return new DirectiveResult(List.copyOf(acks), parsed.residual(), parsed.inline());
    }

    private String execute(Context ctx, DirectiveParser.Directive directive) {
        String args = directive.args() != null ? directive.args().trim() : "";
        return switch (directive.command()) {
            case THINK -> think(ctx, args);
            case VERBOSE -> verbose(ctx, args);
            case REASONING -> reasoning(ctx, args);
            case ELEVATED -> elevated(ctx, args);
            case QUEUE -> queue(ctx, args);
            case MODEL -> model(ctx, args);
            case MODELS -> modelList(ctx, false);
            case STATUS -> status(ctx);
            case HELP -> help();
        };
    }

    // ── Levels ──────────────────────────────────────────────────────────

    private String think(Context ctx, String args) {
        if (args.isEmpty()) {
            SessionEntry entry = ctx.entry();
            ModelSelectionState state = ctx.state();
            ThinkLevel current = EffectiveSettings.think(entry, null, ctx.cfg,
                    state.isReasoning(state.effectiveModel(entry)));
            return "Current thinking level: " + current + "\nOptions: " + ThinkLevel.options() + ".";
        }
        ThinkLevel level = ThinkLevel.normalize(args);
        if (level == null) {
            return "Unrecognized thinking level \"" + args + "\". Valid levels: " + ThinkLevel.options() + ".";
        }
        String ack = level == ThinkLevel.OFF ? "⚙️ Thinking disabled." : "⚙️ Thinking level set to " + level + ".";
        return persist(ctx, e -> e.toBuilder().thinkingLevel(level).build(), ack);
    }

    private String verbose(Context ctx, String args) {
        if (args.isEmpty()) {
            VerboseLevel current = EffectiveSettings.verbose(ctx.entry(), null, ctx.cfg);
            return "Current verbose level: " + current + "\nOptions: on, off.";
        }
        VerboseLevel level = VerboseLevel.normalize(args);
        if (level == null) {
            return "Unrecognized verbose level \"" + args + "\". Valid levels: on, off.";
        }
        String ack = level.isOn() ? "⚙️ Verbose logging enabled." : "⚙️ Verbose logging disabled.";
        return persist(ctx, e -> e.toBuilder().verboseLevel(level).build(), ack);
    }

    private String reasoning(Context ctx, String args) {
        if (args.isEmpty()) {
            ReasoningLevel current = EffectiveSettings.reasoning(ctx.entry(), null, ctx.cfg);
            return "Current reasoning level: " + current + "\nOptions: on, off, stream.";
        }
        ReasoningLevel level = ReasoningLevel.normalize(args);
        if (level == null) {
            return "Unrecognized reasoning level \"" + args + "\". Valid levels: on, off, stream.";
        }
        String ack = switch (level) {
            case ON -> "⚙️ Reasoning visibility enabled.";
            case OFF -> "⚙️ Reasoning visibility disabled.";
            case STREAM -> "⚙️ Reasoning stream enabled.";
        };
        return persist(ctx, e -> e.toBuilder().reasoningLevel(level).build(), ack);
    }

    private String elevated(Context ctx, String args) {
        ElevatedGate.ElevatedPermissions permissions = ElevatedGate.resolve(ctx.cfg, ctx.agentId, ctx.transport,
                ctx.sender);
        if (args.isEmpty()) {
            ElevatedLevel current = EffectiveSettings.elevated(ctx.entry(), null, ctx.cfg, permissions.allowed());
            return "Current elevated level: " + current + "\nOptions: on, off.";
        }
        ElevatedLevel level = ElevatedLevel.normalize(args);
        if (level == null) {
            return "Unrecognized elevated level \"" + args + "\". Valid levels: on, off.";
        }
        if (level.isOn() && !permissions.allowed()) {
            log.info("elevated refused: session={} sender={} gates={}", ctx.key, ctx.sender,
                    permissions.failures());
            return ElevatedGate.formatUnavailableMessage(permissions.failures());
        }
        String ack = (level.isOn() ? "⚙️ Elevated mode enabled." : "⚙️ Elevated mode disabled.")
                + "\nRuntime is direct; sandboxing does not apply.";
        return persist(ctx, e -> e.toBuilder().elevatedLevel(level).build(), ack);
    }

    // ── Queue ───────────────────────────────────────────────────────────

    private String queue(Context ctx, String args) {
        QueueDirective.Args parsed = QueueDirective.parse(args);
        if (parsed.isEmpty()) {
            QueueSettings current = QueueSettingsResolver.resolve(ctx.cfg, ctx.transport, ctx.entry());
            return "Current queue settings: " + current.describe() + ".\n" + QUEUE_OPTIONS;
        }
        if (parsed.hasErrors()) {
            return String.join("\n", parsed.errors());
        }
        if (parsed.reset()) {
            return persist(ctx, SessionEntry::withoutQueueSettings, "⚙️ Queue mode reset to default.");
        }

        List<String> lines = new ArrayList<>();
        if (parsed.mode() != null) {
            lines.add("Queue mode set to " + parsed.mode().label() + ".");
        }
        if (parsed.debounceMs() != null) {
            lines.add("Queue debounce set to " + parsed.debounceMs() + "ms.");
        }
        if (parsed.cap() != null) {
            lines.add("Queue cap set to " + parsed.cap() + ".");
        }
        if (parsed.drop() != null) {
            lines.add("Queue drop set to " + parsed.drop().value() + ".");
        }
        lines.set(0, "⚙️ " + lines.get(0));

        return persist(ctx, e -> {
            SessionEntry.SessionEntryBuilder b = e.toBuilder();
            if (parsed.mode() != null) {
                b.queueMode(parsed.mode());
            }
            if (parsed.debounceMs() != null) {
                b.queueDebounceMs(parsed.debounceMs());
            }
            if (parsed.cap() != null) {
                b.queueCap(parsed.cap());
            }
            if (parsed.drop() != null) {
                b.queueDrop(parsed.drop());
            }
            return b.build();
        }, String.join("\n", lines));
    }

    // ── Model ───────────────────────────────────────────────────────────

    private String model(Context ctx, String args) {
        if (args.isEmpty() || args.equalsIgnoreCase("list")) {
            return modelList(ctx, false);
        }
        if (args.equalsIgnoreCase("status")) {
            return modelList(ctx, true);
        }
        ModelResolver resolver = new ModelResolver(ctx.state(), authProfiles);
        ModelResolution resolution = INDEX_RE.matcher(args).matches()
                ? resolver.resolveIndex(Integer.parseInt(args))
                : resolver.resolve(args);
        if (!resolution.isOk()) {
            return resolution.error();
        }

        ModelSelection selection = resolution.selection();
        UnaryOperator<SessionEntry> mutator = e -> {
            SessionEntry.SessionEntryBuilder b = e.withoutModelOverride().toBuilder();
            if (!selection.isDefault()) {
                b.modelOverride(selection.model()).providerOverride(selection.provider());
            }
            return b.authProfileOverride(selection.authProfile()).build();
        };
        String ack = "Model set to " + selection.label() + ".";
        if (selection.authProfile() != null) {
            ack += "\nAuth profile set to " + selection.authProfile() + ".";
        }
        String result = persist(ctx, mutator, ack);
        systemEvents.enqueue(ctx.key, "Model switched to " + selection.label() + ".");
        log.info("model switched: session={} model={}", ctx.key, selection.key());
        return result;
    }

    private String modelList(Context ctx, boolean withAuth) {
        ModelSelectionState state = ctx.state();
        SessionEntry entry = ctx.entry();
        ModelRef current = state.effectiveModel(entry);

        List<String> lines = new ArrayList<>();
        String currentAlias = state.aliasFor(current);
        lines.add("Current: " + current.key() + (currentAlias != null ? " (" + currentAlias + ")" : ""));
        lines.add("Pick: /model <#> or /model <provider/model>");
        List<ModelCatalogEntry> entries = state.getAllowed().entries();
        for (int i = 0; i < entries.size(); i++) {
            ModelCatalogEntry model = entries.get(i);
            StringBuilder line = new StringBuilder()
                    .append(i + 1).append(") ").append(model.displayName()).append(" — ").append(model.provider());
            String alias = state.aliasFor(model.ref());
            if (alias != null) {
                line.append(" (alias: ").append(alias).append(')');
            }
            if (withAuth) {
                List<String> profiles = authProfiles.profilesFor(model.provider());
                line.append(" · auth: ").append(profiles.isEmpty() ? "none" : String.join(", ", profiles));
            }
            lines.add(line.toString());
        }
        if (withAuth) {
            String override = entry.getAuthProfileOverride();
            lines.add("Session auth: " + (override != null ? override : "default"));
        }
        return String.join("\n", lines);
    }

    // ── Status / help ───────────────────────────────────────────────────

    private String status(Context ctx) {
        SessionEntry entry = ctx.entry();
        ModelSelectionState state = ctx.state();
        ModelRef model = state.effectiveModel(entry);

        String modelLine = "Model: " + model.key();
        if (entry.getAuthProfileOverride() != null) {
            modelLine += " · auth: " + entry.getAuthProfileOverride();
        }

        StringBuilder runtime = new StringBuilder("⚙️ Runtime: direct · Think: ")
                .append(EffectiveSettings.think(entry, null, ctx.cfg, state.isReasoning(model)));
        if (EffectiveSettings.verbose(entry, null, ctx.cfg).isOn()) {
            runtime.append(" · verbose");
        }
        ReasoningLevel reasoning = EffectiveSettings.reasoning(entry, null, ctx.cfg);
        if (reasoning == ReasoningLevel.ON) {
            runtime.append(" · reasoning");
        } else if (reasoning == ReasoningLevel.STREAM) {
            runtime.append(" · reasoning:stream");
        }
        boolean approved = ElevatedGate.resolve(ctx.cfg, ctx.agentId, ctx.transport, ctx.sender).allowed();
        if (ElevatedGate.isAvailable(ctx.cfg, ctx.agentId)
                && EffectiveSettings.elevated(entry, null, ctx.cfg, approved).isOn()) {
            runtime.append(" · elevated");
        }
        QueueSettings queue = QueueSettingsResolver.resolve(ctx.cfg, ctx.transport, entry);
        runtime.append(" · Queue: ").append(queue.mode().label())
                .append(" (debounce ").append(queue.debounceMs()).append("ms, cap ").append(queue.cap())
                .append(", drop ").append(queue.drop().value()).append(')');

        return "Session: " + ctx.key + "\n" + modelLine + "\n" + runtime;
    }

    private static String help() {
        return String.join("\n",
                "ℹ️ Help",
                "/think <off|minimal|low|medium|high>: thinking level (/t, /thinking)",
                "/verbose <on|off>: relay tool results (/v)",
                "/reasoning <on|off|stream>: reasoning visibility (/reason)",
                "/elevated <on|off>: elevated mode (/elev)",
                "/model [list|status|<#>|<provider/model>[@profile]]: show or switch the model (/models)",
                "/queue <mode> [debounce:<d>] [cap:<n>] [drop:<p>] | reset: queue settings",
                "/status: current session settings",
                "Level directives inside a message apply to that message only.");
    }

    // ── Persistence ─────────────────────────────────────────────────────

    private String persist(Context ctx, UnaryOperator<SessionEntry> mutator, String ack) {
        try {
            store.update(ctx.key, mutator);
            return ack;
        } catch (SessionStoreException e) {
            log.warn("Failed to persist directive for {}: {}", ctx.key, e.getCause().getMessage());
            return ack + "\n⚠️ Session state could not be saved: " + e.getCause().getMessage();
        }
    }
}
