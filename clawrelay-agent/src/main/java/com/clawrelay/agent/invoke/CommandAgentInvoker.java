package com.clawrelay.agent.invoke;

import com.clawrelay.common.config.RelayConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an agent CLI as a subprocess per turn.
 *
 * <p>
 * stdout is read line by line so tool results can be relayed while the run
 * is going; the full output is handed to the kind's parser once the process
 * exits. stderr is kept (tail only) for diagnostics. The process is killed on
 * timeout or {@link AgentRun#cancel()}.
 * </p>
 */
@Slf4j
public class CommandAgentInvoker implements AgentInvoker {

    private static final int STDERR_TAIL_CHARS = 2000;

    private final AgentKind kind;
    private final List<String> commandTemplate;
    private final Path workspace;
    private final Duration timeout;
    private final boolean steerViaStdin;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService timer;

    public CommandAgentInvoker(RelayConfig.AgentDefaults defaults) {
        this(resolveKind(defaults.getKind()),
                defaults.getCommand(),
                defaults.getWorkspace() != null && !defaults.getWorkspace().isBlank()
                        ? Path.of(expandHome(defaults.getWorkspace()))
                        : null,
                Duration.ofSeconds(Math.max(1, defaults.getTimeoutSeconds())),
                defaults.isSteerViaStdin());
    }

    public CommandAgentInvoker(AgentKind kind, List<String> commandTemplate, Path workspace,
            Duration timeout, boolean steerViaStdin) {
        this.kind = kind;
        this.commandTemplate = commandTemplate != null ? List.copyOf(commandTemplate) : List.of();
        this.workspace = workspace;
        this.timeout = timeout;
        this.steerViaStdin = steerViaStdin;
        this.ioExecutor = Executors.newCachedThreadPool(daemonThreads("agent-io"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("agent-timeout"));
    }

    @Override
    public AgentRun start(AgentInvocationRequest request) throws AgentInvocationException {
        List<String> argv = AgentArgv.build(kind, commandTemplate, request);
        ProcessBuilder pb = new ProcessBuilder(argv).redirectErrorStream(false);
        if (workspace != null) {
            pb.directory(workspace.toFile());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentInvocationException(AgentInvocationException.Reason.LAUNCH,
                    "Failed to launch " + argv.get(0) + ": " + e.getMessage(), e);
        }
        log.info("agent started: kind={} session={} pid={}", kind.id(), request.getSessionKey(), process.pid());
        ProcessRun run = new ProcessRun(process, request);
        run.begin();
        return run;
    }

    /**
     * Stop the I/O and timeout threads. Runs in flight are not killed.
     */
    public void shutdown() {
        ioExecutor.shutdown();
        timer.shutdown();
    }

    public AgentKind getKind() {
        return kind;
    }

    // ── Run ────────────────────────────────────────────────────────────

    private final class ProcessRun implements AgentRun {

        private final Process process;
        private final AgentInvocationRequest request;
        private final CompletableFuture<AgentInvocationResult> result = new CompletableFuture<>();
        private final StringBuilder stdout = new StringBuilder();
        private final StringBuilder stderr = new StringBuilder();
        private final Writer stdin;
        private final long startedAt = System.currentTimeMillis();
        private volatile boolean timedOut;
        private volatile boolean aborted;
        private ScheduledFuture<?> timeoutTask;

        ProcessRun(Process process, AgentInvocationRequest request) {
            this.process = process;
            this.request = request;
            if (steerViaStdin) {
                this.stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
            } else {
                this.stdin = null;
                closeQuietly(process.getOutputStream());
            }
        }

        void begin() {
            timeoutTask = timer.schedule(() -> {
                if (process.isAlive()) {
                    timedOut = true;
                    log.warn("agent timed out after {}s: session={}", timeout.toSeconds(), request.getSessionKey());
                    process.destroyForcibly();
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            ioExecutor.execute(this::drainStderr);
            ioExecutor.execute(this::readStdout);
        }

        @Override
        public CompletableFuture<AgentInvocationResult> result() {
            return result;
        }

        @Override
        public boolean supportsSteering() {
            return stdin != null && process.isAlive();
        }

        @Override
        public synchronized boolean steer(String text) {
            if (stdin == null || !process.isAlive() || text == null || text.isBlank()) {
                return false;
            }
            try {
                stdin.write(text.replace('\n', ' ').trim());
                stdin.write('\n');
                stdin.flush();
                return true;
            } catch (IOException e) {
                log.debug("steer failed: session={} error={}", request.getSessionKey(), e.getMessage());
                return false;
            }
        }

        @Override
        public void cancel() {
            aborted = true;
            process.destroyForcibly();
        }

        private void readStdout() {
            AgentOutputParser parser = kind.parser();
            Throwable failure = null;
            try {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        stdout.append(line).append('\n');
                        emitToolResult(parser, line);
                    }
                } catch (IOException e) {
                    log.debug("agent stdout closed: session={} error={}", request.getSessionKey(), e.getMessage());
                }
                finish(parser);
            } catch (RuntimeException e) {
                failure = e;
            } finally {
                if (!result.isDone()) {
                    failUnexpectedly(failure);
                }
            }
        }

        /** Completes the result when reading or parsing stopped before doing so. */
        private void failUnexpectedly(Throwable failure) {
            String detail = failure != null ? failure.toString() : "output reader stopped";
            log.error("agent output handling failed: session={} error={}", request.getSessionKey(), detail);
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            process.destroyForcibly();
            result.completeExceptionally(new AgentInvocationException(AgentInvocationException.Reason.EXIT,
                    "agent output handling failed: " + detail, failure));
        }

        private void emitToolResult(AgentOutputParser parser, String line) {
            if (request.getToolResultListener() == null) {
                return;
            }
            try {
                String toolResult = parser.toolResult(line);
                if (toolResult == null || !request.getLiveFlags().shouldEmitToolResult()) {
                    return;
                }
                request.getToolResultListener().accept(toolResult);
            } catch (RuntimeException e) {
                log.warn("tool result relay failed: session={} error={}", request.getSessionKey(), e.getMessage());
            }
        }

        private void finish(AgentOutputParser parser) {
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                result.completeExceptionally(new AgentInvocationException(
                        AgentInvocationException.Reason.ABORTED, "interrupted while waiting for agent", e));
                return;
            } finally {
                if (timeoutTask != null) {
                    timeoutTask.cancel(false);
                }
                closeQuietly(process.getOutputStream());
            }
            long durationMs = System.currentTimeMillis() - startedAt;

            if (aborted) {
                result.completeExceptionally(new AgentInvocationException(
                        AgentInvocationException.Reason.ABORTED, "agent run aborted"));
                return;
            }
            if (timedOut) {
                result.completeExceptionally(new AgentInvocationException(
                        AgentInvocationException.Reason.TIMEOUT,
                        "agent timed out after " + timeout.toSeconds() + "s"));
                return;
            }
            if (exitCode != 0) {
                String detail = stderrTail();
                result.completeExceptionally(new AgentInvocationException(
                        AgentInvocationException.Reason.EXIT,
                        "agent exited with code " + exitCode + (detail.isEmpty() ? "" : ": " + detail)));
                return;
            }
            try {
                ParsedAgentOutput parsed = parser.parse(stdout.toString());
                log.info("agent finished: kind={} session={} durationMs={}", kind.id(), request.getSessionKey(),
                        durationMs);
                result.complete(AgentInvocationResult.builder()
                        .payloads(parsed.texts())
                        .meta(new AgentInvocationResult.Meta(
                                parsed.sessionId(),
                                parsed.durationMs() != null ? parsed.durationMs() : durationMs,
                                parsed.usage()))
                        .build());
            } catch (AgentInvocationException e) {
                result.completeExceptionally(e);
            }
        }

        private void drainStderr() {
            try (InputStream err = process.getErrorStream()) {
                byte[] buf = new byte[4096];
                int n;
                while ((n = err.read(buf)) != -1) {
                    synchronized (stderr) {
                        stderr.append(new String(buf, 0, n, StandardCharsets.UTF_8));
                        if (stderr.length() > STDERR_TAIL_CHARS * 2) {
                            stderr.delete(0, stderr.length() - STDERR_TAIL_CHARS);
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("agent stderr closed: {}", e.getMessage());
            }
        }

        private String stderrTail() {
            synchronized (stderr) {
                String text = stderr.toString().trim();
                return text.length() > STDERR_TAIL_CHARS ? text.substring(text.length() - STDERR_TAIL_CHARS) : text;
            }
        }
    }

    // ── Helpers ────────────────────────────────────────────────────────

    private static AgentKind resolveKind(String raw) {
        AgentKind kind = AgentKind.fromId(raw);
        if (kind == null) {
            log.warn("Unknown agent kind '{}', using claude", raw);
            return AgentKind.CLAUDE;
        }
        return kind;
    }

    private static String expandHome(String path) {
        String trimmed = path.trim();
        return trimmed.startsWith("~") ? System.getProperty("user.home") + trimmed.substring(1) : trimmed;
    }

    private static void closeQuietly(OutputStream out) {
        try {
            out.close();
        } catch (IOException e) {
            log.debug("failed to close agent stdin: {}", e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
