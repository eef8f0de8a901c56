package com.clawrelay.common.infra;

import com.clawrelay.common.config.RelayConfig;

import java.util.function.DoubleSupplier;

/**
 * Exponential backoff and heartbeat timing for a persistent transport
 * connection. Holds no attempt counter; the connection monitor owns that and
 * asks the policy for each delay.
 *
 * @param initialMs        first delay in milliseconds
 * @param maxMs            upper bound on the un-jittered delay
 * @param factor           multiplicative growth per attempt
 * @param jitter           fractional randomization in [0, 1], applied in
 *                         both directions
 * @param maxAttempts      attempts before giving up; 0 means unlimited
 * @param heartbeatSeconds interval between liveness heartbeats
 */
public record ReconnectPolicy(
        long initialMs,
        long maxMs,
        double factor,
        double jitter,
        int maxAttempts,
        int heartbeatSeconds) {

    public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(2_000, 30_000, 1.8, 0.25, 12, 60);

    public ReconnectPolicy {
        if (initialMs < 0 || maxMs < 0) {
            throw new IllegalArgumentException("reconnect delays must be non-negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("reconnect factor must be >= 1");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("reconnect jitter must be within [0, 1]");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("reconnect maxAttempts must be >= 0");
        }
        if (heartbeatSeconds <= 0) {
            throw new IllegalArgumentException("heartbeatSeconds must be positive");
        }
    }

    /**
     * Build a policy from the {@code web} config section, filling unset fields
     * from {@link #DEFAULT}.
     */
    public static ReconnectPolicy fromConfig(RelayConfig.WebConfig web) {
        if (web == null) {
            return DEFAULT;
        }
        RelayConfig.ReconnectConfig rc = web.getReconnect() != null ? web.getReconnect()
                : new RelayConfig.ReconnectConfig();
        long initial = rc.getInitialMs() != null ? rc.getInitialMs() : DEFAULT.initialMs;
        long max = rc.getMaxMs() != null ? rc.getMaxMs() : DEFAULT.maxMs;
        return new ReconnectPolicy(
                initial,
                Math.max(initial, max),
                rc.getFactor() != null ? rc.getFactor() : DEFAULT.factor,
                rc.getJitter() != null ? rc.getJitter() : DEFAULT.jitter,
                rc.getMaxAttempts() != null ? rc.getMaxAttempts() : DEFAULT.maxAttempts,
                web.getHeartbeatSeconds() != null ? web.getHeartbeatSeconds() : DEFAULT.heartbeatSeconds);
    }

    /**
     * Suggested delay before reconnect attempt {@code attempt}.
     *
     * @param attempt 0-based attempt number
     * @param random  source of uniform values in [0, 1)
     * @return delay in milliseconds, never negative
     */
    public long delayMs(int attempt, DoubleSupplier random) {
        double base = Math.min(maxMs, initialMs * Math.pow(factor, Math.max(attempt, 0)));
        double spread = jitter * (2 * random.getAsDouble() - 1);
        return Math.max(0, Math.round(base * (1 + spread)));
    }

    /**
     * Whether a monitor that has made {@code attempts} attempts should stop.
     */
    public boolean shouldGiveUp(int attempts) {
        return maxAttempts > 0 && attempts >= maxAttempts;
    }

    public long heartbeatMs() {
        return heartbeatSeconds * 1000L;
    }
}
