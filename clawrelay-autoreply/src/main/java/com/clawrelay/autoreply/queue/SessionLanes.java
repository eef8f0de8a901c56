package com.clawrelay.autoreply.queue;

import com.clawrelay.agent.runtime.RunCoordinator;

import java.util.concurrent.CompletableFuture;

/**
 * The run-lane operations the queue needs.
 */
public interface SessionLanes {

    boolean isActive(String sessionKey);

    boolean steer(String sessionKey, String text);

    boolean abort(String sessionKey);

    CompletableFuture<Boolean> waitForRunEnd(String sessionKey, long timeoutMs);

    static SessionLanes of(RunCoordinator coordinator) {
        return new SessionLanes() {
            @Override
            public boolean isActive(String sessionKey) {
                return coordinator.isActive(sessionKey);
            }

            @Override
            public boolean steer(String sessionKey, String text) {
                return coordinator.steer(sessionKey, text);
            }

            @Override
            public boolean abort(String sessionKey) {
                return coordinator.abort(sessionKey);
            }

            @Override
            public CompletableFuture<Boolean> waitForRunEnd(String sessionKey, long timeoutMs) {
                return coordinator.waitForRunEnd(sessionKey, timeoutMs);
            }
        };
    }
}
