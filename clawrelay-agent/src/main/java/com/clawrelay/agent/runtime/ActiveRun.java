package com.clawrelay.agent.runtime;

import com.clawrelay.agent.invoke.AgentRun;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Lane holder for one session's in-flight run.
 *
 * <p>
 * Steering, aborting and the terminal transition all take {@link #lock}. Once
 * {@link #markFinishing()} has run, steering fails.
 * </p>
 */
final class ActiveRun {

    private final String sessionKey;
    private final long startedAt;
    private final ReentrantLock lock = new ReentrantLock();
    private AgentRun handle;
    private boolean finishing;
    private boolean aborted;

    ActiveRun(String sessionKey, long startedAt) {
        this.sessionKey = sessionKey;
        this.startedAt = startedAt;
    }

    String sessionKey() {
        return sessionKey;
    }

    long startedAt() {
        return startedAt;
    }

    /**
     * Attach the agent handle. If the run was aborted while starting, the
     * handle is cancelled right away.
     */
    void attach(AgentRun run) {
        lock.lock();
        try {
            this.handle = run;
            if (aborted) {
                run.cancel();
            }
        } finally {
            lock.unlock();
        }
    }

    boolean isStreaming() {
        lock.lock();
        try {
            return handle != null && !finishing && !aborted;
        } finally {
            lock.unlock();
        }
    }

    boolean steer(String text) {
        lock.lock();
        try {
            if (handle == null || finishing || aborted || !handle.supportsSteering()) {
                return false;
            }
            return handle.steer(text);
        } finally {
            lock.unlock();
        }
    }

    void abort() {
        lock.lock();
        try {
            aborted = true;
            if (handle != null) {
                handle.cancel();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return whether the run was aborted before it reached its terminal state
     */
    boolean markFinishing() {
        lock.lock();
        try {
            finishing = true;
            return aborted;
        } finally {
            lock.unlock();
        }
    }
}
