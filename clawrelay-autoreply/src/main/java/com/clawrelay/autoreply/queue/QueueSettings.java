package com.clawrelay.autoreply.queue;

import com.clawrelay.common.model.QueueDropPolicy;
import com.clawrelay.common.model.QueueMode;

/**
 * Fully resolved queue settings for one session.
 */
public record QueueSettings(QueueMode mode, int debounceMs, int cap, QueueDropPolicy drop) {

    public static final QueueMode DEFAULT_MODE = QueueMode.COLLECT;
    public static final int DEFAULT_DEBOUNCE_MS = 1000;
    public static final int DEFAULT_CAP = 20;
    public static final QueueDropPolicy DEFAULT_DROP = QueueDropPolicy.SUMMARIZE;

    public static QueueSettings defaults() {
        return new QueueSettings(DEFAULT_MODE, DEFAULT_DEBOUNCE_MS, DEFAULT_CAP, DEFAULT_DROP);
    }

    /** {@code mode=collect, debounce=1000ms, cap=20, drop=summarize} */
    public String describe() {
        return "mode=" + mode.label() + ", debounce=" + debounceMs + "ms, cap=" + cap + ", drop=" + drop.value();
    }
}
