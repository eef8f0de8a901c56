package com.clawrelay.agent.invoke;

/**
 * Session flags an in-flight run consults at each decision point. Values may
 * change while the run is going.
 */
public interface LiveFlags {

    boolean isVerbose();

    boolean isElevated();

    default boolean shouldEmitToolResult() {
        return isVerbose();
    }

    static LiveFlags fixed(boolean verbose, boolean elevated) {
        return new LiveFlags() {
            @Override
            public boolean isVerbose() {
                return verbose;
            }

            @Override
            public boolean isElevated() {
                return elevated;
            }
        };
    }
}
