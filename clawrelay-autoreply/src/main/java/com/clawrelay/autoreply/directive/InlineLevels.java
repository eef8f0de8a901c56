package com.clawrelay.autoreply.directive;

import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;

/**
 * One-turn level overrides taken from inline directives. Null fields are not
 * overridden.
 */
public record InlineLevels(ThinkLevel think, VerboseLevel verbose, ElevatedLevel elevated,
        ReasoningLevel reasoning) {

    private static final InlineLevels NONE = new InlineLevels(null, null, null, null);

    public static InlineLevels none() {
        return NONE;
    }

    public boolean isEmpty() {
        return think == null && verbose == null && elevated == null && reasoning == null;
    }

    /** Fields set in {@code later} win. */
    public InlineLevels merge(InlineLevels later) {
        if (later == null || later.isEmpty()) {
            return this;
        }
        return new InlineLevels(
                later.think != null ? later.think : think,
                later.verbose != null ? later.verbose : verbose,
                later.elevated != null ? later.elevated : elevated,
                later.reasoning != null ? later.reasoning : reasoning);
    }

    InlineLevels withThink(ThinkLevel level) {
        return new InlineLevels(level, verbose, elevated, reasoning);
    }

    InlineLevels withVerbose(VerboseLevel level) {
        return new InlineLevels(think, level, elevated, reasoning);
    }

    InlineLevels withElevated(ElevatedLevel level) {
        return new InlineLevels(think, verbose, level, reasoning);
    }

    InlineLevels withReasoning(ReasoningLevel level) {
        return new InlineLevels(think, verbose, elevated, level);
    }
}
