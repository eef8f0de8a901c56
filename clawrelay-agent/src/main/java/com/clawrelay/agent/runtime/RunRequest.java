package com.clawrelay.agent.runtime;

import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

/**
 * One agent turn to run for a session. The level fields are one-turn
 * overrides from inline directives; null means "use the session setting".
 */
@Value
@Builder
public class RunRequest {
    String sessionKey;
    String prompt;
    String sender;
    String transport;
    ThinkLevel thinkOverride;
    VerboseLevel verboseOverride;
    ElevatedLevel elevatedOverride;
    ReasoningLevel reasoningOverride;
    Consumer<String> toolResultListener;
}
