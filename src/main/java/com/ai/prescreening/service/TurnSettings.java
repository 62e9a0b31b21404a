package com.ai.prescreening.service;

import java.time.Duration;

/**
 * How the speech pipeline decides that the candidate finished a turn.
 */
public record TurnSettings(Mode mode, Duration minEndpointingDelay) {

    public enum Mode {
        SEMANTIC,
        DISABLED,
        VAD
    }

    /** Session default: semantic end-of-turn model. */
    public static final TurnSettings DEFAULT = new TurnSettings(Mode.SEMANTIC, Duration.ofMillis(500));

    /** Short yes/no answers, no semantic turn model. */
    public static final TurnSettings CLOSED_QUESTION = new TurnSettings(Mode.DISABLED, Duration.ofMillis(500));

    /** Free-text answers: VAD only, wait 2s of quiet before committing the turn. */
    public static final TurnSettings OPEN_QUESTION = new TurnSettings(Mode.VAD, Duration.ofSeconds(2));
}
