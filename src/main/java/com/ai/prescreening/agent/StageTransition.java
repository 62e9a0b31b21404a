package com.ai.prescreening.agent;

/**
 * Hand-off to the next stage agent, chosen by the outgoing agent. A spoken transition carries a
 * closing line that is played before the next agent is activated.
 */
public record StageTransition(StageAgent next, String closingUtterance) {

    public static StageTransition silent(StageAgent next) {
        return new StageTransition(next, null);
    }

    public static StageTransition spoken(StageAgent next, String closingUtterance) {
        return new StageTransition(next, closingUtterance);
    }

    public boolean isSpoken() {
        return closingUtterance != null && !closingUtterance.isBlank();
    }
}
