package com.ai.prescreening.conversation;

/**
 * Presence signal emitted by the speech pipeline after a fixed quiet period.
 */
public enum UserState {
    PRESENT,
    AWAY;

    public static UserState fromWire(String value) {
        return "away".equalsIgnoreCase(value) ? AWAY : PRESENT;
    }
}
