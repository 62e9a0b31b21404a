package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Externally visible status of a finished call, as reported to the result webhook.
 */
public enum CallStatus {
    COMPLETED("completed"),
    VOICEMAIL("voicemail"),
    NOT_INTERESTED("not_interested"),
    KNOCKOUT_FAILED("knockout_failed"),
    ESCALATED("escalated"),
    UNCLEAR("unclear"),
    IRRELEVANT("irrelevant"),
    INCOMPLETE("incomplete");

    private final String wireValue;

    CallStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
