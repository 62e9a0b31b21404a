package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single knockout question. Once assigned to a question id it is never reassigned.
 */
public enum QuestionResult {
    PASS("pass"),
    FAIL("fail"),
    UNCLEAR("unclear"),
    IRRELEVANT("irrelevant"),
    RECRUITER_REQUESTED("recruiter_requested");

    private final String wireValue;

    QuestionResult(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
