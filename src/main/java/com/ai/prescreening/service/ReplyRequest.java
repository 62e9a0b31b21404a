package com.ai.prescreening.service;

/**
 * One request for the interpreter to speak: either a reply to a candidate turn or a
 * system-initiated utterance driven by {@code instructions}.
 */
public record ReplyRequest(String instructions, String userText, boolean allowInterruptions) {

    public static ReplyRequest instructions(String instructions) {
        return new ReplyRequest(instructions, null, true);
    }

    public static ReplyRequest uninterruptible(String instructions) {
        return new ReplyRequest(instructions, null, false);
    }

    public static ReplyRequest userTurn(String userText) {
        return new ReplyRequest(null, userText, true);
    }

    ReplyRequest followUp() {
        return new ReplyRequest(null, null, allowInterruptions);
    }
}
