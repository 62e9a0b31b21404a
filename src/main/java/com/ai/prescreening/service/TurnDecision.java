package com.ai.prescreening.service;

import com.ai.prescreening.conversation.ToolCall;

import java.util.List;

public record TurnDecision(String reply, List<ToolCall> toolCalls, int promptTokens, int completionTokens) {

    public static TurnDecision empty() {
        return new TurnDecision("", List.of(), 0, 0);
    }

    public static TurnDecision say(String reply) {
        return new TurnDecision(reply, List.of(), 0, 0);
    }

    public static TurnDecision call(ToolCall... calls) {
        return new TurnDecision("", List.of(calls), 0, 0);
    }
}
