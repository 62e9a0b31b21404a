package com.ai.prescreening.service;

/**
 * Turns instructions plus the latest candidate utterance into spoken text and tool calls.
 */
public interface TurnInterpreter {

    TurnDecision interpret(TurnRequest request);
}
