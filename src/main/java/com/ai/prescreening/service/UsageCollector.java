package com.ai.prescreening.service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Per-call usage counters. Updated from the call thread and from pipeline metrics events.
 */
public class UsageCollector {

    private final AtomicLong llmPromptTokens = new AtomicLong();
    private final AtomicLong llmCompletionTokens = new AtomicLong();
    private final AtomicLong ttsCharacters = new AtomicLong();
    private final DoubleAdder sttAudioSeconds = new DoubleAdder();

    public void addLlmTokens(long prompt, long completion) {
        llmPromptTokens.addAndGet(prompt);
        llmCompletionTokens.addAndGet(completion);
    }

    public void addTtsCharacters(long characters) {
        ttsCharacters.addAndGet(characters);
    }

    public void addSttAudioSeconds(double seconds) {
        if (seconds > 0) {
            sttAudioSeconds.add(seconds);
        }
    }

    public long getLlmPromptTokens() {
        return llmPromptTokens.get();
    }

    public long getLlmCompletionTokens() {
        return llmCompletionTokens.get();
    }

    public long getTtsCharacters() {
        return ttsCharacters.get();
    }

    public double getSttAudioSeconds() {
        return sttAudioSeconds.sum();
    }
}
