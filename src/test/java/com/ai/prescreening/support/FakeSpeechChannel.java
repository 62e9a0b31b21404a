package com.ai.prescreening.support;

import com.ai.prescreening.service.SpeechChannel;
import com.ai.prescreening.service.TurnSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Records every command; playout finishes immediately.
 */
public class FakeSpeechChannel implements SpeechChannel {

    public final List<String> spoken = new ArrayList<>();
    public final List<TurnSettings> turnSettings = new ArrayList<>();
    public final List<Duration> awayTimeouts = new ArrayList<>();
    public final List<String> languages = new ArrayList<>();
    public int clearedTurns;
    public int hangups;

    @Override
    public CompletableFuture<Void> speak(String text, boolean allowInterruptions) {
        spoken.add(text);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void clearUserTurn() {
        clearedTurns++;
    }

    @Override
    public void configureTurnDetection(TurnSettings settings) {
        turnSettings.add(settings);
    }

    @Override
    public void setUserAwayTimeout(Duration timeout) {
        awayTimeouts.add(timeout);
    }

    @Override
    public void switchLanguage(String language) {
        languages.add(language);
    }

    @Override
    public void hangup() {
        hangups++;
    }

    public String lastSpoken() {
        return spoken.isEmpty() ? null : spoken.get(spoken.size() - 1);
    }
}
