package com.ai.prescreening.console;

import com.ai.prescreening.service.SpeechChannel;
import com.ai.prescreening.service.TurnSettings;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

/**
 * Prints utterances instead of synthesizing them; playout finishes immediately.
 */
public class ConsoleSpeechChannel implements SpeechChannel {

    private final PrintStream out;
    private final CountDownLatch hungUp = new CountDownLatch(1);

    public ConsoleSpeechChannel(PrintStream out) {
        this.out = out;
    }

    @Override
    public CompletableFuture<Void> speak(String text, boolean allowInterruptions) {
        out.println("AGENT > " + text);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void clearUserTurn() {
    }

    @Override
    public void configureTurnDetection(TurnSettings settings) {
        out.println("        (turn detection: " + settings.mode().name().toLowerCase() + ")");
    }

    @Override
    public void setUserAwayTimeout(Duration timeout) {
        out.println("        (away timeout: " + timeout.getSeconds() + "s)");
    }

    @Override
    public void switchLanguage(String language) {
        out.println("        (language: " + language + ")");
    }

    @Override
    public void hangup() {
        out.println("        (call ended)");
        hungUp.countDown();
    }

    public boolean isHungUp() {
        return hungUp.getCount() == 0;
    }
}
