package com.ai.prescreening.service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of the speech pipeline for one call. Implementations must be safe to call from
 * the call's event thread; returned futures may complete on any thread.
 */
public interface SpeechChannel {

    /**
     * Synthesizes and plays an utterance.
     *
     * @return completes when playout has finished or was interrupted
     */
    CompletableFuture<Void> speak(String text, boolean allowInterruptions);

    /** Discards buffered candidate audio that has not yet been committed as a turn. */
    void clearUserTurn();

    void configureTurnDetection(TurnSettings settings);

    void setUserAwayTimeout(Duration timeout);

    void switchLanguage(String language);

    void hangup();
}
