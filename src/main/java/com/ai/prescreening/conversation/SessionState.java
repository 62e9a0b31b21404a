package com.ai.prescreening.conversation;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single mutable record of one call. Created by the orchestrator, passed by reference into
 * every stage agent and task, and read once by {@link OutcomeResolver} at teardown.
 * Accessed only from the call's own event thread.
 */
@Getter
@Setter
public class SessionState {

    /** Irrelevant answers tolerated across the whole call before it is ended. */
    public static final int MAX_IRRELEVANT = 3;

    private final SessionInput input;

    private final List<KnockoutAnswer> knockoutAnswers = new ArrayList<>();
    private final List<OpenAnswer> openAnswers = new ArrayList<>();

    /** null until the candidate answered the recording consent question. */
    private Boolean consentGiven;
    private boolean voicemailDetected;
    private boolean passedKnockout;
    private boolean interestedInAlternatives;
    private boolean recruiterRequested;

    private String chosenTimeslot;
    private String schedulingPreference;
    private String calendarEventId;
    private LocalDate scheduledDate;
    private String scheduledTime;

    private int silenceCount;
    private boolean suppressSilence;
    private int irrelevantCount;

    private String language;

    public SessionState(SessionInput input, String defaultLanguage) {
        this.input = input;
        this.language = input.getLanguage() != null && !input.getLanguage().isBlank()
                ? input.getLanguage()
                : defaultLanguage;
    }

    public List<KnockoutAnswer> getKnockoutAnswers() {
        return Collections.unmodifiableList(knockoutAnswers);
    }

    public List<OpenAnswer> getOpenAnswers() {
        return Collections.unmodifiableList(openAnswers);
    }

    public void addKnockoutAnswer(KnockoutAnswer answer) {
        knockoutAnswers.add(answer);
    }

    public void addOpenAnswer(OpenAnswer answer) {
        openAnswers.add(answer);
    }

    public int incrementIrrelevant() {
        return ++irrelevantCount;
    }

    /** A valid answer anywhere in the call forgives earlier irrelevant ones. */
    public void resetIrrelevant() {
        irrelevantCount = 0;
    }

    public boolean isIrrelevantLimitReached() {
        return irrelevantCount >= MAX_IRRELEVANT;
    }

    public int incrementSilence() {
        return ++silenceCount;
    }

    public void resetSilence() {
        silenceCount = 0;
    }

    /**
     * The candidate record, only for a known candidate; null otherwise.
     */
    public CandidateRecord candidateRecord() {
        return input.isCandidateKnown() ? input.getCandidateRecord() : null;
    }
}
