package com.ai.prescreening.dto;

import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.KnockoutAnswer;
import com.ai.prescreening.conversation.KnockoutQuestion;
import com.ai.prescreening.conversation.OpenAnswer;
import com.ai.prescreening.conversation.OpenQuestion;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.conversation.QuestionResult;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.SessionState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Payload delivered to the result webhook once a call has ended.
 */
@Getter
@Builder
public class CallResult {

    @JsonProperty("call_id")
    private final String callId;

    @JsonProperty("status")
    private final CallStatus status;

    @JsonProperty("consent_given")
    private final Boolean consentGiven;

    @JsonProperty("voicemail_detected")
    private final boolean voicemailDetected;

    @JsonProperty("passed_knockout")
    private final boolean passedKnockout;

    @JsonProperty("interested_in_alternatives")
    private final boolean interestedInAlternatives;

    @JsonProperty("recruiter_requested")
    private final boolean recruiterRequested;

    @JsonProperty("knockout_answers")
    private final List<KnockoutAnswerEntry> knockoutAnswers;

    @JsonProperty("open_answers")
    private final List<OpenAnswerEntry> openAnswers;

    @JsonProperty("chosen_timeslot")
    private final String chosenTimeslot;

    @JsonProperty("scheduling_preference")
    private final String schedulingPreference;

    @JsonProperty("calendar_event_id")
    private final String calendarEventId;

    @JsonProperty("scheduled_date")
    private final String scheduledDate;

    @JsonProperty("scheduled_time")
    private final String scheduledTime;

    @JsonProperty("transcript")
    private final List<ChatMessage> transcript;

    @JsonProperty("usage")
    private final UsageReport usage;

    @Getter
    @Builder
    public static class KnockoutAnswerEntry {

        @JsonProperty("question_id")
        private final String questionId;

        @JsonProperty("internal_id")
        private final String internalId;

        @JsonProperty("question_text")
        private final String questionText;

        @JsonProperty("result")
        private final QuestionResult result;

        @JsonProperty("raw_answer")
        private final String rawAnswer;

        @JsonProperty("candidate_note")
        private final String candidateNote;
    }

    @Getter
    @Builder
    public static class OpenAnswerEntry {

        @JsonProperty("question_id")
        private final String questionId;

        @JsonProperty("internal_id")
        private final String internalId;

        @JsonProperty("question_text")
        private final String questionText;

        @JsonProperty("answer_summary")
        private final String answerSummary;

        @JsonProperty("candidate_note")
        private final String candidateNote;
    }

    /**
     * Resolves the final status and maps question ids back to the backend's internal ids.
     */
    public static CallResult from(SessionState state, List<ChatMessage> transcript, UsageReport usage) {
        SessionInput input = state.getInput();
        Map<String, String> knockoutIds = new HashMap<>();
        for (KnockoutQuestion q : input.getKnockoutQuestions()) {
            knockoutIds.put(q.getId(), q.getInternalId());
        }
        Map<String, String> openIds = new HashMap<>();
        for (OpenQuestion q : input.getOpenQuestions()) {
            openIds.put(q.getId(), q.getInternalId());
        }

        return CallResult.builder()
                .callId(input.getCallId())
                .status(OutcomeResolver.resolve(state))
                .consentGiven(state.getConsentGiven())
                .voicemailDetected(state.isVoicemailDetected())
                .passedKnockout(state.isPassedKnockout())
                .interestedInAlternatives(state.isInterestedInAlternatives())
                .recruiterRequested(state.isRecruiterRequested())
                .knockoutAnswers(state.getKnockoutAnswers().stream()
                        .map(a -> toEntry(a, knockoutIds))
                        .collect(Collectors.toList()))
                .openAnswers(state.getOpenAnswers().stream()
                        .map(a -> toEntry(a, openIds))
                        .collect(Collectors.toList()))
                .chosenTimeslot(state.getChosenTimeslot())
                .schedulingPreference(state.getSchedulingPreference())
                .calendarEventId(state.getCalendarEventId())
                .scheduledDate(state.getScheduledDate() == null ? null : state.getScheduledDate().toString())
                .scheduledTime(state.getScheduledTime())
                .transcript(transcript)
                .usage(usage)
                .build();
    }

    private static KnockoutAnswerEntry toEntry(KnockoutAnswer a, Map<String, String> internalIds) {
        return KnockoutAnswerEntry.builder()
                .questionId(a.getQuestionId())
                .internalId(internalIds.getOrDefault(a.getQuestionId(), ""))
                .questionText(a.getQuestionText())
                .result(a.getResult())
                .rawAnswer(a.getRawAnswer())
                .candidateNote(a.getCandidateNote())
                .build();
    }

    private static OpenAnswerEntry toEntry(OpenAnswer a, Map<String, String> internalIds) {
        return OpenAnswerEntry.builder()
                .questionId(a.getQuestionId())
                .internalId(internalIds.getOrDefault(a.getQuestionId(), ""))
                .questionText(a.getQuestionText())
                .answerSummary(a.getAnswerSummary())
                .candidateNote(a.getCandidateNote())
                .build();
    }
}
