package com.ai.prescreening.conversation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the final session state to one reported call status. Rules are evaluated in order,
 * first match wins.
 */
public final class OutcomeResolver {

    private OutcomeResolver() {
    }

    public static CallStatus resolve(SessionState state) {
        if (state.isVoicemailDetected()) {
            return CallStatus.VOICEMAIL;
        }
        if (Boolean.FALSE.equals(state.getConsentGiven())) {
            return CallStatus.NOT_INTERESTED;
        }
        if (state.isIrrelevantLimitReached()) {
            return CallStatus.IRRELEVANT;
        }
        List<QuestionResult> results = state.getKnockoutAnswers().stream()
                .map(KnockoutAnswer::getResult)
                .collect(Collectors.toList());
        if (results.contains(QuestionResult.UNCLEAR)) {
            return CallStatus.UNCLEAR;
        }
        if (results.contains(QuestionResult.RECRUITER_REQUESTED) || state.isRecruiterRequested()) {
            return CallStatus.ESCALATED;
        }
        if (results.contains(QuestionResult.FAIL)) {
            return state.isInterestedInAlternatives() ? CallStatus.KNOCKOUT_FAILED : CallStatus.NOT_INTERESTED;
        }
        if (state.getChosenTimeslot() != null || state.getSchedulingPreference() != null) {
            return CallStatus.COMPLETED;
        }
        return CallStatus.INCOMPLETE;
    }
}
