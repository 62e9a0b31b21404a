package com.ai.prescreening.task;

/**
 * @param answered true only when the candidate was actually asked and answered
 */
public record OpenQuestionResult(String answerSummary, String candidateNote, boolean recruiterRequested, boolean answered) {

    public static OpenQuestionResult answered(String answerSummary, String candidateNote) {
        return new OpenQuestionResult(answerSummary, candidateNote, false, true);
    }

    public static OpenQuestionResult escalated(String candidateNote) {
        return new OpenQuestionResult("Candidate wants to talk to a recruiter", candidateNote, true, true);
    }

    public static OpenQuestionResult unanswered(String reason) {
        return new OpenQuestionResult(reason, "", false, false);
    }
}
