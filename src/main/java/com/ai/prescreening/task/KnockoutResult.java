package com.ai.prescreening.task;

import com.ai.prescreening.conversation.QuestionResult;

public record KnockoutResult(QuestionResult result, String rawAnswer, String candidateNote) {
}
