package com.ai.prescreening.conversation;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class KnockoutAnswer {

    private final String questionId;
    private final String questionText;
    private final QuestionResult result;
    private final String rawAnswer;
    @Builder.Default
    private final String candidateNote = "";
}
