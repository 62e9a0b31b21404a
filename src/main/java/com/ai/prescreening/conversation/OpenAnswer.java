package com.ai.prescreening.conversation;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class OpenAnswer {

    private final String questionId;
    private final String questionText;
    private final String answerSummary;
    @Builder.Default
    private final String candidateNote = "";
}
