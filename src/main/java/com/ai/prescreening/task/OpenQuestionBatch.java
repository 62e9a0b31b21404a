package com.ai.prescreening.task;

import com.ai.prescreening.conversation.OpenAnswer;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.service.CallSession;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a list of open questions as a regression-capable task group and merges the answers into
 * the session state.
 */
public final class OpenQuestionBatch {

    private OpenQuestionBatch() {
    }

    /**
     * @return completes with true when the candidate asked for a recruiter during the batch
     */
    public static CompletableFuture<Boolean> run(CallSession session, List<QuestionSpec> questions, boolean allowEscalation) {
        CompletableFuture<Boolean> escalated = new CompletableFuture<>();
        TaskGroup<OpenQuestionResult> group = new TaskGroup<OpenQuestionResult>()
                .abortWhen(OpenQuestionResult::recruiterRequested);
        for (QuestionSpec q : questions) {
            group.add(q.id(),
                    StringUtils.defaultIfBlank(q.description(), q.text()),
                    () -> new OpenQuestionTask(q.id(), q.text(), allowEscalation, q.responseMessage()));
        }
        group.run(session, result -> escalated.complete(merge(session.getState(), questions, result)));
        return escalated;
    }

    static boolean merge(SessionState state, List<QuestionSpec> questions, TaskGroupResult<OpenQuestionResult> result) {
        boolean recruiterRequested = false;
        for (QuestionSpec q : questions) {
            OpenQuestionResult r = result.get(q.id());
            if (r == null) {
                continue;
            }
            if (r.recruiterRequested()) {
                recruiterRequested = true;
            }
            if (!r.answered()) {
                continue;
            }
            state.addOpenAnswer(OpenAnswer.builder()
                    .questionId(q.id())
                    .questionText(q.text())
                    .answerSummary(r.answerSummary())
                    .candidateNote(StringUtils.defaultString(r.candidateNote()))
                    .build());
        }
        return recruiterRequested;
    }
}
