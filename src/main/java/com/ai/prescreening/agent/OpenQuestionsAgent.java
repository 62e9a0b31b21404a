package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.CandidateRecord;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.TurnSettings;
import com.ai.prescreening.task.OpenQuestionBatch;
import com.ai.prescreening.task.QuestionSpec;
import com.ai.prescreening.task.ReadyCheckTask;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

public class OpenQuestionsAgent extends StageAgent {

    /** Candidates need more thinking time on open questions. */
    static final Duration OPEN_QUESTIONS_AWAY_TIMEOUT = Duration.ofSeconds(6);
    static final Duration DEFAULT_AWAY_TIMEOUT = Duration.ofSeconds(4);

    public OpenQuestionsAgent(CallSession session) {
        super(StageName.OPEN_QUESTIONS, session, session.getState().getInput().isAllowEscalation());
    }

    @Override
    public void onEnter() {
        state().resetSilence();
        session.setUserAwayTimeout(OPEN_QUESTIONS_AWAY_TIMEOUT);
        session.runTask(new ReadyCheckTask(phrases().readyCheck(language())), this::onReadyChecked);
    }

    private void onReadyChecked(Boolean ready) {
        if (!Boolean.TRUE.equals(ready)) {
            endCall(state().isIrrelevantLimitReached()
                    ? phrases().irrelevantShutdown(language())
                    : phrases().readyCheckDecline(language()));
            return;
        }
        List<QuestionSpec> specs = input().getOpenQuestions().stream()
                .map(q -> new QuestionSpec(q.getId(), q.getText(),
                        StringUtils.defaultIfBlank(q.getDescription(), q.getText()), ""))
                .collect(Collectors.toList());
        OpenQuestionBatch.run(session, specs, allowEscalation).thenAccept(this::onQuestionsAnswered);
    }

    private void onQuestionsAnswered(boolean recruiterRequested) {
        session.setUserAwayTimeout(DEFAULT_AWAY_TIMEOUT);

        if (state().isIrrelevantLimitReached()) {
            endCall(phrases().irrelevantShutdown(language()));
            return;
        }
        if (recruiterRequested) {
            escalate();
            return;
        }
        session.withSilenceSuppressed(() -> session.say(phrases().openQuestionsThanks(language()), false))
                .thenRun(this::afterThanks);
    }

    private void afterThanks() {
        CandidateRecord record = state().candidateRecord();
        if (record != null && record.hasExistingBooking()) {
            endCall(phrases().existingBooking(language(), record.getExistingBookingDate()));
            return;
        }
        session.handOff(StageTransition.silent(stage(StageName.SCHEDULING)));
    }

    @Override
    public TurnSettings turnSettings() {
        return TurnSettings.DEFAULT;
    }

    @Override
    public String instructions() {
        return Prompts.openQuestions(input().getJobTitle(), allowEscalation);
    }

    @Override
    protected List<ToolDefinition> stageTools() {
        return List.of();
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        return unknownTool(call);
    }
}
