package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.ReplyRequest;
import com.ai.prescreening.task.OpenQuestionBatch;
import com.ai.prescreening.task.QuestionSpec;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reached after a knockout failure: offers other openings through a short fixed question batch.
 */
public class AlternativeAgent extends StageAgent {

    static final List<QuestionSpec> ALTERNATIVE_QUESTIONS = List.of(
            new QuestionSpec("alt1", "In welke regio zoek je werk?", "In welke regio zoek je werk?",
                    "Ok, goed, in die regio hebben we meer dan 50 vacatures."),
            new QuestionSpec("alt2", "Zoek je fulltime, parttime of flex?", "Zoek je fulltime, parttime of flex?", ""),
            new QuestionSpec("alt3", "Heb je ervaring in een bepaalde sector? Bijvoorbeeld logistiek, productie, retail?",
                    "Heb je ervaring in een bepaalde sector? Bijvoorbeeld logistiek, productie, retail?", ""));

    public enum Tool implements ToolDefinition {
        CANDIDATE_INTERESTED("candidate_interested", "The candidate is interested in other openings."),
        CANDIDATE_NOT_INTERESTED("candidate_not_interested", "The candidate is not interested in other openings.");

        private final String functionName;
        private final String description;

        Tool(String functionName, String description) {
            this.functionName = functionName;
            this.description = description;
        }

        @Override
        public String functionName() {
            return functionName;
        }

        @Override
        public String description() {
            return description;
        }

        @Override
        public List<String> parameters() {
            return List.of();
        }
    }

    private final String failedQuestion;

    public AlternativeAgent(CallSession session, String failedQuestion) {
        super(StageName.ALTERNATIVE, session, session.getState().getInput().isAllowEscalation());
        this.failedQuestion = failedQuestion;
    }

    @Override
    public void onEnter() {
        state().resetSilence();
        String opening = StringUtils.isNotBlank(failedQuestion)
                ? "The candidate did not meet the requirement: '" + failedQuestion + "'. "
                + "Say that is a pity, but that you would like to look at other possibilities. "
                : "";
        session.generateReply(ReplyRequest.instructions(opening
                + "Ask whether the candidate is interested in other openings."));
    }

    @Override
    public String instructions() {
        return Prompts.alternative(input().getJobTitle(), allowEscalation);
    }

    @Override
    protected List<ToolDefinition> stageTools() {
        return List.of(Tool.values());
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        Optional<Tool> tool = ToolDefinition.lookup(Tool.class, call.getName());
        if (tool.isEmpty()) {
            return unknownTool(call);
        }
        switch (tool.get()) {
            case CANDIDATE_INTERESTED:
                state().resetIrrelevant();
                state().setInterestedInAlternatives(true);
                OpenQuestionBatch.run(session, ALTERNATIVE_QUESTIONS, allowEscalation).thenAccept(this::onQuestionsAnswered);
                return noReply();
            case CANDIDATE_NOT_INTERESTED:
                endCall(phrases().alternativeNotInterested(language()));
                return noReply();
            default:
                return unknownTool(call);
        }
    }

    private void onQuestionsAnswered(boolean recruiterRequested) {
        if (state().isIrrelevantLimitReached()) {
            endCall(phrases().irrelevantShutdown(language()));
            return;
        }
        if (recruiterRequested) {
            escalate();
            return;
        }
        endCall(phrases().alternativeThanks(language()));
    }

    public String getFailedQuestion() {
        return failedQuestion;
    }
}
