package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.CandidateRecord;
import com.ai.prescreening.conversation.KnockoutAnswer;
import com.ai.prescreening.conversation.KnockoutQuestion;
import com.ai.prescreening.conversation.QuestionResult;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.task.KnockoutResult;
import com.ai.prescreening.task.KnockoutTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the knockout questions in order, skipping those already answered in the candidate record.
 * Any non-pass result leaves the stage.
 */
public class ScreeningAgent extends StageAgent {

    private static final Logger log = LoggerFactory.getLogger(ScreeningAgent.class);

    static final String FIRST_TRANSITION =
            "Briefly say 'ok great, then we start with a first question' and go straight to the first question.";
    static final String LAST_TRANSITION =
            "Acknowledge the previous answer with a short word like a recruiter would ('Ok, great.', 'Ah nice.', 'Fine.'). "
                    + "Mention at most one key word of the answer. Then say you have one last yes or no question.";
    static final String NEXT_TRANSITION =
            "Acknowledge the previous answer with a short word like a recruiter would ('Ok, great.', 'Ah nice.', 'Fine.'). "
                    + "Mention at most one key word of the answer. Lead into the next question naturally.";

    private final List<KnockoutQuestion> questions;
    private final CandidateRecord record;

    public ScreeningAgent(CallSession session) {
        super(StageName.SCREENING, session, session.getState().getInput().isAllowEscalation());
        this.questions = input().getKnockoutQuestions();
        this.record = state().candidateRecord();
    }

    @Override
    public void onEnter() {
        state().resetSilence();
        if (record != null && !questions.isEmpty() && questions.stream().allMatch(q -> record.knows(q.getDataKey()))) {
            log.info("[{}] All {} knockout answers pre-known, skipping screening", session.getCallId(), questions.size());
            questions.forEach(this::recordPreKnown);
            passed();
            return;
        }
        askFrom(0, true);
    }

    private void askFrom(int index, boolean first) {
        for (int i = index; i < questions.size(); i++) {
            KnockoutQuestion q = questions.get(i);
            if (isPreKnown(q)) {
                recordPreKnown(q);
                continue;
            }
            int next = i + 1;
            String transition = transitionFor(first, remainingToAsk(i));
            session.runTask(new KnockoutTask(q, transition, allowEscalation), result -> onAnswered(q, result, next));
            return;
        }
        passed();
    }

    private void onAnswered(KnockoutQuestion q, KnockoutResult result, int next) {
        state().addKnockoutAnswer(KnockoutAnswer.builder()
                .questionId(q.getId())
                .questionText(q.getText())
                .result(result.result())
                .rawAnswer(result.rawAnswer())
                .candidateNote(result.candidateNote())
                .build());

        switch (result.result()) {
            case RECRUITER_REQUESTED:
                escalate();
                break;
            case UNCLEAR:
                endCall(phrases().screeningUnclear(language()));
                break;
            case IRRELEVANT:
                endCall(phrases().irrelevantShutdown(language()));
                break;
            case FAIL:
                session.handOff(StageTransition.silent(session.getAgentFactory().alternative(session, q.getText())));
                break;
            case PASS:
            default:
                askFrom(next, false);
                break;
        }
    }

    private void passed() {
        state().setPassedKnockout(true);
        session.handOff(StageTransition.silent(stage(StageName.OPEN_QUESTIONS)));
    }

    private boolean isPreKnown(KnockoutQuestion q) {
        return record != null && record.knows(q.getDataKey());
    }

    private void recordPreKnown(KnockoutQuestion q) {
        state().addKnockoutAnswer(KnockoutAnswer.builder()
                .questionId(q.getId())
                .questionText(q.getText())
                .result(QuestionResult.PASS)
                .rawAnswer("(pre-known: " + record.knownAnswer(q.getDataKey()) + ")")
                .build());
    }

    private int remainingToAsk(int from) {
        int remaining = 0;
        for (int i = from; i < questions.size(); i++) {
            if (!isPreKnown(questions.get(i))) {
                remaining++;
            }
        }
        return remaining;
    }

    static String transitionFor(boolean first, int remaining) {
        if (first) {
            return FIRST_TRANSITION;
        }
        return remaining == 1 ? LAST_TRANSITION : NEXT_TRANSITION;
    }

    @Override
    public String instructions() {
        return Prompts.screening(input().getJobTitle(), allowEscalation);
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
