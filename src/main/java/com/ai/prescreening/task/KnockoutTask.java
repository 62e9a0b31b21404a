package com.ai.prescreening.task;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.IrrelevanceGuard;
import com.ai.prescreening.conversation.KnockoutQuestion;
import com.ai.prescreening.conversation.QuestionResult;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.ReplyRequest;
import com.ai.prescreening.service.TurnSettings;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Asks one yes/no knockout question. Short yes/no cadence, no semantic turn detection.
 */
public class KnockoutTask extends DialogueTask<KnockoutResult> {

    private static final Logger log = LoggerFactory.getLogger(KnockoutTask.class);

    /** The question plus three candidate turns. */
    public static final int MAX_TURNS = 4;

    static final String UNANSWERED = "Candidate could not answer the question";

    public enum Tool implements ToolDefinition {
        NOTE_FOR_RECRUITER("note_for_recruiter",
                "Store a question or remark of the candidate for the recruiter. Call before mark_pass or confirm_fail.", "note"),
        MARK_PASS("mark_pass", "The candidate answered YES to the knockout question.", "answer_summary"),
        CONFIRM_FAIL("confirm_fail", "The candidate answered NO and confirmed it when asked.", "answer_summary"),
        ESCALATE_TO_RECRUITER("escalate_to_recruiter", "The candidate wants to talk to a real recruiter."),
        MARK_IRRELEVANT("mark_irrelevant",
                "The candidate answers off-topic or nonsensically. Call immediately on every irrelevant answer.", "answer_summary");

        private final String functionName;
        private final String description;
        private final List<String> parameters;

        Tool(String functionName, String description, String... parameters) {
            this.functionName = functionName;
            this.description = description;
            this.parameters = List.of(parameters);
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
            return parameters;
        }
    }

    private final KnockoutQuestion question;
    private final String transition;
    private final boolean allowEscalation;
    private String candidateNote = "";

    public KnockoutTask(KnockoutQuestion question, String transition, boolean allowEscalation) {
        super("knockout:" + question.getId(), MAX_TURNS);
        this.question = question;
        this.transition = transition;
        this.allowEscalation = allowEscalation;
    }

    @Override
    protected CompletableFuture<Void> onEnter() {
        state().resetSilence();
        String intro = StringUtils.isNotBlank(transition)
                ? transition + " Then ask this question in a natural way: " + question.getText()
                : "Ask this question in a natural way: " + question.getText();
        return session.withSilenceSuppressed(() -> session.generateReply(ReplyRequest.uninterruptible(intro)));
    }

    @Override
    protected KnockoutResult turnCapResult() {
        return new KnockoutResult(QuestionResult.UNCLEAR, UNANSWERED, candidateNote);
    }

    @Override
    public String instructions() {
        return Prompts.knockoutTask(question.getText(), question.getContext(), allowEscalation);
    }

    @Override
    protected List<ToolDefinition> taskTools() {
        return Arrays.stream(Tool.values())
                .filter(t -> allowEscalation || t != Tool.ESCALATE_TO_RECRUITER)
                .collect(Collectors.toList());
    }

    @Override
    public TurnSettings turnSettings() {
        return TurnSettings.CLOSED_QUESTION;
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        Optional<Tool> tool = ToolDefinition.lookup(Tool.class, call.getName());
        if (tool.isEmpty()) {
            return unknownTool(call);
        }
        log.info("[{}] [{}] {} called: {}", session.getCallId(), question.getId(), call.getName(), call.getArguments());
        switch (tool.get()) {
            case NOTE_FOR_RECRUITER:
                candidateNote = call.getString("note");
                return reply("Noted. Tell the candidate you note it for the recruiter and continue with the question.");
            case MARK_PASS:
                state().resetIrrelevant();
                complete(new KnockoutResult(QuestionResult.PASS, call.getString("answer_summary"), candidateNote));
                return noReply();
            case CONFIRM_FAIL:
                state().resetIrrelevant();
                complete(new KnockoutResult(QuestionResult.FAIL, call.getString("answer_summary"), candidateNote));
                return noReply();
            case ESCALATE_TO_RECRUITER:
                if (!allowEscalation) {
                    return noReply();
                }
                complete(new KnockoutResult(QuestionResult.RECRUITER_REQUESTED,
                        "Candidate wants to talk to a recruiter", candidateNote));
                return noReply();
            case MARK_IRRELEVANT:
                IrrelevanceGuard.Check check = IrrelevanceGuard.check(state());
                if (check.isLimitReached()) {
                    complete(new KnockoutResult(QuestionResult.IRRELEVANT, call.getString("answer_summary"), candidateNote));
                    return noReply();
                }
                return reply(check.getWarning());
            default:
                return unknownTool(call);
        }
    }

    public KnockoutQuestion getQuestion() {
        return question;
    }

    public String getCandidateNote() {
        return candidateNote;
    }
}
