package com.ai.prescreening.task;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.IrrelevanceGuard;
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
 * Asks one free-text question and records a summary of the answer. Waits longer for the candidate
 * to finish speaking and never probes further.
 */
public class OpenQuestionTask extends DialogueTask<OpenQuestionResult> {

    private static final Logger log = LoggerFactory.getLogger(OpenQuestionTask.class);

    public static final int MAX_TURNS = 6;

    public enum Tool implements ToolDefinition {
        RECORD_ANSWER("record_answer",
                "Store the candidate's answer. Call as soon as you have a usable answer.", "answer_summary"),
        NOTE_FOR_RECRUITER("note_for_recruiter", "Store a question or remark of the candidate for the recruiter.", "note"),
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

    private final String questionId;
    private final String questionText;
    private final boolean allowEscalation;
    private final String responseMessage;
    private String candidateNote = "";

    public OpenQuestionTask(String questionId, String questionText, boolean allowEscalation, String responseMessage) {
        super("open:" + questionId, MAX_TURNS);
        this.questionId = questionId;
        this.questionText = questionText;
        this.allowEscalation = allowEscalation;
        this.responseMessage = responseMessage;
    }

    @Override
    protected CompletableFuture<Void> onEnter() {
        if (state().isIrrelevantLimitReached()) {
            complete(OpenQuestionResult.unanswered("Conversation ended due to irrelevant answers"));
            return CompletableFuture.completedFuture(null);
        }
        state().resetSilence();
        session.clearUserTurn();
        return session.withSilenceSuppressed(() -> session.generateReply(ReplyRequest.uninterruptible(
                "Ask this open question in a natural, conversational way: " + questionText)));
    }

    @Override
    protected OpenQuestionResult turnCapResult() {
        return new OpenQuestionResult("Candidate could not answer the question", candidateNote, false, true);
    }

    @Override
    public String instructions() {
        return Prompts.openQuestionTask(questionText, allowEscalation);
    }

    @Override
    protected List<ToolDefinition> taskTools() {
        return Arrays.stream(Tool.values())
                .filter(t -> allowEscalation || t != Tool.ESCALATE_TO_RECRUITER)
                .collect(Collectors.toList());
    }

    @Override
    public TurnSettings turnSettings() {
        return TurnSettings.OPEN_QUESTION;
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        Optional<Tool> tool = ToolDefinition.lookup(Tool.class, call.getName());
        if (tool.isEmpty()) {
            return unknownTool(call);
        }
        log.info("[{}] [{}] {} called: {}", session.getCallId(), questionId, call.getName(), call.getArguments());
        switch (tool.get()) {
            case NOTE_FOR_RECRUITER:
                candidateNote = call.getString("note");
                return noReply();
            case RECORD_ANSWER:
                return recordAnswer(call.getString("answer_summary"));
            case ESCALATE_TO_RECRUITER:
                if (!allowEscalation) {
                    return noReply();
                }
                complete(OpenQuestionResult.escalated(candidateNote));
                return noReply();
            case MARK_IRRELEVANT:
                IrrelevanceGuard.Check check = IrrelevanceGuard.check(state());
                if (check.isLimitReached()) {
                    complete(OpenQuestionResult.answered(call.getString("answer_summary"), candidateNote));
                    return noReply();
                }
                return reply(check.getWarning());
            default:
                return unknownTool(call);
        }
    }

    private CompletableFuture<String> recordAnswer(String summary) {
        CompletableFuture<Void> spoken = StringUtils.isNotBlank(responseMessage)
                ? session.say(responseMessage, false)
                : CompletableFuture.completedFuture(null);
        return spoken.thenApply(v -> {
            state().resetIrrelevant();
            complete(OpenQuestionResult.answered(summary, candidateNote));
            return null;
        });
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getCandidateNote() {
        return candidateNote;
    }
}
