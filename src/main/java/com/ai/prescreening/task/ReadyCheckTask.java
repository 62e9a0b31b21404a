package com.ai.prescreening.task;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.IrrelevanceGuard;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.TurnSettings;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Waits for the candidate to confirm they are ready for the open questions.
 * Completes with false when declined, on the irrelevance cap, or at the turn cap.
 */
public class ReadyCheckTask extends DialogueTask<Boolean> {

    public static final int MAX_TURNS = 3;

    public enum Tool implements ToolDefinition {
        CONFIRM_READY("confirm_ready", "The candidate is ready to continue."),
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

    private final String message;

    public ReadyCheckTask(String message) {
        super("ready_check", MAX_TURNS);
        this.message = message;
    }

    @Override
    protected CompletableFuture<Void> onEnter() {
        state().resetSilence();
        return session.withSilenceSuppressed(() -> session.say(message, false));
    }

    @Override
    protected Boolean turnCapResult() {
        return Boolean.FALSE;
    }

    @Override
    public String instructions() {
        return Prompts.readyCheckTask();
    }

    @Override
    protected List<ToolDefinition> taskTools() {
        return List.of(Tool.values());
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
        switch (tool.get()) {
            case CONFIRM_READY:
                state().resetIrrelevant();
                complete(Boolean.TRUE);
                return noReply();
            case MARK_IRRELEVANT:
                IrrelevanceGuard.Check check = IrrelevanceGuard.check(state(), "whether they are ready");
                if (check.isLimitReached()) {
                    complete(Boolean.FALSE);
                    return noReply();
                }
                return reply(check.getWarning());
            default:
                return unknownTool(call);
        }
    }
}
