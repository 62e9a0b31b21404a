package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.TurnSettings;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal hand-off phase. Greets the candidate by name and stays until the conversation is
 * declared finished, by the interpreter or by the human-facing side.
 */
public class RecruiterAgent extends StageAgent {

    public enum Tool implements ToolDefinition {
        END_CONVERSATION("end_conversation", "The conversation with the recruiter is finished."),
        OFFER_ALTERNATIVES("offer_alternatives", "The candidate would rather hear about other openings.");

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

    public RecruiterAgent(CallSession session) {
        super(StageName.RECRUITER, session, false);
    }

    @Override
    public void onEnter() {
        state().resetSilence();
        session.withSilenceSuppressed(() -> session.say(
                phrases().recruiterGreeting(language(), input().getCandidateName()), false));
    }

    /** The human-facing side signalled that the conversation is over. */
    public void finish() {
        endCall(phrases().recruiterGoodbye(language()));
    }

    @Override
    public TurnSettings turnSettings() {
        return TurnSettings.DEFAULT;
    }

    @Override
    public String instructions() {
        return Prompts.recruiter();
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
            case END_CONVERSATION:
                finish();
                return noReply();
            case OFFER_ALTERNATIVES:
                session.handOff(StageTransition.silent(session.getAgentFactory().alternative(session, "")));
                return noReply();
            default:
                return unknownTool(call);
        }
    }
}
