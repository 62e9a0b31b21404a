package com.ai.prescreening.agent;

import com.ai.prescreening.component.ResponsePhrases;
import com.ai.prescreening.conversation.IrrelevanceGuard;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.conversation.ToolHandler;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.TurnSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One phase of the interview. Owns its entry behavior, runs dialogue tasks, and decides which
 * stage comes next. Every stage shares the language switch, escalation and irrelevance tools.
 */
public abstract class StageAgent implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(StageAgent.class);

    enum BaseTool implements ToolDefinition {
        SWITCH_LANGUAGE("switch_language",
                "Switch the conversation language when the candidate speaks a different language. Supported: nl, en, fr, de.",
                "language"),
        ESCALATE_TO_RECRUITER("escalate_to_recruiter", "The candidate wants to talk to a real recruiter."),
        END_CONVERSATION_IRRELEVANT("end_conversation_irrelevant",
                "The candidate answers off-topic or nonsensically. Call immediately on every irrelevant answer.");

        private final String functionName;
        private final String description;
        private final List<String> parameters;

        BaseTool(String functionName, String description, String... parameters) {
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

    private final StageName name;
    protected final CallSession session;
    protected final boolean allowEscalation;

    protected StageAgent(StageName name, CallSession session, boolean allowEscalation) {
        this.name = name;
        this.session = session;
        this.allowEscalation = allowEscalation;
    }

    public abstract void onEnter();

    protected abstract List<ToolDefinition> stageTools();

    protected abstract CompletableFuture<String> handle(ToolCall call);

    public TurnSettings turnSettings() {
        return TurnSettings.CLOSED_QUESTION;
    }

    @Override
    public final List<ToolDefinition> tools() {
        List<ToolDefinition> tools = new ArrayList<>();
        for (BaseTool t : BaseTool.values()) {
            if (t != BaseTool.ESCALATE_TO_RECRUITER || allowEscalation) {
                tools.add(t);
            }
        }
        tools.addAll(stageTools());
        return tools;
    }

    @Override
    public final CompletableFuture<String> invoke(ToolCall call) {
        Optional<BaseTool> base = ToolDefinition.lookup(BaseTool.class, call.getName());
        if (base.isEmpty()) {
            return handle(call);
        }
        switch (base.get()) {
            case SWITCH_LANGUAGE:
                return switchLanguage(call.getString("language"));
            case ESCALATE_TO_RECRUITER:
                if (!allowEscalation) {
                    return noReply();
                }
                escalate();
                return noReply();
            case END_CONVERSATION_IRRELEVANT:
                IrrelevanceGuard.Check check = IrrelevanceGuard.check(state(), "to stay on topic");
                if (check.isLimitReached()) {
                    endCall(phrases().irrelevantShutdown(language()));
                    return noReply();
                }
                return reply(check.getWarning());
            default:
                return handle(call);
        }
    }

    private CompletableFuture<String> switchLanguage(String language) {
        String lang = language == null ? "" : language.trim().toLowerCase();
        if (!ResponsePhrases.isSupported(lang)) {
            return reply("Language '" + lang + "' is not supported. Supported: "
                    + String.join(", ", ResponsePhrases.SUPPORTED_LANGUAGES));
        }
        session.switchLanguage(lang);
        log.info("[{}] Language switched to {}", session.getCallId(), lang);
        return reply("Language switched to " + lang + ". Continue the conversation in this language.");
    }

    /**
     * Hands the candidate to the recruiter with a spoken hand-off line.
     */
    protected void escalate() {
        state().setRecruiterRequested(true);
        session.handOff(StageTransition.spoken(session.getAgentFactory().recruiter(session),
                phrases().recruiterHandoff(language())));
    }

    protected void endCall(String closingLine) {
        session.sayAndShutdown(closingLine);
    }

    protected StageAgent stage(StageName stage) {
        return session.getAgentFactory().create(stage, session);
    }

    protected SessionState state() {
        return session.getState();
    }

    protected SessionInput input() {
        return session.getState().getInput();
    }

    protected ResponsePhrases phrases() {
        return session.getPhrases();
    }

    protected String language() {
        return session.language();
    }

    protected CompletableFuture<String> unknownTool(ToolCall call) {
        log.warn("[{}] Unknown tool {} for stage {}", session.getCallId(), call.getName(), name.getKey());
        return reply("Unknown tool " + call.getName());
    }

    protected static CompletableFuture<String> reply(String output) {
        return CompletableFuture.completedFuture(output);
    }

    protected static CompletableFuture<String> noReply() {
        return CompletableFuture.completedFuture(null);
    }

    public StageName getName() {
        return name;
    }

    @Override
    public String handlerName() {
        return name.getKey();
    }
}
