package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CallSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Opens the call: confirms a human answered, optionally records consent and identity, and hands
 * over to screening once the candidate has time.
 */
public class GreetingAgent extends StageAgent {

    private static final Logger log = LoggerFactory.getLogger(GreetingAgent.class);

    public enum Tool implements ToolDefinition {
        RECORD_CONSENT("record_consent", "The candidate consents to the call being recorded."),
        RECORD_NO_CONSENT("record_no_consent", "The candidate does not want the call to be recorded."),
        CANDIDATE_READY("candidate_ready", "The candidate confirmed they have time for the pre-screening."),
        DETECTED_VOICEMAIL("detected_voicemail",
                "Call when you detect a voicemail system or answering machine, after its greeting."),
        CANDIDATE_IS_PROXY("candidate_is_proxy",
                "The caller is not the candidate but someone calling on their behalf (friend, family)."),
        CANDIDATE_NOT_AVAILABLE("candidate_not_available", "The candidate has no time or is not interested.");

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

    public GreetingAgent(CallSession session) {
        super(StageName.GREETING, session, session.getState().getInput().isAllowEscalation());
    }

    @Override
    public void onEnter() {
        state().resetSilence();
    }

    @Override
    public String instructions() {
        SessionInput in = input();
        return Prompts.greeting(in.getJobTitle(), in.getCandidateName(), in.isCandidateKnown(),
                allowEscalation, in.isRequireConsent());
    }

    @Override
    protected List<ToolDefinition> stageTools() {
        List<ToolDefinition> tools = new ArrayList<>();
        for (Tool t : Tool.values()) {
            boolean consentTool = t == Tool.RECORD_CONSENT || t == Tool.RECORD_NO_CONSENT;
            if (!consentTool || input().isRequireConsent()) {
                tools.add(t);
            }
        }
        return tools;
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        Optional<Tool> tool = ToolDefinition.lookup(Tool.class, call.getName());
        if (tool.isEmpty()) {
            return unknownTool(call);
        }
        switch (tool.get()) {
            case RECORD_CONSENT:
                state().setConsentGiven(Boolean.TRUE);
                return reply("Consent noted. Continue with the introduction.");
            case RECORD_NO_CONSENT:
                state().setConsentGiven(Boolean.FALSE);
                return reply("Noted. Continue with the introduction.");
            case CANDIDATE_READY:
                state().resetIrrelevant();
                session.handOff(StageTransition.silent(stage(StageName.SCREENING)));
                return noReply();
            case DETECTED_VOICEMAIL:
                log.info("[{}] Voicemail detected", session.getCallId());
                state().setVoicemailDetected(true);
                endCall(phrases().voicemail(language(), input().getCandidateName()));
                return noReply();
            case CANDIDATE_IS_PROXY:
                endCall(phrases().proxyDetected(language()));
                return noReply();
            case CANDIDATE_NOT_AVAILABLE:
                endCall(phrases().candidateNotAvailable(language()));
                return noReply();
            default:
                return unknownTool(call);
        }
    }
}
