package com.ai.prescreening.service;

import com.ai.prescreening.agent.RecruiterAgent;
import com.ai.prescreening.agent.StageAgent;
import com.ai.prescreening.agent.StageAgentFactory;
import com.ai.prescreening.agent.StageName;
import com.ai.prescreening.component.ResponsePhrases;
import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.dto.CallResult;
import com.ai.prescreening.dto.UsageReport;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Single entry for a call's lifecycle: builds the session, picks the first stage, wires the
 * call-wide silence handling and runs teardown once the call has closed.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final TurnInterpreter interpreter;
    private final ResponsePhrases phrases;
    private final StageAgentFactory agentFactory;
    private final SilenceHandler silenceHandler;
    private final UsageReporter usageReporter;
    private final ResultWebhookService webhookService;

    private final Map<String, CallSession> activeCalls = new ConcurrentHashMap<>();

    @Value("${prescreening.default-language:nl}")
    private String defaultLanguage = ResponsePhrases.DEFAULT_LANGUAGE;

    @Value("${prescreening.dev.start-agent:}")
    private String devStartAgent = "";

    @Value("${call.drain-timeout:PT5S}")
    private Duration drainTimeout = Duration.ofSeconds(5);

    public ConversationOrchestrator(TurnInterpreter interpreter,
                                    ResponsePhrases phrases,
                                    StageAgentFactory agentFactory,
                                    SilenceHandler silenceHandler,
                                    UsageReporter usageReporter,
                                    ResultWebhookService webhookService) {
        this.interpreter = interpreter;
        this.phrases = phrases;
        this.agentFactory = agentFactory;
        this.silenceHandler = silenceHandler;
        this.usageReporter = usageReporter;
        this.webhookService = webhookService;
    }

    /**
     * Starts a call on its own event thread. The first stage runs once that thread picks it up.
     *
     * @throws IllegalArgumentException if the input is invalid
     * @throws IllegalStateException    if a call with the same id is already active
     */
    public CallSession startCall(SessionInput input, SpeechChannel channel) {
        if (StringUtils.isBlank(input.getCallId())) {
            input = input.toBuilder().callId(UUID.randomUUID().toString()).build();
        }
        input.validate();
        String callId = input.getCallId();

        ExecutorService executor = newCallExecutor(callId);
        CallSession session = new CallSession(new SessionState(input, defaultLanguage), channel, interpreter,
                phrases, agentFactory, executor, drainTimeout);
        if (activeCalls.putIfAbsent(callId, session) != null) {
            executor.shutdown();
            throw new IllegalStateException("Call " + callId + " is already active");
        }
        session.setUserStateListener(userState -> silenceHandler.handle(session, userState));
        session.setCloseListener(closed -> teardown(closed, executor));

        StageName start = startStage(input);
        log.info("[{}] Starting call for {} ({}) in stage {}", callId, input.getCandidateName(), input.getJobTitle(), start.getKey());
        session.start(agentFactory.create(start, session));
        return session;
    }

    /**
     * The human-facing side ended the recruiter conversation.
     *
     * @return false when no such call is active
     */
    public boolean recruiterFinished(String callId) {
        CallSession session = activeCalls.get(callId);
        if (session == null) {
            return false;
        }
        session.execute(() -> {
            StageAgent agent = session.getActiveAgent();
            if (agent instanceof RecruiterAgent) {
                ((RecruiterAgent) agent).finish();
            } else {
                log.warn("[{}] Recruiter finish signal ignored, active stage is {}", callId,
                        agent == null ? "-" : agent.getName().getKey());
            }
        });
        return true;
    }

    public List<String> activeCallIds() {
        return List.copyOf(activeCalls.keySet());
    }

    public CallSession getCall(String callId) {
        return activeCalls.get(callId);
    }

    StageName startStage(SessionInput input) {
        String requested = StringUtils.defaultIfBlank(input.getStartAgent(), devStartAgent);
        if (StringUtils.isBlank(requested)) {
            return StageName.GREETING;
        }
        StageName stage = StageName.fromKey(requested.trim());
        if (stage == null) {
            log.warn("[{}] Unknown start stage '{}', starting with greeting", input.getCallId(), requested);
            return StageName.GREETING;
        }
        return stage;
    }

    protected ExecutorService newCallExecutor(String callId) {
        return Executors.newSingleThreadExecutor(r -> new Thread(r, "call-" + callId));
    }

    /**
     * Runs on the call thread after the session closed. Every step is isolated so a failing one
     * cannot keep the others from running.
     */
    void teardown(CallSession session, ExecutorService executor) {
        String callId = session.getCallId();
        SessionState state = session.getState();
        try {
            try {
                CallStatus status = OutcomeResolver.resolve(state);
                log.info("[{}] Call finished with status {} ({} transcript messages)", callId,
                        status.getWireValue(), session.getTranscript().size());
            } catch (RuntimeException e) {
                log.error("[{}] Failed to resolve call status", callId, e);
            }

            UsageReport usage = null;
            try {
                usage = usageReporter.build(session);
                usageReporter.save(usage);
            } catch (RuntimeException e) {
                log.error("[{}] Failed to record usage", callId, e);
            }

            try {
                if (state.getInput().isPlayground()) {
                    log.info("[{}] Playground mode: skipping backend webhook POST", callId);
                } else {
                    webhookService.deliver(CallResult.from(state, session.getTranscript().getMessages(), usage));
                }
            } catch (RuntimeException e) {
                log.error("[{}] Failed to deliver call result", callId, e);
            }

            try {
                session.hangup();
            } catch (RuntimeException e) {
                log.error("[{}] Failed to hang up", callId, e);
            }
        } finally {
            activeCalls.remove(callId, session);
            executor.shutdown();
        }
    }
}
