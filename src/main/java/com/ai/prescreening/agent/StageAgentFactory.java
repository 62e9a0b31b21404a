package com.ai.prescreening.agent;

import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.SchedulingService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Builds stage agents bound to one call. Also used for the debug start override.
 */
@Component
public class StageAgentFactory {

    static final String DEBUG_FAILED_QUESTION = "(debug mode)";

    private final SchedulingService schedulingService;
    private final Executor backgroundExecutor;
    private final Clock clock;

    public StageAgentFactory(SchedulingService schedulingService,
                             @Qualifier("backgroundExecutor") Executor backgroundExecutor,
                             Clock clock) {
        this.schedulingService = schedulingService;
        this.backgroundExecutor = backgroundExecutor;
        this.clock = clock;
    }

    public StageAgent create(StageName name, CallSession session) {
        switch (name) {
            case SCREENING:
                return new ScreeningAgent(session);
            case OPEN_QUESTIONS:
                return new OpenQuestionsAgent(session);
            case SCHEDULING:
                return new SchedulingAgent(session, schedulingService, backgroundExecutor, clock);
            case ALTERNATIVE:
                return alternative(session, DEBUG_FAILED_QUESTION);
            case RECRUITER:
                return recruiter(session);
            case GREETING:
            default:
                return new GreetingAgent(session);
        }
    }

    public AlternativeAgent alternative(CallSession session, String failedQuestion) {
        return new AlternativeAgent(session, failedQuestion);
    }

    public RecruiterAgent recruiter(CallSession session) {
        return new RecruiterAgent(session);
    }
}
