package com.ai.prescreening.service;

import com.ai.prescreening.component.ResponsePhrases;
import com.ai.prescreening.conversation.SessionState;
import com.ai.prescreening.conversation.UserState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Call-wide reaction to the speech pipeline's present/away signal. First silence: a gentle
 * prompt. Second: closing line and drain shutdown. Muted while the system itself is speaking.
 */
@Component
public class SilenceHandler {

    private static final Logger log = LoggerFactory.getLogger(SilenceHandler.class);

    static final int MAX_SILENCES = 2;

    private final ResponsePhrases phrases;

    public SilenceHandler(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public void handle(CallSession session, UserState newState) {
        SessionState state = session.getState();
        if (newState == UserState.PRESENT) {
            state.resetSilence();
            return;
        }
        if (state.isSuppressSilence()) {
            log.debug("[{}] Away during system speech, ignored", session.getCallId());
            return;
        }
        int count = state.incrementSilence();
        log.info("[{}] Candidate silent ({}/{})", session.getCallId(), count, MAX_SILENCES);
        if (count < MAX_SILENCES) {
            session.say(phrases.silencePrompt(state.getLanguage()), true);
        } else {
            session.sayAndShutdown(phrases.silenceShutdown(state.getLanguage()));
        }
    }
}
