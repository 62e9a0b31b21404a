package com.ai.prescreening.service;

import com.ai.prescreening.agent.StageName;
import com.ai.prescreening.conversation.UserState;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SilenceHandlerTest {

    private CallFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CallFixture(CallFixture.input().build());
        SilenceHandler handler = new SilenceHandler(fixture.phrases);
        fixture.session.setUserStateListener(s -> handler.handle(fixture.session, s));
        fixture.start(StageName.GREETING);
    }

    @Test
    void firstSilencePromptsSecondEndsTheCall() {
        fixture.session.onUserState(UserState.AWAY);

        assertThat(fixture.spoken()).containsExactly(fixture.phrases.silencePrompt("nl"));
        assertThat(fixture.session.isClosed()).isFalse();

        fixture.session.onUserState(UserState.AWAY);

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.silenceShutdown("nl"));
        assertThat(fixture.session.isClosed()).isTrue();
    }

    @Test
    void presenceResetsTheCount() {
        fixture.session.onUserState(UserState.AWAY);
        fixture.session.onUserState(UserState.PRESENT);
        fixture.session.onUserState(UserState.AWAY);

        assertThat(fixture.spoken()).containsExactly(fixture.phrases.silencePrompt("nl"), fixture.phrases.silencePrompt("nl"));
        assertThat(fixture.session.isClosed()).isFalse();
    }

    @Test
    void silenceWhileTheSystemSpeaksIsIgnored() {
        fixture.state().setSuppressSilence(true);

        fixture.session.onUserState(UserState.AWAY);
        fixture.session.onUserState(UserState.AWAY);

        assertThat(fixture.spoken()).isEmpty();
        assertThat(fixture.state().getSilenceCount()).isZero();
    }

    @Test
    void silenceAfterCloseIsIgnored() {
        fixture.session.onStreamStopped();

        fixture.session.onUserState(UserState.AWAY);

        assertThat(fixture.spoken()).isEmpty();
    }
}
