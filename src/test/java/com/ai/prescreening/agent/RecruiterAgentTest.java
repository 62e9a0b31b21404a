package com.ai.prescreening.agent;

import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.TurnSettings;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecruiterAgentTest {

    private CallFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CallFixture(CallFixture.input().build());
        fixture.start(StageName.RECRUITER);
    }

    @Test
    void greetsTheCandidateByName() {
        assertThat(fixture.spoken()).containsExactly(fixture.phrases.recruiterGreeting("nl", "Sara Peeters"));
        assertThat(fixture.channel.turnSettings).containsExactly(TurnSettings.DEFAULT);
    }

    @Test
    void cannotEscalateAgain() {
        assertThat(fixture.session.getActiveAgent().tools())
                .extracting(ToolDefinition::functionName)
                .doesNotContain("escalate_to_recruiter")
                .contains("end_conversation", "offer_alternatives");

        assertThat(fixture.invoke("escalate_to_recruiter")).isNull();
        assertThat(fixture.spoken()).hasSize(1);
    }

    @Test
    void endConversationSaysGoodbye() {
        fixture.invoke("end_conversation");

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.recruiterGoodbye("nl"));
        assertThat(fixture.closed).containsExactly(fixture.session);
    }

    @Test
    void finishFromOutsideEndsTheCall() {
        RecruiterAgent agent = (RecruiterAgent) fixture.session.getActiveAgent();

        fixture.session.execute(agent::finish);

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.recruiterGoodbye("nl"));
        assertThat(fixture.session.isClosed()).isTrue();
    }

    @Test
    void candidateCanStillHearAboutOtherOpenings() {
        fixture.invoke("offer_alternatives");

        assertThat(fixture.session.getActiveAgent()).isInstanceOfSatisfying(AlternativeAgent.class,
                a -> assertThat(a.getFailedQuestion()).isEmpty());
        assertThat(fixture.interpreter.requests).singleElement()
                .satisfies(r -> assertThat(r.instructions()).doesNotContain("did not meet the requirement"));
    }
}
