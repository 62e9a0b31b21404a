package com.ai.prescreening.agent;

import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.TurnSettings;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GreetingAgentTest {

    private CallFixture started(boolean requireConsent) {
        CallFixture fixture = new CallFixture(CallFixture.input().requireConsent(requireConsent).build());
        fixture.start(StageName.GREETING);
        return fixture;
    }

    @Test
    void waitsForTheCandidateBeforeGreeting() {
        CallFixture fixture = started(false);

        assertThat(fixture.spoken()).isEmpty();
        assertThat(fixture.interpreter.requests).isEmpty();
        assertThat(fixture.channel.turnSettings).containsExactly(TurnSettings.CLOSED_QUESTION);

        fixture.userTurn("Hallo?");

        assertThat(fixture.interpreter.requests).singleElement().satisfies(r -> {
            assertThat(r.userText()).isEqualTo("Hallo?");
            assertThat(r.instructions()).contains("Magazijnier").doesNotContain("`record_consent`");
        });
    }

    @Test
    void consentToolsOnlyWhenConsentIsRequired() {
        assertThat(started(false).session.getActiveAgent().tools())
                .extracting(ToolDefinition::functionName)
                .doesNotContain("record_consent", "record_no_consent")
                .contains("candidate_ready", "switch_language", "escalate_to_recruiter", "end_conversation_irrelevant");

        assertThat(started(true).session.getActiveAgent().tools())
                .extracting(ToolDefinition::functionName)
                .contains("record_consent", "record_no_consent");
    }

    @Test
    void consentIsRecordedBothWays() {
        CallFixture fixture = started(true);

        assertThat(fixture.invoke("record_consent")).startsWith("Consent noted.");
        assertThat(fixture.state().getConsentGiven()).isTrue();

        fixture.invoke("record_no_consent");
        assertThat(fixture.state().getConsentGiven()).isFalse();
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.NOT_INTERESTED);
    }

    @Test
    void readyCandidateMovesToScreening() {
        CallFixture fixture = started(false);
        fixture.state().setIrrelevantCount(2);

        fixture.invoke("candidate_ready");

        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.SCREENING);
        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("knockout:q1");
        assertThat(fixture.state().getIrrelevantCount()).isZero();
    }

    @Test
    void voicemailLeavesAMessageAndEndsTheCall() {
        CallFixture fixture = started(false);

        fixture.invoke("detected_voicemail");

        assertThat(fixture.state().isVoicemailDetected()).isTrue();
        assertThat(fixture.spoken()).containsExactly(fixture.phrases.voicemail("nl", "Sara Peeters"));
        assertThat(fixture.closed).containsExactly(fixture.session);
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.VOICEMAIL);
    }

    @Test
    void proxyAndUnavailableCandidatesGetAClosingLine() {
        CallFixture proxy = started(false);
        proxy.invoke("candidate_is_proxy");
        assertThat(proxy.spoken()).containsExactly(proxy.phrases.proxyDetected("nl"));
        assertThat(proxy.session.isClosed()).isTrue();

        CallFixture busy = started(false);
        busy.invoke("candidate_not_available");
        assertThat(busy.spoken()).containsExactly(busy.phrases.candidateNotAvailable("nl"));
        assertThat(OutcomeResolver.resolve(busy.state())).isEqualTo(CallStatus.INCOMPLETE);
    }

    @Test
    void switchesToSupportedLanguagesOnly() {
        CallFixture fixture = started(false);

        assertThat(fixture.invoke("switch_language", Map.of("language", " EN ")))
                .isEqualTo("Language switched to en. Continue the conversation in this language.");
        assertThat(fixture.state().getLanguage()).isEqualTo("en");
        assertThat(fixture.channel.languages).containsExactly("en");

        assertThat(fixture.invoke("switch_language", Map.of("language", "es"))).contains("not supported");
        assertThat(fixture.state().getLanguage()).isEqualTo("en");
    }

    @Test
    void phrasesFollowTheSwitchedLanguage() {
        CallFixture fixture = started(false);
        fixture.invoke("switch_language", Map.of("language", "en"));

        fixture.invoke("candidate_not_available");

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.candidateNotAvailable("en"));
    }

    @Test
    void thirdIrrelevantTurnEndsTheCall() {
        CallFixture fixture = started(false);

        assertThat(fixture.invoke("end_conversation_irrelevant")).contains("to stay on topic");
        fixture.invoke("end_conversation_irrelevant");
        assertThat(fixture.session.isClosed()).isFalse();
        fixture.invoke("end_conversation_irrelevant");

        assertThat(fixture.spoken()).containsExactly(fixture.phrases.irrelevantShutdown("nl"));
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.IRRELEVANT);
    }

    @Test
    void escalationHandsOverToTheRecruiter() {
        CallFixture fixture = started(false);

        fixture.invoke("escalate_to_recruiter");

        assertThat(fixture.state().isRecruiterRequested()).isTrue();
        assertThat(fixture.spoken()).containsExactly(
                fixture.phrases.recruiterHandoff("nl"),
                fixture.phrases.recruiterGreeting("nl", "Sara Peeters"));
        assertThat(fixture.session.getActiveAgent()).isInstanceOf(RecruiterAgent.class);
    }

    @Test
    void escalationIsIgnoredWhenNotAllowed() {
        CallFixture fixture = new CallFixture(CallFixture.input().allowEscalation(false).build());
        fixture.start(StageName.GREETING);

        assertThat(fixture.session.getActiveAgent().tools())
                .extracting(ToolDefinition::functionName).doesNotContain("escalate_to_recruiter");
        fixture.invoke("escalate_to_recruiter");

        assertThat(fixture.state().isRecruiterRequested()).isFalse();
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.GREETING);
    }
}
