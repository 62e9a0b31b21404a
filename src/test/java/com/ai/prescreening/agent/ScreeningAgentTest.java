package com.ai.prescreening.agent;

import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.CandidateRecord;
import com.ai.prescreening.conversation.KnockoutAnswer;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.conversation.QuestionResult;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

class ScreeningAgentTest {

    private static CallFixture started(Map<String, String> knownAnswers) {
        CallFixture fixture = new CallFixture(CallFixture.input()
                .candidateKnown(knownAnswers != null)
                .candidateRecord(knownAnswers == null ? null : CandidateRecord.builder().knownAnswers(knownAnswers).build())
                .build());
        fixture.start(StageName.SCREENING);
        return fixture;
    }

    private static void pass(CallFixture fixture) {
        fixture.invoke("mark_pass", Map.of("answer_summary", "ja"));
    }

    @Test
    void asksEveryQuestionWithTransitions() {
        CallFixture fixture = started(null);

        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("knockout:q1");
        assertThat(fixture.interpreter.requests.get(0).instructions()).contains(ScreeningAgent.FIRST_TRANSITION);

        pass(fixture);

        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("knockout:q2");
        assertThat(fixture.interpreter.requests.get(1).instructions()).contains(ScreeningAgent.LAST_TRANSITION);

        pass(fixture);

        assertThat(fixture.state().isPassedKnockout()).isTrue();
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.OPEN_QUESTIONS);
        assertThat(fixture.state().getKnockoutAnswers())
                .extracting(KnockoutAnswer::getQuestionId, KnockoutAnswer::getResult)
                .containsExactly(tuple("q1", QuestionResult.PASS), tuple("q2", QuestionResult.PASS));
    }

    @Test
    void skipsTheWholeStageWhenEveryAnswerIsKnown() {
        CallFixture fixture = started(Map.of("license", "ja", "shifts", "ja"));

        assertThat(fixture.interpreter.requests).isEmpty();
        assertThat(fixture.state().isPassedKnockout()).isTrue();
        assertThat(fixture.state().getKnockoutAnswers())
                .extracting(KnockoutAnswer::getQuestionId, KnockoutAnswer::getRawAnswer)
                .containsExactly(tuple("q1", "(pre-known: ja)"), tuple("q2", "(pre-known: ja)"));
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.OPEN_QUESTIONS);
        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("ready_check");
    }

    @Test
    void recordOfAnUnknownCandidateIsIgnored() {
        CallFixture fixture = new CallFixture(CallFixture.input()
                .candidateKnown(false)
                .candidateRecord(CandidateRecord.builder().knownAnswers(Map.of("license", "ja", "shifts", "ja")).build())
                .build());
        fixture.start(StageName.SCREENING);

        assertThat(fixture.state().getKnockoutAnswers()).isEmpty();
        assertThat(fixture.state().candidateRecord()).isNull();
        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("knockout:q1");
    }

    @Test
    void skipsOnlyTheKnownQuestions() {
        CallFixture fixture = started(Map.of("license", "ja"));

        assertThat(fixture.state().getKnockoutAnswers()).extracting(KnockoutAnswer::getQuestionId).containsExactly("q1");
        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("knockout:q2");
        assertThat(fixture.interpreter.requests).singleElement()
                .satisfies(r -> assertThat(r.instructions()).contains(ScreeningAgent.FIRST_TRANSITION));

        pass(fixture);

        assertThat(fixture.state().isPassedKnockout()).isTrue();
    }

    @Test
    void failureMovesToAlternatives() {
        CallFixture fixture = started(null);

        fixture.invoke("confirm_fail", Map.of("answer_summary", "nee, geen rijbewijs"));

        assertThat(fixture.state().isPassedKnockout()).isFalse();
        assertThat(fixture.session.getActiveAgent()).isInstanceOfSatisfying(AlternativeAgent.class,
                a -> assertThat(a.getFailedQuestion()).isEqualTo("Heb je een rijbewijs B?"));
        assertThat(fixture.interpreter.requests.get(1).instructions())
                .contains("did not meet the requirement: 'Heb je een rijbewijs B?'");
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.NOT_INTERESTED);
    }

    @Test
    void unansweredQuestionEndsTheCallAsUnclear() {
        CallFixture fixture = started(null);

        for (int i = 0; i < 4; i++) {
            fixture.userTurn("euh");
        }

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.screeningUnclear("nl"));
        assertThat(fixture.closed).hasSize(1);
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.UNCLEAR);
    }

    @Test
    void irrelevantAnswersEndTheCall() {
        CallFixture fixture = started(null);

        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "a"));
        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "b"));
        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "c"));

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.irrelevantShutdown("nl"));
        assertThat(fixture.state().getKnockoutAnswers()).extracting(KnockoutAnswer::getResult)
                .containsExactly(QuestionResult.IRRELEVANT);
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.IRRELEVANT);
    }

    @Test
    void escalationDuringAQuestionGoesToTheRecruiter() {
        CallFixture fixture = started(null);

        fixture.invoke("escalate_to_recruiter");

        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.RECRUITER);
        assertThat(fixture.state().isRecruiterRequested()).isTrue();
        assertThat(fixture.spoken()).containsExactly(
                fixture.phrases.recruiterHandoff("nl"),
                fixture.phrases.recruiterGreeting("nl", "Sara Peeters"));
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.ESCALATED);
    }

    @Test
    void transitionDependsOnPosition() {
        assertThat(ScreeningAgent.transitionFor(true, 1)).isEqualTo(ScreeningAgent.FIRST_TRANSITION);
        assertThat(ScreeningAgent.transitionFor(false, 1)).isEqualTo(ScreeningAgent.LAST_TRANSITION);
        assertThat(ScreeningAgent.transitionFor(false, 3)).isEqualTo(ScreeningAgent.NEXT_TRANSITION);
    }
}
