package com.ai.prescreening.agent;

import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.CandidateRecord;
import com.ai.prescreening.conversation.OpenAnswer;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.service.TurnSettings;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpenQuestionsAgentTest {

    private static CallFixture started(CandidateRecord record) {
        CallFixture fixture = new CallFixture(CallFixture.input().candidateKnown(record != null).candidateRecord(record).build());
        fixture.start(StageName.OPEN_QUESTIONS);
        return fixture;
    }

    private static void answer(CallFixture fixture, String summary) {
        fixture.invoke("record_answer", Map.of("answer_summary", summary));
    }

    @Test
    void checksReadinessWithALongerAwayTimeout() {
        CallFixture fixture = started(null);

        assertThat(fixture.channel.awayTimeouts).containsExactly(Duration.ofSeconds(6));
        assertThat(fixture.spoken()).containsExactly(fixture.phrases.readyCheck("nl"));
        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("ready_check");
        assertThat(fixture.channel.turnSettings).containsExactly(TurnSettings.DEFAULT, TurnSettings.CLOSED_QUESTION);
    }

    @Test
    void answersEveryQuestionThenMovesToScheduling() {
        CallFixture fixture = started(null);
        fixture.invoke("confirm_ready");

        assertThat(fixture.session.getActiveTask().handlerName()).isEqualTo("open:oq1");
        answer(fixture, "Goede sfeer");
        answer(fixture, "Magazijnier bij een koerier");

        assertThat(fixture.channel.awayTimeouts).containsExactly(Duration.ofSeconds(6), Duration.ofSeconds(4));
        assertThat(fixture.spoken()).contains(fixture.phrases.openQuestionsThanks("nl"),
                fixture.phrases.schedulingInvite("nl", "Gent"));
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.SCHEDULING);
        assertThat(fixture.state().getOpenAnswers())
                .extracting(OpenAnswer::getQuestionId).containsExactly("oq1", "oq2");
        assertThat(fixture.state().isSuppressSilence()).isFalse();
    }

    @Test
    void existingBookingEndsTheCallInsteadOfScheduling() {
        CallFixture fixture = started(CandidateRecord.builder().existingBookingDate("vrijdag 6 maart").build());
        fixture.invoke("confirm_ready");
        answer(fixture, "a");
        answer(fixture, "b");

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.existingBooking("nl", "vrijdag 6 maart"));
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.OPEN_QUESTIONS);
        assertThat(fixture.session.isClosed()).isTrue();
    }

    @Test
    void bookingOfAnUnknownCandidateIsIgnored() {
        CallFixture fixture = new CallFixture(CallFixture.input()
                .candidateKnown(false)
                .candidateRecord(CandidateRecord.builder().existingBookingDate("vrijdag 6 maart").build())
                .build());
        fixture.start(StageName.OPEN_QUESTIONS);
        fixture.invoke("confirm_ready");
        answer(fixture, "a");
        answer(fixture, "b");

        assertThat(fixture.spoken()).doesNotContain(fixture.phrases.existingBooking("nl", "vrijdag 6 maart"));
        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.SCHEDULING);
    }

    @Test
    void declinedReadinessEndsTheCall() {
        CallFixture fixture = started(null);

        fixture.userTurn("nee, niet nu");
        fixture.userTurn("echt niet");
        fixture.userTurn("nee");

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.readyCheckDecline("nl"));
        assertThat(fixture.state().getOpenAnswers()).isEmpty();
        assertThat(fixture.session.isClosed()).isTrue();
    }

    @Test
    void irrelevantReadinessAnswersEndAsIrrelevant() {
        CallFixture fixture = started(null);

        fixture.invoke("mark_irrelevant");
        fixture.invoke("mark_irrelevant");
        fixture.invoke("mark_irrelevant");

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.irrelevantShutdown("nl"));
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.IRRELEVANT);
    }

    @Test
    void irrelevanceCapSkipsTheRemainingQuestions() {
        CallFixture fixture = started(null);
        fixture.invoke("confirm_ready");

        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "x"));
        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "y"));
        fixture.invoke("mark_irrelevant", Map.of("answer_summary", "z"));

        assertThat(fixture.state().getOpenAnswers()).extracting(OpenAnswer::getQuestionId).containsExactly("oq1");
        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.irrelevantShutdown("nl"));
        assertThat(fixture.channel.awayTimeouts).endsWith(Duration.ofSeconds(4));
    }

    @Test
    void escalationDuringTheQuestionsGoesToTheRecruiter() {
        CallFixture fixture = started(null);
        fixture.invoke("confirm_ready");

        fixture.invoke("escalate_to_recruiter");

        assertThat(fixture.session.getActiveAgent().getName()).isEqualTo(StageName.RECRUITER);
        assertThat(fixture.state().isRecruiterRequested()).isTrue();
        assertThat(fixture.spoken()).doesNotContain(fixture.phrases.openQuestionsThanks("nl"));
    }
}
