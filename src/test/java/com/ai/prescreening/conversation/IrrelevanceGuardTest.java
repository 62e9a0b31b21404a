package com.ai.prescreening.conversation;

import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IrrelevanceGuardTest {

    @Test
    void warnsUntilTheCapThenReportsLimit() {
        SessionState state = new SessionState(CallFixture.input().build(), "nl");

        IrrelevanceGuard.Check first = IrrelevanceGuard.check(state);
        assertThat(first.isLimitReached()).isFalse();
        assertThat(first.getWarning())
                .startsWith("[SYSTEM] Irrelevant answer 1/3. 2 chance(s) left.")
                .endsWith("to answer the question.");

        IrrelevanceGuard.Check second = IrrelevanceGuard.check(state, "to stay on topic");
        assertThat(second.getWarning()).contains("2/3", "1 chance(s) left", "to stay on topic");

        IrrelevanceGuard.Check third = IrrelevanceGuard.check(state);
        assertThat(third.isLimitReached()).isTrue();
        assertThat(third.getWarning()).isNull();
        assertThat(state.isIrrelevantLimitReached()).isTrue();
    }

    @Test
    void resetForgivesEarlierAnswers() {
        SessionState state = new SessionState(CallFixture.input().build(), "nl");
        IrrelevanceGuard.check(state);
        IrrelevanceGuard.check(state);

        state.resetIrrelevant();

        assertThat(IrrelevanceGuard.check(state).getWarning()).contains("1/3");
    }
}
