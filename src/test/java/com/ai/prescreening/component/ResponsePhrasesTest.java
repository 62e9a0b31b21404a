package com.ai.prescreening.component;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponsePhrasesTest {

    private final ResponsePhrases phrases = new ResponsePhrases();

    @Test
    void unsupportedLanguageFallsBackToDutch() {
        assertThat(phrases.recruiterHandoff("es")).isEqualTo(phrases.recruiterHandoff("nl"));
        assertThat(ResponsePhrases.isSupported("es")).isFalse();
        assertThat(ResponsePhrases.isSupported("fr")).isTrue();
    }

    @Test
    void confirmationMentionsWhatsAppFollowUp() {
        String tomorrow = phrases.schedulingConfirm("nl", "dinsdag 3 maart om 10 uur", "Gent", "Kortrijksesteenweg 10", true);
        String later = phrases.schedulingConfirm("nl", "vrijdag 6 maart om 14 uur", "Gent", "Kortrijksesteenweg 10", false);

        assertThat(tomorrow)
                .contains("dinsdag 3 maart om 10 uur")
                .contains("kantoor in Gent aan de Kortrijksesteenweg 10")
                .contains("zo meteen nog een bevestiging")
                .doesNotContain("reminder");
        assertThat(later).contains("later ook een reminder");
    }

    @Test
    void voicemailWithAndWithoutName() {
        assertThat(phrases.voicemail("nl", "Sara")).startsWith("Hallo Sara,");
        assertThat(phrases.voicemail("nl", " ")).startsWith("Hallo, je spreekt met Anna");
        assertThat(phrases.voicemail("en", null)).startsWith("Hello, this is Anna");
    }

    @ParameterizedTest
    @ValueSource(strings = {"nl", "en", "fr", "de"})
    void everyLanguageFillsAllPlaceholders(String language) {
        List<String> all = List.of(
                phrases.irrelevantShutdown(language),
                phrases.recruiterHandoff(language),
                phrases.silencePrompt(language),
                phrases.silenceShutdown(language),
                phrases.screeningUnclear(language),
                phrases.readyCheck(language),
                phrases.readyCheckDecline(language),
                phrases.openQuestionsThanks(language),
                phrases.existingBooking(language, "4 maart"),
                phrases.schedulingInvite(language, "Gent"),
                phrases.schedulingConfirm(language, "4 maart", "Gent", "Kerkstraat 1", false),
                phrases.schedulingPreference(language),
                phrases.recruiterGreeting(language, "Sara"),
                phrases.recruiterGoodbye(language),
                phrases.alternativeThanks(language),
                phrases.alternativeNotInterested(language),
                phrases.voicemail(language, "Sara"),
                phrases.proxyDetected(language),
                phrases.candidateNotAvailable(language));

        assertThat(all).allSatisfy(line -> assertThat(line).isNotBlank().doesNotContain("{").doesNotContain("_"));
    }
}
