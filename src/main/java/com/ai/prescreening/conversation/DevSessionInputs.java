package com.ai.prescreening.conversation;

import java.util.List;
import java.util.Map;

/**
 * Hard-coded session used for local development when no backend supplies one.
 */
public final class DevSessionInputs {

    public static final String DEV_CALL_ID = "dev_local";

    private DevSessionInputs() {
    }

    public static SessionInput defaultInput(String startAgent) {
        return SessionInput.builder()
                .callId(DEV_CALL_ID)
                .candidateName("Mark Verbeke")
                .candidateKnown(false)
                .requireConsent(false)
                .candidateRecord(CandidateRecord.builder()
                        .knownAnswers(Map.of("work_permit", "ja"))
                        .existingBookingDate("dinsdag 4 maart om 10 uur")
                        .build())
                .jobTitle("Bakkerij Medewerker")
                .officeLocation("Antwerpen Centrum")
                .officeAddress("Mechelsesteenweg nummer 27")
                .knockoutQuestions(List.of(
                        KnockoutQuestion.builder()
                                .id("q1")
                                .text("Mag je wettelijk werken in Belgie?")
                                .dataKey("work_permit")
                                .build(),
                        KnockoutQuestion.builder()
                                .id("q2")
                                .text("Heb je ervaring met werken in een bakkerij of in de verkoop?")
                                .dataKey("relevant_experience")
                                .build(),
                        KnockoutQuestion.builder()
                                .id("q3")
                                .text("Ben je beschikbaar om in het weekend te werken?")
                                .context("2 a 3 weekends per maand is prima.")
                                .dataKey("weekend_available")
                                .build()))
                .openQuestions(List.of(
                        OpenQuestion.builder()
                                .id("oq1")
                                .text("Waarom wil je in een bakkerij werken?")
                                .description("Motivatievraag")
                                .build(),
                        OpenQuestion.builder()
                                .id("oq2")
                                .text("Wat zijn je sterke punten voor deze functie?")
                                .description("Sterke punten")
                                .build(),
                        OpenQuestion.builder()
                                .id("oq3")
                                .text("Wanneer zou je kunnen starten?")
                                .description("Beschikbaarheid")
                                .build()))
                .startAgent(startAgent == null ? "" : startAgent)
                .build();
    }
}
