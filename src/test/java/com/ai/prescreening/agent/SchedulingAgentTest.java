package com.ai.prescreening.agent;

import com.ai.prescreening.conversation.CallStatus;
import com.ai.prescreening.conversation.OutcomeResolver;
import com.ai.prescreening.service.CalendarEventResult;
import com.ai.prescreening.service.SchedulingService;
import com.ai.prescreening.service.Slot;
import com.ai.prescreening.support.CallFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchedulingAgentTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);
    private static final LocalDate TUESDAY = LocalDate.of(2026, 3, 3);
    private static final LocalDate THURSDAY = LocalDate.of(2026, 3, 5);

    private SchedulingService scheduling;
    private CallFixture fixture;

    @BeforeEach
    void setUp() {
        scheduling = mock(SchedulingService.class);
        fixture = new CallFixture(CallFixture.input().build(), scheduling);
        fixture.start(StageName.SCHEDULING);
    }

    @Test
    void invitesAndAsksForTheAvailableMoments() {
        assertThat(fixture.spoken()).containsExactly(fixture.phrases.schedulingInvite("nl", "Gent"));
        assertThat(fixture.interpreter.requests).singleElement().satisfies(r -> {
            assertThat(r.instructions()).contains("Today is maandag 2 maart 2026.");
            assertThat(r.instructions()).contains("Call `get_available_timeslots` now");
        });
    }

    @Test
    void describesSlotsWithMachineReadableDateAndTime() {
        when(scheduling.getSlots(SchedulingAgent.SLOT_OFFSET_DAYS, SchedulingAgent.SLOT_COUNT)).thenReturn(List.of(
                Slot.of(TUESDAY, "9 uur", TODAY),
                Slot.of(THURSDAY, "10 uur", TODAY)));

        String output = fixture.invoke("get_available_timeslots");

        assertThat(output).isEqualTo("Available moments:\n"
                + "- morgen dinsdag 3 maart om 9 uur (slot_date=2026-03-03, slot_time=9 uur)\n"
                + "- donderdag 5 maart om 10 uur (slot_date=2026-03-05, slot_time=10 uur)");
    }

    @Test
    void noSlotsPointsToTheRecruiter() {
        when(scheduling.getSlots(SchedulingAgent.SLOT_OFFSET_DAYS, SchedulingAgent.SLOT_COUNT)).thenReturn(List.of());

        assertThat(fixture.invoke("get_available_timeslots")).contains("schedule_with_recruiter");
    }

    @Test
    void looksUpASpecificDate() {
        when(scheduling.getSlotsForDate(THURSDAY)).thenReturn(Optional.of(Slot.of(THURSDAY, "10 uur", TODAY)));
        when(scheduling.getSlotsForDate(LocalDate.of(2026, 3, 7))).thenReturn(Optional.empty());

        assertThat(fixture.invoke("get_timeslots_for_date", Map.of("date", "2026-03-05")))
                .isEqualTo("Available moment on donderdag 5 maart:\n"
                        + "- donderdag 5 maart om 10 uur (slot_date=2026-03-05, slot_time=10 uur)");
        assertThat(fixture.invoke("get_timeslots_for_date", Map.of("date", "2026-03-07")))
                .startsWith("No moments available on zaterdag 7 maart.");
        assertThat(fixture.invoke("get_timeslots_for_date", Map.of("date", "volgende week")))
                .isEqualTo("Invalid date 'volgende week'. Use the YYYY-MM-DD format.");
        assertThat(fixture.session.isClosed()).isFalse();
    }

    @Test
    void confirmationBooksTheEventAndEndsTheCall() {
        fixture.state().setIrrelevantCount(2);
        when(scheduling.createEvent("Sara Peeters", TUESDAY, "9 uur", "Interview Sara Peeters - Magazijnier"))
                .thenReturn(CalendarEventResult.success("evt-1"));

        fixture.invoke("confirm_timeslot", Map.of(
                "timeslot", "morgen dinsdag 3 maart om 9 uur",
                "slot_date", "2026-03-03",
                "slot_time", "9 uur"));

        assertThat(fixture.state().getChosenTimeslot()).isEqualTo("morgen dinsdag 3 maart om 9 uur");
        assertThat(fixture.state().getScheduledDate()).isEqualTo(TUESDAY);
        assertThat(fixture.state().getScheduledTime()).isEqualTo("9 uur");
        assertThat(fixture.state().getCalendarEventId()).isEqualTo("evt-1");
        assertThat(fixture.state().getIrrelevantCount()).isZero();
        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.schedulingConfirm("nl",
                "morgen dinsdag 3 maart om 9 uur", "Gent", "Kortrijksesteenweg 10", true));
        assertThat(fixture.session.isClosed()).isTrue();
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.COMPLETED);
    }

    @Test
    void closingWaitsForTheCalendarBooking() {
        List<Runnable> background = new ArrayList<>();
        CallFixture slowCalendar = new CallFixture(CallFixture.input().build(), scheduling, background::add);
        slowCalendar.start(StageName.SCHEDULING);
        when(scheduling.createEvent(any(), any(), any(), any())).thenReturn(CalendarEventResult.success("evt-2"));

        slowCalendar.invoke("confirm_timeslot", Map.of(
                "timeslot", "donderdag 5 maart om 10 uur",
                "slot_date", "2026-03-05",
                "slot_time", "10 uur"));

        assertThat(slowCalendar.session.isDraining()).isTrue();
        assertThat(slowCalendar.session.isClosed()).isFalse();
        assertThat(slowCalendar.state().getCalendarEventId()).isNull();

        background.forEach(Runnable::run);

        assertThat(slowCalendar.state().getCalendarEventId()).isEqualTo("evt-2");
        assertThat(slowCalendar.session.isClosed()).isTrue();
        assertThat(slowCalendar.closed).containsExactly(slowCalendar.session);
    }

    @Test
    void slotsFollowTheCallLanguage() {
        when(scheduling.getSlots(SchedulingAgent.SLOT_OFFSET_DAYS, SchedulingAgent.SLOT_COUNT)).thenReturn(List.of(
                Slot.of(TUESDAY, "9 uur", TODAY),
                Slot.of(LocalDate.of(2026, 3, 6), "half 10", TODAY)));

        fixture.invoke("switch_language", Map.of("language", "en"));
        String output = fixture.invoke("get_available_timeslots");

        assertThat(output).isEqualTo("Available moments:\n"
                + "- tomorrow Tuesday 3 March at 9:00 (slot_date=2026-03-03, slot_time=9 uur)\n"
                + "- Friday 6 March at 9:30 (slot_date=2026-03-06, slot_time=half 10)");
    }

    @Test
    void laterSlotGetsTheReminderFollowUp() {
        when(scheduling.createEvent(any(), any(), any(), any())).thenReturn(CalendarEventResult.failure("calendar down"));

        fixture.invoke("confirm_timeslot", Map.of(
                "timeslot", "donderdag 5 maart om 10 uur",
                "slot_date", "2026-03-05",
                "slot_time", "10 uur"));

        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.schedulingConfirm("nl",
                "donderdag 5 maart om 10 uur", "Gent", "Kortrijksesteenweg 10", false));
        assertThat(fixture.state().getCalendarEventId()).isNull();
        assertThat(fixture.state().getChosenTimeslot()).isEqualTo("donderdag 5 maart om 10 uur");
    }

    @Test
    void confirmationWithoutADateSkipsTheCalendar() {
        fixture.invoke("confirm_timeslot", Map.of("timeslot", "morgen om 9 uur"));

        verify(scheduling, never()).createEvent(any(), any(), any(), any());
        assertThat(fixture.state().getScheduledDate()).isNull();
        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.schedulingConfirm("nl",
                "morgen om 9 uur", "Gent", "Kortrijksesteenweg 10", true));
    }

    @Test
    void preferenceIsPassedToTheRecruiter() {
        fixture.invoke("schedule_with_recruiter", Map.of("preference", "liefst zaterdag"));

        assertThat(fixture.state().getSchedulingPreference()).isEqualTo("liefst zaterdag");
        assertThat(fixture.channel.lastSpoken()).isEqualTo(fixture.phrases.schedulingPreference("nl"));
        assertThat(OutcomeResolver.resolve(fixture.state())).isEqualTo(CallStatus.COMPLETED);
    }
}
