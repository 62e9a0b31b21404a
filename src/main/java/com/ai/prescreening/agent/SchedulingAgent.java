package com.ai.prescreening.agent;

import com.ai.prescreening.component.Prompts;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.ai.prescreening.service.CalendarEventResult;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.ReplyRequest;
import com.ai.prescreening.service.SchedulingService;
import com.ai.prescreening.service.Slot;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Proposes interview moments and books the chosen one. Confirmation and recruiter hand-off both
 * end the call; date lookups do not.
 */
public class SchedulingAgent extends StageAgent {

    private static final Logger log = LoggerFactory.getLogger(SchedulingAgent.class);

    /** Earliest slot is tomorrow. */
    static final int SLOT_OFFSET_DAYS = 1;
    static final int SLOT_COUNT = 3;

    public enum Tool implements ToolDefinition {
        GET_AVAILABLE_TIMESLOTS("get_available_timeslots", "Fetch the available moments for an interview."),
        GET_TIMESLOTS_FOR_DATE("get_timeslots_for_date",
                "Fetch the available moment on a date the candidate asked for (YYYY-MM-DD).", "date"),
        CONFIRM_TIMESLOT("confirm_timeslot",
                "The candidate chose a moment. Confirm it and close the conversation.", "timeslot", "slot_date", "slot_time"),
        SCHEDULE_WITH_RECRUITER("schedule_with_recruiter",
                "No suitable moment found. Store the candidate's preference so the recruiter gets in touch.", "preference");

        private final String functionName;
        private final String description;
        private final List<String> parameters;

        Tool(String functionName, String description, String... parameters) {
            this.functionName = functionName;
            this.description = description;
            this.parameters = List.of(parameters);
        }

        @Override
        public String functionName() {
            return functionName;
        }

        @Override
        public String description() {
            return description;
        }

        @Override
        public List<String> parameters() {
            return parameters;
        }
    }

    private final SchedulingService scheduling;
    private final Executor backgroundExecutor;
    private final Clock clock;

    public SchedulingAgent(CallSession session, SchedulingService scheduling, Executor backgroundExecutor, Clock clock) {
        super(StageName.SCHEDULING, session, session.getState().getInput().isAllowEscalation());
        this.scheduling = scheduling;
        this.backgroundExecutor = backgroundExecutor;
        this.clock = clock;
    }

    @Override
    public void onEnter() {
        state().resetSilence();
        session.withSilenceSuppressed(() -> session
                .say(phrases().schedulingInvite(language(), input().getOfficeLocation()), false)
                .thenCompose(v -> session.generateReply(ReplyRequest.instructions(
                        "Call `get_available_timeslots` now to fetch the available moments."))));
    }

    @Override
    public String instructions() {
        LocalDate today = LocalDate.now(clock);
        return Prompts.scheduling(Slot.dateLabel(today, language()) + " " + today.getYear(), allowEscalation);
    }

    @Override
    protected List<ToolDefinition> stageTools() {
        return List.of(Tool.values());
    }

    @Override
    protected CompletableFuture<String> handle(ToolCall call) {
        Optional<Tool> tool = ToolDefinition.lookup(Tool.class, call.getName());
        if (tool.isEmpty()) {
            return unknownTool(call);
        }
        switch (tool.get()) {
            case GET_AVAILABLE_TIMESLOTS:
                return reply(availableTimeslots());
            case GET_TIMESLOTS_FOR_DATE:
                return reply(timeslotsForDate(call.getString("date")));
            case CONFIRM_TIMESLOT:
                confirmTimeslot(call.getString("timeslot"), call.getString("slot_date"), call.getString("slot_time"));
                return noReply();
            case SCHEDULE_WITH_RECRUITER:
                state().setSchedulingPreference(call.getString("preference"));
                endCall(phrases().schedulingPreference(language()));
                return noReply();
            default:
                return unknownTool(call);
        }
    }

    private String availableTimeslots() {
        List<Slot> slots = scheduling.getSlots(SLOT_OFFSET_DAYS, SLOT_COUNT);
        if (slots.isEmpty()) {
            return "No moments available. Call `schedule_with_recruiter` with the candidate's preference.";
        }
        LocalDate today = LocalDate.now(clock);
        return "Available moments:\n" + slots.stream()
                .map(s -> describe(s, language(), today))
                .collect(Collectors.joining("\n"));
    }

    private String timeslotsForDate(String date) {
        LocalDate requested;
        try {
            requested = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            return "Invalid date '" + date + "'. Use the YYYY-MM-DD format.";
        }
        String dateLabel = Slot.dateLabel(requested, language());
        LocalDate today = LocalDate.now(clock);
        return scheduling.getSlotsForDate(requested)
                .map(s -> "Available moment on " + dateLabel + ":\n" + describe(s, language(), today))
                .orElse("No moments available on " + dateLabel + ". Offer the other moments.");
    }

    /** "- morgen dinsdag 3 maart om 10 uur (slot_date=2026-03-03, slot_time=10 uur)" */
    static String describe(Slot slot, String language, LocalDate today) {
        return "- " + slot.labelIn(language, today) + " (slot_date=" + slot.date() + ", slot_time=" + slot.spokenTime() + ")";
    }

    private void confirmTimeslot(String timeslot, String slotDate, String slotTime) {
        state().resetIrrelevant();
        state().setChosenTimeslot(timeslot);
        LocalDate date = parseDate(slotDate);
        if (date != null) {
            state().setScheduledDate(date);
            state().setScheduledTime(slotTime);
            createEventInBackground(date, slotTime);
        }
        LocalDate tomorrow = LocalDate.now(clock).plusDays(1);
        String label = timeslot.toLowerCase();
        boolean isTomorrow = tomorrow.equals(date) || label.contains("morgen") || label.contains("tomorrow")
                || label.contains("demain");
        SessionInput in = input();
        endCall(phrases().schedulingConfirm(language(), timeslot, in.getOfficeLocation(), in.getOfficeAddress(), isTomorrow));
    }

    private void createEventInBackground(LocalDate date, String time) {
        SessionInput in = input();
        String title = "Interview " + in.getCandidateName() + " - " + in.getJobTitle();
        CompletableFuture<Void> booking = CompletableFuture
                .supplyAsync(() -> scheduling.createEvent(in.getCandidateName(), date, time, title), backgroundExecutor)
                .thenAcceptAsync(result -> recordEvent(result), session::execute)
                .exceptionally(e -> {
                    log.error("[{}] Calendar event creation failed", session.getCallId(), e);
                    return null;
                });
        session.holdShutdownFor(booking);
    }

    private void recordEvent(CalendarEventResult result) {
        if (result.ok()) {
            state().setCalendarEventId(result.eventId());
        } else {
            log.warn("[{}] Calendar event not created: {}", session.getCallId(), result.error());
        }
    }

    private static LocalDate parseDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
