package com.ai.prescreening.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Calendar collaborator. Shared by all calls, so implementations must be thread-safe.
 */
public interface SchedulingService {

    /**
     * @param offsetDays first day that may hold a slot, counted from today
     * @param count      number of slots, one per business day
     */
    List<Slot> getSlots(int offsetDays, int count);

    Optional<Slot> getSlotsForDate(LocalDate date);

    CalendarEventResult createEvent(String candidateName, LocalDate date, String time, String title);
}
