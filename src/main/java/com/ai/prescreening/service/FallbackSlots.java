package com.ai.prescreening.service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hard-coded availability used when no calendar is configured or the calendar fails:
 * the first moment of each business day, weekends skipped.
 */
public class FallbackSlots {

    private static final Map<DayOfWeek, String> FIRST_SLOT = new EnumMap<>(DayOfWeek.class);

    static {
        FIRST_SLOT.put(DayOfWeek.MONDAY, "10 uur");
        FIRST_SLOT.put(DayOfWeek.TUESDAY, "9 uur");
        FIRST_SLOT.put(DayOfWeek.WEDNESDAY, "11 uur");
        FIRST_SLOT.put(DayOfWeek.THURSDAY, "10 uur");
        FIRST_SLOT.put(DayOfWeek.FRIDAY, "half 10");
    }

    private final Clock clock;

    public FallbackSlots(Clock clock) {
        this.clock = clock;
    }

    public List<Slot> build(int offsetDays, int count) {
        LocalDate today = LocalDate.now(clock);
        List<Slot> slots = new ArrayList<>();
        LocalDate d = today.plusDays(offsetDays);
        while (slots.size() < count) {
            String time = FIRST_SLOT.get(d.getDayOfWeek());
            if (time != null) {
                slots.add(Slot.of(d, time, today));
            }
            d = d.plusDays(1);
        }
        return slots;
    }

    public Optional<Slot> forDate(LocalDate date) {
        LocalDate today = LocalDate.now(clock);
        if (!date.isAfter(today)) {
            return Optional.empty();
        }
        String time = FIRST_SLOT.get(date.getDayOfWeek());
        return time == null ? Optional.empty() : Optional.of(Slot.of(date, time, today));
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
