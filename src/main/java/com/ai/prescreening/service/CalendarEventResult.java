package com.ai.prescreening.service;

public record CalendarEventResult(boolean ok, String eventId, String error) {

    public static CalendarEventResult success(String eventId) {
        return new CalendarEventResult(true, eventId, null);
    }

    public static CalendarEventResult failure(String error) {
        return new CalendarEventResult(false, null, error);
    }
}
