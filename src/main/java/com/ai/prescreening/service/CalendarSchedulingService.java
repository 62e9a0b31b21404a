package com.ai.prescreening.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP calendar adapter. Availability requests fall back to {@link FallbackSlots} when no calendar
 * is configured or the calendar cannot be reached.
 */
@Service
public class CalendarSchedulingService implements SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(CalendarSchedulingService.class);

    private final RestTemplate restTemplate;
    private final FallbackSlots fallback;

    @Value("${scheduling.calendar-url:}")
    private String calendarUrl;

    @Value("${scheduling.calendar-id:}")
    private String calendarId;

    public CalendarSchedulingService(@Qualifier("schedulingRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.fallback = new FallbackSlots(clock);
    }

    public boolean isConfigured() {
        return StringUtils.isNotBlank(calendarUrl) && StringUtils.isNotBlank(calendarId);
    }

    @Override
    public List<Slot> getSlots(int offsetDays, int count) {
        if (!isConfigured()) {
            log.debug("Calendar not configured, using fallback slots");
            return fallback.build(offsetDays, count);
        }
        LocalDate today = fallback.today();
        LocalDate from = today.plusDays(offsetDays);
        try {
            JsonNode days = restTemplate.getForObject(
                    calendarUrl + "/calendars/{id}/availability?from={from}&days={days}",
                    JsonNode.class, calendarId, from.toString(), count * 3);
            List<Slot> slots = new ArrayList<>();
            if (days != null) {
                for (JsonNode day : days) {
                    if (slots.size() >= count) {
                        break;
                    }
                    toSlot(day, today).ifPresent(slots::add);
                }
            }
            if (slots.isEmpty()) {
                log.warn("Calendar {} returned no availability, using fallback slots", calendarId);
                return fallback.build(offsetDays, count);
            }
            return slots;
        } catch (RestClientException | DateTimeParseException e) {
            log.warn("Calendar availability lookup failed, using fallback slots: {}", e.getMessage());
            return fallback.build(offsetDays, count);
        }
    }

    @Override
    public Optional<Slot> getSlotsForDate(LocalDate date) {
        if (!isConfigured()) {
            return fallback.forDate(date);
        }
        try {
            JsonNode days = restTemplate.getForObject(
                    calendarUrl + "/calendars/{id}/availability?from={from}&days=1",
                    JsonNode.class, calendarId, date.toString());
            if (days == null || !days.elements().hasNext()) {
                return Optional.empty();
            }
            return toSlot(days.elements().next(), fallback.today());
        } catch (RestClientException | DateTimeParseException e) {
            log.warn("Calendar lookup for {} failed, using fallback: {}", date, e.getMessage());
            return fallback.forDate(date);
        }
    }

    @Override
    public CalendarEventResult createEvent(String candidateName, LocalDate date, String time, String title) {
        if (!isConfigured()) {
            return CalendarEventResult.failure("Calendar not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = new HashMap<>();
        body.put("candidate_name", candidateName);
        body.put("date", date.toString());
        body.put("time", time);
        body.put("title", title);
        try {
            JsonNode response = restTemplate.postForObject(calendarUrl + "/calendars/{id}/events",
                    new HttpEntity<>(body, headers), JsonNode.class, calendarId);
            String eventId = response == null ? "" : response.path("id").asText("");
            if (eventId.isEmpty()) {
                return CalendarEventResult.failure("No event id in calendar response");
            }
            log.info("Created calendar event {} for {} on {} {}", eventId, candidateName, date, time);
            return CalendarEventResult.success(eventId);
        } catch (RestClientException e) {
            log.error("Failed to create calendar event for {}: {}", candidateName, e.getMessage());
            return CalendarEventResult.failure(e.getMessage());
        }
    }

    /** Day entry: {"date": "2026-03-03", "times": ["10 uur", "14 uur"]}. First time of the day wins. */
    private static Optional<Slot> toSlot(JsonNode day, LocalDate today) {
        JsonNode times = day.path("times");
        if (!times.isArray() || times.isEmpty()) {
            return Optional.empty();
        }
        LocalDate date = LocalDate.parse(day.path("date").asText());
        return Optional.of(Slot.of(date, times.get(0).asText(), today));
    }
}
