package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Pre-known candidate data from the CRM. Used to skip knockout questions and scheduling.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandidateRecord {

    @JsonProperty("known_answers")
    @Builder.Default
    private final Map<String, String> knownAnswers = Map.of();

    @JsonProperty("existing_booking_date")
    private final String existingBookingDate;

    public boolean knows(String dataKey) {
        return StringUtils.isNotBlank(dataKey) && knownAnswers != null && knownAnswers.containsKey(dataKey);
    }

    public String knownAnswer(String dataKey) {
        return knownAnswers == null ? null : knownAnswers.get(dataKey);
    }

    public boolean hasExistingBooking() {
        return StringUtils.isNotBlank(existingBookingDate);
    }
}
