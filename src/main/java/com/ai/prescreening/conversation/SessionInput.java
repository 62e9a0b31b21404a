package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All input configuration for a pre-screening call, supplied once by the backend.
 * Question ids are unique per list and are used to correlate results.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionInput {

    @JsonProperty("call_id")
    @Builder.Default
    private final String callId = "";

    @JsonProperty("candidate_name")
    @Builder.Default
    private final String candidateName = "";

    @JsonProperty("candidate_known")
    private final boolean candidateKnown;

    @JsonProperty("candidate_record")
    private final CandidateRecord candidateRecord;

    @JsonProperty("job_title")
    @Builder.Default
    private final String jobTitle = "";

    @JsonProperty("office_location")
    @Builder.Default
    private final String officeLocation = "";

    @JsonProperty("office_address")
    @Builder.Default
    private final String officeAddress = "";

    @JsonProperty("knockout_questions")
    @Builder.Default
    private final List<KnockoutQuestion> knockoutQuestions = List.of();

    @JsonProperty("open_questions")
    @Builder.Default
    private final List<OpenQuestion> openQuestions = List.of();

    @JsonProperty("start_agent")
    @Builder.Default
    private final String startAgent = "";

    @JsonProperty("allow_escalation")
    @Builder.Default
    private final boolean allowEscalation = true;

    @JsonProperty("require_consent")
    @Builder.Default
    private final boolean requireConsent = true;

    @JsonProperty("is_playground")
    private final boolean playground;

    @JsonProperty("language")
    @Builder.Default
    private final String language = "";

    /**
     * @throws IllegalArgumentException if a question id is missing or used twice within its list
     */
    public void validate() {
        Set<String> knockoutIds = new HashSet<>();
        for (KnockoutQuestion q : knockoutQuestions) {
            requireUnique(knockoutIds, q.getId(), "knockout");
        }
        Set<String> openIds = new HashSet<>();
        for (OpenQuestion q : openQuestions) {
            requireUnique(openIds, q.getId(), "open");
        }
    }

    private static void requireUnique(Set<String> seen, String id, String kind) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Missing id on " + kind + " question");
        }
        if (!seen.add(id)) {
            throw new IllegalArgumentException("Duplicate " + kind + " question id: " + id);
        }
    }
}
