package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Yes/no hard-requirement question. {@code dataKey} links it to a pre-known answer in the
 * candidate record.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnockoutQuestion {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("internal_id")
    @Builder.Default
    private final String internalId = "";

    @JsonProperty("context")
    @Builder.Default
    private final String context = "";

    @JsonProperty("data_key")
    @Builder.Default
    private final String dataKey = "";
}
