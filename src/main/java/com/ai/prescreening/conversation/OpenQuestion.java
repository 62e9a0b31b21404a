package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenQuestion {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("internal_id")
    @Builder.Default
    private final String internalId = "";

    @JsonProperty("description")
    @Builder.Default
    private final String description = "";
}
