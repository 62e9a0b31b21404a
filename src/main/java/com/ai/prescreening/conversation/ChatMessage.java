package com.ai.prescreening.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ChatMessage {

    @JsonProperty("role")
    private final String role;

    @JsonProperty("message")
    private final String content;
}
