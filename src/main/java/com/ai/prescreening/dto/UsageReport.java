package com.ai.prescreening.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

/**
 * Speech pipeline and LLM consumption of one call with its estimated cost in USD.
 */
@Getter
@Builder
public class UsageReport {

    @JsonProperty("call_id")
    private final String callId;

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("candidate_name")
    private final String candidateName;

    @JsonProperty("job_title")
    private final String jobTitle;

    @JsonProperty("llm_prompt_tokens")
    private final long llmPromptTokens;

    @JsonProperty("llm_completion_tokens")
    private final long llmCompletionTokens;

    @JsonProperty("tts_characters")
    private final long ttsCharacters;

    @JsonProperty("stt_audio_duration")
    private final double sttAudioDuration;

    @JsonProperty("cost_usd")
    private final Cost costUsd;

    @Getter
    @Builder
    public static class Cost {

        @JsonProperty("llm")
        private final double llm;

        @JsonProperty("tts")
        private final double tts;

        @JsonProperty("stt")
        private final double stt;

        @JsonProperty("total")
        private final double total;
    }
}
