package com.ai.prescreening.service;

import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.dto.UsageReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Prices a call's usage and writes it as a JSON report per call.
 */
@Service
public class UsageReporter {

    private static final Logger log = LoggerFactory.getLogger(UsageReporter.class);

    /** USD per 1M LLM input tokens. */
    static final double LLM_PROMPT_RATE = 0.40;
    /** USD per 1M LLM output tokens. */
    static final double LLM_COMPLETION_RATE = 1.60;
    /** USD per synthesized character. */
    static final double TTS_CHARACTER_RATE = 0.00001125;
    /** USD per hour of transcribed audio. */
    static final double STT_HOUR_RATE = 0.462;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Executor backgroundExecutor;
    private final Clock clock;

    @Value("${usage.log-dir:usage_logs}")
    private String logDir;

    public UsageReporter(@Qualifier("backgroundExecutor") Executor backgroundExecutor, Clock clock) {
        this.backgroundExecutor = backgroundExecutor;
        this.clock = clock;
    }

    public UsageReport build(CallSession session) {
        SessionInput input = session.getState().getInput();
        UsageCollector usage = session.getUsage();

        double llmCost = usage.getLlmPromptTokens() * LLM_PROMPT_RATE / 1_000_000
                + usage.getLlmCompletionTokens() * LLM_COMPLETION_RATE / 1_000_000;
        double ttsCost = usage.getTtsCharacters() * TTS_CHARACTER_RATE;
        double sttCost = usage.getSttAudioSeconds() / 3600 * STT_HOUR_RATE;

        return UsageReport.builder()
                .callId(session.getCallId())
                .timestamp(LocalDateTime.now(clock).format(TIMESTAMP))
                .candidateName(input.getCandidateName())
                .jobTitle(input.getJobTitle())
                .llmPromptTokens(usage.getLlmPromptTokens())
                .llmCompletionTokens(usage.getLlmCompletionTokens())
                .ttsCharacters(usage.getTtsCharacters())
                .sttAudioDuration(usage.getSttAudioSeconds())
                .costUsd(UsageReport.Cost.builder()
                        .llm(round(llmCost))
                        .tts(round(ttsCost))
                        .stt(round(sttCost))
                        .total(round(llmCost + ttsCost + sttCost))
                        .build())
                .build();
    }

    /**
     * Writes {@code {callId}_{timestamp}.json} in the background. Failures are logged only.
     */
    public CompletableFuture<Void> save(UsageReport report) {
        return CompletableFuture.runAsync(() -> write(report), backgroundExecutor);
    }

    void write(UsageReport report) {
        Path file = Paths.get(logDir, report.getCallId() + "_" + report.getTimestamp() + ".json");
        try {
            Files.createDirectories(file.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
            log.info("[{}] Usage saved to {}", report.getCallId(), file);
        } catch (IOException e) {
            log.error("[{}] Failed to write usage report {}", report.getCallId(), file, e);
        }
    }

    static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
