package com.ai.prescreening.service;

import com.ai.prescreening.dto.UsageReport;
import com.ai.prescreening.support.CallFixture;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UsageReporterTest {

    @TempDir
    Path logDir;

    private final UsageReporter reporter = new UsageReporter(Runnable::run, CallFixture.CLOCK);

    @Test
    void pricesEveryUsageCounter() {
        CallFixture fixture = new CallFixture(CallFixture.input().build());
        UsageCollector usage = fixture.session.getUsage();
        usage.addLlmTokens(1_000_000, 500_000);
        usage.addTtsCharacters(2_000);
        usage.addSttAudioSeconds(1_800);

        UsageReport report = reporter.build(fixture.session);

        assertThat(report.getCallId()).isEqualTo("call-1");
        assertThat(report.getTimestamp()).isEqualTo("20260302_100000");
        assertThat(report.getCandidateName()).isEqualTo("Sara Peeters");
        assertThat(report.getCostUsd().getLlm()).isCloseTo(1.2, within(1e-9));
        assertThat(report.getCostUsd().getTts()).isCloseTo(0.0225, within(1e-9));
        assertThat(report.getCostUsd().getStt()).isCloseTo(0.231, within(1e-9));
        assertThat(report.getCostUsd().getTotal()).isCloseTo(1.4535, within(1e-9));
    }

    @Test
    void writesOneJsonFilePerCall() throws Exception {
        ReflectionTestUtils.setField(reporter, "logDir", logDir.resolve("usage").toString());
        CallFixture fixture = new CallFixture(CallFixture.input().build());
        fixture.session.getUsage().addLlmTokens(120, 30);

        reporter.save(reporter.build(fixture.session)).join();

        Path file = logDir.resolve("usage").resolve("call-1_20260302_100000.json");
        assertThat(file).exists();
        JsonNode json = new ObjectMapper().readTree(Files.readString(file));
        assertThat(json.path("llm_prompt_tokens").asLong()).isEqualTo(120);
        assertThat(json.path("job_title").asText()).isEqualTo("Magazijnier");
        assertThat(json.path("cost_usd").has("total")).isTrue();
    }

    @Test
    void roundsToSixDecimals() {
        assertThat(UsageReporter.round(0.12345678)).isEqualTo(0.123457);
    }
}
