package com.ai.prescreening.service;

import com.ai.prescreening.agent.SchedulingAgent;
import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.ToolCall;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LlmServiceTest {

    private final LlmService llm = new LlmService(new RestTemplateBuilder());

    @Test
    void unconfiguredServiceReturnsAnEmptyDecision() {
        assertThat(llm.isConfigured()).isFalse();

        TurnDecision decision = llm.interpret(new TurnRequest("call-1", "nl", "x", List.of(), List.of(), "hallo", List.of()));

        assertThat(decision.reply()).isEmpty();
        assertThat(decision.toolCalls()).isEmpty();
    }

    @Test
    void parsesReplyToolCallsAndUsage() throws Exception {
        String body = "{"
                + "\"choices\":[{\"message\":{\"content\":\" Top! \",\"tool_calls\":["
                + "{\"id\":\"call_abc\",\"type\":\"function\",\"function\":{\"name\":\"confirm_timeslot\","
                + "\"arguments\":\"{\\\"timeslot\\\":\\\"dinsdag om 9 uur\\\",\\\"slot_date\\\":\\\"2026-03-03\\\",\\\"attempt\\\":2}\"}}"
                + "]}}],"
                + "\"usage\":{\"prompt_tokens\":812,\"completion_tokens\":27}"
                + "}";

        TurnDecision decision = llm.parse("call-1", body);

        assertThat(decision.reply()).isEqualTo("Top!");
        assertThat(decision.promptTokens()).isEqualTo(812);
        assertThat(decision.completionTokens()).isEqualTo(27);
        assertThat(decision.toolCalls()).singleElement().satisfies(c -> {
            assertThat(c.getId()).isEqualTo("call_abc");
            assertThat(c.getName()).isEqualTo("confirm_timeslot");
            assertThat(c.getArguments()).containsEntry("timeslot", "dinsdag om 9 uur")
                    .containsEntry("slot_date", "2026-03-03")
                    .containsEntry("attempt", "2");
        });
    }

    @Test
    void parsesAPlainReplyWithoutToolsOrUsage() throws Exception {
        TurnDecision decision = llm.parse("call-1", "{\"choices\":[{\"message\":{\"content\":\"Hallo\"}}]}");

        assertThat(decision.reply()).isEqualTo("Hallo");
        assertThat(decision.toolCalls()).isEmpty();
        assertThat(decision.promptTokens()).isZero();
    }

    @Test
    void toolSchemasRequireEveryStringParameter() {
        List<Map<String, Object>> tools = llm.buildTools(List.of(SchedulingAgent.Tool.CONFIRM_TIMESLOT));

        assertThat(tools).singleElement().satisfies(t -> {
            assertThat(t).containsEntry("type", "function")
                    .extractingByKey("function", InstanceOfAssertFactories.MAP)
                    .containsEntry("name", "confirm_timeslot")
                    .extractingByKey("parameters", InstanceOfAssertFactories.MAP)
                    .containsEntry("type", "object")
                    .containsEntry("required", List.of("timeslot", "slot_date", "slot_time"))
                    .extractingByKey("properties", InstanceOfAssertFactories.MAP)
                    .containsOnlyKeys("timeslot", "slot_date", "slot_time");
        });
    }

    @Test
    void toolOutputsFollowTheHistoryAsAnAssistantToolCallTurn() {
        TurnRequest request = new TurnRequest("call-1", "en", "You are Anna.", List.of(),
                List.of(new ChatMessage("user", "Which days?")), null,
                List.of(new TurnRequest.ToolOutput(ToolCall.of("get_available_timeslots"), "Available moments: ...")));

        List<Map<String, Object>> messages = llm.buildMessages(request);

        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).containsEntry("role", "system");
        assertThat((String) messages.get(0).get("content")).startsWith("You are Anna.").contains("language code: en");
        assertThat(messages.get(1)).containsEntry("role", "user").containsEntry("content", "Which days?");
        assertThat(messages.get(2)).containsEntry("role", "assistant").containsKey("tool_calls");
        assertThat(messages.get(3)).containsEntry("role", "tool")
                .containsEntry("tool_call_id", "call_0")
                .containsEntry("content", "Available moments: ...");
    }
}
