package com.ai.prescreening.service;

import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interprets candidate turns using OpenAI Chat Completions with function calling.
 */
@Service
public class LlmService implements TurnInterpreter {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4.1-mini}")
    private String openAiModel;

    public LlmService(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    public boolean isConfigured() {
        return StringUtils.isNotBlank(openAiApiKey);
    }

    @Override
    public TurnDecision interpret(TurnRequest request) {
        if (!isConfigured()) {
            log.error("OPENAI_API_KEY is not set");
            return TurnDecision.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("temperature", 0.2);
        body.put("messages", buildMessages(request));
        if (!request.tools().isEmpty()) {
            body.put("tools", buildTools(request.tools()));
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(URL, new HttpEntity<>(body, headers), String.class);
            return parse(request.callId(), response.getBody());
        } catch (RestClientException | JsonProcessingException ex) {
            log.error("[{}] Failed to get LLM decision", request.callId(), ex);
            return TurnDecision.empty();
        }
    }

    List<Map<String, Object>> buildMessages(TurnRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(message("system", request.instructions()
                + "\n\n# Current language\n- Reply in language code: " + request.language() + "."));

        for (ChatMessage msg : request.history()) {
            messages.add(message(msg.getRole(), msg.getContent()));
        }

        if (!request.toolOutputs().isEmpty()) {
            List<Map<String, Object>> calls = new ArrayList<>();
            List<Map<String, Object>> results = new ArrayList<>();
            int i = 0;
            for (TurnRequest.ToolOutput out : request.toolOutputs()) {
                String id = StringUtils.defaultIfBlank(out.call().getId(), "call_" + i++);
                Map<String, Object> function = new HashMap<>();
                function.put("name", out.call().getName());
                function.put("arguments", toJson(out.call().getArguments()));
                Map<String, Object> call = new HashMap<>();
                call.put("id", id);
                call.put("type", "function");
                call.put("function", function);
                calls.add(call);

                Map<String, Object> result = message("tool", out.output());
                result.put("tool_call_id", id);
                results.add(result);
            }
            Map<String, Object> assistant = new HashMap<>();
            assistant.put("role", "assistant");
            assistant.put("tool_calls", calls);
            messages.add(assistant);
            messages.addAll(results);
        }
        return messages;
    }

    List<Map<String, Object>> buildTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> defs = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> properties = new LinkedHashMap<>();
            for (String p : tool.parameters()) {
                properties.put(p, Map.of("type", "string"));
            }
            Map<String, Object> parameters = new HashMap<>();
            parameters.put("type", "object");
            parameters.put("properties", properties);
            parameters.put("required", tool.parameters());

            Map<String, Object> function = new HashMap<>();
            function.put("name", tool.functionName());
            function.put("description", tool.description());
            function.put("parameters", parameters);

            Map<String, Object> def = new HashMap<>();
            def.put("type", "function");
            def.put("function", function);
            defs.add(def);
        }
        return defs;
    }

    TurnDecision parse(String callId, String responseBody) throws JsonProcessingException {
        JsonNode root = mapper.readTree(responseBody);
        JsonNode message = root.path("choices").path(0).path("message");
        String reply = message.path("content").asText("").trim();

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            Map<String, String> arguments = new HashMap<>();
            String rawArguments = function.path("arguments").asText("");
            if (StringUtils.isNotBlank(rawArguments)) {
                Iterator<Map.Entry<String, JsonNode>> fields = mapper.readTree(rawArguments).fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> f = fields.next();
                    arguments.put(f.getKey(), f.getValue().isTextual() ? f.getValue().asText() : f.getValue().toString());
                }
            }
            toolCalls.add(ToolCall.of(call.path("id").asText(null), function.path("name").asText(), arguments));
        }

        JsonNode usage = root.path("usage");
        int promptTokens = usage.path("prompt_tokens").asInt(0);
        int completionTokens = usage.path("completion_tokens").asInt(0);
        log.debug("[{}] LLM reply='{}' tools={} tokens={}/{}", callId, reply, toolCalls, promptTokens, completionTokens);
        return new TurnDecision(reply, toolCalls, promptTokens, completionTokens);
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    private String toJson(Map<String, String> arguments) {
        try {
            return mapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
