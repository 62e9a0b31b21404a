package com.ai.prescreening.websocket;

import com.ai.prescreening.conversation.DevSessionInputs;
import com.ai.prescreening.conversation.SessionInput;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.UserState;
import com.ai.prescreening.service.CallSession;
import com.ai.prescreening.service.ConversationOrchestrator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event channel between the speech pipeline and the conversation. One socket carries one call.
 */
@Component
public class CallStreamHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(CallStreamHandler.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();

    private final ConversationOrchestrator orchestrator;

    @Value("${prescreening.dev.start-agent:}")
    private String devStartAgent;

    public CallStreamHandler(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    static class StreamState {
        final WebSocketSpeechChannel channel;
        /** Set once the orchestrator accepted the call; playouts may be reported before that. */
        volatile CallSession call;

        StreamState(WebSocketSpeechChannel channel) {
            this.channel = channel;
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {

        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Invalid event on socket {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        String event = root.path("event").asText();

        if ("start".equals(event)) {
            handleStart(session, root);
            return;
        }

        StreamState state = streams.get(session.getId());
        if (state == null) {
            log.debug("Event {} before start on socket {}, ignored", event, session.getId());
            return;
        }
        if ("playout_finished".equals(event)) {
            state.channel.playoutFinished(root.path("utterance_id").asText());
            return;
        }
        CallSession call = state.call;
        if (call == null) {
            log.debug("Event {} before call start on socket {}, ignored", event, session.getId());
            return;
        }

        switch (event) {
            case "user_state":
                call.onUserState(UserState.fromWire(root.path("state").asText()));
                break;
            case "user_turn":
                call.onUserTurn(root.path("text").asText(""));
                break;
            case "tool_call":
                call.onToolCall(toolCall(root));
                break;
            case "metrics":
                call.getUsage().addSttAudioSeconds(root.path("stt_audio_seconds").asDouble(0));
                break;
            case "stop":
                log.info("[{}] Stream stopped", call.getCallId());
                cleanup(session.getId());
                break;
            default:
                log.debug("[{}] Unknown event {}", call.getCallId(), event);
                break;
        }
    }

    private void handleStart(WebSocketSession session, JsonNode root) {
        if (streams.containsKey(session.getId())) {
            log.warn("Duplicate start on socket {}, ignored", session.getId());
            return;
        }
        WebSocketSpeechChannel channel = new WebSocketSpeechChannel(session, mapper);
        StreamState state = new StreamState(channel);
        streams.put(session.getId(), state);
        try {
            SessionInput input = sessionInput(session.getId(), root.path("session_input"));
            channel.setCallId(input.getCallId());
            state.call = orchestrator.startCall(input, channel);
            log.info("[{}] Call stream started | socket={}", state.call.getCallId(), session.getId());
        } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
            streams.remove(session.getId());
            log.error("Rejected call on socket {}: {}", session.getId(), e.getMessage());
            try {
                session.close(CloseStatus.BAD_DATA.withReason("Invalid session input"));
            } catch (IOException closeError) {
                log.debug("Failed to close socket {}: {}", session.getId(), closeError.getMessage());
            }
        }
    }

    private SessionInput sessionInput(String socketId, JsonNode node) throws JsonProcessingException {
        if (node.isMissingNode() || node.isNull()) {
            log.info("No session input on socket {}, using development input", socketId);
            return DevSessionInputs.defaultInput(devStartAgent).toBuilder()
                    .callId(DevSessionInputs.DEV_CALL_ID + "_" + socketId)
                    .build();
        }
        return mapper.treeToValue(node, SessionInput.class);
    }

    private static ToolCall toolCall(JsonNode root) {
        Map<String, String> arguments = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("arguments").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            arguments.put(f.getKey(), f.getValue().asText());
        }
        String id = root.path("id").asText(null);
        return ToolCall.of(id, root.path("name").asText(), arguments);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        cleanup(session.getId());
    }

    private void cleanup(String socketId) {
        StreamState state = streams.remove(socketId);
        if (state != null) {
            state.channel.releasePlayouts();
            if (state.call != null) {
                state.call.onStreamStopped();
            }
        }
    }
}
