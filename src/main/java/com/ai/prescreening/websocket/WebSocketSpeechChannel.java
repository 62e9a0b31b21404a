package com.ai.prescreening.websocket;

import com.ai.prescreening.service.SpeechChannel;
import com.ai.prescreening.service.TurnSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Speech pipeline commands sent over the call's WebSocket. Each utterance gets an id; its future
 * completes when the pipeline reports {@code playout_finished} for that id or the socket closes.
 */
public class WebSocketSpeechChannel implements SpeechChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSpeechChannel.class);

    private final WebSocketSession socket;
    private final ObjectMapper mapper;
    private final Map<String, CompletableFuture<Void>> playouts = new ConcurrentHashMap<>();
    private final AtomicLong utteranceSeq = new AtomicLong();
    private volatile String callId = "-";

    public WebSocketSpeechChannel(WebSocketSession socket, ObjectMapper mapper) {
        this.socket = socket;
        this.mapper = mapper;
    }

    void setCallId(String callId) {
        this.callId = callId;
    }

    @Override
    public CompletableFuture<Void> speak(String text, boolean allowInterruptions) {
        String utteranceId = "u" + utteranceSeq.incrementAndGet();
        CompletableFuture<Void> playout = new CompletableFuture<>();
        playouts.put(utteranceId, playout);

        ObjectNode event = event("speak");
        event.put("utterance_id", utteranceId);
        event.put("text", text);
        event.put("allow_interruptions", allowInterruptions);
        if (!send(event)) {
            playouts.remove(utteranceId);
            playout.complete(null);
        }
        return playout;
    }

    @Override
    public void clearUserTurn() {
        send(event("clear_user_turn"));
    }

    @Override
    public void configureTurnDetection(TurnSettings settings) {
        ObjectNode event = event("turn_detection");
        event.put("mode", settings.mode().name().toLowerCase());
        event.put("min_endpointing_delay_ms", settings.minEndpointingDelay().toMillis());
        send(event);
    }

    @Override
    public void setUserAwayTimeout(Duration timeout) {
        ObjectNode event = event("user_away_timeout");
        event.put("seconds", timeout.toMillis() / 1000.0);
        send(event);
    }

    @Override
    public void switchLanguage(String language) {
        ObjectNode event = event("language");
        event.put("language", language);
        send(event);
    }

    @Override
    public void hangup() {
        send(event("hangup"));
        releasePlayouts();
    }

    void playoutFinished(String utteranceId) {
        CompletableFuture<Void> playout = playouts.remove(utteranceId);
        if (playout == null) {
            log.debug("[{}] playout_finished for unknown utterance {}", callId, utteranceId);
            return;
        }
        playout.complete(null);
    }

    /** Nothing will be played any more; unblock everyone waiting on a playout. */
    void releasePlayouts() {
        playouts.values().forEach(f -> f.complete(null));
        playouts.clear();
    }

    private ObjectNode event(String name) {
        ObjectNode node = mapper.createObjectNode();
        node.put("event", name);
        return node;
    }

    private boolean send(ObjectNode event) {
        if (!socket.isOpen()) {
            log.debug("[{}] Socket closed, dropping {}", callId, event.path("event").asText());
            return false;
        }
        try {
            String payload = mapper.writeValueAsString(event);
            synchronized (socket) {
                socket.sendMessage(new TextMessage(payload));
            }
            return true;
        } catch (JsonProcessingException e) {
            log.error("[{}] Failed to encode {}", callId, event.path("event").asText(), e);
            return false;
        } catch (IOException | IllegalStateException e) {
            log.warn("[{}] Failed to send {}: {}", callId, event.path("event").asText(), e.getMessage());
            return false;
        }
    }
}
