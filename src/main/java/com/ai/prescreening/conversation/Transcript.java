package com.ai.prescreening.conversation;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered role/text pairs of one call, attached to the result payload at teardown.
 */
public class Transcript {

    private static final Logger log = LoggerFactory.getLogger(Transcript.class);

    private final String callId;
    private final List<ChatMessage> messages = Collections.synchronizedList(new ArrayList<>());

    public Transcript(String callId) {
        this.callId = callId;
    }

    public void appendUser(String text) {
        append("user", text);
        log.info("[{}] User: {}", callId, text);
    }

    public void appendAssistant(String text) {
        append("assistant", text);
        log.info("[{}] Assistant: {}", callId, text);
    }

    private void append(String role, String text) {
        if (StringUtils.isBlank(text)) {
            return;
        }
        messages.add(new ChatMessage(role, text.trim()));
    }

    public List<ChatMessage> getMessages() {
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    /**
     * Last few exchanges, oldest first. Used as conversational context for the interpreter.
     */
    public List<ChatMessage> recent(int max) {
        synchronized (messages) {
            int start = Math.max(0, messages.size() - max);
            return List.copyOf(messages.subList(start, messages.size()));
        }
    }

    public int size() {
        return messages.size();
    }
}
