package com.ai.prescreening.service;

import com.ai.prescreening.conversation.ChatMessage;
import com.ai.prescreening.conversation.ToolCall;
import com.ai.prescreening.conversation.ToolDefinition;

import java.util.List;

/**
 * @param instructions  system instructions of the active agent or task, plus any one-off reply instruction
 * @param userText      the candidate utterance that triggered this request, null for system-initiated replies
 * @param toolOutputs   outputs of the tools invoked in the previous round, empty on the first round
 */
public record TurnRequest(
        String callId,
        String language,
        String instructions,
        List<ToolDefinition> tools,
        List<ChatMessage> history,
        String userText,
        List<ToolOutput> toolOutputs) {

    public record ToolOutput(ToolCall call, String output) {
    }

    public boolean hasUserText() {
        return userText != null && !userText.isBlank();
    }
}
