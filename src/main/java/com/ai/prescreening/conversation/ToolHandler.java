package com.ai.prescreening.conversation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Whatever currently owns the conversation: the active dialogue task, or the active stage agent
 * when no task runs. Tool calls from the interpreter are routed here.
 */
public interface ToolHandler {

    String handlerName();

    String instructions();

    List<ToolDefinition> tools();

    /**
     * @return tool output fed back to the interpreter, completing with null when there is nothing to say
     */
    CompletableFuture<String> invoke(ToolCall call);
}
