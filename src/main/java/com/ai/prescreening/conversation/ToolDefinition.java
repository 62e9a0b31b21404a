package com.ai.prescreening.conversation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A function the interpreter may call on the active stage agent or dialogue task.
 * Implemented by the closed tool enums of each agent and task; all parameters are strings.
 */
public interface ToolDefinition {

    String functionName();

    String description();

    List<String> parameters();

    static <T extends Enum<T> & ToolDefinition> Optional<T> lookup(Class<T> type, String functionName) {
        return Arrays.stream(type.getEnumConstants())
                .filter(t -> t.functionName().equals(functionName))
                .findFirst();
    }
}
