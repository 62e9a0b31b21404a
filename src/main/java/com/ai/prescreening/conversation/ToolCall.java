package com.ai.prescreening.conversation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One function invocation requested by the interpreter or the speech pipeline.
 */
public final class ToolCall {

    private final String id;
    private final String name;
    private final Map<String, String> arguments;

    private ToolCall(String id, String name, Map<String, String> arguments) {
        this.id = id;
        this.name = name;
        this.arguments = arguments == null ? Collections.emptyMap() : new HashMap<>(arguments);
    }

    public static ToolCall of(String name) {
        return new ToolCall(null, name, null);
    }

    public static ToolCall of(String name, Map<String, String> arguments) {
        return new ToolCall(null, name, arguments);
    }

    public static ToolCall of(String id, String name, Map<String, String> arguments) {
        return new ToolCall(id, name, arguments);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * @return the argument value, or an empty string when absent
     */
    public String getString(String key) {
        String v = arguments.get(key);
        return v == null ? "" : v;
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
