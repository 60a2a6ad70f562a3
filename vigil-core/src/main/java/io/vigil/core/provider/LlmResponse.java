package io.vigil.core.provider;

import io.vigil.core.model.ToolCall;
import java.util.List;
import java.util.Map;

public record LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM: ";

    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse text(String content) {
        return new LlmResponse(content, List.of(), Map.of());
    }

    public static LlmResponse error(String message) {
        return new LlmResponse(ERROR_PREFIX + message, List.of(), Map.of());
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
