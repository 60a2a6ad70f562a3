package io.vigil.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record ChatMessage(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (role == MessageRole.TOOL && (toolCallId == null || toolCallId.isBlank())) {
            throw new IllegalArgumentException("tool messages require a toolCallId");
        }
        if (role != MessageRole.ASSISTANT && !toolCalls.isEmpty()) {
            throw new IllegalArgumentException("only assistant messages may carry tool calls");
        }
    }

    public static ChatMessage system(String content) {
        return of(MessageRole.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(MessageRole.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return of(MessageRole.ASSISTANT, content);
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, null);
    }

    public String wireRole() {
        return role.name().toLowerCase(Locale.ROOT);
    }

    public boolean requestsTools() {
        return !toolCalls.isEmpty();
    }

    private static ChatMessage of(MessageRole role, String content) {
        return new ChatMessage(role, content, null, null);
    }
}
