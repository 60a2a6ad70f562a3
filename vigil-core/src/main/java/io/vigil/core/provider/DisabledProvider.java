package io.vigil.core.provider;

import io.vigil.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        return LlmResponse.error("provider " + name + " is not configured (" + reason + ")");
    }
}
