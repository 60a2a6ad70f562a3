package io.vigil.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String workspace,
    String provider,
    String model,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations,
    @JsonAlias({"history_turns"}) int historyTurns
) {

    public static AgentConfig defaults() {
        return new AgentConfig(
            "~/.vigil/workspace",
            "openai",
            "gpt-4o-mini",
            "",
            "https://api.openai.com/v1",
            "You are Vigil, an always-on assistant. Answer scheduled prompts concisely.",
            10,
            20
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
