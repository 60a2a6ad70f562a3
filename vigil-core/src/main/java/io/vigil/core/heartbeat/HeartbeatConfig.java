package io.vigil.core.heartbeat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeartbeatConfig(boolean enabled, String every, String prompt, ActiveHours activeHours) {
    public static final String DEFAULT_EVERY = "30m";
    public static final String DEFAULT_PROMPT = """
        Check if anything needs attention. Respond using the structured format below.

        ## Response Format

        STATUS: HEARTBEAT_OK | CHAT_YES | CHAT_NO
        REASON: <brief explanation of your decision>
        CONTENT: <message to deliver, only when STATUS is CHAT_YES>

        ## Examples

        If nothing to report:
        STATUS: HEARTBEAT_OK
        REASON: All systems normal, no alerts or notable changes.

        If you decide not to message:
        STATUS: CHAT_NO
        REASON: Minor changes, nothing worth reporting.

        If you want to send a message:
        STATUS: CHAT_YES
        REASON: A scheduled task failed twice in a row.
        CONTENT: The nightly backup job failed again at 02:00. You may want to check the disk space.
        """;

    public HeartbeatConfig {
        every = every == null || every.isBlank() ? DEFAULT_EVERY : every;
        prompt = prompt == null || prompt.isBlank() ? DEFAULT_PROMPT : prompt;
    }

    public static HeartbeatConfig defaults() {
        return new HeartbeatConfig(false, DEFAULT_EVERY, DEFAULT_PROMPT, null);
    }

    public HeartbeatConfig withEnabled(boolean value) {
        return new HeartbeatConfig(value, every, prompt, activeHours);
    }
}
