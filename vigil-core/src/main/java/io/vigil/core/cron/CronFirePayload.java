package io.vigil.core.cron;

import com.fasterxml.jackson.databind.JsonNode;

public record CronFirePayload(String jobId, String jobName, String payload) {

    public static CronFirePayload from(JsonNode node) {
        return new CronFirePayload(
            node.path("jobId").asText(""),
            node.path("jobName").asText(""),
            node.path("payload").asText("")
        );
    }
}
