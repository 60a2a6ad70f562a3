package io.vigil.core.cron;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobStatus {
    @JsonProperty("ok")
    OK,
    @JsonProperty("error")
    ERROR
}
