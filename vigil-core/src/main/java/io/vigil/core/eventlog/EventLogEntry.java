package io.vigil.core.eventlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

public record EventLogEntry(long seq, long ts, String type, JsonNode payload) {

    public EventLogEntry {
        Objects.requireNonNull(type, "type must not be null");
        payload = payload == null ? NullNode.getInstance() : payload;
    }
}
