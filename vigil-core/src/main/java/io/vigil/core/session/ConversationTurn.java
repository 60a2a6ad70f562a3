package io.vigil.core.session;

import java.time.Instant;
import java.util.Objects;

public record ConversationTurn(Instant createdAt, String prompt, String response) {

    public ConversationTurn {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        prompt = prompt == null ? "" : prompt;
        response = response == null ? "" : response;
    }
}
