package io.vigil.core.delivery;

import java.io.IOException;

public interface Connector {
    String channel();

    void send(String to, String text) throws IOException;

    default String defaultRecipient() {
        return "default";
    }
}
