package io.vigil.core.session;

import java.io.IOException;
import java.util.List;

public interface SessionStore {
    String id();

    void append(ConversationTurn turn) throws IOException;

    List<ConversationTurn> list() throws IOException;

    default List<ConversationTurn> recent(int limit) throws IOException {
        List<ConversationTurn> turns = list();
        if (limit <= 0) {
            return List.of();
        }
        return turns.size() <= limit ? turns : List.copyOf(turns.subList(turns.size() - limit, turns.size()));
    }
}
