package io.vigil.core;

import io.vigil.core.session.ConversationTurn;
import io.vigil.core.session.SessionStore;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemorySessionStore implements SessionStore {
    private final String id;
    private final List<ConversationTurn> turns = new CopyOnWriteArrayList<>();

    public InMemorySessionStore(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void append(ConversationTurn turn) {
        turns.add(turn);
    }

    @Override
    public List<ConversationTurn> list() {
        return List.copyOf(turns);
    }
}
