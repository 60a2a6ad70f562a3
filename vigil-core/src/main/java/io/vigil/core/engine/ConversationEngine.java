package io.vigil.core.engine;

import io.vigil.core.session.SessionStore;
import java.io.IOException;

public interface ConversationEngine {

    EngineResult ask(String prompt) throws IOException;

    EngineResult askWithSession(String prompt, SessionStore session, AskOptions options) throws IOException;
}
