package io.vigil.core.engine;

import io.vigil.core.model.ChatMessage;
import io.vigil.core.model.ToolCall;
import io.vigil.core.provider.LlmProvider;
import io.vigil.core.provider.LlmResponse;
import io.vigil.core.session.ConversationTurn;
import io.vigil.core.session.SessionStore;
import io.vigil.core.tool.Tool;
import io.vigil.core.tool.ToolContext;
import io.vigil.core.tool.ToolRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmConversationEngine implements ConversationEngine {
    static final String MAX_ITERATIONS_REPLY = "Stopped after max tool iterations";

    private static final Logger LOG = LoggerFactory.getLogger(LlmConversationEngine.class);

    private final LlmProvider provider;
    private final String model;
    private final String systemPrompt;
    private final ToolRegistry toolRegistry;
    private final Map<String, Object> toolServices;
    private final Path workspace;
    private final int maxToolIterations;
    private final int historyTurns;
    private final Clock clock;

    public LlmConversationEngine(
        LlmProvider provider,
        String model,
        String systemPrompt,
        ToolRegistry toolRegistry,
        Map<String, Object> toolServices,
        Path workspace,
        int maxToolIterations,
        int historyTurns,
        Clock clock
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model == null ? "" : model;
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
        this.toolRegistry = toolRegistry == null ? new ToolRegistry() : toolRegistry;
        this.toolServices = toolServices == null ? Map.of() : Map.copyOf(toolServices);
        this.workspace = workspace;
        this.maxToolIterations = Math.max(1, maxToolIterations);
        this.historyTurns = Math.max(0, historyTurns);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public EngineResult ask(String prompt) throws IOException {
        List<ChatMessage> transcript = new ArrayList<>();
        addSystemPrompt(transcript);
        transcript.add(ChatMessage.user(prompt));
        return EngineResult.text(run(transcript));
    }

    @Override
    public EngineResult askWithSession(String prompt, SessionStore session, AskOptions options) throws IOException {
        Objects.requireNonNull(session, "session must not be null");
        AskOptions askOptions = options == null ? AskOptions.none() : options;

        List<ChatMessage> transcript = new ArrayList<>();
        addSystemPrompt(transcript);
        List<ConversationTurn> history = session.recent(historyTurns);
        if (!history.isEmpty()) {
            String preamble = askOptions.historyPreamble();
            if (preamble != null && !preamble.isBlank()) {
                transcript.add(ChatMessage.system(preamble));
            }
            for (ConversationTurn turn : history) {
                transcript.add(ChatMessage.user(turn.prompt()));
                transcript.add(ChatMessage.assistant(turn.response()));
            }
        }
        transcript.add(ChatMessage.user(prompt));

        String reply = run(transcript);
        session.append(new ConversationTurn(clock.instant(), prompt, reply));
        return EngineResult.text(reply);
    }

    private String run(List<ChatMessage> transcript) throws IOException {
        for (int i = 0; i < maxToolIterations; i++) {
            LlmResponse response = provider.chat(model, transcript, toolDefinitions());
            String content = response.content() == null ? "" : response.content();
            if (response.isError()) {
                throw new IOException(content);
            }
            if (response.toolCalls().isEmpty()) {
                return content;
            }

            transcript.add(ChatMessage.assistantWithToolCalls(content, response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                transcript.add(ChatMessage.tool(executeTool(call), call.id()));
            }
        }
        LOG.warn("Provider {} exceeded {} tool iterations", provider.name(), maxToolIterations);
        return MAX_ITERATIONS_REPLY;
    }

    private void addSystemPrompt(List<ChatMessage> transcript) {
        if (!systemPrompt.isBlank()) {
            transcript.add(ChatMessage.system(systemPrompt));
        }
    }

    private String executeTool(ToolCall call) {
        return toolRegistry.find(call.name())
            .map(tool -> safelyExecute(tool, call.arguments()))
            .orElse("Error: Tool '" + call.name() + "' not found");
    }

    private String safelyExecute(Tool tool, Map<String, Object> input) {
        try {
            return tool.execute(input, new ToolContext(workspace, toolServices));
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed", tool.name(), e);
            return "Error executing tool '" + tool.name() + "': " + e.getMessage();
        }
    }

    private List<Map<String, Object>> toolDefinitions() {
        return toolRegistry.all().stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "parameters", tool.schema())))
            .toList();
    }
}
