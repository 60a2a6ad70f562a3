package io.vigil.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vigil.core.InMemorySessionStore;
import io.vigil.core.model.ChatMessage;
import io.vigil.core.model.MessageRole;
import io.vigil.core.model.ToolCall;
import io.vigil.core.provider.EchoProvider;
import io.vigil.core.provider.LlmProvider;
import io.vigil.core.provider.LlmResponse;
import io.vigil.core.session.ConversationTurn;
import io.vigil.core.tool.Tool;
import io.vigil.core.tool.ToolContext;
import io.vigil.core.tool.ToolRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LlmConversationEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldAnswerWithSystemPromptAndUserMessage() throws Exception {
        ScriptedProvider provider = new ScriptedProvider().then(LlmResponse.text("hello back"));
        LlmConversationEngine engine = engine(provider, new ToolRegistry(), 5, 10);

        EngineResult result = engine.ask("hello");

        assertThat(result.text()).isEqualTo("hello back");
        assertThat(provider.calls.get(0)).extracting(ChatMessage::role).containsExactly(MessageRole.SYSTEM, MessageRole.USER);
        assertThat(provider.calls.get(0).get(0).content()).isEqualTo("be brief");
    }

    @Test
    void shouldPrependRecentHistoryAndRecordNewTurn() throws Exception {
        InMemorySessionStore session = new InMemorySessionStore("cron/default");
        session.append(new ConversationTurn(Instant.EPOCH, "old question", "old answer"));
        session.append(new ConversationTurn(Instant.EPOCH, "q1", "a1"));
        session.append(new ConversationTurn(Instant.EPOCH, "q2", "a2"));
        ScriptedProvider provider = new ScriptedProvider().then(LlmResponse.text("a3"));
        LlmConversationEngine engine = engine(provider, new ToolRegistry(), 5, 2);

        engine.askWithSession("q3", session, new AskOptions("Recent history follows."));

        List<String> sent = provider.calls.get(0).stream().map(ChatMessage::content).toList();
        assertThat(sent).containsExactly("be brief", "Recent history follows.", "q1", "a1", "q2", "a2", "q3");
        assertThat(session.list()).hasSize(4);
        ConversationTurn recorded = session.list().get(3);
        assertThat(recorded.prompt()).isEqualTo("q3");
        assertThat(recorded.response()).isEqualTo("a3");
        assertThat(recorded.createdAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void shouldOmitPreambleWithoutHistory() throws Exception {
        ScriptedProvider provider = new ScriptedProvider().then(LlmResponse.text("ok"));
        LlmConversationEngine engine = engine(provider, new ToolRegistry(), 5, 10);

        engine.askWithSession("first", new InMemorySessionStore("web"), new AskOptions("History:"));

        assertThat(provider.calls.get(0)).extracting(ChatMessage::content).containsExactly("be brief", "first");
    }

    @Test
    void shouldRunToolsUntilFinalAnswer() throws Exception {
        ToolRegistry tools = new ToolRegistry();
        tools.register(new UpperTool());
        ScriptedProvider provider = new ScriptedProvider()
            .then(new LlmResponse("", List.of(new ToolCall("call-1", "upper", Map.of("text", "abc"))), Map.of()))
            .then(LlmResponse.text("result is ABC"));
        LlmConversationEngine engine = engine(provider, tools, 5, 10);

        EngineResult result = engine.ask("shout abc");

        assertThat(result.text()).isEqualTo("result is ABC");
        List<ChatMessage> second = provider.calls.get(1);
        ChatMessage toolReply = second.get(second.size() - 1);
        assertThat(toolReply.role()).isEqualTo(MessageRole.TOOL);
        assertThat(toolReply.content()).isEqualTo("ABC");
        assertThat(toolReply.toolCallId()).isEqualTo("call-1");
        assertThat(provider.tools.get(0)).hasSize(1);
    }

    @Test
    void shouldReportUnknownToolToModel() throws Exception {
        ScriptedProvider provider = new ScriptedProvider()
            .then(new LlmResponse("", List.of(new ToolCall("c", "missing", Map.of())), Map.of()))
            .then(LlmResponse.text("sorry"));

        engine(provider, new ToolRegistry(), 5, 10).ask("x");

        List<ChatMessage> second = provider.calls.get(1);
        assertThat(second.get(second.size() - 1).content()).contains("Tool 'missing' not found");
    }

    @Test
    void shouldStopAfterMaxToolIterations() throws Exception {
        ScriptedProvider provider = new ScriptedProvider();
        for (int i = 0; i < 3; i++) {
            provider.then(new LlmResponse("", List.of(new ToolCall("c" + i, "missing", Map.of())), Map.of()));
        }

        EngineResult result = engine(provider, new ToolRegistry(), 2, 10).ask("loop");

        assertThat(result.text()).isEqualTo(LlmConversationEngine.MAX_ITERATIONS_REPLY);
        assertThat(provider.calls).hasSize(2);
    }

    @Test
    void providerErrorShouldSurfaceAsIoExceptionWithoutRecordingTurn() {
        InMemorySessionStore session = new InMemorySessionStore("heartbeat");
        ScriptedProvider provider = new ScriptedProvider().then(LlmResponse.error("HTTP 500"));

        assertThatThrownBy(() -> engine(provider, new ToolRegistry(), 5, 10).askWithSession("x", session, AskOptions.none()))
            .isInstanceOf(IOException.class)
            .hasMessage("Error calling LLM: HTTP 500");
        assertThat(session.list()).isEmpty();
    }

    @Test
    void echoProviderShouldRepeatLastUserMessage() throws Exception {
        LlmConversationEngine engine = new LlmConversationEngine(
            new EchoProvider("echo"), "m", "", null, null, null, 1, 0, CLOCK);

        assertThat(engine.ask("ping").text()).isEqualTo("[echo] ping");
    }

    private static LlmConversationEngine engine(LlmProvider provider, ToolRegistry tools, int maxIterations, int historyTurns) {
        return new LlmConversationEngine(provider, "test-model", "be brief", tools, Map.of(), Path.of("."), maxIterations, historyTurns, CLOCK);
    }

    private static final class ScriptedProvider implements LlmProvider {
        private final Deque<LlmResponse> responses = new ArrayDeque<>();
        private final List<List<ChatMessage>> calls = new ArrayList<>();
        private final List<List<Map<String, Object>>> tools = new ArrayList<>();

        ScriptedProvider then(LlmResponse response) {
            responses.addLast(response);
            return this;
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> toolDefinitions) {
            calls.add(List.copyOf(messages));
            tools.add(toolDefinitions);
            LlmResponse next = responses.pollFirst();
            return next == null ? LlmResponse.text("") : next;
        }
    }

    private static final class UpperTool implements Tool {
        @Override
        public String name() {
            return "upper";
        }

        @Override
        public String description() {
            return "Upper-cases text";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return String.valueOf(input.get("text")).toUpperCase();
        }
    }
}
