package io.vigil.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vigil.core.model.ChatMessage;
import io.vigil.core.model.MessageRole;
import io.vigil.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAI-compatible {@code POST /chat/completions} client. Requests are non-streaming; 429 and
 * 5xx answers and transport errors are retried with exponential backoff.
 */
public final class ChatCompletionsProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(ChatCompletionsProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;
    private final long initialRetryDelayMs;

    public ChatCompletionsProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3, 250);
    }

    public ChatCompletionsProvider(String name, String apiKey, String apiBase, int maxAttempts, long initialRetryDelayMs) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialRetryDelayMs = Math.max(0, initialRetryDelayMs);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name);
        }

        long delayMs = initialRetryDelayMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages, tools);
                try (Response response = client.newCall(request).execute()) {
                    ResponseBody body = response.body();
                    String text = body == null ? "" : body.string();
                    if (response.isSuccessful()) {
                        return parse(text);
                    }
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("Provider {} answered HTTP {}, retrying (attempt {}/{})", name, response.code(), attempt, maxAttempts);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 4000);
                        continue;
                    }
                    return LlmResponse.error("HTTP " + response.code() + " " + text);
                }
            } catch (IOException e) {
                if (attempt < maxAttempts) {
                    LOG.debug("Provider {} request failed, retrying (attempt {}/{})", name, attempt, maxAttempts, e);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 4000);
                    continue;
                }
                return LlmResponse.error(String.valueOf(e.getMessage()));
            }
        }
        return LlmResponse.error("exhausted retries");
    }

    private Request buildRequest(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", tools);
            payload.put("tool_choice", "auto");
        }

        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) throws IOException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.wireRole());
            row.put("content", message.content());
            if (message.requestsTools()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) throws IOException {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id() == null || call.id().isBlank() ? "call_" + i : call.id());
            item.put("type", "function");
            item.put("function", Map.of(
                "name", call.name(),
                "arguments", mapper.writeValueAsString(call.arguments())));
            wire.add(item);
        }
        return wire;
    }

    private LlmResponse parse(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode message = root.path("choices").path(0).path("message");
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode item : message.path("tool_calls")) {
            JsonNode function = item.path("function");
            JsonNode argsNode = function.path("arguments");
            Map<String, Object> args = argsNode.isTextual()
                ? parseArguments(argsNode.asText())
                : mapper.convertValue(argsNode, MAP_TYPE);
            String id = item.path("id").asText("");
            toolCalls.add(new ToolCall(id.isBlank() ? "call_" + toolCalls.size() : id, function.path("name").asText(""), args));
        }
        Map<String, Object> usage = root.path("usage").isObject() ? mapper.convertValue(root.path("usage"), MAP_TYPE) : Map.of();
        return new LlmResponse(message.path("content").asText(""), toolCalls, usage);
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            LOG.debug("Ignoring malformed tool arguments from provider {}", name, e);
            return Map.of();
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
