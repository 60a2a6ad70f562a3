package io.vigil.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vigil.core.cron.CronEngine;
import io.vigil.core.cron.CronJob;
import io.vigil.core.cron.CronJobCreate;
import io.vigil.core.cron.CronJobNotFoundException;
import io.vigil.core.cron.CronJobPatch;
import io.vigil.core.cron.CronSchedule;
import io.vigil.core.delivery.Connector;
import io.vigil.core.delivery.ConnectorRegistry;
import io.vigil.core.engine.AskOptions;
import io.vigil.core.engine.ConversationEngine;
import io.vigil.core.engine.EngineResult;
import io.vigil.core.eventlog.EventLog;
import io.vigil.core.eventlog.EventLogEntry;
import io.vigil.core.eventlog.EventQuery;
import io.vigil.core.eventlog.Subscription;
import io.vigil.core.heartbeat.Heartbeat;
import io.vigil.core.session.SessionStore;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP and WebSocket surface over the event log, the scheduler, the heartbeat and chat.
 *
 * <p>WebSocket clients on {@code /ws} receive every appended event and, through the {@code web}
 * connector, the messages scheduled runs deliver.
 */
public final class GatewayServer implements AutoCloseable {
    public static final String WEB_CHANNEL = "web";
    public static final String MESSAGE_RECEIVED_EVENT = "message.received";
    public static final String MESSAGE_SENT_EVENT = "message.sent";

    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final String CRON_JOBS_PATH = "/api/cron/jobs";
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final EventLog eventLog;
    private final CronEngine cronEngine;
    private final Heartbeat heartbeat;
    private final ConversationEngine engine;
    private final SessionStore chatSession;
    private final ConnectorRegistry connectors;
    private final AtomicBoolean running;
    private final Map<String, WebSocketChannel> clients;
    private Undertow server;
    private Subscription eventSubscription;
    private int actualPort;

    public GatewayServer(
        String host,
        int port,
        EventLog eventLog,
        CronEngine cronEngine,
        Heartbeat heartbeat,
        ConversationEngine engine,
        SessionStore chatSession,
        ConnectorRegistry connectors
    ) {
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.heartbeat = heartbeat;
        this.engine = engine;
        this.chatSession = chatSession;
        this.connectors = Objects.requireNonNull(connectors, "connectors must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
        this.clients = new ConcurrentHashMap<>();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/api/events/recent", api(this::handleRecentEvents))
            .addExactPath("/api/events", api(this::handleEvents))
            .addPrefixPath(CRON_JOBS_PATH, api(this::handleCronJobs))
            .addExactPath("/api/heartbeat/status", api(this::handleHeartbeatStatus))
            .addExactPath("/api/heartbeat/trigger", api(this::handleHeartbeatTrigger))
            .addExactPath("/api/heartbeat/enabled", api(this::handleHeartbeatEnabled))
            .addExactPath("/api/chat", api(this::handleChat))
            .addExactPath("/ws", Handlers.websocket(this::onWebSocketConnect));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        actualPort = resolveBoundPort(server, requestedPort);

        eventSubscription = eventLog.subscribe(entry -> broadcast(Map.of("type", "event", "entry", entry)));
        connectors.register(new WebConnector());
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (eventSubscription != null) {
            eventSubscription.close();
            eventSubscription = null;
        }
        connectors.unregister(WEB_CHANNEL);
        if (server != null) {
            server.stop();
        }
        clients.values().forEach(channel -> {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.debug("Failed to close websocket channel", e);
            }
        });
        clients.clear();
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        if (origin == null || origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,PUT,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String hostName = uri.getHost();
            return "http".equalsIgnoreCase(uri.getScheme())
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "lastSeq", eventLog.lastSeq()));
    }

    private void handleRecentEvents(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        List<EventLogEntry> entries = eventLog.recent(eventQuery(exchange));
        sendJson(exchange, 200, Map.of("entries", entries, "lastSeq", eventLog.lastSeq()));
    }

    private void handleEvents(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        List<EventLogEntry> entries = eventLog.read(eventQuery(exchange));
        sendJson(exchange, 200, Map.of("entries", entries, "lastSeq", eventLog.lastSeq()));
    }

    private void handleCronJobs(HttpServerExchange exchange) throws Exception {
        String method = exchange.getRequestMethod().toString().toUpperCase(Locale.ROOT);
        String[] segments = exchange.getRelativePath().replaceAll("^/+|/+$", "").split("/");
        String id = segments[0];

        if (id.isEmpty()) {
            switch (method) {
                case "GET" -> sendJson(exchange, 200, Map.of("jobs", cronEngine.list()));
                case "POST" -> {
                    String newId = cronEngine.add(readCreate(readJsonBody(exchange)));
                    sendJson(exchange, 201, Map.of("id", newId, "job", cronEngine.get(newId).orElseThrow()));
                }
                default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
            return;
        }

        if (segments.length == 2 && "run".equals(segments[1])) {
            if (requireMethod(exchange, "POST")) {
                sendJson(exchange, 200, Map.of("job", cronEngine.runNow(id)));
            }
            return;
        }
        if (segments.length > 1) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }

        switch (method) {
            case "GET" -> {
                CronJob job = cronEngine.get(id).orElseThrow(() -> new CronJobNotFoundException(id));
                sendJson(exchange, 200, Map.of("job", job));
            }
            case "PUT" -> sendJson(exchange, 200, Map.of("job", cronEngine.update(id, readPatch(readJsonBody(exchange)))));
            case "DELETE" -> {
                cronEngine.remove(id);
                sendJson(exchange, 200, Map.of("removed", id));
            }
            default -> sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        }
    }

    private void handleHeartbeatStatus(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "GET") || !requireHeartbeat(exchange)) {
            return;
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", heartbeat.isEnabled());
        status.put("every", heartbeat.config().every());
        status.put("activeHours", heartbeat.config().activeHours());
        String jobId = heartbeat.jobId().orElse(null);
        status.put("jobId", jobId);
        if (jobId != null) {
            cronEngine.get(jobId).ifPresent(job -> status.put("state", job.state()));
        }
        sendJson(exchange, 200, status);
    }

    private void handleHeartbeatTrigger(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "POST") || !requireHeartbeat(exchange)) {
            return;
        }
        String jobId = heartbeat.jobId().orElse(null);
        if (jobId == null || cronEngine.get(jobId).isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "heartbeat_job_not_found"));
            return;
        }
        cronEngine.runNow(jobId);
        sendJson(exchange, 200, Map.of("triggered", true, "jobId", jobId));
    }

    private void handleHeartbeatEnabled(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "PUT") || !requireHeartbeat(exchange)) {
            return;
        }
        JsonNode enabled = readJsonBody(exchange).path("enabled");
        if (!enabled.isBoolean()) {
            throw new IllegalArgumentException("enabled must be a boolean");
        }
        heartbeat.setEnabled(enabled.asBoolean());
        sendJson(exchange, 200, Map.of("enabled", heartbeat.isEnabled()));
    }

    private void handleChat(HttpServerExchange exchange) throws Exception {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        if (engine == null || chatSession == null) {
            sendJson(exchange, 503, Map.of("error", "engine_not_configured"));
            return;
        }
        String message = readJsonBody(exchange).path("message").asText("").trim();
        if (message.isEmpty()) {
            throw new IllegalArgumentException("message is required");
        }

        connectors.touchInteraction(WEB_CHANNEL, "default");
        eventLog.append(MESSAGE_RECEIVED_EVENT, Map.of("channel", WEB_CHANNEL, "text", message));
        EngineResult result;
        try {
            result = engine.askWithSession(message, chatSession, AskOptions.none());
        } catch (IOException e) {
            LOG.warn("Chat request failed", e);
            sendJson(exchange, 502, Map.of("error", String.valueOf(e.getMessage())));
            return;
        }
        eventLog.append(MESSAGE_SENT_EVENT, Map.of("channel", WEB_CHANNEL, "text", result.text()));
        sendJson(exchange, 200, Map.of("text", result.text(), "media", result.media()));
    }

    private CronJobCreate readCreate(JsonNode body) throws JsonProcessingException {
        CronSchedule schedule = readSchedule(body);
        if (schedule == null) {
            throw new IllegalArgumentException("schedule is required");
        }
        return new CronJobCreate(
            body.path("name").asText(""),
            schedule,
            body.path("payload").asText(""),
            body.path("enabled").asBoolean(true)
        );
    }

    private CronJobPatch readPatch(JsonNode body) throws JsonProcessingException {
        return new CronJobPatch(
            body.hasNonNull("name") ? body.get("name").asText() : null,
            readSchedule(body),
            body.hasNonNull("payload") ? body.get("payload").asText() : null,
            body.hasNonNull("enabled") ? body.get("enabled").asBoolean() : null
        );
    }

    private CronSchedule readSchedule(JsonNode body) throws JsonProcessingException {
        JsonNode schedule = body.get("schedule");
        if (schedule == null || schedule.isNull()) {
            return null;
        }
        return mapper.treeToValue(schedule, CronSchedule.class);
    }

    private EventQuery eventQuery(HttpServerExchange exchange) {
        long afterSeq = parseQueryLong(exchange, "afterSeq", 0);
        long limit = Math.max(1L, Math.min(parseQueryLong(exchange, "limit", 100), 1000L));
        return new EventQuery(afterSeq, (int) limit, queryParam(exchange, "type"));
    }

    private void onWebSocketConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String clientId = UUID.randomUUID().toString();
        clients.put(clientId, channel);
        channel.getCloseSetter().set(closed -> clients.remove(clientId));
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel wsChannel, BufferedTextMessage message) {
                handleInboundWs(wsChannel, message.getData());
            }
        });
        channel.resumeReceives();
        LOG.debug("WebSocket client {} connected", clientId);
    }

    private void handleInboundWs(WebSocketChannel channel, String raw) {
        try {
            JsonNode message = mapper.readTree(raw);
            if ("ping".equals(message.path("type").asText())) {
                sendWs(channel, Map.of("type", "pong"));
            }
        } catch (JsonProcessingException e) {
            sendWs(channel, Map.of("type", "error", "error", "invalid_json"));
        }
    }

    private void broadcast(Map<String, ?> message) {
        for (WebSocketChannel channel : clients.values()) {
            sendWs(channel, message);
        }
    }

    private void sendWs(WebSocketChannel channel, Map<String, ?> message) {
        try {
            WebSockets.sendText(mapper.writeValueAsString(message), channel, null);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize websocket message", e);
        }
    }

    private HttpHandler api(ApiHandler handler) {
        return new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) {
                if (exchange.isInIoThread()) {
                    exchange.dispatch(this);
                    return;
                }
                try {
                    handler.handle(exchange);
                } catch (CronJobNotFoundException e) {
                    sendError(exchange, 404, e.getMessage());
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "invalid_json: " + e.getOriginalMessage());
                } catch (IllegalArgumentException e) {
                    sendError(exchange, 400, e.getMessage());
                } catch (Exception e) {
                    LOG.warn("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
                    sendError(exchange, 500, e.getMessage() == null ? "internal_error" : e.getMessage());
                }
            }
        };
    }

    private boolean requireMethod(HttpServerExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            return true;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        return false;
    }

    private boolean requireHeartbeat(HttpServerExchange exchange) throws IOException {
        if (heartbeat != null) {
            return true;
        }
        sendJson(exchange, 503, Map.of("error", "heartbeat_not_configured"));
        return false;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendError(HttpServerExchange exchange, int status, String error) {
        try {
            sendJson(exchange, status, Map.of("error", error == null ? "error" : error));
        } catch (IOException e) {
            LOG.debug("Failed to send error response", e);
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private long parseQueryLong(HttpServerExchange exchange, String key, long fallback) {
        String raw = queryParam(exchange, key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number");
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        String value = values == null || values.isEmpty() ? null : values.peekFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ApiHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    /**
     * Pushes delivered messages to every connected browser as {@code notification} frames.
     */
    private final class WebConnector implements Connector {
        @Override
        public String channel() {
            return WEB_CHANNEL;
        }

        @Override
        public void send(String to, String text) throws IOException {
            if (clients.isEmpty()) {
                throw new IOException("no web clients connected");
            }
            broadcast(Map.of("type", "notification", "content", text));
        }
    }
}
