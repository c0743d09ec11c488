package com.adkstream.gateway.transport;

import com.adkstream.common.config.ConfigService;
import com.adkstream.common.config.StreamConfig;
import com.adkstream.gateway.protocol.ChunkLogger;
import com.adkstream.gateway.protocol.SseFormatter;
import com.adkstream.gateway.protocol.StreamProtocolConverter;
import com.adkstream.gateway.runtime.AgentRuntime;
import com.adkstream.gateway.runtime.ToolResultSink;
import com.adkstream.gateway.runtime.TurnRequest;
import com.adkstream.gateway.session.CreateOrFetch;
import com.adkstream.gateway.session.HistoryMessage;
import com.adkstream.gateway.session.HistoryReplicator;
import com.adkstream.gateway.session.Session;
import com.adkstream.gateway.session.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bidirectional transport at {@code /live}.
 * <p>
 * Client frames are JSON objects with a {@code type}:
 * <ul>
 * <li>{@code message}: {messages:[...]}; replays history, applies approval
 * decisions and starts a turn when the last message is from the user</li>
 * <li>{@code tool_result}: {toolCallId, result}; resumes a frontend tool</li>
 * <li>{@code audio_chunk}: {data} base64 PCM forwarded to the runtime</li>
 * <li>{@code audio_control}, {@code interrupt}: logged</li>
 * <li>{@code ping}: answered with {@code pong}</li>
 * </ul>
 * Server frames are the same {@code data: <json>\n\n} records the SSE
 * transport writes.
 */
@Slf4j
public class LiveWebSocketHandler extends TextWebSocketHandler {

    public static final String ATTR_USER_ID = "live.userId";
    static final String DEFAULT_USER_ID = "anonymous";

    private static final TypeReference<List<HistoryMessage>> MESSAGE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ConfigService configService;
    private final SessionStore sessionStore;
    private final HistoryReplicator historyReplicator;
    private final TurnStreamer turnStreamer;
    private final AgentRuntime runtime;
    private final ToolResultSink toolResultSink;
    private final SseFormatter formatter;
    private final Map<String, BidiConnection> connections = new ConcurrentHashMap<>();

    public LiveWebSocketHandler(ObjectMapper objectMapper, ConfigService configService, SessionStore sessionStore,
            HistoryReplicator historyReplicator, TurnStreamer turnStreamer, AgentRuntime runtime,
            ToolResultSink toolResultSink) {
        this.objectMapper = objectMapper;
        this.configService = configService;
        this.sessionStore = sessionStore;
        this.historyReplicator = historyReplicator;
        this.turnStreamer = turnStreamer;
        this.runtime = runtime;
        this.toolResultSink = toolResultSink;
        this.formatter = new SseFormatter(objectMapper);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        String connId = socket.getId();
        Object userAttr = socket.getAttributes().get(ATTR_USER_ID);
        String userId = userAttr != null ? userAttr.toString() : DEFAULT_USER_ID;

        CreateOrFetch resolved = sessionStore.getOrCreate(userId, connId);
        StreamConfig config = configService.loadConfig();
        BidiConnection connection = new BidiConnection(socket, resolved.session(),
                StreamProtocolConverter.fromConfig(config), formatter);
        connections.put(connId, connection);

        log.info("live:open conn={} user={} session={} created={}",
                connId, userId, resolved.session().getSessionId(), resolved.created());
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        String connId = socket.getId();
        BidiConnection connection = connections.get(connId);
        if (connection == null) {
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("live:parse error conn={}: {}", connId, e.getMessage());
            return;
        }
        String type = node.path("type").asText("");

        switch (type) {
            case "message" -> handleMessage(connection, node);
            case "tool_result" -> handleToolResult(connection, node);
            case "audio_chunk" -> handleAudioChunk(connection, node);
            case "audio_control" -> log.info("live:audio_control conn={} action={}",
                    connId, node.path("action").asText(null));
            case "interrupt" -> log.info("live:interrupt conn={} reason={}",
                    connId, node.path("reason").asText(null));
            case "ping" -> handlePing(connection, node);
            default -> log.warn("live:unknown frame type '{}' conn={}", type, connId);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        BidiConnection connection = connections.remove(socket.getId());
        if (connection != null) {
            log.info("live:close conn={} session={} code={}",
                    socket.getId(), connection.getSession().getSessionId(), status.getCode());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        log.debug("live:transport error conn={}: {}", socket.getId(), exception.getMessage());
    }

    public int getConnectionCount() {
        return connections.size();
    }

    // =========================================================================
    // Frame handlers
    // =========================================================================

    private void handleMessage(BidiConnection connection, JsonNode node) {
        List<HistoryMessage> messages;
        try {
            JsonNode list = node.path("messages");
            messages = list.isArray() ? objectMapper.convertValue(list, MESSAGE_LIST) : List.of();
        } catch (IllegalArgumentException e) {
            log.warn("live:bad messages conn={}: {}", connection.getConnectionId(), e.getMessage());
            return;
        }
        if (messages.isEmpty()) {
            log.warn("live:message without messages conn={}", connection.getConnectionId());
            return;
        }

        Session session = connection.getSession();
        historyReplicator.replayHistory(session, messages);

        HistoryMessage last = messages.get(messages.size() - 1);
        String confirmationTool = configService.loadConfig().getConfirmationToolName();
        List<ApprovalResponse> responses = ClientMessages.approvalResponses(last, confirmationTool);
        for (ApprovalResponse response : responses) {
            String target = connection.approvalTarget(response);
            boolean delivered = session.getApprovals().resolve(target, response.toDecision());
            log.debug("live:approval conn={} request={} approved={} delivered={}",
                    connection.getConnectionId(), target, response.approved(), delivered);
        }

        if (last.isUser()) {
            TurnRequest request = new TurnRequest(session, last.text(), messages);
            connection.enqueueTurn(() ->
                    turnStreamer.stream(request, connection.getConverter(), connection, ChunkLogger.Mode.ADK_BIDI));
        } else if (responses.isEmpty()) {
            log.debug("live:message had nothing to run conn={} role={}", connection.getConnectionId(), last.role());
        }
    }

    private void handleToolResult(BidiConnection connection, JsonNode node) {
        String toolCallId = node.path("toolCallId").asText(null);
        if (toolCallId == null || toolCallId.isBlank()) {
            log.warn("live:tool_result without toolCallId conn={}", connection.getConnectionId());
            return;
        }
        JsonNode resultNode = node.get("result");
        Map<String, Object> result;
        if (resultNode != null && resultNode.isObject()) {
            result = objectMapper.convertValue(resultNode, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } else {
            result = new LinkedHashMap<>();
            result.put("result", resultNode != null ? objectMapper.convertValue(resultNode, Object.class) : null);
        }
        toolResultSink.resumeTool(toolCallId, result);
    }

    private void handleAudioChunk(BidiConnection connection, JsonNode node) {
        String data = node.path("data").asText(null);
        if (data == null) {
            log.warn("live:audio_chunk without data conn={}", connection.getConnectionId());
            return;
        }
        byte[] pcm;
        try {
            pcm = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            log.warn("live:audio_chunk is not base64 conn={}", connection.getConnectionId());
            return;
        }
        runtime.sendRealtime(connection.getSession(), "audio/pcm", pcm);
    }

    private void handlePing(BidiConnection connection, JsonNode node) {
        Map<String, Object> pong = new LinkedHashMap<>();
        pong.put("type", "pong");
        pong.put("timestamp", node.has("timestamp") ? node.get("timestamp").asLong() : System.currentTimeMillis());
        try {
            connection.sendRaw(objectMapper.writeValueAsString(pong));
        } catch (IOException e) {
            log.debug("live:pong failed conn={}: {}", connection.getConnectionId(), e.getMessage());
        }
    }
}
