package com.adkstream.app.web;

import com.adkstream.common.config.ConfigService;
import com.adkstream.gateway.protocol.ChunkLogger;
import com.adkstream.gateway.protocol.SseFormatter;
import com.adkstream.gateway.protocol.StreamProtocolConverter;
import com.adkstream.gateway.runtime.TurnRequest;
import com.adkstream.gateway.session.HistoryMessage;
import com.adkstream.gateway.session.HistoryReplicator;
import com.adkstream.gateway.session.Session;
import com.adkstream.gateway.session.SessionStore;
import com.adkstream.gateway.transport.TurnStreamer;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Request/response transport: one turn per request, streamed back as
 * server-sent events ending with {@code [DONE]}.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class StreamController {

    public static final String SESSION_HEADER = "X-Session-Id";
    static final long EMITTER_TIMEOUT_MS = 300_000L;

    private final SessionStore sessionStore;
    private final HistoryReplicator historyReplicator;
    private final TurnStreamer turnStreamer;
    private final ConfigService configService;
    private final SseFormatter sseFormatter;

    public StreamController(SessionStore sessionStore, HistoryReplicator historyReplicator,
            TurnStreamer turnStreamer, ConfigService configService, SseFormatter sseFormatter) {
        this.sessionStore = sessionStore;
        this.historyReplicator = historyReplicator;
        this.turnStreamer = turnStreamer;
        this.configService = configService;
        this.sseFormatter = sseFormatter;
    }

    @PostMapping(value = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Object stream(@RequestBody StreamRequest request, HttpServletResponse httpResponse) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("userId is required"));
        }
        List<HistoryMessage> messages = request.getMessages() != null ? request.getMessages() : List.of();
        if (messages.isEmpty() || !messages.get(messages.size() - 1).isUser()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("The last message must be a user message"));
        }

        Session session = sessionStore.getOrCreate(request.getUserId(), request.getSessionId()).session();
        historyReplicator.replayHistory(session, messages);
        HistoryMessage last = messages.get(messages.size() - 1);

        httpResponse.setHeader(SESSION_HEADER, session.getSessionId());
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        StreamProtocolConverter converter = StreamProtocolConverter.fromConfig(configService.loadConfig());

        log.debug("SSE turn for session {}", session.getSessionId());
        turnStreamer.stream(new TurnRequest(session, last.text(), messages), converter,
                        new SseEmitterChunkSink(emitter, sseFormatter), ChunkLogger.Mode.ADK_SSE)
                .whenComplete((ignored, err) -> emitter.complete());
        return emitter;
    }
}
