package com.adkstream.gateway.transport;

import com.adkstream.gateway.protocol.ProtocolChunk;
import com.adkstream.gateway.protocol.SseFormatter;
import com.adkstream.gateway.protocol.StreamProtocolConverter;
import com.adkstream.gateway.session.Session;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * State of one live connection: its session, its converter, the approval ids
 * it has announced, and the chain that keeps its turns in order.
 */
@Slf4j
public class BidiConnection implements ChunkSink {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT = 512 * 1024;

    @Getter
    private final String connectionId;
    @Getter
    private final Session session;
    @Getter
    private final StreamProtocolConverter converter;
    private final WebSocketSession socket;
    private final SseFormatter formatter;

    /** approvalId to the id of the call it gates */
    private final Map<String, String> approvalTargets = new ConcurrentHashMap<>();

    // guarded by this
    private CompletableFuture<Void> lastTurn = CompletableFuture.completedFuture(null);

    public BidiConnection(WebSocketSession socket, Session session, StreamProtocolConverter converter,
            SseFormatter formatter) {
        this.connectionId = socket.getId();
        this.socket = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        this.session = session;
        this.converter = converter;
        this.formatter = formatter;
    }

    @Override
    public void send(ProtocolChunk chunk) throws IOException {
        if ("tool-approval-request".equals(chunk.type())) {
            String approvalId = chunk.getString("approvalId");
            String toolCallId = chunk.getString("toolCallId");
            if (approvalId != null && toolCallId != null) {
                approvalTargets.put(approvalId, toolCallId);
            }
        }
        sendRaw(formatter.format(chunk));
    }

    public void sendRaw(String text) throws IOException {
        if (!socket.isOpen()) {
            throw new IOException("connection " + connectionId + " is closed");
        }
        try {
            socket.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException e) {
            throw new IOException("connection " + connectionId + " is not keeping up", e);
        }
    }

    /**
     * Id the registry knows the approval by. Falls back to the client's tool
     * call id, then to the approval id itself.
     */
    public String approvalTarget(ApprovalResponse response) {
        if (response.approvalId() != null) {
            String target = approvalTargets.remove(response.approvalId());
            if (target != null) {
                return target;
            }
        }
        return response.toolCallId() != null ? response.toolCallId() : response.approvalId();
    }

    /**
     * Run {@code turn} once every earlier turn on this connection has finished.
     */
    public synchronized CompletableFuture<Void> enqueueTurn(Supplier<CompletableFuture<Void>> turn) {
        lastTurn = lastTurn
                .exceptionally(err -> null)
                .thenCompose(ignored -> turn.get());
        return lastTurn;
    }

    public boolean isOpen() {
        return socket.isOpen();
    }
}
