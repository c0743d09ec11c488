package com.adkstream.app.web;

import com.adkstream.gateway.session.SessionStore;
import com.adkstream.gateway.transport.LiveWebSocketHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check with session and live connection counts.
 */
@RestController
public class HealthController {

    private final ObjectMapper mapper;
    private final SessionStore sessionStore;
    private final LiveWebSocketHandler liveHandler;

    public HealthController(ObjectMapper mapper, SessionStore sessionStore,
                            LiveWebSocketHandler liveHandler) {
        this.mapper = mapper;
        this.sessionStore = sessionStore;
        this.liveHandler = liveHandler;
    }

    @GetMapping("/api/health")
    public ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("sessions", sessionStore.size());
        node.put("liveConnections", liveHandler.getConnectionCount());
        return node;
    }
}
