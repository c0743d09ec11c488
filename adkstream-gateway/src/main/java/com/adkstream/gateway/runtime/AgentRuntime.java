package com.adkstream.gateway.runtime;

import com.adkstream.gateway.protocol.RuntimeEvent;
import com.adkstream.gateway.session.Session;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The agent runtime that produces events for a turn. Model invocation and
 * tool execution live behind this interface.
 */
public interface AgentRuntime {

    /**
     * Run one turn. Events are delivered to {@code events} one at a time, in
     * order. The future completes when the runtime has nothing more to emit
     * for this turn, exceptionally if the event stream itself failed.
     */
    CompletableFuture<Void> runTurn(TurnRequest request, Consumer<RuntimeEvent> events);

    /**
     * Streamed realtime input such as microphone PCM audio.
     */
    default void sendRealtime(Session session, String mimeType, byte[] data) {
    }
}
