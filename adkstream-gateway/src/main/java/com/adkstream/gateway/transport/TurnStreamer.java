package com.adkstream.gateway.transport;

import com.adkstream.common.infra.ErrorUtils;
import com.adkstream.gateway.protocol.ChunkLogger;
import com.adkstream.gateway.protocol.ProtocolChunk;
import com.adkstream.gateway.protocol.RuntimeEvent;
import com.adkstream.gateway.protocol.StreamProtocolConverter;
import com.adkstream.gateway.runtime.AgentRuntime;
import com.adkstream.gateway.runtime.TurnRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one turn: runtime events go through the converter and the resulting
 * chunks go to the sink, in order.
 * <p>
 * When the runtime finishes, an Active turn is finalised; when it fails, the
 * turn ends with an error chunk. If the sink fails the client is gone: the
 * rest of the turn is still converted but no longer delivered.
 */
@Slf4j
public class TurnStreamer {

    private final AgentRuntime runtime;
    private final ChunkLogger chunkLogger;

    public TurnStreamer(AgentRuntime runtime, ChunkLogger chunkLogger) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.chunkLogger = chunkLogger != null ? chunkLogger : ChunkLogger.disabled();
    }

    /**
     * @return completes once the terminal marker has been handed to the sink
     */
    public CompletableFuture<Void> stream(TurnRequest request, StreamProtocolConverter converter,
            ChunkSink sink, ChunkLogger.Mode mode) {
        Delivery delivery = new Delivery(converter, sink, mode, request.session().getSessionId());

        CompletableFuture<Void> run;
        try {
            run = runtime.runTurn(request, delivery::onEvent);
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        return run.handle((ignored, err) -> {
            if (err != null) {
                delivery.onFailure(ErrorUtils.unwrap(err));
            } else {
                delivery.onComplete();
            }
            return null;
        });
    }

    private final class Delivery {
        private final StreamProtocolConverter converter;
        private final ChunkSink sink;
        private final ChunkLogger.Mode mode;
        private final String sessionId;
        private final AtomicBoolean sinkClosed = new AtomicBoolean(false);

        Delivery(StreamProtocolConverter converter, ChunkSink sink, ChunkLogger.Mode mode, String sessionId) {
            this.converter = converter;
            this.sink = sink;
            this.mode = mode;
            this.sessionId = sessionId;
        }

        void onEvent(RuntimeEvent event) {
            chunkLogger.logChunk(ChunkLogger.Location.BACKEND_ADK_EVENT, ChunkLogger.Direction.IN, event, mode);
            synchronized (converter) {
                deliver(converter.convert(event));
            }
        }

        void onComplete() {
            synchronized (converter) {
                deliver(converter.complete());
            }
        }

        void onFailure(Throwable error) {
            synchronized (converter) {
                deliver(converter.fail(error));
            }
        }

        private void deliver(List<ProtocolChunk> chunks) {
            for (ProtocolChunk chunk : chunks) {
                chunkLogger.logChunk(ChunkLogger.Location.BACKEND_SSE_EVENT, ChunkLogger.Direction.OUT,
                        chunk.toMap(), mode);
                if (sinkClosed.get()) {
                    continue;
                }
                try {
                    sink.send(chunk);
                } catch (IOException | IllegalStateException e) {
                    sinkClosed.set(true);
                    log.debug("Client for {} went away, dropping the rest of the turn: {}",
                            sessionId, e.getMessage());
                }
            }
        }
    }
}
