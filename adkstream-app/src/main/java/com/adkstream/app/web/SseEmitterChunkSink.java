package com.adkstream.app.web;

import com.adkstream.gateway.protocol.ProtocolChunk;
import com.adkstream.gateway.protocol.SseFormatter;
import com.adkstream.gateway.transport.ChunkSink;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes chunks to an {@link SseEmitter} as {@code data:} events.
 */
class SseEmitterChunkSink implements ChunkSink {

    static final String DONE_DATA = "[DONE]";

    private final SseEmitter emitter;
    private final SseFormatter formatter;

    SseEmitterChunkSink(SseEmitter emitter, SseFormatter formatter) {
        this.emitter = emitter;
        this.formatter = formatter;
    }

    @Override
    public void send(ProtocolChunk chunk) throws IOException {
        String data = chunk.isTerminator() ? DONE_DATA : formatter.toJson(chunk);
        emitter.send(SseEmitter.event().data(data));
    }
}
