package com.adkstream.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Frames chunks as server-sent events. The same framing is used on the
 * WebSocket transport.
 */
public class SseFormatter {

    public static final String DONE_FRAME = "data: [DONE]\n\n";

    private final ObjectMapper objectMapper;

    public SseFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(ProtocolChunk chunk) {
        if (chunk.isTerminator()) {
            return DONE_FRAME;
        }
        return "data: " + toJson(chunk) + "\n\n";
    }

    /**
     * JSON body without the SSE framing, for transports that frame it
     * themselves.
     */
    public String toJson(ProtocolChunk chunk) {
        if (chunk.isTerminator()) {
            return ProtocolChunk.DONE_TYPE;
        }
        try {
            return objectMapper.writeValueAsString(chunk.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Chunk is not serializable: " + chunk.type(), e);
        }
    }
}
