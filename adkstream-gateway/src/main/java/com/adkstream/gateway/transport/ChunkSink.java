package com.adkstream.gateway.transport;

import com.adkstream.gateway.protocol.ProtocolChunk;

import java.io.IOException;

/**
 * Byte-level destination for one turn's chunks.
 */
@FunctionalInterface
public interface ChunkSink {

    void send(ProtocolChunk chunk) throws IOException;
}
