package com.adkstream.gateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChunkLoggerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void logChunk_enabled_writesJsonLinesPerLocation() throws Exception {
        Path file;
        try (ChunkLogger logger = new ChunkLogger(true, tempDir, "run-1", mapper)) {
            logger.logChunk(ChunkLogger.Location.BACKEND_SSE_EVENT, ChunkLogger.Direction.OUT,
                    Map.of("type", "start"), ChunkLogger.Mode.ADK_SSE);
            logger.logChunk(ChunkLogger.Location.BACKEND_SSE_EVENT, ChunkLogger.Direction.OUT,
                    Map.of("type", "finish"), ChunkLogger.Mode.ADK_SSE, Map.of("note", "x"));
            file = logger.getSessionDir().resolve("backend-sse-event.jsonl");
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("run-1", first.get("session_id").asText());
        assertEquals("adk-sse", first.get("mode").asText());
        assertEquals("out", first.get("direction").asText());
        assertEquals(1, first.get("sequence_number").asLong());
        assertEquals("start", first.get("chunk").get("type").asText());
        JsonNode second = mapper.readTree(lines.get(1));
        assertEquals(2, second.get("sequence_number").asLong());
        assertEquals("x", second.get("metadata").get("note").asText());
    }

    @Test
    void logChunk_disabled_writesNothing() throws Exception {
        try (ChunkLogger logger = new ChunkLogger(false, tempDir, "run-2", mapper)) {
            logger.logChunk(ChunkLogger.Location.BACKEND_ADK_EVENT, ChunkLogger.Direction.IN,
                    Map.of("type", "start"), ChunkLogger.Mode.ADK_BIDI);
        }

        assertFalse(Files.exists(tempDir.resolve("run-2")));
    }

    @Test
    void blankSessionId_getsTimestampedName() {
        ChunkLogger logger = new ChunkLogger(false, tempDir, " ", mapper);

        assertTrue(logger.getSessionId().startsWith("session-"));
    }
}
